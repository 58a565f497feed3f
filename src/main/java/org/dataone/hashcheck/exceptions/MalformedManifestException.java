package org.dataone.hashcheck.exceptions;

import java.io.IOException;

/**
 * An exception thrown when a manifest cannot be used at all, for example when none of its lines
 * decode to a path and digest pair. Single bad lines are reported as warnings instead.
 */
public class MalformedManifestException extends IOException {

    private final int lineNumber;
    private final String line;

    public MalformedManifestException(String message, int lineNumber, String line) {
        super(message);
        this.lineNumber = lineNumber;
        this.line = line;
    }

    /**
     * @return 1-based number of the first offending line, or 0 when not tied to a line
     */
    public int getLineNumber() {
        return lineNumber;
    }

    public String getLine() {
        return line;
    }
}
