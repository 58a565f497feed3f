package org.dataone.hashcheck.manifest;

/**
 * A manifest line that could not be decoded into a path and digest.
 *
 * @param lineNumber 1-based line number in the manifest text
 * @param line       The line as read
 * @param reason     Why the line was rejected
 */
public record MalformedEntry(int lineNumber, String line, String reason) {

    @Override
    public String toString() {
        return "Line " + lineNumber + ": " + reason + " (" + line + ")";
    }
}
