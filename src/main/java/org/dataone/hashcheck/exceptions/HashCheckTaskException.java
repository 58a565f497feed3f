package org.dataone.hashcheck.exceptions;

import java.nio.file.Path;

import org.dataone.hashcheck.task.TaskPhase;

/**
 * A task-level failure. The task produced no result; the phase and path (when known) describe
 * where it stopped, the cause holds the underlying error (ex. IOException,
 * MalformedManifestException, UnsupportedHashAlgorithmException).
 */
public class HashCheckTaskException extends Exception {

    private final TaskPhase phase;
    private final Path path;

    public HashCheckTaskException(String message, TaskPhase phase, Path path, Throwable cause) {
        super(message, cause);
        this.phase = phase;
        this.path = path;
    }

    public TaskPhase getPhase() {
        return phase;
    }

    /**
     * @return Path being processed when the task failed, may be null
     */
    public Path getPath() {
        return path;
    }
}
