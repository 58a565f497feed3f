package org.dataone.hashcheck;

import java.nio.file.Path;

import org.dataone.hashcheck.task.TaskPhase;

/**
 * A failure confined to one file. It is attached to that file's result and never aborts the
 * rest of the batch.
 *
 * @param path    File that failed
 * @param phase   Stage the failure happened in
 * @param message Human readable description
 * @param cause   Underlying exception, may be null
 */
public record EntryError(Path path, TaskPhase phase, String message, Exception cause) {

    public static EntryError of(Path path, TaskPhase phase, Exception cause) {
        String message = cause.getMessage() == null ? cause.getClass().getSimpleName()
            : cause.getClass().getSimpleName() + ": " + cause.getMessage();
        return new EntryError(path, phase, message, cause);
    }

    @Override
    public String toString() {
        return path + " (" + phase + "): " + message;
    }
}
