package org.dataone.hashcheck.exceptions;

/**
 * Thrown when a task was stopped at the caller's request. Carries how far the task got; no
 * partial result object is produced.
 */
public class TaskCancelledException extends Exception {

    private final int processed;
    private final int total;

    public TaskCancelledException(String message, int processed, int total) {
        super(message);
        this.processed = processed;
        this.total = total;
    }

    public int getProcessed() {
        return processed;
    }

    public int getTotal() {
        return total;
    }
}
