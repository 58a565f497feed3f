package org.dataone.hashcheck.task;

import org.dataone.hashcheck.exceptions.HashCheckTaskException;
import org.dataone.hashcheck.exceptions.TaskCancelledException;
import org.dataone.hashcheck.exceptions.UnsupportedHashAlgorithmException;

/**
 * A unit of work the {@link TaskRunner} can execute: generation, verification or comparison.
 *
 * @param <T> Result type
 */
public interface HashCheckTask<T> {

    /**
     * Check the task's parameters before it is scheduled.
     *
     * @throws UnsupportedHashAlgorithmException An algorithm the task needs is not registered
     * @throws IllegalArgumentException          Other invalid parameters
     */
    void validate() throws UnsupportedHashAlgorithmException, IllegalArgumentException;

    /**
     * Execute the task on the calling thread. Per-file work is fanned out to a worker pool.
     *
     * @param token   Cancellation flag checked between files
     * @param tracker Progress of this task
     * @return Task result
     * @throws HashCheckTaskException The task failed as a whole
     * @throws TaskCancelledException The token was cancelled before the task completed
     */
    T run(CancellationToken token, ProgressTracker tracker)
        throws HashCheckTaskException, TaskCancelledException;
}
