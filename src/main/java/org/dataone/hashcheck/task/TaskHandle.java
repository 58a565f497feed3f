package org.dataone.hashcheck.task;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import org.dataone.hashcheck.exceptions.HashCheckTaskException;
import org.dataone.hashcheck.exceptions.TaskCancelledException;

/**
 * Handle to a submitted task. The task resolves to exactly one of: its result, a
 * {@link HashCheckTaskException}, or a {@link TaskCancelledException}.
 *
 * @param <T> Result type
 */
public class TaskHandle<T> {
    private final CompletableFuture<T> future;
    private final CancellationToken token;
    private final ProgressTracker tracker;

    TaskHandle(CompletableFuture<T> future, CancellationToken token, ProgressTracker tracker) {
        this.future = future;
        this.token = token;
        this.tracker = tracker;
    }

    /**
     * Ask the task to stop. Files already being read are finished; no new file is started.
     */
    public void cancel() {
        token.cancel();
    }

    public boolean isCancelled() {
        return token.isCancelled();
    }

    public boolean isDone() {
        return future.isDone();
    }

    public TaskProgress latestProgress() {
        return tracker.getLatest();
    }

    /**
     * Wait for the task to finish.
     *
     * @return The task result
     * @throws HashCheckTaskException The task failed as a whole
     * @throws TaskCancelledException The task was cancelled before it finished
     * @throws InterruptedException   The waiting thread was interrupted
     */
    public T await() throws HashCheckTaskException, TaskCancelledException,
        InterruptedException {
        try {
            return future.get();

        } catch (ExecutionException ee) {
            Throwable cause = ee.getCause();
            if (cause instanceof HashCheckTaskException) {
                throw (HashCheckTaskException) cause;
            }
            if (cause instanceof TaskCancelledException) {
                throw (TaskCancelledException) cause;
            }
            throw new HashCheckTaskException(
                "Task failed unexpectedly: " + cause, tracker.getPhase(), null, cause);
        }
    }

    /**
     * @return Future completed with the result, or exceptionally with the task's exception
     */
    public CompletableFuture<T> future() {
        return future;
    }
}
