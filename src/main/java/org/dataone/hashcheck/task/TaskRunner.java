package org.dataone.hashcheck.task;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.dataone.hashcheck.HashCheckUtility;
import org.dataone.hashcheck.exceptions.HashCheckTaskException;
import org.dataone.hashcheck.exceptions.TaskCancelledException;
import org.dataone.hashcheck.exceptions.UnsupportedHashAlgorithmException;

/**
 * TaskRunner executes tasks off the caller's thread. Each task gets its own cancellation token
 * and progress tracker, and fans its per-file work out to its own worker pool.
 */
public class TaskRunner implements AutoCloseable {
    private static final Log logTaskRunner = LogFactory.getLog(TaskRunner.class);

    private final ExecutorService coordinator =
        Executors.newCachedThreadPool(WorkerPool.namedThreadFactory("hashcheck-task"));

    /**
     * Validate and schedule a task.
     *
     * @param task     Task to run
     * @param listener Receives progress events, may be null
     * @param <T>      Result type
     * @return Handle to the running task
     * @throws UnsupportedHashAlgorithmException The task needs an algorithm that is not
     *                                           registered; nothing was scheduled
     * @throws IllegalArgumentException          Other invalid task parameters
     */
    public <T> TaskHandle<T> submit(HashCheckTask<T> task, ProgressListener listener)
        throws UnsupportedHashAlgorithmException, IllegalArgumentException {
        HashCheckUtility.ensureNotNull(task, "task", "submit");
        task.validate();

        CancellationToken token = new CancellationToken();
        ProgressTracker tracker = new ProgressTracker(listener);
        CompletableFuture<T> future = new CompletableFuture<>();
        String taskName = task.getClass().getSimpleName();

        coordinator.execute(() -> {
            try {
                future.complete(task.run(token, tracker));

            } catch (HashCheckTaskException | TaskCancelledException expected) {
                future.completeExceptionally(expected);

            } catch (RuntimeException | Error unexpected) {
                logTaskRunner.error(
                    "Unexpected failure in " + taskName + ": " + unexpected.getMessage(),
                    unexpected);
                future.completeExceptionally(unexpected);
            }
        });
        logTaskRunner.debug("Submitted: " + taskName);
        return new TaskHandle<>(future, token, tracker);
    }

    /**
     * Stop accepting tasks. Running tasks are interrupted, which cancels them.
     */
    @Override
    public void close() {
        coordinator.shutdownNow();
    }
}
