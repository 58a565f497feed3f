package org.dataone.hashcheck.task;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

/**
 * Runs the per-file work items of one task on a bounded pool of worker threads.
 */
class WorkerPool {
    private static final Log logWorkerPool = LogFactory.getLog(WorkerPool.class);

    /**
     * Run every work item and return their results in submission order. Items that have not
     * started when the token is cancelled are skipped and yield null; items already running are
     * allowed to finish.
     *
     * @param work          Work items, each independent of the others
     * @param workerThreads Maximum number of concurrent items
     * @param token         Cancellation flag
     * @param <T>           Result type
     * @return Results in the order of {@code work}, null for skipped items
     * @throws InterruptedException The calling thread was interrupted; the token is cancelled
     */
    static <T> List<T> runAll(
        List<Callable<T>> work, int workerThreads, CancellationToken token)
        throws InterruptedException {
        List<T> results = new ArrayList<>(work.size());
        if (work.isEmpty()) {
            return results;
        }
        int poolSize = Math.max(1, Math.min(workerThreads, work.size()));
        ExecutorService executorService =
            Executors.newFixedThreadPool(poolSize, namedThreadFactory("hashcheck-worker"));
        try {
            List<Future<T>> futures = new ArrayList<>(work.size());
            for (Callable<T> item : work) {
                futures.add(executorService.submit(() -> {
                    if (token.isCancelled()) {
                        return null;
                    }
                    return item.call();
                }));
            }
            for (Future<T> future : futures) {
                try {
                    results.add(future.get());
                } catch (ExecutionException ee) {
                    // Work items report their own errors, anything thrown here is a bug
                    Throwable cause = ee.getCause();
                    logWorkerPool.error("Unexpected error in worker: " + cause);
                    if (cause instanceof RuntimeException) {
                        throw (RuntimeException) cause;
                    }
                    throw new IllegalStateException(cause);
                }
            }

        } catch (InterruptedException ie) {
            token.cancel();
            throw ie;

        } finally {
            executorService.shutdownNow();
        }
        return results;
    }

    /**
     * @param prefix Thread name prefix
     * @return Factory creating named daemon threads
     */
    static ThreadFactory namedThreadFactory(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
