package org.dataone.hashcheck.task;

import java.nio.file.Path;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

/**
 * ProgressTracker is the only state shared by the workers of a task: the processed/total counts
 * and the current phase. Updates and listener notifications happen under the tracker's lock, so
 * the listener sees counts in increasing order.
 */
public class ProgressTracker {
    private static final Log logTracker = LogFactory.getLog(ProgressTracker.class);

    private final ProgressListener listener;
    private int processed;
    private int total;
    private volatile TaskPhase phase = TaskPhase.SUBMISSION;
    private volatile TaskProgress latest = TaskProgress.initial();

    public ProgressTracker(ProgressListener listener) {
        this.listener = listener == null ? ProgressListener.NONE : listener;
    }

    /**
     * Enter a new phase, adding the number of items it will process to the total.
     *
     * @param newPhase  Phase being entered
     * @param moreItems Items the phase will process
     */
    public synchronized void beginPhase(TaskPhase newPhase, int moreItems) {
        phase = newPhase;
        total += moreItems;
        publish(null);
    }

    /**
     * Record one finished item.
     *
     * @param currentPath Item just finished
     */
    public synchronized void advance(Path currentPath) {
        processed++;
        publish(currentPath);
    }

    public synchronized int getProcessed() {
        return processed;
    }

    public synchronized int getTotal() {
        return total;
    }

    public TaskPhase getPhase() {
        return phase;
    }

    public TaskProgress getLatest() {
        return latest;
    }

    private void publish(Path currentPath) {
        TaskProgress progress = new TaskProgress(processed, total, currentPath, phase);
        latest = progress;
        try {
            listener.onProgress(progress);
        } catch (RuntimeException re) {
            logTracker.warn("Progress listener failed: " + re.getMessage());
        }
    }
}
