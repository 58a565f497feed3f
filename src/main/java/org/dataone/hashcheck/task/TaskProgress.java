package org.dataone.hashcheck.task;

import java.nio.file.Path;

/**
 * Snapshot of a running task's progress.
 *
 * @param processed   Items finished so far, never decreases within a task
 * @param total       Items known so far; grows when a task adds a stage (ex. verify after
 *                    generation)
 * @param currentPath Item that was just finished, may be null
 * @param phase       Stage the task is in
 */
public record TaskProgress(int processed, int total, Path currentPath, TaskPhase phase) {

    public static TaskProgress initial() {
        return new TaskProgress(0, 0, null, TaskPhase.SUBMISSION);
    }
}
