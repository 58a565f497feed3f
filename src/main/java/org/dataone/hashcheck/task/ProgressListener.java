package org.dataone.hashcheck.task;

/**
 * Receives progress events of a task. Calls are serialized; the listener is never invoked by two
 * workers at once. Exceptions thrown by a listener are logged and ignored.
 */
@FunctionalInterface
public interface ProgressListener {

    ProgressListener NONE = progress -> {
    };

    void onProgress(TaskProgress progress);
}
