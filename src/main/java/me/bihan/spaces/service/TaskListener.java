package me.bihan.spaces.service;

/**
 * Observer interface for task state changes.
 * Called synchronously on the thread executing the task.
 */
@FunctionalInterface
public interface TaskListener {

    /**
     * Called whenever the observed task changes state or transfers bytes.
     */
    void update(DownloadTask task);
}
