package me.bihan.spaces.service.impl;

import lombok.extern.log4j.Log4j2;
import me.bihan.spaces.service.DownloadTask;
import me.bihan.spaces.service.TaskListener;
import me.bihan.spaces.service.TaskState;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * Fires once per task, once its transfer has returned with every byte of the known size received.
 * A task whose last chunk has arrived is still RUNNING until the client has finished writing the
 * file, so byte equality alone is not enough. Later notifications for the same task are ignored.
 */
@Log4j2
public class CompletionObserver implements TaskListener {

    private final Consumer<DownloadTask> callback;
    private final Set<String> completedTaskIds = ConcurrentHashMap.newKeySet();

    public CompletionObserver() {
        this(null);
    }

    public CompletionObserver(Consumer<DownloadTask> callback) {
        this.callback = callback;
    }

    @Override
    public void update(DownloadTask task) {
        if (task.getState() != TaskState.COMPLETED || !task.isTransferComplete()) {
            return;
        }
        if (!completedTaskIds.add(task.getId())) {
            return;
        }

        log.info("Download {} complete.", task.getId());
        if (callback != null) {
            callback.accept(task);
        }
    }
}
