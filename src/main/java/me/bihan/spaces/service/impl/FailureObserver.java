package me.bihan.spaces.service.impl;

import lombok.extern.log4j.Log4j2;
import me.bihan.spaces.service.DownloadTask;
import me.bihan.spaces.service.TaskListener;
import me.bihan.spaces.service.TaskState;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * Fires once per task when it reaches {@link TaskState#FAILED}.
 */
@Log4j2
public class FailureObserver implements TaskListener {

    private final Consumer<DownloadTask> callback;
    private final Set<String> failedTaskIds = ConcurrentHashMap.newKeySet();

    public FailureObserver(Consumer<DownloadTask> callback) {
        this.callback = callback;
    }

    @Override
    public void update(DownloadTask task) {
        if (task.getState() != TaskState.FAILED || !failedTaskIds.add(task.getId())) {
            return;
        }

        log.debug("Routing failed task {}", task.getId());
        callback.accept(task);
    }
}
