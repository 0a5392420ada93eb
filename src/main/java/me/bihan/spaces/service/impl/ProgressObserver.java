package me.bihan.spaces.service.impl;

import me.bihan.spaces.service.DownloadTask;
import me.bihan.spaces.service.TaskListener;
import me.bihan.spaces.service.TaskProgress;
import me.bihan.spaces.service.TaskState;

import java.time.Clock;
import java.util.concurrent.ConcurrentMap;

/**
 * Writes a rendered status line for every update into the shared progress map.
 * The map is keyed by task id; last write wins.
 */
public class ProgressObserver implements TaskListener {

    private final ConcurrentMap<String, String> progressMap;
    private final Clock clock;

    public ProgressObserver(ConcurrentMap<String, String> progressMap) {
        this(progressMap, Clock.systemUTC());
    }

    public ProgressObserver(ConcurrentMap<String, String> progressMap, Clock clock) {
        this.progressMap = progressMap;
        this.clock = clock;
    }

    @Override
    public void update(DownloadTask task) {
        TaskProgress progress = TaskProgress.of(task, clock.instant());
        String status = progress.toStatusLine();

        if (progress.getState() == TaskState.FAILED && task.getFailure() != null) {
            status = status + "  error: " + task.getFailure().getMessage();
        }
        progressMap.put(task.getId(), status);
    }
}
