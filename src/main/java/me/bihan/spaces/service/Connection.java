package me.bihan.spaces.service;

import lombok.Getter;
import lombok.extern.log4j.Log4j2;
import me.bihan.spaces.storage.StorageClient;

import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

/**
 * Worker bound to one storage handle. Pulls tasks from the ready queue and runs
 * each one to completion before taking the next, so one connection means at most
 * one concurrent transfer.
 */
@Log4j2
public class Connection implements Callable<Void> {

    @Getter
    private final int connectionId;
    private final StorageClient client;
    private final BlockingQueue<DownloadTask> readyQueue;
    private final BooleanSupplier poolRunning;
    private final long pollTimeoutMillis;

    @Getter
    private volatile DownloadTask currentTask;
    @Getter
    private volatile int tasksExecuted = 0;

    public Connection(int connectionId, StorageClient client, BlockingQueue<DownloadTask> readyQueue,
                      BooleanSupplier poolRunning, Duration pollTimeout) {
        this.connectionId = connectionId;
        this.client = client;
        this.readyQueue = readyQueue;
        this.poolRunning = poolRunning;
        this.pollTimeoutMillis = pollTimeout.toMillis();
    }

    @Override
    public Void call() {
        log.debug("Connection {} started", connectionId);

        try {
            // Exits only once the pool stops; an empty queue while running just means waiting
            while (poolRunning.getAsBoolean()) {
                DownloadTask task = readyQueue.poll(pollTimeoutMillis, TimeUnit.MILLISECONDS);
                if (task != null) {
                    execute(task);
                }
            }
        } catch (InterruptedException e) {
            log.info("Connection {} interrupted", connectionId);
            Thread.currentThread().interrupt();
        }

        log.debug("Connection {} finished after {} task(s)", connectionId, tasksExecuted);
        return null;
    }

    private void execute(DownloadTask task) {
        currentTask = task;
        log.debug("Connection {} claimed task {}", connectionId, task.getId());
        try {
            task.start(client);
        } catch (RuntimeException e) {
            log.error("Connection {} caught unexpected error from task {}: {}",
                    connectionId, task.getId(), e.getMessage(), e);
        } finally {
            tasksExecuted++;
            currentTask = null;
        }
    }

    /**
     * True while a task is being transferred on this connection.
     */
    public boolean isBusy() {
        return currentTask != null;
    }

    void closeClient() {
        try {
            client.close();
        } catch (RuntimeException e) {
            log.warn("Connection {} failed to close its storage client: {}", connectionId, e.getMessage());
        }
    }
}
