package me.bihan.spaces.service;

import lombok.extern.log4j.Log4j2;
import me.bihan.spaces.config.DownloadSettings;
import me.bihan.spaces.contract.Contract;
import me.bihan.spaces.service.impl.CompletionObserver;
import me.bihan.spaces.service.impl.FailureObserver;
import me.bihan.spaces.service.impl.ProgressObserver;
import me.bihan.spaces.storage.StorageClientFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Top-level orchestrator for downloads.
 *
 * <p>Tasks move pending → ready → complete (or failed). Each move happens in exactly
 * one place: {@link #promote} for pending → ready, a connection's poll for claiming,
 * and the completion and failure observers for the terminal queues.
 *
 * <p>Submissions made before {@link #start()} wait in the pending queue. Once started,
 * every {@link #submit} drains the pending queue itself, so late submissions are
 * promoted immediately and never lost.
 */
@Log4j2
public class DownloadManager {

    private final BlockingQueue<DownloadTask> pendingQueue = new LinkedBlockingQueue<>();
    private final BlockingQueue<DownloadTask> readyQueue = new LinkedBlockingQueue<>();
    private final BlockingQueue<DownloadTask> completeQueue = new LinkedBlockingQueue<>();
    private final BlockingQueue<DownloadTask> failedQueue = new LinkedBlockingQueue<>();
    private final ConcurrentMap<String, String> progressMap = new ConcurrentHashMap<>();

    private final ConnectionPool connectionPool;
    private final ProgressTracker progressTracker;

    private final CompletionObserver completionObserver;
    private final ProgressObserver progressObserver;
    private final FailureObserver failureObserver;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);
    private volatile boolean shutdownComplete = false;
    private final AtomicInteger submittedCount = new AtomicInteger(0);

    // Guards settledCount; waited on by awaitCompletion
    private final Object settleMonitor = new Object();
    private int settledCount = 0;

    public DownloadManager(StorageClientFactory clientFactory, DownloadSettings settings) {
        this.connectionPool = new ConnectionPool(
                readyQueue,
                clientFactory,
                settings.getWorkers(),
                settings.getPollTimeout(),
                settings.getShutdownTimeout()
        );
        this.progressTracker = new ProgressTracker(
                progressMap,
                settings.getProgressInterval(),
                settings.getOutput(),
                settings.isClearScreen()
        );

        this.completionObserver = new CompletionObserver(this::moveToComplete);
        this.progressObserver = new ProgressObserver(progressMap);
        this.failureObserver = new FailureObserver(this::moveToFailed);
    }

    /**
     * Wraps a contract in a task and queues it.
     *
     * @return the task created for the contract
     * @throws IllegalStateException if the manager has been stopped
     */
    public DownloadTask submit(Contract contract) {
        if (stopped.get()) {
            throw new IllegalStateException("Download manager is stopped, cannot accept " + contract.getKey());
        }

        DownloadTask task = new DownloadTask(contract);
        submittedCount.incrementAndGet();
        pendingQueue.add(task);
        log.debug("Submitted task {} for {}/{}", task.getId(), contract.getBucket(), contract.getKey());

        if (started.get()) {
            drainPending();
        }
        return task;
    }

    /**
     * Promotes every pending task, then starts the progress tracker and the connection pool.
     *
     * @throws IllegalStateException if called more than once
     */
    public void start() {
        if (stopped.get() || !started.compareAndSet(false, true)) {
            throw new IllegalStateException("Download manager already started");
        }

        drainPending();
        log.info("Starting {} download(s) on {} connection(s)", readyQueue.size(), connectionPool.getSize());

        progressTracker.start();
        connectionPool.start();
    }

    /**
     * Best-effort shutdown: stops the connection pool (in-flight transfers may finish
     * within the shutdown timeout), then the progress tracker. A failure in one stage
     * does not prevent the other.
     */
    public void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        log.info("Stopping download manager");

        try {
            if (!connectionPool.stop()) {
                log.warn("Some transfers were still running when the connection pool stopped");
            }
        } catch (RuntimeException e) {
            log.error("Failed to stop connection pool: {}", e.getMessage(), e);
        }

        try {
            progressTracker.stop();
        } catch (RuntimeException e) {
            log.error("Failed to stop progress tracker: {}", e.getMessage(), e);
        }

        synchronized (settleMonitor) {
            shutdownComplete = true;
            settleMonitor.notifyAll();
        }
        log.info("Download manager stopped: {} complete, {} failed, {} never started",
                completeQueue.size(), failedQueue.size(), pendingQueue.size() + readyQueue.size());
    }

    /**
     * Blocks until every submitted task is complete or failed, or until {@link #stop()} has finished.
     *
     * @return true if all submitted tasks settled
     */
    public boolean awaitCompletion() throws InterruptedException {
        synchronized (settleMonitor) {
            while (!allSettled() && !shutdownComplete) {
                settleMonitor.wait();
            }
            return allSettled();
        }
    }

    /**
     * Like {@link #awaitCompletion()} but gives up after the timeout.
     */
    public boolean awaitCompletion(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        synchronized (settleMonitor) {
            while (!allSettled() && !shutdownComplete) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    return false;
                }
                TimeUnit.NANOSECONDS.timedWait(settleMonitor, remaining);
            }
            return allSettled();
        }
    }

    private void drainPending() {
        DownloadTask task;
        while ((task = pendingQueue.poll()) != null) {
            promote(task);
        }
    }

    private void promote(DownloadTask task) {
        // Progress first, so the map is current when a completion is routed
        task.attach(progressObserver);
        task.attach(completionObserver);
        task.attach(failureObserver);
        task.markReady();
        progressObserver.update(task);
        readyQueue.add(task);
    }

    private void moveToComplete(DownloadTask task) {
        completeQueue.add(task);
        settle();
    }

    private void moveToFailed(DownloadTask task) {
        failedQueue.add(task);
        settle();
    }

    private void settle() {
        synchronized (settleMonitor) {
            settledCount++;
            settleMonitor.notifyAll();
        }
    }

    private boolean allSettled() {
        return settledCount >= submittedCount.get();
    }

    public int getSubmittedCount() {
        return submittedCount.get();
    }

    public int getPendingCount() {
        return pendingQueue.size();
    }

    public int getReadyCount() {
        return readyQueue.size();
    }

    /**
     * Number of connections transferring right now.
     */
    public int getActiveCount() {
        return connectionPool.getBusyCount();
    }

    public List<DownloadTask> getCompletedTasks() {
        return new ArrayList<>(completeQueue);
    }

    public List<DownloadTask> getFailedTasks() {
        return new ArrayList<>(failedQueue);
    }

    /**
     * Copy of the current status line per task id.
     */
    public Map<String, String> getProgressSnapshot() {
        return Map.copyOf(progressMap);
    }

    public boolean isStarted() {
        return started.get();
    }

    public boolean isStopped() {
        return stopped.get();
    }
}
