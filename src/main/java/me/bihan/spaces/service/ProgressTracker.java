package me.bihan.spaces.service;

import lombok.extern.log4j.Log4j2;

import java.io.PrintStream;
import java.time.Duration;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Periodically renders the shared progress map to an output sink.
 * Runs on its own thread and only reads the map, so no locking beyond the map's own is needed.
 */
@Log4j2
public class ProgressTracker {

    private static final String CLEAR_SCREEN = "\033[H\033[2J";

    private final Map<String, String> progressMap;
    private final Duration renderInterval;
    private final PrintStream out;
    private final boolean clearScreen;

    private final AtomicBoolean isRunning = new AtomicBoolean(false);
    private volatile ScheduledExecutorService renderExecutor;

    public ProgressTracker(Map<String, String> progressMap, Duration renderInterval,
                           PrintStream out, boolean clearScreen) {
        if (renderInterval.isZero() || renderInterval.isNegative()) {
            throw new IllegalArgumentException("Render interval must be positive: " + renderInterval);
        }
        this.progressMap = progressMap;
        this.renderInterval = renderInterval;
        this.out = out;
        this.clearScreen = clearScreen;
    }

    /**
     * Start rendering at a fixed rate.
     */
    public void start() {
        if (!isRunning.compareAndSet(false, true)) {
            log.warn("Progress tracker already running");
            return;
        }

        renderExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "progress-tracker");
            t.setDaemon(true);
            return t;
        });

        renderExecutor.scheduleAtFixedRate(
            this::renderSafely,
            0,
            renderInterval.toMillis(),
            TimeUnit.MILLISECONDS
        );

        log.debug("Progress tracker started (interval: {} ms)", renderInterval.toMillis());
    }

    /**
     * Stop rendering after the current iteration, then print one last snapshot.
     */
    public void stop() {
        if (!isRunning.compareAndSet(true, false)) {
            return;
        }

        ScheduledExecutorService executor = renderExecutor;
        if (executor != null) {
            executor.shutdown();
            try {
                if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                    log.warn("Progress tracker did not stop in time");
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                executor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }

        render(false);
        log.debug("Progress tracker stopped");
    }

    public boolean isRunning() {
        return isRunning.get();
    }

    private void renderSafely() {
        try {
            render(clearScreen);
        } catch (RuntimeException e) {
            // An exception would cancel the schedule
            log.warn("Progress render failed: {}", e.getMessage());
        }
    }

    /**
     * Writes one snapshot of every tracked task to the sink.
     */
    void render(boolean clear) {
        Map<String, String> snapshot = new TreeMap<>(progressMap);

        StringBuilder frame = new StringBuilder();
        if (clear) {
            frame.append(CLEAR_SCREEN);
        }
        frame.append("Progress:").append(System.lineSeparator());
        snapshot.forEach((taskId, status) ->
                frame.append(taskId).append(": ").append(status).append(System.lineSeparator()));

        out.print(frame);
        out.flush();
    }
}
