package me.bihan.spaces.service;

import lombok.extern.log4j.Log4j2;
import me.bihan.spaces.storage.StorageClient;
import me.bihan.spaces.storage.StorageClientFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed set of {@link Connection}s sharing one ready queue.
 * The pool size is the only bound on concurrent transfers; the ready queue itself is unbounded.
 */
@Log4j2
public class ConnectionPool {

    private static final Duration INTERRUPT_GRACE = Duration.ofSeconds(5);

    private final BlockingQueue<DownloadTask> readyQueue;
    private final List<Connection> connections;
    private final Duration shutdownTimeout;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);
    private volatile ExecutorService connectionExecutor;

    /**
     * Creates the connections up front, each with its own storage handle.
     */
    public ConnectionPool(BlockingQueue<DownloadTask> readyQueue, StorageClientFactory clientFactory,
                          int size, Duration pollTimeout, Duration shutdownTimeout) {
        if (size < 1) {
            throw new IllegalArgumentException("Connection pool size must be at least 1: " + size);
        }
        this.readyQueue = readyQueue;
        this.shutdownTimeout = shutdownTimeout;

        List<Connection> created = new ArrayList<>(size);
        try {
            for (int i = 0; i < size; i++) {
                StorageClient client = clientFactory.create();
                created.add(new Connection(i, client, readyQueue, running::get, pollTimeout));
            }
        } catch (RuntimeException e) {
            created.forEach(Connection::closeClient);
            throw e;
        }
        this.connections = Collections.unmodifiableList(created);
    }

    /**
     * Launches every connection.
     */
    public void start() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Connection pool already started");
        }

        running.set(true);
        AtomicInteger threadNumber = new AtomicInteger();
        connectionExecutor = Executors.newFixedThreadPool(connections.size(), r -> {
            Thread t = new Thread(r, "connection-" + threadNumber.getAndIncrement());
            t.setDaemon(true);
            return t;
        });

        for (Connection connection : connections) {
            connectionExecutor.submit(connection);
        }
        log.info("Started {} connection(s)", connections.size());
    }

    /**
     * Stops claiming new tasks and waits for in-flight transfers, up to the shutdown timeout.
     * Tasks still in the ready queue stay there. Transfers still running at the timeout are
     * interrupted, and clients are closed only after they return or a short grace period ends.
     *
     * @return true if every connection exited within the timeout
     */
    public boolean stop() {
        if (!stopped.compareAndSet(false, true)) {
            return true;
        }
        running.set(false);

        boolean clean = true;
        if (connectionExecutor != null) {
            log.info("Stopping {} connection(s), {} in flight", connections.size(), getBusyCount());
            connectionExecutor.shutdown();
            try {
                if (!connectionExecutor.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                    log.warn("Connections did not finish within {} ms, interrupting {} busy connection(s)",
                            shutdownTimeout.toMillis(), getBusyCount());
                    connectionExecutor.shutdownNow();
                    clean = false;
                    // Interrupted transfers still own their clients until they return
                    if (!connectionExecutor.awaitTermination(INTERRUPT_GRACE.toMillis(), TimeUnit.MILLISECONDS)) {
                        log.error("{} connection(s) ignored the interrupt, closing their clients anyway", getBusyCount());
                    }
                }
            } catch (InterruptedException e) {
                connectionExecutor.shutdownNow();
                Thread.currentThread().interrupt();
                clean = false;
            }
        }

        connections.forEach(Connection::closeClient);
        log.info("Connection pool stopped, {} task(s) left in the ready queue", readyQueue.size());
        return clean;
    }

    public boolean isRunning() {
        return running.get();
    }

    public int getSize() {
        return connections.size();
    }

    /**
     * Number of connections currently transferring.
     */
    public int getBusyCount() {
        return (int) connections.stream().filter(Connection::isBusy).count();
    }

    List<Connection> getConnections() {
        return connections;
    }
}
