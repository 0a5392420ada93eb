package me.bihan.spaces.service;

import lombok.Getter;
import lombok.extern.log4j.Log4j2;
import me.bihan.spaces.contract.Contract;
import me.bihan.spaces.storage.StorageClient;
import me.bihan.spaces.storage.StorageException;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Map;
import java.util.OptionalLong;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One transfer of a remote object to a local file.
 * Executed by exactly one {@link Connection}; publishes every byte-count change
 * and every terminal state change to its listeners on the executing thread.
 */
@Log4j2
public class DownloadTask implements TaskNotifier {

    private static final long UNKNOWN_SIZE = -1L;

    @Getter
    private final String id;
    @Getter
    private final String bucket;
    @Getter
    private final String key;
    @Getter
    private final Path destination;
    @Getter
    private final Map<String, String> options;

    // Guards size and bytesTransferred
    private final Object lock = new Object();
    private long size = UNKNOWN_SIZE;
    private long bytesTransferred = 0;
    private boolean overrunReported = false;

    private final AtomicReference<TaskState> state = new AtomicReference<>(TaskState.PENDING);
    private final CopyOnWriteArrayList<TaskListener> listeners = new CopyOnWriteArrayList<>();

    @Getter
    private volatile Instant startedAt;
    @Getter
    private volatile Instant finishedAt;
    /** Cause of the failure once the task is {@link TaskState#FAILED}, otherwise null. */
    @Getter
    private volatile Exception failure;

    public DownloadTask(Contract contract) {
        this.id = contract.getId();
        this.bucket = contract.getBucket();
        this.key = contract.getKey();
        this.destination = contract.getDestination();
        this.options = contract.getOptions();
    }

    /**
     * Probes the object size, then runs the transfer to completion on the calling thread.
     * Never throws for storage failures: those move the task to {@link TaskState#FAILED}.
     *
     * @param client Storage handle owned by the calling connection
     */
    public void start(StorageClient client) {
        if (!state.compareAndSet(TaskState.READY, TaskState.RUNNING)) {
            log.warn("Task {} cannot be started from state {}", id, state.get());
            return;
        }

        try {
            setSize(client.probeSize(bucket, key));
        } catch (StorageException e) {
            log.warn("Failed to retrieve object size for {}/{} (task {}): {}", bucket, key, id, e.getMessage());
        }

        startedAt = Instant.now();
        log.debug("Task {} started: {}/{} -> {}", id, bucket, key, destination);

        try {
            client.download(bucket, key, destination, options, this::progress);
        } catch (StorageException | RuntimeException e) {
            fail(e);
            return;
        }
        complete();
    }

    /**
     * Progress callback: adds newly transferred bytes and notifies listeners.
     */
    void progress(long newBytes) {
        if (newBytes <= 0) {
            return;
        }
        synchronized (lock) {
            long next = bytesTransferred + newBytes;
            if (size != UNKNOWN_SIZE && next > size) {
                if (!overrunReported) {
                    log.warn("Task {} received more bytes than the probed size {}, capping progress", id, size);
                    overrunReported = true;
                }
                next = size;
            }
            bytesTransferred = next;
        }
        notifyListeners();
    }

    private void complete() {
        long transferred;
        long expected;
        synchronized (lock) {
            if (size == UNKNOWN_SIZE) {
                size = bytesTransferred;
            }
            transferred = bytesTransferred;
            expected = size;
        }

        if (transferred < expected) {
            fail(new StorageException(StorageException.Kind.TRANSFER,
                    "Transfer ended after " + transferred + " of " + expected + " bytes"));
            return;
        }

        finishedAt = Instant.now();
        state.set(TaskState.COMPLETED);
        log.debug("Task {} transferred {} bytes", id, transferred);
        // Completion observers act on this notification, including for zero-byte objects
        notifyListeners();
    }

    private void fail(Exception cause) {
        failure = cause;
        finishedAt = Instant.now();
        state.set(TaskState.FAILED);
        log.error("Task {} failed for {}/{}: {}", id, bucket, key, cause.getMessage());
        notifyListeners();
    }

    /**
     * Moves the task from PENDING to READY.
     * @return false if the task was not pending
     */
    boolean markReady() {
        return state.compareAndSet(TaskState.PENDING, TaskState.READY);
    }

    private void setSize(long probed) {
        synchronized (lock) {
            if (size != UNKNOWN_SIZE) {
                log.warn("Task {} size already set to {}, ignoring {}", id, size, probed);
                return;
            }
            size = probed;
        }
    }

    /**
     * Total size in bytes, empty until the size is known.
     */
    public OptionalLong getSize() {
        synchronized (lock) {
            return size == UNKNOWN_SIZE ? OptionalLong.empty() : OptionalLong.of(size);
        }
    }

    public long getBytesTransferred() {
        synchronized (lock) {
            return bytesTransferred;
        }
    }

    /**
     * True once bytes transferred equals a known size.
     */
    public boolean isTransferComplete() {
        synchronized (lock) {
            return size != UNKNOWN_SIZE && bytesTransferred == size;
        }
    }

    public TaskState getState() {
        return state.get();
    }

    @Override
    public void attach(TaskListener listener) {
        if (listener != null) {
            listeners.addIfAbsent(listener);
        }
    }

    @Override
    public void detach(TaskListener listener) {
        listeners.remove(listener);
    }

    @Override
    public void notifyListeners() {
        for (TaskListener listener : listeners) {
            try {
                listener.update(this);
            } catch (RuntimeException e) {
                log.error("Listener {} failed for task {}: {}",
                        listener.getClass().getSimpleName(), id, e.getMessage(), e);
            }
        }
    }

    @Override
    public String toString() {
        return String.format("DownloadTask{id=%s, key=%s, state=%s}", id, key, state.get());
    }
}
