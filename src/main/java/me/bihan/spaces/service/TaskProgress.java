package me.bihan.spaces.service;

import lombok.Builder;
import lombok.Value;
import me.bihan.spaces.util.FormatUtils;

import java.time.Duration;
import java.time.Instant;
import java.util.OptionalDouble;

/**
 * Immutable progress snapshot of a single task.
 */
@Value
@Builder
public class TaskProgress {

    String taskId;

    TaskState state;

    long bytesTransferred;

    /** Total size in bytes, or -1 when the size probe did not succeed. */
    long size;

    /** Average transfer rate since the task started, in bytes per second. */
    long bytesPerSecond;

    Duration elapsed;

    /**
     * Takes a consistent snapshot of the task at the given instant.
     */
    public static TaskProgress of(DownloadTask task, Instant now) {
        long transferred = task.getBytesTransferred();
        long size = task.getSize().orElse(-1L);
        Instant startedAt = task.getStartedAt();

        Duration elapsed = startedAt == null ? Duration.ZERO : Duration.between(startedAt, now);
        long millis = elapsed.toMillis();
        long rate = millis > 0 ? transferred * 1000 / millis : 0L;

        return TaskProgress.builder()
                .taskId(task.getId())
                .state(task.getState())
                .bytesTransferred(transferred)
                .size(size)
                .bytesPerSecond(rate)
                .elapsed(elapsed)
                .build();
    }

    /**
     * Percentage transferred; empty when the size is unknown or zero.
     */
    public OptionalDouble getPercentage() {
        if (size <= 0) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of((double) bytesTransferred / size * 100.0);
    }

    /**
     * Renders the status line shown by the progress tracker.
     */
    public String toStatusLine() {
        StringBuilder line = new StringBuilder();
        line.append(state).append(' ');
        OptionalDouble percentage = getPercentage();
        if (percentage.isPresent()) {
            line.append("transferred ").append(FormatUtils.formatPercentage(percentage.getAsDouble()))
                    .append(" (").append(FormatUtils.formatBytes(bytesTransferred))
                    .append(" of ").append(FormatUtils.formatBytes(size)).append(')');
        } else {
            line.append("transferred ").append(FormatUtils.formatBytes(bytesTransferred));
        }
        line.append("  ").append(FormatUtils.formatRate(bytesPerSecond))
                .append("  ").append(FormatUtils.formatDuration(elapsed));
        return line.toString();
    }
}
