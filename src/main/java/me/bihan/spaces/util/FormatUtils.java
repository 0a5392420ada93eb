package me.bihan.spaces.util;

import java.time.Duration;
import java.util.Locale;

/**
 * Formatting helpers for progress output and log lines.
 */
public final class FormatUtils {

    private static final String[] UNITS = {"B", "KB", "MB", "GB", "TB"};

    private FormatUtils() {
    }

    /**
     * Format a byte count using binary units.
     * @param bytes Number of bytes to format
     * @return Formatted string (e.g., "42 B", "1.5 MB")
     */
    public static String formatBytes(long bytes) {
        if (bytes < 1024) {
            return bytes + " B";
        }
        double value = bytes;
        int unit = 0;
        while (value >= 1024 && unit < UNITS.length - 1) {
            value /= 1024.0;
            unit++;
        }
        return String.format(Locale.ROOT, "%.1f %s", value, UNITS[unit]);
    }

    /**
     * Format a transfer rate given in bytes per second.
     */
    public static String formatRate(long bytesPerSecond) {
        return formatBytes(Math.max(0, bytesPerSecond)) + "/s";
    }

    /**
     * Format percentage with one decimal place (e.g., "87.5%").
     */
    public static String formatPercentage(double percentage) {
        return String.format(Locale.ROOT, "%.1f%%", percentage);
    }

    /**
     * Format an elapsed duration (e.g., "2h 30m 15s", "45m 20s", "12s").
     */
    public static String formatDuration(Duration duration) {
        if (duration == null || duration.isNegative()) {
            return "0s";
        }
        long hours = duration.toHours();
        long minutes = duration.toMinutesPart();
        long seconds = duration.toSecondsPart();

        if (hours > 0) {
            return String.format(Locale.ROOT, "%dh %dm %ds", hours, minutes, seconds);
        }
        if (minutes > 0) {
            return String.format(Locale.ROOT, "%dm %ds", minutes, seconds);
        }
        return String.format(Locale.ROOT, "%ds", seconds);
    }
}
