package me.bihan.spaces.config;

import lombok.Builder;
import lombok.Value;

import java.io.PrintStream;
import java.time.Duration;

/**
 * Tuning values for a download manager.
 */
@Value
@Builder(toBuilder = true)
public class DownloadSettings {

    /** Number of connections, which is also the maximum number of concurrent transfers. */
    @Builder.Default
    int workers = 1;

    /** How long an idle connection waits on the ready queue before re-checking the pool state. */
    @Builder.Default
    Duration pollTimeout = Duration.ofMillis(500);

    /** Upper bound on waiting for in-flight transfers during shutdown. */
    @Builder.Default
    Duration shutdownTimeout = Duration.ofSeconds(30);

    @Builder.Default
    Duration progressInterval = Duration.ofSeconds(2);

    /** Clear the terminal before each progress frame. */
    @Builder.Default
    boolean clearScreen = true;

    @Builder.Default
    PrintStream output = System.out;

    /** Per-request retries performed by the storage client. */
    @Builder.Default
    int maxRetries = 3;

    public static DownloadSettings defaults() {
        return DownloadSettings.builder().build();
    }
}
