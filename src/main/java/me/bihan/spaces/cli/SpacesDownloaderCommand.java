package me.bihan.spaces.cli;

import lombok.Getter;
import me.bihan.spaces.config.DownloadSettings;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * CLI command definition for the downloader using PicoCLI.
 */
@Command(
    name = "spaces-downloader",
    mixinStandardHelpOptions = true,
    version = "Spaces Downloader 1.0.0",
    description = "Downloads objects from an S3-compatible bucket over a fixed pool of connections.",
    headerHeading = "%nUsage:%n%n",
    synopsisHeading = "",
    descriptionHeading = "%nDescription:%n%n",
    parameterListHeading = "%nParameters:%n",
    optionListHeading = "%nOptions:%n",
    footerHeading = "%nExamples:%n",
    footer = {
        "  # Download two objects using the bucket from spaces.conf:",
        "  java -jar spaces-downloader.jar videos/ep1.mkv videos/ep2.mkv",
        "",
        "  # Four connections, custom config file and destination:",
        "  java -jar spaces-downloader.jar -c /etc/spaces.conf -w 4 -d /data/downloads videos/ep1.mkv",
        "",
        "  # Download a specific object version:",
        "  java -jar spaces-downloader.jar -o VersionId=3HL4kqtJlcpXroDTDmJ videos/ep1.mkv",
        ""
    }
)
@Getter
public class SpacesDownloaderCommand implements Callable<Integer> {

    @Parameters(
        arity = "1..*",
        paramLabel = "<keys>",
        description = "One or more object keys to download"
    )
    private List<String> keys;

    @Option(
        names = {"-c", "--config"},
        paramLabel = "<file>",
        description = "Key=value configuration file (default: ${DEFAULT-VALUE})",
        defaultValue = "spaces.conf"
    )
    private Path configFile;

    @Option(
        names = {"-b", "--bucket"},
        paramLabel = "<bucket>",
        description = "Bucket to download from, overrides SPACES_NAME from the config file"
    )
    private String bucket;

    @Option(
        names = {"-d", "--dest-dir"},
        paramLabel = "<directory>",
        description = "Directory to download into, keys keep their prefixes (default: ${DEFAULT-VALUE})",
        defaultValue = "."
    )
    private Path destinationDirectory;

    @Option(
        names = {"-w", "--workers"},
        paramLabel = "<count>",
        description = "Number of connections, i.e. concurrent transfers (default: ${DEFAULT-VALUE})",
        defaultValue = "4"
    )
    private int workers;

    @Option(
        names = {"-i", "--progress-interval"},
        paramLabel = "<seconds>",
        description = "Seconds between progress redraws (default: ${DEFAULT-VALUE})",
        defaultValue = "2"
    )
    private int progressIntervalSeconds;

    @Option(
        names = {"-t", "--shutdown-timeout"},
        paramLabel = "<seconds>",
        description = "Seconds to wait for running transfers on shutdown (default: ${DEFAULT-VALUE})",
        defaultValue = "30"
    )
    private int shutdownTimeoutSeconds;

    @Option(
        names = {"-r", "--max-retries"},
        paramLabel = "<count>",
        description = "Retries per storage request before a transfer fails (default: ${DEFAULT-VALUE})",
        defaultValue = "3"
    )
    private int maxRetries;

    @Option(
        names = {"-o", "--option"},
        paramLabel = "<name=value>",
        description = "Transfer option passed to every download, e.g. VersionId=... (repeatable)"
    )
    private Map<String, String> transferOptions = new LinkedHashMap<>();

    @Option(
        names = "--no-clear",
        description = "Do not clear the terminal between progress redraws"
    )
    private boolean noClear;

    @Option(
        names = {"-v", "--verbose"},
        description = "Enable verbose logging output"
    )
    private boolean verbose;

    @Override
    public Integer call() throws Exception {
        // Business logic lives in the application class
        return 0;
    }

    /**
     * Validates the command line arguments, printing the first problem found.
     * @return true if all arguments are valid
     */
    public boolean validateArguments(PrintStream err) {
        if (workers < 1 || workers > 64) {
            err.println("Error: Workers must be between 1 and 64");
            return false;
        }

        if (progressIntervalSeconds < 1 || progressIntervalSeconds > 3600) {
            err.println("Error: Progress interval must be between 1 and 3600 seconds");
            return false;
        }

        if (shutdownTimeoutSeconds < 1) {
            err.println("Error: Shutdown timeout must be at least 1 second");
            return false;
        }

        if (maxRetries < 0 || maxRetries > 10) {
            err.println("Error: Max retries must be between 0 and 10");
            return false;
        }

        if (Files.exists(destinationDirectory) && !Files.isDirectory(destinationDirectory)) {
            err.println("Error: Destination is not a directory: " + destinationDirectory);
            return false;
        }

        Path root = destinationDirectory.toAbsolutePath().normalize();
        for (String key : keys) {
            if (key.isBlank() || key.endsWith("/")) {
                err.println("Error: Not an object key: '" + key + "'");
                return false;
            }
            Path target = destinationFor(key).toAbsolutePath().normalize();
            if (!target.startsWith(root) || target.equals(root)) {
                err.println("Error: Key resolves outside the destination directory: '" + key + "'");
                return false;
            }
        }

        return true;
    }

    /**
     * Local path an object key is written to.
     */
    public Path destinationFor(String key) {
        String relative = key.startsWith("/") ? key.substring(1) : key;
        return destinationDirectory.resolve(relative).normalize();
    }

    /**
     * Builds manager settings from the parsed options.
     */
    public DownloadSettings toSettings(PrintStream out) {
        return DownloadSettings.builder()
                .workers(workers)
                .progressInterval(Duration.ofSeconds(progressIntervalSeconds))
                .shutdownTimeout(Duration.ofSeconds(shutdownTimeoutSeconds))
                .maxRetries(maxRetries)
                .clearScreen(!noClear)
                .output(out)
                .build();
    }
}
