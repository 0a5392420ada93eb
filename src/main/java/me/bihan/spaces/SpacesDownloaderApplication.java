package me.bihan.spaces;

import lombok.extern.log4j.Log4j2;
import me.bihan.spaces.cli.SpacesDownloaderCommand;
import me.bihan.spaces.config.SpacesDownloaderConfig;
import me.bihan.spaces.config.StorageConfig;
import me.bihan.spaces.contract.Contract;
import me.bihan.spaces.contract.ContractFactory;
import me.bihan.spaces.service.DownloadManager;
import me.bihan.spaces.service.DownloadTask;
import me.bihan.spaces.util.FormatUtils;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.core.config.Configurator;
import picocli.CommandLine;

import java.time.Duration;

/**
 * Command line entry point.
 * Submits one download per key, runs them over the connection pool and
 * stops cleanly on completion or on process termination.
 */
@Log4j2
public class SpacesDownloaderApplication {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        SpacesDownloaderCommand command = new SpacesDownloaderCommand();
        CommandLine commandLine = new CommandLine(command);

        try {
            commandLine.parseArgs(args);

            if (commandLine.isUsageHelpRequested()) {
                commandLine.usage(System.out);
                return EXIT_OK;
            }

            if (commandLine.isVersionHelpRequested()) {
                commandLine.printVersionHelp(System.out);
                return EXIT_OK;
            }

            if (!command.validateArguments(System.err)) {
                return EXIT_USAGE;
            }

            if (command.isVerbose()) {
                Configurator.setAllLevels("me.bihan.spaces", Level.DEBUG);
                log.debug("Verbose logging enabled");
            }

            log.info("=== Spaces Downloader Starting ===");
            log.info("Config file: {}", command.getConfigFile());
            log.info("Destination: {}", command.getDestinationDirectory().toAbsolutePath());
            log.info("Workers: {}", command.getWorkers());

            SpacesDownloaderConfig config = new SpacesDownloaderConfig(
                StorageConfig.load(command.getConfigFile()),
                command.toSettings(System.out),
                command.getBucket()
            );

            ContractFactory contractFactory = config.createContractFactory();
            DownloadManager manager = config.createDownloadManager();

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                if (!manager.isStopped()) {
                    System.out.println("\nShutting down, waiting for running transfers...");
                    manager.stop();
                }
            }, "shutdown-hook"));

            for (String key : command.getKeys()) {
                Contract contract = contractFactory.newContract(
                    key, command.destinationFor(key), command.getTransferOptions());
                manager.submit(contract);
            }

            long startedAt = System.nanoTime();
            manager.start();
            manager.awaitCompletion();
            manager.stop();

            return printSummary(manager, Duration.ofNanos(System.nanoTime() - startedAt));

        } catch (CommandLine.ParameterException ex) {
            System.err.println("Error: " + ex.getMessage());
            System.err.println();
            commandLine.usage(System.err);
            return EXIT_USAGE;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for downloads");
            return EXIT_FAILURE;
        } catch (Exception e) {
            log.error("Application error: {}", e.getMessage(), e);
            System.err.println("Error: " + e.getMessage());
            return EXIT_FAILURE;
        }
    }

    private static int printSummary(DownloadManager manager, Duration elapsed) {
        long totalBytes = manager.getCompletedTasks().stream()
                .mapToLong(DownloadTask::getBytesTransferred)
                .sum();

        System.out.println();
        System.out.println("=== Downloads Finished ===");
        System.out.printf("Completed: %d of %d (%s in %s)%n",
                manager.getCompletedTasks().size(),
                manager.getSubmittedCount(),
                FormatUtils.formatBytes(totalBytes),
                FormatUtils.formatDuration(elapsed));

        for (DownloadTask failed : manager.getFailedTasks()) {
            System.err.printf("Failed: %s (%s)%n", failed.getKey(),
                    failed.getFailure() != null ? failed.getFailure().getMessage() : "unknown error");
        }

        boolean allComplete = manager.getCompletedTasks().size() == manager.getSubmittedCount();
        log.info("=== Spaces Downloader Finished ===");
        return allComplete ? EXIT_OK : EXIT_FAILURE;
    }
}
