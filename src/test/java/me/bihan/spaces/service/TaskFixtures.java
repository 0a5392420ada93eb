package me.bihan.spaces.service;

import me.bihan.spaces.contract.ContractFactory;

import java.nio.file.Path;

/**
 * Builds tasks in a given state for tests outside this package.
 */
public final class TaskFixtures {

    private static final ContractFactory CONTRACTS = new ContractFactory("test-bucket");

    private TaskFixtures() {
    }

    public static DownloadTask pendingTask(String key) {
        return new DownloadTask(CONTRACTS.newContract(key, Path.of("downloads", key)));
    }

    public static DownloadTask readyTask(String key) {
        DownloadTask task = pendingTask(key);
        task.markReady();
        return task;
    }

    /** Feeds bytes to a task as if a storage client had received them. */
    public static void receive(DownloadTask task, long bytes) {
        task.progress(bytes);
    }
}
