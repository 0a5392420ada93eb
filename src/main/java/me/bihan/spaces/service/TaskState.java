package me.bihan.spaces.service;

/**
 * Lifecycle of a {@link DownloadTask}.
 */
public enum TaskState {
    PENDING,    // Submitted, waiting for the manager to start
    READY,      // Observers attached, waiting for a free connection
    RUNNING,    // Claimed by a connection
    COMPLETED,  // Transfer returned normally
    FAILED;     // Transfer raised, see DownloadTask#getFailure

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
