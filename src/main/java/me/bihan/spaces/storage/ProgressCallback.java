package me.bihan.spaces.storage;

/**
 * Receives the number of bytes written since the previous call.
 */
@FunctionalInterface
public interface ProgressCallback {

    void onBytesTransferred(long newBytes);
}
