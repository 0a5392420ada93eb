package me.bihan.spaces.storage;

import java.nio.file.Path;
import java.util.Map;

/**
 * Handle onto a remote object store.
 * A handle is used by one connection at a time and is not shared between connections.
 */
public interface StorageClient extends AutoCloseable {

    /**
     * Fetches the content length of an object.
     *
     * @param bucket The bucket holding the object
     * @param key The object key
     * @return Size of the object in bytes
     * @throws StorageException with kind NOT_FOUND or TRANSPORT
     */
    long probeSize(String bucket, String key) throws StorageException;

    /**
     * Downloads an object to a local file, reporting progress as chunks arrive.
     * The callback runs on the calling thread.
     *
     * @param bucket The bucket holding the object
     * @param key The object key
     * @param destination Local file to write
     * @param options Transfer options, may be empty
     * @param callback Invoked with the byte count of every chunk written
     * @throws StorageException with kind TRANSFER or UNSUPPORTED_OPTION
     */
    void download(String bucket, String key, Path destination, Map<String, String> options,
                  ProgressCallback callback) throws StorageException;

    @Override
    void close();
}
