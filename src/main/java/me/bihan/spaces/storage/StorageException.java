package me.bihan.spaces.storage;

import lombok.Getter;

import java.io.IOException;

/**
 * Failure reported by a {@link StorageClient}.
 * The {@link Kind} tells callers which stage of a transfer went wrong.
 */
@Getter
public class StorageException extends IOException {

    public enum Kind {
        /** The object does not exist. */
        NOT_FOUND,
        /** The service could not be reached or answered with an error. */
        TRANSPORT,
        /** The download was interrupted or could not be written locally. */
        TRANSFER,
        /** A transfer option was not recognised by the client. */
        UNSUPPORTED_OPTION
    }

    private final Kind kind;

    public StorageException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public StorageException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public static StorageException notFound(String bucket, String key) {
        return new StorageException(Kind.NOT_FOUND, "Object not found: " + bucket + "/" + key);
    }
}
