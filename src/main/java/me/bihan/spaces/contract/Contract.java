package me.bihan.spaces.contract;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.nio.file.Path;
import java.util.Map;

/**
 * Immutable request to download one remote object to a local path.
 * Created through a {@link ContractFactory} bound to a bucket.
 */
@Value
public class Contract {

    /** Opaque unique token, copied onto the task that executes this contract. */
    String id;

    String bucket;

    String key;

    Path destination;

    /** Transfer options passed through to the storage client, never null. */
    Map<String, String> options;

    @Builder
    private Contract(@NonNull String id, @NonNull String bucket, @NonNull String key,
                     @NonNull Path destination, Map<String, String> options) {
        this.id = id;
        this.bucket = bucket;
        this.key = key;
        this.destination = destination;
        this.options = options == null ? Map.of() : Map.copyOf(options);
    }
}
