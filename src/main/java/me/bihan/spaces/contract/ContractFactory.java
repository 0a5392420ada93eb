package me.bihan.spaces.contract;

import lombok.Getter;

import java.nio.file.Path;
import java.util.Map;
import java.util.UUID;

/**
 * Creates {@link Contract}s for a single bucket.
 */
@Getter
public class ContractFactory {

    private final String bucket;

    public ContractFactory(String bucket) {
        if (bucket == null || bucket.isBlank()) {
            throw new IllegalArgumentException("Bucket name must not be empty");
        }
        this.bucket = bucket;
    }

    /**
     * Creates a contract without transfer options.
     */
    public Contract newContract(String key, Path destination) {
        return newContract(key, destination, Map.of());
    }

    /**
     * Creates a contract with a fresh random id.
     *
     * @param key Object key inside the bucket
     * @param destination Local file to write
     * @param options Transfer options, copied into the contract
     */
    public Contract newContract(String key, Path destination, Map<String, String> options) {
        return Contract.builder()
                .id(generateId())
                .bucket(bucket)
                .key(key)
                .destination(destination)
                .options(options == null ? Map.of() : options)
                .build();
    }

    private static String generateId() {
        return UUID.randomUUID().toString();
    }
}
