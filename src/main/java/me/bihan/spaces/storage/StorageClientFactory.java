package me.bihan.spaces.storage;

/**
 * Creates independent {@link StorageClient} handles, one per connection.
 */
@FunctionalInterface
public interface StorageClientFactory {

    StorageClient create();
}
