package me.bihan.spaces.config;

import lombok.Getter;
import me.bihan.spaces.contract.ContractFactory;
import me.bihan.spaces.service.DownloadManager;
import me.bihan.spaces.storage.S3StorageClientFactory;
import me.bihan.spaces.storage.StorageClientFactory;

/**
 * Creates and wires the downloader's collaborators by hand.
 * One factory method per collaborator, so tests can swap any of them out.
 */
@Getter
public class SpacesDownloaderConfig {

    private final StorageConfig storageConfig;
    private final DownloadSettings settings;
    private final String bucketOverride;

    public SpacesDownloaderConfig(StorageConfig storageConfig, DownloadSettings settings, String bucketOverride) {
        this.storageConfig = storageConfig;
        this.settings = settings;
        this.bucketOverride = bucketOverride;
    }

    /**
     * Bucket from the command line if given, otherwise from the configuration file.
     */
    public String resolveBucket() {
        if (bucketOverride != null && !bucketOverride.isBlank()) {
            return bucketOverride;
        }
        return storageConfig.getBucketName();
    }

    /** Creates the factory that hands each connection its own storage client. */
    public StorageClientFactory createStorageClientFactory() {
        return new S3StorageClientFactory(storageConfig, settings.getMaxRetries());
    }

    /** Creates a download manager with one connection per configured worker. */
    public DownloadManager createDownloadManager() {
        return createDownloadManager(createStorageClientFactory());
    }

    public DownloadManager createDownloadManager(StorageClientFactory clientFactory) {
        return new DownloadManager(clientFactory, settings);
    }

    /**
     * Creates a contract factory for the resolved bucket.
     * @throws IllegalStateException if no bucket is configured
     */
    public ContractFactory createContractFactory() {
        String bucket = resolveBucket();
        if (bucket == null) {
            throw new IllegalStateException("No bucket configured: pass --bucket or set "
                    + StorageConfig.BUCKET_NAME + " in the config file");
        }
        return new ContractFactory(bucket);
    }
}
