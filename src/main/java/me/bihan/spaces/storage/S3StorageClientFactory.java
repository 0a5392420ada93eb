package me.bihan.spaces.storage;

import lombok.extern.log4j.Log4j2;
import me.bihan.spaces.config.StorageConfig;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.core.retry.RetryPolicy;
import software.amazon.awssdk.core.retry.backoff.BackoffStrategy;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;

import java.net.URI;

/**
 * Builds one independent S3 client per call, so connections never share a handle.
 */
@Log4j2
public class S3StorageClientFactory implements StorageClientFactory {

    private final StorageConfig config;
    private final int maxRetries;
    private final int bufferSize;

    public S3StorageClientFactory(StorageConfig config, int maxRetries) {
        this(config, maxRetries, S3StorageClient.DEFAULT_BUFFER_SIZE);
    }

    public S3StorageClientFactory(StorageConfig config, int maxRetries, int bufferSize) {
        this.config = config;
        this.maxRetries = maxRetries;
        this.bufferSize = bufferSize;
    }

    /**
     * @throws IllegalStateException if the configuration has no region
     */
    @Override
    public StorageClient create() {
        if (config.getRegionName() == null) {
            throw new IllegalStateException("Storage configuration is missing " + StorageConfig.REGION_NAME
                    + ", cannot build a storage client");
        }

        S3ClientBuilder builder = S3Client.builder()
                .region(Region.of(config.getRegionName()))
                .credentialsProvider(credentialsProvider())
                .overrideConfiguration(ClientOverrideConfiguration.builder()
                        .retryPolicy(RetryPolicy.builder()
                                .numRetries(maxRetries)
                                .backoffStrategy(BackoffStrategy.defaultStrategy())
                                .build())
                        .build());

        if (config.getEndpointUrl() != null) {
            builder.endpointOverride(URI.create(config.getEndpointUrl()));
        }

        log.debug("Creating storage client for {}", config);
        return new S3StorageClient(builder.build(), bufferSize);
    }

    private AwsCredentialsProvider credentialsProvider() {
        if (config.hasCredentials()) {
            return StaticCredentialsProvider.create(
                    AwsBasicCredentials.create(config.getAccessKey(), config.getSecretKey()));
        }
        return DefaultCredentialsProvider.create();
    }
}
