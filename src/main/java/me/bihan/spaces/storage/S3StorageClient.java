package me.bihan.spaces.storage;

import lombok.extern.log4j.Log4j2;
import software.amazon.awssdk.core.ResponseInputStream;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectResponse;
import software.amazon.awssdk.services.s3.model.S3Exception;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Map;
import java.util.function.BiConsumer;

/**
 * {@link StorageClient} backed by the AWS SDK v2 S3 client.
 * Works against AWS S3 and S3-compatible services such as DigitalOcean Spaces.
 */
@Log4j2
public class S3StorageClient implements StorageClient {

    public static final int DEFAULT_BUFFER_SIZE = 256 * 1024;

    private static final String PARTIAL_SUFFIX = ".part";

    private static final Map<String, BiConsumer<GetObjectRequest.Builder, String>> SUPPORTED_OPTIONS = Map.of(
            "VersionId", GetObjectRequest.Builder::versionId,
            "SSECustomerAlgorithm", GetObjectRequest.Builder::sseCustomerAlgorithm,
            "SSECustomerKey", GetObjectRequest.Builder::sseCustomerKey,
            "SSECustomerKeyMD5", GetObjectRequest.Builder::sseCustomerKeyMD5,
            "RequestPayer", GetObjectRequest.Builder::requestPayer,
            "ExpectedBucketOwner", GetObjectRequest.Builder::expectedBucketOwner,
            "ChecksumMode", GetObjectRequest.Builder::checksumMode
    );

    private final S3Client s3Client;
    private final int bufferSize;

    public S3StorageClient(S3Client s3Client) {
        this(s3Client, DEFAULT_BUFFER_SIZE);
    }

    public S3StorageClient(S3Client s3Client, int bufferSize) {
        if (bufferSize <= 0) {
            throw new IllegalArgumentException("Buffer size must be positive: " + bufferSize);
        }
        this.s3Client = s3Client;
        this.bufferSize = bufferSize;
    }

    @Override
    public long probeSize(String bucket, String key) throws StorageException {
        HeadObjectRequest request = HeadObjectRequest.builder()
                .bucket(bucket)
                .key(key)
                .build();
        try {
            HeadObjectResponse response = s3Client.headObject(request);
            Long length = response.contentLength();
            if (length == null) {
                throw new StorageException(StorageException.Kind.TRANSPORT,
                        "No content length returned for " + bucket + "/" + key);
            }
            return length;
        } catch (S3Exception e) {
            if (e.statusCode() == 404) {
                throw StorageException.notFound(bucket, key);
            }
            throw new StorageException(StorageException.Kind.TRANSPORT,
                    "Head request failed for " + bucket + "/" + key + ": " + e.getMessage(), e);
        } catch (SdkException e) {
            throw new StorageException(StorageException.Kind.TRANSPORT,
                    "Could not reach storage for " + bucket + "/" + key + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void download(String bucket, String key, Path destination, Map<String, String> options,
                         ProgressCallback callback) throws StorageException {
        GetObjectRequest request = buildGetRequest(bucket, key, options);
        Path partial = destination.resolveSibling(destination.getFileName() + PARTIAL_SUFFIX);

        try {
            Path parent = destination.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }

            try (ResponseInputStream<GetObjectResponse> in = s3Client.getObject(request);
                 OutputStream out = Files.newOutputStream(partial, StandardOpenOption.CREATE,
                         StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
                byte[] buffer = new byte[bufferSize];
                int read;
                while ((read = in.read(buffer)) != -1) {
                    out.write(buffer, 0, read);
                    callback.onBytesTransferred(read);
                }
            }

            Files.move(partial, destination, StandardCopyOption.REPLACE_EXISTING);
            log.debug("Downloaded {}/{} to {}", bucket, key, destination);

        } catch (IOException | RuntimeException e) {
            deletePartial(partial);
            throw new StorageException(StorageException.Kind.TRANSFER,
                    "Download of " + bucket + "/" + key + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        s3Client.close();
    }

    private GetObjectRequest buildGetRequest(String bucket, String key, Map<String, String> options)
            throws StorageException {
        GetObjectRequest.Builder builder = GetObjectRequest.builder()
                .bucket(bucket)
                .key(key);

        for (Map.Entry<String, String> option : options.entrySet()) {
            BiConsumer<GetObjectRequest.Builder, String> setter = SUPPORTED_OPTIONS.get(option.getKey());
            if (setter == null) {
                throw new StorageException(StorageException.Kind.UNSUPPORTED_OPTION,
                        "Unsupported transfer option '" + option.getKey() + "', expected one of "
                                + SUPPORTED_OPTIONS.keySet());
            }
            setter.accept(builder, option.getValue());
        }
        return builder.build();
    }

    private void deletePartial(Path partial) {
        try {
            Files.deleteIfExists(partial);
        } catch (IOException cleanupEx) {
            log.warn("Failed to clean up partial file: {}", partial, cleanupEx);
        }
    }
}
