package me.bihan.spaces.config;

import lombok.Getter;
import lombok.extern.log4j.Log4j2;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Storage connection settings read from a flat key=value file.
 *
 * <pre>
 * SPACES_NAME=my-bucket
 * ACCESS_KEY=...
 * SECRET_KEY=...
 * REGION_NAME=nyc3
 * ENDPOINT=https://nyc3.digitaloceanspaces.com
 * </pre>
 *
 * A missing file is not an error: it is logged and yields an empty configuration,
 * which then fails when a storage client is built from it.
 */
@Log4j2
@Getter
public class StorageConfig {

    public static final String DEFAULT_FILE_NAME = "spaces.conf";

    public static final String BUCKET_NAME = "SPACES_NAME";
    public static final String ACCESS_KEY = "ACCESS_KEY";
    public static final String SECRET_KEY = "SECRET_KEY";
    public static final String REGION_NAME = "REGION_NAME";
    public static final String ENDPOINT = "ENDPOINT";

    private final String bucketName;
    private final String accessKey;
    private final String secretKey;
    private final String regionName;
    private final String endpointUrl;

    public StorageConfig(Map<String, String> values) {
        this.bucketName = blankToNull(values.get(BUCKET_NAME));
        this.accessKey = blankToNull(values.get(ACCESS_KEY));
        this.secretKey = blankToNull(values.get(SECRET_KEY));
        this.regionName = blankToNull(values.get(REGION_NAME));
        this.endpointUrl = blankToNull(values.get(ENDPOINT));
    }

    /**
     * Loads the configuration file; never throws for a missing or unreadable file.
     */
    public static StorageConfig load(Path file) {
        return new StorageConfig(readEntries(file));
    }

    public static StorageConfig empty() {
        return new StorageConfig(Map.of());
    }

    /**
     * Parses key=value lines. Blank lines and lines starting with '#' are skipped,
     * the value is everything after the first '='.
     */
    static Map<String, String> readEntries(Path file) {
        Map<String, String> entries = new LinkedHashMap<>();
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            int lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                String trimmed = line.trim();
                if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                    continue;
                }
                int separator = trimmed.indexOf('=');
                if (separator <= 0) {
                    log.warn("Ignoring malformed line {} in {}", lineNumber, file);
                    continue;
                }
                entries.put(trimmed.substring(0, separator).trim(), trimmed.substring(separator + 1).trim());
            }
        } catch (NoSuchFileException e) {
            log.error("Config file missing: {}", file);
            return Collections.emptyMap();
        } catch (IOException e) {
            log.error("Config file {} could not be read: {}", file, e.getMessage());
            return Collections.emptyMap();
        }
        log.debug("Loaded {} setting(s) from {}", entries.size(), file);
        return entries;
    }

    public boolean hasCredentials() {
        return accessKey != null && secretKey != null;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    @Override
    public String toString() {
        // Secret key is never printed
        return String.format("StorageConfig{bucket=%s, region=%s, endpoint=%s, credentials=%s}",
                bucketName, regionName, endpointUrl, hasCredentials() ? "static" : "default chain");
    }
}
