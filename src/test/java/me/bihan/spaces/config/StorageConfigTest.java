package me.bihan.spaces.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class StorageConfigTest {

    @TempDir
    Path tempDir;

    @Test
    void loadsAllKeys() throws Exception {
        Path file = Files.writeString(tempDir.resolve("spaces.conf"), String.join("\n",
                "SPACES_NAME=media-bucket",
                "ACCESS_KEY=AKIAEXAMPLE",
                "SECRET_KEY=wJalrXUtnFEMI/K7MDENG=",
                "REGION_NAME=nyc3",
                "ENDPOINT=https://nyc3.digitaloceanspaces.com"));

        StorageConfig config = StorageConfig.load(file);

        assertThat(config.getBucketName()).isEqualTo("media-bucket");
        assertThat(config.getAccessKey()).isEqualTo("AKIAEXAMPLE");
        // Only the first '=' separates key and value
        assertThat(config.getSecretKey()).isEqualTo("wJalrXUtnFEMI/K7MDENG=");
        assertThat(config.getRegionName()).isEqualTo("nyc3");
        assertThat(config.getEndpointUrl()).isEqualTo("https://nyc3.digitaloceanspaces.com");
        assertThat(config.hasCredentials()).isTrue();
    }

    @Test
    void skipsCommentsBlankAndMalformedLines() throws Exception {
        Path file = Files.writeString(tempDir.resolve("spaces.conf"), String.join("\n",
                "# storage settings",
                "",
                "   REGION_NAME = ams3   ",
                "not a setting",
                "=no key",
                "  # indented comment"));

        Map<String, String> entries = StorageConfig.readEntries(file);

        assertThat(entries).containsExactly(Map.entry("REGION_NAME", "ams3"));
    }

    @Test
    void missingFileYieldsEmptyConfig() {
        StorageConfig config = StorageConfig.load(tempDir.resolve("does-not-exist.conf"));

        assertThat(config.getBucketName()).isNull();
        assertThat(config.getRegionName()).isNull();
        assertThat(config.hasCredentials()).isFalse();
    }

    @Test
    void blankValuesAreTreatedAsUnset() {
        StorageConfig config = new StorageConfig(Map.of("SPACES_NAME", "  ", "ACCESS_KEY", "key"));

        assertThat(config.getBucketName()).isNull();
        assertThat(config.hasCredentials()).isFalse();
    }

    @Test
    void toStringHidesSecret() {
        StorageConfig config = new StorageConfig(Map.of(
                "ACCESS_KEY", "key", "SECRET_KEY", "super-secret", "REGION_NAME", "nyc3"));

        assertThat(config.toString()).doesNotContain("super-secret").contains("nyc3");
    }
}
