package com.example.artworkextractor;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConfigLoaderTest {
    @TempDir
    Path tempDir;

    @Test
    void appliesDefaults() throws Exception {
        ExtractorConfig config = new ConfigLoader(Map.<String, String>of()::get).load(write("{\"apiKey\": \"k\"}"));

        assertEquals("k", config.apiKey());
        assertEquals(Path.of("artwork"), config.outputDirectory());
        assertTrue(config.downloadThumbnails());
        assertEquals("https://eth-mainnet.g.alchemy.com/nft/v2", config.providerBaseUrl());
        assertEquals(1, config.threadCount());
        assertEquals(Duration.ofSeconds(60), config.requestTimeout());
        assertEquals(MediaSelectionPolicy.defaults(), config.selectionPolicy());
        assertEquals(DuplicateMatch.HOST_STRIPPED, config.selectionPolicy().duplicateMatch());
        assertTrue(config.selectionPolicy().preferGateway());
        assertEquals(3128, config.listenerPort());
        assertFalse(config.s3SyncEnabled());
        assertEquals(Optional.empty(), config.s3Bucket());
    }

    @Test
    void readsEnvironmentFallbacks() throws Exception {
        Map<String, String> env = Map.of("ALCHEMY_API_KEY", "from-env", "DOWNLOAD_THUMBNAILS", "No");

        ExtractorConfig config = new ConfigLoader(env::get).load(write("{\"outputDirectory\": \"out\", \"unknown\": 1}"));

        assertEquals("from-env", config.apiKey());
        assertFalse(config.downloadThumbnails());
        assertEquals(Path.of("out"), config.outputDirectory());
    }

    @Test
    void fileSettingsWinOverEnvironment() throws Exception {
        Map<String, String> env = Map.of("ALCHEMY_API_KEY", "from-env", "DOWNLOAD_THUMBNAILS", "false");

        ExtractorConfig config = new ConfigLoader(env::get).load(write("""
                {"apiKey": "from-file", "downloadThumbnails": true, "preferGateway": false,
                 "duplicateMatch": "equality", "threadCount": 4, "requestTimeoutSeconds": 5}
                """));

        assertEquals("from-file", config.apiKey());
        assertTrue(config.downloadThumbnails());
        assertEquals(new MediaSelectionPolicy(false, DuplicateMatch.EQUALITY), config.selectionPolicy());
        assertEquals(4, config.threadCount());
        assertEquals(Duration.ofSeconds(5), config.requestTimeout());
    }

    @Test
    void rejectsInvalidConfigurations() throws Exception {
        ConfigLoader loader = new ConfigLoader(Map.<String, String>of()::get);

        assertThrows(IllegalArgumentException.class, () -> loader.load(write("{}")));
        assertThrows(IllegalArgumentException.class,
                () -> loader.load(write("{\"apiKey\": \"k\", \"s3SyncEnabled\": true}")));
        assertThrows(IllegalArgumentException.class,
                () -> loader.load(write("{\"apiKey\": \"k\", \"duplicateMatch\": \"fuzzy\"}")));
    }

    @Test
    void truthyValues() {
        assertTrue(ConfigLoader.isTruthy("TRUE"));
        assertTrue(ConfigLoader.isTruthy(" 1 "));
        assertTrue(ConfigLoader.isTruthy("yes"));
        assertFalse(ConfigLoader.isTruthy("on"));
    }

    private Path write(String json) throws Exception {
        Path file = Files.createTempFile(tempDir, "config", ".json");
        Files.writeString(file, json);
        return file;
    }
}
