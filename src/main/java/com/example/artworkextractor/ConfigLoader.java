package com.example.artworkextractor;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Function;

public class ConfigLoader {
    static final String API_KEY_ENV = "ALCHEMY_API_KEY";
    static final String DOWNLOAD_THUMBNAILS_ENV = "DOWNLOAD_THUMBNAILS";
    private static final String DEFAULT_OUTPUT_DIRECTORY = "artwork";
    private static final String DEFAULT_PROVIDER_BASE_URL = "https://eth-mainnet.g.alchemy.com/nft/v2";
    private static final int DEFAULT_THREAD_COUNT = 1;
    private static final int DEFAULT_REQUEST_TIMEOUT_SECONDS = 60;
    private static final int DEFAULT_LISTENER_PORT = 3128;

    private final ObjectMapper mapper;
    private final Function<String, String> environment;

    public ConfigLoader() {
        this(System::getenv);
    }

    ConfigLoader(Function<String, String> environment) {
        this.mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.environment = environment;
    }

    public ExtractorConfig load(Path path) throws IOException {
        RawConfig raw = mapper.readValue(path.toFile(), RawConfig.class);

        String apiKey = Optional.ofNullable(raw.apiKey)
                .filter(value -> !value.isBlank())
                .or(() -> Optional.ofNullable(environment.apply(API_KEY_ENV)).filter(value -> !value.isBlank()))
                .orElseThrow(() -> new IllegalArgumentException(
                        "apiKey must be set in the config file or the " + API_KEY_ENV + " environment variable."));

        Path outputDirectory = Path.of(optionalString(raw.outputDirectory, DEFAULT_OUTPUT_DIRECTORY));
        boolean downloadThumbnails = raw.downloadThumbnails != null
                ? raw.downloadThumbnails
                : Optional.ofNullable(environment.apply(DOWNLOAD_THUMBNAILS_ENV))
                        .map(ConfigLoader::isTruthy)
                        .orElse(true);
        String providerBaseUrl = optionalString(raw.providerBaseUrl, DEFAULT_PROVIDER_BASE_URL);
        int threadCount = raw.threadCount != null && raw.threadCount > 0
                ? raw.threadCount
                : DEFAULT_THREAD_COUNT;
        Duration requestTimeout = Duration.ofSeconds(raw.requestTimeoutSeconds != null && raw.requestTimeoutSeconds > 0
                ? raw.requestTimeoutSeconds
                : DEFAULT_REQUEST_TIMEOUT_SECONDS);
        MediaSelectionPolicy policy = new MediaSelectionPolicy(
                raw.preferGateway == null || raw.preferGateway,
                parseDuplicateMatch(raw.duplicateMatch)
        );
        int listenerPort = raw.listenerPort != null && raw.listenerPort >= 0
                ? raw.listenerPort
                : DEFAULT_LISTENER_PORT;

        boolean s3SyncEnabled = raw.s3SyncEnabled != null && raw.s3SyncEnabled;
        Optional<String> s3Bucket = Optional.ofNullable(raw.s3Bucket).filter(value -> !value.isBlank());
        Optional<String> s3Prefix = Optional.ofNullable(raw.s3Prefix).filter(value -> !value.isBlank());
        Optional<String> s3Region = Optional.ofNullable(raw.s3Region).filter(value -> !value.isBlank());
        if (s3SyncEnabled && s3Bucket.isEmpty()) {
            throw new IllegalArgumentException("s3Bucket is required when s3SyncEnabled is true.");
        }

        return new ExtractorConfig(
                apiKey,
                outputDirectory,
                downloadThumbnails,
                providerBaseUrl,
                threadCount,
                requestTimeout,
                policy,
                listenerPort,
                s3SyncEnabled,
                s3Bucket,
                s3Prefix,
                s3Region
        );
    }

    static boolean isTruthy(String value) {
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return normalized.equals("true") || normalized.equals("1") || normalized.equals("yes");
    }

    private DuplicateMatch parseDuplicateMatch(String value) {
        if (value == null || value.isBlank()) {
            return MediaSelectionPolicy.defaults().duplicateMatch();
        }
        try {
            return DuplicateMatch.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unknown duplicateMatch rule: " + value, ex);
        }
    }

    private String optionalString(String value, String fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        return value;
    }

    private static class RawConfig {
        public String apiKey;
        public String outputDirectory;
        public Boolean downloadThumbnails;
        public String providerBaseUrl;
        public Integer threadCount;
        public Integer requestTimeoutSeconds;
        public Boolean preferGateway;
        public String duplicateMatch;
        public Integer listenerPort;
        public Boolean s3SyncEnabled;
        public String s3Bucket;
        public String s3Prefix;
        public String s3Region;
    }
}
