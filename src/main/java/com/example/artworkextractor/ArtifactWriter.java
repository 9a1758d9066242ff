package com.example.artworkextractor;

import com.example.artworkextractor.model.ArtifactRole;
import com.example.artworkextractor.model.ResolvedMedia;
import com.example.artworkextractor.model.WriteResult;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Writes token artifacts into one flat output directory.
 * <p>
 * Media downloads are skipped when the destination already exists, so re-running a resolution does
 * not fetch the same bytes again. A download, body and redirects included, must finish within the
 * request timeout. Both media and JSON are staged in a temporary file and moved into place, so an
 * interrupted run never leaves a partial file under a final name.
 */
public class ArtifactWriter {
    private static final Logger LOGGER = LoggerFactory.getLogger(ArtifactWriter.class);
    private static final String IPFS_GATEWAY = "https://ipfs.io/ipfs/";
    private static final int MAX_REDIRECTS = 5;

    private final Path outputDirectory;
    private final HttpClient httpClient;
    private final HttpClient relaxedTlsClient;
    private final Duration requestTimeout;
    private final ObjectWriter jsonWriter;
    private volatile boolean directoryReady;

    public ArtifactWriter(Path outputDirectory,
                          HttpClient httpClient,
                          HttpClient relaxedTlsClient,
                          Duration requestTimeout) {
        this.outputDirectory = outputDirectory;
        this.httpClient = httpClient;
        this.relaxedTlsClient = relaxedTlsClient;
        this.requestTimeout = requestTimeout;
        this.jsonWriter = jsonMapper().writer(prettyPrinter());
    }

    public ArtifactWriter(Path outputDirectory, Duration requestTimeout) {
        this(outputDirectory,
                HttpClientFactory.standard(requestTimeout),
                HttpClientFactory.trustingAllCertificates(requestTimeout),
                requestTimeout);
    }

    /**
     * Shared mapper settings for every JSON file the tool writes.
     */
    public static ObjectMapper jsonMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
    }

    public Path pathFor(String baseName, ArtifactRole role, String extension) {
        return outputDirectory.resolve(role.fileName(baseName, extension));
    }

    /**
     * Downloads {@code media} to {@code <baseName>[-thumbnail].<extension>} unless that file already exists.
     */
    public WriteResult download(String baseName, ResolvedMedia media) throws IOException {
        Path target = pathFor(baseName, media.role(), media.extension());
        ensureOutputDirectory();
        if (Files.exists(target)) {
            long size = Files.size(target);
            LOGGER.info("Skipping download of {}; {} already exists ({} bytes)", media.url(), target, size);
            return new WriteResult(target, size, true);
        }

        URI uri = toFetchUri(media.url());
        LOGGER.debug("Downloading {} from {}", media.role(), uri);
        Path temp = Files.createTempFile(outputDirectory, ".download-", ".part");
        try {
            long deadline = System.nanoTime() + requestTimeout.toNanos();
            for (int hop = 0; ; hop++) {
                HttpResponse<Path> response = fetch(media.url(), uri, temp, deadline);
                int status = response.statusCode();
                Optional<String> location = response.headers().firstValue("Location");
                if (status >= 300 && status < 400 && location.isPresent() && hop < MAX_REDIRECTS) {
                    // The relaxed client hands redirects back; each hop picks the client for its own host.
                    uri = resolveRedirect(media.url(), uri, location.get());
                    LOGGER.debug("Following redirect to {}", uri);
                    continue;
                }
                if (status < 200 || status >= 300) {
                    throw new DownloadException(media.url(), status);
                }
                break;
            }
            moveIntoPlace(temp, target);
        } catch (DownloadException ex) {
            throw ex;
        } catch (IOException ex) {
            throw new DownloadException(media.url(), ex);
        } finally {
            Files.deleteIfExists(temp);
        }

        long size = Files.size(target);
        LOGGER.info("Saved {} ({} bytes)", target, size);
        return new WriteResult(target, size, false);
    }

    /**
     * Serializes {@code value} as indented JSON to {@code <baseName>[-token].json}, replacing any previous file.
     */
    public WriteResult writeJson(String baseName, ArtifactRole role, Object value) throws IOException {
        Path target = pathFor(baseName, role, "json");
        ensureOutputDirectory();
        Path temp = Files.createTempFile(outputDirectory, ".json-", ".part");
        try {
            jsonWriter.writeValue(temp.toFile(), value);
            moveIntoPlace(temp, target);
        } finally {
            Files.deleteIfExists(temp);
        }
        long size = Files.size(target);
        LOGGER.info("Saved {} ({} bytes)", target, size);
        return new WriteResult(target, size, false);
    }

    public Path outputDirectory() {
        return outputDirectory;
    }

    static boolean requiresRelaxedTls(URI uri) {
        String host = uri.getHost();
        return "https".equalsIgnoreCase(uri.getScheme())
                && host != null
                && host.toLowerCase(Locale.ROOT).startsWith("ipfs.");
    }

    /**
     * Maps {@code ipfs://} content addresses onto the public HTTPS gateway; other URLs pass through.
     */
    static URI toFetchUri(String url) throws DownloadException {
        String trimmed = url.trim();
        if (trimmed.regionMatches(true, 0, "ipfs://", 0, "ipfs://".length())) {
            String content = trimmed.substring("ipfs://".length());
            if (content.startsWith("ipfs/")) {
                content = content.substring("ipfs/".length());
            }
            trimmed = IPFS_GATEWAY + content;
        }
        try {
            URI uri = URI.create(trimmed);
            if (uri.getScheme() == null || uri.getHost() == null) {
                throw new IllegalArgumentException("not an absolute URL");
            }
            return uri;
        } catch (IllegalArgumentException ex) {
            throw new DownloadException(url, ex);
        }
    }

    /**
     * One request/response exchange. The request timeout only bounds the wait for headers, so the
     * whole exchange, body included, is also held to {@code deadlineNanos}.
     */
    private HttpResponse<Path> fetch(String url, URI uri, Path temp, long deadlineNanos) throws DownloadException {
        HttpRequest request = HttpRequest.newBuilder(uri)
                .timeout(requestTimeout)
                .GET()
                .build();
        HttpClient client = requiresRelaxedTls(uri) ? relaxedTlsClient : httpClient;
        CompletableFuture<HttpResponse<Path>> exchange = client.sendAsync(request,
                HttpResponse.BodyHandlers.ofFile(temp,
                        StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING));
        try {
            return exchange.get(Math.max(0L, deadlineNanos - System.nanoTime()), TimeUnit.NANOSECONDS);
        } catch (TimeoutException ex) {
            exchange.cancel(true);
            throw new DownloadException(url, ex);
        } catch (ExecutionException ex) {
            throw new DownloadException(url, ex.getCause() == null ? ex : ex.getCause());
        } catch (InterruptedException ex) {
            exchange.cancel(true);
            Thread.currentThread().interrupt();
            throw new DownloadException(url, ex);
        }
    }

    private static URI resolveRedirect(String url, URI current, String location) throws DownloadException {
        try {
            URI next = current.resolve(location.trim());
            if (next.getScheme() == null || next.getHost() == null) {
                throw new IllegalArgumentException("redirect to a non-absolute location: " + location);
            }
            return next;
        } catch (IllegalArgumentException ex) {
            throw new DownloadException(url, ex);
        }
    }

    private void ensureOutputDirectory() throws IOException {
        if (!directoryReady) {
            synchronized (this) {
                if (!directoryReady) {
                    Files.createDirectories(outputDirectory);
                    directoryReady = true;
                }
            }
        }
    }

    private static void moveIntoPlace(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException ex) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static DefaultPrettyPrinter prettyPrinter() {
        DefaultIndenter indenter = new DefaultIndenter("    ", DefaultIndenter.SYS_LF);
        return new DefaultPrettyPrinter()
                .withObjectIndenter(indenter)
                .withArrayIndenter(indenter);
    }
}
