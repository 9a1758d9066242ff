package com.example.artworkextractor;

import com.example.artworkextractor.model.ArtifactManifest;
import com.example.artworkextractor.model.ManifestEntry;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.apache.tika.Tika;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Mirrors each resolved token to S3 under {@code <prefix>/<contract>/<tokenId>/}: every artifact that is on
 * disk, plus a {@code manifest.json} describing the token's artifacts by object key.
 * <p>
 * Uploads run on one background worker so a slow bucket never holds up resolution. Failed uploads are
 * logged and left out of the uploaded manifest's keys; they are never retried.
 */
public final class S3SyncService implements ArtifactSyncer {
    private static final Logger LOGGER = LoggerFactory.getLogger(S3SyncService.class);
    static final String MANIFEST_NAME = "manifest.json";

    private final S3Client s3Client;
    private final String bucket;
    private final String prefix;
    private final ObjectMapper mapper = ArtifactWriter.jsonMapper();
    private final Tika tika = new Tika();
    private final ExecutorService worker = Executors.newSingleThreadExecutor(task -> new Thread(task, "s3-sync"));

    public S3SyncService(String bucket, String prefix, Optional<String> region) {
        this(region
                .map(Region::of)
                .map(r -> S3Client.builder().region(r).build())
                .orElseGet(() -> S3Client.builder().build()), bucket, prefix);
    }

    S3SyncService(S3Client s3Client, String bucket, String prefix) {
        this.s3Client = s3Client;
        this.bucket = bucket;
        this.prefix = prefix == null ? "" : prefix.replaceAll("^/+|/+$", "");
    }

    @Override
    public void sync(ArtifactManifest manifest) {
        try {
            worker.execute(() -> mirror(manifest));
        } catch (RejectedExecutionException ex) {
            LOGGER.warn("Not mirroring {}/{}: the sync service is closed", manifest.contractAddress(), manifest.tokenId());
        }
    }

    /**
     * Finishes every token already handed over, then releases the client.
     */
    @Override
    public void close() {
        worker.shutdown();
        try {
            if (!worker.awaitTermination(10, TimeUnit.MINUTES)) {
                LOGGER.warn("S3 mirroring did not finish in time; {} tokens dropped", worker.shutdownNow().size());
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            worker.shutdownNow();
            LOGGER.warn("Interrupted while waiting for S3 mirroring to finish", ex);
        } finally {
            s3Client.close();
        }
    }

    private void mirror(ArtifactManifest manifest) {
        ObjectNode document = mapper.createObjectNode()
                .put("contractAddress", manifest.contractAddress())
                .put("tokenId", manifest.tokenId())
                .put("baseName", manifest.baseName());
        ArrayNode artifacts = document.putArray("artifacts");
        int uploaded = 0;
        int attempted = 0;
        for (ManifestEntry entry : manifest.entries()) {
            ObjectNode artifact = mapper.valueToTree(entry);
            artifacts.add(artifact);
            if (entry.isFailure()) {
                continue;
            }
            Path path = Path.of(entry.path());
            String key = keyFor(manifest, path.getFileName().toString());
            attempted++;
            if (!Files.isRegularFile(path)) {
                LOGGER.warn("Not uploading {}: file is gone", path);
                continue;
            }
            if (put(key, contentType(path), RequestBody.fromFile(path), path.toString())) {
                artifact.put("key", key);
                uploaded++;
            }
        }

        try {
            byte[] body = mapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(document);
            put(keyFor(manifest, MANIFEST_NAME), "application/json", RequestBody.fromBytes(body), MANIFEST_NAME);
        } catch (JsonProcessingException ex) {
            LOGGER.warn("Could not serialize the S3 manifest of {}/{}", manifest.contractAddress(), manifest.tokenId(), ex);
        }
        LOGGER.info("Mirrored {}/{} artifacts of {}/{} to s3://{}/{}", uploaded, attempted,
                manifest.contractAddress(), manifest.tokenId(), bucket, keyFor(manifest, ""));
    }

    private boolean put(String key, String contentType, RequestBody body, String source) {
        try {
            s3Client.putObject(PutObjectRequest.builder()
                    .bucket(bucket)
                    .key(key)
                    .contentType(contentType)
                    .build(), body);
            LOGGER.debug("Uploaded {} to s3://{}/{}", source, bucket, key);
            return true;
        } catch (RuntimeException ex) {
            LOGGER.warn("Failed to upload {} to s3://{}/{}", source, bucket, key, ex);
            return false;
        }
    }

    String keyFor(ArtifactManifest manifest, String fileName) {
        String tokenPath = manifest.contractAddress() + "/" + manifest.tokenId() + "/" + fileName;
        return prefix.isEmpty() ? tokenPath : prefix + "/" + tokenPath;
    }

    String contentType(Path path) {
        String detected = tika.detect(path.getFileName().toString());
        if ("application/octet-stream".equals(detected) && Files.isRegularFile(path)) {
            try {
                detected = tika.detect(path);
            } catch (IOException ex) {
                LOGGER.debug("Could not sniff {}", path, ex);
            }
        }
        return detected;
    }
}
