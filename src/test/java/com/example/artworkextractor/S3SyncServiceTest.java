package com.example.artworkextractor;

import com.example.artworkextractor.model.ArtifactManifest;
import com.example.artworkextractor.model.ArtifactRole;
import com.example.artworkextractor.model.ManifestEntry;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class S3SyncServiceTest {
    @TempDir
    Path tempDir;

    @Test
    void mirrorsArtifactsAndManifestUnderTheTokenPrefix() throws Exception {
        S3Client client = mock(S3Client.class);
        Path media = Files.write(tempDir.resolve("Sunset.png"), new byte[]{(byte) 0x89, 0x50, 0x4E, 0x47});
        Path metadata = Files.writeString(tempDir.resolve("Sunset.json"), "{}");
        ArtifactManifest manifest = new ArtifactManifest("0xabc", "7", "Sunset", List.of(
                new ManifestEntry(ArtifactRole.PRIMARY, media.toString(), 4, ManifestEntry.Status.SKIPPED, "https://cdn/a.png", null),
                ManifestEntry.failed(ArtifactRole.THUMBNAIL, tempDir.resolve("Sunset-thumbnail.png").toString(), "https://cdn/b.png", "HTTP 404"),
                new ManifestEntry(ArtifactRole.METADATA, metadata.toString(), 2, ManifestEntry.Status.WRITTEN, null, null)
        ));

        S3SyncService service = new S3SyncService(client, "bucket", "/artwork/");
        service.sync(manifest);
        service.close();

        ArgumentCaptor<PutObjectRequest> requests = ArgumentCaptor.forClass(PutObjectRequest.class);
        ArgumentCaptor<RequestBody> bodies = ArgumentCaptor.forClass(RequestBody.class);
        verify(client, times(3)).putObject(requests.capture(), bodies.capture());
        assertEquals(List.of("artwork/0xabc/7/Sunset.png", "artwork/0xabc/7/Sunset.json", "artwork/0xabc/7/manifest.json"),
                requests.getAllValues().stream().map(PutObjectRequest::key).toList());
        assertEquals(List.of("image/png", "application/json", "application/json"),
                requests.getAllValues().stream().map(PutObjectRequest::contentType).toList());
        assertEquals("bucket", requests.getValue().bucket());

        JsonNode uploaded;
        try (InputStream in = bodies.getAllValues().get(2).contentStreamProvider().newStream()) {
            uploaded = new ObjectMapper().readTree(in);
        }
        assertEquals("0xabc", uploaded.get("contractAddress").asText());
        JsonNode artifacts = uploaded.get("artifacts");
        assertEquals(3, artifacts.size());
        assertEquals("artwork/0xabc/7/Sunset.png", artifacts.get(0).get("key").asText());
        assertEquals("FAILED", artifacts.get(1).get("status").asText());
        assertFalse(artifacts.get(1).has("key"));
        verify(client).close();
    }

    @Test
    void failedUploadIsLeftOutOfTheManifestKeys() throws Exception {
        S3Client client = mock(S3Client.class);
        when(client.putObject(any(PutObjectRequest.class), any(RequestBody.class)))
                .thenThrow(new IllegalStateException("denied"))
                .thenReturn(null);
        Path metadata = Files.writeString(tempDir.resolve("a.json"), "{}");
        ArtifactManifest manifest = new ArtifactManifest("0xabc", "1", "a", List.of(
                new ManifestEntry(ArtifactRole.METADATA, metadata.toString(), 2, ManifestEntry.Status.WRITTEN, null, null)));

        S3SyncService service = new S3SyncService(client, "bucket", "");
        service.sync(manifest);
        service.close();

        ArgumentCaptor<RequestBody> bodies = ArgumentCaptor.forClass(RequestBody.class);
        verify(client, times(2)).putObject(any(PutObjectRequest.class), bodies.capture());
        JsonNode uploaded;
        try (InputStream in = bodies.getAllValues().get(1).contentStreamProvider().newStream()) {
            uploaded = new ObjectMapper().readTree(in);
        }
        assertFalse(uploaded.get("artifacts").get(0).has("key"));
    }

    @Test
    void ignoresManifestsSyncedAfterClose() {
        S3Client client = mock(S3Client.class);
        S3SyncService service = new S3SyncService(client, "bucket", null);
        service.close();
        ArtifactManifest late = new ArtifactManifest("0xabc", "9", "late", List.of());

        service.sync(late);

        verify(client, never()).putObject(any(PutObjectRequest.class), any(RequestBody.class));
        assertEquals("0xabc/9/late.json", service.keyFor(late, "late.json"));
    }
}
