package com.example.artworkextractor;

import com.example.artworkextractor.model.ArtifactManifest;
import com.example.artworkextractor.model.MetadataDocument;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BatchRunnerTest {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    @TempDir
    Path output;

    @Test
    void oneFailingTokenDoesNotStopTheBatch() throws Exception {
        MetadataFetcher fetcher = (contract, tokenId) -> {
            if (tokenId.equals("2")) {
                throw new MetadataFetchException(MetadataFetchException.Kind.NOT_FOUND, "missing");
            }
            if (tokenId.equals("3")) {
                throw new IllegalStateException("provider returned garbage");
            }
            return piece(tokenId);
        };

        BatchSummary summary = runner(fetcher, 3).run(List.of(
                new TokenReference("0xabc", "1"),
                new TokenReference("0xabc", "2"),
                new TokenReference("0xabc", "3"),
                new TokenReference("0xabc", "4")
        ));

        assertEquals(2, summary.processed());
        assertEquals(2, summary.failed());
        assertEquals(List.of("Piece-1", "Piece-4"),
                summary.manifests().stream().map(ArtifactManifest::baseName).toList());
        assertTrue(Files.exists(output.resolve("Piece-1.json")));
        assertTrue(Files.exists(output.resolve("Piece-4-token.json")));
        assertFalse(summary.finishedAt().isBefore(summary.startedAt()));
    }

    @Test
    void emptyBatchProducesEmptySummary() throws Exception {
        BatchSummary summary = runner((contract, tokenId) -> {
            throw new AssertionError("not called");
        }, 1).run(List.of());

        assertEquals(0, summary.processed());
        assertEquals(0, summary.failed());
    }

    private static MetadataDocument piece(String tokenId) {
        ObjectNode root = MAPPER.createObjectNode();
        root.putObject("metadata").put("name", "Piece " + tokenId);
        return MetadataDocument.of(root);
    }

    private BatchRunner runner(MetadataFetcher fetcher, int threads) {
        ResourceOrchestrator orchestrator = new ResourceOrchestrator(
                new MediaSelector(),
                new ExtensionResolver(),
                new ArtifactWriter(output, Duration.ofSeconds(5)));
        return new BatchRunner(fetcher, orchestrator, ResolutionOptions.defaults(), threads);
    }
}
