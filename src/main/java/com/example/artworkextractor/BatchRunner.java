package com.example.artworkextractor;

import com.example.artworkextractor.model.ArtifactManifest;
import com.example.artworkextractor.model.MetadataDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Fetches and resolves a sequence of tokens on a bounded worker pool.
 * A token whose metadata cannot be fetched is counted as failed; the rest of the batch continues.
 */
public final class BatchRunner {
    private static final Logger LOGGER = LoggerFactory.getLogger(BatchRunner.class);

    private final MetadataFetcher fetcher;
    private final ResourceOrchestrator orchestrator;
    private final ResolutionOptions options;
    private final int threadCount;

    public BatchRunner(MetadataFetcher fetcher,
                       ResourceOrchestrator orchestrator,
                       ResolutionOptions options,
                       int threadCount) {
        this.fetcher = fetcher;
        this.orchestrator = orchestrator;
        this.options = options;
        this.threadCount = Math.max(1, threadCount);
    }

    public BatchSummary run(List<TokenReference> references) throws InterruptedException {
        Instant startedAt = Instant.now();
        LOGGER.info("Processing {} tokens with {} worker(s)", references.size(), threadCount);
        ExecutorService executor = Executors.newFixedThreadPool(threadCount);
        List<Future<Optional<ArtifactManifest>>> futures = new ArrayList<>(references.size());
        try {
            for (TokenReference reference : references) {
                futures.add(executor.submit(() -> resolve(reference)));
            }
            List<ArtifactManifest> manifests = new ArrayList<>();
            int failed = 0;
            for (int i = 0; i < futures.size(); i++) {
                Optional<ArtifactManifest> manifest = await(futures.get(i), references.get(i));
                if (manifest.isPresent()) {
                    manifests.add(manifest.get());
                } else {
                    failed++;
                }
            }
            BatchSummary summary = new BatchSummary(manifests.size(), failed, startedAt, Instant.now(), manifests);
            LOGGER.info("Batch finished. Processed: {}, Failed: {}", summary.processed(), summary.failed());
            return summary;
        } finally {
            executor.shutdownNow();
        }
    }

    private Optional<ArtifactManifest> resolve(TokenReference reference) {
        MetadataDocument document;
        try {
            document = fetcher.fetch(reference.contractAddress(), reference.tokenId());
        } catch (MetadataFetchException ex) {
            LOGGER.warn("Skipping {}: {} ({})", reference, ex.getMessage(), ex.kind());
            return Optional.empty();
        }
        return Optional.of(orchestrator.resolveAndSave(
                document, reference.tokenId(), reference.contractAddress(), options));
    }

    private Optional<ArtifactManifest> await(Future<Optional<ArtifactManifest>> future, TokenReference reference)
            throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException ex) {
            LOGGER.error("Unexpected failure resolving {}", reference, ex.getCause());
            return Optional.empty();
        }
    }
}
