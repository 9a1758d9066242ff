package com.example.artworkextractor;

import com.example.artworkextractor.model.MetadataDocument;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class AlchemyMetadataFetcherTest {
    private static final String PATH = "/nft/v2/secret/getNFTMetadata";

    @Test
    void returnsDocumentOnSuccess() throws Exception {
        try (StubHttpServer server = new StubHttpServer()
                .serveJson(PATH, 200, "{\"title\": \"Sunset\", \"metadata\": {\"name\": \"Sunset #1\"}}")) {
            MetadataDocument document = fetcher(server).fetch("0xabc", "1");

            assertEquals("Sunset #1", document.text("metadata", "name").orElseThrow());
            assertEquals(1, server.hits(PATH));
        }
    }

    @Test
    void mapsProviderFailures() throws Exception {
        assertEquals(MetadataFetchException.Kind.NOT_FOUND, failureFor(404, "{}"));
        assertEquals(MetadataFetchException.Kind.RATE_LIMITED, failureFor(429, "{}"));
        assertEquals(MetadataFetchException.Kind.UPSTREAM, failureFor(500, "{}"));
        assertEquals(MetadataFetchException.Kind.UPSTREAM, failureFor(200, "not json"));
        assertEquals(MetadataFetchException.Kind.UPSTREAM, failureFor(200, "[1, 2]"));
    }

    @Test
    void buildsRequestWithEncodedParameters() {
        AlchemyMetadataFetcher fetcher = new AlchemyMetadataFetcher(
                HttpClientFactory.standard(Duration.ofSeconds(1)), new ObjectMapper(),
                "https://eth-mainnet.g.alchemy.com/nft/v2/", "k y", Duration.ofSeconds(1));

        assertEquals("https://eth-mainnet.g.alchemy.com/nft/v2/k+y/getNFTMetadata?contractAddress=0xabc&tokenId=12&refreshCache=false",
                fetcher.requestUri("0xabc", "12").toString());
    }

    private MetadataFetchException.Kind failureFor(int status, String body) throws Exception {
        try (StubHttpServer server = new StubHttpServer().serveJson(PATH, status, body)) {
            AlchemyMetadataFetcher fetcher = fetcher(server);
            return assertThrows(MetadataFetchException.class, () -> fetcher.fetch("0xabc", "1")).kind();
        }
    }

    private static AlchemyMetadataFetcher fetcher(StubHttpServer server) {
        return new AlchemyMetadataFetcher(
                HttpClientFactory.standard(Duration.ofSeconds(5)),
                new ObjectMapper(),
                server.url("/nft/v2"),
                "secret",
                Duration.ofSeconds(5));
    }
}
