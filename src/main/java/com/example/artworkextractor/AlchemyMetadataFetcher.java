package com.example.artworkextractor;

import com.example.artworkextractor.model.MetadataDocument;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Fetches token metadata from the Alchemy NFT API ({@code getNFTMetadata}).
 */
public final class AlchemyMetadataFetcher implements MetadataFetcher {
    private static final Logger LOGGER = LoggerFactory.getLogger(AlchemyMetadataFetcher.class);

    private final HttpClient httpClient;
    private final ObjectMapper mapper;
    private final String baseUrl;
    private final String apiKey;
    private final Duration requestTimeout;

    public AlchemyMetadataFetcher(HttpClient httpClient,
                                  ObjectMapper mapper,
                                  String baseUrl,
                                  String apiKey,
                                  Duration requestTimeout) {
        this.httpClient = httpClient;
        this.mapper = mapper;
        this.baseUrl = baseUrl.replaceAll("/+$", "");
        this.apiKey = apiKey;
        this.requestTimeout = requestTimeout;
    }

    @Override
    public MetadataDocument fetch(String contractAddress, String tokenId) throws MetadataFetchException {
        URI uri = requestUri(contractAddress, tokenId);
        HttpRequest request = HttpRequest.newBuilder(uri)
                .timeout(requestTimeout)
                .header("Accept", "application/json")
                .GET()
                .build();
        LOGGER.debug("Fetching metadata for {}/{}", contractAddress, tokenId);
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException ex) {
            throw new MetadataFetchException(MetadataFetchException.Kind.UPSTREAM,
                    "Metadata request failed for " + contractAddress + "/" + tokenId, ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new MetadataFetchException(MetadataFetchException.Kind.UPSTREAM,
                    "Interrupted fetching metadata for " + contractAddress + "/" + tokenId, ex);
        }

        int status = response.statusCode();
        if (status == 404) {
            throw new MetadataFetchException(MetadataFetchException.Kind.NOT_FOUND,
                    "No metadata for " + contractAddress + "/" + tokenId);
        }
        if (status == 429) {
            throw new MetadataFetchException(MetadataFetchException.Kind.RATE_LIMITED,
                    "Rate limited fetching " + contractAddress + "/" + tokenId);
        }
        if (status < 200 || status >= 300) {
            throw new MetadataFetchException(MetadataFetchException.Kind.UPSTREAM,
                    "Failed to fetch metadata for " + contractAddress + "/" + tokenId + ". Status: " + status);
        }
        try {
            JsonNode root = mapper.readTree(response.body());
            if (root == null || !root.isObject()) {
                throw new MetadataFetchException(MetadataFetchException.Kind.UPSTREAM,
                        "Metadata response for " + contractAddress + "/" + tokenId + " is not a JSON object");
            }
            return MetadataDocument.of(root);
        } catch (MetadataFetchException ex) {
            throw ex;
        } catch (IOException ex) {
            throw new MetadataFetchException(MetadataFetchException.Kind.UPSTREAM,
                    "Malformed metadata response for " + contractAddress + "/" + tokenId, ex);
        }
    }

    URI requestUri(String contractAddress, String tokenId) {
        return URI.create(baseUrl + "/" + encode(apiKey) + "/getNFTMetadata"
                + "?contractAddress=" + encode(contractAddress)
                + "&tokenId=" + encode(tokenId)
                + "&refreshCache=false");
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
