package com.example.artworkextractor;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.math.BigInteger;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Local HTTP trigger for token ranges:
 * {@code GET /?NFT_CONTRACT_ADDRESS=0x..&FIRST_TOKEN_ID=1[&LAST_TOKEN_ID=5]}.
 * Token ids may be decimal or {@code 0x} hexadecimal. The range runs before the response is sent.
 */
public final class RequestListener implements AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(RequestListener.class);
    static final String CONTRACT_PARAM = "NFT_CONTRACT_ADDRESS";
    static final String FIRST_TOKEN_PARAM = "FIRST_TOKEN_ID";
    static final String LAST_TOKEN_PARAM = "LAST_TOKEN_ID";
    private static final String USAGE = "Invalid request. Provide NFT_CONTRACT_ADDRESS and FIRST_TOKEN_ID.\n";

    private final BatchRunner batchRunner;
    private final ObjectMapper mapper;
    private final HttpServer server;
    private final ExecutorService executor;

    public RequestListener(BatchRunner batchRunner, ObjectMapper mapper, int port) throws IOException {
        this.batchRunner = batchRunner;
        this.mapper = mapper;
        this.server = HttpServer.create(new InetSocketAddress("localhost", port), 0);
        this.executor = Executors.newSingleThreadExecutor();
        this.server.createContext("/", this::handle);
        this.server.setExecutor(executor);
    }

    public void start() {
        server.start();
        LOGGER.info("HTTP listener started on port {}", port());
    }

    public int port() {
        return server.getAddress().getPort();
    }

    @Override
    public void close() {
        server.stop(0);
        executor.shutdownNow();
    }

    private void handle(HttpExchange exchange) throws IOException {
        try {
            LOGGER.info("{} {} from {}", exchange.getRequestMethod(), exchange.getRequestURI(),
                    exchange.getRemoteAddress());
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                respond(exchange, 405, "text/plain", "Only GET is supported.\n".getBytes(StandardCharsets.UTF_8));
                return;
            }
            Optional<TokenRange> range = parseRange(exchange.getRequestURI().getRawQuery());
            if (range.isEmpty()) {
                respond(exchange, 400, "text/plain", USAGE.getBytes(StandardCharsets.UTF_8));
                return;
            }
            BatchSummary summary = batchRunner.run(range.get().references());
            respond(exchange, 200, "application/json", mapper.writeValueAsBytes(summary));
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            LOGGER.warn("Interrupted while processing {}", exchange.getRequestURI(), ex);
        } finally {
            exchange.close();
        }
    }

    static Optional<TokenRange> parseRange(String rawQuery) {
        Map<String, String> params = parseQuery(rawQuery);
        String contract = params.get(CONTRACT_PARAM);
        if (contract == null || contract.isBlank()) {
            return Optional.empty();
        }
        Optional<BigInteger> first = TokenIdParser.parse(params.get(FIRST_TOKEN_PARAM));
        if (first.isEmpty()) {
            return Optional.empty();
        }
        Optional<BigInteger> last = params.containsKey(LAST_TOKEN_PARAM)
                ? TokenIdParser.parse(params.get(LAST_TOKEN_PARAM))
                : first;
        return last.map(value -> new TokenRange(contract.trim(), first.get(), value));
    }

    private static Map<String, String> parseQuery(String rawQuery) {
        Map<String, String> params = new HashMap<>();
        if (rawQuery == null || rawQuery.isEmpty()) {
            return params;
        }
        for (String pair : rawQuery.split("&")) {
            int eq = pair.indexOf('=');
            String key = URLDecoder.decode(eq >= 0 ? pair.substring(0, eq) : pair, StandardCharsets.UTF_8);
            String value = eq >= 0 ? URLDecoder.decode(pair.substring(eq + 1), StandardCharsets.UTF_8) : "";
            params.putIfAbsent(key, value);
        }
        return params;
    }

    private static void respond(HttpExchange exchange, int status, String contentType, byte[] body) throws IOException {
        exchange.getResponseHeaders().set("Content-Type", contentType);
        exchange.sendResponseHeaders(status, body.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(body);
        }
    }
}
