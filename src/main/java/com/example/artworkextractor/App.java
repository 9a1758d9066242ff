package com.example.artworkextractor;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.net.http.HttpClient;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.OptionalInt;
import java.util.concurrent.CountDownLatch;

public final class App {
    private static final Logger LOGGER = LoggerFactory.getLogger(App.class);
    private static final String USAGE = String.join(System.lineSeparator(),
            "Usage: java -jar artwork-extractor.jar <config.json> [command]",
            "  range <contractAddress> <firstTokenId> [lastTokenId]",
            "  sheet <sheetUrl> [startRow] [count]",
            "  listen   (default)");

    private App() {
    }

    public static void main(String[] args) throws Exception {
        if (args.length < 1) {
            LOGGER.error(USAGE);
            System.exit(1);
        }
        ExtractorConfig config = new ConfigLoader().load(Path.of(args[0]));
        String command = args.length > 1 ? args[1] : "listen";
        List<String> commandArgs = Arrays.asList(args).subList(Math.min(args.length, 2), args.length);

        ObjectMapper mapper = ArtifactWriter.jsonMapper();
        HttpClient httpClient = HttpClientFactory.standard(config.requestTimeout());
        ArtifactSyncer syncer = ArtifactSyncer.noop();
        if (config.s3SyncEnabled()) {
            syncer = new S3SyncService(
                    config.s3Bucket().orElseThrow(),
                    config.s3Prefix().orElse(""),
                    config.s3Region()
            );
        }

        try {
            ArtifactWriter writer = new ArtifactWriter(config.outputDirectory(), config.requestTimeout());
            ResourceOrchestrator orchestrator = new ResourceOrchestrator(
                    new MediaSelector(config.selectionPolicy()),
                    new ExtensionResolver(),
                    writer,
                    syncer
            );
            MetadataFetcher fetcher = new AlchemyMetadataFetcher(
                    httpClient, mapper, config.providerBaseUrl(), config.apiKey(), config.requestTimeout());
            BatchRunner runner = new BatchRunner(
                    fetcher, orchestrator, new ResolutionOptions(config.downloadThumbnails()), config.threadCount());

            switch (command) {
                case "range" -> runRange(runner, commandArgs);
                case "sheet" -> runSheet(runner, new SheetBatchSource(httpClient, config.requestTimeout()), commandArgs);
                case "listen" -> listen(runner, mapper, config.listenerPort());
                default -> {
                    LOGGER.error("Unknown command '{}'.{}{}", command, System.lineSeparator(), USAGE);
                    System.exit(1);
                }
            }
        } finally {
            syncer.close();
        }
    }

    private static void runRange(BatchRunner runner, List<String> args) throws InterruptedException {
        if (args.size() < 2) {
            throw new IllegalArgumentException(USAGE);
        }
        BigInteger first = TokenIdParser.parse(args.get(1))
                .orElseThrow(() -> new IllegalArgumentException("Invalid first token id: " + args.get(1)));
        BigInteger last = args.size() > 2
                ? TokenIdParser.parse(args.get(2))
                        .orElseThrow(() -> new IllegalArgumentException("Invalid last token id: " + args.get(2)))
                : first;
        runner.run(new TokenRange(args.get(0), first, last).references());
    }

    private static void runSheet(BatchRunner runner, SheetBatchSource source, List<String> args) throws Exception {
        if (args.isEmpty()) {
            throw new IllegalArgumentException(USAGE);
        }
        int startRow = args.size() > 1 ? Integer.parseInt(args.get(1)) : 1;
        OptionalInt count = args.size() > 2 ? OptionalInt.of(Integer.parseInt(args.get(2))) : OptionalInt.empty();
        LOGGER.info("Sheet: {}, start row: {}, count: {}", args.get(0), startRow,
                count.isPresent() ? count.getAsInt() : "all");
        runner.run(source.load(args.get(0), startRow, count));
    }

    private static void listen(BatchRunner runner, ObjectMapper mapper, int port) throws Exception {
        CountDownLatch shutdown = new CountDownLatch(1);
        try (RequestListener listener = new RequestListener(runner, mapper, port)) {
            Runtime.getRuntime().addShutdownHook(new Thread(shutdown::countDown, "listener-shutdown"));
            listener.start();
            shutdown.await();
        }
    }
}
