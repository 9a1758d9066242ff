package com.example.artworkextractor;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringReader;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads token references from a shared spreadsheet through its CSV export.
 * <p>
 * Every cell of a row is tried in turn; the first one that parses as a token reference is used and
 * the rest of the row is ignored. Rows are numbered from 1, header included.
 */
public class SheetBatchSource {
    private static final Logger LOGGER = LoggerFactory.getLogger(SheetBatchSource.class);
    private static final Pattern SPREADSHEET_ID = Pattern.compile("/spreadsheets/d/([a-zA-Z0-9_-]+)");
    private static final Pattern GID = Pattern.compile("(?:^|[?&#])gid=(\\d+)");
    // Blank lines still count as rows so row numbers match the spreadsheet.
    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
            .setIgnoreEmptyLines(false)
            .build();

    private final HttpClient httpClient;
    private final Duration requestTimeout;

    public SheetBatchSource(HttpClient httpClient, Duration requestTimeout) {
        this.httpClient = httpClient;
        this.requestTimeout = requestTimeout;
    }

    /**
     * Rewrites a spreadsheet share link to its CSV export link, keeping the sheet {@code gid} (default 0).
     */
    public static String toCsvExportUrl(String sheetUrl) {
        Matcher id = SPREADSHEET_ID.matcher(sheetUrl == null ? "" : sheetUrl);
        if (!id.find()) {
            throw new IllegalArgumentException("Could not extract spreadsheet ID from URL: " + sheetUrl);
        }
        String gid = "0";
        URI uri = URI.create(sheetUrl.trim());
        for (String part : new String[]{uri.getRawQuery(), uri.getRawFragment()}) {
            if (part == null) {
                continue;
            }
            Matcher matcher = GID.matcher(part);
            if (matcher.find()) {
                gid = matcher.group(1);
            }
        }
        return "https://docs.google.com/spreadsheets/d/" + id.group(1) + "/export?format=csv&gid=" + gid;
    }

    public List<TokenReference> load(String sheetUrl, int startRow, OptionalInt count) throws IOException {
        String csvUrl = toCsvExportUrl(sheetUrl);
        LOGGER.info("Fetching sheet data from {}", csvUrl);
        HttpRequest request = HttpRequest.newBuilder(URI.create(csvUrl))
                .timeout(requestTimeout)
                .GET()
                .build();
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted fetching " + csvUrl, ex);
        }
        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            throw new IOException("Failed to fetch CSV from " + csvUrl + ". Status: " + response.statusCode());
        }
        return parse(response.body(), startRow, count);
    }

    /**
     * Collects references from {@code startRow} on, stopping after {@code count} references when given.
     */
    public static List<TokenReference> parse(String csv, int startRow, OptionalInt count) throws IOException {
        List<TokenReference> references = new ArrayList<>();
        int firstRow = Math.max(1, startRow);
        int skipped = 0;
        try (CSVParser parser = FORMAT.parse(new StringReader(csv))) {
            int rowNumber = 0;
            for (CSVRecord record : parser) {
                rowNumber++;
                if (rowNumber < firstRow) {
                    continue;
                }
                if (count.isPresent() && references.size() >= count.getAsInt()) {
                    break;
                }
                if (isEmpty(record)) {
                    LOGGER.info("Skipping empty row {}", rowNumber);
                    skipped++;
                    continue;
                }
                Optional<TokenReference> reference = firstReference(record);
                if (reference.isEmpty()) {
                    LOGGER.warn("Row {}: no token reference found in {}", rowNumber, record.toList());
                    skipped++;
                    continue;
                }
                references.add(reference.get());
            }
        }
        LOGGER.info("Sheet yielded {} token references ({} rows skipped)", references.size(), skipped);
        return references;
    }

    private static Optional<TokenReference> firstReference(CSVRecord record) {
        for (String cell : record) {
            Optional<TokenReference> reference = TokenReferenceParser.parse(cell);
            if (reference.isPresent()) {
                return reference;
            }
        }
        return Optional.empty();
    }

    private static boolean isEmpty(CSVRecord record) {
        for (String cell : record) {
            if (cell != null && !cell.isBlank()) {
                return false;
            }
        }
        return true;
    }
}
