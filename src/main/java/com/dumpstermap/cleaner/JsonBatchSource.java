package com.dumpstermap.cleaner;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Reads raw listing batches from a directory of JSON files, one file per state.
 * <p>
 * Each file holds either a JSON array of records or an object with a {@code providers} array. The pull summary
 * file ({@value #SUMMARY_FILE}) is skipped. The batch source name comes from the file name via
 * {@link Utils#sourceNameFromFile(String)}.
 *
 * @author DumpsterMap Data Team
 * @since 1.0
 */
public class JsonBatchSource implements ListingSourceInterface {
    private static final Logger logger = LoggerFactory.getLogger(JsonBatchSource.class);

    static final String SUMMARY_FILE = "pull_summary.json";

    private static final TypeReference<List<Map<String, Object>>> RECORDS = new TypeReference<>() {};

    private final ObjectMapper mapper;

    public JsonBatchSource() {
        this(new ObjectMapper());
    }

    public JsonBatchSource(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public List<ListingBatch> loadBatches(Path rawDir) throws IOException {
        if (rawDir == null || !Files.isDirectory(rawDir)) {
            throw new IOException("Raw data directory not found: " + rawDir);
        }
        List<Path> files;
        try (Stream<Path> entries = Files.list(rawDir)) {
            files = entries
                .filter(p -> p.getFileName().toString().endsWith(".json"))
                .filter(p -> !p.getFileName().toString().equals(SUMMARY_FILE))
                .sorted()
                .toList();
        }
        List<ListingBatch> batches = new ArrayList<>(files.size());
        for (Path file : files) {
            batches.add(loadBatch(file));
        }
        logger.info("Loaded {} batches from {}", batches.size(), rawDir);
        return batches;
    }

    /**
     * Reads a single batch file.
     * @param file JSON file
     * @return batch named after the file
     * @throws IOException if the file cannot be read or is not an array of record objects / providers object
     */
    public ListingBatch loadBatch(Path file) throws IOException {
        JsonNode root = mapper.readTree(file.toFile());
        JsonNode records = root != null && root.isObject() ? root.get("providers") : root;
        if (records == null || !records.isArray()) {
            throw new IOException("Expected a JSON array of listings in " + file);
        }
        List<Map<String, Object>> rows;
        try {
            rows = mapper.convertValue(records, RECORDS);
        } catch (IllegalArgumentException e) {
            throw new IOException("Malformed listing records in " + file, e);
        }
        String source = Utils.sourceNameFromFile(file.getFileName().toString());
        logger.debug("Read {} records for {} from {}", rows.size(), source, file);
        return new ListingBatch(source, rows);
    }
}
