package com.dumpstermap.cleaner;

import java.util.List;
import java.util.Map;

/**
 * One input batch: raw listing records from a single source, typically one state's pull.
 *
 * @param source  provenance tag copied onto every accepted listing as {@code source_state}
 * @param records raw records, each a flat field map
 */
public record ListingBatch(String source, List<Map<String, Object>> records) {
    public ListingBatch {
        source = source == null ? "" : source;
        records = records == null ? List.of() : records;
    }
}
