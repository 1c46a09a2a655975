package com.dumpstermap.cleaner;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Output of one {@link ListingDeduplicator#deduplicate(List)} call.
 *
 * @param survivors  one listing per duplicate cluster, in input order
 * @param duplicates dropped listings, in input order
 */
public record DedupResult(List<Listing> survivors, List<Duplicate> duplicates) {

    /**
     * A dropped listing together with the key it collided on.
     *
     * @param listing    the dropped listing
     * @param key        key already registered by an earlier survivor
     * @param survivorId provenance of the survivor that introduced the key ({@code place_id} or {@code #index})
     */
    public record Duplicate(Listing listing, DedupKey key, String survivorId) {}

    public DedupResult {
        survivors = List.copyOf(survivors);
        duplicates = List.copyOf(duplicates);
    }

    public int duplicateCount() {
        return duplicates.size();
    }

    /**
     * Duplicate counts per key kind ({@code phone}, {@code address}, {@code domain}).
     */
    public Map<String, Integer> countsByKind() {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (Duplicate d : duplicates) {
            counts.merge(d.key().kind().label(), 1, Integer::sum);
        }
        return counts;
    }
}
