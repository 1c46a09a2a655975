package com.dumpstermap.cleaner;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Aggregate statistics of one pipeline run, serialized as the cleaning stats report.
 *
 * @param totalRaw          listings read from all batches
 * @param removed           classifier rejections per reason label ({@code missing_name}, {@code national_chain:rumpke}...)
 * @param totalAfterFilter  listings accepted by the classifier
 * @param duplicatesRemoved listings dropped by the deduplicator
 * @param duplicatesByKey   duplicates per matched key kind ({@code phone}, {@code address}, {@code domain})
 * @param totalClean        listings in the final output
 * @param bySource          per-batch subtotals keyed by source name
 * @param validation        website validation outcome counts
 */
public record PipelineStats(
    @JsonProperty("total_raw") int totalRaw,
    @JsonProperty("removed") Map<String, Integer> removed,
    @JsonProperty("total_after_filter") int totalAfterFilter,
    @JsonProperty("duplicates_removed") int duplicatesRemoved,
    @JsonProperty("duplicates_by_key") Map<String, Integer> duplicatesByKey,
    @JsonProperty("total_clean") int totalClean,
    @JsonProperty("by_source") Map<String, SourceStats> bySource,
    @JsonProperty("validation") ValidationStats validation
) {

    /**
     * Subtotals for one input batch.
     *
     * @param raw        listings in the batch
     * @param kept       listings accepted by the classifier
     * @param removed    rejections per reason label
     * @param duplicates accepted listings later dropped as duplicates
     */
    public record SourceStats(
        @JsonProperty("raw") int raw,
        @JsonProperty("kept") int kept,
        @JsonProperty("removed") Map<String, Integer> removed,
        @JsonProperty("duplicates") int duplicates
    ) {}

    /**
     * Website validation outcome counts.
     *
     * @param enabled          false when the run skipped validation
     * @param checked          listings probed
     * @param reachable        probes with status below 400
     * @param unreachable      every other probe
     * @param skippedNoWebsite listings without a website, never probed
     * @param byStatus         probes per verdict label ({@code reachable}, {@code unreachable:timeout}...)
     */
    public record ValidationStats(
        @JsonProperty("enabled") boolean enabled,
        @JsonProperty("checked") int checked,
        @JsonProperty("reachable") int reachable,
        @JsonProperty("unreachable") int unreachable,
        @JsonProperty("skipped_no_website") int skippedNoWebsite,
        @JsonProperty("by_status") Map<String, Integer> byStatus
    ) {
        public static ValidationStats disabled(int listings) {
            return new ValidationStats(false, 0, 0, 0, listings, Map.of());
        }
    }
}
