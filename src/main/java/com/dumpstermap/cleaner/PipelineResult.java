package com.dumpstermap.cleaner;

import java.util.List;

/**
 * Final output of {@link ListingPipeline}: cleaned listings sorted by quality score, plus the run statistics.
 */
public record PipelineResult(List<Listing> listings, PipelineStats stats) {}
