package com.dumpstermap.cleaner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Sequences the cleaning stages over a set of input batches and aggregates run statistics.
 * <p>
 * Workflow:
 * <ul>
 *   <li>PHASE 1: every batch is classified; rejections are tallied overall and per source, accepted listings are
 *       tagged with their source.</li>
 *   <li>PHASE 2: the accepted listings of all batches are deduplicated together.</li>
 *   <li>PHASE 3: every survivor is scored and the set is sorted by score, highest first.</li>
 *   <li>PHASE 4 (optional): listings with a website are probed concurrently, merged back in place, and the set is
 *       sorted again.</li>
 * </ul>
 * Sorting is stable, so listings with equal scores keep their input order. The pipeline owns no rule or network
 * logic of its own; it only orders the stages and counts.
 *
 * @author DumpsterMap Data Team
 * @since 1.0
 */
public class ListingPipeline {
    private static final Logger logger = LoggerFactory.getLogger(ListingPipeline.class);

    static final String RUN_ID = "runId";

    private static final Comparator<Listing> BY_SCORE_DESC =
        Comparator.comparingDouble((Listing l) -> l.qualityScore() == null ? 0.0 : l.qualityScore()).reversed();

    private final ListingClassifier classifier;
    private final ListingDeduplicator deduplicator;
    private final QualityScorer scorer;
    private final WebsiteValidator validator;

    /**
     * @param validator website validator, or null to skip website validation
     */
    public ListingPipeline(ListingClassifier classifier, ListingDeduplicator deduplicator, QualityScorer scorer,
                           WebsiteValidator validator) {
        this.classifier = classifier;
        this.deduplicator = deduplicator;
        this.scorer = scorer;
        this.validator = validator;
    }

    /**
     * Wires a pipeline from configuration, using the JDK HTTP client for website probes.
     */
    public static ListingPipeline fromConfig(PipelineConfig config) {
        PipelineConfig.ValidatorSettings settings = config.validator();
        WebsiteValidator validator = null;
        if (settings.enabled()) {
            WebsiteProbeTransport transport = new HttpClientProbeTransport(settings.timeout(), settings.userAgent());
            validator = new WebsiteValidator(transport, settings.concurrency(), settings.timeout());
        }
        return new ListingPipeline(
            new ListingClassifier(config.classifierPolicy()),
            new ListingDeduplicator(config.platformDomains()),
            new QualityScorer(),
            validator);
    }

    /**
     * Runs the full pipeline. Blocks while the synchronous stages run and again while website validation completes.
     * @param batches input batches in processing order
     * @return sorted listings and run statistics
     * @throws InterruptedException if interrupted while waiting for website validation
     */
    public PipelineResult run(List<ListingBatch> batches) throws InterruptedException {
        if (batches == null) throw new IllegalArgumentException("batches must not be null");
        String previousRunId = MDC.get(RUN_ID);
        MDC.put(RUN_ID, UUID.randomUUID().toString().substring(0, 8));
        try {
            return execute(batches);
        } finally {
            if (previousRunId != null) MDC.put(RUN_ID, previousRunId); else MDC.remove(RUN_ID);
        }
    }

    private PipelineResult execute(List<ListingBatch> batches) throws InterruptedException {
        // PHASE 1: classify
        int totalRaw = 0;
        Map<String, Integer> removed = new LinkedHashMap<>();
        Map<String, SourceTally> bySource = new LinkedHashMap<>();
        List<Listing> accepted = new ArrayList<>();

        for (ListingBatch batch : batches) {
            SourceTally tally = bySource.computeIfAbsent(batch.source(), s -> new SourceTally());
            int keptBefore = tally.kept;
            for (Map<String, Object> raw : batch.records()) {
                totalRaw++;
                tally.raw++;
                Listing listing = Listing.fromMap(raw);
                RejectionReason reason = classifier.classify(listing);
                if (reason.isKeep()) {
                    accepted.add(listing.withSourceState(batch.source()));
                    tally.kept++;
                } else {
                    removed.merge(reason.label(), 1, Integer::sum);
                    tally.removed.merge(reason.label(), 1, Integer::sum);
                }
            }
            logger.info("{}: {} -> {}", batch.source(), batch.records().size(), tally.kept - keptBefore);
        }
        int totalAfterFilter = accepted.size();
        logger.info("After filtering: {} of {} listings", totalAfterFilter, totalRaw);

        // PHASE 2: deduplicate across all sources
        DedupResult dedup = deduplicator.deduplicate(accepted);
        for (DedupResult.Duplicate duplicate : dedup.duplicates()) {
            SourceTally tally = bySource.get(duplicate.listing().sourceState());
            if (tally != null) tally.duplicates++;
        }

        // PHASE 3: score and sort
        List<Listing> ranked = new ArrayList<>(dedup.survivors().size());
        for (Listing survivor : dedup.survivors()) {
            ranked.add(survivor.withQualityScore(scorer.score(survivor)));
        }
        ranked.sort(BY_SCORE_DESC);

        // PHASE 4: validate websites
        PipelineStats.ValidationStats validation;
        if (validator == null) {
            validation = PipelineStats.ValidationStats.disabled(ranked.size());
        } else {
            List<Listing> withWebsites = ranked.stream().filter(Listing::hasWebsite).toList();
            List<Listing> validated = validator.start(withWebsites).await();
            ranked = mergeBack(ranked, validated);
            ranked.sort(BY_SCORE_DESC);
            validation = validationStats(validated, ranked.size() - validated.size());
        }

        Map<String, PipelineStats.SourceStats> sourceStats = new LinkedHashMap<>();
        bySource.forEach((source, t) -> sourceStats.put(source,
            new PipelineStats.SourceStats(t.raw, t.kept, new LinkedHashMap<>(t.removed), t.duplicates)));

        PipelineStats stats = new PipelineStats(totalRaw, removed, totalAfterFilter, dedup.duplicateCount(),
            dedup.countsByKind(), ranked.size(), sourceStats, validation);
        logger.info("Run complete: raw={}, after filter={}, duplicates={}, clean={}, websites reachable={}/{}",
            totalRaw, totalAfterFilter, dedup.duplicateCount(), ranked.size(), validation.reachable(), validation.checked());
        return new PipelineResult(List.copyOf(ranked), stats);
    }

    // Replaces each listing that has a website with its validated copy; both lists share the same relative order.
    private static List<Listing> mergeBack(List<Listing> ranked, List<Listing> validated) {
        Iterator<Listing> checked = validated.iterator();
        List<Listing> merged = new ArrayList<>(ranked.size());
        for (Listing listing : ranked) {
            merged.add(listing.hasWebsite() && checked.hasNext() ? checked.next() : listing);
        }
        return merged;
    }

    private static PipelineStats.ValidationStats validationStats(List<Listing> validated, int skipped) {
        int reachable = 0;
        Map<String, Integer> byStatus = new LinkedHashMap<>();
        for (Listing listing : validated) {
            WebsiteCheck check = listing.websiteCheck();
            if (check == null) continue;
            if (check.reachable()) reachable++;
            byStatus.merge(check.verdict(), 1, Integer::sum);
        }
        return new PipelineStats.ValidationStats(true, validated.size(), reachable, validated.size() - reachable,
            skipped, byStatus);
    }

    private static final class SourceTally {
        int raw;
        int kept;
        int duplicates;
        final Map<String, Integer> removed = new LinkedHashMap<>();
    }
}
