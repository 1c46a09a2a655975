package com.dumpstermap.cleaner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;

/**
 * Command-line entry point for the listing cleaning pipeline.
 * <p>
 * Usage: {@code [mode] [rawDir] [outDir]}
 * <ul>
 *   <li>{@code mode}: {@code validate} (default) runs every phase including website validation; {@code clean} skips it.</li>
 *   <li>{@code rawDir}: directory of per-state JSON pulls, default {@value #DEFAULT_RAW_DIR}.</li>
 *   <li>{@code outDir}: output directory for JSON and CSV results, default {@value #DEFAULT_OUT_DIR}. The CSV is
 *       {@code validated_providers_<stamp>.csv} after validation and {@code cleaned_providers_<stamp>.csv} otherwise.</li>
 * </ul>
 * Exits with status 1 when the raw data cannot be read or the configuration is invalid.
 *
 * @author DumpsterMap Data Team
 * @since 1.0
 */
public class Main {
    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    static final String DEFAULT_RAW_DIR = "data/raw";
    static final String DEFAULT_OUT_DIR = "data/cleaned";

    static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmm");

    /**
     * Parsed command line.
     */
    record Options(boolean validate, Path rawDir, Path outDir) {
        /** CSV file prefix: {@code validated_providers} when websites were probed, {@code cleaned_providers} otherwise. */
        String csvPrefix(PipelineConfig config) {
            return validate && config.validator().enabled() ? "validated_providers" : "cleaned_providers";
        }

        static Options parse(String[] args) {
            String mode = args != null && args.length > 0 ? args[0].trim().toLowerCase(Locale.ROOT) : "";
            boolean validate = !mode.equals("clean");
            if (!mode.isEmpty() && !mode.equals("clean") && !mode.equals("validate")) {
                logger.warn("Unknown mode '{}', running full validation", mode);
            }
            Path raw = Path.of(args != null && args.length > 1 ? args[1] : DEFAULT_RAW_DIR);
            Path out = Path.of(args != null && args.length > 2 ? args[2] : DEFAULT_OUT_DIR);
            return new Options(validate, raw, out);
        }
    }

    /**
     * Runs the pipeline with the given collaborators. Every output file of the run carries the same timestamp.
     * @return process exit status
     */
    static int run(Options options, PipelineConfig config, ListingSourceInterface source,
                   ResultSinkInterface sink, CsvExportServiceInterface csv, Clock clock) {
        ListingPipeline pipeline;
        try {
            pipeline = ListingPipeline.fromConfig(config.withValidationEnabled(
                options.validate() && config.validator().enabled()));
        } catch (IllegalArgumentException e) {
            logger.error("Invalid configuration: {}", e.getMessage());
            return 1;
        }
        try {
            List<ListingBatch> batches = source.loadBatches(options.rawDir());
            PipelineResult result = pipeline.run(batches);

            String stamp = LocalDateTime.now(clock).format(STAMP);
            sink.write(result, options.outDir(), stamp);
            csv.writeListingsToCsv(result.listings(),
                options.outDir().resolve(options.csvPrefix(config) + "_" + stamp + ".csv"));

            PipelineStats stats = result.stats();
            logger.info("Raw records: {}, after filtering: {}, after dedup: {}, websites OK: {}",
                stats.totalRaw(), stats.totalAfterFilter(), stats.totalClean(), stats.validation().reachable());
            return 0;
        } catch (IOException e) {
            logger.error("Pipeline failed on I/O: {}", e.getMessage());
            return 1;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.error("Pipeline interrupted while validating websites");
            return 1;
        }
    }

    /**
     * Main application entry point.
     * @param args Command-line arguments
     */
    public static void main(String[] args) {
        int status;
        try {
            PipelineConfig config = PipelineConfig.load();
            status = run(Options.parse(args), config, new JsonBatchSource(), new JsonResultSink(), new CsvExportService(),
                Clock.systemDefaultZone());
        } catch (UncheckedIOException | IllegalArgumentException e) {
            logger.error("Invalid configuration: {}", e.getMessage());
            status = 1;
        }
        if (status != 0) System.exit(status);
    }
}
