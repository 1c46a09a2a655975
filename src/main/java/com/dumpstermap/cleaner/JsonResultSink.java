package com.dumpstermap.cleaner;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes the cleaned listings and the stats report as pretty-printed JSON files stamped with the run time:
 * {@code all_providers_<stamp>.json} and {@code cleaning_stats_<stamp>.json}.
 *
 * @author DumpsterMap Data Team
 * @since 1.0
 */
public class JsonResultSink implements ResultSinkInterface {
    private static final Logger logger = LoggerFactory.getLogger(JsonResultSink.class);

    private final ObjectMapper mapper;

    public JsonResultSink() {
        this.mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public List<Path> write(PipelineResult result, Path outDir, String stamp) throws IOException {
        Files.createDirectories(outDir);
        Path listingsFile = outDir.resolve("all_providers_" + stamp + ".json");
        Path statsFile = outDir.resolve("cleaning_stats_" + stamp + ".json");
        mapper.writeValue(listingsFile.toFile(), Listing.toMaps(result.listings()));
        mapper.writeValue(statsFile.toFile(), result.stats());
        logger.info("Wrote {} listings to {} and stats to {}", result.listings().size(), listingsFile, statsFile);
        return List.of(listingsFile, statsFile);
    }
}
