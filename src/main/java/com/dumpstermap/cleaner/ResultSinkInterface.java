package com.dumpstermap.cleaner;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Interface for persisting a pipeline result.
 */
public interface ResultSinkInterface {
    /**
     * Writes the cleaned listings and the statistics report.
     * @param result pipeline output
     * @param outDir target directory, created if missing
     * @param stamp  run timestamp embedded in every file name, shared with the other outputs of the run
     * @return paths of the files written
     * @throws IOException if writing fails
     */
    List<Path> write(PipelineResult result, Path outDir, String stamp) throws IOException;
}
