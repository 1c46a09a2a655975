package com.dumpstermap.cleaner;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Interface for reading raw listing batches from storage.
 */
public interface ListingSourceInterface {
    /**
     * Loads every batch found under a raw-data directory.
     * @param rawDir directory holding one file per source
     * @return batches in file-name order
     * @throws IOException if the directory or any batch file cannot be read or parsed
     */
    List<ListingBatch> loadBatches(Path rawDir) throws IOException;
}
