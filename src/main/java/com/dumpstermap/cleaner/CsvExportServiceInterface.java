package com.dumpstermap.cleaner;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Interface for CSV export of cleaned listings.
 */
public interface CsvExportServiceInterface {
    /**
     * Writes listings to a CSV file with a header row.
     * @param listings listings to export, in output order
     * @param file target CSV file; parent directories are created
     * @throws IOException if file writing fails
     */
    void writeListingsToCsv(List<Listing> listings, Path file) throws IOException;
}
