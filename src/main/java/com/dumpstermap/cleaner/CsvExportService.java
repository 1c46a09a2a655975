package com.dumpstermap.cleaner;

import com.opencsv.CSVWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Service for exporting cleaned listings to CSV files using OpenCSV, for quick review in a spreadsheet.
 * <p>
 * Columns: name, phone, website, website_status, city, state, rating, reviews, quality_score. {@code website_status} is {@code reachable}, the failed probe's status
 * ({@code 404}, {@code timeout}...), or {@code no_url} when the listing was never probed.
 *
 * @author DumpsterMap Data Team
 * @since 1.0
 */
public class CsvExportService implements CsvExportServiceInterface {
    private static final Logger logger = LoggerFactory.getLogger(CsvExportService.class);

    static final String[] HEADER = {
        "name", "phone", "website", "website_status", "city", "state", "rating", "reviews", "quality_score"
    };

    @Override
    public void writeListingsToCsv(List<Listing> listings, Path file) throws IOException {
        if (listings == null) {
            throw new IllegalArgumentException("Listing list cannot be null");
        }
        if (file == null) {
            throw new IllegalArgumentException("CSV file cannot be null");
        }
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);

        try (Writer out = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
             CSVWriter writer = new CSVWriter(out)) {
            writer.writeNext(HEADER);
            for (Listing listing : listings) {
                writer.writeNext(new String[]{
                    safe(listing.name()),
                    safe(listing.phone()),
                    safe(listing.website()),
                    websiteStatus(listing.websiteCheck()),
                    safe(listing.attribute("city")),
                    safe(listing.attribute("state")),
                    listing.rating() == null ? "" : listing.rating().toString(),
                    listing.reviewCount() == null ? "" : listing.reviewCount().toString(),
                    listing.qualityScore() == null ? "" : listing.qualityScore().toString()
                });
            }
        }
        logger.info("Wrote {} listings to CSV file: {}", listings.size(), file);
    }

    private static String websiteStatus(WebsiteCheck check) {
        if (check == null) return WebsiteCheck.NO_URL;
        return check.reachable() ? "reachable" : check.status();
    }

    /**
     * Collapses line breaks into a single space and trims, so every listing stays on one CSV row.
     */
    private static String safe(Object value) {
        return value == null ? "" : value.toString().replaceAll("[\\r\\n]+", " ").trim();
    }
}
