package com.dumpstermap.cleaner;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Deterministic completeness and trust score for a listing, between 0.0 and 1.0.
 * <p>
 * Points are summed over five groups and divided once by the maximum ({@value #MAX_POINTS}):
 * <ul>
 *   <li>required fields: name, phone, address, website, 1 each (max 4)</li>
 *   <li>verification: verified flag 1, OPERATIONAL status 0.5 (max 1.5)</li>
 *   <li>review volume: 50+ 1, 20+ 0.7, 5+ 0.4, 1+ 0.2</li>
 *   <li>rating: 4.5+ 1, 4.0+ 0.7, 3.5+ 0.4</li>
 *   <li>photos: 10+ 1, 5+ 0.6, 1+ 0.3</li>
 * </ul>
 * Missing numeric fields count as zero.
 *
 * @author DumpsterMap Data Team
 * @since 1.0
 */
public class QualityScorer {
    static final double MAX_POINTS = 8.5;

    /**
     * Scores a listing.
     * @param listing listing to score
     * @return score rounded to two decimals
     */
    public double score(Listing listing) {
        double points = 0.0;

        if (!Utils.isBlank(listing.name())) points += 1;
        if (!Utils.isBlank(listing.phone())) points += 1;
        if (!Utils.isBlank(listing.address())) points += 1;
        if (!Utils.isBlank(listing.website())) points += 1;

        if (listing.verified()) points += 1;
        if (listing.businessStatus() == BusinessStatus.OPERATIONAL) points += 0.5;

        int reviews = listing.reviewCount() == null ? 0 : listing.reviewCount();
        if (reviews >= 50) points += 1;
        else if (reviews >= 20) points += 0.7;
        else if (reviews >= 5) points += 0.4;
        else if (reviews >= 1) points += 0.2;

        double rating = listing.rating() == null ? 0.0 : listing.rating();
        if (rating >= 4.5) points += 1;
        else if (rating >= 4.0) points += 0.7;
        else if (rating >= 3.5) points += 0.4;

        int photos = listing.photoCount() == null ? 0 : listing.photoCount();
        if (photos >= 10) points += 1;
        else if (photos >= 5) points += 0.6;
        else if (photos >= 1) points += 0.3;

        return BigDecimal.valueOf(points / MAX_POINTS).setScale(2, RoundingMode.HALF_EVEN).doubleValue();
    }
}
