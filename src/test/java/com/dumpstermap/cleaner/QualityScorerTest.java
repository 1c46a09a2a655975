package com.dumpstermap.cleaner;

import org.junit.jupiter.api.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the completeness and trust score.
 */
public class QualityScorerTest {
    private final QualityScorer scorer = new QualityScorer();

    @Test
    void testFullRecordScoresOne() {
        Listing listing = ListingFixtures.provider("Acme", "555-111-2222", "1 Elm St", "acme.com")
            .with("verified", true).with("reviews", 120).with("rating", 4.8).with("photos_count", 25)
            .listing();
        assertEquals(1.0, scorer.score(listing));
    }

    @Test
    void testContactFieldsOnly() {
        Listing listing = ListingFixtures.record("Acme").with("phone", "555-111-2222").with("address", "1 Elm St").listing();
        // 3 of 8.5 points
        assertEquals(0.35, scorer.score(listing));
    }

    @Test
    void testTiersPickHighestMatchOnly() {
        Listing listing = ListingFixtures.record("Acme")
            .with("review_count", 20).with("rating", "4.0").with("photo_count", 5).with("business_status", "OPERATIONAL")
            .listing();
        // name 1 + operational 0.5 + reviews 0.7 + rating 0.7 + photos 0.6 = 3.5
        assertEquals(0.41, scorer.score(listing));
    }

    @Test
    void testMalformedNumbersCountAsZero() {
        Listing listing = ListingFixtures.record("Acme").with("rating", "n/a").with("reviews", "").listing();
        assertNull(listing.rating());
        assertEquals(0.12, scorer.score(listing));
    }

    @Test
    void testEmptyRecordScoresZero() {
        assertEquals(0.0, scorer.score(Listing.fromMap(null)));
    }

    @Test
    void testScoreIsBounded() {
        Listing huge = ListingFixtures.provider("Acme", "1", "2", "3")
            .with("verified", "true").with("reviews", 100000).with("rating", 5).with("photos_count", 999)
            .listing();
        double score = scorer.score(huge);
        assertTrue(score >= 0.0 && score <= 1.0);
    }
}
