package com.dumpstermap.cleaner;

import com.dumpstermap.cleaner.RejectionReason.Code;
import org.junit.jupiter.api.*;
import static org.junit.jupiter.api.Assertions.*;
import java.util.List;

/**
 * Tests for the ordered classification rules.
 */
public class ListingClassifierTest {
    private ListingClassifier classifier;

    @BeforeEach
    void setUp() {
        classifier = new ListingClassifier(PipelineConfig.load(key -> null).classifierPolicy());
    }

    private static ListingFixtures ok(String name) {
        return ListingFixtures.provider(name, "(555) 123-4567", "123 Main St, Springfield, OH", "acme.com");
    }

    @Test
    void testKeepsDumpsterProvider() {
        RejectionReason reason = classifier.classify(ok("Acme Dumpster Rentals").listing());
        assertTrue(reason.isKeep());
        assertEquals("keep", reason.label());
    }

    @Test
    void testMissingName() {
        assertEquals(Code.MISSING_NAME, classifier.classify(ok(null).listing()).code());
        assertEquals(Code.MISSING_NAME, classifier.classify(ok("   ").listing()).code());
        assertEquals(Code.MISSING_NAME, classifier.classify(null).code());
    }

    @Test
    void testMissingContactNeedsBothPhoneAndWebsiteAbsent() {
        Listing noContact = ListingFixtures.record("Acme").with("address", "1 Elm St").listing();
        assertEquals(Code.MISSING_CONTACT, classifier.classify(noContact).code());

        Listing websiteOnly = ListingFixtures.record("Acme").with("address", "1 Elm St").with("website", "acme.com").listing();
        assertTrue(classifier.classify(websiteOnly).isKeep());

        Listing phoneOnly = ListingFixtures.record("Acme").with("address", "1 Elm St").with("phone", "555-0100").listing();
        assertTrue(classifier.classify(phoneOnly).isKeep());
    }

    @Test
    void testMissingAddressAcceptsFullAddressAlias() {
        Listing noAddress = ListingFixtures.record("Acme").with("phone", "555-0100").listing();
        assertEquals("missing_address", classifier.classify(noAddress).label());

        Listing fullAddress = ListingFixtures.record("Acme").with("phone", "555-0100").with("full_address", "1 Elm St").listing();
        assertTrue(classifier.classify(fullAddress).isKeep());
    }

    @Test
    void testClosedPermanentlyBeatsKeywordRules() {
        Listing closedBigBox = ok("Home Depot Tool Rental").with("business_status", "CLOSED_PERMANENTLY").listing();
        assertEquals(Code.CLOSED_PERMANENTLY, classifier.classify(closedBigBox).code());

        Listing temporarilyClosed = ok("Acme Dumpsters").with("business_status", "CLOSED_TEMPORARILY").listing();
        assertTrue(classifier.classify(temporarilyClosed).isKeep());
    }

    @Test
    void testBigBoxRetailerRecordsKeyword() {
        RejectionReason reason = classifier.classify(ok("The HOME DEPOT #4411").listing());
        assertEquals(Code.BIG_BOX_RETAILER, reason.code());
        assertEquals("home depot", reason.match());
        assertEquals("big_box_retailer:home depot", reason.label());
    }

    @Test
    void testNationalChain() {
        RejectionReason reason = classifier.classify(ok("Rumpke Waste & Recycling").listing());
        assertEquals("national_chain:rumpke", reason.label());
    }

    @Test
    void testJunkRemovalOnlyRequiresCategoryWithoutDumpster() {
        Listing junkOnly = ok("College Hunks Hauling Junk").with("category", "Junk removal service").listing();
        assertEquals("junk_removal_only:college hunks", classifier.classify(junkOnly).label());

        Listing junkAndDumpsters = ok("College Hunks Hauling Junk").with("category", "Junk removal service, Dumpster rental").listing();
        assertTrue(classifier.classify(junkAndDumpsters).isKeep());

        Listing noJunkCategory = ok("Junk King Dumpsters").with("category", "Dumpster rental service").listing();
        assertTrue(classifier.classify(noJunkCategory).isKeep());
    }

    @Test
    void testNonDumpsterMatchesNameOrCategory() {
        assertEquals("non_dumpster:self storage", classifier.classify(ok("Bob's Self Storage").listing()).label());

        Listing byCategory = ok("Bob's Services").with("category", List.of("Septic system service", "Plumber")).listing();
        assertEquals("non_dumpster:septic", classifier.classify(byCategory).label());
    }

    @Test
    void testEmptyPolicyOnlyAppliesStructuralRules() {
        ListingClassifier lenient = new ListingClassifier(ClassifierPolicy.empty());
        assertTrue(lenient.classify(ok("Home Depot").listing()).isKeep());
        assertTrue(lenient.classify(ok("Bob's Self Storage").listing()).isKeep());
        assertEquals(Code.MISSING_NAME, lenient.classify(ok("").listing()).code());
    }

    @Test
    void testCustomPolicyKeywordsAreNormalized() {
        ClassifierPolicy policy = new ClassifierPolicy(List.of("  MegaMart "), List.of(), List.of(), List.of());
        assertEquals(List.of("megamart"), policy.bigBoxRetailers());
        ListingClassifier custom = new ListingClassifier(policy);
        assertEquals("big_box_retailer:megamart", custom.classify(ok("MEGAMART Supercenter").listing()).label());
    }
}
