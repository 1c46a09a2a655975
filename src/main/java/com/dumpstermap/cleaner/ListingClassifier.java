package com.dumpstermap.cleaner;

import com.dumpstermap.cleaner.RejectionReason.Code;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Function;

/**
 * Rule-based accept/reject decision for scraped listings.
 * <p>
 * Rules are evaluated top to bottom and the first match wins:
 * <ol>
 *   <li>missing name</li>
 *   <li>neither phone nor website</li>
 *   <li>missing address</li>
 *   <li>permanently closed</li>
 *   <li>big-box retailer name</li>
 *   <li>national waste chain name</li>
 *   <li>junk-removal-only business (category says junk removal, never dumpster, and the name is a junk brand)</li>
 *   <li>unrelated service in name or category (storage, movers, portable toilets, septic...)</li>
 * </ol>
 * Anything left is {@link RejectionReason#KEEP}. Keyword tests are case-insensitive substring matches
 * against the lists in {@link ClassifierPolicy}.
 *
 * @author DumpsterMap Data Team
 * @since 1.0
 */
public class ListingClassifier {
    private static final Logger logger = LoggerFactory.getLogger(ListingClassifier.class);

    private final List<Function<Listing, Optional<RejectionReason>>> rules;

    public ListingClassifier(ClassifierPolicy policy) {
        ClassifierPolicy p = policy == null ? ClassifierPolicy.empty() : policy;
        this.rules = List.of(
            l -> when(Utils.isBlank(l.name()), Code.MISSING_NAME),
            l -> when(Utils.isBlank(l.phone()) && Utils.isBlank(l.website()), Code.MISSING_CONTACT),
            l -> when(Utils.isBlank(l.address()), Code.MISSING_ADDRESS),
            l -> when(l.businessStatus() == BusinessStatus.CLOSED_PERMANENTLY, Code.CLOSED_PERMANENTLY),
            l -> firstIn(lower(l.name()), p.bigBoxRetailers()).map(k -> RejectionReason.matched(Code.BIG_BOX_RETAILER, k)),
            l -> firstIn(lower(l.name()), p.nationalChains()).map(k -> RejectionReason.matched(Code.NATIONAL_CHAIN, k)),
            l -> junkRemovalOnly(l, p.junkRemovalBrands()),
            l -> nonDumpster(l, p.nonDumpsterKeywords())
        );
    }

    /**
     * Classifies one listing. Total: every listing gets exactly one reason.
     * @param listing listing to classify
     * @return first matching rejection reason, or {@link RejectionReason#KEEP}
     */
    public RejectionReason classify(Listing listing) {
        if (listing == null) return RejectionReason.of(Code.MISSING_NAME);
        for (Function<Listing, Optional<RejectionReason>> rule : rules) {
            Optional<RejectionReason> reason = rule.apply(listing);
            if (reason.isPresent()) {
                logger.debug("Rejected '{}': {}", listing.describe(), reason.get());
                return reason.get();
            }
        }
        return RejectionReason.KEEP;
    }

    private static Optional<RejectionReason> when(boolean condition, Code code) {
        return condition ? Optional.of(RejectionReason.of(code)) : Optional.empty();
    }

    private static Optional<RejectionReason> junkRemovalOnly(Listing listing, List<String> brands) {
        String category = lower(listing.category());
        if (!category.contains("junk removal") || category.contains("dumpster")) return Optional.empty();
        return firstIn(lower(listing.name()), brands).map(k -> RejectionReason.matched(Code.JUNK_REMOVAL_ONLY, k));
    }

    private static Optional<RejectionReason> nonDumpster(Listing listing, List<String> keywords) {
        String name = lower(listing.name());
        String category = lower(listing.category());
        for (String kw : keywords) {
            if (name.contains(kw) || category.contains(kw)) {
                return Optional.of(RejectionReason.matched(Code.NON_DUMPSTER, kw));
            }
        }
        return Optional.empty();
    }

    private static Optional<String> firstIn(String text, List<String> keywords) {
        for (String kw : keywords) {
            if (text.contains(kw)) return Optional.of(kw);
        }
        return Optional.empty();
    }

    private static String lower(String s) {
        return s == null ? "" : s.toLowerCase(Locale.ROOT);
    }
}
