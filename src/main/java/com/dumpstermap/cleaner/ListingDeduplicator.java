package com.dumpstermap.cleaner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Merges duplicate listings that reached the cleaned set through different directories, queries or states.
 * <p>
 * Matching workflow, strictly in input order:
 * <ul>
 *   <li>A 10-digit normalized phone already registered marks the listing as a duplicate.</li>
 *   <li>Otherwise, a normalized address longer than 15 characters already registered marks it as a duplicate.</li>
 *   <li>Otherwise, a website domain (platform domains excluded) already registered marks it as a duplicate.</li>
 *   <li>A listing that matched nothing survives and registers all of its keys.</li>
 * </ul>
 * The first listing to introduce a key is the survivor of its cluster. A duplicate never registers its other keys,
 * so matching is greedy and short-circuited rather than a transitive closure: the survivor of a cluster depends on
 * input order.
 * <p>
 * TODO: confirm with the directory owners whether transitive clustering should replace the greedy policy; doing so
 * changes which listing survives a cluster.
 *
 * @author DumpsterMap Data Team
 * @since 1.0
 */
public class ListingDeduplicator {
    private static final Logger logger = LoggerFactory.getLogger(ListingDeduplicator.class);

    static final int PHONE_LENGTH = 10;
    static final int MIN_ADDRESS_LENGTH = 16;

    private final Set<String> platformDomains;

    /**
     * @param platformDomains domains that identify a listing platform rather than the business (facebook.com, yelp.com)
     */
    public ListingDeduplicator(List<String> platformDomains) {
        this.platformDomains = Set.copyOf(ClassifierPolicy.clean(platformDomains));
    }

    /**
     * Deduplicates a batch. Each call uses fresh key tables, so repeated runs never share state.
     * @param listings accepted listings across all sources, in input order
     * @return survivors and dropped duplicates
     */
    public DedupResult deduplicate(List<Listing> listings) {
        DedupContext context = new DedupContext();
        List<Listing> survivors = new ArrayList<>();
        List<DedupResult.Duplicate> duplicates = new ArrayList<>();
        for (int i = 0; i < listings.size(); i++) {
            Listing listing = listings.get(i);
            List<DedupKey> keys = keysOf(listing);
            DedupKey hit = context.firstSeen(keys);
            if (hit != null) {
                String survivorId = context.provenance(hit);
                logger.debug("Duplicate '{}' matched {} of {}", listing.describe(), hit, survivorId);
                duplicates.add(new DedupResult.Duplicate(listing, hit, survivorId));
            } else {
                context.register(keys, listing.placeId() != null ? listing.placeId() : "#" + i);
                survivors.add(listing);
            }
        }
        logger.info("Deduplicated {} listings: {} survivors, {} duplicates", listings.size(), survivors.size(), duplicates.size());
        logger.debug("Key tables after run: {}", context);
        return new DedupResult(survivors, duplicates);
    }

    /**
     * Comparison keys of a listing in check order: phone, address, domain. Keys failing their validity test are omitted.
     */
    public List<DedupKey> keysOf(Listing listing) {
        List<DedupKey> keys = new ArrayList<>(3);
        String phone = ListingNormalizer.normalizePhone(listing.phone());
        if (phone.length() == PHONE_LENGTH) {
            keys.add(new DedupKey(DedupKey.Kind.PHONE, phone));
        }
        String address = ListingNormalizer.normalizeAddress(listing.address());
        if (address.length() >= MIN_ADDRESS_LENGTH) {
            keys.add(new DedupKey(DedupKey.Kind.ADDRESS, address));
        }
        String domain = ListingNormalizer.extractDomain(listing.website());
        if (!domain.isEmpty() && !platformDomains.contains(domain)) {
            keys.add(new DedupKey(DedupKey.Kind.DOMAIN, domain));
        }
        return keys;
    }

    /**
     * Key tables for a single deduplication run: key value to provenance of the survivor that introduced it.
     */
    private static final class DedupContext {
        private final Map<DedupKey.Kind, Map<String, String>> tables = new EnumMap<>(DedupKey.Kind.class);

        DedupContext() {
            for (DedupKey.Kind kind : DedupKey.Kind.values()) {
                tables.put(kind, new LinkedHashMap<>());
            }
        }

        DedupKey firstSeen(List<DedupKey> keys) {
            for (DedupKey key : keys) {
                if (tables.get(key.kind()).containsKey(key.value())) return key;
            }
            return null;
        }

        String provenance(DedupKey key) {
            return tables.get(key.kind()).get(key.value());
        }

        void register(List<DedupKey> keys, String provenance) {
            for (DedupKey key : keys) {
                tables.get(key.kind()).put(key.value(), provenance);
            }
        }

        @Override
        public String toString() {
            return tables.entrySet().stream()
                .map(e -> e.getKey().label() + "=" + e.getValue().size())
                .collect(Collectors.joining(", ", "DedupContext{", "}"));
        }
    }
}
