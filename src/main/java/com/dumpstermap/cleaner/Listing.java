package com.dumpstermap.cleaner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Immutable record representing one candidate business listing pulled from an external directory.
 * <p>
 * Lifecycle:
 * <ul>
 *   <li>Built once per input batch from a flat field map via {@link #fromMap(Map)}; the raw map is kept in {@code attributes}.</li>
 *   <li>Semantic fields are read through a small set of accepted raw keys (e.g. {@code reviews} or {@code review_count}).</li>
 *   <li>Each pipeline stage returns an annotated copy: {@link #withSourceState}, {@link #withQualityScore}, {@link #withWebsiteCheck}.</li>
 *   <li>{@link #toMap()} merges the raw attributes with the annotations for downstream consumers.</li>
 * </ul>
 * Annotation keys found on input are discarded, so a score or website verdict is never inherited from an earlier run.
 *
 * @author DumpsterMap Data Team
 * @since 1.0
 */
public record Listing(
    String name,
    String phone,
    String address,
    String website,
    String category,
    BusinessStatus businessStatus,
    Double rating,
    Integer reviewCount,
    Integer photoCount,
    boolean verified,
    String placeId,
    String sourceState,
    Double qualityScore,
    WebsiteCheck websiteCheck,
    Map<String, Object> attributes
) {
    private static final Logger logger = LoggerFactory.getLogger(Listing.class);

    public static final String QUALITY_SCORE = "quality_score";
    public static final String SOURCE_STATE = "source_state";
    public static final String WEBSITE_CHECK = "website_check";

    private static final Set<String> ANNOTATION_KEYS = Set.of(
        QUALITY_SCORE, "_quality_score",
        SOURCE_STATE, "_source_state",
        WEBSITE_CHECK, "_website_check"
    );

    public Listing {
        businessStatus = businessStatus == null ? BusinessStatus.UNKNOWN : businessStatus;
        attributes = attributes == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    /**
     * Builds a listing from a raw record mapping. Missing or malformed fields become null, never an exception.
     * @param raw flat mapping of field names to scalar values (may be null)
     * @return listing without annotations
     */
    public static Listing fromMap(Map<String, ?> raw) {
        Map<String, Object> attrs = new LinkedHashMap<>();
        if (raw != null) {
            raw.forEach((k, v) -> {
                if (k != null && !ANNOTATION_KEYS.contains(k)) attrs.put(k, v);
            });
        }
        return new Listing(
            text(attrs, "name"),
            text(attrs, "phone"),
            text(attrs, "address", "full_address"),
            text(attrs, "website", "site"),
            text(attrs, "category", "type"),
            BusinessStatus.parse(attrs.get("business_status")),
            decimal(attrs, "rating"),
            integer(attrs, "review_count", "reviews", "reviewCount"),
            integer(attrs, "photo_count", "photos_count"),
            flag(attrs.get("verified")),
            text(attrs, "place_id", "placeId"),
            null,
            null,
            null,
            attrs
        );
    }

    public Listing withSourceState(String source) {
        return new Listing(name, phone, address, website, category, businessStatus, rating, reviewCount, photoCount,
            verified, placeId, source, qualityScore, websiteCheck, attributes);
    }

    public Listing withQualityScore(double score) {
        return new Listing(name, phone, address, website, category, businessStatus, rating, reviewCount, photoCount,
            verified, placeId, sourceState, score, websiteCheck, attributes);
    }

    public Listing withWebsiteCheck(WebsiteCheck check) {
        return new Listing(name, phone, address, website, category, businessStatus, rating, reviewCount, photoCount,
            verified, placeId, sourceState, qualityScore, check, attributes);
    }

    public boolean hasWebsite() {
        return !Utils.isBlank(website);
    }

    /**
     * Raw attribute value, used by exporters for fields the pipeline does not model (city, state).
     */
    public Object attribute(String key) {
        return attributes.get(key);
    }

    /**
     * Output mapping: every raw field plus {@code quality_score}, {@code source_state} and {@code website_check} where set.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> out = new LinkedHashMap<>(attributes);
        if (qualityScore != null) out.put(QUALITY_SCORE, qualityScore);
        if (sourceState != null) out.put(SOURCE_STATE, sourceState);
        if (websiteCheck != null) out.put(WEBSITE_CHECK, websiteCheck.toMap());
        return out;
    }

    /**
     * Short label for log messages.
     */
    public String describe() {
        return placeId != null ? name + " [" + placeId + "]" : String.valueOf(name);
    }

    private static String text(Map<String, Object> attrs, String... keys) {
        for (String key : keys) {
            Object v = attrs.get(key);
            if (v == null) continue;
            if (v instanceof Collection<?> c) {
                return c.stream().filter(e -> e != null).map(Object::toString).collect(Collectors.joining(", "));
            }
            return v.toString();
        }
        return null;
    }

    private static Double decimal(Map<String, Object> attrs, String key) {
        Object v = attrs.get(key);
        if (v instanceof Number n) return n.doubleValue();
        if (v instanceof String s && !s.isBlank()) {
            try {
                return Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                logger.debug("Ignoring non-numeric {} '{}'", key, s);
            }
        }
        return null;
    }

    private static Integer integer(Map<String, Object> attrs, String... keys) {
        for (String key : keys) {
            Object v = attrs.get(key);
            if (v instanceof Number n) return clamp(n.longValue());
            if (v instanceof String s && !s.isBlank()) {
                try {
                    return clamp((long) Double.parseDouble(s.trim()));
                } catch (NumberFormatException e) {
                    logger.debug("Ignoring non-numeric {} '{}'", key, s);
                }
            }
        }
        return null;
    }

    // counts beyond the int range saturate instead of wrapping
    private static int clamp(long value) {
        return (int) Math.max(Integer.MIN_VALUE, Math.min(value, Integer.MAX_VALUE));
    }

    private static boolean flag(Object v) {
        if (v instanceof Boolean b) return b;
        if (v instanceof Number n) return n.intValue() != 0;
        return v instanceof String s && Boolean.parseBoolean(s.trim());
    }

    static List<Map<String, Object>> toMaps(List<Listing> listings) {
        return listings.stream().map(Listing::toMap).collect(Collectors.toList());
    }
}
