package com.dumpstermap.cleaner;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Keyword lists driving {@link ListingClassifier}. Entries are lower-cased and blank entries dropped at
 * construction; a null or empty list simply disables its rule.
 *
 * @param bigBoxRetailers      name substrings of hardware/big-box stores
 * @param nationalChains       name substrings of national waste companies
 * @param junkRemovalBrands    name substrings of junk-removal-only brands
 * @param nonDumpsterKeywords  name or category substrings of unrelated services
 */
public record ClassifierPolicy(
    List<String> bigBoxRetailers,
    List<String> nationalChains,
    List<String> junkRemovalBrands,
    List<String> nonDumpsterKeywords
) {
    public ClassifierPolicy {
        bigBoxRetailers = clean(bigBoxRetailers);
        nationalChains = clean(nationalChains);
        junkRemovalBrands = clean(junkRemovalBrands);
        nonDumpsterKeywords = clean(nonDumpsterKeywords);
    }

    public static ClassifierPolicy empty() {
        return new ClassifierPolicy(List.of(), List.of(), List.of(), List.of());
    }

    static List<String> clean(List<String> keywords) {
        if (keywords == null) return List.of();
        return keywords.stream()
            .filter(Objects::nonNull)
            .map(k -> k.trim().toLowerCase(Locale.ROOT))
            .filter(k -> !k.isEmpty())
            .toList();
    }
}
