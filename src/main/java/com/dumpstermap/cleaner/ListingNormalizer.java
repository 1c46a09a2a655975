package com.dumpstermap.cleaner;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Pure functions turning free-form phone numbers, postal addresses and website URLs into
 * canonical comparison keys for {@link ListingDeduplicator}.
 * <p>
 * Every function is total: {@code null} or empty input yields an empty string, never an exception.
 *
 * @author DumpsterMap Data Team
 * @since 1.0
 */
public final class ListingNormalizer {
    private static final Pattern NON_DIGIT = Pattern.compile("\\D");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern SCHEME = Pattern.compile("^https?://");

    // Street-type abbreviations, expanded on word boundaries only.
    private static final Pattern[] ABBREVIATIONS = {
        Pattern.compile("\\bst\\b"),
        Pattern.compile("\\brd\\b"),
        Pattern.compile("\\bave\\b"),
        Pattern.compile("\\bblvd\\b"),
        Pattern.compile("\\bdr\\b")
    };
    private static final String[] EXPANSIONS = {"street", "road", "avenue", "boulevard", "drive"};

    private ListingNormalizer() {}

    /**
     * Strips every non-digit and drops a leading US country code from an 11-digit result.
     * The remaining digits are returned verbatim; callers check for the 10-digit length themselves.
     * @param phone raw phone number, e.g. {@code +1 (415) 555-0100}
     * @return digit string, e.g. {@code 4155550100}
     */
    public static String normalizePhone(String phone) {
        if (phone == null || phone.isEmpty()) return "";
        String digits = NON_DIGIT.matcher(phone).replaceAll("");
        if (digits.length() == 11 && digits.charAt(0) == '1') {
            digits = digits.substring(1);
        }
        return digits;
    }

    /**
     * Lower-cases, trims, expands street-type abbreviations and collapses whitespace.
     * @param address raw address, e.g. {@code 123 Main St}
     * @return normalized address, e.g. {@code 123 main street}
     */
    public static String normalizeAddress(String address) {
        if (address == null || address.isEmpty()) return "";
        String addr = address.toLowerCase(Locale.ROOT).trim();
        for (int i = 0; i < ABBREVIATIONS.length; i++) {
            addr = ABBREVIATIONS[i].matcher(addr).replaceAll(EXPANSIONS[i]);
        }
        return WHITESPACE.matcher(addr).replaceAll(" ");
    }

    /**
     * Extracts the host part of a website URL: scheme and {@code www.} stripped, path dropped.
     * @param url website as stored on the listing (with or without scheme)
     * @return lower-cased domain, or empty string
     */
    public static String extractDomain(String url) {
        if (url == null || url.isEmpty()) return "";
        String domain = SCHEME.matcher(url.trim().toLowerCase(Locale.ROOT)).replaceFirst("");
        if (domain.startsWith("www.")) {
            domain = domain.substring(4);
        }
        int slash = domain.indexOf('/');
        return slash >= 0 ? domain.substring(0, slash) : domain;
    }
}
