package com.dumpstermap.cleaner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Utility class for common helper methods used by the cleaning pipeline and its file collaborators.
 *
 * @author DumpsterMap Data Team
 * @since 1.0
 */
public final class Utils {
    private static final Logger logger = LoggerFactory.getLogger(Utils.class);

    private Utils() {}

    /**
     * Looks up a setting from the process environment, falling back to a JVM system property.
     * @param key setting name, e.g. {@code LISTING_VALIDATOR_CONCURRENCY}
     * @return the value, or null if neither source defines it
     */
    public static String envOrProp(String key) {
        String ev = System.getenv(key);
        if (ev != null) return ev;
        return System.getProperty(key);
    }

    /**
     * Returns true when the value is null or contains only whitespace.
     */
    public static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    /**
     * Turns a raw batch file name into a display name: extension dropped, separators to spaces, words title-cased.
     * {@code new_york.json} becomes {@code New York}.
     * @param fileName file name (may be null)
     * @return display name, or empty string
     */
    public static String sourceNameFromFile(String fileName) {
        if (fileName == null) return "";
        String stem = fileName;
        int dot = stem.lastIndexOf('.');
        if (dot > 0) stem = stem.substring(0, dot);
        String[] words = stem.replace('_', ' ').replace('-', ' ').trim().split("\\s+");
        StringBuilder sb = new StringBuilder();
        for (String w : words) {
            if (w.isEmpty()) continue;
            if (sb.length() > 0) sb.append(' ');
            sb.append(w.substring(0, 1).toUpperCase(Locale.ROOT)).append(w.substring(1).toLowerCase(Locale.ROOT));
        }
        logger.debug("Batch file '{}' mapped to source '{}'", fileName, sb);
        return sb.toString();
    }
}
