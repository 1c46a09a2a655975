package com.dumpstermap.cleaner;

import java.util.Locale;

/**
 * Operating status reported by the listing directory.
 */
public enum BusinessStatus {
    OPERATIONAL,
    CLOSED_TEMPORARILY,
    CLOSED_PERMANENTLY,
    UNKNOWN;

    /**
     * Parses a raw status value; anything unrecognised or absent maps to {@link #UNKNOWN}.
     */
    public static BusinessStatus parse(Object raw) {
        if (raw == null) return UNKNOWN;
        String value = raw.toString().trim().toUpperCase(Locale.ROOT);
        for (BusinessStatus status : values()) {
            if (status.name().equals(value)) return status;
        }
        return UNKNOWN;
    }
}
