package com.dumpstermap.cleaner;

/**
 * Canonical comparison key derived from a listing.
 *
 * @param kind  which listing field produced the key
 * @param value normalized phone digits, normalized address, or website domain
 */
public record DedupKey(Kind kind, String value) {

    public enum Kind {
        PHONE, ADDRESS, DOMAIN;

        public String label() {
            return name().toLowerCase(java.util.Locale.ROOT);
        }
    }

    @Override
    public String toString() {
        return kind.label() + ":" + value;
    }
}
