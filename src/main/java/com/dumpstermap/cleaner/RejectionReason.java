package com.dumpstermap.cleaner;

/**
 * Classifier outcome for one listing: a reason code plus, for keyword rules, the keyword that matched.
 * <p>
 * Labels render as {@code missing_name}, {@code big_box_retailer:home depot}, {@code keep}, and so on.
 *
 * @param code  which rule fired
 * @param match matched keyword for keyword rules, otherwise null
 */
public record RejectionReason(Code code, String match) {

    public enum Code {
        MISSING_NAME("missing_name"),
        MISSING_CONTACT("missing_contact"),
        MISSING_ADDRESS("missing_address"),
        CLOSED_PERMANENTLY("closed_permanently"),
        BIG_BOX_RETAILER("big_box_retailer"),
        NATIONAL_CHAIN("national_chain"),
        JUNK_REMOVAL_ONLY("junk_removal_only"),
        NON_DUMPSTER("non_dumpster"),
        KEEP("keep");

        private final String label;

        Code(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }
    }

    public static final RejectionReason KEEP = new RejectionReason(Code.KEEP, null);

    public static RejectionReason of(Code code) {
        return new RejectionReason(code, null);
    }

    public static RejectionReason matched(Code code, String keyword) {
        return new RejectionReason(code, keyword);
    }

    public boolean isKeep() {
        return code == Code.KEEP;
    }

    public String label() {
        return match == null ? code.label() : code.label() + ":" + match;
    }

    @Override
    public String toString() {
        return label();
    }
}
