package com.eventwatch.core.pattern;

/**
 * Result of running a registry against some input. {@link #NONE} when
 * nothing matched.
 */
public final class ThreatMatch {

    public static final ThreatMatch NONE = new ThreatMatch(false, null, null, null);

    private final boolean matched;
    private final String category;
    private final String signature;
    private final String matchedValue;

    private ThreatMatch(boolean matched, String category, String signature, String matchedValue) {
        this.matched = matched;
        this.category = category;
        this.signature = signature;
        this.matchedValue = matchedValue;
    }

    public static ThreatMatch of(ThreatPattern pattern, String matchedValue) {
        return new ThreatMatch(true, pattern.getCategory(), pattern.getName(), matchedValue);
    }

    public boolean isMatched() {
        return matched;
    }

    public String getCategory() {
        return category;
    }

    /** Name of the signature that fired, e.g. {@code "../"} or {@code "union select"}. */
    public String getSignature() {
        return signature;
    }

    /** The text that matched, as it appeared in the input. */
    public String getMatchedValue() {
        return matchedValue;
    }

    @Override
    public String toString() {
        return matched ? "ThreatMatch{" + category + ", '" + signature + "'}" : "ThreatMatch{none}";
    }
}
