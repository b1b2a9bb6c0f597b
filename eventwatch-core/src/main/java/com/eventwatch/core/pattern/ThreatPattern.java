package com.eventwatch.core.pattern;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * An immutable (category, signature) pair. Matching is case-insensitive
 * and never throws.
 */
public final class ThreatPattern {

    private final String category;
    private final String name;
    private final Pattern pattern;

    private ThreatPattern(String category, String name, Pattern pattern) {
        this.category = Objects.requireNonNull(category, "category");
        this.name = Objects.requireNonNull(name, "name");
        this.pattern = Objects.requireNonNull(pattern, "pattern");
    }

    /** Literal substring signature; {@code name} doubles as the text to look for. */
    public static ThreatPattern literal(String category, String literal) {
        return new ThreatPattern(category, literal,
                Pattern.compile(Pattern.quote(literal), Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE));
    }

    public static ThreatPattern regex(String category, String name, String regex) {
        return new ThreatPattern(category, name,
                Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE));
    }

    public String getCategory() {
        return category;
    }

    public String getName() {
        return name;
    }

    /**
     * @return the matched text, or {@code null} if the signature is not present
     */
    public String find(CharSequence input) {
        if (input == null || input.length() == 0) {
            return null;
        }
        try {
            Matcher matcher = pattern.matcher(input);
            return matcher.find() ? matcher.group() : null;
        } catch (RuntimeException | StackOverflowError e) {
            // attacker-controlled input must never break the pipeline
            return null;
        }
    }

    public boolean matches(CharSequence input) {
        return find(input) != null;
    }

    @Override
    public String toString() {
        return category + ":" + name;
    }
}
