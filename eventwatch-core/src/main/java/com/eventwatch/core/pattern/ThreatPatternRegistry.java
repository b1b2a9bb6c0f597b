package com.eventwatch.core.pattern;

import com.eventwatch.core.model.SecurityEventCategories;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Precompiled signature sets for URL/query threats and form-field XSS and
 * SQL-injection grammars.
 *
 * <p>
 * Built once at start-up and shared by every in-flight request. Instances are
 * immutable, so reads need no synchronisation.
 * </p>
 *
 * <p>
 * Matching is plain case-insensitive substring/regex work, not parsing. It
 * over-reports on purpose and never throws: malformed input is "no match".
 * </p>
 */
public final class ThreatPatternRegistry {

    /** Inputs longer than this are only inspected up to this many characters. */
    public static final int MAX_INSPECTED_LENGTH = 64 * 1024;

    private final List<ThreatPattern> urlPatterns;
    private final List<ThreatPattern> bodyPatterns;

    public ThreatPatternRegistry(List<ThreatPattern> urlPatterns, List<ThreatPattern> bodyPatterns) {
        this.urlPatterns = List.copyOf(urlPatterns);
        this.bodyPatterns = List.copyOf(bodyPatterns);
    }

    public static ThreatPatternRegistry defaults() {
        return new ThreatPatternRegistry(defaultUrlPatterns(), defaultBodyPatterns());
    }

    /**
     * Checks the path and the query string, both as received and percent-decoded.
     * Returns the first signature that fires.
     */
    public ThreatMatch matchUrlThreat(String path, String query) {
        List<String> candidates = new ArrayList<>(4);
        addWithDecoded(candidates, path);
        addWithDecoded(candidates, query);
        for (ThreatPattern pattern : urlPatterns) {
            for (String candidate : candidates) {
                String found = pattern.find(candidate);
                if (found != null) {
                    return ThreatMatch.of(pattern, found);
                }
            }
        }
        return ThreatMatch.NONE;
    }

    /** First XSS or SQL-injection signature found in a form field value. */
    public ThreatMatch matchBodyThreat(String fieldValue) {
        String input = truncate(fieldValue);
        for (ThreatPattern pattern : bodyPatterns) {
            String found = pattern.find(input);
            if (found != null) {
                return ThreatMatch.of(pattern, found);
            }
        }
        return ThreatMatch.NONE;
    }

    /**
     * All body categories that fire for a field value, at most one match per
     * category, in registry order.
     */
    public List<ThreatMatch> matchBodyThreats(String fieldValue) {
        String input = truncate(fieldValue);
        if (input == null || input.isEmpty()) {
            return List.of();
        }
        List<ThreatMatch> matches = new ArrayList<>(2);
        Set<String> seenCategories = new HashSet<>();
        for (ThreatPattern pattern : bodyPatterns) {
            if (seenCategories.contains(pattern.getCategory())) {
                continue;
            }
            String found = pattern.find(input);
            if (found != null) {
                seenCategories.add(pattern.getCategory());
                matches.add(ThreatMatch.of(pattern, found));
            }
        }
        return matches;
    }

    private static void addWithDecoded(List<String> candidates, String value) {
        String raw = truncate(value);
        if (raw == null || raw.isEmpty()) {
            return;
        }
        candidates.add(raw);
        String decoded = decode(raw);
        if (!decoded.equals(raw)) {
            candidates.add(decoded);
        }
    }

    static String decode(String value) {
        try {
            return URLDecoder.decode(value, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            // broken percent escapes, fall back to the raw text
            return value;
        }
    }

    private static String truncate(String value) {
        if (value == null || value.length() <= MAX_INSPECTED_LENGTH) {
            return value;
        }
        return value.substring(0, MAX_INSPECTED_LENGTH);
    }

    // --- Signature sets ---

    private static List<ThreatPattern> defaultUrlPatterns() {
        String c = SecurityEventCategories.MALICIOUS_URL_PATTERN;
        return List.of(
                // path traversal
                ThreatPattern.literal(c, "../"),
                ThreatPattern.literal(c, "..\\"),
                ThreatPattern.literal(c, "%2e%2e"),
                ThreatPattern.literal(c, "%252e%252e"),
                ThreatPattern.literal(c, "..%2f"),
                ThreatPattern.literal(c, "..%5c"),
                // script injection
                ThreatPattern.literal(c, "<script"),
                ThreatPattern.literal(c, "script>"),
                ThreatPattern.literal(c, "javascript:"),
                ThreatPattern.literal(c, "vbscript:"),
                ThreatPattern.regex(c, "onload=", "\\bonload\\s*="),
                ThreatPattern.regex(c, "onerror=", "\\bonerror\\s*="),
                ThreatPattern.regex(c, "onclick=", "\\bonclick\\s*="),
                ThreatPattern.regex(c, "eval(", "\\beval\\s*\\("),
                ThreatPattern.regex(c, "alert(", "\\balert\\s*\\("),
                ThreatPattern.literal(c, "document.cookie"),
                ThreatPattern.literal(c, "document.write"),
                // SQL injection
                ThreatPattern.regex(c, "union select", "\\bunion(\\s+all)?\\s+select\\b"),
                ThreatPattern.regex(c, "drop table", "\\bdrop\\s+table\\b"),
                ThreatPattern.regex(c, "insert into", "\\binsert\\s+into\\b"),
                ThreatPattern.regex(c, "delete from", "\\bdelete\\s+from\\b"),
                ThreatPattern.regex(c, "update set", "\\bupdate\\s+(\\S+\\s+)?set\\b"),
                ThreatPattern.regex(c, "exec(", "\\bexec(ute)?\\s*\\("),
                ThreatPattern.literal(c, "sp_executesql"),
                ThreatPattern.literal(c, "xp_cmdshell"),
                ThreatPattern.regex(c, "'; --", "';\\s*--"),
                ThreatPattern.regex(c, "or 1=1", "\\bor\\s+1\\s*=\\s*1\\b"));
    }

    private static List<ThreatPattern> defaultBodyPatterns() {
        String xss = SecurityEventCategories.XSS_PATTERN_DETECTION;
        String sql = SecurityEventCategories.SQL_INJECTION_PATTERN_DETECTION;
        return List.of(
                ThreatPattern.literal(xss, "<script"),
                ThreatPattern.literal(xss, "javascript:"),
                ThreatPattern.literal(xss, "vbscript:"),
                ThreatPattern.regex(xss, "onload=", "\\bonload\\s*="),
                ThreatPattern.regex(xss, "onerror=", "\\bonerror\\s*="),
                ThreatPattern.regex(xss, "onclick=", "\\bonclick\\s*="),
                ThreatPattern.regex(xss, "eval(", "\\beval\\s*\\("),
                ThreatPattern.regex(xss, "alert(", "\\balert\\s*\\("),
                ThreatPattern.regex(xss, "confirm(", "\\bconfirm\\s*\\("),
                ThreatPattern.regex(xss, "prompt(", "\\bprompt\\s*\\("),
                ThreatPattern.literal(xss, "document.cookie"),
                ThreatPattern.literal(xss, "document.write"),

                ThreatPattern.regex(sql, "union select", "\\bunion(\\s+all)?\\s+select\\b"),
                ThreatPattern.regex(sql, "drop table", "\\bdrop\\s+table\\b"),
                ThreatPattern.regex(sql, "insert into", "\\binsert\\s+into\\b"),
                ThreatPattern.regex(sql, "delete from", "\\bdelete\\s+from\\b"),
                ThreatPattern.regex(sql, "update set", "\\bupdate\\s+(\\S+\\s+)?set\\b"),
                ThreatPattern.regex(sql, "exec(", "\\bexec(ute)?\\s*\\("),
                ThreatPattern.regex(sql, "stacked exec", ";\\s*exec\\b"),
                ThreatPattern.literal(sql, "sp_executesql"),
                ThreatPattern.literal(sql, "xp_cmdshell"),
                ThreatPattern.regex(sql, "'; --", "';\\s*--"),
                ThreatPattern.regex(sql, "' or '1'='1", "'\\s*or\\s*'1'\\s*=\\s*'1"),
                ThreatPattern.regex(sql, "\" or \"1\"=\"1", "\"\\s*or\\s*\"1\"\\s*=\\s*\"1"),
                ThreatPattern.regex(sql, "or 1=1", "\\bor\\s+1\\s*=\\s*1\\b"),
                ThreatPattern.regex(sql, "and 1=1", "\\band\\s+1\\s*=\\s*1\\b"),
                ThreatPattern.regex(sql, "having 1=1", "\\bhaving\\s+1\\s*=\\s*1\\b"));
    }
}
