package com.eventwatch.module.useragent;

import com.eventwatch.core.pattern.UserAgentPatternRegistry;

import java.util.Collection;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Maps a raw User-Agent header to a {@link UserAgentTier}.
 *
 * <p>
 * Precedence, first hit wins:
 * </p>
 * <ol>
 * <li>absent header on a health/readiness path: {@link UserAgentTier#EXEMPT}</li>
 * <li>absent header elsewhere: {@link UserAgentTier#MISSING}</li>
 * <li>allowlist: {@link UserAgentTier#LEGITIMATE}, no further checks</li>
 * <li>security-tooling denylist: {@link UserAgentTier#SECURITY_SCANNER}</li>
 * <li>generic-automation denylist: {@link UserAgentTier#SUSPICIOUS_AUTOMATION}</li>
 * <li>otherwise {@link UserAgentTier#ORDINARY}</li>
 * </ol>
 *
 * <p>
 * The allowlist goes first so the operator's own CI and monitoring clients do
 * not raise noise. Stateless and thread-safe.
 * </p>
 */
public class UserAgentClassifier {

    private final UserAgentPatternRegistry patterns;
    private final Set<String> healthCheckPaths;

    public UserAgentClassifier(UserAgentPatternRegistry patterns, Collection<String> healthCheckPaths) {
        this.patterns = patterns;
        this.healthCheckPaths = healthCheckPaths.stream()
                .map(UserAgentClassifier::normalizePath)
                .collect(Collectors.toUnmodifiableSet());
    }

    public UserAgentClassification classify(String userAgentHeader, String requestPath) {
        if (userAgentHeader == null || userAgentHeader.isBlank()) {
            return isHealthCheckPath(requestPath)
                    ? UserAgentClassification.of(UserAgentTier.EXEMPT)
                    : UserAgentClassification.of(UserAgentTier.MISSING);
        }

        Optional<String> legitimate = patterns.findLegitimate(userAgentHeader);
        if (legitimate.isPresent()) {
            return UserAgentClassification.of(UserAgentTier.LEGITIMATE, legitimate.get());
        }

        Optional<String> scanner = patterns.findScanner(userAgentHeader);
        if (scanner.isPresent()) {
            return UserAgentClassification.of(UserAgentTier.SECURITY_SCANNER, scanner.get());
        }

        Optional<String> automation = patterns.findAutomation(userAgentHeader);
        if (automation.isPresent()) {
            return UserAgentClassification.of(UserAgentTier.SUSPICIOUS_AUTOMATION, automation.get());
        }

        return UserAgentClassification.of(UserAgentTier.ORDINARY);
    }

    boolean isHealthCheckPath(String requestPath) {
        if (requestPath == null) {
            return false;
        }
        return healthCheckPaths.contains(normalizePath(requestPath));
    }

    private static String normalizePath(String path) {
        String normalized = path.trim().toLowerCase(Locale.ROOT);
        while (normalized.length() > 1 && normalized.endsWith("/")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        return normalized;
    }
}
