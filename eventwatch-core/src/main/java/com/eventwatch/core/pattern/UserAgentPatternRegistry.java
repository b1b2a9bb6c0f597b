package com.eventwatch.core.pattern;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * User-Agent signature tiers: a legitimate allowlist, a security-tooling
 * denylist and a generic-automation denylist. Precedence between the tiers
 * is the classifier's job; this class only answers "which signature, if any".
 */
public final class UserAgentPatternRegistry {

    public static final String LEGITIMATE = "LegitimateUserAgent";
    public static final String SCANNER = "SecurityScannerUserAgent";
    public static final String AUTOMATION = "SuspiciousAutomationUserAgent";

    private final List<ThreatPattern> legitimate;
    private final List<ThreatPattern> scanners;
    private final List<ThreatPattern> automation;

    public UserAgentPatternRegistry(List<ThreatPattern> legitimate, List<ThreatPattern> scanners,
            List<ThreatPattern> automation) {
        this.legitimate = List.copyOf(legitimate);
        this.scanners = List.copyOf(scanners);
        this.automation = List.copyOf(automation);
    }

    public static UserAgentPatternRegistry defaults() {
        List<ThreatPattern> legitimate = new ArrayList<>(literals(LEGITIMATE,
                        // search engines and link-preview bots
                        "googlebot", "bingbot", "slurp", "duckduckbot", "baiduspider", "yandexbot",
                        "applebot", "facebookexternalhit", "facebot", "twitterbot", "linkedinbot",
                        "slackbot", "discordbot", "telegrambot", "whatsapp", "pinterestbot",
                        // API, load-testing and CI clients
                        "postmanruntime", "postman", "insomnia", "xunit", "junit", "github-actions",
                        "apache-jmeter", "gatling", "kube-probe", "elb-healthchecker", "uptimerobot",
                        "pingdom", "microsoft.aspnetcore.testhost"));
        legitimate.add(ThreatPattern.regex(LEGITIMATE, "k6", "\\bk6/"));

        return new UserAgentPatternRegistry(
                legitimate,
                List.of(
                        ThreatPattern.literal(SCANNER, "sqlmap"),
                        ThreatPattern.literal(SCANNER, "nmap"),
                        ThreatPattern.literal(SCANNER, "nikto"),
                        ThreatPattern.literal(SCANNER, "dirb"),
                        ThreatPattern.literal(SCANNER, "gobuster"),
                        ThreatPattern.literal(SCANNER, "burp"),
                        ThreatPattern.regex(SCANNER, "zap", "\\bzap\\b"),
                        ThreatPattern.literal(SCANNER, "masscan"),
                        ThreatPattern.literal(SCANNER, "nessus"),
                        ThreatPattern.literal(SCANNER, "openvas"),
                        ThreatPattern.literal(SCANNER, "w3af"),
                        ThreatPattern.literal(SCANNER, "whatweb"),
                        ThreatPattern.literal(SCANNER, "httprint"),
                        ThreatPattern.literal(SCANNER, "nuclei"),
                        ThreatPattern.literal(SCANNER, "acunetix"),
                        ThreatPattern.literal(SCANNER, "wpscan"),
                        ThreatPattern.literal(SCANNER, "netsparker"),
                        ThreatPattern.literal(SCANNER, "arachni"),
                        ThreatPattern.literal(SCANNER, "skipfish"),
                        ThreatPattern.literal(SCANNER, "metasploit"),
                        ThreatPattern.literal(SCANNER, "commix"),
                        ThreatPattern.literal(SCANNER, "wfuzz"),
                        ThreatPattern.regex(SCANNER, "ffuf", "\\bffuf\\b")),
                List.of(
                        ThreatPattern.literal(AUTOMATION, "python-requests"),
                        ThreatPattern.literal(AUTOMATION, "python-urllib"),
                        ThreatPattern.literal(AUTOMATION, "curl/"),
                        ThreatPattern.literal(AUTOMATION, "wget/"),
                        ThreatPattern.regex(AUTOMATION, "java/", "\\bjava/"),
                        ThreatPattern.literal(AUTOMATION, "go-http-client"),
                        ThreatPattern.literal(AUTOMATION, "libwww-perl"),
                        ThreatPattern.literal(AUTOMATION, "okhttp"),
                        ThreatPattern.literal(AUTOMATION, "node-fetch"),
                        ThreatPattern.literal(AUTOMATION, "scrapy"),
                        ThreatPattern.literal(AUTOMATION, "headlesschrome"),
                        ThreatPattern.literal(AUTOMATION, "phantomjs"),
                        ThreatPattern.literal(AUTOMATION, "bot"),
                        ThreatPattern.literal(AUTOMATION, "crawler"),
                        ThreatPattern.literal(AUTOMATION, "spider"),
                        ThreatPattern.literal(AUTOMATION, "scraper")));
    }

    public Optional<String> findLegitimate(String userAgent) {
        return firstMatch(legitimate, userAgent);
    }

    public Optional<String> findScanner(String userAgent) {
        return firstMatch(scanners, userAgent);
    }

    public Optional<String> findAutomation(String userAgent) {
        return firstMatch(automation, userAgent);
    }

    private static Optional<String> firstMatch(List<ThreatPattern> patterns, String userAgent) {
        if (userAgent == null || userAgent.isEmpty()) {
            return Optional.empty();
        }
        String input = userAgent.length() > ThreatPatternRegistry.MAX_INSPECTED_LENGTH
                ? userAgent.substring(0, ThreatPatternRegistry.MAX_INSPECTED_LENGTH)
                : userAgent;
        for (ThreatPattern pattern : patterns) {
            if (pattern.matches(input)) {
                return Optional.of(pattern.getName());
            }
        }
        return Optional.empty();
    }

    private static List<ThreatPattern> literals(String category, String... signatures) {
        return Arrays.stream(signatures)
                .map(s -> ThreatPattern.literal(category, s))
                .collect(Collectors.toUnmodifiableList());
    }
}
