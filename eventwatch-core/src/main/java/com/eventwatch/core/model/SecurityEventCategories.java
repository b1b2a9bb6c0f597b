package com.eventwatch.core.model;

/**
 * Category tags attached to emitted events. One tag per detector.
 */
public final class SecurityEventCategories {

    public static final String MALICIOUS_URL_PATTERN = "MaliciousUrlPattern";
    public static final String SECURITY_SCANNER_USER_AGENT = "SecurityScannerUserAgent";
    public static final String SUSPICIOUS_AUTOMATION_USER_AGENT = "SuspiciousAutomationUserAgent";
    public static final String MISSING_USER_AGENT = "MissingUserAgent";
    public static final String XSS_PATTERN_DETECTION = "XSSPatternDetection";
    public static final String SQL_INJECTION_PATTERN_DETECTION = "SQLInjectionPatternDetection";
    public static final String SECURITY_EXCEPTION = "SecurityException";
    public static final String SLOW_REQUEST = "SlowRequest";
    public static final String SENSITIVE_AREA_ACCESS = "SensitiveAreaAccess";

    private SecurityEventCategories() {
    }
}
