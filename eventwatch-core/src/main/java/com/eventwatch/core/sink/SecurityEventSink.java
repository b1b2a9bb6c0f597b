package com.eventwatch.core.sink;

import com.eventwatch.core.model.RequestContext;
import com.eventwatch.core.model.SecurityEventSeverity;

/**
 * Where the inspection pipeline sends what it finds. Persistence, alerting
 * and deduplication belong to the implementation.
 *
 * <p>
 * Implementations are called from request threads concurrently and must be
 * thread-safe. They must also return quickly: a slow sink slows the request.
 * </p>
 */
public interface SecurityEventSink {

    /**
     * Threat signal raised while inspecting a request.
     *
     * @param request      the request being inspected
     * @param category     detector tag, see {@link com.eventwatch.core.model.SecurityEventCategories}
     * @param detail       human-readable description of what matched
     * @param matchedValue the offending text or exception type, may be {@code null}
     * @param severity     alerting priority
     */
    void onSuspiciousActivity(RequestContext request, String category, String detail,
            String matchedValue, SecurityEventSeverity severity);

    /**
     * Threat signal raised by the form body scan. Request context is passed as
     * plain values because the form has already been consumed.
     *
     * @param field  the form field that matched, may be {@code null}
     * @param userId authenticated principal, {@code null} for anonymous requests
     */
    void onSuspiciousActivity(String category, String detail, String field, String userId,
            SecurityEventSeverity severity, String path, String method, String clientIp, String userAgent);

    /**
     * Audit trail for an authenticated request to a sensitive area. Independent
     * of severity and of whether anything looked malicious.
     *
     * @param statusCode response status, {@code null} when the downstream call threw
     */
    void logDataAccess(String userId, String areaTag, String path, String method, Integer statusCode);
}
