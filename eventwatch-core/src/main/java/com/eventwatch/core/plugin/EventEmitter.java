package com.eventwatch.core.plugin;

import com.eventwatch.core.model.RequestContext;
import com.eventwatch.core.model.SecurityEventSeverity;
import com.eventwatch.core.sink.SecurityEventSink;
import com.eventwatch.core.util.LogSanitizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Per-request handle that modules report through. Every sink call is
 * guarded: a sink failure is logged and the request carries on.
 */
public class EventEmitter {

    private static final Logger log = LoggerFactory.getLogger(EventEmitter.class);

    private final RequestContext request;
    private final SecurityEventSink sink;
    private final AtomicInteger emitted = new AtomicInteger();

    public EventEmitter(RequestContext request, SecurityEventSink sink) {
        this.request = request;
        this.sink = sink;
    }

    public void suspicious(String category, String detail, String matchedValue, SecurityEventSeverity severity) {
        try {
            sink.onSuspiciousActivity(request, category, detail, matchedValue, severity);
            emitted.incrementAndGet();
        } catch (RuntimeException e) {
            log.error("[EventWatch] Sink rejected {} event for {}: {}",
                    category, LogSanitizer.sanitize(request.getPath()), e.getMessage());
        }
    }

    /** Body-scan event; the request context travels as plain values. */
    public void fieldMatch(String category, String detail, String field, SecurityEventSeverity severity) {
        try {
            sink.onSuspiciousActivity(category, detail, field, request.getUserId(), severity,
                    request.getPath(), request.getMethod(), request.getClientIp(), request.getUserAgent());
            emitted.incrementAndGet();
        } catch (RuntimeException e) {
            log.error("[EventWatch] Sink rejected {} event for {}: {}",
                    category, LogSanitizer.sanitize(request.getPath()), e.getMessage());
        }
    }

    /** Audit record; skipped for anonymous requests. */
    public void dataAccess(String areaTag, Integer statusCode) {
        if (!request.isAuthenticated()) {
            return;
        }
        try {
            sink.logDataAccess(request.getUserId(), areaTag, request.getPath(), request.getMethod(), statusCode);
            emitted.incrementAndGet();
        } catch (RuntimeException e) {
            log.error("[EventWatch] Sink rejected data access record for {}: {}",
                    LogSanitizer.sanitize(request.getPath()), e.getMessage());
        }
    }

    /** Number of sink calls that went through for this request. */
    public int getEmittedCount() {
        return emitted.get();
    }
}
