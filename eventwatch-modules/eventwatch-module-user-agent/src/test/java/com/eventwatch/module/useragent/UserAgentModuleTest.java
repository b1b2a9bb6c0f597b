package com.eventwatch.module.useragent;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import java.time.Clock;
import java.util.Map;

import com.eventwatch.core.config.EventWatchProperties;
import com.eventwatch.core.model.RequestContext;
import com.eventwatch.core.model.SecurityEventSeverity;
import com.eventwatch.core.pattern.UserAgentPatternRegistry;
import com.eventwatch.core.plugin.EventEmitter;
import com.eventwatch.core.plugin.ModuleContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("UserAgentModule")
class UserAgentModuleTest {

    private UserAgentModule module;
    private EventEmitter emitter;
    private ModuleContext context;

    @BeforeEach
    void setUp() {
        EventWatchProperties properties = new EventWatchProperties();
        module = new UserAgentModule(UserAgentPatternRegistry.defaults(), properties);
        emitter = mock(EventEmitter.class);
        context = new ModuleContext(properties, Clock.systemUTC());
    }

    private static RequestContext request(String path, String userAgent) {
        return RequestContext.builder()
                .path(path)
                .userAgent(userAgent)
                .headers(Map.of())
                .build();
    }

    @Test
    @DisplayName("should report scanners with the header as matched value")
    void shouldReportScanner() {
        module.analyzeRequest(request("/api/songs", "sqlmap/1.7.2#stable"), emitter, context);

        verify(emitter).suspicious(eq("SecurityScannerUserAgent"), anyString(), eq("sqlmap/1.7.2#stable"),
                eq(SecurityEventSeverity.HIGH));
    }

    @Test
    @DisplayName("should report a missing header off the health paths")
    void shouldReportMissingHeader() {
        module.analyzeRequest(request("/api/songs", null), emitter, context);

        verify(emitter).suspicious(eq("MissingUserAgent"), eq("Request without User-Agent header"), isNull(),
                eq(SecurityEventSeverity.LOW));
    }

    @Test
    @DisplayName("should not report a missing header on /health")
    void shouldExemptHealth() {
        module.analyzeRequest(request("/health", null), emitter, context);

        verify(emitter, never()).suspicious(anyString(), anyString(), any(), any());
    }

    @Test
    @DisplayName("should not report allowlisted testing tools")
    void shouldIgnoreAllowlisted() {
        module.analyzeRequest(request("/api/songs", "PostmanRuntime/7.36.0"), emitter, context);

        verify(emitter, never()).suspicious(anyString(), anyString(), any(), any());
    }
}
