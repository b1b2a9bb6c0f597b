package com.eventwatch.module.sensitivearea;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import com.eventwatch.core.config.EventWatchProperties;
import com.eventwatch.core.model.RequestContext;
import com.eventwatch.core.model.RequestOutcome;
import com.eventwatch.core.plugin.EventEmitter;
import com.eventwatch.core.plugin.ModuleContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("SensitiveAreaModule")
class SensitiveAreaModuleTest {

    private SensitiveAreaModule module;
    private EventEmitter emitter;
    private ModuleContext context;

    @BeforeEach
    void setUp() {
        module = new SensitiveAreaModule();
        emitter = mock(EventEmitter.class);
        context = new ModuleContext(new EventWatchProperties(), Clock.systemUTC());
    }

    private static RequestContext request(String path, String userId) {
        return RequestContext.builder()
                .path(path)
                .userId(userId)
                .headers(Map.of())
                .build();
    }

    @Test
    @DisplayName("should audit authenticated access to a sensitive area")
    void shouldAuditAuthenticatedAccess() {
        module.analyzeOutcome(request("/Admin/users", "alice"), RequestOutcome.completed(200, Duration.ZERO),
                emitter, context);

        verify(emitter).dataAccess("SensitiveArea", 200);
    }

    @Test
    @DisplayName("should audit failed requests without a status code")
    void shouldAuditFailures() {
        module.analyzeOutcome(request("/account", "alice"),
                RequestOutcome.failed(new SecurityException(), Duration.ZERO), emitter, context);

        verify(emitter).dataAccess("SensitiveArea", null);
    }

    @Test
    @DisplayName("should not audit anonymous requests")
    void shouldSkipAnonymous() {
        module.analyzeOutcome(request("/admin", null), RequestOutcome.completed(200, Duration.ZERO), emitter,
                context);

        verify(emitter, never()).dataAccess(anyString(), any());
    }

    @Test
    @DisplayName("should not audit other areas")
    void shouldSkipOtherAreas() {
        module.analyzeOutcome(request("/songs/42", "alice"), RequestOutcome.completed(200, Duration.ZERO),
                emitter, context);

        verify(emitter, never()).dataAccess(anyString(), any());
    }

    @Test
    @DisplayName("should match default prefixes case-insensitively, including longer names")
    void shouldMatchDefaultPrefixes() {
        List<String> defaults = new EventWatchProperties().getSensitivePaths();

        assertTrue(SensitiveAreaModule.isSensitive("/admin/users", defaults));
        assertTrue(SensitiveAreaModule.isSensitive("/ADMIN", defaults));
        assertTrue(SensitiveAreaModule.isSensitive("/administrator", defaults));
        assertTrue(SensitiveAreaModule.isSensitive("/admin-panel", defaults));
        assertTrue(SensitiveAreaModule.isSensitive("/accounts/5", defaults));
        assertTrue(SensitiveAreaModule.isSensitive("/apiv2/songs", defaults));
        assertFalse(SensitiveAreaModule.isSensitive("/songs/admin", defaults));
        assertFalse(SensitiveAreaModule.isSensitive(null, defaults));
    }

    @Test
    @DisplayName("should confine a prefix ending in a slash to its segment")
    void shouldHonourTrailingSlash() {
        List<String> prefixes = List.of("/api/");

        assertTrue(SensitiveAreaModule.isSensitive("/api/songs", prefixes));
        assertFalse(SensitiveAreaModule.isSensitive("/apiv2/songs", prefixes));
    }
}
