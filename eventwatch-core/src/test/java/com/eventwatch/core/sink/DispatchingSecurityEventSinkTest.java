package com.eventwatch.core.sink;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

import com.eventwatch.core.model.DataAccessRecord;
import com.eventwatch.core.model.RequestContext;
import com.eventwatch.core.model.SecurityEvent;
import com.eventwatch.core.model.SecurityEventSeverity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

@DisplayName("DispatchingSecurityEventSink")
class DispatchingSecurityEventSinkTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    private List<SecurityEvent> received;
    private SecurityEventListener collector;

    @BeforeEach
    void setUp() {
        received = new ArrayList<>();
        collector = received::add;
    }

    private static RequestContext request() {
        return RequestContext.builder()
                .requestId("abc123")
                .method("post")
                .path("/api/songs")
                .clientIp("198.51.100.4")
                .userAgent("sqlmap/1.7")
                .userId("alice")
                .headers(Map.of())
                .build();
    }

    @Nested
    @DisplayName("Request-scoped events")
    class RequestScoped {

        @Test
        @DisplayName("should copy request context into the event")
        void shouldCopyContext() {
            DispatchingSecurityEventSink sink = DispatchingSecurityEventSink.synchronous(List.of(collector), clock);

            sink.onSuspiciousActivity(request(), "SecurityScannerUserAgent", "Security scanning tool detected",
                    "sqlmap/1.7", SecurityEventSeverity.HIGH);

            assertEquals(1, received.size());
            SecurityEvent event = received.get(0);
            assertEquals("SecurityScannerUserAgent", event.getCategory());
            assertEquals(SecurityEventSeverity.HIGH, event.getSeverity());
            assertEquals("sqlmap/1.7", event.getMatchedValue());
            assertEquals("abc123", event.getRequestId());
            assertEquals("/api/songs", event.getRequestPath());
            assertEquals("POST", event.getHttpMethod());
            assertEquals("198.51.100.4", event.getClientIp());
            assertEquals("alice", event.getUserId().orElseThrow());
            assertEquals(NOW, event.getTimestamp());
        }

        @Test
        @DisplayName("should carry the field name for body-scan events")
        void shouldCarryFieldName() {
            DispatchingSecurityEventSink sink = DispatchingSecurityEventSink.synchronous(List.of(collector), clock);

            sink.onSuspiciousActivity("XSSPatternDetection", "XSS pattern detected in field comment", "comment",
                    null, SecurityEventSeverity.HIGH, "/feedback", "POST", "10.0.0.1", "Mozilla/5.0");

            SecurityEvent event = received.get(0);
            assertEquals("comment", event.getField());
            assertNull(event.getMatchedValue());
            assertFalse(event.getUserId().isPresent());
        }
    }

    @Nested
    @DisplayName("Data access")
    class DataAccess {

        @Test
        @DisplayName("should deliver audit records to listeners")
        void shouldDeliverRecords() {
            List<DataAccessRecord> records = new ArrayList<>();
            SecurityEventListener auditor = new SecurityEventListener() {
                @Override
                public void onSecurityEvent(SecurityEvent event) {
                }

                @Override
                public void onDataAccess(DataAccessRecord record) {
                    records.add(record);
                }
            };
            DispatchingSecurityEventSink sink = DispatchingSecurityEventSink.synchronous(List.of(auditor), clock);

            sink.logDataAccess("alice", "SensitiveArea", "/admin/users", "GET", 200);

            assertEquals(1, records.size());
            assertEquals("alice", records.get(0).getUserId());
            assertEquals(200, records.get(0).getStatusCode().getAsInt());
            assertEquals(NOW, records.get(0).getTimestamp());
        }

        @Test
        @DisplayName("should allow an absent status code")
        void shouldAllowAbsentStatus() {
            List<DataAccessRecord> records = new ArrayList<>();
            SecurityEventListener auditor = new SecurityEventListener() {
                @Override
                public void onSecurityEvent(SecurityEvent event) {
                }

                @Override
                public void onDataAccess(DataAccessRecord record) {
                    records.add(record);
                }
            };
            DispatchingSecurityEventSink sink = DispatchingSecurityEventSink.synchronous(List.of(auditor), clock);

            sink.logDataAccess("alice", "SensitiveArea", "/admin/users", "DELETE", null);

            assertTrue(records.get(0).getStatusCode().isEmpty());
        }
    }

    @Nested
    @DisplayName("Delivery")
    class Delivery {

        @Test
        @DisplayName("should keep delivering when one listener throws")
        void shouldIsolateListenerFailures() {
            SecurityEventListener broken = mock(SecurityEventListener.class);
            doThrow(new IllegalStateException("disk full")).when(broken).onSecurityEvent(any());
            DispatchingSecurityEventSink sink = DispatchingSecurityEventSink.synchronous(
                    List.of(broken, collector), clock);

            sink.onSuspiciousActivity(request(), "MissingUserAgent", "Request without User-Agent header", null,
                    SecurityEventSeverity.LOW);

            assertEquals(1, received.size());
        }

        @Test
        @DisplayName("should build the event before handing it to the executor")
        void shouldBuildOnCallingThread() {
            List<Runnable> queued = new ArrayList<>();
            Executor deferred = queued::add;
            SecurityEventListener listener = mock(SecurityEventListener.class);
            DispatchingSecurityEventSink sink = new DispatchingSecurityEventSink(List.of(listener), deferred, clock);

            sink.onSuspiciousActivity(request(), "SlowRequest", "Request to /api/songs took 12.00 seconds", null,
                    SecurityEventSeverity.MEDIUM);

            verify(listener, never()).onSecurityEvent(any());
            queued.forEach(Runnable::run);
            ArgumentCaptor<SecurityEvent> captor = ArgumentCaptor.forClass(SecurityEvent.class);
            verify(listener).onSecurityEvent(captor.capture());
            assertEquals(NOW, captor.getValue().getTimestamp());
        }

        @Test
        @DisplayName("should drop and count events the executor rejects")
        void shouldCountRejectedEvents() {
            Executor full = task -> {
                throw new RejectedExecutionException("queue full");
            };
            DispatchingSecurityEventSink sink = new DispatchingSecurityEventSink(List.of(collector), full, clock);

            sink.onSuspiciousActivity(request(), "MissingUserAgent", "Request without User-Agent header", null,
                    SecurityEventSeverity.LOW);
            sink.logDataAccess("alice", "SensitiveArea", "/admin", "GET", 200);

            assertEquals(2, sink.getDroppedEvents());
            assertTrue(received.isEmpty());
        }
    }
}
