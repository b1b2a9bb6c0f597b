package com.eventwatch.core.sink;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.eventwatch.core.model.DataAccessRecord;
import com.eventwatch.core.model.SecurityEvent;
import com.eventwatch.core.model.SecurityEventSeverity;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

@DisplayName("LoggingSecurityEventListener")
class LoggingSecurityEventListenerTest {

    private Logger logger;
    private ListAppender<ILoggingEvent> appender;
    private LoggingSecurityEventListener listener;

    @BeforeEach
    void setUp() {
        logger = (Logger) LoggerFactory.getLogger("eventwatch.security.test");
        logger.setLevel(Level.DEBUG);
        appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
        listener = new LoggingSecurityEventListener(logger);
    }

    @AfterEach
    void tearDown() {
        logger.detachAppender(appender);
    }

    private static SecurityEvent event(SecurityEventSeverity severity, String userAgent) {
        return SecurityEvent.builder()
                .category("SecurityScannerUserAgent")
                .severity(severity)
                .detail("Security scanning tool detected")
                .requestPath("/api/songs")
                .httpMethod("GET")
                .clientIp("10.0.0.1")
                .userAgent(userAgent)
                .timestamp(Instant.parse("2024-05-01T10:00:00Z"))
                .build();
    }

    @Test
    @DisplayName("should map severity to log level")
    void shouldMapSeverityToLevel() {
        listener.onSecurityEvent(event(SecurityEventSeverity.HIGH, "sqlmap/1.7"));
        listener.onSecurityEvent(event(SecurityEventSeverity.MEDIUM, "curl/8.0"));
        listener.onSecurityEvent(event(SecurityEventSeverity.LOW, null));

        assertEquals(3, appender.list.size());
        assertEquals(Level.ERROR, appender.list.get(0).getLevel());
        assertEquals(Level.WARN, appender.list.get(1).getLevel());
        assertEquals(Level.INFO, appender.list.get(2).getLevel());
    }

    @Test
    @DisplayName("should sanitise attacker-controlled values before logging")
    void shouldSanitiseValues() {
        listener.onSecurityEvent(event(SecurityEventSeverity.HIGH, "evil\r\n[INFO] forged line"));

        String message = appender.list.get(0).getFormattedMessage();
        assertFalse(message.contains("\n"));
        assertFalse(message.contains("\r"));
        assertTrue(message.contains("userAgent=evil [NEWLINE] [INFO] forged line"));
        assertTrue(message.contains("user=anonymous"));
    }

    @Test
    @DisplayName("should log data access at info level")
    void shouldLogDataAccess() {
        listener.onDataAccess(new DataAccessRecord("alice", "SensitiveArea", "/admin/users", "GET", null,
                Instant.parse("2024-05-01T10:00:00Z")));

        ILoggingEvent logged = appender.list.get(0);
        assertEquals(Level.INFO, logged.getLevel());
        assertTrue(logged.getFormattedMessage().contains("user=alice area=SensitiveArea path=/admin/users"));
        assertTrue(logged.getFormattedMessage().contains("status=n/a"));
    }
}
