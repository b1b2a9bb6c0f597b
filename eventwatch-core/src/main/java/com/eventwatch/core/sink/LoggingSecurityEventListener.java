package com.eventwatch.core.sink;

import com.eventwatch.core.model.DataAccessRecord;
import com.eventwatch.core.model.SecurityEvent;
import com.eventwatch.core.util.LogSanitizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes every event to the {@code eventwatch.security} logger. Severity
 * drives the log level: LOW is INFO, MEDIUM is WARN, HIGH is ERROR.
 * All request-derived values are sanitised first since they are
 * attacker-controlled.
 */
public class LoggingSecurityEventListener implements SecurityEventListener {

    static final String LOGGER_NAME = "eventwatch.security";

    private final Logger log;

    public LoggingSecurityEventListener() {
        this(LoggerFactory.getLogger(LOGGER_NAME));
    }

    LoggingSecurityEventListener(Logger log) {
        this.log = log;
    }

    @Override
    public void onSecurityEvent(SecurityEvent event) {
        String format = "[EventWatch] Security event: category={} severity={} detail={} field={} "
                + "path={} method={} ip={} userAgent={} user={}";
        Object[] args = {
                event.getCategory(),
                event.getSeverity(),
                LogSanitizer.sanitize(event.getDetail()),
                LogSanitizer.sanitize(event.getField()),
                LogSanitizer.sanitize(event.getRequestPath()),
                LogSanitizer.sanitize(event.getHttpMethod()),
                LogSanitizer.sanitize(event.getClientIp()),
                LogSanitizer.sanitize(event.getUserAgent()),
                LogSanitizer.sanitize(event.getUserId().orElse("anonymous"))
        };
        switch (event.getSeverity()) {
            case HIGH:
                log.error(format, args);
                break;
            case MEDIUM:
                log.warn(format, args);
                break;
            default:
                log.info(format, args);
        }
    }

    @Override
    public void onDataAccess(DataAccessRecord record) {
        log.info("[EventWatch] Data access: user={} area={} path={} method={} status={}",
                LogSanitizer.sanitize(record.getUserId()),
                record.getAreaTag(),
                LogSanitizer.sanitize(record.getPath()),
                LogSanitizer.sanitize(record.getMethod()),
                record.getStatusCode().isPresent() ? record.getStatusCode().getAsInt() : "n/a");
    }
}
