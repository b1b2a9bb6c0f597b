package com.eventwatch.core.sink;

import com.eventwatch.core.model.DataAccessRecord;
import com.eventwatch.core.model.RequestContext;
import com.eventwatch.core.model.SecurityEvent;
import com.eventwatch.core.model.SecurityEventSeverity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Default sink. Builds the event on the calling thread, so the timestamp is
 * the capture time, then hands it to every listener through an executor.
 *
 * <p>
 * With a bounded executor this is fire-and-continue: if the queue is full the
 * event is dropped and counted rather than blocking the request. Use
 * {@link #synchronous} to deliver on the calling thread instead.
 * </p>
 */
public class DispatchingSecurityEventSink implements SecurityEventSink {

    private static final Logger log = LoggerFactory.getLogger(DispatchingSecurityEventSink.class);

    private final List<SecurityEventListener> listeners;
    private final Executor executor;
    private final Clock clock;
    private final AtomicLong droppedEvents = new AtomicLong();

    public DispatchingSecurityEventSink(List<SecurityEventListener> listeners, Executor executor, Clock clock) {
        this.listeners = List.copyOf(listeners);
        this.executor = Objects.requireNonNull(executor, "executor");
        this.clock = Objects.requireNonNull(clock, "clock");
        log.info("[EventWatch] Security event sink dispatching to {} listener(s)", this.listeners.size());
    }

    /** Delivers on the calling thread. */
    public static DispatchingSecurityEventSink synchronous(List<SecurityEventListener> listeners, Clock clock) {
        return new DispatchingSecurityEventSink(listeners, Runnable::run, clock);
    }

    @Override
    public void onSuspiciousActivity(RequestContext request, String category, String detail,
            String matchedValue, SecurityEventSeverity severity) {
        SecurityEvent event = SecurityEvent.builder()
                .category(category)
                .severity(severity)
                .detail(detail)
                .matchedValue(matchedValue)
                .requestId(request.getRequestId())
                .requestPath(request.getPath())
                .httpMethod(request.getMethod())
                .clientIp(request.getClientIp())
                .userAgent(request.getUserAgent())
                .userId(request.getUserId())
                .timestamp(clock.instant())
                .build();
        dispatch(event);
    }

    @Override
    public void onSuspiciousActivity(String category, String detail, String field, String userId,
            SecurityEventSeverity severity, String path, String method, String clientIp, String userAgent) {
        SecurityEvent event = SecurityEvent.builder()
                .category(category)
                .severity(severity)
                .detail(detail)
                .field(field)
                .requestPath(path)
                .httpMethod(method)
                .clientIp(clientIp)
                .userAgent(userAgent)
                .userId(userId)
                .timestamp(clock.instant())
                .build();
        dispatch(event);
    }

    @Override
    public void logDataAccess(String userId, String areaTag, String path, String method, Integer statusCode) {
        DataAccessRecord record = new DataAccessRecord(userId, areaTag, path, method, statusCode, clock.instant());
        submit(() -> {
            for (SecurityEventListener listener : listeners) {
                try {
                    listener.onDataAccess(record);
                } catch (RuntimeException e) {
                    log.error("[EventWatch] Listener {} failed on data access record: {}",
                            listener.getClass().getSimpleName(), e.getMessage());
                }
            }
        });
    }

    /** Events dropped because the executor refused them. */
    public long getDroppedEvents() {
        return droppedEvents.get();
    }

    private void dispatch(SecurityEvent event) {
        submit(() -> {
            for (SecurityEventListener listener : listeners) {
                try {
                    listener.onSecurityEvent(event);
                } catch (RuntimeException e) {
                    // one broken listener must not starve the others
                    log.error("[EventWatch] Listener {} failed on {}: {}",
                            listener.getClass().getSimpleName(), event.getCategory(), e.getMessage());
                }
            }
        });
    }

    private void submit(Runnable delivery) {
        try {
            executor.execute(delivery);
        } catch (RejectedExecutionException e) {
            long dropped = droppedEvents.incrementAndGet();
            if (dropped == 1 || dropped % 1000 == 0) {
                log.warn("[EventWatch] Sink queue full, {} event(s) dropped so far", dropped);
            }
        }
    }
}
