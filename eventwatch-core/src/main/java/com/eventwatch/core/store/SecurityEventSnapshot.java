package com.eventwatch.core.store;

import com.eventwatch.core.model.SecurityEvent;
import com.eventwatch.core.model.SecurityEventSeverity;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Point-in-time view of {@link InMemorySecurityEventStore}.
 */
public final class SecurityEventSnapshot {

    private final long totalEvents;
    private final long dataAccessRecords;
    private final Map<String, Long> eventsByCategory;
    private final Map<SecurityEventSeverity, Long> eventsBySeverity;
    private final List<Map.Entry<String, Long>> topClientIps;
    private final List<SecurityEvent> recentEvents;
    private final Instant lastEventTime;

    SecurityEventSnapshot(long totalEvents, long dataAccessRecords, Map<String, Long> eventsByCategory,
            Map<SecurityEventSeverity, Long> eventsBySeverity, List<Map.Entry<String, Long>> topClientIps,
            List<SecurityEvent> recentEvents, Instant lastEventTime) {
        this.totalEvents = totalEvents;
        this.dataAccessRecords = dataAccessRecords;
        this.eventsByCategory = Map.copyOf(eventsByCategory);
        this.eventsBySeverity = Map.copyOf(eventsBySeverity);
        this.topClientIps = List.copyOf(topClientIps);
        this.recentEvents = List.copyOf(recentEvents);
        this.lastEventTime = lastEventTime;
    }

    public long getTotalEvents() {
        return totalEvents;
    }

    public long getDataAccessRecords() {
        return dataAccessRecords;
    }

    public Map<String, Long> getEventsByCategory() {
        return eventsByCategory;
    }

    public long countFor(String category) {
        return eventsByCategory.getOrDefault(category, 0L);
    }

    public Map<SecurityEventSeverity, Long> getEventsBySeverity() {
        return eventsBySeverity;
    }

    /** Client IPs with the most events, busiest first. */
    public List<Map.Entry<String, Long>> getTopClientIps() {
        return topClientIps;
    }

    /** Most recent events, oldest first. */
    public List<SecurityEvent> getRecentEvents() {
        return recentEvents;
    }

    /** {@code null} if nothing has been recorded yet. */
    public Instant getLastEventTime() {
        return lastEventTime;
    }
}
