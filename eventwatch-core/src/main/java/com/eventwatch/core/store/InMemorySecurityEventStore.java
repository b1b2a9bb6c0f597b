package com.eventwatch.core.store;

import com.eventwatch.core.model.DataAccessRecord;
import com.eventwatch.core.model.SecurityEvent;
import com.eventwatch.core.model.SecurityEventSeverity;
import com.eventwatch.core.sink.SecurityEventListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * In-memory event counters and a bounded window of recent events, for
 * dashboards and tests on a single instance. Category and severity counters
 * are process-lifetime. Per-client counters are capped at
 * {@code maxTrackedClients}: when full, the clients seen least recently are
 * evicted first.
 */
public class InMemorySecurityEventStore implements SecurityEventListener {

    private static final Logger log = LoggerFactory.getLogger(InMemorySecurityEventStore.class);

    public static final int DEFAULT_MAX_TRACKED_CLIENTS = 10_000;

    private final int maxRecentEvents;
    private final int maxTrackedClients;
    private final Clock clock;

    private final ConcurrentLinkedDeque<SecurityEvent> recentEvents = new ConcurrentLinkedDeque<>();
    private final AtomicInteger recentSize = new AtomicInteger();
    private final Map<String, AtomicLong> byCategory = new ConcurrentHashMap<>();
    private final Map<SecurityEventSeverity, AtomicLong> bySeverity = new ConcurrentHashMap<>();
    private final Map<String, ClientActivity> byClientIp = new ConcurrentHashMap<>();
    private final AtomicLong evictedClients = new AtomicLong();
    private final AtomicLong totalEvents = new AtomicLong();
    private final AtomicLong dataAccessRecords = new AtomicLong();
    private volatile Instant lastEventTime;

    public InMemorySecurityEventStore(int maxRecentEvents, Clock clock) {
        this(maxRecentEvents, DEFAULT_MAX_TRACKED_CLIENTS, clock);
    }

    public InMemorySecurityEventStore(int maxRecentEvents, int maxTrackedClients, Clock clock) {
        if (maxRecentEvents <= 0) {
            throw new IllegalArgumentException("maxRecentEvents must be positive: " + maxRecentEvents);
        }
        if (maxTrackedClients <= 0) {
            throw new IllegalArgumentException("maxTrackedClients must be positive: " + maxTrackedClients);
        }
        this.maxRecentEvents = maxRecentEvents;
        this.maxTrackedClients = maxTrackedClients;
        this.clock = clock;
    }

    @Override
    public void onSecurityEvent(SecurityEvent event) {
        totalEvents.incrementAndGet();
        byCategory.computeIfAbsent(event.getCategory(), k -> new AtomicLong()).incrementAndGet();
        bySeverity.computeIfAbsent(event.getSeverity(), k -> new AtomicLong()).incrementAndGet();
        if (event.getClientIp() != null) {
            recordClient(event.getClientIp(), event.getTimestamp() != null ? event.getTimestamp() : clock.instant());
        }
        lastEventTime = event.getTimestamp();

        recentEvents.addLast(event);
        if (recentSize.incrementAndGet() > maxRecentEvents) {
            if (recentEvents.pollFirst() != null) {
                recentSize.decrementAndGet();
            }
        }
    }

    @Override
    public void onDataAccess(DataAccessRecord record) {
        dataAccessRecords.incrementAndGet();
    }

    public SecurityEventSnapshot snapshot() {
        return snapshot(10);
    }

    public SecurityEventSnapshot snapshot(int topIpCount) {
        Map<String, Long> categories = byCategory.entrySet().stream()
                .collect(Collectors.toMap(Map.Entry::getKey, e -> e.getValue().get()));
        Map<SecurityEventSeverity, Long> severities = bySeverity.entrySet().stream()
                .collect(Collectors.toMap(Map.Entry::getKey, e -> e.getValue().get()));
        List<Map.Entry<String, Long>> topIps = byClientIp.entrySet().stream()
                .map(e -> Map.entry(e.getKey(), e.getValue().count.get()))
                .sorted(Map.Entry.<String, Long>comparingByValue(Comparator.reverseOrder())
                        .thenComparing(Map.Entry.comparingByKey()))
                .limit(Math.max(0, topIpCount))
                .collect(Collectors.toList());
        return new SecurityEventSnapshot(totalEvents.get(), dataAccessRecords.get(), categories, severities,
                topIps, new ArrayList<>(recentEvents), lastEventTime);
    }

    /** Clients evicted to stay within {@code maxTrackedClients}. */
    public long getEvictedClientCount() {
        return evictedClients.get();
    }

    /**
     * Drops recent events, and clients not seen since, older than {@code age}.
     * Category and severity counters are untouched.
     *
     * @return how many events were removed
     */
    public int clearOlderThan(Duration age) {
        Instant cutoff = clock.instant().minus(age);
        int removed = 0;
        Iterator<SecurityEvent> it = recentEvents.iterator();
        while (it.hasNext()) {
            if (it.next().getTimestamp().isBefore(cutoff)) {
                it.remove();
                recentSize.decrementAndGet();
                removed++;
            }
        }
        int before = byClientIp.size();
        byClientIp.values().removeIf(activity -> activity.lastSeen.isBefore(cutoff));
        int clientsRemoved = before - byClientIp.size();
        if (removed > 0 || clientsRemoved > 0) {
            log.debug("[EventWatch] Cleared {} security events and {} clients older than {}",
                    removed, Math.max(0, clientsRemoved), age);
        }
        return removed;
    }

    private void recordClient(String clientIp, Instant seenAt) {
        ClientActivity activity = byClientIp.get(clientIp);
        if (activity == null) {
            if (byClientIp.size() >= maxTrackedClients) {
                evictStalestClients();
            }
            activity = byClientIp.computeIfAbsent(clientIp, k -> new ClientActivity(seenAt));
        }
        activity.record(seenAt);
    }

    /** Evicts a tenth of the tracked clients, least recently seen first. */
    private synchronized void evictStalestClients() {
        int target = maxTrackedClients - Math.max(1, maxTrackedClients / 10);
        int excess = byClientIp.size() - target;
        if (excess <= 0) {
            return;
        }
        List<Map.Entry<String, Instant>> byAge = byClientIp.entrySet().stream()
                .map(e -> Map.entry(e.getKey(), e.getValue().lastSeen))
                .sorted(Map.Entry.comparingByValue())
                .limit(excess)
                .collect(Collectors.toList());
        for (Map.Entry<String, Instant> stale : byAge) {
            if (byClientIp.remove(stale.getKey()) != null) {
                evictedClients.incrementAndGet();
            }
        }
        log.debug("[EventWatch] Client table full ({}), evicted {} least recently seen", maxTrackedClients,
                byAge.size());
    }

    private static final class ClientActivity {
        final AtomicLong count = new AtomicLong();
        volatile Instant lastSeen;

        ClientActivity(Instant firstSeen) {
            this.lastSeen = firstSeen;
        }

        void record(Instant seenAt) {
            count.incrementAndGet();
            if (seenAt.isAfter(lastSeen)) {
                lastSeen = seenAt;
            }
        }
    }
}
