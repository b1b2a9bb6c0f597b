package com.eventwatch.autoconfigure;

import com.eventwatch.core.store.InMemorySecurityEventStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.util.concurrent.ScheduledFuture;

/**
 * Periodically drops events and client counters older than the retention
 * window from the {@link InMemorySecurityEventStore}.
 */
public class SecurityEventStoreCleanup implements InitializingBean, DisposableBean {

    private static final Logger log = LoggerFactory.getLogger(SecurityEventStoreCleanup.class);

    private final InMemorySecurityEventStore store;
    private final TaskScheduler scheduler;
    private final Duration retention;
    private final Duration interval;

    private ScheduledFuture<?> task;

    public SecurityEventStoreCleanup(InMemorySecurityEventStore store, TaskScheduler scheduler,
            Duration retention, Duration interval) {
        this.store = store;
        this.scheduler = scheduler;
        this.retention = retention;
        this.interval = interval;
    }

    @Override
    public void afterPropertiesSet() {
        task = scheduler.scheduleAtFixedRate(this::cleanup, interval);
        log.info("[EventWatch] Store cleanup every {} (retention {})", interval, retention);
    }

    void cleanup() {
        try {
            store.clearOlderThan(retention);
        } catch (RuntimeException e) {
            log.warn("[EventWatch] Store cleanup failed: {}", e.getMessage());
        }
    }

    @Override
    public void destroy() {
        if (task != null) {
            task.cancel(false);
        }
    }
}
