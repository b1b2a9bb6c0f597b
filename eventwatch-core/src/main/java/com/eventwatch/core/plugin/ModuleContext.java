package com.eventwatch.core.plugin;

import com.eventwatch.core.config.EventWatchProperties;

import java.time.Clock;

/**
 * Shared, read-only context passed to each DetectionModule.
 */
public class ModuleContext {

    private final EventWatchProperties properties;
    private final Clock clock;

    public ModuleContext(EventWatchProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    /** Access to configuration properties. */
    public EventWatchProperties getProperties() {
        return properties;
    }

    public Clock getClock() {
        return clock;
    }
}
