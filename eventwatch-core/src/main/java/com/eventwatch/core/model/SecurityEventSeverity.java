package com.eventwatch.core.model;

/**
 * Alerting priority of a security event. Ordered from least to most urgent;
 * {@link #HIGH} is the top tier.
 */
public enum SecurityEventSeverity {

    /** Worth recording, not worth waking anyone up. */
    LOW,

    /** Suspicious automation or degraded behaviour. */
    MEDIUM,

    /** Likely attack or reconnaissance. */
    HIGH;

    public boolean isAtLeast(SecurityEventSeverity other) {
        return compareTo(other) >= 0;
    }
}
