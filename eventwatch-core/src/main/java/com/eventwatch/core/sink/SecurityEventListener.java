package com.eventwatch.core.sink;

import com.eventwatch.core.model.DataAccessRecord;
import com.eventwatch.core.model.SecurityEvent;

/**
 * Receives fully built events from {@link DispatchingSecurityEventSink}.
 * Register one as a Spring bean to forward events to your own alerting.
 */
public interface SecurityEventListener {

    void onSecurityEvent(SecurityEvent event);

    default void onDataAccess(DataAccessRecord record) {
        // most listeners only care about threat signals
    }
}
