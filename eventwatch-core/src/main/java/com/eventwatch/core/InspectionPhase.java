package com.eventwatch.core;

/**
 * Where a single request is in the inspection pipeline.
 */
public enum InspectionPhase {
    START,
    PRE_CHECKED,
    INVOKING,
    EXCEPTION_CLASSIFIED,
    POST_CHECKED,
    COMPLETED
}
