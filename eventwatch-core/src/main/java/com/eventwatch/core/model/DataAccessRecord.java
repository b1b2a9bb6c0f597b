package com.eventwatch.core.model;

import java.time.Instant;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Audit entry for an authenticated request that touched a sensitive area.
 * Not a threat signal, so it carries no severity.
 */
public final class DataAccessRecord {

    private final String userId;
    private final String areaTag;
    private final String path;
    private final String method;
    private final Integer statusCode; // null when the downstream call threw
    private final Instant timestamp;

    public DataAccessRecord(String userId, String areaTag, String path, String method,
            Integer statusCode, Instant timestamp) {
        this.userId = Objects.requireNonNull(userId, "userId");
        this.areaTag = Objects.requireNonNull(areaTag, "areaTag");
        this.path = path;
        this.method = method;
        this.statusCode = statusCode;
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
    }

    public String getUserId() {
        return userId;
    }

    public String getAreaTag() {
        return areaTag;
    }

    public String getPath() {
        return path;
    }

    public String getMethod() {
        return method;
    }

    public OptionalInt getStatusCode() {
        return statusCode != null ? OptionalInt.of(statusCode) : OptionalInt.empty();
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    @Override
    public String toString() {
        return "DataAccessRecord{area='" + areaTag + "', path='" + path + "', status=" + statusCode + '}';
    }
}
