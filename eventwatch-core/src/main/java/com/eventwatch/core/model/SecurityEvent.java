package com.eventwatch.core.model;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * A single detection emitted by the inspection pipeline.
 * Immutable; built by the sink at capture time and handed to listeners.
 */
public final class SecurityEvent {

    private final String category;
    private final SecurityEventSeverity severity;
    private final String detail;
    private final String matchedValue; // offending value or exception type, may be null
    private final String field; // form field for body-scan events, null otherwise
    private final String requestId;
    private final String requestPath;
    private final String httpMethod;
    private final String clientIp;
    private final String userAgent;
    private final String userId; // null for anonymous requests
    private final Instant timestamp;

    private SecurityEvent(Builder builder) {
        if (builder.category == null || builder.category.isBlank()) {
            throw new IllegalArgumentException("Security event category must not be empty");
        }
        this.category = builder.category;
        this.severity = Objects.requireNonNull(builder.severity, "severity");
        this.detail = builder.detail != null ? builder.detail : "";
        this.matchedValue = builder.matchedValue;
        this.field = builder.field;
        this.requestId = builder.requestId;
        this.requestPath = builder.requestPath;
        this.httpMethod = builder.httpMethod;
        this.clientIp = builder.clientIp;
        this.userAgent = builder.userAgent;
        this.userId = builder.userId;
        this.timestamp = Objects.requireNonNull(builder.timestamp, "timestamp");
    }

    public String getCategory() {
        return category;
    }

    public SecurityEventSeverity getSeverity() {
        return severity;
    }

    public String getDetail() {
        return detail;
    }

    public String getMatchedValue() {
        return matchedValue;
    }

    public String getField() {
        return field;
    }

    public String getRequestId() {
        return requestId;
    }

    public String getRequestPath() {
        return requestPath;
    }

    public String getHttpMethod() {
        return httpMethod;
    }

    public String getClientIp() {
        return clientIp;
    }

    public String getUserAgent() {
        return userAgent;
    }

    public Optional<String> getUserId() {
        return Optional.ofNullable(userId);
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String category;
        private SecurityEventSeverity severity;
        private String detail;
        private String matchedValue;
        private String field;
        private String requestId;
        private String requestPath;
        private String httpMethod;
        private String clientIp;
        private String userAgent;
        private String userId;
        private Instant timestamp;

        public Builder category(String category) {
            this.category = category;
            return this;
        }

        public Builder severity(SecurityEventSeverity severity) {
            this.severity = severity;
            return this;
        }

        public Builder detail(String detail) {
            this.detail = detail;
            return this;
        }

        public Builder matchedValue(String matchedValue) {
            this.matchedValue = matchedValue;
            return this;
        }

        public Builder field(String field) {
            this.field = field;
            return this;
        }

        public Builder requestId(String requestId) {
            this.requestId = requestId;
            return this;
        }

        public Builder requestPath(String requestPath) {
            this.requestPath = requestPath;
            return this;
        }

        public Builder httpMethod(String httpMethod) {
            this.httpMethod = httpMethod;
            return this;
        }

        public Builder clientIp(String clientIp) {
            this.clientIp = clientIp;
            return this;
        }

        public Builder userAgent(String userAgent) {
            this.userAgent = userAgent;
            return this;
        }

        public Builder userId(String userId) {
            this.userId = userId;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public SecurityEvent build() {
            return new SecurityEvent(this);
        }
    }

    @Override
    public String toString() {
        return "SecurityEvent{" +
                "category='" + category + '\'' +
                ", severity=" + severity +
                ", path='" + requestPath + '\'' +
                ", clientIp='" + clientIp + '\'' +
                '}';
    }
}
