package com.eventwatch.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Captures what the detection modules need to know about an incoming HTTP
 * request. Built once per request by the host adapter and never mutated.
 */
public class RequestContext {

    private static final Set<String> STATE_CHANGING_METHODS = Set.of("POST", "PUT", "PATCH", "DELETE");

    private final String requestId;
    private final String method;
    private final String path; // raw request URI, not decoded
    private final String queryString;
    private final Map<String, String> headers;
    private final String contentType;
    private final String clientIp;
    private final String userAgent; // null when the header is absent
    private final String userId; // null if unauthenticated
    private final Map<String, List<String>> formFields;
    private final boolean bodyBuffered;

    private RequestContext(Builder builder) {
        this.requestId = builder.requestId;
        this.method = builder.method != null ? builder.method.toUpperCase(Locale.ROOT) : "GET";
        this.path = builder.path != null ? builder.path : "";
        this.queryString = builder.queryString;
        this.headers = builder.headers != null ? Map.copyOf(builder.headers) : Map.of();
        this.contentType = builder.contentType;
        this.clientIp = builder.clientIp;
        this.userAgent = builder.userAgent;
        this.userId = builder.userId;
        this.formFields = copyFields(builder.formFields);
        this.bodyBuffered = builder.bodyBuffered;
    }

    private static Map<String, List<String>> copyFields(Map<String, List<String>> fields) {
        if (fields == null || fields.isEmpty()) {
            return Map.of();
        }
        Map<String, List<String>> copy = new LinkedHashMap<>();
        fields.forEach((name, values) -> copy.put(name, List.copyOf(values)));
        return Collections.unmodifiableMap(copy);
    }

    public String getRequestId() {
        return requestId;
    }

    public String getMethod() {
        return method;
    }

    public String getPath() {
        return path;
    }

    public String getQueryString() {
        return queryString;
    }

    public Map<String, String> getHeaders() {
        return headers;
    }

    public String getContentType() {
        return contentType;
    }

    public String getClientIp() {
        return clientIp;
    }

    public String getUserAgent() {
        return userAgent;
    }

    public String getUserId() {
        return userId;
    }

    public boolean isAuthenticated() {
        return userId != null;
    }

    /** Form fields parsed from the buffered body, in submission order. Empty if nothing was buffered. */
    public Map<String, List<String>> getFormFields() {
        return formFields;
    }

    /** Whether the host adapter buffered the whole body before invocation. */
    public boolean isBodyBuffered() {
        return bodyBuffered;
    }

    public boolean isStateChanging() {
        return STATE_CHANGING_METHODS.contains(method);
    }

    public boolean isFormEncoded() {
        return contentType != null
                && contentType.toLowerCase(Locale.ROOT).startsWith("application/x-www-form-urlencoded");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String requestId;
        private String method;
        private String path;
        private String queryString;
        private Map<String, String> headers;
        private String contentType;
        private String clientIp;
        private String userAgent;
        private String userId;
        private Map<String, List<String>> formFields;
        private boolean bodyBuffered;

        public Builder requestId(String requestId) {
            this.requestId = requestId;
            return this;
        }

        public Builder method(String method) {
            this.method = method;
            return this;
        }

        public Builder path(String path) {
            this.path = path;
            return this;
        }

        public Builder queryString(String queryString) {
            this.queryString = queryString;
            return this;
        }

        public Builder headers(Map<String, String> headers) {
            this.headers = headers;
            return this;
        }

        public Builder contentType(String contentType) {
            this.contentType = contentType;
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

        public Builder formFields(Map<String, List<String>> formFields) {
            this.formFields = formFields;
            return this;
        }

        public Builder bodyBuffered(boolean bodyBuffered) {
            this.bodyBuffered = bodyBuffered;
            return this;
        }

        public RequestContext build() {
            return new RequestContext(this);
        }
    }

    @Override
    public String toString() {
        return "RequestContext{" +
                "method='" + method + '\'' +
                ", path='" + path + '\'' +
                ", clientIp='" + clientIp + '\'' +
                ", userId='" + userId + '\'' +
                '}';
    }
}
