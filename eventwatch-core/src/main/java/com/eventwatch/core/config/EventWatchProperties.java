package com.eventwatch.core.config;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Core configuration properties for EventWatch.
 * These map directly to the `eventwatch.*` properties in your application.yml.
 */
public class EventWatchProperties {

    private boolean enabled = true;
    private List<String> excludePaths = List.of();
    private Duration slowRequestThreshold = Duration.ofSeconds(10);
    private List<String> sensitivePaths = List.of(
            "/admin", "/account", "/profile", "/settings", "/api", "/dashboard");
    private List<String> healthCheckPaths = List.of(
            "/health", "/healthcheck", "/ping", "/status", "/ready", "/metrics", "/actuator/health");

    private FormScanProperties formScan = new FormScanProperties();
    private SinkProperties sink = new SinkProperties();
    private StoreProperties store = new StoreProperties();
    private Map<String, ModuleProperties> modules = new HashMap<>();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    /** Paths that bypass inspection entirely. A trailing {@code /**} matches a whole subtree. */
    public List<String> getExcludePaths() {
        return excludePaths;
    }

    public void setExcludePaths(List<String> excludePaths) {
        this.excludePaths = excludePaths;
    }

    public Duration getSlowRequestThreshold() {
        return slowRequestThreshold;
    }

    public void setSlowRequestThreshold(Duration slowRequestThreshold) {
        this.slowRequestThreshold = slowRequestThreshold;
    }

    public List<String> getSensitivePaths() {
        return sensitivePaths;
    }

    public void setSensitivePaths(List<String> sensitivePaths) {
        this.sensitivePaths = sensitivePaths;
    }

    public List<String> getHealthCheckPaths() {
        return healthCheckPaths;
    }

    public void setHealthCheckPaths(List<String> healthCheckPaths) {
        this.healthCheckPaths = healthCheckPaths;
    }

    public FormScanProperties getFormScan() {
        return formScan;
    }

    public void setFormScan(FormScanProperties formScan) {
        this.formScan = formScan;
    }

    public SinkProperties getSink() {
        return sink;
    }

    public void setSink(SinkProperties sink) {
        this.sink = sink;
    }

    public StoreProperties getStore() {
        return store;
    }

    public void setStore(StoreProperties store) {
        this.store = store;
    }

    public Map<String, ModuleProperties> getModules() {
        return modules;
    }

    public void setModules(Map<String, ModuleProperties> modules) {
        this.modules = modules;
    }

    /**
     * Modules are enabled by default unless explicitly turned off.
     */
    public boolean isModuleEnabled(String moduleId) {
        ModuleProperties props = modules.get(moduleId);
        if (props == null)
            return true;
        return props.isEnabled();
    }

    /**
     * See if the requested path matches any of the configured exclude patterns.
     */
    public boolean isExcludedPath(String path) {
        if (path == null) {
            return false;
        }
        for (String pattern : excludePaths) {
            if (pattern.endsWith("/**")) {
                String prefix = pattern.substring(0, pattern.length() - 3);
                if (path.startsWith(prefix))
                    return true;
            } else if (pattern.equals(path)) {
                return true;
            }
        }
        return false;
    }

    public static class FormScanProperties {
        private int maxBodyBytes = 512 * 1024;

        /** Larger form bodies are passed through without being scanned. */
        public int getMaxBodyBytes() {
            return maxBodyBytes;
        }

        public void setMaxBodyBytes(int maxBodyBytes) {
            this.maxBodyBytes = maxBodyBytes;
        }
    }

    public static class SinkProperties {
        private boolean async = true;
        private int threads = 1; // one thread keeps per-request ordering at the listeners
        private int queueCapacity = 1000;

        public boolean isAsync() {
            return async;
        }

        public void setAsync(boolean async) {
            this.async = async;
        }

        public int getThreads() {
            return threads;
        }

        public void setThreads(int threads) {
            this.threads = threads;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }
    }

    public static class StoreProperties {
        private int maxRecentEvents = 1000;
        private int maxTrackedClients = 10_000;
        private Duration retention = Duration.ofHours(24);
        private Duration cleanupInterval = Duration.ofHours(1);

        public int getMaxRecentEvents() {
            return maxRecentEvents;
        }

        public void setMaxRecentEvents(int maxRecentEvents) {
            this.maxRecentEvents = maxRecentEvents;
        }

        public int getMaxTrackedClients() {
            return maxTrackedClients;
        }

        public void setMaxTrackedClients(int maxTrackedClients) {
            this.maxTrackedClients = maxTrackedClients;
        }

        public Duration getRetention() {
            return retention;
        }

        public void setRetention(Duration retention) {
            this.retention = retention;
        }

        public Duration getCleanupInterval() {
            return cleanupInterval;
        }

        public void setCleanupInterval(Duration cleanupInterval) {
            this.cleanupInterval = cleanupInterval;
        }
    }

    public static class ModuleProperties {
        private boolean enabled = true;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }
}
