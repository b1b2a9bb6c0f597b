package com.eventwatch.core.plugin;

import com.eventwatch.core.model.RequestContext;
import com.eventwatch.core.model.RequestOutcome;

/**
 * The plugin interface that all EventWatch detectors implement.
 * Each module focuses on one kind of signal.
 *
 * <p>
 * Modules are discovered automatically via Spring's component scanning.
 * Simply annotate your implementation with {@code @Component}.
 * </p>
 *
 * <p>
 * <b>Lifecycle:</b>
 * </p>
 * <ol>
 * <li>{@link #analyzeRequest} - called synchronously BEFORE the downstream
 * handler runs.</li>
 * <li>{@link #analyzeOutcome} - called synchronously AFTER it returned or
 * threw.</li>
 * </ol>
 *
 * <p>
 * Modules observe only. They report through the {@link EventEmitter} and must
 * never touch the request or response. They are shared across all in-flight
 * requests, so they must not keep per-request state in fields.
 * </p>
 */
public interface DetectionModule {

    /**
     * Unique identifier for this module. Used in configuration keys:
     * {@code eventwatch.modules.{id}.enabled}
     */
    String getId();

    /**
     * Human-readable name for logging.
     */
    String getName();

    /**
     * Priority order. Lower values run first within each phase.
     */
    default int getOrder() {
        return 500;
    }

    /**
     * Pre-invocation check. Must be fast and must not block.
     */
    default void analyzeRequest(RequestContext request, EventEmitter emitter, ModuleContext context) {
        // Default: nothing to check before invocation
    }

    /**
     * Post-invocation check. Runs whether the downstream call completed or threw.
     */
    default void analyzeOutcome(RequestContext request, RequestOutcome outcome, EventEmitter emitter,
            ModuleContext context) {
        // Default: nothing to check after invocation
    }

    /**
     * Whether this module is enabled. Checked against configuration.
     */
    default boolean isEnabled(ModuleContext context) {
        return context.getProperties().isModuleEnabled(getId());
    }
}
