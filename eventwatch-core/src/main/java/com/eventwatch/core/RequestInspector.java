package com.eventwatch.core;

import com.eventwatch.core.config.EventWatchProperties;
import com.eventwatch.core.exception.SecurityExceptionClassifier;
import com.eventwatch.core.model.RequestContext;
import com.eventwatch.core.plugin.ModuleContext;
import com.eventwatch.core.plugin.ModuleRegistry;
import com.eventwatch.core.sink.SecurityEventSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs every enabled DetectionModule around a request: pre-checks, timed
 * invocation, exception classification, post-checks.
 *
 * <p>
 * Detection only. Nothing here blocks, delays or rewrites a request, and any
 * exception from the downstream handler is rethrown exactly as it was thrown.
 * </p>
 */
public class RequestInspector {

    private static final Logger log = LoggerFactory.getLogger(RequestInspector.class);

    private final ModuleRegistry registry;
    private final ModuleContext context;
    private final SecurityEventSink sink;
    private final SecurityExceptionClassifier exceptionClassifier;

    public RequestInspector(ModuleRegistry registry, ModuleContext context, SecurityEventSink sink,
            SecurityExceptionClassifier exceptionClassifier) {
        this.registry = registry;
        this.context = context;
        this.sink = sink;
        this.exceptionClassifier = exceptionClassifier;
        log.info("[EventWatch] Inspector started with {} module(s)", registry.getModules().size());
    }

    /**
     * Starts inspecting one request. Disabled or excluded requests get an
     * inspection whose steps do nothing.
     */
    public Inspection begin(RequestContext request) {
        EventWatchProperties properties = context.getProperties();
        boolean active = properties.isEnabled() && !properties.isExcludedPath(request.getPath());
        return new Inspection(request, active, registry.getEnabledModules(context), context, sink,
                exceptionClassifier);
    }

    /**
     * Runs the whole pipeline around {@code downstream}.
     *
     * @return the status code returned by {@code downstream}
     * @throws Exception whatever {@code downstream} threw, unchanged
     */
    public int inspect(RequestContext request, Downstream downstream) throws Exception {
        Inspection inspection = begin(request);
        inspection.preCheck();
        int status;
        try {
            status = downstream.proceed();
        } catch (Throwable ex) {
            inspection.failed(ex);
            throw ex;
        }
        inspection.completed(status);
        return status;
    }
}
