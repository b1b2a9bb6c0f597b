package com.eventwatch.core;

import com.eventwatch.core.exception.SecurityExceptionClassifier;
import com.eventwatch.core.exception.SecurityExceptionKind;
import com.eventwatch.core.model.RequestContext;
import com.eventwatch.core.model.RequestOutcome;
import com.eventwatch.core.model.SecurityEventCategories;
import com.eventwatch.core.model.SecurityEventSeverity;
import com.eventwatch.core.plugin.DetectionModule;
import com.eventwatch.core.plugin.EventEmitter;
import com.eventwatch.core.plugin.ModuleContext;
import com.eventwatch.core.sink.SecurityEventSink;
import com.eventwatch.core.util.LogSanitizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * One request's pass through the pipeline:
 * {@code START -> PRE_CHECKED -> INVOKING -> [EXCEPTION_CLASSIFIED] -> POST_CHECKED -> COMPLETED}.
 *
 * <p>
 * Steps called out of order are ignored. None of the methods throw: module and
 * sink failures are logged and swallowed so they can never mask the
 * downstream result. The final step may run on a container thread when the
 * request completes asynchronously; transitions are synchronized.
 * </p>
 */
public class Inspection {

    private static final Logger log = LoggerFactory.getLogger(Inspection.class);

    private final RequestContext request;
    private final boolean active;
    private final List<DetectionModule> modules;
    private final ModuleContext context;
    private final SecurityExceptionClassifier exceptionClassifier;
    private final EventEmitter emitter;

    private volatile InspectionPhase phase = InspectionPhase.START;
    private volatile Instant startedAt;

    Inspection(RequestContext request, boolean active, List<DetectionModule> modules, ModuleContext context,
            SecurityEventSink sink, SecurityExceptionClassifier exceptionClassifier) {
        this.request = request;
        this.active = active;
        this.modules = modules;
        this.context = context;
        this.exceptionClassifier = exceptionClassifier;
        this.emitter = new EventEmitter(request, sink);
    }

    /**
     * Runs the pre-invocation checks, then starts the clock. Call right before
     * handing the request downstream.
     */
    public void preCheck() {
        if (!advance(InspectionPhase.START, InspectionPhase.PRE_CHECKED)) {
            return;
        }
        if (active) {
            for (DetectionModule module : modules) {
                try {
                    module.analyzeRequest(request, emitter, context);
                } catch (RuntimeException e) {
                    log.error("[EventWatch] Module '{}' failed during pre-check: {}",
                            module.getId(), e.getMessage());
                }
            }
        }
        phase = InspectionPhase.INVOKING;
        startedAt = context.getClock().instant();
    }

    /** The downstream handler returned normally with {@code statusCode}. */
    public void completed(int statusCode) {
        if (!advance(InspectionPhase.INVOKING, InspectionPhase.POST_CHECKED)) {
            return;
        }
        postCheck(RequestOutcome.completed(statusCode, elapsed()));
        phase = InspectionPhase.COMPLETED;
    }

    /**
     * The downstream handler threw. Classifies the failure, then runs the
     * post-invocation checks. The caller rethrows {@code failure} itself.
     */
    public void failed(Throwable failure) {
        if (!advance(InspectionPhase.INVOKING, InspectionPhase.EXCEPTION_CLASSIFIED)) {
            return;
        }
        Duration elapsed = elapsed();
        if (active) {
            classify(failure);
        }
        phase = InspectionPhase.POST_CHECKED;
        postCheck(RequestOutcome.failed(failure, elapsed));
        phase = InspectionPhase.COMPLETED;
    }

    public InspectionPhase getPhase() {
        return phase;
    }

    private void classify(Throwable failure) {
        try {
            Optional<SecurityExceptionKind> kind = exceptionClassifier.classify(failure);
            if (kind.isEmpty()) {
                log.debug("[EventWatch] Non-security exception {} for path {}",
                        failure.getClass().getSimpleName(), LogSanitizer.sanitize(request.getPath()));
                return;
            }
            Throwable cause = exceptionClassifier.findClassifiedCause(failure);
            String typeName = cause.getClass().getSimpleName();
            log.warn("[EventWatch] Security-relevant exception {} ({}) for path {}",
                    typeName, kind.get(), LogSanitizer.sanitize(request.getPath()));
            emitter.suspicious(SecurityEventCategories.SECURITY_EXCEPTION,
                    "Security-related exception occurred: " + typeName,
                    cause.getClass().getName(),
                    SecurityEventSeverity.HIGH);
        } catch (RuntimeException e) {
            log.error("[EventWatch] Exception classification failed: {}", e.getMessage());
        }
    }

    private void postCheck(RequestOutcome outcome) {
        if (!active) {
            return;
        }
        for (DetectionModule module : modules) {
            try {
                module.analyzeOutcome(request, outcome, emitter, context);
            } catch (RuntimeException e) {
                log.error("[EventWatch] Module '{}' failed during post-check: {}",
                        module.getId(), e.getMessage());
            }
        }
    }

    private Duration elapsed() {
        try {
            Duration elapsed = Duration.between(startedAt, context.getClock().instant());
            return elapsed.isNegative() ? Duration.ZERO : elapsed;
        } catch (RuntimeException e) {
            return Duration.ZERO;
        }
    }

    private synchronized boolean advance(InspectionPhase expected, InspectionPhase next) {
        if (phase != expected) {
            log.debug("[EventWatch] Ignoring transition to {} from {} for {}",
                    next, phase, LogSanitizer.sanitize(request.getPath()));
            return false;
        }
        phase = next;
        return true;
    }
}
