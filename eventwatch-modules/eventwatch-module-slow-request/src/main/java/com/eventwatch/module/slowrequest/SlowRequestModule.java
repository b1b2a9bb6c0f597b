package com.eventwatch.module.slowrequest;

import com.eventwatch.core.model.RequestContext;
import com.eventwatch.core.model.RequestOutcome;
import com.eventwatch.core.model.SecurityEventCategories;
import com.eventwatch.core.model.SecurityEventSeverity;
import com.eventwatch.core.plugin.DetectionModule;
import com.eventwatch.core.plugin.EventEmitter;
import com.eventwatch.core.plugin.ModuleContext;
import com.eventwatch.core.util.LogSanitizer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Locale;

/**
 * Reports requests whose handling took strictly longer than
 * {@code eventwatch.slow-request-threshold}, whether they completed or failed.
 */
@Component
public class SlowRequestModule implements DetectionModule {

    private static final String ID = "slow-request";

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public String getName() {
        return "Slow Request Detector";
    }

    @Override
    public int getOrder() {
        return 400;
    }

    @Override
    public void analyzeOutcome(RequestContext request, RequestOutcome outcome, EventEmitter emitter,
            ModuleContext context) {
        Duration threshold = context.getProperties().getSlowRequestThreshold();
        Duration elapsed = outcome.getElapsed();
        if (threshold == null || elapsed == null || elapsed.compareTo(threshold) <= 0) {
            return;
        }
        double seconds = elapsed.toMillis() / 1000.0;
        emitter.suspicious(SecurityEventCategories.SLOW_REQUEST,
                String.format(Locale.ROOT, "Request to %s took %.2f seconds",
                        LogSanitizer.sanitize(request.getPath(), 200), seconds),
                null,
                SecurityEventSeverity.MEDIUM);
    }
}
