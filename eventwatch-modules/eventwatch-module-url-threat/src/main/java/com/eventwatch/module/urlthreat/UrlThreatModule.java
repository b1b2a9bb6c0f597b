package com.eventwatch.module.urlthreat;

import com.eventwatch.core.model.RequestContext;
import com.eventwatch.core.model.SecurityEventCategories;
import com.eventwatch.core.model.SecurityEventSeverity;
import com.eventwatch.core.pattern.ThreatMatch;
import com.eventwatch.core.pattern.ThreatPatternRegistry;
import com.eventwatch.core.plugin.DetectionModule;
import com.eventwatch.core.plugin.EventEmitter;
import com.eventwatch.core.plugin.ModuleContext;
import com.eventwatch.core.util.LogSanitizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Flags path traversal, script injection and SQL-injection idioms in the
 * request path and query string. At most one event per request: the first
 * signature that fires.
 */
@Component
public class UrlThreatModule implements DetectionModule {

    private static final Logger log = LoggerFactory.getLogger(UrlThreatModule.class);
    private static final String ID = "url-threat";

    private final ThreatPatternRegistry patterns;

    public UrlThreatModule(ThreatPatternRegistry patterns) {
        this.patterns = patterns;
    }

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public String getName() {
        return "URL Threat Patterns";
    }

    @Override
    public int getOrder() {
        return 100;
    }

    @Override
    public void analyzeRequest(RequestContext request, EventEmitter emitter, ModuleContext context) {
        ThreatMatch match = patterns.matchUrlThreat(request.getPath(), request.getQueryString());
        if (!match.isMatched()) {
            return;
        }
        log.debug("[EventWatch] [url-threat] Pattern '{}' matched in {}",
                match.getSignature(), LogSanitizer.sanitize(request.getPath()));
        emitter.suspicious(SecurityEventCategories.MALICIOUS_URL_PATTERN,
                "Suspicious pattern '" + match.getSignature() + "' detected in request",
                match.getMatchedValue(),
                SecurityEventSeverity.HIGH);
    }
}
