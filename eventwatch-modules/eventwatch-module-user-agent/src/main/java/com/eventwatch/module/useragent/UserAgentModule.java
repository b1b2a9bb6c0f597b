package com.eventwatch.module.useragent;

import com.eventwatch.core.config.EventWatchProperties;
import com.eventwatch.core.model.RequestContext;
import com.eventwatch.core.pattern.UserAgentPatternRegistry;
import com.eventwatch.core.plugin.DetectionModule;
import com.eventwatch.core.plugin.EventEmitter;
import com.eventwatch.core.plugin.ModuleContext;
import com.eventwatch.core.util.LogSanitizer;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Reports missing headers, scanner tooling and generic automation based on
 * the User-Agent header.
 */
@Component
public class UserAgentModule implements DetectionModule {

    private static final String ID = "user-agent";

    private final UserAgentClassifier classifier;

    @Autowired
    public UserAgentModule(UserAgentPatternRegistry patterns, EventWatchProperties properties) {
        this(new UserAgentClassifier(patterns, properties.getHealthCheckPaths()));
    }

    public UserAgentModule(UserAgentClassifier classifier) {
        this.classifier = classifier;
    }

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public String getName() {
        return "User-Agent Classifier";
    }

    @Override
    public int getOrder() {
        return 200;
    }

    @Override
    public void analyzeRequest(RequestContext request, EventEmitter emitter, ModuleContext context) {
        UserAgentClassification classification = classifier.classify(request.getUserAgent(), request.getPath());
        if (!classification.isReportable()) {
            return;
        }
        emitter.suspicious(classification.getCategory(),
                describe(classification, request.getUserAgent()),
                request.getUserAgent(),
                classification.getSeverity());
    }

    private static String describe(UserAgentClassification classification, String userAgent) {
        switch (classification.getTier()) {
            case MISSING:
                return "Request without User-Agent header";
            case SECURITY_SCANNER:
                return "Security scanning tool detected: " + LogSanitizer.sanitize(userAgent, 200);
            default:
                return "Automated client detected: " + LogSanitizer.sanitize(userAgent, 200);
        }
    }
}
