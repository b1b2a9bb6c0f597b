package com.eventwatch.module.formscan;

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

import java.util.List;
import java.util.Map;

/**
 * Scans URL-encoded form fields of state-changing requests for XSS and
 * SQL-injection payloads. Reports at most one event per category per field,
 * naming the field but never echoing its value.
 *
 * <p>
 * The body itself is buffered and rewound by the servlet layer before this
 * module runs; a body that was too large to buffer is skipped.
 * </p>
 */
@Component
public class FormScanModule implements DetectionModule {

    private static final Logger log = LoggerFactory.getLogger(FormScanModule.class);
    public static final String ID = "form-scan";

    private final ThreatPatternRegistry patterns;

    public FormScanModule(ThreatPatternRegistry patterns) {
        this.patterns = patterns;
    }

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public String getName() {
        return "Form Body Scanner";
    }

    @Override
    public int getOrder() {
        return 300;
    }

    @Override
    public void analyzeRequest(RequestContext request, EventEmitter emitter, ModuleContext context) {
        if (!request.isStateChanging() || !request.isFormEncoded()) {
            return;
        }
        if (!request.isBodyBuffered()) {
            log.debug("[EventWatch] [form-scan] Body of {} {} not buffered, skipping",
                    request.getMethod(), LogSanitizer.sanitize(request.getPath()));
            return;
        }

        for (Map.Entry<String, List<String>> field : request.getFormFields().entrySet()) {
            String value = String.join(",", field.getValue());
            for (ThreatMatch match : patterns.matchBodyThreats(value)) {
                emitter.fieldMatch(match.getCategory(), describe(match.getCategory(), field.getKey()),
                        field.getKey(), SecurityEventSeverity.HIGH);
            }
        }
    }

    private static String describe(String category, String field) {
        String safeField = LogSanitizer.sanitize(field, 100);
        if (SecurityEventCategories.XSS_PATTERN_DETECTION.equals(category)) {
            return "XSS pattern detected in field " + safeField;
        }
        return "SQL injection pattern detected in field " + safeField;
    }
}
