package com.eventwatch.module.sensitivearea;

import com.eventwatch.core.model.RequestContext;
import com.eventwatch.core.model.RequestOutcome;
import com.eventwatch.core.plugin.DetectionModule;
import com.eventwatch.core.plugin.EventEmitter;
import com.eventwatch.core.plugin.ModuleContext;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Writes an audit record when an authenticated user touches one of the
 * configured sensitive areas. Anonymous traffic is not recorded.
 */
@Component
public class SensitiveAreaModule implements DetectionModule {

    static final String AREA_TAG = "SensitiveArea";
    private static final String ID = "sensitive-area";

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public String getName() {
        return "Sensitive Area Audit";
    }

    @Override
    public int getOrder() {
        return 500;
    }

    @Override
    public void analyzeOutcome(RequestContext request, RequestOutcome outcome, EventEmitter emitter,
            ModuleContext context) {
        if (!request.isAuthenticated()) {
            return;
        }
        if (!isSensitive(request.getPath(), context.getProperties().getSensitivePaths())) {
            return;
        }
        emitter.dataAccess(AREA_TAG, outcome.getStatusCode());
    }

    /**
     * Plain case-insensitive prefix match: {@code /admin} also covers
     * {@code /administrator} and {@code /admin-panel}. End a configured prefix
     * with {@code /} to restrict it to one path segment.
     */
    static boolean isSensitive(String path, List<String> sensitivePaths) {
        if (path == null || sensitivePaths == null) {
            return false;
        }
        String lower = path.toLowerCase(Locale.ROOT);
        for (String prefix : sensitivePaths) {
            if (prefix != null && !prefix.isEmpty() && lower.startsWith(prefix.toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }
}
