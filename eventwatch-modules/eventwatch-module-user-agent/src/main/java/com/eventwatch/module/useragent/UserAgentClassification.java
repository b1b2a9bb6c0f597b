package com.eventwatch.module.useragent;

import com.eventwatch.core.model.SecurityEventCategories;
import com.eventwatch.core.model.SecurityEventSeverity;

import java.util.Optional;

/**
 * Verdict for one User-Agent header.
 */
public final class UserAgentClassification {

    private final UserAgentTier tier;
    private final String signature; // which allow/deny entry matched, if any

    private UserAgentClassification(UserAgentTier tier, String signature) {
        this.tier = tier;
        this.signature = signature;
    }

    static UserAgentClassification of(UserAgentTier tier) {
        return new UserAgentClassification(tier, null);
    }

    static UserAgentClassification of(UserAgentTier tier, String signature) {
        return new UserAgentClassification(tier, signature);
    }

    public UserAgentTier getTier() {
        return tier;
    }

    public Optional<String> getSignature() {
        return Optional.ofNullable(signature);
    }

    /** Whether this classification should produce an event. */
    public boolean isReportable() {
        return getCategory() != null;
    }

    /** Event category, or {@code null} if nothing should be emitted. */
    public String getCategory() {
        switch (tier) {
            case MISSING:
                return SecurityEventCategories.MISSING_USER_AGENT;
            case SECURITY_SCANNER:
                return SecurityEventCategories.SECURITY_SCANNER_USER_AGENT;
            case SUSPICIOUS_AUTOMATION:
                return SecurityEventCategories.SUSPICIOUS_AUTOMATION_USER_AGENT;
            default:
                return null;
        }
    }

    /** Event severity, or {@code null} if nothing should be emitted. */
    public SecurityEventSeverity getSeverity() {
        switch (tier) {
            case MISSING:
                return SecurityEventSeverity.LOW;
            case SECURITY_SCANNER:
                return SecurityEventSeverity.HIGH;
            case SUSPICIOUS_AUTOMATION:
                return SecurityEventSeverity.MEDIUM;
            default:
                return null;
        }
    }

    @Override
    public String toString() {
        return "UserAgentClassification{" + tier + (signature != null ? ", '" + signature + "'" : "") + '}';
    }
}
