package com.eventwatch.module.useragent;

/**
 * Outcome tiers of User-Agent classification.
 */
public enum UserAgentTier {

    /** Header absent on a health or readiness path; not worth reporting. */
    EXEMPT,

    /** Header absent anywhere else. */
    MISSING,

    /** Known crawler, preview bot, or API/testing client. */
    LEGITIMATE,

    /** Vulnerability scanner or exploitation framework. */
    SECURITY_SCANNER,

    /** Bare HTTP library or generic bot/scraper token. */
    SUSPICIOUS_AUTOMATION,

    /** Nothing matched, ordinary browser traffic. */
    ORDINARY
}
