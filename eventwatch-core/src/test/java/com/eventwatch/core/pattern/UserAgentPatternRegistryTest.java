package com.eventwatch.core.pattern;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Optional;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("UserAgentPatternRegistry")
class UserAgentPatternRegistryTest {

    private final UserAgentPatternRegistry registry = UserAgentPatternRegistry.defaults();

    @ParameterizedTest
    @ValueSource(strings = {
            "Mozilla/5.0 (compatible; Googlebot/2.1; +http://www.google.com/bot.html)",
            "PostmanRuntime/7.36.0",
            "k6/0.49.0 (https://k6.io/)",
            "GitHub-Actions",
            "facebookexternalhit/1.1"})
    @DisplayName("should recognise allowlisted clients")
    void shouldRecogniseLegitimate(String userAgent) {
        assertTrue(registry.findLegitimate(userAgent).isPresent());
    }

    @ParameterizedTest
    @ValueSource(strings = {"sqlmap/1.7.2#stable", "Nikto/2.5.0", "Mozilla/5.0 (Nmap Scripting Engine)",
            "Fuzz Faster U Fool v2.1.0 ffuf", "Nuclei - Open-source project"})
    @DisplayName("should recognise scanners")
    void shouldRecogniseScanners(String userAgent) {
        assertTrue(registry.findScanner(userAgent).isPresent());
    }

    @ParameterizedTest
    @ValueSource(strings = {"python-requests/2.31.0", "curl/8.4.0", "Java/11.0.2", "Go-http-client/1.1",
            "my-scraper-bot"})
    @DisplayName("should recognise generic automation")
    void shouldRecogniseAutomation(String userAgent) {
        assertTrue(registry.findAutomation(userAgent).isPresent());
    }

    @Test
    @DisplayName("should report the signature that matched")
    void shouldReportSignature() {
        assertEquals(Optional.of("sqlmap"), registry.findScanner("SQLMAP/1.0"));
    }

    @Test
    @DisplayName("should not treat ordinary browsers as anything")
    void shouldIgnoreBrowsers() {
        String chrome = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 "
                + "(KHTML, like Gecko) Chrome/124.0.0.0 Safari/537.36";

        assertFalse(registry.findLegitimate(chrome).isPresent());
        assertFalse(registry.findScanner(chrome).isPresent());
        assertFalse(registry.findAutomation(chrome).isPresent());
    }
}
