package com.eventwatch.autoconfigure;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;

@DisplayName("ClientIpResolver")
class ClientIpResolverTest {

    private final ClientIpResolver resolver = new ClientIpResolver();

    @Test
    @DisplayName("should prefer the first X-Forwarded-For entry")
    void shouldPreferForwardedFor() {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.addHeader("X-Forwarded-For", " 203.0.113.9 , 10.0.0.1");
        request.addHeader("X-Real-IP", "198.51.100.2");

        assertThat(resolver.resolve(request)).isEqualTo("203.0.113.9");
    }

    @Test
    @DisplayName("should fall back to X-Real-IP")
    void shouldFallBackToRealIp() {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.addHeader("X-Real-IP", "198.51.100.2");

        assertThat(resolver.resolve(request)).isEqualTo("198.51.100.2");
    }

    @Test
    @DisplayName("should fall back to the socket address")
    void shouldFallBackToRemoteAddress() {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.setRemoteAddr("192.0.2.44");
        request.addHeader("X-Forwarded-For", "");

        assertThat(resolver.resolve(request)).isEqualTo("192.0.2.44");
    }
}
