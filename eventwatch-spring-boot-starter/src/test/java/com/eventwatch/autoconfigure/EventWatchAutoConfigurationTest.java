package com.eventwatch.autoconfigure;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

import java.time.Duration;
import java.util.stream.Collectors;

import com.eventwatch.core.RequestInspector;
import com.eventwatch.core.config.EventWatchProperties;
import com.eventwatch.core.exception.SecurityExceptionClassifier;
import com.eventwatch.core.exception.SecurityExceptionKind;
import com.eventwatch.core.plugin.DetectionModule;
import com.eventwatch.core.plugin.ModuleContext;
import com.eventwatch.core.plugin.ModuleRegistry;
import com.eventwatch.core.sink.DispatchingSecurityEventSink;
import com.eventwatch.core.sink.SecurityEventSink;
import com.eventwatch.core.store.InMemorySecurityEventStore;
import jakarta.servlet.ServletException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.context.ConfigurationPropertiesAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.authentication.BadCredentialsException;

@DisplayName("EventWatchAutoConfiguration")
class EventWatchAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(
                    ConfigurationPropertiesAutoConfiguration.class,
                    EventWatchAutoConfiguration.class));

    @Test
    @DisplayName("should wire the filter, the sink and every detection module")
    void shouldWireDefaults() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(EventWatchSecurityFilter.class);
            assertThat(context).hasSingleBean(RequestInspector.class);
            assertThat(context).hasSingleBean(InMemorySecurityEventStore.class);
            assertThat(context).hasSingleBean(SecurityEventStoreCleanup.class);
            assertThat(context.getBean(SecurityEventSink.class)).isInstanceOf(DispatchingSecurityEventSink.class);

            ModuleRegistry registry = context.getBean(ModuleRegistry.class);
            assertThat(registry.getModules().stream().map(DetectionModule::getId).collect(Collectors.toList()))
                    .containsExactly("url-threat", "user-agent", "form-scan", "slow-request", "sensitive-area");
        });
    }

    @Test
    @DisplayName("should bind eventwatch.* properties")
    void shouldBindProperties() {
        contextRunner
                .withPropertyValues(
                        "eventwatch.slow-request-threshold=5s",
                        "eventwatch.sensitive-paths=/billing",
                        "eventwatch.form-scan.max-body-bytes=2048",
                        "eventwatch.modules.user-agent.enabled=false")
                .run(context -> {
                    EventWatchProperties properties = context.getBean(EventWatchProperties.class);
                    assertThat(properties.getSlowRequestThreshold()).isEqualTo(Duration.ofSeconds(5));
                    assertThat(properties.getSensitivePaths()).containsExactly("/billing");
                    assertThat(properties.getFormScan().getMaxBodyBytes()).isEqualTo(2048);

                    ModuleRegistry registry = context.getBean(ModuleRegistry.class);
                    assertThat(registry.getEnabledModules(context.getBean(ModuleContext.class)))
                            .extracting(DetectionModule::getId)
                            .doesNotContain("user-agent")
                            .contains("url-threat");
                });
    }

    @Test
    @DisplayName("should back off entirely when disabled")
    void shouldBackOffWhenDisabled() {
        contextRunner.withPropertyValues("eventwatch.enabled=false")
                .run(context -> {
                    assertThat(context).doesNotHaveBean(EventWatchSecurityFilter.class);
                    assertThat(context).doesNotHaveBean(RequestInspector.class);
                });
    }

    @Test
    @DisplayName("should keep a user-supplied sink")
    void shouldKeepCustomSink() {
        SecurityEventSink custom = mock(SecurityEventSink.class);

        contextRunner.withBean(SecurityEventSink.class, () -> custom)
                .run(context -> assertThat(context.getBean(SecurityEventSink.class)).isSameAs(custom));
    }

    @Test
    @DisplayName("should classify Spring Security failures as unauthorized access")
    void shouldClassifySpringSecurityFailures() {
        contextRunner.run(context -> {
            SecurityExceptionClassifier classifier = context.getBean(SecurityExceptionClassifier.class);
            assertThat(classifier.classify(new AccessDeniedException("no")))
                    .contains(SecurityExceptionKind.UNAUTHORIZED_ACCESS);
            assertThat(classifier.classify(new BadCredentialsException("no")))
                    .contains(SecurityExceptionKind.UNAUTHORIZED_ACCESS);
            assertThat(classifier.classify(new IllegalArgumentException("no"))).isEmpty();
            assertThat(classifier.classify(new ServletException("dispatch failed", new AccessDeniedException("no"))))
                    .contains(SecurityExceptionKind.UNAUTHORIZED_ACCESS);
        });
    }
}
