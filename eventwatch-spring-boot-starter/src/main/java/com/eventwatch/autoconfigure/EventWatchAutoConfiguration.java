package com.eventwatch.autoconfigure;

import com.eventwatch.core.RequestInspector;
import com.eventwatch.core.config.EventWatchProperties;
import com.eventwatch.core.exception.SecurityExceptionClassifier;
import com.eventwatch.core.exception.SecurityExceptionKind;
import com.eventwatch.core.pattern.ThreatPatternRegistry;
import com.eventwatch.core.pattern.UserAgentPatternRegistry;
import com.eventwatch.core.plugin.DetectionModule;
import com.eventwatch.core.plugin.ModuleContext;
import com.eventwatch.core.plugin.ModuleRegistry;
import com.eventwatch.core.sink.DispatchingSecurityEventSink;
import com.eventwatch.core.sink.LoggingSecurityEventListener;
import com.eventwatch.core.sink.SecurityEventListener;
import com.eventwatch.core.sink.SecurityEventSink;
import com.eventwatch.core.store.InMemorySecurityEventStore;
import jakarta.servlet.ServletException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.core.AuthenticationException;

import java.time.Clock;
import java.util.List;

/**
 * Auto-configuration for EventWatch.
 * Activated when {@code eventwatch.enabled=true} (default).
 */
@AutoConfiguration
@ConditionalOnProperty(name = "eventwatch.enabled", havingValue = "true", matchIfMissing = true)
@ComponentScan(basePackages = "com.eventwatch.module")
public class EventWatchAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(EventWatchAutoConfiguration.class);

    @Bean
    @ConfigurationProperties(prefix = "eventwatch")
    public EventWatchProperties eventWatchProperties() {
        return new EventWatchProperties();
    }

    @Bean
    @ConditionalOnMissingBean(name = "eventWatchClock")
    public Clock eventWatchClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public ThreatPatternRegistry threatPatternRegistry() {
        return ThreatPatternRegistry.defaults();
    }

    @Bean
    @ConditionalOnMissingBean
    public UserAgentPatternRegistry userAgentPatternRegistry() {
        return UserAgentPatternRegistry.defaults();
    }

    @Bean
    @ConditionalOnMissingBean
    public SecurityExceptionClassifier securityExceptionClassifier() {
        return SecurityExceptionClassifier.builder()
                .withDefaults()
                .rule(SecurityExceptionKind.UNAUTHORIZED_ACCESS, AccessDeniedException.class)
                .rule(SecurityExceptionKind.UNAUTHORIZED_ACCESS, AuthenticationException.class)
                .wrapper(ServletException.class)
                .build();
    }

    @Bean
    @ConditionalOnMissingBean
    public InMemorySecurityEventStore securityEventStore(EventWatchProperties properties,
            @Qualifier("eventWatchClock") Clock clock) {
        // TODO: Add a persistent store once a retention policy is agreed for audit records
        EventWatchProperties.StoreProperties store = properties.getStore();
        log.info("[EventWatch] Using InMemorySecurityEventStore (last {} events, {} clients)",
                store.getMaxRecentEvents(), store.getMaxTrackedClients());
        return new InMemorySecurityEventStore(store.getMaxRecentEvents(), store.getMaxTrackedClients(), clock);
    }

    @Bean
    @ConditionalOnMissingBean(name = "eventWatchCleanupScheduler")
    public ThreadPoolTaskScheduler eventWatchCleanupScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("eventwatch-cleanup-");
        scheduler.setDaemon(true);
        return scheduler;
    }

    @Bean
    @ConditionalOnMissingBean
    public SecurityEventStoreCleanup securityEventStoreCleanup(InMemorySecurityEventStore store,
            EventWatchProperties properties,
            @Qualifier("eventWatchCleanupScheduler") ThreadPoolTaskScheduler scheduler) {
        return new SecurityEventStoreCleanup(store, scheduler, properties.getStore().getRetention(),
                properties.getStore().getCleanupInterval());
    }

    @Bean
    @ConditionalOnMissingBean
    public LoggingSecurityEventListener loggingSecurityEventListener() {
        return new LoggingSecurityEventListener();
    }

    @Bean
    @ConditionalOnMissingBean(name = "eventWatchSinkExecutor")
    public ThreadPoolTaskExecutor eventWatchSinkExecutor(EventWatchProperties properties) {
        EventWatchProperties.SinkProperties sink = properties.getSink();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(sink.getThreads());
        executor.setMaxPoolSize(sink.getThreads());
        executor.setQueueCapacity(sink.getQueueCapacity());
        executor.setThreadNamePrefix("eventwatch-sink-");
        return executor;
    }

    @Bean
    @ConditionalOnMissingBean
    public SecurityEventSink securityEventSink(List<SecurityEventListener> listeners,
            EventWatchProperties properties, @Qualifier("eventWatchClock") Clock clock,
            @Qualifier("eventWatchSinkExecutor") ThreadPoolTaskExecutor executor) {
        if (!properties.getSink().isAsync()) {
            log.info("[EventWatch] Delivering events synchronously to {} listener(s)", listeners.size());
            return DispatchingSecurityEventSink.synchronous(listeners, clock);
        }
        return new DispatchingSecurityEventSink(listeners, executor, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public ModuleContext moduleContext(EventWatchProperties properties, @Qualifier("eventWatchClock") Clock clock) {
        return new ModuleContext(properties, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public ModuleRegistry moduleRegistry(List<DetectionModule> modules) {
        return new ModuleRegistry(modules);
    }

    @Bean
    @ConditionalOnMissingBean
    public RequestInspector requestInspector(ModuleRegistry registry, ModuleContext context,
            SecurityEventSink sink, SecurityExceptionClassifier classifier) {
        return new RequestInspector(registry, context, sink, classifier);
    }

    @Bean
    @ConditionalOnMissingBean
    public PrincipalResolver principalResolver() {
        return new SecurityContextPrincipalResolver();
    }

    @Bean
    @ConditionalOnMissingBean
    public ClientIpResolver clientIpResolver() {
        return new ClientIpResolver();
    }

    @Bean
    public EventWatchSecurityFilter eventWatchSecurityFilter(RequestInspector inspector,
            EventWatchProperties properties, ClientIpResolver clientIpResolver,
            PrincipalResolver principalResolver) {
        return new EventWatchSecurityFilter(inspector, properties, clientIpResolver, principalResolver);
    }
}
