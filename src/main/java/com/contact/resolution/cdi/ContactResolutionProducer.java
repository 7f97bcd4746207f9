package com.contact.resolution.cdi;

import com.contact.resolution.api.ContactResolver;
import com.contact.resolution.cache.CacheConfig;
import com.contact.resolution.mcp.McpToolDefinition;
import com.contact.resolution.mcp.PersonalDataMcpTools;
import com.contact.resolution.metrics.MetricsService;
import com.contact.resolution.metrics.MicrometerMetricsService;
import com.contact.resolution.metrics.NoOpMetricsService;
import com.contact.resolution.pim.CalendarEventReader;
import com.contact.resolution.pim.ContactWriter;
import com.contact.resolution.pim.MailReader;
import com.contact.resolution.pim.MessageReader;
import com.contact.resolution.source.AutomationExecutor;
import com.contact.resolution.source.AutomationIdentitySource;
import com.contact.resolution.source.IdentitySource;
import com.contact.resolution.source.InMemoryIdentitySource;
import com.contact.resolution.tracing.NoOpTracingService;
import com.contact.resolution.tracing.OpenTelemetryTracingService;
import com.contact.resolution.tracing.TracingService;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.OpenTelemetry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * CDI producer that wires contact resolution from MicroProfile Config properties.
 *
 * <p>The host application supplies the OS-facing collaborators as beans:
 * an {@link AutomationExecutor} and, optionally, the calendar, mail and
 * message readers and a {@link ContactWriter}. Tools whose reader is missing
 * are not exposed.</p>
 *
 * <h2>Configuration</h2>
 * <pre>
 * contact-resolution.cache.ttl-ms=300000
 * contact-resolution.metrics.enabled=true
 * contact-resolution.tracing.enabled=false
 * </pre>
 */
@ApplicationScoped
public class ContactResolutionProducer {

    private static final Logger log = LoggerFactory.getLogger(ContactResolutionProducer.class);

    @Inject
    @ConfigProperty(name = "contact-resolution.cache.ttl-ms", defaultValue = "300000")
    long cacheTtlMillis;

    @Inject
    @ConfigProperty(name = "contact-resolution.metrics.enabled", defaultValue = "true")
    boolean metricsEnabled;

    @Inject
    @ConfigProperty(name = "contact-resolution.tracing.enabled", defaultValue = "false")
    boolean tracingEnabled;

    @Inject
    Instance<AutomationExecutor> automationExecutor;

    @Inject
    Instance<MeterRegistry> meterRegistry;

    @Inject
    Instance<OpenTelemetry> openTelemetry;

    @Inject
    Instance<CalendarEventReader> calendarReader;

    @Inject
    Instance<MailReader> mailReader;

    @Inject
    Instance<MessageReader> messageReader;

    @Inject
    Instance<ContactWriter> contactWriter;

    @Produces
    @ApplicationScoped
    public ContactResolver contactResolver() {
        log.info("Producing ContactResolver: ttl={}ms metrics={} tracing={}",
                cacheTtlMillis, metricsEnabled, tracingEnabled);
        return ContactResolver.builder()
                .identitySource(identitySource())
                .cacheConfig(CacheConfig.ofMillis(cacheTtlMillis))
                .metricsService(metricsService())
                .tracingService(tracingService())
                .build();
    }

    public void closeResolver(@Disposes ContactResolver resolver) {
        log.info("Closing ContactResolver");
        resolver.close();
    }

    @Produces
    @ApplicationScoped
    public PersonalDataMcpTools personalDataMcpTools(ContactResolver resolver) {
        PersonalDataMcpTools tools = PersonalDataMcpTools.builder(resolver)
                .calendarReader(orNull(calendarReader))
                .mailReader(orNull(mailReader))
                .messageReader(orNull(messageReader))
                .contactWriter(orNull(contactWriter))
                .build();
        log.info("MCP tools available: {}", tools.getToolDefinitions().stream()
                .map(McpToolDefinition::name)
                .toList());
        return tools;
    }

    private IdentitySource identitySource() {
        if (automationExecutor.isResolvable()) {
            return new AutomationIdentitySource(automationExecutor.get());
        }
        log.warn("No AutomationExecutor bean available, contact names will not be resolved");
        return new InMemoryIdentitySource();
    }

    private MetricsService metricsService() {
        if (metricsEnabled && meterRegistry.isResolvable()) {
            return new MicrometerMetricsService(meterRegistry.get());
        }
        if (metricsEnabled) {
            log.warn("Metrics enabled but no MeterRegistry bean available, falling back to NoOp");
        }
        return new NoOpMetricsService();
    }

    private TracingService tracingService() {
        if (tracingEnabled && openTelemetry.isResolvable()) {
            return new OpenTelemetryTracingService(openTelemetry.get());
        }
        if (tracingEnabled) {
            log.warn("Tracing enabled but no OpenTelemetry bean available, falling back to NoOp");
        }
        return new NoOpTracingService();
    }

    private static <T> T orNull(Instance<T> instance) {
        return instance.isResolvable() ? instance.get() : null;
    }
}
