package com.hyperdesk.vmrequest.config;

import com.hyperdesk.observability.CommandMetrics;
import com.hyperdesk.observability.SpanHelper;
import com.hyperdesk.vmrequest.application.vmrequest.CommandInstrumentation;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.GlobalOpenTelemetry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration(proxyBeanMethods = false)
public class ObservabilityConfig {

    static final String INSTRUMENTATION_SCOPE = "com.hyperdesk.vmrequest";

    @Bean
    public CommandMetrics commandMetrics(MeterRegistry meterRegistry, VmRequestServiceProperties properties) {
        return new CommandMetrics(meterRegistry, properties.name());
    }

    @Bean
    public CommandInstrumentation commandInstrumentation(CommandMetrics commandMetrics) {
        return new CommandInstrumentation(commandMetrics);
    }

    /** Uses whatever OpenTelemetry SDK the runtime installed globally; no-op otherwise. */
    @Bean
    public SpanHelper spanHelper() {
        return new SpanHelper(GlobalOpenTelemetry.getTracer(INSTRUMENTATION_SCOPE));
    }
}
