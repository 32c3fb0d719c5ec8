package com.bluequee.tabconfig.config;

import com.bluequee.observability.MetricFactory;
import com.bluequee.observability.SpanHelper;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.GlobalOpenTelemetry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Metrics and tracing helpers.
 *
 * <p>The tracer comes from {@link GlobalOpenTelemetry}: a no-op unless the OpenTelemetry Java agent
 * (or an SDK registered at startup) is present.
 */
@Configuration
public class ObservabilityConfig {

    public static final String INSTRUMENTATION_NAME = "com.bluequee.tabconfig";

    @Bean
    public MetricFactory metricFactory(MeterRegistry registry, TabConfigServiceProperties properties) {
        return new MetricFactory(registry, properties.name());
    }

    @Bean
    public SpanHelper spanHelper() {
        return new SpanHelper(GlobalOpenTelemetry.getTracer(INSTRUMENTATION_NAME));
    }
}
