package com.flowrunner.runner.config;

import com.flowrunner.engine.metrics.WorkflowMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Metrics configuration for the workflow runner.
 */
@Configuration
public class MetricsConfiguration {

    @Bean
    public MeterRegistryCustomizer<MeterRegistry> metricsCommonTags() {
        return registry -> registry.config()
            .commonTags("application", "flowrunner");
    }

    @Bean
    public WorkflowMetrics workflowMetrics(MeterRegistry registry) {
        return new WorkflowMetrics(registry);
    }
}
