package com.agentflow.api.config;

import com.agentflow.engine.metrics.AgentFlowMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Prometheus metrics configuration.
 */
@Configuration
public class MetricsConfiguration {

    @Bean
    public MeterRegistryCustomizer<MeterRegistry> metricsCommonTags() {
        return registry -> registry.config()
            .commonTags("application", "agentflow");
    }

    @Bean
    public AgentFlowMetrics agentFlowMetrics(MeterRegistry registry) {
        return new AgentFlowMetrics(registry);
    }
}
