package com.versioning.engine.metrics;

import com.versioning.engine.config.VersioningProperties;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Metrics configuration for the versioning engine.
 * Adds the application tag to every meter.
 */
@Configuration
public class MetricsConfiguration {

    @Bean
    public MeterRegistryCustomizer<MeterRegistry> metricsCommonTags(VersioningProperties properties) {
        return registry -> registry.config()
            .commonTags("application", properties.getApplicationName());
    }

    @Bean
    public VersioningMetrics versioningMetrics() {
        return new VersioningMetrics();
    }
}
