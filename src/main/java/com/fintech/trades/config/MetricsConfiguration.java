package com.fintech.trades.config;

import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.config.MeterFilter;
import io.micrometer.core.instrument.distribution.DistributionStatisticConfig;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Metrics configuration shared by all meters.
 *
 * - common tags identify the instance in Prometheus
 * - API timers publish p50/p95/p99 and histogram buckets sized for
 *   in-memory cache lookups (sub-millisecond to tens of milliseconds)
 */
@Configuration
public class MetricsConfiguration {

    @Bean
    public MeterRegistryCustomizer<MeterRegistry> metricsCommonTags() {
        return registry -> {
            registry.config().commonTags(
                "application", "trade-relay-service",
                "environment", getEnvironment()
            );

            registry.config().meterFilter(new MeterFilter() {
                @Override
                public DistributionStatisticConfig configure(Meter.Id id, DistributionStatisticConfig config) {
                    if (id.getType() != Meter.Type.TIMER || !id.getName().startsWith("api.")) {
                        return config;
                    }
                    return DistributionStatisticConfig.builder()
                        .percentiles(0.5, 0.95, 0.99)
                        .percentilePrecision(2)
                        .serviceLevelObjectives(
                            Duration.ofMillis(1).toNanos(),
                            Duration.ofMillis(5).toNanos(),
                            Duration.ofMillis(10).toNanos(),
                            Duration.ofMillis(50).toNanos()   // SLA boundary
                        )
                        .percentilesHistogram(true)
                        .expiry(Duration.ofSeconds(60))
                        .bufferLength(3)
                        .build()
                        .merge(config);
                }
            });
        };
    }

    private String getEnvironment() {
        String env = System.getenv("SPRING_PROFILES_ACTIVE");
        return env != null ? env : "local";
    }
}
