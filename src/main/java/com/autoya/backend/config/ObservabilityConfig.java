package com.autoya.backend.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import io.micrometer.core.aop.TimedAspect;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.config.MeterFilter;
import io.micrometer.core.instrument.distribution.DistributionStatisticConfig;
import lombok.extern.slf4j.Slf4j;

/**
 * Metrics wiring for the rental API.
 *
 * Meters scraped from /actuator/prometheus:
 * - api.* timers from {@code @Timed} controller methods
 * - autoya.service.* from {@link com.autoya.backend.util.MetricsHelper}
 * - the usual JVM, HikariCP and http.server.requests meters
 */
@Slf4j
@Configuration
public class ObservabilityConfig {

    private static final String SERVICE_METER_PREFIX = "autoya.service";

    @Bean
    public MeterRegistryCustomizer<MeterRegistry> autoyaCommonTags(
            @Value("${spring.application.name:autoya-backend}") String application,
            @Value("${autoya.environment:dev}") String environment) {
        log.info("Metrics common tags: application={}, environment={}", application, environment);
        return registry -> registry.config().commonTags("application", application, "environment", environment);
    }

    @Bean
    public TimedAspect timedAspect(MeterRegistry registry) {
        return new TimedAspect(registry);
    }

    /**
     * Publishes p50/p95/p99 for service operation timers.
     */
    @Bean
    public MeterFilter servicePercentiles() {
        return new MeterFilter() {
            @Override
            public DistributionStatisticConfig configure(Meter.Id id, DistributionStatisticConfig config) {
                if (!id.getName().startsWith(SERVICE_METER_PREFIX)) {
                    return config;
                }
                return DistributionStatisticConfig.builder()
                    .percentiles(0.5, 0.95, 0.99)
                    .build()
                    .merge(config);
            }
        };
    }
}
