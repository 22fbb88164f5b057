package com.autoya.backend.util;

import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

import org.springframework.stereotype.Component;

import com.autoya.backend.result.ServiceResult;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Helper class for service-level business metrics.
 *
 * Metrics exposed via Prometheus at /actuator/prometheus:
 * - autoya.service.operations (counter): mutating operations by outcome
 * - autoya.service.duration (timer): time spent in a service operation
 * - autoya.api.errors (counter): error responses by kind
 *
 * Tags:
 * - entity: vehicle/owner/renter/rental
 * - operation: save/update/delete
 * - outcome: success, or the lower-cased error kind
 *
 * @see com.autoya.backend.config.ObservabilityConfig
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MetricsHelper {

    private static final String SERVICE_PREFIX = "autoya.service";
    private static final String API_PREFIX = "autoya.api";

    private final MeterRegistry meterRegistry;

    /**
     * Times a service operation and counts its outcome.
     *
     * @param entity entity tag
     * @param operation operation tag
     * @param operationBody the operation to run
     * @param <T> result value type
     * @return the operation's result, unchanged
     */
    public <T> ServiceResult<T> recordOperation(String entity, String operation,
                                                Supplier<ServiceResult<T>> operationBody) {
        long start = System.nanoTime();
        ServiceResult<T> result = operationBody.get();
        long durationNanos = System.nanoTime() - start;

        String outcome = result.isSuccess()
                ? "success"
                : result.getError().kind().name().toLowerCase();

        Counter.builder(SERVICE_PREFIX + ".operations")
            .tag("entity", entity)
            .tag("operation", operation)
            .tag("outcome", outcome)
            .description("Mutating service operations by outcome")
            .register(meterRegistry)
            .increment();

        Timer.builder(SERVICE_PREFIX + ".duration")
            .tag("entity", entity)
            .tag("operation", operation)
            .description("Service operation duration")
            .register(meterRegistry)
            .record(durationNanos, TimeUnit.NANOSECONDS);

        log.trace("Recorded {} {} outcome={} in {}ms",
            entity, operation, outcome, TimeUnit.NANOSECONDS.toMillis(durationNanos));

        return result;
    }

    /**
     * Counts an error response sent to a client.
     *
     * @param code error code written in the response body
     * @param status HTTP status
     */
    public void recordApiError(String code, int status) {
        Counter.builder(API_PREFIX + ".errors")
            .tag("code", code)
            .tag("status", String.valueOf(status))
            .description("Error responses returned to API clients")
            .register(meterRegistry)
            .increment();
    }
}
