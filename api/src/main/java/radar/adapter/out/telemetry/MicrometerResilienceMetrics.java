package radar.adapter.out.telemetry;

import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import radar.config.TelemetryConfigMapping;
import radar.core.model.resilience.CircuitBreakerState;
import radar.core.port.out.ResilienceMetrics;

/**
 * Records resilience metrics using Micrometer.
 *
 * <p>All methods are no-ops when telemetry is disabled, making it safe
 * to inject and call without checking configuration at each call site.
 *
 * <p>Metrics recorded:
 * <ul>
 *   <li>{@code radar.circuit_breaker.state} - Breaker state gauge (0=closed, 1=half open, 2=open)</li>
 *   <li>{@code radar.circuit_breaker.calls} - Calls by service and outcome</li>
 *   <li>{@code radar.retry.attempts} - Attempts per retried operation</li>
 *   <li>{@code radar.retry.attempt.failed} - Failed attempts that were retried</li>
 *   <li>{@code radar.retry.exhausted} - Operations that ran out of attempts</li>
 *   <li>{@code radar.operation.timeouts} - Operations cut off by their deadline</li>
 *   <li>{@code radar.operation.timeout.deadline} - Deadlines of the operations that timed out</li>
 *   <li>{@code radar.operation.completed} - Operations finishing within their deadline</li>
 *   <li>{@code radar.rate_limit.checks} - Local admission decisions</li>
 *   <li>{@code radar.rate_limit.blocks} - Services blocked after 429 or manual block</li>
 *   <li>{@code radar.http.request.duration} - Latency of single transport attempts</li>
 *   <li>{@code radar.http.requests.total} - Logical requests after retries</li>
 *   <li>{@code radar.http.total.duration} - Logical request time including retries</li>
 *   <li>{@code radar.http.requests.failed} - Failed logical requests by error type</li>
 * </ul>
 */
@ApplicationScoped
public class MicrometerResilienceMetrics implements ResilienceMetrics {

    private static final List<String> OPERATION_PREFIXES = List.of("http_", "db_", "cache_");

    private final MeterRegistry registry;
    private final boolean enabled;

    @Inject
    public MicrometerResilienceMetrics(MeterRegistry registry, TelemetryConfigMapping config) {
        this.registry = registry;
        this.enabled = config != null && config.enabled() && config.metrics().enabled();
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    // -------------------------------------------------------------------------
    // Circuit Breaker Metrics
    // -------------------------------------------------------------------------

    @Override
    public void registerCircuitBreaker(String service, Supplier<CircuitBreakerState> state) {
        if (!enabled) {
            return;
        }

        // A replaced breaker must not leave the gauge reading the old instance
        final var existing = registry.find("radar.circuit_breaker.state")
                .tag("service", nullSafe(service))
                .gauge();
        if (existing != null) {
            registry.remove(existing);
        }

        Gauge.builder("radar.circuit_breaker.state", state, s -> s.get().gaugeValue())
                .description("Circuit breaker state (0=closed, 1=half open, 2=open)")
                .tag("service", nullSafe(service))
                .strongReference(true)
                .register(registry);
    }

    @Override
    public void recordCircuitBreakerCall(String service, String outcome) {
        if (!enabled) {
            return;
        }

        Counter.builder("radar.circuit_breaker.calls")
                .description("Calls passing through or rejected by circuit breakers")
                .tag("service", nullSafe(service))
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    // -------------------------------------------------------------------------
    // Retry Metrics
    // -------------------------------------------------------------------------

    @Override
    public void recordRetryAttemptFailed(String operation, int attempt) {
        if (!enabled) {
            return;
        }

        Counter.builder("radar.retry.attempt.failed")
                .description("Failed attempts followed by a retry")
                .tag("operation", nullSafe(operation))
                .tag("attempt", String.valueOf(attempt))
                .register(registry)
                .increment();
    }

    @Override
    public void recordRetryOutcome(String operation, int attempts, boolean success) {
        if (!enabled) {
            return;
        }

        DistributionSummary.builder("radar.retry.attempts")
                .description("Attempts made per retried operation")
                .tag("operation", nullSafe(operation))
                .tag("success", String.valueOf(success))
                .register(registry)
                .record(attempts);

        if (!success) {
            Counter.builder("radar.retry.exhausted")
                    .description("Operations that failed after their last attempt")
                    .tag("operation", nullSafe(operation))
                    .register(registry)
                    .increment();
        }
    }

    // -------------------------------------------------------------------------
    // Timeout Metrics
    // -------------------------------------------------------------------------

    @Override
    public void recordTimeout(String operation, long timeoutMs) {
        if (!enabled) {
            return;
        }

        Counter.builder("radar.operation.timeouts")
                .description("Operations cut off by their deadline")
                .tag("service", serviceOf(operation))
                .tag("operation", nullSafe(operation))
                .register(registry)
                .increment();

        DistributionSummary.builder("radar.operation.timeout.deadline")
                .description("Deadline of operations that timed out")
                .baseUnit("milliseconds")
                .tag("service", serviceOf(operation))
                .tag("operation", nullSafe(operation))
                .register(registry)
                .record(timeoutMs);
    }

    @Override
    public void recordOperationCompleted(String operation, long durationMs, boolean success) {
        if (!enabled) {
            return;
        }

        Timer.builder("radar.operation.completed")
                .description("Operations settling before their deadline")
                .tag("service", serviceOf(operation))
                .tag("operation", nullSafe(operation))
                .tag("result", success ? "success" : "error")
                .register(registry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    // -------------------------------------------------------------------------
    // Rate Limit Metrics
    // -------------------------------------------------------------------------

    @Override
    public void recordRateLimitCheck(String service, boolean allowed) {
        if (!enabled) {
            return;
        }

        Counter.builder("radar.rate_limit.checks")
                .description("Local rate limit admission decisions")
                .tag("service", nullSafe(service))
                .tag("allowed", String.valueOf(allowed))
                .register(registry)
                .increment();
    }

    @Override
    public void recordRateLimitBlock(String service, long durationMs) {
        if (!enabled) {
            return;
        }

        Counter.builder("radar.rate_limit.blocks")
                .description("Services blocked from making requests")
                .tag("service", nullSafe(service))
                .register(registry)
                .increment();
    }

    // -------------------------------------------------------------------------
    // HTTP Metrics
    // -------------------------------------------------------------------------

    @Override
    public void recordAttempt(String service, String method, int status, long latencyMs) {
        if (!enabled) {
            return;
        }

        Timer.builder("radar.http.request.duration")
                .description("Latency of single outbound attempts")
                .tag("service", nullSafe(service))
                .tag("method", nullSafe(method))
                .tag("status", statusTag(status))
                .tag("status_class", statusClass(status))
                .publishPercentiles(0.5, 0.9, 0.95, 0.99)
                .register(registry)
                .record(latencyMs, TimeUnit.MILLISECONDS);
    }

    @Override
    public void recordRequest(String service, int status, boolean success, int attempts, long durationMs) {
        if (!enabled) {
            return;
        }

        Counter.builder("radar.http.requests.total")
                .description("Outbound requests after retries have settled")
                .tag("service", nullSafe(service))
                .tag("status", statusTag(status))
                .tag("success", String.valueOf(success))
                .register(registry)
                .increment();

        Timer.builder("radar.http.total.duration")
                .description("Outbound request time including retries and backoff")
                .tag("service", nullSafe(service))
                .tag("success", String.valueOf(success))
                .tag("attempts", String.valueOf(attempts))
                .register(registry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    @Override
    public void recordRequestFailure(String service, String errorType) {
        if (!enabled) {
            return;
        }

        Counter.builder("radar.http.requests.failed")
                .description("Outbound requests that ended in an error")
                .tag("service", nullSafe(service))
                .tag("error", nullSafe(errorType))
                .register(registry)
                .increment();
    }

    // -------------------------------------------------------------------------
    // Helper Methods
    // -------------------------------------------------------------------------

    private String nullSafe(String value) {
        return value != null ? value : "unknown";
    }

    /**
     * Strips the category prefix the timeout helpers add, so {@code http_goplus} tags as {@code goplus}.
     */
    static String serviceOf(String operation) {
        if (operation == null) {
            return "unknown";
        }
        for (final var prefix : OPERATION_PREFIXES) {
            if (operation.startsWith(prefix) && operation.length() > prefix.length()) {
                return operation.substring(prefix.length());
            }
        }
        return operation;
    }

    private String statusTag(int status) {
        return status > 0 ? String.valueOf(status) : "none";
    }

    private String statusClass(int statusCode) {
        if (statusCode <= 0) {
            return "none";
        }
        if (statusCode < 200) {
            return "1xx";
        }
        if (statusCode < 300) {
            return "2xx";
        }
        if (statusCode < 400) {
            return "3xx";
        }
        if (statusCode < 500) {
            return "4xx";
        }
        return "5xx";
    }
}
