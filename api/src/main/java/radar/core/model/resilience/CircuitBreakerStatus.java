package radar.core.model.resilience;

import java.time.Instant;

/**
 * Point-in-time snapshot of a circuit breaker, surfaced to health checks.
 *
 * @param name the service name
 * @param state current state
 * @param failureCount consecutive counted failures
 * @param successCount successes since the last reset
 * @param failureThreshold configured threshold
 * @param lastFailureTime time of the last counted failure, or null
 * @param nextAttemptTime earliest time an open circuit admits a trial call, or null
 * @param healthy false only while the circuit is open
 */
public record CircuitBreakerStatus(
        String name,
        CircuitBreakerState state,
        int failureCount,
        int successCount,
        int failureThreshold,
        Instant lastFailureTime,
        Instant nextAttemptTime,
        boolean healthy) {}
