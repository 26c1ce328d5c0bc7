package radar.core.model.resilience;

import java.time.Duration;
import java.util.List;

/**
 * Circuit breaker thresholds for one upstream service.
 *
 * @param failureThreshold unignored failures, each within {@code monitoringPeriod} of the previous,
 *     that open the circuit
 * @param resetTimeout cooldown before an open circuit admits a trial call
 * @param monitoringPeriod longest gap between two failures that still counts them together
 * @param expectedErrors substrings of exception names or messages that are never counted as failures
 */
public record CircuitBreakerSettings(
        int failureThreshold, Duration resetTimeout, Duration monitoringPeriod, List<String> expectedErrors) {

    public CircuitBreakerSettings {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be at least 1");
        }
        if (resetTimeout == null || resetTimeout.isNegative()) {
            throw new IllegalArgumentException("resetTimeout must be non-negative");
        }
        monitoringPeriod = monitoringPeriod != null ? monitoringPeriod : Duration.ofMinutes(1);
        expectedErrors = expectedErrors != null ? List.copyOf(expectedErrors) : List.of();
    }

    /**
     * Creates settings with no expected errors and a one minute monitoring period.
     */
    public static CircuitBreakerSettings of(int failureThreshold, Duration resetTimeout) {
        return new CircuitBreakerSettings(failureThreshold, resetTimeout, Duration.ofMinutes(1), List.of());
    }

    /**
     * Returns a copy with the given expected error patterns.
     *
     * @param patterns substrings matched against exception simple names and messages
     * @return new settings
     */
    public CircuitBreakerSettings withExpectedErrors(String... patterns) {
        return new CircuitBreakerSettings(failureThreshold, resetTimeout, monitoringPeriod, List.of(patterns));
    }

    /**
     * Returns a copy with a different threshold and cooldown.
     */
    public CircuitBreakerSettings withThreshold(int threshold, Duration reset) {
        return new CircuitBreakerSettings(threshold, reset, monitoringPeriod, expectedErrors);
    }
}
