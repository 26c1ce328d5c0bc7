package radar.core.exception;

import java.time.Instant;

import radar.core.model.resilience.CircuitBreakerState;

/**
 * Fail-fast rejection from a circuit breaker that is not admitting calls.
 */
public class CircuitBreakerOpenException extends RuntimeException {

    private final String service;
    private final CircuitBreakerState state;
    private final Instant nextAttemptTime;

    public CircuitBreakerOpenException(String service, CircuitBreakerState state, Instant nextAttemptTime) {
        super(buildMessage(service, state, nextAttemptTime));
        this.service = service;
        this.state = state;
        this.nextAttemptTime = nextAttemptTime;
    }

    private static String buildMessage(String service, CircuitBreakerState state, Instant nextAttemptTime) {
        if (state == CircuitBreakerState.HALF_OPEN) {
            return "Circuit breaker is HALF_OPEN for " + service + ", trial call already in flight";
        }
        return "Circuit breaker is " + state + " for " + service + ". Next attempt allowed at " + nextAttemptTime;
    }

    public String getService() {
        return service;
    }

    public CircuitBreakerState getState() {
        return state;
    }

    public Instant getNextAttemptTime() {
        return nextAttemptTime;
    }
}
