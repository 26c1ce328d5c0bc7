package radar.core.model.resilience;

/**
 * States of a per-service circuit breaker.
 *
 * <p>The numeric gauge value is what dashboards plot: CLOSED=0, HALF_OPEN=1, OPEN=2.
 */
public enum CircuitBreakerState {

    /** Calls flow normally; failures are counted. */
    CLOSED(0),

    /** Probation after the cooldown; a single trial call decides the next state. */
    HALF_OPEN(1),

    /** Calls fail fast until the next attempt time. */
    OPEN(2);

    private final int gaugeValue;

    CircuitBreakerState(int gaugeValue) {
        this.gaugeValue = gaugeValue;
    }

    /**
     * Returns the value exported on the state gauge.
     *
     * @return 0 for CLOSED, 1 for HALF_OPEN, 2 for OPEN
     */
    public int gaugeValue() {
        return gaugeValue;
    }
}
