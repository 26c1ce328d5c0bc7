package radar.core.service.resilience;

import java.time.Clock;
import java.time.Instant;
import java.util.Locale;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import radar.core.exception.CircuitBreakerOpenException;
import radar.core.model.resilience.CircuitBreakerSettings;
import radar.core.model.resilience.CircuitBreakerState;
import radar.core.model.resilience.CircuitBreakerStatus;
import radar.core.port.out.ResilienceMetrics;

/**
 * Per-service circuit breaker.
 *
 * <p>State machine:
 * <ul>
 *   <li>CLOSED: calls pass; counted failures accumulate until {@code failureThreshold} opens the circuit.
 *   A failure arriving more than {@code monitoringPeriod} after the previous one starts a new count.</li>
 *   <li>OPEN: calls fail fast with {@link CircuitBreakerOpenException} until {@code nextAttemptTime}</li>
 *   <li>HALF_OPEN: one trial call is admitted; success closes the circuit, failure reopens it.
 *   Every move to CLOSED or OPEN frees the trial slot, so a trial outliving its half-open period
 *   never blocks the next one.</li>
 * </ul>
 *
 * <p>Failures whose simple class name or message contains one of the configured
 * expected error patterns are rethrown without being counted.
 *
 * <p>All transitions happen under a lock, so callbacks completing on different
 * threads observe a consistent state.
 */
public class CircuitBreaker {

    private static final Logger LOG = Logger.getLogger(CircuitBreaker.class);

    private final String name;
    private final CircuitBreakerSettings settings;
    private final Clock clock;
    private final ResilienceMetrics metrics;
    private final ReentrantLock lock = new ReentrantLock();

    private CircuitBreakerState state = CircuitBreakerState.CLOSED;
    private int failureCount;
    private int successCount;
    private long lastFailureTime;
    private long nextAttemptTime;
    // Token of the trial call holding the half-open slot, 0 when the slot is free
    private long activeProbe;
    private long probeSequence;

    public CircuitBreaker(String name, CircuitBreakerSettings settings, Clock clock, ResilienceMetrics metrics) {
        this.name = name;
        this.settings = settings;
        this.clock = clock;
        this.metrics = metrics;
        metrics.registerCircuitBreaker(name, this::getState);
    }

    /**
     * Runs an operation through the breaker.
     *
     * <p>The operation is created lazily, only once the breaker admits the call.
     *
     * @param operation supplies the operation to protect
     * @param <T> result type
     * @return Uni with the operation's result, or a {@link CircuitBreakerOpenException} failure
     */
    public <T> Uni<T> execute(Supplier<Uni<T>> operation) {
        return Uni.createFrom().deferred(() -> {
            final long probe;
            try {
                probe = acquirePermission();
            } catch (CircuitBreakerOpenException e) {
                metrics.recordCircuitBreakerCall(name, "rejected");
                return Uni.createFrom().<T>failure(e);
            }

            return Uni.createFrom()
                    .deferred(operation::get)
                    .onItem()
                    .invoke(ignored -> onSuccess(probe))
                    .onFailure()
                    .invoke(error -> onFailure(error, probe))
                    .onCancellation()
                    .invoke(() -> releaseProbe(probe));
        });
    }

    /**
     * Admits or rejects a call.
     *
     * @return the trial token when the call is the half-open trial, 0 otherwise
     */
    private long acquirePermission() {
        lock.lock();
        try {
            final var now = clock.millis();
            if (state == CircuitBreakerState.OPEN) {
                if (now < nextAttemptTime) {
                    throw new CircuitBreakerOpenException(name, state, Instant.ofEpochMilli(nextAttemptTime));
                }
                transitionTo(CircuitBreakerState.HALF_OPEN);
                LOG.infof("Circuit breaker %s transitioning to HALF_OPEN", name);
            }
            if (state == CircuitBreakerState.HALF_OPEN) {
                if (activeProbe != 0) {
                    throw new CircuitBreakerOpenException(name, state, Instant.ofEpochMilli(nextAttemptTime));
                }
                activeProbe = ++probeSequence;
                return activeProbe;
            }
            return 0;
        } finally {
            lock.unlock();
        }
    }

    private void onSuccess(long probe) {
        lock.lock();
        try {
            releaseProbeLocked(probe);
            failureCount = 0;
            successCount++;
            if (state == CircuitBreakerState.HALF_OPEN) {
                close();
                LOG.infof("Circuit breaker %s recovered, transitioning to CLOSED", name);
            }
        } finally {
            lock.unlock();
        }
        metrics.recordCircuitBreakerCall(name, "success");
    }

    private void onFailure(Throwable error, long probe) {
        if (isExpectedError(error)) {
            releaseProbe(probe);
            LOG.debugf("Circuit breaker %s ignoring expected error: %s", name, error.getMessage());
            metrics.recordCircuitBreakerCall(name, "expected_error");
            return;
        }

        lock.lock();
        try {
            releaseProbeLocked(probe);
            final var now = clock.millis();
            if (state == CircuitBreakerState.CLOSED
                    && lastFailureTime > 0
                    && now - lastFailureTime > settings.monitoringPeriod().toMillis()) {
                failureCount = 0;
            }
            failureCount++;
            lastFailureTime = now;

            if (state == CircuitBreakerState.HALF_OPEN) {
                open(now);
                LOG.warnf("Circuit breaker %s trial call failed, transitioning back to OPEN", name);
            } else if (state == CircuitBreakerState.CLOSED && failureCount >= settings.failureThreshold()) {
                open(now);
                LOG.warnf(
                        "Circuit breaker %s OPENED after %d failures. Next attempt at %s",
                        name, failureCount, Instant.ofEpochMilli(nextAttemptTime));
            }
        } finally {
            lock.unlock();
        }
        metrics.recordCircuitBreakerCall(name, "failure");
    }

    private void releaseProbe(long probe) {
        if (probe == 0) {
            return;
        }
        lock.lock();
        try {
            releaseProbeLocked(probe);
        } finally {
            lock.unlock();
        }
    }

    // Caller holds the lock. A stale token leaves a newer trial's slot alone.
    private void releaseProbeLocked(long probe) {
        if (probe != 0 && probe == activeProbe) {
            activeProbe = 0;
        }
    }

    boolean isExpectedError(Throwable error) {
        if (settings.expectedErrors().isEmpty()) {
            return false;
        }
        final var type = error.getClass().getSimpleName();
        final var message = error.getMessage() != null ? error.getMessage() : "";
        return settings.expectedErrors().stream()
                .anyMatch(pattern -> type.contains(pattern) || message.contains(pattern));
    }

    // Caller holds the lock
    private void open(long now) {
        transitionTo(CircuitBreakerState.OPEN);
        nextAttemptTime = now + settings.resetTimeout().toMillis();
        activeProbe = 0;
    }

    // Caller holds the lock
    private void close() {
        transitionTo(CircuitBreakerState.CLOSED);
        nextAttemptTime = 0;
        activeProbe = 0;
    }

    private void transitionTo(CircuitBreakerState next) {
        if (state != next) {
            LOG.debugf("Circuit breaker %s: %s -> %s", name, state, next);
        }
        state = next;
    }

    /**
     * Opens the circuit immediately, regardless of failures.
     */
    public void forceOpen() {
        lock.lock();
        try {
            open(clock.millis());
        } finally {
            lock.unlock();
        }
        LOG.warnf("Circuit breaker %s manually forced OPEN", name);
    }

    /**
     * Closes the circuit and zeroes the failure count.
     */
    public void forceClose() {
        lock.lock();
        try {
            close();
            failureCount = 0;
        } finally {
            lock.unlock();
        }
        LOG.infof("Circuit breaker %s manually forced CLOSED", name);
    }

    /**
     * Returns the breaker to its initial state, clearing counters and timestamps.
     */
    public void reset() {
        lock.lock();
        try {
            close();
            failureCount = 0;
            successCount = 0;
            lastFailureTime = 0;
        } finally {
            lock.unlock();
        }
        LOG.infof("Circuit breaker %s reset", name);
    }

    public CircuitBreakerStatus getStatus() {
        lock.lock();
        try {
            return new CircuitBreakerStatus(
                    name,
                    state,
                    failureCount,
                    successCount,
                    settings.failureThreshold(),
                    toInstant(lastFailureTime),
                    toInstant(nextAttemptTime),
                    state != CircuitBreakerState.OPEN);
        } finally {
            lock.unlock();
        }
    }

    public CircuitBreakerState getState() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    public String getName() {
        return name;
    }

    public CircuitBreakerSettings getSettings() {
        return settings;
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "CircuitBreaker[%s, %s]", name, getState());
    }

    private static Instant toInstant(long epochMillis) {
        return epochMillis > 0 ? Instant.ofEpochMilli(epochMillis) : null;
    }
}
