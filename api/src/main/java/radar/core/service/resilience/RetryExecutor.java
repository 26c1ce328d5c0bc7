package radar.core.service.resilience;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Supplier;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import radar.core.exception.RetryExhaustedException;
import radar.core.model.resilience.RetryListener;
import radar.core.model.resilience.RetryPolicy;
import radar.core.model.resilience.RetryResult;
import radar.core.port.out.ResilienceMetrics;

/**
 * Re-runs failed operations with exponential backoff.
 *
 * <p>Attempts are strictly sequential. After a failed attempt the policy's condition
 * decides whether another attempt is made; once attempts run out, or the condition
 * refuses, the operation fails with a {@link RetryExhaustedException} holding every
 * attempt's error.
 */
@ApplicationScoped
public class RetryExecutor {

    private static final Logger LOG = Logger.getLogger(RetryExecutor.class);

    static final double JITTER_RATIO = 0.25;

    private final Clock clock;
    private final ResilienceMetrics metrics;

    @Inject
    public RetryExecutor(Clock clock, ResilienceMetrics metrics) {
        this.clock = clock;
        this.metrics = metrics;
    }

    public <T> Uni<RetryResult<T>> execute(Supplier<Uni<T>> operation, RetryPolicy policy) {
        return execute(operation, policy, RetryListener.NONE);
    }

    /**
     * Runs an operation under a retry policy.
     *
     * @param operation supplies a fresh attempt each time it is called
     * @param policy attempts, delays and retry condition
     * @param listener notified before each backoff sleep
     * @param <T> result type
     * @return Uni with the result and attempt count, or a {@link RetryExhaustedException}
     */
    public <T> Uni<RetryResult<T>> execute(
            Supplier<Uni<T>> operation, RetryPolicy policy, RetryListener listener) {
        return Uni.createFrom().deferred(() -> {
            final List<Throwable> errors = Collections.synchronizedList(new ArrayList<>());
            return attempt(operation, policy, listener, 1, clock.millis(), errors);
        });
    }

    private <T> Uni<RetryResult<T>> attempt(
            Supplier<Uni<T>> operation,
            RetryPolicy policy,
            RetryListener listener,
            int attempt,
            long startMillis,
            List<Throwable> errors) {
        return Uni.createFrom()
                .deferred(operation::get)
                .onItem()
                .transform(value -> {
                    if (attempt > 1) {
                        LOG.infof("Operation %s succeeded on attempt %d", policy.name(), attempt);
                    }
                    metrics.recordRetryOutcome(policy.name(), attempt, true);
                    return new RetryResult<>(value, attempt, Duration.ofMillis(clock.millis() - startMillis));
                })
                .onFailure()
                .recoverWithUni(error -> {
                    errors.add(error);

                    if (attempt >= policy.maxAttempts() || !shouldRetry(policy, error)) {
                        LOG.warnf(
                                "Operation %s failed after %d attempts: %s",
                                policy.name(), attempt, error.getMessage());
                        metrics.recordRetryOutcome(policy.name(), attempt, false);
                        return Uni.createFrom()
                                .<RetryResult<T>>failure(new RetryExhaustedException(policy.name(), attempt, errors));
                    }

                    metrics.recordRetryAttemptFailed(policy.name(), attempt);
                    notifyListener(listener, policy, error, attempt);

                    final var delay = calculateDelay(policy, attempt);
                    LOG.debugf(
                            "Operation %s attempt %d failed, retrying in %dms: %s",
                            policy.name(), attempt, delay.toMillis(), error.getMessage());

                    final Uni<Void> sleep = delay.isZero()
                            ? Uni.createFrom().voidItem()
                            : Uni.createFrom().voidItem().onItem().delayIt().by(delay);
                    return sleep.onItem()
                            .transformToUni(
                                    ignored -> attempt(operation, policy, listener, attempt + 1, startMillis, errors));
                });
    }

    private boolean shouldRetry(RetryPolicy policy, Throwable error) {
        try {
            return policy.condition().shouldRetry(error);
        } catch (RuntimeException e) {
            LOG.warnf(e, "Retry condition for %s failed, not retrying", policy.name());
            return false;
        }
    }

    private void notifyListener(RetryListener listener, RetryPolicy policy, Throwable error, int attempt) {
        try {
            listener.onRetry(error, attempt);
        } catch (RuntimeException e) {
            LOG.warnf(e, "Retry callback for %s failed", policy.name());
        }
    }

    /**
     * Computes the backoff before the attempt following {@code attempt}.
     *
     * @param policy delays, multiplier and jitter flag
     * @param attempt the 1-based attempt that just failed
     * @return the delay, never negative
     */
    public static Duration calculateDelay(RetryPolicy policy, int attempt) {
        return calculateDelay(policy, attempt, ThreadLocalRandom.current().nextDouble());
    }

    static Duration calculateDelay(RetryPolicy policy, int attempt, double random) {
        final var exponential = policy.baseDelay().toMillis() * Math.pow(policy.backoffMultiplier(), attempt - 1);
        double delay = Math.min(exponential, policy.maxDelay().toMillis());

        if (policy.jitter()) {
            final var jitter = (random - 0.5) * 2 * JITTER_RATIO * delay;
            delay = Math.max(0, Math.round(delay + jitter));
        }

        return Duration.ofMillis(Math.round(delay));
    }
}
