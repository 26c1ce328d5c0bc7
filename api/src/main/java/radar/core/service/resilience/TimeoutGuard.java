package radar.core.service.resilience;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import radar.core.exception.OperationTimeoutException;
import radar.core.model.resilience.TimedOperation;
import radar.core.model.resilience.TimedOutcome;
import radar.core.model.resilience.TimeoutOptions;
import radar.core.port.out.ResilienceMetrics;

/**
 * Races operations against a deadline.
 *
 * <p>When the deadline wins, the operation's subscription is cancelled, the optional
 * {@code onTimeout} listener fires once and the caller receives an
 * {@link OperationTimeoutException}.
 */
@ApplicationScoped
public class TimeoutGuard {

    private static final Logger LOG = Logger.getLogger(TimeoutGuard.class);

    private final Clock clock;
    private final ResilienceMetrics metrics;

    @Inject
    public TimeoutGuard(Clock clock, ResilienceMetrics metrics) {
        this.clock = clock;
        this.metrics = metrics;
    }

    /**
     * Runs an operation under a deadline.
     *
     * @param operation supplies the operation; invoked on subscription
     * @param options deadline, name and optional listener
     * @param <T> result type
     * @return Uni with the operation's result or an {@link OperationTimeoutException}
     */
    public <T> Uni<T> withTimeout(Supplier<Uni<T>> operation, TimeoutOptions options) {
        return Uni.createFrom().deferred(() -> {
            final var start = clock.millis();
            final var timedOut = new AtomicBoolean();

            return Uni.createFrom()
                    .deferred(operation::get)
                    .ifNoItem()
                    .after(options.timeout())
                    .failWith(() -> onDeadline(options, timedOut))
                    .onItem()
                    .invoke(ignored -> metrics.recordOperationCompleted(options.name(), clock.millis() - start, true))
                    .onFailure()
                    .invoke(error -> {
                        if (!timedOut.get()) {
                            metrics.recordOperationCompleted(options.name(), clock.millis() - start, false);
                        }
                    });
        });
    }

    private OperationTimeoutException onDeadline(TimeoutOptions options, AtomicBoolean timedOut) {
        if (timedOut.compareAndSet(false, true)) {
            options.onTimeout().ifPresent(listener -> {
                try {
                    listener.onTimeout();
                } catch (RuntimeException e) {
                    LOG.warnf(e, "Timeout callback for %s failed", options.name());
                }
            });
            metrics.recordTimeout(options.name(), options.timeout().toMillis());
            LOG.warnf("Operation %s timed out after %dms", options.name(), options.timeout().toMillis());
        }
        return new OperationTimeoutException(options.name(), options.timeout());
    }

    /**
     * Deadline for a single HTTP attempt, named {@code http_<service>}.
     */
    public <T> Uni<T> withHttpTimeout(Supplier<Uni<T>> operation, Duration timeout, String service) {
        return withTimeout(operation, TimeoutOptions.of(timeout, "http_" + service));
    }

    /**
     * Deadline for a storage call, named {@code db_<operation>}.
     */
    public <T> Uni<T> withStorageTimeout(Supplier<Uni<T>> operation, Duration timeout, String name) {
        return withTimeout(operation, TimeoutOptions.of(timeout, "db_" + name));
    }

    /**
     * Deadline for a cache call, named {@code cache_<operation>}.
     */
    public <T> Uni<T> withCacheTimeout(Supplier<Uni<T>> operation, Duration timeout, String name) {
        return withTimeout(operation, TimeoutOptions.of(timeout, "cache_" + name));
    }

    /**
     * Runs a batch of operations concurrently, each under its own deadline.
     *
     * <p>With {@code failFast} the batch fails with the first failure. Otherwise every
     * member settles and the result holds one outcome per operation, in input order.
     *
     * @param operations the batch
     * @param failFast whether the first failure fails the whole batch
     * @param <T> result type
     * @return Uni with one outcome per operation
     */
    public <T> Uni<List<TimedOutcome<T>>> allWithTimeout(List<TimedOperation<T>> operations, boolean failFast) {
        if (operations.isEmpty()) {
            return Uni.createFrom().item(List.of());
        }

        final List<Uni<TimedOutcome<T>>> guarded = new ArrayList<>(operations.size());
        for (int i = 0; i < operations.size(); i++) {
            final var operation = operations.get(i);
            final var name = operationName(operation, i);
            final var uni = withTimeout(operation.operation(), TimeoutOptions.of(operation.timeout(), name))
                    .map(value -> TimedOutcome.success(name, value));
            guarded.add(failFast ? uni : uni.onFailure().recoverWithItem(error -> TimedOutcome.failure(name, error)));
        }

        if (failFast) {
            return Uni.join().all(guarded).andFailFast();
        }
        return Uni.join().all(guarded).andCollectFailures();
    }

    /**
     * Races a batch of operations, each under its own deadline, and settles with the first to settle.
     *
     * @param operations the contenders
     * @param globalTimeout optional deadline for the whole race
     * @param <T> result type
     * @return Uni settling like the first contender to settle
     */
    public <T> Uni<T> raceWithTimeout(List<TimedOperation<T>> operations, Optional<Duration> globalTimeout) {
        if (operations.isEmpty()) {
            return Uni.createFrom().failure(new IllegalArgumentException("No operations to race"));
        }

        final List<Uni<T>> contenders = new ArrayList<>(operations.size());
        for (int i = 0; i < operations.size(); i++) {
            final var operation = operations.get(i);
            contenders.add(withTimeout(
                    operation.operation(), TimeoutOptions.of(operation.timeout(), operationName(operation, i))));
        }

        final Uni<T> race = Uni.combine().any().of(contenders);
        return globalTimeout
                .map(timeout -> withTimeout(() -> race, TimeoutOptions.of(timeout, "race")))
                .orElse(race);
    }

    /**
     * Completes after the given delay.
     */
    public Uni<Void> delay(Duration duration) {
        return Uni.createFrom().voidItem().onItem().delayIt().by(duration);
    }

    private static String operationName(TimedOperation<?> operation, int index) {
        return operation.name() != null ? operation.name() : "operation_" + index;
    }
}
