package radar.core.model.resilience;

import java.time.Duration;
import java.util.function.Supplier;

import io.smallrye.mutiny.Uni;

/**
 * One member of a batch run under per-item deadlines.
 *
 * @param operation lazily creates the operation
 * @param timeout per-item deadline
 * @param name optional name; batch helpers fall back to a positional name when null
 * @param <T> result type
 */
public record TimedOperation<T>(Supplier<Uni<T>> operation, Duration timeout, String name) {

    public static <T> TimedOperation<T> of(Supplier<Uni<T>> operation, Duration timeout) {
        return new TimedOperation<>(operation, timeout, null);
    }
}
