package radar.core.model.resilience;

import java.util.Optional;

import radar.core.exception.OperationTimeoutException;

/**
 * Outcome of one member of a collect-all batch: either a value or a failure.
 *
 * @param name the operation name
 * @param value the value when the operation succeeded
 * @param failure the error when it failed or timed out
 * @param <T> result type
 */
public record TimedOutcome<T>(String name, T value, Throwable failure) {

    public static <T> TimedOutcome<T> success(String name, T value) {
        return new TimedOutcome<>(name, value, null);
    }

    public static <T> TimedOutcome<T> failure(String name, Throwable failure) {
        return new TimedOutcome<>(name, null, failure);
    }

    public boolean isSuccess() {
        return failure == null;
    }

    public boolean isTimeout() {
        return failure instanceof OperationTimeoutException;
    }

    public Optional<T> valueIfPresent() {
        return Optional.ofNullable(value);
    }
}
