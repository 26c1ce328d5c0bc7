package radar.core.model.resilience;

import java.time.Duration;

/**
 * Successful outcome of a retried operation.
 *
 * @param result the operation's value
 * @param attempts the attempt that succeeded, starting at 1
 * @param totalTime wall time from the first attempt to success, including sleeps
 * @param <T> result type
 */
public record RetryResult<T>(T result, int attempts, Duration totalTime) {}
