package radar.core.model.resilience;

/**
 * Callback invoked before sleeping ahead of the next attempt.
 *
 * <p>Exceptions thrown here are logged by the retry engine and otherwise ignored.
 */
@FunctionalInterface
public interface RetryListener {

    RetryListener NONE = (error, attempt) -> {};

    /**
     * @param error the failure that triggered the retry
     * @param attempt the 1-based number of the attempt that failed
     */
    void onRetry(Throwable error, int attempt);
}
