package radar.core.model.resilience;

import radar.core.exception.HttpStatusException;
import radar.core.exception.NetworkErrorCode;
import radar.core.exception.NetworkException;
import radar.core.exception.OperationTimeoutException;

/**
 * Decides whether a failed attempt may be retried.
 */
@FunctionalInterface
public interface RetryCondition {

    /**
     * @param error the failure of the latest attempt
     * @return true to schedule another attempt
     */
    boolean shouldRetry(Throwable error);

    /**
     * Default condition for outbound HTTP calls.
     *
     * <p>Retries transient network failures, timeouts, 5xx and 429. Other 4xx
     * statuses are never retried. Anything else is retried.
     */
    static RetryCondition defaults() {
        return error -> {
            if (error instanceof NetworkException network) {
                return network.getCode().isTransient();
            }
            if (error instanceof OperationTimeoutException) {
                return true;
            }
            if (error instanceof HttpStatusException http) {
                return http.isServerError() || http.getStatus() == 429;
            }
            return true;
        };
    }

    /**
     * Condition for storage calls: connection level failures and timeouts only,
     * never argument or state errors raised by the store.
     */
    static RetryCondition storage() {
        return error -> {
            if (error instanceof NetworkException network) {
                return network.getCode() == NetworkErrorCode.CONNECTION_RESET
                        || network.getCode() == NetworkErrorCode.TIMED_OUT;
            }
            if (error instanceof OperationTimeoutException) {
                return true;
            }
            return !(error instanceof IllegalArgumentException || error instanceof IllegalStateException);
        };
    }

    /**
     * Condition for cache calls: connection resets and transport timeouts only.
     */
    static RetryCondition cache() {
        return error -> error instanceof NetworkException network
                && (network.getCode() == NetworkErrorCode.CONNECTION_RESET
                        || network.getCode() == NetworkErrorCode.TIMED_OUT);
    }

    /**
     * Condition that never retries.
     */
    static RetryCondition never() {
        return error -> false;
    }
}
