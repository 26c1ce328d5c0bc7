package radar.core.port.out;

import java.util.function.Supplier;

import radar.core.model.resilience.CircuitBreakerState;

/**
 * Port interface for recording metrics of the outbound resilience layer.
 *
 * <p>Implementations handle the actual metric recording (e.g., Micrometer).
 */
public interface ResilienceMetrics {

    /**
     * Check if metrics collection is enabled.
     *
     * @return true if enabled
     */
    boolean isEnabled();

    /**
     * Register the state gauge of a circuit breaker.
     *
     * @param service the service name
     * @param state supplier of the live state
     */
    void registerCircuitBreaker(String service, Supplier<CircuitBreakerState> state);

    /**
     * Record a call that passed through, or was rejected by, a circuit breaker.
     *
     * @param service the service name
     * @param outcome one of success, failure, rejected, expected_error
     */
    void recordCircuitBreakerCall(String service, String outcome);

    /**
     * Record a failed attempt that will be retried.
     *
     * @param operation the retry policy name
     * @param attempt the 1-based attempt that failed
     */
    void recordRetryAttemptFailed(String operation, int attempt);

    /**
     * Record the end of a retried operation.
     *
     * @param operation the retry policy name
     * @param attempts attempts made
     * @param success whether the operation eventually succeeded
     */
    void recordRetryOutcome(String operation, int attempts, boolean success);

    /**
     * Record a timed out operation.
     *
     * @param operation the timeout name
     * @param timeoutMs the deadline in milliseconds
     */
    void recordTimeout(String operation, long timeoutMs);

    /**
     * Record an operation that finished before its deadline.
     *
     * @param operation the timeout name
     * @param durationMs time taken
     * @param success whether it completed with an item
     */
    void recordOperationCompleted(String operation, long durationMs, boolean success);

    /**
     * Record a local rate limit admission decision.
     *
     * @param service the service name
     * @param allowed whether the request was admitted
     */
    void recordRateLimitCheck(String service, boolean allowed);

    /**
     * Record a service being blocked after an upstream rate limit or manual block.
     *
     * @param service the service name
     * @param durationMs block length
     */
    void recordRateLimitBlock(String service, long durationMs);

    /**
     * Record a single transport attempt.
     *
     * @param service the service name
     * @param method the HTTP method
     * @param status the response status, or 0 when no response arrived
     * @param latencyMs attempt latency
     */
    void recordAttempt(String service, String method, int status, long latencyMs);

    /**
     * Record a logical request after retries have settled.
     *
     * @param service the service name
     * @param status final status, or 0 on failure
     * @param success whether the request succeeded
     * @param attempts attempts made
     * @param durationMs total time including retries
     */
    void recordRequest(String service, int status, boolean success, int attempts, long durationMs);

    /**
     * Record a failed logical request.
     *
     * @param service the service name
     * @param errorType simple name of the terminal error
     */
    void recordRequestFailure(String service, String errorType);
}
