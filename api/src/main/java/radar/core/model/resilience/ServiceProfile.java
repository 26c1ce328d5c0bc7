package radar.core.model.resilience;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * Complete resilience configuration for one upstream service.
 *
 * <p>Read once when the service's client is built; later configuration changes
 * do not affect an existing client.
 *
 * @param serviceName unique service name; keys breakers, limiters and clients
 * @param baseUrl prefix for relative request URLs, may be empty
 * @param timeout default per-attempt deadline
 * @param operationTimeouts per-operation deadlines overriding {@code timeout}
 * @param retry retry policy for every request
 * @param circuitBreaker breaker thresholds
 * @param rateLimit admission limits
 * @param headers static headers sent with every request
 * @param queueTimeout how long a denied request may wait for capacity; zero fails fast
 * @param healthCheck reachability probe settings
 */
public record ServiceProfile(
        String serviceName,
        String baseUrl,
        Duration timeout,
        Map<String, Duration> operationTimeouts,
        RetryPolicy retry,
        CircuitBreakerSettings circuitBreaker,
        RateLimitConfig rateLimit,
        Map<String, String> headers,
        Duration queueTimeout,
        HealthCheckSettings healthCheck) {

    public ServiceProfile {
        if (serviceName == null || serviceName.isBlank()) {
            throw new IllegalArgumentException("serviceName must not be blank");
        }
        baseUrl = baseUrl != null ? baseUrl : "";
        timeout = timeout != null ? timeout : Duration.ofSeconds(10);
        operationTimeouts = operationTimeouts != null ? Map.copyOf(operationTimeouts) : Map.of();
        retry = retry != null ? retry.withName(serviceName) : RetryPolicy.http(serviceName);
        circuitBreaker = circuitBreaker != null
                ? circuitBreaker
                : CircuitBreakerSettings.of(5, Duration.ofMinutes(1));
        rateLimit = rateLimit != null ? rateLimit : RateLimitConfig.unlimited();
        headers = headers != null ? Map.copyOf(headers) : Map.of();
        queueTimeout = queueTimeout != null ? queueTimeout : Duration.ZERO;
        healthCheck = healthCheck != null ? healthCheck : HealthCheckSettings.defaults();
    }

    /**
     * Returns the deadline for a named operation, falling back to the default timeout.
     *
     * @param operation operation name such as {@code search} or {@code price}
     * @return the deadline
     */
    public Duration timeoutFor(String operation) {
        return Optional.ofNullable(operation)
                .map(operationTimeouts::get)
                .orElse(timeout);
    }

    public ServiceProfile withRetry(RetryPolicy policy) {
        return new ServiceProfile(
                serviceName, baseUrl, timeout, operationTimeouts, policy, circuitBreaker, rateLimit, headers,
                queueTimeout, healthCheck);
    }

    public ServiceProfile withCircuitBreaker(CircuitBreakerSettings settings) {
        return new ServiceProfile(
                serviceName, baseUrl, timeout, operationTimeouts, retry, settings, rateLimit, headers,
                queueTimeout, healthCheck);
    }

    public ServiceProfile withRateLimit(RateLimitConfig config) {
        return new ServiceProfile(
                serviceName, baseUrl, timeout, operationTimeouts, retry, circuitBreaker, config, headers,
                queueTimeout, healthCheck);
    }

    public ServiceProfile withBaseUrl(String url) {
        return new ServiceProfile(
                serviceName, url, timeout, operationTimeouts, retry, circuitBreaker, rateLimit, headers,
                queueTimeout, healthCheck);
    }

    public ServiceProfile withTimeouts(Duration defaultTimeout, Map<String, Duration> perOperation) {
        return new ServiceProfile(
                serviceName, baseUrl, defaultTimeout, perOperation, retry, circuitBreaker, rateLimit, headers,
                queueTimeout, healthCheck);
    }

    public ServiceProfile withQueueTimeout(Duration wait) {
        return new ServiceProfile(
                serviceName, baseUrl, timeout, operationTimeouts, retry, circuitBreaker, rateLimit, headers, wait,
                healthCheck);
    }

    public ServiceProfile withHealthCheck(HealthCheckSettings settings) {
        return new ServiceProfile(
                serviceName, baseUrl, timeout, operationTimeouts, retry, circuitBreaker, rateLimit, headers,
                queueTimeout, settings);
    }

    public ServiceProfile withHeaders(Map<String, String> staticHeaders) {
        return new ServiceProfile(
                serviceName, baseUrl, timeout, operationTimeouts, retry, circuitBreaker, rateLimit, staticHeaders,
                queueTimeout, healthCheck);
    }
}
