package radar.core.model.resilience;

import java.time.Instant;

/**
 * Operational snapshot of one resilient client.
 *
 * @param service the service name
 * @param circuitBreaker breaker status
 * @param lastRequestTime when the client last sent a request, or null
 * @param rateLimit configured admission limits
 * @param rateLimitStatus current admission standing, or null when the service has no limiter state
 * @param totalRequests logical calls made through the client
 * @param failedRequests logical calls that ended in an error
 * @param healthCheck reachability probe settings
 * @param lastHealthCheck when the upstream was last probed, or null if never
 * @param reachable outcome of the last probe, or null if never probed
 */
public record ClientHealthStatus(
        String service,
        CircuitBreakerStatus circuitBreaker,
        Instant lastRequestTime,
        RateLimitConfig rateLimit,
        RateLimitStatus rateLimitStatus,
        long totalRequests,
        long failedRequests,
        HealthCheckSettings healthCheck,
        Instant lastHealthCheck,
        Boolean reachable) {}
