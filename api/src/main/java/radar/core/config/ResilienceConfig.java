package radar.core.config;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import radar.core.model.resilience.ResiliencyMode;

/**
 * Configuration mapping for the outbound resilience layer.
 *
 * <p>Configuration prefix: {@code radar.resilience}
 *
 * <p>Every per-service value is optional. Values that are present override the
 * built-in profile of the same service; everything else keeps the built-in value.
 */
@ConfigMapping(prefix = "radar.resilience")
public interface ResilienceConfig {

    /**
     * Process-wide adjustment applied on top of every profile and rate limit.
     *
     * @return the mode (default: DEFAULT)
     */
    @WithDefault("DEFAULT")
    ResiliencyMode mode();

    /**
     * Interval of the rate limiter's background sweep.
     *
     * @return Sweep interval (default: 60 seconds)
     */
    @WithDefault("PT60S")
    Duration cleanupInterval();

    /**
     * User agent sent with every outbound request.
     *
     * @return the user agent (default: Radar/1.0)
     */
    @WithDefault("Radar/1.0")
    String userAgent();

    /**
     * Outbound transport settings shared by all services.
     */
    TransportConfig transport();

    /**
     * Per-service profile overrides, keyed by service name.
     */
    Map<String, ServiceConfig> services();

    /**
     * Rate limiter overrides, keyed by service name.
     */
    Map<String, RateLimitSettings> rateLimits();

    /**
     * Connection settings of the HTTP transport.
     */
    interface TransportConfig {

        /**
         * Maximum time to establish a TCP connection to an upstream.
         *
         * @return Connect timeout duration (default: 5 seconds)
         */
        @WithDefault("PT5S")
        Duration connectTimeout();

        /**
         * Maximum pooled connections per upstream host.
         *
         * @return Max connections per host (default: 20)
         */
        @WithDefault("20")
        int maxConnectionsPerHost();
    }

    /**
     * Profile overrides for one service.
     */
    interface ServiceConfig {

        Optional<String> baseUrl();

        /**
         * Default per-attempt deadline.
         */
        Optional<Duration> timeout();

        /**
         * Per-operation deadlines, e.g. {@code operation-timeouts.search=PT10S}.
         */
        Map<String, Duration> operationTimeouts();

        Optional<RetrySettings> retry();

        Optional<CircuitBreakerConfig> circuitBreaker();

        Optional<RateLimitSettings> rateLimit();

        /**
         * Static headers sent with every request to the service.
         */
        Map<String, String> headers();

        /**
         * How long a request denied by the local rate limiter may wait for capacity.
         * Zero fails fast.
         */
        Optional<Duration> queueTimeout();

        Optional<HealthCheckConfig> healthCheck();
    }

    /**
     * Retry overrides.
     */
    interface RetrySettings {

        Optional<Integer> maxAttempts();

        Optional<Duration> baseDelay();

        Optional<Duration> maxDelay();

        Optional<Double> backoffMultiplier();

        Optional<Boolean> jitter();
    }

    /**
     * Circuit breaker overrides.
     */
    interface CircuitBreakerConfig {

        Optional<Integer> failureThreshold();

        Optional<Duration> resetTimeout();

        Optional<Duration> monitoringPeriod();

        /**
         * Substrings of exception names or messages never counted as failures.
         */
        Optional<List<String>> expectedErrors();
    }

    /**
     * Admission limits. Absent values disable the corresponding limit.
     */
    interface RateLimitSettings {

        Optional<Double> requestsPerSecond();

        Optional<Integer> requestsPerMinute();

        Optional<Integer> requestsPerHour();

        Optional<Integer> burstSize();
    }

    /**
     * Health probe overrides.
     */
    interface HealthCheckConfig {

        Optional<Duration> interval();

        Optional<Duration> timeout();

        Optional<Integer> retries();
    }
}
