package radar.core.service.client;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import radar.core.config.ResilienceConfig;
import radar.core.model.resilience.CircuitBreakerSettings;
import radar.core.model.resilience.HealthCheckSettings;
import radar.core.model.resilience.RateLimitConfig;
import radar.core.model.resilience.ResiliencyMode;
import radar.core.model.resilience.RetryCondition;
import radar.core.model.resilience.RetryPolicy;
import radar.core.model.resilience.ServiceProfile;

/**
 * Resolves the effective profile of a service.
 *
 * <p>Resolution order:
 * <ol>
 *   <li>the built-in profile of the service, or the generic defaults for unknown services</li>
 *   <li>values present under {@code radar.resilience.services.<name>}</li>
 *   <li>the configured {@link ResiliencyMode}</li>
 * </ol>
 */
@ApplicationScoped
public class ServiceProfiles {

    private static final List<String> UPSTREAM_EXPECTED_ERRORS =
            List.of("RateLimit", "OperationTimeout", "CONNECTION_RESET");

    private static final List<String> TRANSIENT_NETWORK_ERRORS = List.of("OperationTimeout", "CONNECTION_RESET");

    static final Map<String, ServiceProfile> BUILT_IN = Map.of(
            "dexscreener",
            builtIn(
                    "dexscreener",
                    "https://api.dexscreener.com/latest",
                    Duration.ofSeconds(10),
                    Map.of(
                            "search", Duration.ofSeconds(10),
                            "pairs", Duration.ofSeconds(8),
                            "tokens", Duration.ofSeconds(8),
                            "latest", Duration.ofSeconds(6)),
                    retry(3, 1000, 10_000, 2),
                    breaker(5, Duration.ofMinutes(1), Duration.ofMinutes(1), UPSTREAM_EXPECTED_ERRORS),
                    RateLimitConfig.perSecond(5, 10),
                    new HealthCheckSettings(Duration.ofSeconds(30), Duration.ofSeconds(5), 2)),
            "goplus",
            builtIn(
                    "goplus",
                    "https://api.gopluslabs.io/api/v1",
                    Duration.ofSeconds(15),
                    Map.of(
                            "security", Duration.ofSeconds(15),
                            "batch", Duration.ofSeconds(20),
                            "token_security", Duration.ofSeconds(12)),
                    retry(2, 2000, 15_000, 3),
                    breaker(3, Duration.ofMinutes(2), Duration.ofMinutes(1), UPSTREAM_EXPECTED_ERRORS),
                    RateLimitConfig.perSecond(0.5, 2),
                    new HealthCheckSettings(Duration.ofMinutes(1), Duration.ofSeconds(8), 1)),
            "birdeye",
            builtIn(
                    "birdeye",
                    "https://public-api.birdeye.so",
                    Duration.ofSeconds(12),
                    Map.of(
                            "price", Duration.ofSeconds(12),
                            "overview", Duration.ofSeconds(15),
                            "multi_price", Duration.ofSeconds(18)),
                    retry(2, 5000, 30_000, 3),
                    breaker(3, Duration.ofMinutes(5), Duration.ofMinutes(1), UPSTREAM_EXPECTED_ERRORS),
                    RateLimitConfig.perSecond(1, 1),
                    new HealthCheckSettings(Duration.ofMinutes(2), Duration.ofSeconds(10), 1)),
            "coingecko",
            builtIn(
                    "coingecko",
                    "https://api.coingecko.com/api/v3",
                    Duration.ofSeconds(8),
                    Map.of(
                            "search", Duration.ofSeconds(8),
                            "price", Duration.ofSeconds(6),
                            "markets", Duration.ofSeconds(10),
                            "coins", Duration.ofSeconds(8)),
                    retry(3, 1500, 12_000, 2),
                    breaker(5, Duration.ofMinutes(3), Duration.ofMinutes(1), UPSTREAM_EXPECTED_ERRORS),
                    RateLimitConfig.perSecond(2, 5),
                    new HealthCheckSettings(Duration.ofSeconds(45), Duration.ofSeconds(6), 2)),
            "redis",
            builtIn(
                    "redis",
                    "",
                    Duration.ofSeconds(2),
                    Map.of(
                            "get", Duration.ofSeconds(2),
                            "set", Duration.ofSeconds(3),
                            "del", Duration.ofSeconds(2),
                            "scan", Duration.ofSeconds(5),
                            "pipeline", Duration.ofSeconds(5)),
                    retry(3, 100, 2000, 2).withCondition(RetryCondition.cache()),
                    breaker(3, Duration.ofSeconds(30), Duration.ofSeconds(30), TRANSIENT_NETWORK_ERRORS),
                    RateLimitConfig.perSecond(100, 200),
                    new HealthCheckSettings(Duration.ofSeconds(15), Duration.ofSeconds(3), 3)),
            "database",
            builtIn(
                    "database",
                    "",
                    Duration.ofSeconds(5),
                    Map.of(
                            "select", Duration.ofSeconds(5),
                            "insert", Duration.ofSeconds(8),
                            "update", Duration.ofSeconds(8),
                            "delete", Duration.ofSeconds(5),
                            "transaction", Duration.ofSeconds(10)),
                    retry(3, 200, 3000, 2).withCondition(RetryCondition.storage()),
                    breaker(3, Duration.ofMinutes(1), Duration.ofSeconds(30), List.of("OperationTimeout", "Lock")),
                    RateLimitConfig.perSecond(50, 100),
                    new HealthCheckSettings(Duration.ofSeconds(20), Duration.ofSeconds(4), 2)),
            "websocket",
            builtIn(
                    "websocket",
                    "",
                    Duration.ofSeconds(10),
                    Map.of(
                            "connect", Duration.ofSeconds(10),
                            "send", Duration.ofSeconds(5),
                            "close", Duration.ofSeconds(3),
                            "ping", Duration.ofSeconds(2)),
                    retry(3, 1000, 5000, 2),
                    breaker(
                            5,
                            Duration.ofSeconds(30),
                            Duration.ofSeconds(30),
                            List.of("OperationTimeout", "CONNECTION_RESET", "DNS_FAILURE")),
                    RateLimitConfig.perSecond(10, 20),
                    HealthCheckSettings.defaults()));

    private final ResilienceConfig config;

    @Inject
    public ServiceProfiles(ResilienceConfig config) {
        this.config = config;
    }

    /**
     * Returns the effective profile of a service.
     *
     * @param serviceName the service name
     * @return the profile with configuration overrides and the mode applied
     */
    public ServiceProfile resolve(String serviceName) {
        final var base = BUILT_IN.getOrDefault(serviceName, defaults(serviceName));
        final var overridden = config.services().containsKey(serviceName)
                ? overlay(base, config.services().get(serviceName))
                : base;
        return config.mode().apply(overridden);
    }

    public ResiliencyMode mode() {
        return config.mode();
    }

    /**
     * Generic profile for services without a built-in one.
     */
    public static ServiceProfile defaults(String serviceName) {
        return builtIn(
                serviceName,
                "",
                Duration.ofSeconds(10),
                Map.of(),
                retry(3, 1000, 10_000, 2),
                breaker(5, Duration.ofMinutes(1), Duration.ofMinutes(1), TRANSIENT_NETWORK_ERRORS),
                RateLimitConfig.perSecond(5, 10),
                HealthCheckSettings.defaults());
    }

    static ServiceProfile overlay(ServiceProfile base, ResilienceConfig.ServiceConfig override) {
        var profile = base;

        if (override.baseUrl().isPresent()) {
            profile = profile.withBaseUrl(override.baseUrl().get());
        }

        if (override.timeout().isPresent() || !override.operationTimeouts().isEmpty()) {
            final Map<String, Duration> operations = new HashMap<>(profile.operationTimeouts());
            operations.putAll(override.operationTimeouts());
            profile = profile.withTimeouts(override.timeout().orElse(profile.timeout()), operations);
        }

        if (override.retry().isPresent()) {
            final var retry = override.retry().get();
            final var current = profile.retry();
            profile = profile.withRetry(current.withMaxAttempts(retry.maxAttempts().orElse(current.maxAttempts()))
                    .withDelays(
                            retry.baseDelay().orElse(current.baseDelay()),
                            retry.maxDelay().orElse(current.maxDelay()))
                    .withBackoffMultiplier(retry.backoffMultiplier().orElse(current.backoffMultiplier()))
                    .withJitter(retry.jitter().orElse(current.jitter())));
        }

        if (override.circuitBreaker().isPresent()) {
            final var breaker = override.circuitBreaker().get();
            final var current = profile.circuitBreaker();
            profile = profile.withCircuitBreaker(new CircuitBreakerSettings(
                    breaker.failureThreshold().orElse(current.failureThreshold()),
                    breaker.resetTimeout().orElse(current.resetTimeout()),
                    breaker.monitoringPeriod().orElse(current.monitoringPeriod()),
                    breaker.expectedErrors().orElse(current.expectedErrors())));
        }

        if (override.rateLimit().isPresent()) {
            final var limit = override.rateLimit().get();
            final var current = profile.rateLimit();
            profile = profile.withRateLimit(new RateLimitConfig(
                    limit.requestsPerSecond().or(current::requestsPerSecond),
                    limit.requestsPerMinute().or(current::requestsPerMinute),
                    limit.requestsPerHour().or(current::requestsPerHour),
                    limit.burstSize().or(current::burstSize)));
        }

        if (!override.headers().isEmpty()) {
            final Map<String, String> headers = new HashMap<>(profile.headers());
            headers.putAll(override.headers());
            profile = profile.withHeaders(headers);
        }

        if (override.queueTimeout().isPresent()) {
            profile = profile.withQueueTimeout(override.queueTimeout().get());
        }

        if (override.healthCheck().isPresent()) {
            final var health = override.healthCheck().get();
            final var current = profile.healthCheck();
            profile = new ServiceProfile(
                    profile.serviceName(),
                    profile.baseUrl(),
                    profile.timeout(),
                    profile.operationTimeouts(),
                    profile.retry(),
                    profile.circuitBreaker(),
                    profile.rateLimit(),
                    profile.headers(),
                    profile.queueTimeout(),
                    new HealthCheckSettings(
                            health.interval().orElse(current.interval()),
                            health.timeout().orElse(current.timeout()),
                            health.retries().orElse(current.retries())));
        }

        return profile;
    }

    private static ServiceProfile builtIn(
            String name,
            String baseUrl,
            Duration timeout,
            Map<String, Duration> operations,
            RetryPolicy retry,
            CircuitBreakerSettings breaker,
            RateLimitConfig rateLimit,
            HealthCheckSettings healthCheck) {
        return new ServiceProfile(
                name, baseUrl, timeout, operations, retry, breaker, rateLimit, Map.of(), Duration.ZERO, healthCheck);
    }

    private static RetryPolicy retry(int attempts, long baseMs, long maxMs, double multiplier) {
        return new RetryPolicy(
                null,
                attempts,
                Duration.ofMillis(baseMs),
                Duration.ofMillis(maxMs),
                multiplier,
                true,
                RetryCondition.defaults());
    }

    private static CircuitBreakerSettings breaker(
            int threshold, Duration reset, Duration monitoring, List<String> expectedErrors) {
        return new CircuitBreakerSettings(threshold, reset, monitoring, expectedErrors);
    }
}
