package radar.core.model.resilience;

import java.time.Duration;

/**
 * Immutable retry configuration.
 *
 * <p>The delay before attempt {@code n+1} is {@code min(baseDelay * backoffMultiplier^(n-1), maxDelay)},
 * optionally perturbed by up to 25% in either direction when {@code jitter} is set.
 *
 * @param name name used in logs and metric tags
 * @param maxAttempts total attempts including the first
 * @param baseDelay delay after the first failed attempt
 * @param maxDelay cap applied before jitter
 * @param backoffMultiplier exponential growth factor
 * @param jitter whether to randomize delays by up to 25%
 * @param condition decides which failures are retried
 */
public record RetryPolicy(
        String name,
        int maxAttempts,
        Duration baseDelay,
        Duration maxDelay,
        double backoffMultiplier,
        boolean jitter,
        RetryCondition condition) {

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        if (baseDelay == null || baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay must be non-negative");
        }
        if (maxDelay == null || maxDelay.isNegative()) {
            throw new IllegalArgumentException("maxDelay must be non-negative");
        }
        if (backoffMultiplier < 1.0) {
            throw new IllegalArgumentException("backoffMultiplier must be at least 1");
        }
        name = name != null ? name : "unknown";
        condition = condition != null ? condition : RetryCondition.defaults();
    }

    /**
     * General purpose defaults: 3 attempts, 1s growing to 30s, doubling, with jitter.
     */
    public static RetryPolicy defaults(String name) {
        return new RetryPolicy(
                name, 3, Duration.ofSeconds(1), Duration.ofSeconds(30), 2.0, true, RetryCondition.defaults());
    }

    /**
     * Preset for outbound HTTP calls: 3 attempts, 1s growing to 10s.
     */
    public static RetryPolicy http(String name) {
        return new RetryPolicy(
                name, 3, Duration.ofSeconds(1), Duration.ofSeconds(10), 2.0, true, RetryCondition.defaults());
    }

    /**
     * Preset for storage calls: 3 attempts, 500ms growing to 5s.
     */
    public static RetryPolicy storage(String operation) {
        return new RetryPolicy(
                "db_" + operation,
                3,
                Duration.ofMillis(500),
                Duration.ofSeconds(5),
                2.0,
                true,
                RetryCondition.storage());
    }

    /**
     * Preset for cache calls: 2 attempts, 100ms growing to 1s.
     */
    public static RetryPolicy cache(String operation) {
        return new RetryPolicy(
                "cache_" + operation,
                2,
                Duration.ofMillis(100),
                Duration.ofSeconds(1),
                2.0,
                true,
                RetryCondition.cache());
    }

    public RetryPolicy withName(String newName) {
        return new RetryPolicy(newName, maxAttempts, baseDelay, maxDelay, backoffMultiplier, jitter, condition);
    }

    public RetryPolicy withMaxAttempts(int attempts) {
        return new RetryPolicy(name, attempts, baseDelay, maxDelay, backoffMultiplier, jitter, condition);
    }

    public RetryPolicy withDelays(Duration base, Duration max) {
        return new RetryPolicy(name, maxAttempts, base, max, backoffMultiplier, jitter, condition);
    }

    public RetryPolicy withBackoffMultiplier(double multiplier) {
        return new RetryPolicy(name, maxAttempts, baseDelay, maxDelay, multiplier, jitter, condition);
    }

    public RetryPolicy withJitter(boolean enabled) {
        return new RetryPolicy(name, maxAttempts, baseDelay, maxDelay, backoffMultiplier, enabled, condition);
    }

    public RetryPolicy withCondition(RetryCondition retryCondition) {
        return new RetryPolicy(name, maxAttempts, baseDelay, maxDelay, backoffMultiplier, jitter, retryCondition);
    }
}
