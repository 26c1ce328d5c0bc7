package radar.core.model.resilience;

import java.time.Duration;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Process-wide adjustment applied on top of every service profile.
 *
 * <ul>
 *   <li>{@link #DEFAULT} leaves profiles untouched</li>
 *   <li>{@link #EMERGENCY} trips breakers sooner, stops retrying, halves timeouts and cuts rates to 30%</li>
 *   <li>{@link #PERFORMANCE} tolerates more failures, retries more and relaxes timeouts and rates by 50%</li>
 * </ul>
 */
public enum ResiliencyMode {
    DEFAULT {
        @Override
        public ServiceProfile apply(ServiceProfile profile) {
            return profile;
        }
    },

    EMERGENCY {
        @Override
        public ServiceProfile apply(ServiceProfile profile) {
            final var breaker = new CircuitBreakerSettings(
                    2, Duration.ofMinutes(5), Duration.ofSeconds(30), profile.circuitBreaker().expectedErrors());
            final var retry = profile.retry()
                    .withMaxAttempts(1)
                    .withDelays(Duration.ofSeconds(5), Duration.ofSeconds(5))
                    .withBackoffMultiplier(1.0)
                    .withJitter(false);
            return scaleTimeouts(profile, 0.5)
                    .withCircuitBreaker(breaker)
                    .withRetry(retry)
                    .withRateLimit(apply(profile.rateLimit()));
        }

        @Override
        public RateLimitConfig apply(RateLimitConfig limits) {
            return limits.scaled(0.3, 0.1, 1);
        }
    },

    PERFORMANCE {
        @Override
        public ServiceProfile apply(ServiceProfile profile) {
            final var breaker = new CircuitBreakerSettings(
                    8, Duration.ofSeconds(30), Duration.ofMinutes(1), profile.circuitBreaker().expectedErrors());
            final var retry = profile.retry()
                    .withMaxAttempts(4)
                    .withDelays(Duration.ofMillis(500), Duration.ofSeconds(15))
                    .withBackoffMultiplier(2.0)
                    .withJitter(true);
            return scaleTimeouts(profile, 1.5)
                    .withCircuitBreaker(breaker)
                    .withRetry(retry)
                    .withRateLimit(apply(profile.rateLimit()));
        }

        @Override
        public RateLimitConfig apply(RateLimitConfig limits) {
            return limits.scaled(1.5, 0.0, 1);
        }
    };

    /**
     * Applies this mode to a profile.
     *
     * @param profile the configured profile
     * @return the adjusted profile
     */
    public abstract ServiceProfile apply(ServiceProfile profile);

    /**
     * Applies this mode to admission limits alone.
     *
     * @param limits the configured limits
     * @return the adjusted limits
     */
    public RateLimitConfig apply(RateLimitConfig limits) {
        return limits;
    }

    private static ServiceProfile scaleTimeouts(ServiceProfile profile, double factor) {
        final Map<String, Duration> operations = profile.operationTimeouts().entrySet().stream()
                .collect(Collectors.toMap(Map.Entry::getKey, e -> scale(e.getValue(), factor)));
        return profile.withTimeouts(scale(profile.timeout(), factor), operations);
    }

    private static Duration scale(Duration duration, double factor) {
        return Duration.ofMillis(Math.round(duration.toMillis() * factor));
    }
}
