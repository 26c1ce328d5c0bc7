package radar.core.model.resilience;

import java.time.Instant;

/**
 * Result of a rate limit admission check.
 *
 * @param allowed whether the request was admitted and recorded
 * @param remaining requests left under the most restrictive configured limit
 * @param resetTime when the limit next frees capacity
 */
public record RateLimitDecision(boolean allowed, long remaining, Instant resetTime) {

    /**
     * Decision for services without any configured limit.
     *
     * @param now the current time
     * @return an allowed decision with unbounded remaining capacity
     */
    public static RateLimitDecision unlimited(Instant now) {
        return new RateLimitDecision(true, Long.MAX_VALUE, now);
    }
}
