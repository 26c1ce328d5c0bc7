package radar.core.model.resilience;

import java.time.Instant;

/**
 * Current rate limit standing of a service, without consuming capacity.
 *
 * @param service the service name
 * @param remaining requests left under the most restrictive configured limit
 * @param resetTime when capacity next frees up
 * @param limited true while blocked or exhausted
 * @param blockedUntil end of an explicit block, or null when not blocked
 */
public record RateLimitStatus(
        String service, long remaining, Instant resetTime, boolean limited, Instant blockedUntil) {}
