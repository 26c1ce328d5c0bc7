package radar.core.exception;

import radar.core.model.resilience.RateLimitDecision;

/**
 * Admission to an upstream service was denied by the local rate limiter.
 */
public class RateLimitRejectedException extends RuntimeException {

    private final String service;
    private final RateLimitDecision decision;

    public RateLimitRejectedException(String service, RateLimitDecision decision) {
        super("Rate limit exceeded for " + service + ", resets at " + decision.resetTime());
        this.service = service;
        this.decision = decision;
    }

    public String getService() {
        return service;
    }

    public RateLimitDecision getDecision() {
        return decision;
    }
}
