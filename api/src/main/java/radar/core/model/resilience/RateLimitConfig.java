package radar.core.model.resilience;

import java.util.Optional;

/**
 * Admission limits for one upstream service.
 *
 * <p>All values are optional. The token bucket is active only when both
 * {@code requestsPerSecond} and {@code burstSize} are present; the sliding windows
 * are active when their ceiling is present.
 *
 * @param requestsPerSecond sustained token refill rate
 * @param requestsPerMinute ceiling over a trailing 60 second window
 * @param requestsPerHour ceiling over a trailing hour
 * @param burstSize token bucket capacity
 */
public record RateLimitConfig(
        Optional<Double> requestsPerSecond,
        Optional<Integer> requestsPerMinute,
        Optional<Integer> requestsPerHour,
        Optional<Integer> burstSize) {

    public RateLimitConfig {
        requestsPerSecond = requestsPerSecond != null ? requestsPerSecond : Optional.empty();
        requestsPerMinute = requestsPerMinute != null ? requestsPerMinute : Optional.empty();
        requestsPerHour = requestsPerHour != null ? requestsPerHour : Optional.empty();
        burstSize = burstSize != null ? burstSize : Optional.empty();
        requestsPerSecond.ifPresent(rps -> {
            if (rps <= 0) {
                throw new IllegalArgumentException("requestsPerSecond must be positive");
            }
        });
    }

    /**
     * Token bucket only.
     */
    public static RateLimitConfig perSecond(double requestsPerSecond, int burstSize) {
        return new RateLimitConfig(
                Optional.of(requestsPerSecond), Optional.empty(), Optional.empty(), Optional.of(burstSize));
    }

    /**
     * Per-minute window with a burst size used as the initial token count.
     */
    public static RateLimitConfig perMinute(int requestsPerMinute, int burstSize) {
        return new RateLimitConfig(
                Optional.empty(), Optional.of(requestsPerMinute), Optional.empty(), Optional.of(burstSize));
    }

    /**
     * Per-minute window only.
     */
    public static RateLimitConfig perMinute(int requestsPerMinute) {
        return new RateLimitConfig(
                Optional.empty(), Optional.of(requestsPerMinute), Optional.empty(), Optional.empty());
    }

    /**
     * All limits at once.
     */
    public static RateLimitConfig of(
            double requestsPerSecond, int requestsPerMinute, int requestsPerHour, int burstSize) {
        return new RateLimitConfig(
                Optional.of(requestsPerSecond),
                Optional.of(requestsPerMinute),
                Optional.of(requestsPerHour),
                Optional.of(burstSize));
    }

    /**
     * No limits at all.
     */
    public static RateLimitConfig unlimited() {
        return new RateLimitConfig(Optional.empty(), Optional.empty(), Optional.empty(), Optional.empty());
    }

    /**
     * Whether the token bucket applies.
     */
    public boolean hasTokenBucket() {
        return requestsPerSecond.isPresent() && burstSize.isPresent();
    }

    /**
     * Returns a copy with the rate and burst scaled, keeping the given floors.
     *
     * @param factor multiplier applied to rate and burst
     * @param minRate lowest allowed rate after scaling
     * @param minBurst lowest allowed burst after scaling
     * @return scaled config
     */
    public RateLimitConfig scaled(double factor, double minRate, int minBurst) {
        return new RateLimitConfig(
                requestsPerSecond.map(rps -> Math.max(minRate, rps * factor)),
                requestsPerMinute,
                requestsPerHour,
                burstSize.map(burst -> Math.max(minBurst, (int) Math.round(burst * factor))));
    }
}
