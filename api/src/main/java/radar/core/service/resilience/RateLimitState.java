package radar.core.service.resilience;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;

import radar.core.model.resilience.RateLimitConfig;
import radar.core.model.resilience.RateLimitStatus;

/**
 * Mutable admission state of one service: a token bucket, a ledger of admitted
 * request times and an optional block.
 *
 * <p>Not thread-safe. {@link RateLimitManager} synchronizes on the instance.
 */
final class RateLimitState {

    static final long MINUTE_MS = 60_000L;
    static final long HOUR_MS = 3_600_000L;

    private final RateLimitConfig config;
    private final Deque<Long> requests = new ArrayDeque<>();
    private double tokens;
    private long lastRefill;
    private boolean blocked;
    private long blockedUntil;

    RateLimitState(RateLimitConfig config, long nowMillis) {
        this.config = config;
        this.tokens = config.burstSize().orElse(1);
        this.lastRefill = nowMillis;
    }

    RateLimitConfig config() {
        return config;
    }

    /**
     * Checks admission without recording anything. Refills the bucket and clears an
     * expired block as side effects.
     */
    boolean canAdmit(long now) {
        if (blocked) {
            if (now < blockedUntil) {
                return false;
            }
            unblock();
        }

        if (config.hasTokenBucket()) {
            refill(now);
            if (tokens < 1) {
                return false;
            }
        }

        if (config.requestsPerMinute().isPresent()
                && countSince(now - MINUTE_MS) >= config.requestsPerMinute().get()) {
            return false;
        }

        return config.requestsPerHour().isEmpty() || countSince(now - HOUR_MS) < config.requestsPerHour().get();
    }

    void record(long now) {
        if (tokens >= 1) {
            tokens -= 1;
        }
        requests.addLast(now);
    }

    private void refill(long now) {
        final var elapsedSeconds = (now - lastRefill) / 1000.0;
        if (elapsedSeconds > 0) {
            tokens = Math.min(config.burstSize().get(), tokens + elapsedSeconds * config.requestsPerSecond().get());
            lastRefill = now;
        }
    }

    long countSince(long cutoff) {
        long count = 0;
        final Iterator<Long> newestFirst = requests.descendingIterator();
        while (newestFirst.hasNext() && newestFirst.next() > cutoff) {
            count++;
        }
        return count;
    }

    private Long oldestSince(long cutoff) {
        for (final Long time : requests) {
            if (time > cutoff) {
                return time;
            }
        }
        return null;
    }

    void block(long until) {
        blocked = true;
        blockedUntil = until;
    }

    void unblock() {
        blocked = false;
        blockedUntil = 0;
    }

    boolean isBlocked(long now) {
        return blocked && now < blockedUntil;
    }

    /**
     * Drops ledger entries older than an hour and clears an expired block.
     */
    void prune(long now) {
        final var cutoff = now - HOUR_MS;
        while (!requests.isEmpty() && requests.peekFirst() <= cutoff) {
            requests.pollFirst();
        }
        if (blocked && now >= blockedUntil) {
            unblock();
        }
    }

    /**
     * Reports the most restrictive configured limit: the token bucket, then the
     * minute window, then the hour window.
     */
    RateLimitStatus status(String service, long now) {
        long remaining = Long.MAX_VALUE;
        long reset = now;

        if (config.requestsPerSecond().isPresent()) {
            if (config.hasTokenBucket()) {
                refill(now);
            }
            remaining = (long) Math.floor(tokens);
            reset = now + (long) Math.ceil(1000 / config.requestsPerSecond().get());
        } else if (config.requestsPerMinute().isPresent()) {
            remaining = windowRemaining(config.requestsPerMinute().get(), now - MINUTE_MS);
            reset = windowReset(now, MINUTE_MS);
        } else if (config.requestsPerHour().isPresent()) {
            remaining = windowRemaining(config.requestsPerHour().get(), now - HOUR_MS);
            reset = windowReset(now, HOUR_MS);
        }

        final var isBlocked = isBlocked(now);
        return new RateLimitStatus(
                service,
                remaining,
                Instant.ofEpochMilli(reset),
                isBlocked || remaining == 0,
                isBlocked ? Instant.ofEpochMilli(blockedUntil) : null);
    }

    private long windowRemaining(int ceiling, long cutoff) {
        return Math.max(0, ceiling - countSince(cutoff));
    }

    private long windowReset(long now, long window) {
        final var oldest = oldestSince(now - window);
        return oldest != null ? oldest + window : now;
    }

    /**
     * Time until the next admission is worth trying, capped at one second.
     */
    long nextWaitMillis(long now) {
        long wait;
        if (isBlocked(now)) {
            wait = blockedUntil - now;
        } else if (config.requestsPerSecond().isPresent()) {
            wait = (long) Math.ceil(1000 / config.requestsPerSecond().get());
        } else if (config.requestsPerMinute().isPresent()) {
            wait = (long) Math.ceil(60_000.0 / config.requestsPerMinute().get());
        } else {
            wait = 1000;
        }
        return Math.max(1, Math.min(wait, 1000));
    }
}
