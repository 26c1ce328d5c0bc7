package radar.core.service.resilience;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BooleanSupplier;
import java.util.stream.Collectors;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import radar.core.config.ResilienceConfig;
import radar.core.model.resilience.RateLimitConfig;
import radar.core.model.resilience.RateLimitDecision;
import radar.core.model.resilience.RateLimitStatus;
import radar.core.port.out.ResilienceMetrics;

/**
 * In-process admission control for upstream services.
 *
 * <p>Each service may combine a token bucket ({@code requestsPerSecond} with
 * {@code burstSize}), a trailing minute window and a trailing hour window; the most
 * restrictive limit wins. A service can also be blocked outright, either explicitly
 * or after the upstream answered 429.
 *
 * <p>{@link #checkLimit(String)} checks and records in one critical section per
 * service, so two callers can never both take the last unit of capacity.
 *
 * <p>State lives in this process only and is lost on restart.
 */
@ApplicationScoped
public class RateLimitManager {

    private static final Logger LOG = Logger.getLogger(RateLimitManager.class);

    static final long MAX_BACKOFF_MS = 300_000L;
    static final long BASE_BACKOFF_MS = 30_000L;

    /**
     * Limits registered when configuration does not override them.
     */
    public static final Map<String, RateLimitConfig> DEFAULT_LIMITS = Map.ofEntries(
            Map.entry("birdeye", RateLimitConfig.perSecond(0.9, 3)),
            Map.entry("goplus", RateLimitConfig.perMinute(25, 5)),
            Map.entry("dexscreener", RateLimitConfig.perSecond(2, 5)),
            Map.entry("geckoterminal", RateLimitConfig.perSecond(1, 3)),
            Map.entry("honeypot", RateLimitConfig.perSecond(1, 2)),
            Map.entry("coingecko", RateLimitConfig.perMinute(30, 10)),
            Map.entry("auth", RateLimitConfig.of(0.1, 5, 20, 3)),
            Map.entry("api", RateLimitConfig.of(2, 60, 1000, 10)),
            Map.entry("external_api", RateLimitConfig.of(1, 30, 500, 5)));

    private final Map<String, RateLimitState> states = new ConcurrentHashMap<>();
    private final Clock clock;
    private final ResilienceMetrics metrics;
    private final Duration cleanupInterval;
    private volatile ScheduledExecutorService cleanupExecutor;

    @Inject
    public RateLimitManager(Clock clock, ResilienceMetrics metrics, ResilienceConfig config) {
        this(clock, metrics, config.cleanupInterval(), resolveLimits(config));
    }

    public RateLimitManager(
            Clock clock, ResilienceMetrics metrics, Duration cleanupInterval, Map<String, RateLimitConfig> limits) {
        this.clock = clock;
        this.metrics = metrics;
        this.cleanupInterval = cleanupInterval;
        limits.forEach(this::setLimit);
    }

    /**
     * Merges configured overrides over {@link #DEFAULT_LIMITS} and applies the resiliency mode.
     */
    static Map<String, RateLimitConfig> resolveLimits(ResilienceConfig config) {
        final Map<String, RateLimitConfig> limits = new HashMap<>(DEFAULT_LIMITS);
        config.rateLimits().forEach((service, override) -> {
            final var base = limits.getOrDefault(service, RateLimitConfig.unlimited());
            limits.put(
                    service,
                    new RateLimitConfig(
                            override.requestsPerSecond().or(base::requestsPerSecond),
                            override.requestsPerMinute().or(base::requestsPerMinute),
                            override.requestsPerHour().or(base::requestsPerHour),
                            override.burstSize().or(base::burstSize)));
        });
        return limits.entrySet().stream()
                .collect(Collectors.toMap(Map.Entry::getKey, e -> config.mode().apply(e.getValue())));
    }

    @PostConstruct
    void start() {
        final var executor = Executors.newSingleThreadScheduledExecutor(r -> {
            final var t = new Thread(r, "rate-limit-cleanup");
            t.setDaemon(true);
            return t;
        });
        final var period = cleanupInterval.toMillis();
        executor.scheduleAtFixedRate(this::cleanup, period, period, TimeUnit.MILLISECONDS);
        this.cleanupExecutor = executor;
    }

    /**
     * Stops the background sweep and drops all state.
     */
    @PreDestroy
    public void shutdown() {
        final var executor = cleanupExecutor;
        if (executor != null) {
            executor.shutdown();
            try {
                if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                executor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        states.clear();
    }

    /**
     * Registers or replaces the limits of a service, resetting its state.
     */
    public void setLimit(String service, RateLimitConfig config) {
        states.put(service, new RateLimitState(config, clock.millis()));
        LOG.debugf("Rate limit registered for %s: %s", service, config);
    }

    /**
     * Registers limits only when the service has none yet.
     *
     * @return true if the limits were registered
     */
    public boolean setLimitIfAbsent(String service, RateLimitConfig config) {
        final var registered = new boolean[1];
        states.computeIfAbsent(service, key -> {
            registered[0] = true;
            return new RateLimitState(config, clock.millis());
        });
        return registered[0];
    }

    public Optional<RateLimitConfig> getLimit(String service) {
        return Optional.ofNullable(states.get(service)).map(RateLimitState::config);
    }

    /**
     * Checks whether a request would be admitted now, without recording it.
     *
     * <p>Services without limits are always admitted.
     */
    public boolean canMakeRequest(String service) {
        final var state = states.get(service);
        if (state == null) {
            LOG.warnf("No rate limit configured for service: %s", service);
            return true;
        }
        synchronized (state) {
            return state.canAdmit(clock.millis());
        }
    }

    /**
     * Records a request against a service's limits.
     */
    public void recordRequest(String service) {
        final var state = states.get(service);
        if (state == null) {
            return;
        }
        synchronized (state) {
            state.record(clock.millis());
        }
    }

    /**
     * Checks and, when admitted, records a request in one step.
     *
     * @param service the service name
     * @return Uni with the decision
     */
    public Uni<RateLimitDecision> checkLimit(String service) {
        return Uni.createFrom().item(() -> checkNow(service));
    }

    private RateLimitDecision checkNow(String service) {
        final var state = states.get(service);
        final var now = clock.millis();
        if (state == null) {
            LOG.warnf("No rate limit configured for service: %s", service);
            return RateLimitDecision.unlimited(Instant.ofEpochMilli(now));
        }

        final RateLimitDecision decision;
        synchronized (state) {
            final var allowed = state.canAdmit(now);
            if (allowed) {
                state.record(now);
            }
            final var status = state.status(service, now);
            decision = new RateLimitDecision(allowed, status.remaining(), status.resetTime());
        }

        metrics.recordRateLimitCheck(service, decision.allowed());
        if (!decision.allowed()) {
            LOG.debugf("Rate limit exceeded for %s, resets at %s", service, decision.resetTime());
        }
        return decision;
    }

    /**
     * Polls until a request would be admitted or {@code maxWait} elapses. Nothing is recorded.
     *
     * @return Uni with true once capacity is available, false on giving up
     */
    public Uni<Boolean> waitForAvailability(String service, Duration maxWait) {
        return Uni.createFrom()
                .deferred(() -> poll(service, clock.millis() + maxWait.toMillis(), () -> canMakeRequest(service)));
    }

    /**
     * Like {@link #checkLimit(String)}, but keeps polling for up to {@code maxWait} while denied.
     *
     * @return Uni with the last decision taken
     */
    public Uni<RateLimitDecision> acquire(String service, Duration maxWait) {
        return Uni.createFrom().deferred(() -> {
            final var last = new AtomicReference<RateLimitDecision>();
            return poll(service, clock.millis() + maxWait.toMillis(), () -> {
                        last.set(checkNow(service));
                        return last.get().allowed();
                    })
                    .map(ignored -> last.get());
        });
    }

    private Uni<Boolean> poll(String service, long deadline, BooleanSupplier attempt) {
        if (attempt.getAsBoolean()) {
            return Uni.createFrom().item(true);
        }
        final var now = clock.millis();
        if (now >= deadline) {
            return Uni.createFrom().item(false);
        }
        final var wait = Math.max(1, Math.min(waitMillis(service, now), deadline - now));
        return Uni.createFrom()
                .voidItem()
                .onItem()
                .delayIt()
                .by(Duration.ofMillis(wait))
                .onItem()
                .transformToUni(ignored -> poll(service, deadline, attempt));
    }

    private long waitMillis(String service, long now) {
        final var state = states.get(service);
        if (state == null) {
            return 1000;
        }
        synchronized (state) {
            return state.nextWaitMillis(now);
        }
    }

    /**
     * Blocks a service until the duration elapses. Unknown services get an unlimited
     * entry so the block still applies.
     */
    public void blockService(String service, Duration duration, String reason) {
        final var state = states.computeIfAbsent(
                service, key -> new RateLimitState(RateLimitConfig.unlimited(), clock.millis()));
        final var until = clock.millis() + duration.toMillis();
        synchronized (state) {
            state.block(until);
        }
        metrics.recordRateLimitBlock(service, duration.toMillis());
        LOG.warnf("Service %s blocked until %s: %s", service, Instant.ofEpochMilli(until), reason);
    }

    public void unblockService(String service) {
        final var state = states.get(service);
        if (state == null) {
            return;
        }
        synchronized (state) {
            state.unblock();
        }
        LOG.infof("Service %s unblocked", service);
    }

    /**
     * Reacts to an upstream 429.
     *
     * <p>Blocks for {@code Retry-After} seconds when given, otherwise backs off
     * exponentially on the number of requests made in the last hour, capped at five minutes.
     *
     * @param service the service name
     * @param retryAfterSeconds parsed {@code Retry-After} header, if any
     */
    public void handle429Response(String service, OptionalLong retryAfterSeconds) {
        final long blockMillis;
        if (retryAfterSeconds.isPresent()) {
            blockMillis = retryAfterSeconds.getAsLong() * 1000;
        } else {
            blockMillis = backoffMillis(recentRequestCount(service));
        }
        blockService(service, Duration.ofMillis(blockMillis), "HTTP 429 from upstream");
    }

    static long backoffMillis(long recentRequests) {
        final var exponent = (int) Math.min(recentRequests, 4);
        return Math.min(MAX_BACKOFF_MS, BASE_BACKOFF_MS * (1L << exponent));
    }

    private long recentRequestCount(String service) {
        final var state = states.get(service);
        if (state == null) {
            return 0;
        }
        synchronized (state) {
            return state.countSince(clock.millis() - RateLimitState.HOUR_MS);
        }
    }

    public Optional<RateLimitStatus> getStatus(String service) {
        final var state = states.get(service);
        if (state == null) {
            return Optional.empty();
        }
        synchronized (state) {
            return Optional.of(state.status(service, clock.millis()));
        }
    }

    public Map<String, RateLimitStatus> getAllStatuses() {
        final var now = clock.millis();
        final Map<String, RateLimitStatus> statuses = new HashMap<>();
        states.forEach((service, state) -> {
            synchronized (state) {
                statuses.put(service, state.status(service, now));
            }
        });
        return statuses;
    }

    /**
     * Prunes ledger entries older than an hour and clears expired blocks.
     */
    public void cleanup() {
        final var now = clock.millis();
        states.values().forEach(state -> {
            synchronized (state) {
                state.prune(now);
            }
        });
        LOG.debugf("Rate limit cleanup swept %d services", states.size());
    }
}
