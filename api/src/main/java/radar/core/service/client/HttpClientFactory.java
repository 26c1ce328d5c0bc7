package radar.core.service.client;

import java.time.Clock;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jboss.logging.Logger;

import radar.core.config.ResilienceConfig;
import radar.core.model.resilience.ClientHealthStatus;
import radar.core.port.out.HttpTransport;
import radar.core.port.out.ResilienceMetrics;
import radar.core.service.resilience.CircuitBreakerRegistry;
import radar.core.service.resilience.RateLimitManager;
import radar.core.service.resilience.RetryExecutor;
import radar.core.service.resilience.TimeoutGuard;

/**
 * Creates and caches one {@link ResilientHttpClient} per service.
 *
 * <p>A client is built on first request from the service's resolved profile. Its
 * circuit breaker comes from the shared {@link CircuitBreakerRegistry}; its profile
 * rate limit is registered with the {@link RateLimitManager} unless the manager
 * already has limits for the service.
 */
@ApplicationScoped
public class HttpClientFactory {

    private static final Logger LOG = Logger.getLogger(HttpClientFactory.class);

    public static final String DEXSCREENER = "dexscreener";
    public static final String GOPLUS = "goplus";
    public static final String BIRDEYE = "birdeye";
    public static final String COINGECKO = "coingecko";

    private final Map<String, ResilientHttpClient> clients = new ConcurrentHashMap<>();
    private final ServiceProfiles profiles;
    private final HttpTransport transport;
    private final CircuitBreakerRegistry circuitBreakers;
    private final RateLimitManager rateLimitManager;
    private final RetryExecutor retryExecutor;
    private final TimeoutGuard timeoutGuard;
    private final ResilienceMetrics metrics;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final String userAgent;

    @Inject
    public HttpClientFactory(
            ServiceProfiles profiles,
            HttpTransport transport,
            CircuitBreakerRegistry circuitBreakers,
            RateLimitManager rateLimitManager,
            RetryExecutor retryExecutor,
            TimeoutGuard timeoutGuard,
            ResilienceMetrics metrics,
            ObjectMapper objectMapper,
            Clock clock,
            ResilienceConfig config) {
        this.profiles = profiles;
        this.transport = transport;
        this.circuitBreakers = circuitBreakers;
        this.rateLimitManager = rateLimitManager;
        this.retryExecutor = retryExecutor;
        this.timeoutGuard = timeoutGuard;
        this.metrics = metrics;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.userAgent = config.userAgent();
    }

    /**
     * Returns the client for a service, building it on first use.
     *
     * @param serviceName the service name
     * @return the cached client
     */
    public ResilientHttpClient client(String serviceName) {
        return clients.computeIfAbsent(serviceName, this::create);
    }

    private ResilientHttpClient create(String serviceName) {
        final var profile = profiles.resolve(serviceName);
        if (rateLimitManager.setLimitIfAbsent(serviceName, profile.rateLimit())) {
            LOG.debugf("Registered profile rate limit for %s", serviceName);
        }
        final var breaker = circuitBreakers.getOrCreate(serviceName, profile.circuitBreaker());

        LOG.infof(
                "Created resilient client for %s (baseUrl=%s, timeout=%dms, maxAttempts=%d, mode=%s)",
                serviceName,
                profile.baseUrl(),
                profile.timeout().toMillis(),
                profile.retry().maxAttempts(),
                profiles.mode());

        return new ResilientHttpClient(
                profile,
                transport,
                breaker,
                rateLimitManager,
                retryExecutor,
                timeoutGuard,
                metrics,
                objectMapper,
                clock,
                userAgent);
    }

    public ResilientHttpClient dexScreener() {
        return client(DEXSCREENER);
    }

    public ResilientHttpClient goPlus() {
        return client(GOPLUS);
    }

    public ResilientHttpClient birdeye() {
        return client(BIRDEYE);
    }

    public ResilientHttpClient coinGecko() {
        return client(COINGECKO);
    }

    /**
     * Returns the client for a service only if it was already built.
     */
    public Optional<ResilientHttpClient> find(String serviceName) {
        return Optional.ofNullable(clients.get(serviceName));
    }

    public Collection<ResilientHttpClient> all() {
        return List.copyOf(clients.values());
    }

    /**
     * Returns the health of every built client, keyed by service name.
     */
    public Map<String, ClientHealthStatus> getHealthStatus() {
        return clients.values().stream()
                .collect(Collectors.toMap(ResilientHttpClient::getServiceName, ResilientHttpClient::getHealthStatus));
    }
}
