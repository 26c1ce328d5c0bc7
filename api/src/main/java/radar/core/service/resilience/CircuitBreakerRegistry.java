package radar.core.service.resilience;

import java.time.Clock;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import radar.core.model.resilience.CircuitBreakerSettings;
import radar.core.model.resilience.CircuitBreakerStatus;
import radar.core.port.out.ResilienceMetrics;

/**
 * Process-wide registry of named circuit breakers.
 *
 * <p>Breakers are created on first use and live for the lifetime of the application.
 * The bulk operations are emergency controls exposed through the admin API.
 */
@ApplicationScoped
public class CircuitBreakerRegistry {

    private static final Logger LOG = Logger.getLogger(CircuitBreakerRegistry.class);

    private final Map<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();
    private final Clock clock;
    private final ResilienceMetrics metrics;

    @Inject
    public CircuitBreakerRegistry(Clock clock, ResilienceMetrics metrics) {
        this.clock = clock;
        this.metrics = metrics;
    }

    /**
     * Creates and registers a breaker, replacing any existing breaker with the same name.
     *
     * @param name the service name
     * @param settings breaker thresholds
     * @return the new breaker
     */
    public CircuitBreaker create(String name, CircuitBreakerSettings settings) {
        final var breaker = new CircuitBreaker(name, settings, clock, metrics);
        final var previous = breakers.put(name, breaker);
        if (previous != null) {
            LOG.warnf("Replaced existing circuit breaker %s", name);
        }
        return breaker;
    }

    /**
     * Returns the breaker for a name, creating it with the given settings on first use.
     *
     * <p>Settings are ignored when the breaker already exists.
     */
    public CircuitBreaker getOrCreate(String name, CircuitBreakerSettings settings) {
        return breakers.computeIfAbsent(name, key -> new CircuitBreaker(key, settings, clock, metrics));
    }

    public Optional<CircuitBreaker> get(String name) {
        return Optional.ofNullable(breakers.get(name));
    }

    public Collection<CircuitBreaker> all() {
        return List.copyOf(breakers.values());
    }

    /**
     * Returns the status of every registered breaker, keyed by name.
     */
    public Map<String, CircuitBreakerStatus> statuses() {
        return breakers.values().stream()
                .collect(Collectors.toMap(CircuitBreaker::getName, CircuitBreaker::getStatus));
    }

    public void openAll() {
        LOG.warnf("Forcing %d circuit breakers OPEN", breakers.size());
        breakers.values().forEach(CircuitBreaker::forceOpen);
    }

    public void closeAll() {
        LOG.infof("Forcing %d circuit breakers CLOSED", breakers.size());
        breakers.values().forEach(CircuitBreaker::forceClose);
    }

    public void resetAll() {
        LOG.infof("Resetting %d circuit breakers", breakers.size());
        breakers.values().forEach(CircuitBreaker::reset);
    }
}
