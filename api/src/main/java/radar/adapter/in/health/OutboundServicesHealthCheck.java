package radar.adapter.in.health;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.HealthCheckResponseBuilder;
import org.eclipse.microprofile.health.Readiness;

import radar.core.model.resilience.CircuitBreakerState;
import radar.core.service.resilience.CircuitBreakerRegistry;
import radar.core.service.resilience.RateLimitManager;

/**
 * Readiness check summarizing the outbound circuit breakers.
 *
 * <p>Reports the state of every breaker, and whether each rate-limited service is
 * currently limited. The check is DOWN only when breakers exist and every one of
 * them is OPEN; a single failing upstream does not take the application out of rotation.
 */
@Readiness
@ApplicationScoped
public class OutboundServicesHealthCheck implements HealthCheck {

    static final String NAME = "outbound-services";

    private final CircuitBreakerRegistry circuitBreakers;
    private final RateLimitManager rateLimitManager;

    @Inject
    public OutboundServicesHealthCheck(CircuitBreakerRegistry circuitBreakers, RateLimitManager rateLimitManager) {
        this.circuitBreakers = circuitBreakers;
        this.rateLimitManager = rateLimitManager;
    }

    @Override
    public HealthCheckResponse call() {
        HealthCheckResponseBuilder builder = HealthCheckResponse.builder().name(NAME);

        final var statuses = circuitBreakers.statuses();
        statuses.forEach((name, status) -> builder.withData("circuit_breaker." + name, status.state().name()));
        rateLimitManager
                .getAllStatuses()
                .forEach((name, status) -> builder.withData("rate_limited." + name, status.limited()));

        final var openCount = statuses.values().stream()
                .filter(status -> status.state() == CircuitBreakerState.OPEN)
                .count();
        builder.withData("circuit_breakers.open", openCount);

        final var allOpen = !statuses.isEmpty() && openCount == statuses.size();
        return builder.status(!allOpen).build();
    }
}
