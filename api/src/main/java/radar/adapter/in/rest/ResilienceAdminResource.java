package radar.adapter.in.rest;

import java.util.Map;
import java.util.function.Consumer;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import radar.core.service.client.HttpClientFactory;
import radar.core.service.resilience.CircuitBreaker;
import radar.core.service.resilience.CircuitBreakerRegistry;
import radar.core.service.resilience.RateLimitManager;

/**
 * REST resource for operating the outbound resilience layer.
 *
 * <p>
 * Provides endpoints for:
 * <ul>
 * <li>Inspecting client health, circuit breakers and rate limits</li>
 * <li>Probing an upstream for reachability</li>
 * <li>Forcing single breakers, or all of them, open or closed</li>
 * <li>Lifting a rate limit block</li>
 * </ul>
 */
@Path("/admin/resilience")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
public class ResilienceAdminResource {

    private static final Logger LOG = Logger.getLogger(ResilienceAdminResource.class);

    private final HttpClientFactory clientFactory;
    private final CircuitBreakerRegistry circuitBreakers;
    private final RateLimitManager rateLimitManager;

    public ResilienceAdminResource(
            HttpClientFactory clientFactory,
            CircuitBreakerRegistry circuitBreakers,
            RateLimitManager rateLimitManager) {
        this.clientFactory = clientFactory;
        this.circuitBreakers = circuitBreakers;
        this.rateLimitManager = rateLimitManager;
    }

    /**
     * Health of every client built so far.
     */
    @GET
    @Path("/health")
    public Uni<Response> health() {
        return Uni.createFrom()
                .item(() -> Response.ok(clientFactory.getHealthStatus()).build());
    }

    /**
     * Probes one client's upstream and returns its refreshed health.
     */
    @POST
    @Path("/health/{name}/check")
    public Uni<Response> checkHealth(@PathParam("name") String name) {
        return clientFactory
                .find(name)
                .map(client -> client.checkHealth()
                        .map(reachable -> Response.ok(client.getHealthStatus()).build()))
                .orElseGet(() -> Uni.createFrom().item(notFound("client", name)));
    }

    @GET
    @Path("/circuit-breakers")
    public Uni<Response> circuitBreakers() {
        return Uni.createFrom().item(() -> Response.ok(circuitBreakers.statuses()).build());
    }

    @GET
    @Path("/rate-limits")
    public Uni<Response> rateLimits() {
        return Uni.createFrom()
                .item(() -> Response.ok(rateLimitManager.getAllStatuses()).build());
    }

    @POST
    @Path("/circuit-breakers/{name}/open")
    public Uni<Response> open(@PathParam("name") String name) {
        return withBreaker(name, CircuitBreaker::forceOpen);
    }

    @POST
    @Path("/circuit-breakers/{name}/close")
    public Uni<Response> close(@PathParam("name") String name) {
        return withBreaker(name, CircuitBreaker::forceClose);
    }

    @POST
    @Path("/circuit-breakers/{name}/reset")
    public Uni<Response> reset(@PathParam("name") String name) {
        return withBreaker(name, CircuitBreaker::reset);
    }

    @POST
    @Path("/circuit-breakers/open-all")
    public Uni<Response> openAll() {
        LOG.warn("Admin request to open all circuit breakers");
        circuitBreakers.openAll();
        return Uni.createFrom().item(Response.ok(circuitBreakers.statuses()).build());
    }

    @POST
    @Path("/circuit-breakers/close-all")
    public Uni<Response> closeAll() {
        LOG.info("Admin request to close all circuit breakers");
        circuitBreakers.closeAll();
        return Uni.createFrom().item(Response.ok(circuitBreakers.statuses()).build());
    }

    @POST
    @Path("/circuit-breakers/reset-all")
    public Uni<Response> resetAll() {
        LOG.info("Admin request to reset all circuit breakers");
        circuitBreakers.resetAll();
        return Uni.createFrom().item(Response.ok(circuitBreakers.statuses()).build());
    }

    /**
     * Lifts an explicit or 429-triggered block on a service.
     */
    @POST
    @Path("/rate-limits/{name}/unblock")
    public Uni<Response> unblock(@PathParam("name") String name) {
        if (rateLimitManager.getLimit(name).isEmpty()) {
            return Uni.createFrom().item(notFound("rate limit", name));
        }
        rateLimitManager.unblockService(name);
        return Uni.createFrom()
                .item(Response.ok(rateLimitManager.getStatus(name).orElseThrow()).build());
    }

    private Uni<Response> withBreaker(String name, Consumer<CircuitBreaker> action) {
        return Uni.createFrom().item(() -> circuitBreakers
                .get(name)
                .map(breaker -> {
                    action.accept(breaker);
                    LOG.infof("Admin action applied to circuit breaker %s, now %s", name, breaker.getState());
                    return Response.ok(breaker.getStatus()).build();
                })
                .orElseGet(() -> notFound("circuit breaker", name)));
    }

    private Response notFound(String kind, String name) {
        return Response.status(Response.Status.NOT_FOUND)
                .entity(Map.of("error", "Unknown " + kind + ": " + name))
                .build();
    }
}
