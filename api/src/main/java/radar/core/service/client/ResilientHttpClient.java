package radar.core.service.client;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalLong;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import radar.core.exception.HttpStatusException;
import radar.core.exception.RateLimitRejectedException;
import radar.core.exception.RetryExhaustedException;
import radar.core.exception.UpstreamRateLimitedException;
import radar.core.model.http.OutboundRequest;
import radar.core.model.http.OutboundResponse;
import radar.core.model.resilience.ClientHealthStatus;
import radar.core.model.resilience.HealthCheckSettings;
import radar.core.model.resilience.RetryResult;
import radar.core.model.resilience.ServiceProfile;
import radar.core.port.out.HttpTransport;
import radar.core.port.out.ResilienceMetrics;
import radar.core.service.resilience.CircuitBreaker;
import radar.core.service.resilience.RateLimitManager;
import radar.core.service.resilience.RetryExecutor;
import radar.core.service.resilience.TimeoutGuard;

/**
 * HTTP client for one upstream service with the full resilience stack applied.
 *
 * <p>Every call is first admitted by the {@link RateLimitManager} and paced to the
 * profile's request rate. Attempts are then driven by the {@link RetryExecutor}; each
 * attempt passes through the service's {@link CircuitBreaker} and is bounded by the
 * {@link TimeoutGuard}.
 *
 * <p>Responses with status 429 or 5xx fail the attempt. Every other status, including
 * other 4xx, is handed back to the caller.
 *
 * <p>Instances are created by {@link HttpClientFactory}, one per service.
 */
public class ResilientHttpClient {

    private static final Logger LOG = Logger.getLogger(ResilientHttpClient.class);

    private static final Set<String> SENSITIVE_HEADER_MARKERS =
            Set.of("authorization", "key", "token", "secret", "cookie", "password");

    private final ServiceProfile profile;
    private final HttpTransport transport;
    private final CircuitBreaker circuitBreaker;
    private final RateLimitManager rateLimitManager;
    private final RetryExecutor retryExecutor;
    private final TimeoutGuard timeoutGuard;
    private final ResilienceMetrics metrics;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Map<String, List<String>> defaultHeaders;
    private final long minIntervalMillis;

    private final AtomicLong nextRequestSlot = new AtomicLong();
    private final AtomicLong lastRequestTime = new AtomicLong();
    private final AtomicReference<HealthProbe> lastHealthProbe = new AtomicReference<>();
    private final AtomicLong totalRequests = new AtomicLong();
    private final AtomicLong failedRequests = new AtomicLong();

    public ResilientHttpClient(
            ServiceProfile profile,
            HttpTransport transport,
            CircuitBreaker circuitBreaker,
            RateLimitManager rateLimitManager,
            RetryExecutor retryExecutor,
            TimeoutGuard timeoutGuard,
            ResilienceMetrics metrics,
            ObjectMapper objectMapper,
            Clock clock,
            String userAgent) {
        this.profile = profile;
        this.transport = transport;
        this.circuitBreaker = circuitBreaker;
        this.rateLimitManager = rateLimitManager;
        this.retryExecutor = retryExecutor;
        this.timeoutGuard = timeoutGuard;
        this.metrics = metrics;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.defaultHeaders = buildDefaultHeaders(profile, userAgent);
        this.minIntervalMillis = profile.rateLimit()
                .requestsPerSecond()
                .map(rps -> (long) Math.ceil(1000 / rps))
                .orElse(0L);
    }

    private static Map<String, List<String>> buildDefaultHeaders(ServiceProfile profile, String userAgent) {
        final Map<String, List<String>> headers = new LinkedHashMap<>();
        headers.put("Accept", List.of("application/json"));
        headers.put("User-Agent", List.of(userAgent));
        profile.headers().forEach((name, value) -> {
            if (value != null && !value.isBlank()) {
                headers.put(name, List.of(value));
            }
        });
        return Map.copyOf(headers);
    }

    public Uni<OutboundResponse> get(String url) {
        return execute("GET", url, null, null, Map.of());
    }

    /**
     * GET with a named operation, so the operation's timeout applies.
     */
    public Uni<OutboundResponse> get(String url, String operation) {
        return execute("GET", url, null, operation, Map.of());
    }

    public Uni<OutboundResponse> post(String url, Object body) {
        return execute("POST", url, body, null, Map.of());
    }

    public Uni<OutboundResponse> put(String url, Object body) {
        return execute("PUT", url, body, null, Map.of());
    }

    public Uni<OutboundResponse> patch(String url, Object body) {
        return execute("PATCH", url, body, null, Map.of());
    }

    public Uni<OutboundResponse> delete(String url) {
        return execute("DELETE", url, null, null, Map.of());
    }

    /**
     * GETs a URL and decodes the JSON body.
     *
     * <p>Fails with {@link HttpStatusException} for any status outside 2xx.
     */
    public <T> Uni<T> getJson(String url, Class<T> type) {
        return getJson(url, null, type);
    }

    public <T> Uni<T> getJson(String url, String operation, Class<T> type) {
        return get(url, operation).map(response -> {
            if (!response.isSuccess()) {
                throw new HttpStatusException(
                        profile.serviceName(), response.status(), response.headers(), response.body());
            }
            try {
                return objectMapper.readValue(response.body(), type);
            } catch (IOException e) {
                throw new IllegalStateException(
                        "Failed to decode response from " + profile.serviceName() + " as " + type.getSimpleName(), e);
            }
        });
    }

    /**
     * Sends a request through admission, pacing, retry, circuit breaker and timeout.
     *
     * @param method HTTP method
     * @param url absolute URL, or a path relative to the profile's base URL
     * @param body request body: bytes and strings are sent as is, anything else as JSON; may be null
     * @param operation operation name selecting the timeout; may be null
     * @param headers extra headers for this request
     * @return Uni with the response
     */
    public Uni<OutboundResponse> execute(
            String method, String url, Object body, String operation, Map<String, String> headers) {
        return Uni.createFrom().deferred(() -> {
            final var start = clock.millis();
            totalRequests.incrementAndGet();
            final var request = buildRequest(method, url, body, operation, headers);

            return admit()
                    .chain(this::pace)
                    .chain(ignored -> retryExecutor.execute(
                            () -> attempt(request),
                            profile.retry(),
                            (error, attempt) -> LOG.infof(
                                    "Retrying %s %s for %s after attempt %d: %s",
                                    method, request.uri(), profile.serviceName(), attempt, error.getMessage())))
                    .onItem()
                    .invoke(result -> metrics.recordRequest(
                            profile.serviceName(),
                            result.result().status(),
                            true,
                            result.attempts(),
                            clock.millis() - start))
                    .map(RetryResult::result)
                    .onFailure()
                    .invoke(error -> onRequestFailure(method, request, error, start));
        });
    }

    private Uni<Void> admit() {
        final var service = profile.serviceName();
        final var decision = profile.queueTimeout().isZero()
                ? rateLimitManager.checkLimit(service)
                : rateLimitManager.acquire(service, profile.queueTimeout());

        return decision.chain(result -> {
            if (!result.allowed()) {
                LOG.warnf("Rate limit exceeded for %s, resets at %s", service, result.resetTime());
                return Uni.createFrom().<Void>failure(new RateLimitRejectedException(service, result));
            }
            return Uni.createFrom().voidItem();
        });
    }

    /**
     * Keeps at least {@code 1/requestsPerSecond} between consecutive requests of this client.
     * Each caller reserves its slot up front, so concurrent callers queue in order.
     */
    private Uni<Void> pace(Void ignored) {
        final var now = clock.millis();
        final var slot =
                nextRequestSlot.updateAndGet(last -> last == 0 ? now : Math.max(now, last + minIntervalMillis));
        final var wait = slot - now;
        if (wait <= 0) {
            return Uni.createFrom().voidItem();
        }
        LOG.debugf("Pacing request to %s by %dms", profile.serviceName(), wait);
        return timeoutGuard.delay(Duration.ofMillis(wait));
    }

    private Uni<OutboundResponse> attempt(OutboundRequest request) {
        final var timeout = profile.timeoutFor(request.operation());
        return circuitBreaker.execute(
                () -> timeoutGuard.withHttpTimeout(() -> send(request), timeout, profile.serviceName()));
    }

    private Uni<OutboundResponse> send(OutboundRequest request) {
        final var attemptStart = clock.millis();
        if (LOG.isDebugEnabled()) {
            LOG.debugf(
                    "%s %s -> %s headers=%s",
                    request.method(), request.uri(), profile.serviceName(), redact(request.headers()));
        }
        lastRequestTime.set(attemptStart);
        return transport.send(request)
                .onItem()
                .invoke(response -> metrics.recordAttempt(
                        profile.serviceName(), request.method(), response.status(), clock.millis() - attemptStart))
                .onFailure()
                .invoke(error -> metrics.recordAttempt(
                        profile.serviceName(), request.method(), 0, clock.millis() - attemptStart))
                .map(this::validate);
    }

    private OutboundResponse validate(OutboundResponse response) {
        if (response.status() == 429) {
            final var retryAfter = parseRetryAfter(response);
            rateLimitManager.handle429Response(profile.serviceName(), retryAfter);
            throw new UpstreamRateLimitedException(
                    profile.serviceName(), response.headers(), response.body(), retryAfter);
        }
        if (response.status() >= 500) {
            throw new HttpStatusException(
                    profile.serviceName(), response.status(), response.headers(), response.body());
        }
        return response;
    }

    /**
     * Probes the service's base URL for reachability with the profile's health check settings.
     *
     * <p>Any status below 500 counts as reachable. A result younger than the check interval is
     * reused. Probes skip the circuit breaker so they never count against it, but still pass rate
     * limit admission; a denied probe reports the last known result, or reachable if there is none.
     *
     * @return Uni with true when the upstream answered
     */
    public Uni<Boolean> checkHealth() {
        return Uni.createFrom().deferred(() -> {
            final var settings = profile.healthCheck();
            final var previous = lastHealthProbe.get();
            if (previous != null && clock.millis() - previous.checkedAt() < settings.interval().toMillis()) {
                return Uni.createFrom().item(previous.reachable());
            }
            if (profile.baseUrl().isBlank()) {
                return Uni.createFrom().<Boolean>failure(new IllegalStateException(
                        "No base URL to probe for " + profile.serviceName()));
            }

            return rateLimitManager.checkLimit(profile.serviceName()).chain(decision -> {
                if (!decision.allowed()) {
                    LOG.debugf("Skipping health probe of %s while rate limited", profile.serviceName());
                    return Uni.createFrom().item(previous == null || previous.reachable());
                }
                return probe(settings);
            });
        });
    }

    private Uni<Boolean> probe(HealthCheckSettings settings) {
        final var request = buildRequest("GET", "/", null, null, Map.of());
        final var policy = profile.retry().withMaxAttempts(settings.retries() + 1);

        return retryExecutor.execute(
                        () -> timeoutGuard.withHttpTimeout(
                                () -> transport.send(request).map(this::failOnServerError),
                                settings.timeout(),
                                profile.serviceName()),
                        policy)
                .map(result -> true)
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warnf("Health probe of %s failed: %s", profile.serviceName(), error.getMessage());
                    return false;
                })
                .invoke(reachable -> lastHealthProbe.set(new HealthProbe(clock.millis(), reachable)));
    }

    private OutboundResponse failOnServerError(OutboundResponse response) {
        if (response.status() >= 500) {
            throw new HttpStatusException(
                    profile.serviceName(), response.status(), response.headers(), response.body());
        }
        return response;
    }

    static OptionalLong parseRetryAfter(OutboundResponse response) {
        return response.header("Retry-After")
                .map(String::trim)
                .filter(value -> value.matches("\\d+"))
                .map(value -> OptionalLong.of(Long.parseLong(value)))
                .orElse(OptionalLong.empty());
    }

    private void onRequestFailure(String method, OutboundRequest request, Throwable error, long start) {
        failedRequests.incrementAndGet();
        final var terminal = error instanceof RetryExhaustedException exhausted && exhausted.getLastError() != null
                ? exhausted.getLastError()
                : error;
        final var attempts = error instanceof RetryExhaustedException exhausted ? exhausted.getAttempts() : 0;
        final var status = terminal instanceof HttpStatusException http ? http.getStatus() : 0;

        metrics.recordRequestFailure(profile.serviceName(), terminal.getClass().getSimpleName());
        metrics.recordRequest(profile.serviceName(), status, false, attempts, clock.millis() - start);
        LOG.warnf(
                "%s %s to %s failed after %d attempts: %s",
                method, request.uri(), profile.serviceName(), attempts, error.getMessage());
    }

    OutboundRequest buildRequest(
            String method, String url, Object body, String operation, Map<String, String> headers) {
        final Map<String, List<String>> merged = new LinkedHashMap<>(defaultHeaders);
        headers.forEach((name, value) -> merged.put(name, List.of(value)));

        final var payload = encodeBody(body);
        if (payload.length > 0 && !(body instanceof byte[]) && !(body instanceof String)) {
            merged.putIfAbsent("Content-Type", List.of("application/json"));
        }

        return new OutboundRequest(method, resolve(url), merged, payload, operation);
    }

    URI resolve(String url) {
        if (url.startsWith("http://") || url.startsWith("https://")) {
            return URI.create(url);
        }
        final var base = profile.baseUrl().endsWith("/")
                ? profile.baseUrl().substring(0, profile.baseUrl().length() - 1)
                : profile.baseUrl();
        final var path = url.startsWith("/") ? url : "/" + url;
        return URI.create(base + path);
    }

    private byte[] encodeBody(Object body) {
        if (body == null) {
            return new byte[0];
        }
        if (body instanceof byte[] bytes) {
            return bytes;
        }
        if (body instanceof String text) {
            return text.getBytes(StandardCharsets.UTF_8);
        }
        try {
            return objectMapper.writeValueAsBytes(body);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to encode request body for " + profile.serviceName(), e);
        }
    }

    static Map<String, String> redact(Map<String, List<String>> headers) {
        return headers.entrySet().stream()
                .collect(Collectors.toMap(
                        Map.Entry::getKey,
                        e -> isSensitive(e.getKey()) ? "[REDACTED]" : String.join(",", e.getValue())));
    }

    private static boolean isSensitive(String header) {
        final var lower = header.toLowerCase(Locale.ROOT);
        return SENSITIVE_HEADER_MARKERS.stream().anyMatch(lower::contains);
    }

    public ClientHealthStatus getHealthStatus() {
        final var last = lastRequestTime.get();
        final var probe = lastHealthProbe.get();
        return new ClientHealthStatus(
                profile.serviceName(),
                circuitBreaker.getStatus(),
                last > 0 ? Instant.ofEpochMilli(last) : null,
                profile.rateLimit(),
                rateLimitManager.getStatus(profile.serviceName()).orElse(null),
                totalRequests.get(),
                failedRequests.get(),
                profile.healthCheck(),
                probe != null ? Instant.ofEpochMilli(probe.checkedAt()) : null,
                probe != null ? probe.reachable() : null);
    }

    public void resetCircuitBreaker() {
        circuitBreaker.reset();
    }

    public void openCircuitBreaker() {
        circuitBreaker.forceOpen();
    }

    public void closeCircuitBreaker() {
        circuitBreaker.forceClose();
    }

    public ServiceProfile getProfile() {
        return profile;
    }

    public String getServiceName() {
        return profile.serviceName();
    }

    private record HealthProbe(long checkedAt, boolean reachable) {}
}
