package radar.core.service.client;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.lenient;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import radar.core.config.ResilienceConfig;
import radar.core.model.resilience.RateLimitConfig;
import radar.core.model.resilience.ResiliencyMode;
import radar.core.port.out.ResilienceMetrics;
import radar.core.service.resilience.CircuitBreakerRegistry;
import radar.core.service.resilience.RateLimitManager;
import radar.core.service.resilience.RetryExecutor;
import radar.core.service.resilience.TimeoutGuard;
import radar.mock.ScriptedHttpTransport;

@DisplayName("HttpClientFactory")
@ExtendWith(MockitoExtension.class)
class HttpClientFactoryTest {

    @Mock
    private ResilienceConfig config;

    @Mock
    private ResilienceMetrics metrics;

    private CircuitBreakerRegistry circuitBreakers;
    private RateLimitManager rateLimitManager;
    private ScriptedHttpTransport transport;
    private HttpClientFactory factory;

    @BeforeEach
    void setUp() {
        lenient().when(config.mode()).thenReturn(ResiliencyMode.DEFAULT);
        lenient().when(config.services()).thenReturn(Map.of());
        lenient().when(config.userAgent()).thenReturn("Radar-Test/1.0");

        var clock = Clock.systemUTC();
        transport = new ScriptedHttpTransport();
        circuitBreakers = new CircuitBreakerRegistry(clock, metrics);
        rateLimitManager = new RateLimitManager(
                clock, metrics, Duration.ofMinutes(1), Map.of("birdeye", RateLimitConfig.perSecond(0.9, 3)));
        factory = new HttpClientFactory(
                new ServiceProfiles(config),
                transport,
                circuitBreakers,
                rateLimitManager,
                new RetryExecutor(clock, metrics),
                new TimeoutGuard(clock, metrics),
                metrics,
                new ObjectMapper(),
                clock,
                config);
    }

    @Test
    @DisplayName("should cache one client per service")
    void shouldCacheClients() {
        var first = factory.client("dexscreener");

        assertSame(first, factory.client("dexscreener"));
        assertSame(first, factory.dexScreener());
        assertEquals(1, factory.all().size());
    }

    @Test
    @DisplayName("named accessors should return the matching services")
    void shouldExposeNamedClients() {
        assertEquals(HttpClientFactory.DEXSCREENER, factory.dexScreener().getServiceName());
        assertEquals(HttpClientFactory.GOPLUS, factory.goPlus().getServiceName());
        assertEquals(HttpClientFactory.BIRDEYE, factory.birdeye().getServiceName());
        assertEquals(HttpClientFactory.COINGECKO, factory.coinGecko().getServiceName());
    }

    @Test
    @DisplayName("should register the profile's rate limit when none exists")
    void shouldRegisterProfileLimit() {
        factory.coinGecko();

        assertEquals(Optional.of(RateLimitConfig.perSecond(2, 5)), rateLimitManager.getLimit("coingecko"));
    }

    @Test
    @DisplayName("should keep limits already known to the rate limiter")
    void shouldKeepManagerLimit() {
        factory.birdeye();

        assertEquals(Optional.of(RateLimitConfig.perSecond(0.9, 3)), rateLimitManager.getLimit("birdeye"));
    }

    @Test
    @DisplayName("should share circuit breakers through the registry")
    void shouldShareBreakers() {
        var client = factory.goPlus();
        client.openCircuitBreaker();

        assertTrue(circuitBreakers.get("goplus").isPresent());
        assertEquals(
                client.getHealthStatus().circuitBreaker().state(),
                circuitBreakers.get("goplus").orElseThrow().getState());
    }

    @Test
    @DisplayName("find should only return clients already built")
    void findShouldNotCreate() {
        assertTrue(factory.find("goplus").isEmpty());

        factory.goPlus();

        assertTrue(factory.find("goplus").isPresent());
    }

    @Test
    @DisplayName("should report health for every built client")
    void shouldReportHealth() {
        factory.dexScreener();
        factory.birdeye();

        var health = factory.getHealthStatus();

        assertEquals(2, health.size());
        assertEquals("birdeye", health.get("birdeye").service());
    }

    @Test
    @DisplayName("should send the configured user agent")
    void shouldUseConfiguredUserAgent() {
        factory.client("custom").get("http://localhost:1/ping").await().atMost(Duration.ofSeconds(5));

        assertEquals("Radar-Test/1.0", transport.requests().get(0).headers().get("User-Agent").get(0));
    }
}
