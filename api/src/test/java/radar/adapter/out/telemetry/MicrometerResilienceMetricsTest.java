package radar.adapter.out.telemetry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import radar.config.TelemetryConfigMapping;
import radar.core.model.resilience.CircuitBreakerState;

@DisplayName("MicrometerResilienceMetrics")
class MicrometerResilienceMetricsTest {

    private SimpleMeterRegistry registry;
    private TelemetryConfigMapping telemetryConfig;
    private TelemetryConfigMapping.MetricsConfig metricsConfig;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        telemetryConfig = mock(TelemetryConfigMapping.class);
        metricsConfig = mock(TelemetryConfigMapping.MetricsConfig.class);
        when(telemetryConfig.metrics()).thenReturn(metricsConfig);
    }

    private MicrometerResilienceMetrics metrics(boolean telemetry, boolean metricsEnabled) {
        when(telemetryConfig.enabled()).thenReturn(telemetry);
        when(metricsConfig.enabled()).thenReturn(metricsEnabled);
        return new MicrometerResilienceMetrics(registry, telemetryConfig);
    }

    @Nested
    @DisplayName("isEnabled")
    class IsEnabled {

        @Test
        @DisplayName("should return true when telemetry and metrics are enabled")
        void shouldReturnTrueWhenBothEnabled() {
            assertTrue(metrics(true, true).isEnabled());
        }

        @Test
        @DisplayName("should return false when telemetry is disabled")
        void shouldReturnFalseWhenTelemetryDisabled() {
            assertFalse(metrics(false, true).isEnabled());
        }

        @Test
        @DisplayName("should return false when metrics are disabled")
        void shouldReturnFalseWhenMetricsDisabled() {
            assertFalse(metrics(true, false).isEnabled());
        }
    }

    @Nested
    @DisplayName("when enabled")
    class WhenEnabled {

        private MicrometerResilienceMetrics metrics;

        @BeforeEach
        void setUp() {
            metrics = metrics(true, true);
        }

        @Test
        @DisplayName("should track circuit breaker state through the gauge")
        void shouldTrackBreakerState() {
            var state = new AtomicReference<>(CircuitBreakerState.CLOSED);
            metrics.registerCircuitBreaker("goplus", state::get);

            var gauge = registry.get("radar.circuit_breaker.state").tag("service", "goplus").gauge();
            assertEquals(0.0, gauge.value());

            state.set(CircuitBreakerState.OPEN);
            assertEquals(CircuitBreakerState.OPEN.gaugeValue(), gauge.value());
        }

        @Test
        @DisplayName("should follow the newest breaker registered under a service")
        void shouldFollowReplacedBreaker() {
            metrics.registerCircuitBreaker("birdeye", () -> CircuitBreakerState.CLOSED);
            metrics.registerCircuitBreaker("birdeye", () -> CircuitBreakerState.OPEN);

            var gauges = registry.find("radar.circuit_breaker.state").tag("service", "birdeye").gauges();
            assertEquals(1, gauges.size());
            assertEquals(2.0, gauges.iterator().next().value());
        }

        @Test
        @DisplayName("should count circuit breaker calls by outcome")
        void shouldCountBreakerCalls() {
            metrics.recordCircuitBreakerCall("goplus", "success");
            metrics.recordCircuitBreakerCall("goplus", "success");
            metrics.recordCircuitBreakerCall("goplus", "rejected");

            assertEquals(
                    2.0,
                    registry.get("radar.circuit_breaker.calls")
                            .tag("outcome", "success")
                            .counter()
                            .count());
            assertEquals(
                    1.0,
                    registry.get("radar.circuit_breaker.calls")
                            .tag("outcome", "rejected")
                            .counter()
                            .count());
        }

        @Test
        @DisplayName("should record retry outcomes and exhaustion")
        void shouldRecordRetryOutcomes() {
            metrics.recordRetryAttemptFailed("birdeye", 1);
            metrics.recordRetryOutcome("birdeye", 3, false);

            assertEquals(
                    1.0,
                    registry.get("radar.retry.attempt.failed")
                            .tag("attempt", "1")
                            .counter()
                            .count());
            var summary = registry.get("radar.retry.attempts").tag("success", "false").summary();
            assertEquals(3.0, summary.totalAmount());
            assertEquals(1.0, registry.get("radar.retry.exhausted").counter().count());
        }

        @Test
        @DisplayName("should record timeouts and completions")
        void shouldRecordTimeouts() {
            metrics.recordTimeout("http_goplus", 15_000);
            metrics.recordOperationCompleted("http_goplus", 120, true);

            assertEquals(
                    1.0,
                    registry.get("radar.operation.timeouts")
                            .tag("service", "goplus")
                            .tag("operation", "http_goplus")
                            .counter()
                            .count());
            var deadline = registry.get("radar.operation.timeout.deadline").tag("service", "goplus").summary();
            assertEquals(15_000.0, deadline.totalAmount());
            var timer = registry.get("radar.operation.completed")
                    .tag("service", "goplus")
                    .tag("result", "success")
                    .timer();
            assertEquals(120.0, timer.totalTime(TimeUnit.MILLISECONDS));
        }

        @Test
        @DisplayName("should derive the service tag from helper operation names")
        void shouldDeriveServiceTag() {
            assertEquals("goplus", MicrometerResilienceMetrics.serviceOf("http_goplus"));
            assertEquals("positions", MicrometerResilienceMetrics.serviceOf("db_positions"));
            assertEquals("race", MicrometerResilienceMetrics.serviceOf("race"));
            assertEquals("http_", MicrometerResilienceMetrics.serviceOf("http_"));
            assertEquals("unknown", MicrometerResilienceMetrics.serviceOf(null));
        }

        @Test
        @DisplayName("should tag attempts with status class")
        void shouldTagAttempts() {
            metrics.recordAttempt("dexscreener", "GET", 503, 40);
            metrics.recordAttempt("dexscreener", "GET", 0, 5);

            assertEquals(
                    1L,
                    registry.get("radar.http.request.duration")
                            .tag("status_class", "5xx")
                            .timer()
                            .count());
            assertEquals(
                    1L,
                    registry.get("radar.http.request.duration")
                            .tag("status", "none")
                            .timer()
                            .count());
        }

        @Test
        @DisplayName("should record logical requests and failures")
        void shouldRecordRequests() {
            metrics.recordRequest("coingecko", 200, true, 2, 300);
            metrics.recordRequestFailure("coingecko", "RetryExhaustedException");

            assertEquals(
                    1.0,
                    registry.get("radar.http.requests.total")
                            .tag("status", "200")
                            .counter()
                            .count());
            assertEquals(
                    1L,
                    registry.get("radar.http.total.duration")
                            .tag("attempts", "2")
                            .timer()
                            .count());
            assertEquals(
                    1.0,
                    registry.get("radar.http.requests.failed")
                            .tag("error", "RetryExhaustedException")
                            .counter()
                            .count());
        }

        @Test
        @DisplayName("should record rate limit checks and blocks")
        void shouldRecordRateLimits() {
            metrics.recordRateLimitCheck("birdeye", false);
            metrics.recordRateLimitBlock("birdeye", 60_000);

            assertEquals(
                    1.0,
                    registry.get("radar.rate_limit.checks")
                            .tag("allowed", "false")
                            .counter()
                            .count());
            assertEquals(1.0, registry.get("radar.rate_limit.blocks").counter().count());
        }
    }

    @Test
    @DisplayName("should record nothing when disabled")
    void shouldRecordNothingWhenDisabled() {
        var metrics = metrics(false, false);

        metrics.registerCircuitBreaker("goplus", () -> CircuitBreakerState.OPEN);
        metrics.recordCircuitBreakerCall("goplus", "failure");
        metrics.recordRequest("goplus", 500, false, 3, 1000);

        assertTrue(registry.getMeters().isEmpty());
        assertNull(registry.find("radar.circuit_breaker.state").gauge());
    }
}
