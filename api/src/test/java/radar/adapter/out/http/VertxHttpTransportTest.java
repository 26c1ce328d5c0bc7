package radar.adapter.out.http;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.getRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.post;
import static com.github.tomakehurst.wiremock.client.WireMock.postRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.lenient;

import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.net.UnknownHostException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.propagation.TextMapPropagator;
import io.vertx.mutiny.core.Vertx;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import radar.config.TelemetryConfigMapping;
import radar.core.config.ResilienceConfig;
import radar.core.exception.NetworkErrorCode;
import radar.core.exception.NetworkException;
import radar.core.model.http.OutboundRequest;

/**
 * Unit tests for VertxHttpTransport against a local WireMock server.
 */
@DisplayName("VertxHttpTransport")
@ExtendWith(MockitoExtension.class)
class VertxHttpTransportTest {

    private static final Duration AWAIT = Duration.ofSeconds(5);

    @Mock
    private Tracer tracer;

    @Mock
    private TextMapPropagator propagator;

    @Mock
    private ResilienceConfig config;

    @Mock
    private ResilienceConfig.TransportConfig transportConfig;

    @Mock
    private TelemetryConfigMapping telemetryConfig;

    private WireMockServer wireMockServer;
    private Vertx vertx;
    private VertxHttpTransport transport;

    @BeforeEach
    void setUp() {
        vertx = Vertx.vertx();
        wireMockServer = new WireMockServer(WireMockConfiguration.options().dynamicPort());
        wireMockServer.start();

        lenient().when(config.transport()).thenReturn(transportConfig);
        lenient().when(transportConfig.connectTimeout()).thenReturn(Duration.ofSeconds(2));
        lenient().when(transportConfig.maxConnectionsPerHost()).thenReturn(4);

        transport = new VertxHttpTransport(vertx, tracer, propagator, config, telemetryConfig);
        transport.init();
    }

    @AfterEach
    void tearDown() {
        if (transport != null) {
            transport.close();
        }
        if (wireMockServer != null) {
            wireMockServer.stop();
        }
        if (vertx != null) {
            vertx.close().await().indefinitely();
        }
    }

    private URI uri(String path) {
        return URI.create("http://localhost:" + wireMockServer.port() + path);
    }

    @Nested
    @DisplayName("send")
    class Send {

        @Test
        @DisplayName("should return status, headers and body as received")
        void shouldReturnResponse() {
            wireMockServer.stubFor(get(urlEqualTo("/latest/pairs"))
                    .willReturn(aResponse()
                            .withStatus(200)
                            .withHeader("Content-Type", "application/json")
                            .withBody("{\"pairs\":[]}")));

            var response = transport.send(new OutboundRequest("GET", uri("/latest/pairs"), Map.of(), null, null))
                    .await()
                    .atMost(AWAIT);

            assertEquals(200, response.status());
            assertEquals("application/json", response.header("content-type").orElseThrow());
            assertEquals("{\"pairs\":[]}", response.bodyAsString());
        }

        @Test
        @DisplayName("should hand back error statuses without failing")
        void shouldReturnErrorStatuses() {
            wireMockServer.stubFor(get(urlEqualTo("/busy"))
                    .willReturn(aResponse().withStatus(429).withHeader("Retry-After", "30")));

            var response = transport.send(new OutboundRequest("GET", uri("/busy"), Map.of(), null, null))
                    .await()
                    .atMost(AWAIT);

            assertEquals(429, response.status());
            assertEquals("30", response.header("Retry-After").orElseThrow());
        }

        @Test
        @DisplayName("should send headers")
        void shouldSendHeaders() {
            wireMockServer.stubFor(get(urlEqualTo("/price")).willReturn(aResponse().withStatus(200)));

            transport.send(new OutboundRequest(
                            "GET",
                            uri("/price"),
                            Map.of("X-API-KEY", List.of("abc"), "User-Agent", List.of("Radar/1.0")),
                            null,
                            "price"))
                    .await()
                    .atMost(AWAIT);

            wireMockServer.verify(getRequestedFor(urlEqualTo("/price"))
                    .withHeader("X-API-KEY", equalTo("abc"))
                    .withHeader("User-Agent", equalTo("Radar/1.0")));
        }

        @Test
        @DisplayName("should send the request body")
        void shouldSendBody() {
            wireMockServer.stubFor(post(urlEqualTo("/batch")).willReturn(aResponse().withStatus(201)));

            var response = transport.send(new OutboundRequest(
                            "POST",
                            uri("/batch"),
                            Map.of("Content-Type", List.of("application/json")),
                            "{\"ids\":[1,2]}".getBytes(StandardCharsets.UTF_8),
                            null))
                    .await()
                    .atMost(AWAIT);

            assertEquals(201, response.status());
            wireMockServer.verify(postRequestedFor(urlEqualTo("/batch")).withRequestBody(equalTo("{\"ids\":[1,2]}")));
        }

        @Test
        @DisplayName("should translate refused connections to NetworkException")
        void shouldTranslateRefusedConnection() {
            var port = wireMockServer.port();
            wireMockServer.stop();

            var error = assertThrows(
                    NetworkException.class,
                    () -> transport.send(new OutboundRequest(
                                    "GET", URI.create("http://localhost:" + port + "/"), Map.of(), null, null))
                            .await()
                            .atMost(AWAIT));

            assertEquals(NetworkErrorCode.CONNECTION_REFUSED, error.getCode());
            assertTrue(error.getMessage().startsWith("CONNECTION_REFUSED calling localhost"));
        }
    }

    @Nested
    @DisplayName("classify")
    class Classify {

        @Test
        @DisplayName("should detect timeouts")
        void shouldDetectTimeouts() {
            assertEquals(NetworkErrorCode.TIMED_OUT, VertxHttpTransport.classify(new TimeoutException("slow")));
            assertEquals(NetworkErrorCode.TIMED_OUT, VertxHttpTransport.classify(new SocketTimeoutException()));
        }

        @Test
        @DisplayName("should detect DNS failures")
        void shouldDetectDnsFailures() {
            assertEquals(
                    NetworkErrorCode.DNS_FAILURE, VertxHttpTransport.classify(new UnknownHostException("nope.test")));
            assertEquals(
                    NetworkErrorCode.DNS_FAILURE,
                    VertxHttpTransport.classify(new IOException("Failed to resolve 'nope.test'")));
        }

        @Test
        @DisplayName("should detect refused and reset connections")
        void shouldDetectConnectionFailures() {
            assertEquals(
                    NetworkErrorCode.CONNECTION_REFUSED, VertxHttpTransport.classify(new ConnectException("refused")));
            assertEquals(
                    NetworkErrorCode.CONNECTION_RESET,
                    VertxHttpTransport.classify(new IOException("Connection reset by peer")));
            assertEquals(
                    NetworkErrorCode.CONNECTION_RESET,
                    VertxHttpTransport.classify(new IllegalStateException("Connection was closed")));
        }

        @Test
        @DisplayName("should walk the cause chain")
        void shouldWalkCauses() {
            var wrapped = new RuntimeException("request failed", new ConnectException("refused"));

            assertEquals(NetworkErrorCode.CONNECTION_REFUSED, VertxHttpTransport.classify(wrapped));
        }

        @Test
        @DisplayName("should fall back to OTHER")
        void shouldFallBack() {
            assertEquals(NetworkErrorCode.OTHER, VertxHttpTransport.classify(new IllegalStateException("odd")));
        }

        @Test
        @DisplayName("translate should keep existing NetworkExceptions")
        void translateShouldKeepNetworkExceptions() {
            var original = new NetworkException(NetworkErrorCode.CONNECTION_RESET, "reset");

            assertSame(original, VertxHttpTransport.translate(URI.create("http://x.test"), original));
        }
    }
}
