package radar.adapter.out.http;

import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.net.UnknownHostException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeoutException;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Context;
import io.opentelemetry.context.propagation.TextMapPropagator;
import io.opentelemetry.context.propagation.TextMapSetter;
import io.smallrye.mutiny.Uni;
import io.vertx.core.http.HttpMethod;
import io.vertx.ext.web.client.WebClientOptions;
import io.vertx.mutiny.core.Vertx;
import io.vertx.mutiny.core.buffer.Buffer;
import io.vertx.mutiny.ext.web.client.HttpRequest;
import io.vertx.mutiny.ext.web.client.HttpResponse;
import io.vertx.mutiny.ext.web.client.WebClient;
import org.jboss.logging.Logger;

import radar.adapter.out.telemetry.SpanAttributes;
import radar.config.TelemetryConfigMapping;
import radar.core.config.ResilienceConfig;
import radar.core.exception.NetworkErrorCode;
import radar.core.exception.NetworkException;
import radar.core.model.http.OutboundRequest;
import radar.core.model.http.OutboundResponse;
import radar.core.port.out.HttpTransport;

/**
 * HTTP adapter sending outbound requests with Vert.x WebClient.
 *
 * <p>Returns every response as received; status handling belongs to the caller.
 * Failures without a response are translated to {@link NetworkException}.
 *
 * <p>When tracing is enabled, each request gets a CLIENT span and W3C Trace Context
 * headers (traceparent, tracestate) are propagated to the upstream.
 */
@ApplicationScoped
public class VertxHttpTransport implements HttpTransport {

    private static final Logger LOG = Logger.getLogger(VertxHttpTransport.class);

    private static final TextMapSetter<HttpRequest<Buffer>> HEADER_SETTER =
            (carrier, key, value) -> carrier.putHeader(key, value);

    private final Vertx vertx;
    private final Tracer tracer;
    private final TextMapPropagator propagator;
    private final ResilienceConfig.TransportConfig transportConfig;
    private final boolean tracingEnabled;
    private WebClient webClient;

    @Inject
    public VertxHttpTransport(
            Vertx vertx,
            Tracer tracer,
            TextMapPropagator propagator,
            ResilienceConfig config,
            TelemetryConfigMapping telemetryConfig) {
        this.vertx = vertx;
        this.tracer = tracer;
        this.propagator = propagator;
        this.transportConfig = config.transport();
        this.tracingEnabled = telemetryConfig != null
                && telemetryConfig.enabled()
                && telemetryConfig.tracing().enabled();
    }

    @PostConstruct
    void init() {
        final var options = new WebClientOptions()
                .setConnectTimeout((int) transportConfig.connectTimeout().toMillis())
                .setMaxPoolSize(transportConfig.maxConnectionsPerHost())
                .setUserAgentEnabled(false)
                .setFollowRedirects(true);
        this.webClient = WebClient.create(vertx, options);
    }

    @PreDestroy
    void close() {
        if (webClient != null) {
            webClient.close();
        }
    }

    @Override
    public Uni<OutboundResponse> send(OutboundRequest outbound) {
        final var targetUri = outbound.uri();
        final var request = createRequest(HttpMethod.valueOf(outbound.method()), targetUri);
        applyHeaders(outbound, request);

        final var span = tracingEnabled ? startSpan(outbound, targetUri) : Span.getInvalid();
        if (tracingEnabled) {
            // Propagate trace context (W3C Trace Context headers)
            propagator.inject(Context.current().with(span), request, HEADER_SETTER);
        }

        return execute(request, outbound)
                .invoke(response -> {
                    span.setAttribute(SpanAttributes.HTTP_STATUS_CODE, (long) response.status());
                    if (response.status() >= 400) {
                        span.setStatus(StatusCode.ERROR, "HTTP " + response.status());
                    }
                    span.end();
                })
                .onFailure()
                .transform(error -> {
                    final var translated = translate(targetUri, error);
                    span.setAttribute(SpanAttributes.NETWORK_ERROR, translated.getCode().name());
                    span.setStatus(StatusCode.ERROR, translated.getMessage());
                    span.recordException(error);
                    span.end();
                    return translated;
                })
                .onCancellation()
                .invoke(() -> {
                    span.setStatus(StatusCode.ERROR, "cancelled");
                    span.end();
                });
    }

    private Span startSpan(OutboundRequest outbound, URI targetUri) {
        final var builder = tracer.spanBuilder("HTTP " + outbound.method())
                .setSpanKind(SpanKind.CLIENT)
                .setAttribute(SpanAttributes.HTTP_METHOD, outbound.method())
                .setAttribute(SpanAttributes.HTTP_URL, targetUri.toString())
                .setAttribute(SpanAttributes.NET_PEER_NAME, targetUri.getHost())
                .setAttribute(SpanAttributes.NET_PEER_PORT, (long) getPort(targetUri));
        if (outbound.operation() != null) {
            builder.setAttribute(SpanAttributes.OPERATION, outbound.operation());
        }
        return builder.startSpan();
    }

    private int getPort(URI uri) {
        var port = uri.getPort();
        if (port == -1) {
            port = "https".equalsIgnoreCase(uri.getScheme()) ? 443 : 80;
        }
        return port;
    }

    private HttpRequest<Buffer> createRequest(HttpMethod method, URI targetUri) {
        return webClient.requestAbs(method, targetUri.toString());
    }

    private void applyHeaders(OutboundRequest outbound, HttpRequest<Buffer> httpRequest) {
        for (var entry : outbound.headers().entrySet()) {
            for (var value : entry.getValue()) {
                httpRequest.putHeader(entry.getKey(), value);
            }
        }
    }

    private Uni<OutboundResponse> execute(HttpRequest<Buffer> request, OutboundRequest outbound) {
        if (outbound.hasBody()) {
            return request.sendBuffer(Buffer.buffer(outbound.body())).map(this::toOutboundResponse);
        }

        return request.send().map(this::toOutboundResponse);
    }

    private OutboundResponse toOutboundResponse(HttpResponse<Buffer> response) {
        Map<String, List<String>> headers = new HashMap<>();

        for (var name : response.headers().names()) {
            headers.computeIfAbsent(name, k -> new ArrayList<>())
                    .addAll(response.headers().getAll(name));
        }

        var responseBody = response.body() != null ? response.body().getBytes() : new byte[0];

        return new OutboundResponse(response.statusCode(), headers, responseBody);
    }

    /**
     * Maps a transport failure to a {@link NetworkException}, walking the cause chain.
     */
    static NetworkException translate(URI target, Throwable error) {
        if (error instanceof NetworkException network) {
            return network;
        }
        final var code = classify(error);
        LOG.debugf("Request to %s failed with %s: %s", target.getHost(), code, error.getMessage());
        return new NetworkException(code, code + " calling " + target.getHost() + ": " + error.getMessage(), error);
    }

    static NetworkErrorCode classify(Throwable error) {
        for (var current = error; current != null; current = current.getCause()) {
            final var name = current.getClass().getSimpleName();
            final var message = current.getMessage() != null ? current.getMessage().toLowerCase(Locale.ROOT) : "";

            if (current instanceof TimeoutException
                    || current instanceof SocketTimeoutException
                    || name.contains("Timeout")) {
                return NetworkErrorCode.TIMED_OUT;
            }
            if (current instanceof UnknownHostException || message.contains("failed to resolve")) {
                return NetworkErrorCode.DNS_FAILURE;
            }
            if (current instanceof ConnectException || message.contains("connection refused")) {
                return NetworkErrorCode.CONNECTION_REFUSED;
            }
            if (message.contains("connection reset") || message.contains("connection was closed")) {
                return NetworkErrorCode.CONNECTION_RESET;
            }
            if (current.getCause() == current) {
                break;
            }
        }
        return NetworkErrorCode.OTHER;
    }
}
