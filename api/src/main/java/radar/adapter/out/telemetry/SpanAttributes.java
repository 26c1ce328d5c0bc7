package radar.adapter.out.telemetry;

/**
 * Constants for span attributes used in distributed tracing.
 *
 * <p>They follow OpenTelemetry semantic conventions where applicable.
 *
 * @see <a href="https://opentelemetry.io/docs/specs/semconv/">OpenTelemetry Semantic Conventions</a>
 */
public final class SpanAttributes {

    private SpanAttributes() {}

    // -------------------------------------------------------------------------
    // OpenTelemetry Semantic Convention Attributes
    // @see https://opentelemetry.io/docs/specs/semconv/http/http-spans/
    // -------------------------------------------------------------------------

    /** HTTP method (GET, POST, etc.). */
    public static final String HTTP_METHOD = "http.method";

    /** Full URL of the HTTP request. */
    public static final String HTTP_URL = "http.url";

    /** HTTP response status code. */
    public static final String HTTP_STATUS_CODE = "http.status_code";

    /** Remote host name. */
    public static final String NET_PEER_NAME = "net.peer.name";

    /** Remote port number. */
    public static final String NET_PEER_PORT = "net.peer.port";

    // -------------------------------------------------------------------------
    // Radar Attributes
    // -------------------------------------------------------------------------

    /** Logical operation name, when the caller gave one. */
    public static final String OPERATION = "radar.operation";

    /** Network failure kind when no response was received. */
    public static final String NETWORK_ERROR = "radar.network.error";
}
