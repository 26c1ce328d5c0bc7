package radar.core.model.http;

import java.net.URI;
import java.util.List;
import java.util.Map;

/**
 * A fully resolved outbound request, ready for the transport.
 *
 * @param method HTTP method name
 * @param uri absolute target
 * @param headers request headers
 * @param body request body, empty when none
 * @param operation logical operation name used for per-operation timeouts, may be null
 */
public record OutboundRequest(
        String method, URI uri, Map<String, List<String>> headers, byte[] body, String operation) {

    public OutboundRequest {
        if (method == null || method.isBlank()) {
            throw new IllegalArgumentException("method is required");
        }
        if (uri == null) {
            throw new IllegalArgumentException("uri is required");
        }
        if (headers == null) {
            headers = Map.of();
        }
        if (body == null) {
            body = new byte[0];
        }
    }

    public boolean hasBody() {
        return body.length > 0;
    }
}
