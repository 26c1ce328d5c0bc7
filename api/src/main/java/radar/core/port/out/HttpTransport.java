package radar.core.port.out;

import io.smallrye.mutiny.Uni;

import radar.core.model.http.OutboundRequest;
import radar.core.model.http.OutboundResponse;

/**
 * Port interface for sending a single HTTP request to an upstream service.
 *
 * <p>Implementations own connection pooling, TLS and wire encoding. They return
 * every response the upstream sends, whatever its status, and fail with
 * {@link radar.core.exception.NetworkException} only when no response arrived.
 * Cancelling the returned {@link Uni} should abort the request where the
 * transport supports it.
 */
public interface HttpTransport {

    /**
     * Send a request.
     *
     * @param request the resolved request
     * @return Uni with the upstream response
     */
    Uni<OutboundResponse> send(OutboundRequest request);
}
