package radar.core.exception;

import java.util.List;
import java.util.Map;

/**
 * Raised when an upstream answered with a status the client does not accept.
 */
public class HttpStatusException extends RuntimeException {

    private final String service;
    private final int status;
    private final Map<String, List<String>> headers;
    private final byte[] body;

    public HttpStatusException(String service, int status, Map<String, List<String>> headers, byte[] body) {
        this("HTTP " + status + " from " + service, service, status, headers, body);
    }

    protected HttpStatusException(
            String message, String service, int status, Map<String, List<String>> headers, byte[] body) {
        super(message);
        this.service = service;
        this.status = status;
        this.headers = headers != null ? headers : Map.of();
        this.body = body != null ? body.clone() : new byte[0];
    }

    public String getService() {
        return service;
    }

    public int getStatus() {
        return status;
    }

    public Map<String, List<String>> getHeaders() {
        return headers;
    }

    /** Returns a copy of the response body. */
    public byte[] getBody() {
        return body.clone();
    }

    /** Returns true for 5xx statuses. */
    public boolean isServerError() {
        return status >= 500;
    }

    /** Returns true for 4xx statuses. */
    public boolean isClientError() {
        return status >= 400 && status < 500;
    }
}
