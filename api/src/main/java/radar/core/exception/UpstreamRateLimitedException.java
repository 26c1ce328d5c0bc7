package radar.core.exception;

import java.util.List;
import java.util.Map;
import java.util.OptionalLong;

/**
 * An upstream answered 429 Too Many Requests.
 *
 * <p>Carries the parsed {@code Retry-After} value when the upstream sent one in seconds.
 */
public class UpstreamRateLimitedException extends HttpStatusException {

    private final OptionalLong retryAfterSeconds;

    public UpstreamRateLimitedException(
            String service, Map<String, List<String>> headers, byte[] body, OptionalLong retryAfterSeconds) {
        super("HTTP 429 rate limited by " + service, service, 429, headers, body);
        this.retryAfterSeconds = retryAfterSeconds != null ? retryAfterSeconds : OptionalLong.empty();
    }

    public OptionalLong getRetryAfterSeconds() {
        return retryAfterSeconds;
    }
}
