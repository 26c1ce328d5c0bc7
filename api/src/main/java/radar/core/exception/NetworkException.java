package radar.core.exception;

/**
 * Raised by the transport when no HTTP response was received.
 */
public class NetworkException extends RuntimeException {

    private final NetworkErrorCode code;

    public NetworkException(NetworkErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public NetworkException(NetworkErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public NetworkErrorCode getCode() {
        return code;
    }
}
