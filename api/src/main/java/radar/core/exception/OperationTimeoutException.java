package radar.core.exception;

import java.time.Duration;

/**
 * An operation did not complete before its deadline.
 */
public class OperationTimeoutException extends RuntimeException {

    private final String operation;
    private final Duration timeout;

    public OperationTimeoutException(String operation, Duration timeout) {
        super("Operation '" + operation + "' timed out after " + timeout.toMillis() + "ms");
        this.operation = operation;
        this.timeout = timeout;
    }

    public String getOperation() {
        return operation;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public long getTimeoutMs() {
        return timeout.toMillis();
    }
}
