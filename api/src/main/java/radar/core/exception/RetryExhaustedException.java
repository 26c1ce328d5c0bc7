package radar.core.exception;

import java.util.List;

/**
 * Terminal failure of a retried operation.
 *
 * <p>Holds every attempt's error in attempt order; the last one is also the cause.
 */
public class RetryExhaustedException extends RuntimeException {

    private final String operation;
    private final int attempts;
    private final List<Throwable> errors;

    public RetryExhaustedException(String operation, int attempts, List<Throwable> errors) {
        super(
                "Operation " + operation + " failed after " + attempts + " attempts. Last error: "
                        + lastMessage(errors),
                errors.isEmpty() ? null : errors.get(errors.size() - 1));
        this.operation = operation;
        this.attempts = attempts;
        this.errors = List.copyOf(errors);
    }

    private static String lastMessage(List<Throwable> errors) {
        return errors.isEmpty() ? "none" : errors.get(errors.size() - 1).getMessage();
    }

    public String getOperation() {
        return operation;
    }

    public int getAttempts() {
        return attempts;
    }

    public Throwable getLastError() {
        return getCause();
    }

    public List<Throwable> getErrors() {
        return errors;
    }
}
