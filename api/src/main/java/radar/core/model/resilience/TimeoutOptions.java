package radar.core.model.resilience;

import java.time.Duration;
import java.util.Optional;

/**
 * Options for one timeout-guarded invocation.
 *
 * @param timeout the deadline, measured from subscription
 * @param name operation name used in the failure, logs and metrics
 * @param onTimeout optional callback fired before the failure is raised
 */
public record TimeoutOptions(Duration timeout, String name, Optional<TimeoutListener> onTimeout) {

    public TimeoutOptions {
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        name = name != null ? name : "unknown";
        onTimeout = onTimeout != null ? onTimeout : Optional.empty();
    }

    public static TimeoutOptions of(Duration timeout, String name) {
        return new TimeoutOptions(timeout, name, Optional.empty());
    }

    public static TimeoutOptions of(Duration timeout, String name, TimeoutListener onTimeout) {
        return new TimeoutOptions(timeout, name, Optional.ofNullable(onTimeout));
    }
}
