package radar.core.model.resilience;

import java.time.Duration;

/**
 * How often and how patiently an upstream's health should be probed.
 *
 * @param interval time between probes
 * @param timeout deadline for a single probe
 * @param retries probe retries before the upstream is reported down
 */
public record HealthCheckSettings(Duration interval, Duration timeout, int retries) {

    public static HealthCheckSettings defaults() {
        return new HealthCheckSettings(Duration.ofSeconds(30), Duration.ofSeconds(5), 2);
    }
}
