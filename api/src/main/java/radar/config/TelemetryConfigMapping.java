package radar.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration for telemetry of outbound calls.
 *
 * <p>Telemetry is disabled by default. Example configuration:
 * <pre>{@code
 * radar.telemetry.enabled=true
 * radar.telemetry.tracing.enabled=true
 * radar.telemetry.metrics.enabled=true
 * }</pre>
 */
@ConfigMapping(prefix = "radar.telemetry")
public interface TelemetryConfigMapping {

    /**
     * Master toggle for all telemetry features.
     * When disabled, all sub-features are also disabled regardless of their individual settings.
     */
    @WithDefault("false")
    boolean enabled();

    /**
     * Tracing configuration for distributed tracing with OpenTelemetry.
     */
    TracingConfig tracing();

    /**
     * Metrics configuration for Micrometer metrics collection.
     */
    MetricsConfig metrics();

    /**
     * Tracing configuration.
     */
    interface TracingConfig {
        /**
         * Create client spans for outbound requests and propagate trace context.
         * Requires radar.telemetry.enabled=true to take effect.
         */
        @WithDefault("false")
        boolean enabled();
    }

    /**
     * Metrics configuration.
     */
    interface MetricsConfig {
        /**
         * Enable metrics collection with Micrometer.
         * Requires radar.telemetry.enabled=true to take effect.
         */
        @WithDefault("false")
        boolean enabled();
    }
}
