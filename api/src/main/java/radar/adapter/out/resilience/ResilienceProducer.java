package radar.adapter.out.resilience;

import java.time.Clock;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.propagation.TextMapPropagator;
import io.quarkus.arc.DefaultBean;

/**
 * Produces the infrastructure beans the resilience services and the outbound transport depend on.
 *
 * <p>Every bean is a {@link DefaultBean}: the Micrometer and OpenTelemetry extensions
 * replace the registry, tracer and propagator whenever they are active.
 */
@ApplicationScoped
public class ResilienceProducer {

    /**
     * System UTC clock driving breaker cooldowns, rate limit windows and retry timing.
     *
     * @return the system clock
     */
    @Produces
    @Singleton
    @DefaultBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * In-memory registry so resilience metrics still record when no exporter is configured.
     */
    @Produces
    @Singleton
    @DefaultBean
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    // Transport spans become no-ops while the OpenTelemetry SDK is disabled
    @Produces
    @Singleton
    @DefaultBean
    public Tracer tracer() {
        return OpenTelemetry.noop().getTracer("radar-outbound");
    }

    @Produces
    @Singleton
    @DefaultBean
    public TextMapPropagator textMapPropagator() {
        return OpenTelemetry.noop().getPropagators().getTextMapPropagator();
    }
}
