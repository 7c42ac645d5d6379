package gatekeeper.adapter.out.telemetry;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Default;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.api.trace.propagation.W3CTraceContextPropagator;
import io.opentelemetry.context.propagation.TextMapPropagator;
import io.quarkus.arc.DefaultBean;

/**
 * Provides fallback telemetry beans when the Quarkus OpenTelemetry and Micrometer
 * extensions don't provide their own (e.g., when telemetry is disabled).
 */
@ApplicationScoped
public class TelemetryFallbackProducer {

    @Produces
    @Singleton
    @DefaultBean
    @Default
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    @Produces
    @Singleton
    @DefaultBean
    @Default
    public Tracer tracer() {
        return OpenTelemetry.noop().getTracer("gatekeeper-noop");
    }

    /**
     * Propagator for outgoing backend requests.
     *
     * @return the W3C Trace Context propagator
     */
    @Produces
    @Singleton
    @DefaultBean
    @Default
    public TextMapPropagator textMapPropagator() {
        return W3CTraceContextPropagator.getInstance();
    }
}
