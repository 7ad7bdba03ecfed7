package gatehouse.adapter.out.telemetry;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

import gatehouse.config.TelemetryConfigMapping;
import gatehouse.core.port.out.LoginMetrics;

/**
 * Records login metrics using Micrometer.
 *
 * <p>All methods are no-ops when metrics are disabled, so callers never
 * check configuration themselves.
 *
 * <p>Metrics recorded:
 * <ul>
 *   <li>{@code gatehouse.login.attempts} - Login attempts by method</li>
 *   <li>{@code gatehouse.login.outcomes} - Terminal outcomes by method and outcome</li>
 *   <li>{@code gatehouse.profiles.created} - Profiles created on first login</li>
 *   <li>{@code gatehouse.profiles.conflicts} - Concurrent first-login inserts recovered by re-read</li>
 * </ul>
 */
@ApplicationScoped
public class MicrometerLoginMetrics implements LoginMetrics {

    private final MeterRegistry registry;
    private final boolean enabled;

    @Inject
    public MicrometerLoginMetrics(MeterRegistry registry, TelemetryConfigMapping config) {
        this.registry = registry;
        this.enabled = config != null && config.metrics().enabled();
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public void recordAttempt(String method) {
        if (!enabled) {
            return;
        }
        Counter.builder("gatehouse.login.attempts")
                .description("Login attempts started")
                .tag("method", method)
                .register(registry)
                .increment();
    }

    @Override
    public void recordOutcome(String method, String outcome) {
        if (!enabled) {
            return;
        }
        Counter.builder("gatehouse.login.outcomes")
                .description("Login attempts by terminal outcome")
                .tag("method", method)
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    @Override
    public void recordProfileCreated() {
        if (!enabled) {
            return;
        }
        Counter.builder("gatehouse.profiles.created")
                .description("Profiles created on first login")
                .register(registry)
                .increment();
    }

    @Override
    public void recordProfileConflict() {
        if (!enabled) {
            return;
        }
        Counter.builder("gatehouse.profiles.conflicts")
                .description("Concurrent profile inserts recovered by re-reading")
                .register(registry)
                .increment();
    }
}
