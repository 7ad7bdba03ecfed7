package gatehouse.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for telemetry.
 *
 * <p>Configuration prefix: {@code gatehouse.telemetry}
 */
@ConfigMapping(prefix = "gatehouse.telemetry")
public interface TelemetryConfigMapping {

    /**
     * Metrics configuration.
     */
    MetricsConfig metrics();

    interface MetricsConfig {

        /**
         * Record login and profile counters.
         *
         * @return true if enabled (default: true)
         */
        @WithDefault("true")
        boolean enabled();
    }
}
