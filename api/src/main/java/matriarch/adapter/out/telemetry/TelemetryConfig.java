package matriarch.adapter.out.telemetry;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration for telemetry.
 *
 * <p>Example configuration:
 * <pre>{@code
 * matriarch.telemetry.metrics.enabled=true
 * }</pre>
 */
@ConfigMapping(prefix = "matriarch.telemetry")
public interface TelemetryConfig {

    /**
     * Metrics configuration for Micrometer metrics collection.
     */
    MetricsConfig metrics();

    /**
     * Metrics configuration.
     */
    interface MetricsConfig {
        /**
         * Enable metrics collection with Micrometer.
         */
        @WithDefault("true")
        boolean enabled();
    }
}
