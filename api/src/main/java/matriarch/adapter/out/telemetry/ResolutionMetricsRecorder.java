package matriarch.adapter.out.telemetry;

import java.util.Locale;
import java.util.concurrent.TimeUnit;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import matriarch.core.model.cache.RecordKind;
import matriarch.core.port.out.ResolutionMetrics;

/**
 * Micrometer metrics for identity resolution.
 *
 * <p>Records metrics for:
 * <ul>
 *   <li>{@code matriarch.directory.calls} - Directory call attempts by operation and outcome</li>
 *   <li>{@code matriarch.directory.retries} - Retries by operation</li>
 *   <li>{@code matriarch.cache.hits} - Cache hits by record kind</li>
 *   <li>{@code matriarch.cache.misses} - Cache misses by record kind</li>
 *   <li>{@code matriarch.resolution.duration} - Resolution latency by outcome</li>
 *   <li>{@code matriarch.resolution.partial} - Resolutions with an incomplete group closure</li>
 * </ul>
 */
@ApplicationScoped
public class ResolutionMetricsRecorder implements ResolutionMetrics {

    private final MeterRegistry registry;
    private final boolean enabled;

    @Inject
    public ResolutionMetricsRecorder(MeterRegistry registry, TelemetryConfig config) {
        this.registry = registry;
        this.enabled = config != null && config.metrics().enabled();
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public void recordDirectoryCall(String operation, String outcome) {
        if (!enabled) {
            return;
        }

        Counter.builder("matriarch.directory.calls")
                .description("Directory call attempts")
                .tag("operation", nullSafe(operation))
                .tag("outcome", nullSafe(outcome))
                .register(registry)
                .increment();
    }

    @Override
    public void recordRetry(String operation) {
        if (!enabled) {
            return;
        }

        Counter.builder("matriarch.directory.retries")
                .description("Directory call retries after transient failures")
                .tag("operation", nullSafe(operation))
                .register(registry)
                .increment();
    }

    @Override
    public void recordCacheHit(RecordKind kind) {
        if (!enabled) {
            return;
        }

        Counter.builder("matriarch.cache.hits")
                .description("Directory cache hits")
                .tag("kind", kind.name().toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
    }

    @Override
    public void recordCacheMiss(RecordKind kind) {
        if (!enabled) {
            return;
        }

        Counter.builder("matriarch.cache.misses")
                .description("Directory cache misses")
                .tag("kind", kind.name().toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
    }

    @Override
    public void recordResolution(String outcome, long durationMs) {
        if (!enabled) {
            return;
        }

        Timer.builder("matriarch.resolution.duration")
                .description("Identity resolution latency")
                .tag("outcome", nullSafe(outcome))
                .publishPercentiles(0.5, 0.9, 0.95, 0.99)
                .register(registry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    @Override
    public void recordPartialResolution() {
        if (!enabled) {
            return;
        }

        Counter.builder("matriarch.resolution.partial")
                .description("Resolutions completed with an incomplete group closure")
                .register(registry)
                .increment();
    }

    private String nullSafe(String value) {
        return value != null ? value : "unknown";
    }
}
