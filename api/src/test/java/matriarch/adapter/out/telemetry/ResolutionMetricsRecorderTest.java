package matriarch.adapter.out.telemetry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.util.Locale;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import matriarch.core.model.cache.RecordKind;

@DisplayName("ResolutionMetricsRecorder")
class ResolutionMetricsRecorderTest {

    private SimpleMeterRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
    }

    private static TelemetryConfig telemetry(boolean enabled) {
        var config = mock(TelemetryConfig.class);
        var metrics = mock(TelemetryConfig.MetricsConfig.class);
        when(config.metrics()).thenReturn(metrics);
        when(metrics.enabled()).thenReturn(enabled);
        return config;
    }

    @Nested
    @DisplayName("When enabled")
    class WhenEnabled {

        private ResolutionMetricsRecorder recorder;

        @BeforeEach
        void setUp() {
            recorder = new ResolutionMetricsRecorder(registry, telemetry(true));
        }

        @Test
        @DisplayName("should count directory calls by operation and outcome")
        void shouldCountDirectoryCalls() {
            recorder.recordDirectoryCall("getGroupParents", "success");
            recorder.recordDirectoryCall("getGroupParents", "success");
            recorder.recordDirectoryCall("getGroupParents", "transient");

            var success = registry.find("matriarch.directory.calls")
                    .tag("operation", "getGroupParents")
                    .tag("outcome", "success")
                    .counter();
            var transientCalls = registry.find("matriarch.directory.calls")
                    .tag("outcome", "transient")
                    .counter();
            assertEquals(2.0, success.count());
            assertEquals(1.0, transientCalls.count());
        }

        @Test
        @DisplayName("should tag retries by operation")
        void shouldCountRetries() {
            recorder.recordRetry("findPrincipal");

            var counter = registry.find("matriarch.directory.retries")
                    .tag("operation", "findPrincipal")
                    .counter();
            assertEquals(1.0, counter.count());
        }

        @Test
        @DisplayName("should tag cache hits and misses by record kind")
        void shouldCountCacheHitsAndMisses() {
            recorder.recordCacheHit(RecordKind.MEMBERSHIPS);
            recorder.recordCacheMiss(RecordKind.PRINCIPAL);

            assertEquals(1.0, registry.find("matriarch.cache.hits").tag("kind", "memberships").counter().count());
            assertEquals(1.0, registry.find("matriarch.cache.misses").tag("kind", "principal").counter().count());
        }

        @Test
        @DisplayName("should keep record kind tags stable under a Turkish default locale")
        void shouldTagKindsIndependentlyOfLocale() {
            var previous = Locale.getDefault();
            Locale.setDefault(Locale.forLanguageTag("tr-TR"));
            try {
                recorder.recordCacheMiss(RecordKind.PRINCIPAL);
            } finally {
                Locale.setDefault(previous);
            }

            assertNotNull(registry.find("matriarch.cache.misses").tag("kind", "principal").counter());
        }

        @Test
        @DisplayName("should time resolutions by outcome")
        void shouldTimeResolutions() {
            recorder.recordResolution("success", 40);
            recorder.recordResolution("success", 60);

            var timer = registry.find("matriarch.resolution.duration").tag("outcome", "success").timer();
            assertNotNull(timer);
            assertEquals(2, timer.count());
        }

        @Test
        @DisplayName("should count partial resolutions")
        void shouldCountPartialResolutions() {
            recorder.recordPartialResolution();

            assertEquals(1.0, registry.find("matriarch.resolution.partial").counter().count());
        }

        @Test
        @DisplayName("should replace a null tag value with unknown")
        void shouldReplaceNullTags() {
            recorder.recordDirectoryCall(null, "error");

            assertNotNull(registry.find("matriarch.directory.calls").tag("operation", "unknown").counter());
        }
    }

    @Nested
    @DisplayName("When disabled")
    class WhenDisabled {

        @Test
        @DisplayName("should register no meters")
        void shouldRegisterNothing() {
            var recorder = new ResolutionMetricsRecorder(registry, telemetry(false));

            recorder.recordDirectoryCall("findPrincipal", "success");
            recorder.recordRetry("findPrincipal");
            recorder.recordCacheHit(RecordKind.PRINCIPAL);
            recorder.recordResolution("success", 10);
            recorder.recordPartialResolution();

            assertFalse(recorder.isEnabled());
            assertTrue(registry.getMeters().isEmpty());
        }

        @Test
        @DisplayName("should treat a missing configuration as disabled")
        void shouldTreatMissingConfigAsDisabled() {
            var recorder = new ResolutionMetricsRecorder(registry, null);

            recorder.recordPartialResolution();

            assertFalse(recorder.isEnabled());
            assertNull(registry.find("matriarch.resolution.partial").counter());
        }
    }
}
