package com.tracecontract.telemetry;

import com.tracecontract.core.ActivityInfo;
import com.tracecontract.core.ActivityListener;
import com.tracecontract.core.ContractRegistry;
import com.tracecontract.core.LogLevel;
import com.tracecontract.core.TraceRuntime;
import com.tracecontract.core.testing.InMemoryLogSink;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link MicrometerActivityListener}: timer naming, tags and recorded durations.
 */
@DisplayName("MicrometerActivityListener")
class MicrometerActivityListenerTest {

    private SimpleMeterRegistry registry;
    private MicrometerActivityListener listener;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        listener = new MicrometerActivityListener(registry);
    }

    @Nested
    @DisplayName("Construction")
    class Construction {

        @Test
        @DisplayName("should reject null registry")
        void shouldRejectNullRegistry() {
            assertThatThrownBy(() -> new MicrometerActivityListener(null))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("registry");
        }

        @Test
        @DisplayName("should expose underlying registry")
        void shouldExposeRegistry() {
            assertThat(listener.registry()).isSameAs(registry);
        }
    }

    @Nested
    @DisplayName("Recording")
    class Recording {

        @Test
        @DisplayName("should record the elapsed time with operation, owner and level tags")
        void shouldRecordElapsed() {
            ActivityInfo info = new ActivityInfo("com.acme.Importer", "importing", "Importing b-1",
                    LogLevel.INFO, Map.of());

            ActivityListener.Scope scope = listener.onStart(info);
            scope.end(Duration.ofMillis(250));

            Timer timer = registry.find(MicrometerActivityListener.METRIC_NAME)
                    .tag(MicrometerActivityListener.TAG_OPERATION, "importing")
                    .tag(MicrometerActivityListener.TAG_OWNER, "com.acme.Importer")
                    .tag(MicrometerActivityListener.TAG_LEVEL, "INFO")
                    .timer();
            assertThat(timer).isNotNull();
            assertThat(timer.count()).isEqualTo(1);
            assertThat(timer.totalTime(TimeUnit.MILLISECONDS)).isEqualTo(250.0);
        }

        @Test
        @DisplayName("should share one timer per operation and owner")
        void shouldShareTimer() {
            ActivityInfo info = new ActivityInfo("owner", "rebuilding", "Rebuilding index a",
                    LogLevel.WARNING, Map.of("index", "a"));

            listener.onStart(info).end(Duration.ofMillis(10));
            listener.onStart(info).end(Duration.ofMillis(30));

            Timer timer = registry.get(MicrometerActivityListener.METRIC_NAME).timer();
            assertThat(timer.count()).isEqualTo(2);
            assertThat(timer.totalTime(TimeUnit.MILLISECONDS)).isEqualTo(40.0);
            assertThat(registry.getMeters()).hasSize(1);
        }

        @Test
        @DisplayName("should time activities of a bound contract")
        void shouldTimeBoundActivities() {
            InMemoryLogSink sink = new InMemoryLogSink();
            TraceRuntime runtime = TraceRuntime.of(sink).withListener(listener);
            ImportTrace trace = new ContractRegistry().getOrCompile(ImportTrace.class)
                    .bind(ImportTrace.class, "com.acme.Importer", () -> runtime);

            trace.rebuilding("users").close();
            trace.rebuilding("orders").close();

            Timer timer = registry.get(MicrometerActivityListener.METRIC_NAME)
                    .tag(MicrometerActivityListener.TAG_OPERATION, "rebuilding")
                    .tag(MicrometerActivityListener.TAG_LEVEL, "WARNING")
                    .timer();
            assertThat(timer.count()).isEqualTo(2);
            assertThat(sink.size()).isEqualTo(4);
        }
    }
}
