package com.tracecontract.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link Activity}: start/end records, duration formatting and idempotent close.
 */
@DisplayName("Activity")
class ActivityTest {

    private final List<FormattedRecord> emitted = new ArrayList<>();
    private final AtomicLong nanos = new AtomicLong(1_000_000L);

    private Activity startActivity(List<ActivityListener.Scope> scopes) {
        return Activity.start("Loading data.csv", Map.of("file", "data.csv"), LogLevel.INFO,
                emitted::add, nanos::get, scopes);
    }

    private void advance(Duration duration) {
        nanos.addAndGet(duration.toNanos());
    }

    @Nested
    @DisplayName("Duration formatting")
    class DurationFormatting {

        @Test
        @DisplayName("should format 500 ms as 0.500")
        void shouldFormatSubSecond() {
            assertThat(Activity.formatElapsed(Duration.ofMillis(500))).isEqualTo("0.500");
        }

        @Test
        @DisplayName("should format 61 500 ms as 1:01.500")
        void shouldFormatOverOneMinute() {
            assertThat(Activity.formatElapsed(Duration.ofMillis(61_500))).isEqualTo("1:01.500");
        }

        @Test
        @DisplayName("should switch format exactly at one minute")
        void shouldSwitchAtOneMinute() {
            assertThat(Activity.formatElapsed(Duration.ofMillis(59_999))).isEqualTo("59.999");
            assertThat(Activity.formatElapsed(Duration.ofMillis(60_000))).isEqualTo("1:00.000");
        }

        @Test
        @DisplayName("should keep counting minutes past one hour")
        void shouldNotWrapHours() {
            assertThat(Activity.formatElapsed(Duration.ofMinutes(75).plusMillis(5))).isEqualTo("75:00.005");
        }

        @Test
        @DisplayName("should truncate sub-millisecond precision")
        void shouldTruncateNanos() {
            assertThat(Activity.formatElapsed(Duration.ofNanos(12_345_678))).isEqualTo("0.012");
        }
    }

    @Nested
    @DisplayName("Lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("should emit the start record immediately")
        void shouldEmitStartRecord() {
            Activity activity = startActivity(List.of());

            assertThat(emitted).hasSize(1);
            FormattedRecord start = emitted.get(0);
            assertThat(start.message()).isEqualTo("Loading data.csv [+]");
            assertThat(start.level()).isEqualTo(LogLevel.INFO);
            assertThat(start.context()).containsEntry("file", "data.csv");
            assertThat(activity.isClosed()).isFalse();
        }

        @Test
        @DisplayName("should emit the elapsed time on close with the same context and level")
        void shouldEmitEndRecord() {
            Activity activity = startActivity(List.of());
            advance(Duration.ofMillis(500));

            activity.close();

            assertThat(emitted).hasSize(2);
            FormattedRecord end = emitted.get(1);
            assertThat(end.message()).isEqualTo("Loading data.csv [0.500]");
            assertThat(end.level()).isEqualTo(LogLevel.INFO);
            assertThat(end.context()).isEqualTo(emitted.get(0).context());
            assertThat(activity.isClosed()).isTrue();
        }

        @Test
        @DisplayName("should emit exactly one closing record when closed twice")
        void shouldIgnoreSecondClose() {
            Activity activity = startActivity(List.of());
            advance(Duration.ofMillis(61_500));

            activity.close();
            activity.close();

            assertThat(emitted).extracting(FormattedRecord::message)
                    .containsExactly("Loading data.csv [+]", "Loading data.csv [1:01.500]");
        }

        @Test
        @DisplayName("should close on the exception path of try-with-resources")
        void shouldCloseWhenScopeThrows() {
            assertThatThrownBy(() -> {
                try (Activity ignored = startActivity(List.of())) {
                    advance(Duration.ofMillis(20));
                    throw new IllegalStateException("work failed");
                }
            }).isInstanceOf(IllegalStateException.class);

            assertThat(emitted).extracting(FormattedRecord::message)
                    .containsExactly("Loading data.csv [+]", "Loading data.csv [0.020]");
        }

        @Test
        @DisplayName("should end listener scopes once with the elapsed time")
        void shouldEndListenerScopes() {
            List<Duration> ended = new ArrayList<>();
            Activity activity = startActivity(List.of(ended::add));
            advance(Duration.ofMillis(250));

            activity.close();
            activity.close();

            assertThat(ended).containsExactly(Duration.ofMillis(250));
        }

        @Test
        @DisplayName("should end listener scopes even if the closing emission fails")
        void shouldEndScopesWhenEmitterFails() {
            List<Duration> ended = new ArrayList<>();
            List<String> seen = new ArrayList<>();
            Activity activity = Activity.start("Sync", Map.of(), LogLevel.INFO, record -> {
                seen.add(record.message());
                if (record.message().endsWith("]") && !record.message().endsWith("[+]")) {
                    throw new IllegalStateException("sink down");
                }
            }, nanos::get, List.of(ended::add));

            assertThatThrownBy(activity::close).isInstanceOf(IllegalStateException.class);
            assertThat(ended).hasSize(1);
            assertThat(seen).hasSize(2);
        }

        @Test
        @DisplayName("should reject missing arguments")
        void shouldRejectNulls() {
            assertThatThrownBy(() -> Activity.start(null, Map.of(), LogLevel.INFO, emitted::add))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> Activity.start("x", Map.of(), null, emitted::add))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> Activity.start("x", Map.of(), LogLevel.INFO, null))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
