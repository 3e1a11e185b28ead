package com.tracecontract.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("TraceSettings")
class TraceSettingsTest {

    @Nested
    @DisplayName("Defaults")
    class Defaults {

        @Test
        @DisplayName("should be enabled at DEBUG")
        void shouldBeEnabledAtDebug() {
            TraceSettings settings = TraceSettings.defaults();

            assertThat(settings.enabled()).isTrue();
            assertThat(settings.minimumLevel()).isEqualTo(LogLevel.DEBUG);
        }

        @Test
        @DisplayName("should default a null minimum level to DEBUG")
        void shouldDefaultNullLevel() {
            assertThat(new TraceSettings(true, null).minimumLevel()).isEqualTo(LogLevel.DEBUG);
        }

        @Test
        @DisplayName("disabled settings should accept nothing")
        void disabledShouldAcceptNothing() {
            TraceSettings settings = TraceSettings.disabled();

            for (LogLevel level : LogLevel.values()) {
                assertThat(settings.accepts(level)).as(level.name()).isFalse();
            }
        }
    }

    @Nested
    @DisplayName("Accepts")
    class Accepts {

        @Test
        @DisplayName("should accept levels at or above the minimum")
        void shouldApplyMinimum() {
            TraceSettings settings = new TraceSettings(true, LogLevel.WARNING);

            assertThat(settings.accepts(LogLevel.DEBUG)).isFalse();
            assertThat(settings.accepts(LogLevel.INFO)).isFalse();
            assertThat(settings.accepts(LogLevel.WARNING)).isTrue();
            assertThat(settings.accepts(LogLevel.ERROR)).isTrue();
        }

        @Test
        @DisplayName("should never accept NONE")
        void shouldRejectNone() {
            assertThat(TraceSettings.defaults().accepts(LogLevel.NONE)).isFalse();
        }
    }

    @Nested
    @DisplayName("From properties")
    class FromProperties {

        @Test
        @DisplayName("should fall back to defaults for empty properties")
        void shouldUseDefaults() {
            assertThat(TraceSettings.fromProperties(new Properties())).isEqualTo(TraceSettings.defaults());
        }

        @Test
        @DisplayName("should read both keys")
        void shouldReadKeys() {
            Properties properties = new Properties();
            properties.setProperty(TraceSettings.PROPERTY_ENABLED, " FALSE ");
            properties.setProperty(TraceSettings.PROPERTY_MINIMUM_LEVEL, "warn");

            TraceSettings settings = TraceSettings.fromProperties(properties);

            assertThat(settings.enabled()).isFalse();
            assertThat(settings.minimumLevel()).isEqualTo(LogLevel.WARNING);
        }

        @Test
        @DisplayName("should reject a non-boolean enabled flag")
        void shouldRejectInvalidBoolean() {
            Properties properties = new Properties();
            properties.setProperty(TraceSettings.PROPERTY_ENABLED, "yes");

            assertThatThrownBy(() -> TraceSettings.fromProperties(properties))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining(TraceSettings.PROPERTY_ENABLED)
                    .hasMessageContaining("yes");
        }

        @Test
        @DisplayName("should reject an unknown level")
        void shouldRejectInvalidLevel() {
            Properties properties = new Properties();
            properties.setProperty(TraceSettings.PROPERTY_MINIMUM_LEVEL, "verbose");

            assertThatThrownBy(() -> TraceSettings.fromProperties(properties))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("should reject null properties")
        void shouldRejectNull() {
            assertThatThrownBy(() -> TraceSettings.fromProperties(null))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("Load")
    class Load {

        @Test
        @DisplayName("should read the classpath resource")
        void shouldReadResource() {
            TraceSettings settings = TraceSettings.load();

            assertThat(settings.enabled()).isTrue();
            assertThat(settings.minimumLevel()).isEqualTo(LogLevel.INFO);
        }

        @Test
        @DisplayName("should let system properties override the resource")
        void shouldPreferSystemProperties() {
            System.setProperty(TraceSettings.PROPERTY_MINIMUM_LEVEL, "ERROR");
            try {
                assertThat(TraceSettings.load().minimumLevel()).isEqualTo(LogLevel.ERROR);
            } finally {
                System.clearProperty(TraceSettings.PROPERTY_MINIMUM_LEVEL);
            }
        }
    }
}
