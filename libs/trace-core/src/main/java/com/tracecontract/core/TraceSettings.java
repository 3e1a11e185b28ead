package com.tracecontract.core;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Locale;
import java.util.Properties;

/**
 * Process-wide trace configuration.
 * <p>
 * Loaded by {@link #load()} from the classpath resource {@value #RESOURCE}, with system
 * properties taking precedence:
 *
 * <pre>
 * tracecontract.enabled=true
 * tracecontract.minimum-level=INFO
 * </pre>
 *
 * @param enabled      false to discard every record
 * @param minimumLevel records below this level are neither formatted nor emitted
 */
public record TraceSettings(boolean enabled, LogLevel minimumLevel) {

    /** Classpath resource read by {@link #load()}. */
    public static final String RESOURCE = "tracecontract.properties";

    /** Property enabling or disabling emission. */
    public static final String PROPERTY_ENABLED = "tracecontract.enabled";

    /** Property holding the minimum emitted level. */
    public static final String PROPERTY_MINIMUM_LEVEL = "tracecontract.minimum-level";

    /**
     * Compact constructor: defaults the minimum level to {@link LogLevel#DEBUG}.
     */
    public TraceSettings {
        if (minimumLevel == null) {
            minimumLevel = LogLevel.DEBUG;
        }
    }

    /**
     * Returns enabled settings with minimum level {@link LogLevel#DEBUG}.
     */
    public static TraceSettings defaults() {
        return new TraceSettings(true, LogLevel.DEBUG);
    }

    /**
     * Returns disabled settings.
     */
    public static TraceSettings disabled() {
        return new TraceSettings(false, LogLevel.DEBUG);
    }

    /**
     * Loads settings from {@value #RESOURCE} (if present on the context class loader) overridden
     * by system properties.
     *
     * @throws IllegalArgumentException if a property holds an invalid value
     * @throws UncheckedIOException     if the resource exists but cannot be read
     */
    public static TraceSettings load() {
        Properties properties = new Properties();
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        if (loader == null) {
            loader = TraceSettings.class.getClassLoader();
        }
        try (InputStream in = loader.getResourceAsStream(RESOURCE)) {
            if (in != null) {
                properties.load(in);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + RESOURCE, e);
        }
        copyIfSet(System.getProperties(), properties, PROPERTY_ENABLED);
        copyIfSet(System.getProperties(), properties, PROPERTY_MINIMUM_LEVEL);
        return fromProperties(properties);
    }

    /**
     * Builds settings from properties; absent keys take the defaults.
     *
     * @throws IllegalArgumentException if a property holds an invalid value
     */
    public static TraceSettings fromProperties(Properties properties) {
        if (properties == null) {
            throw new IllegalArgumentException("properties must not be null");
        }
        String enabled = properties.getProperty(PROPERTY_ENABLED);
        String minimumLevel = properties.getProperty(PROPERTY_MINIMUM_LEVEL);
        return new TraceSettings(
                enabled == null || parseBoolean(PROPERTY_ENABLED, enabled),
                minimumLevel == null ? null : LogLevel.parse(minimumLevel));
    }

    /**
     * Returns true if records of {@code level} pass these settings.
     */
    public boolean accepts(LogLevel level) {
        return enabled && level != LogLevel.NONE && level.isAtLeast(minimumLevel);
    }

    private static boolean parseBoolean(String key, String value) {
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "true" -> true;
            case "false" -> false;
            default -> throw new IllegalArgumentException(
                    "Property %s must be 'true' or 'false' but was '%s'".formatted(key, value));
        };
    }

    private static void copyIfSet(Properties from, Properties to, String key) {
        String value = from.getProperty(key);
        if (value != null) {
            to.setProperty(key, value);
        }
    }
}
