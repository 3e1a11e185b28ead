package com.tracecontract.core;

import org.slf4j.ILoggerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;
import org.slf4j.spi.LoggingEventBuilder;

import java.util.Map;
import java.util.Optional;

/**
 * {@link LogSink} backed by SLF4J. The owner name selects the SLF4J logger; context entries are
 * attached as key/value pairs through the fluent logging API, so backends that support
 * structured arguments (e.g. Logback encoders) receive them as fields.
 */
public final class Slf4jLogSink implements LogSink {

    private final ILoggerFactory loggerFactory;

    /**
     * Creates a sink using the SLF4J provider found on the classpath.
     */
    public Slf4jLogSink() {
        this(LoggerFactory.getILoggerFactory());
    }

    public Slf4jLogSink(ILoggerFactory loggerFactory) {
        if (loggerFactory == null) {
            throw new IllegalArgumentException("loggerFactory must not be null");
        }
        this.loggerFactory = loggerFactory;
    }

    /**
     * Maps a trace level onto SLF4J. {@link LogLevel#NONE} has no SLF4J counterpart and maps to
     * empty, meaning "off".
     *
     * @param level the trace level
     * @return the SLF4J level, or empty for {@link LogLevel#NONE}
     */
    public static Optional<Level> toExternalLevel(LogLevel level) {
        if (level == null) {
            throw new IllegalArgumentException("level must not be null");
        }
        return switch (level) {
            case NONE -> Optional.empty();
            case DEBUG -> Optional.of(Level.DEBUG);
            case INFO -> Optional.of(Level.INFO);
            case WARNING -> Optional.of(Level.WARN);
            case ERROR -> Optional.of(Level.ERROR);
        };
    }

    @Override
    public boolean isEnabled(String loggerName, LogLevel level) {
        return toExternalLevel(level)
                .map(external -> logger(loggerName).isEnabledForLevel(external))
                .orElse(false);
    }

    @Override
    public void emit(String loggerName, LogLevel level, String message,
                     Map<String, Object> context, Throwable exception) {
        Optional<Level> external = toExternalLevel(level);
        if (external.isEmpty()) {
            return;
        }

        LoggingEventBuilder event = logger(loggerName).atLevel(external.get()).setMessage(message);
        if (exception != null) {
            event = event.setCause(exception);
        }
        if (context != null) {
            for (Map.Entry<String, Object> entry : context.entrySet()) {
                event = event.addKeyValue(entry.getKey(), entry.getValue());
            }
        }
        event.log();
    }

    private Logger logger(String loggerName) {
        return loggerFactory.getLogger(loggerName);
    }

    @Override
    public String toString() {
        return "Slf4jLogSink[" + loggerFactory.getClass().getName() + "]";
    }
}
