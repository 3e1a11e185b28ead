package com.tracecontract.core;

import java.util.Map;

/**
 * Destination of formatted records. Implementations map {@link LogLevel} onto their backend's
 * own severities; failures inside a sink propagate to the caller unchanged.
 */
public interface LogSink {

    /** A sink that is never enabled and discards every record. */
    LogSink NOOP = new LogSink() {
        @Override
        public void emit(String loggerName, LogLevel level, String message,
                         Map<String, Object> context, Throwable exception) {
            // discard
        }

        @Override
        public boolean isEnabled(String loggerName, LogLevel level) {
            return false;
        }

        @Override
        public String toString() {
            return "LogSink.NOOP";
        }
    };

    /**
     * Emits one record.
     *
     * @param loggerName owner name of the contract that produced the record
     * @param level      record level
     * @param message    rendered message
     * @param context    structured context, possibly empty
     * @param exception  attached exception, or null
     */
    void emit(String loggerName, LogLevel level, String message, Map<String, Object> context, Throwable exception);

    /**
     * Returns whether records of {@code level} for {@code loggerName} would be kept. Callers use
     * this to skip formatting; {@link LogLevel#NONE} is never enabled.
     */
    default boolean isEnabled(String loggerName, LogLevel level) {
        return level != LogLevel.NONE;
    }

    /**
     * Emits a formatted record.
     */
    default void emit(String loggerName, FormattedRecord record) {
        emit(loggerName, record.level(), record.message(), record.context(), record.exception());
    }
}
