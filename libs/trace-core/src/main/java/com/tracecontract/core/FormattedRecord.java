package com.tracecontract.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A log record ready to be handed to a {@link LogSink}.
 *
 * @param message   the rendered message
 * @param context   structured key/value fields in insertion order (values may be null)
 * @param level     severity of the record
 * @param exception the attached exception, or null
 */
public record FormattedRecord(String message, Map<String, Object> context, LogLevel level, Throwable exception) {

    public FormattedRecord {
        if (message == null) {
            throw new IllegalArgumentException("message must not be null");
        }
        if (level == null) {
            throw new IllegalArgumentException("level must not be null");
        }
        context = context == null || context.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(context));
    }

    /**
     * Creates a record without exception.
     */
    public static FormattedRecord of(String message, Map<String, Object> context, LogLevel level) {
        return new FormattedRecord(message, context, level, null);
    }

    public boolean hasException() {
        return exception != null;
    }
}
