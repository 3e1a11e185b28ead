package com.tracecontract.core;

import java.util.ArrayList;
import java.util.List;

/**
 * The sink, settings and activity listeners a bound contract emits through. Immutable; changes
 * produce a new runtime.
 *
 * @param sink      destination of records
 * @param settings  enablement and minimum level
 * @param listeners activity observers, notified in order
 */
public record TraceRuntime(LogSink sink, TraceSettings settings, List<ActivityListener> listeners) {

    public TraceRuntime {
        if (sink == null) {
            throw new IllegalArgumentException("sink must not be null");
        }
        if (settings == null) {
            settings = TraceSettings.defaults();
        }
        listeners = listeners == null ? List.of() : List.copyOf(listeners);
    }

    /**
     * Creates a runtime emitting to {@code sink} with default settings and no listeners.
     */
    public static TraceRuntime of(LogSink sink) {
        return new TraceRuntime(sink, TraceSettings.defaults(), List.of());
    }

    /**
     * Creates the runtime described by {@code settings}: an {@link Slf4jLogSink} when enabled,
     * {@link LogSink#NOOP} otherwise.
     */
    public static TraceRuntime fromSettings(TraceSettings settings) {
        LogSink sink = settings.enabled() ? new Slf4jLogSink() : LogSink.NOOP;
        return new TraceRuntime(sink, settings, List.of());
    }

    public TraceRuntime withSink(LogSink newSink) {
        return new TraceRuntime(newSink, settings, listeners);
    }

    public TraceRuntime withSettings(TraceSettings newSettings) {
        return new TraceRuntime(sink, newSettings, listeners);
    }

    public TraceRuntime withListener(ActivityListener listener) {
        if (listener == null) {
            throw new IllegalArgumentException("listener must not be null");
        }
        List<ActivityListener> updated = new ArrayList<>(listeners);
        updated.add(listener);
        return new TraceRuntime(sink, settings, updated);
    }

    /**
     * Returns true if a record of {@code level} from {@code loggerName} would be emitted.
     */
    public boolean isEnabled(String loggerName, LogLevel level) {
        return settings.accepts(level) && sink.isEnabled(loggerName, level);
    }
}
