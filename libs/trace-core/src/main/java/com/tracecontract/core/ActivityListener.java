package com.tracecontract.core;

import java.time.Duration;

/**
 * Observes the lifecycle of activities, e.g. to mirror them as tracing spans or timers.
 * <p>
 * {@link #onStart(ActivityInfo)} is called once per activity before its start record is emitted;
 * the returned {@link Scope} is ended exactly once when the activity closes.
 */
@FunctionalInterface
public interface ActivityListener {

    Scope onStart(ActivityInfo activity);

    /**
     * Per-activity handle returned by a listener.
     */
    @FunctionalInterface
    interface Scope {

        void end(Duration elapsed);
    }
}
