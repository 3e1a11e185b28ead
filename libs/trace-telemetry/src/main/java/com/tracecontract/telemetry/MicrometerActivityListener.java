package com.tracecontract.telemetry;

import com.tracecontract.core.ActivityInfo;
import com.tracecontract.core.ActivityListener;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;

/**
 * Records the duration of every trace activity as a Micrometer {@link Timer}.
 * <p>
 * Timers are named {@value #METRIC_NAME} and tagged with the operation, the owner and the level,
 * so one timer exists per distinct operation of each owner.
 */
public final class MicrometerActivityListener implements ActivityListener {

    /** Name of the activity duration timer. */
    public static final String METRIC_NAME = "tracecontract.activity.duration";

    /** Tag key for the operation name. */
    public static final String TAG_OPERATION = "operation";

    /** Tag key for the owner's logger name. */
    public static final String TAG_OWNER = "owner";

    /** Tag key for the activity level. */
    public static final String TAG_LEVEL = "level";

    private final MeterRegistry registry;

    /**
     * @param registry the Micrometer meter registry (e.g., PrometheusMeterRegistry)
     */
    public MicrometerActivityListener(MeterRegistry registry) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        this.registry = registry;
    }

    @Override
    public Scope onStart(ActivityInfo activity) {
        Timer timer = Timer.builder(METRIC_NAME)
                .description("Duration of trace activities")
                .tags(Tags.of(
                        TAG_OPERATION, activity.operationName(),
                        TAG_OWNER, activity.ownerName(),
                        TAG_LEVEL, activity.level().name()))
                .register(registry);
        return elapsed -> timer.record(elapsed);
    }

    /**
     * Returns the underlying meter registry.
     */
    public MeterRegistry registry() {
        return registry;
    }
}
