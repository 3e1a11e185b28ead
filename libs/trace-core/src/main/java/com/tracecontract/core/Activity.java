package com.tracecontract.core;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.function.LongSupplier;

/**
 * A timed activity. Emits {@code "<name> [+]"} when started and {@code "<name> [<duration>]"}
 * when closed, both with the same level and context.
 * <p>
 * Use with try-with-resources so the closing record is emitted on every exit path:
 *
 * <pre>{@code
 * try (Activity ignored = trace.loadingCatalog(catalogId)) {
 *     load(catalogId);
 * }
 * }</pre>
 *
 * Closing more than once is a no-op.
 */
public final class Activity implements AutoCloseable {

    private static final long MILLIS_PER_MINUTE = 60_000L;

    private final String name;
    private final LogLevel level;
    private final Map<String, Object> context;
    private final Consumer<FormattedRecord> emitter;
    private final LongSupplier nanoClock;
    private final List<ActivityListener.Scope> scopes;
    private final long startNanos;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private Activity(String name, Map<String, Object> context, LogLevel level,
                     Consumer<FormattedRecord> emitter, LongSupplier nanoClock,
                     List<ActivityListener.Scope> scopes) {
        this.name = name;
        this.level = level;
        this.context = context == null ? Map.of() : context;
        this.emitter = emitter;
        this.nanoClock = nanoClock;
        this.scopes = List.copyOf(scopes);
        this.startNanos = nanoClock.getAsLong();
    }

    /**
     * Starts an activity and emits its start record through {@code emitter}.
     *
     * @param name    activity name, the prefix of both records
     * @param context structured context attached to both records
     * @param level   level of both records
     * @param emitter destination of the records
     * @return the running activity
     */
    public static Activity start(String name, Map<String, Object> context, LogLevel level,
                                 Consumer<FormattedRecord> emitter) {
        return start(name, context, level, emitter, System::nanoTime, List.of());
    }

    static Activity start(String name, Map<String, Object> context, LogLevel level,
                          Consumer<FormattedRecord> emitter, LongSupplier nanoClock,
                          List<ActivityListener.Scope> scopes) {
        if (name == null) {
            throw new IllegalArgumentException("name must not be null");
        }
        if (level == null) {
            throw new IllegalArgumentException("level must not be null");
        }
        if (emitter == null) {
            throw new IllegalArgumentException("emitter must not be null");
        }
        Activity activity = new Activity(name, context, level, emitter, nanoClock, scopes);
        emitter.accept(FormattedRecord.of(name + " [+]", activity.context, level));
        return activity;
    }

    /**
     * Emits the closing record with the elapsed time and ends listener scopes. Only the first
     * call has an effect.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        Duration elapsed = Duration.ofNanos(nanoClock.getAsLong() - startNanos);
        try {
            emitter.accept(FormattedRecord.of(name + " [" + formatElapsed(elapsed) + "]", context, level));
        } finally {
            for (ActivityListener.Scope scope : scopes) {
                scope.end(elapsed);
            }
        }
    }

    public String name() {
        return name;
    }

    public LogLevel level() {
        return level;
    }

    public Map<String, Object> context() {
        return context;
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Formats an elapsed time as {@code s.fff} below one minute and {@code m:ss.fff} from one
     * minute on. Minutes are not wrapped into hours.
     *
     * @param elapsed non-negative duration
     * @return e.g. {@code 0.500} or {@code 1:01.500}
     */
    public static String formatElapsed(Duration elapsed) {
        long millis = Math.max(0, elapsed.toMillis());
        if (millis < MILLIS_PER_MINUTE) {
            return String.format(Locale.ROOT, "%d.%03d", millis / 1000, millis % 1000);
        }
        return String.format(Locale.ROOT, "%d:%02d.%03d",
                millis / MILLIS_PER_MINUTE, (millis / 1000) % 60, millis % 1000);
    }

    @Override
    public String toString() {
        return "Activity[" + name + ", " + level + (closed.get() ? ", closed" : "") + "]";
    }
}
