package com.tracecontract.telemetry;

import com.tracecontract.core.ActivityInfo;
import com.tracecontract.core.ActivityListener;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.Tracer;

import java.util.Map;

/**
 * Mirrors trace activities as OpenTelemetry spans.
 * <p>
 * Each activity starts an {@link SpanKind#INTERNAL} span named after the operation that started
 * it. The owner, level and formatted activity name are attached as {@code trace.*} attributes;
 * context entries are attached under their own keys, keeping numeric and boolean values typed.
 * The span is ended when the activity closes.
 * <p>
 * Like other OpenTelemetry helpers this class does not configure the SDK; it only uses the
 * supplied {@link Tracer}.
 */
public final class OpenTelemetryActivityListener implements ActivityListener {

    /** Attribute holding the logger name of the contract owner. */
    public static final AttributeKey<String> OWNER = AttributeKey.stringKey("trace.owner");

    /** Attribute holding the activity level. */
    public static final AttributeKey<String> LEVEL = AttributeKey.stringKey("trace.level");

    /** Attribute holding the formatted activity name. */
    public static final AttributeKey<String> ACTIVITY = AttributeKey.stringKey("trace.activity");

    private final Tracer tracer;

    /**
     * @param tracer the OpenTelemetry tracer (typically obtained from {@code GlobalOpenTelemetry})
     */
    public OpenTelemetryActivityListener(Tracer tracer) {
        if (tracer == null) {
            throw new IllegalArgumentException("tracer must not be null");
        }
        this.tracer = tracer;
    }

    @Override
    public Scope onStart(ActivityInfo activity) {
        Span span = tracer.spanBuilder(activity.operationName())
                .setSpanKind(SpanKind.INTERNAL)
                .setAllAttributes(attributes(activity))
                .startSpan();
        return elapsed -> span.end();
    }

    static Attributes attributes(ActivityInfo activity) {
        AttributesBuilder builder = Attributes.builder()
                .put(OWNER, activity.ownerName())
                .put(LEVEL, activity.level().name())
                .put(ACTIVITY, activity.name());
        for (Map.Entry<String, Object> entry : activity.context().entrySet()) {
            put(builder, entry.getKey(), entry.getValue());
        }
        return builder.build();
    }

    private static void put(AttributesBuilder builder, String key, Object value) {
        if (value instanceof Long || value instanceof Integer || value instanceof Short
                || value instanceof Byte) {
            builder.put(AttributeKey.longKey(key), ((Number) value).longValue());
        } else if (value instanceof Double || value instanceof Float) {
            builder.put(AttributeKey.doubleKey(key), ((Number) value).doubleValue());
        } else if (value instanceof Boolean bool) {
            builder.put(AttributeKey.booleanKey(key), bool);
        } else {
            builder.put(AttributeKey.stringKey(key), String.valueOf(value));
        }
    }

    /**
     * Returns the underlying OTel tracer.
     */
    public Tracer tracer() {
        return tracer;
    }
}
