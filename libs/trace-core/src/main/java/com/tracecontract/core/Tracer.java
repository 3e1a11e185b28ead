package com.tracecontract.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * Entry point: binds trace contracts and holds the process-wide {@link TraceRuntime}.
 * <p>
 * The runtime is created lazily from {@link TraceSettings#load()} on first use. Contracts bound
 * before {@link #init(LogSink)} or {@link #disable()} pick up the change, because every call
 * resolves the current runtime.
 */
public final class Tracer {

    private static final Logger log = LoggerFactory.getLogger(Tracer.class);

    private static final AtomicReference<TraceRuntime> RUNTIME = new AtomicReference<>();

    private Tracer() {
        // Utility class: no instantiation
    }

    /**
     * Returns an implementation of {@code contractType} whose records are emitted under the
     * owner class's binary name.
     *
     * @param contractType interface extending {@link TraceContract}
     * @param owner        class whose name is used as logger name
     * @param <T>          contract type
     * @throws TraceException if the contract is invalid
     */
    public static <T extends TraceContract> T bind(Class<T> contractType, Class<?> owner) {
        if (owner == null) {
            throw new IllegalArgumentException("owner must not be null");
        }
        return bind(contractType, owner.getName());
    }

    /**
     * Returns an implementation of {@code contractType} whose records are emitted under
     * {@code ownerName}.
     *
     * @throws TraceException if the contract is invalid
     */
    public static <T extends TraceContract> T bind(Class<T> contractType, String ownerName) {
        return ContractRegistry.global()
                .getOrCompile(contractType)
                .bind(contractType, ownerName, Tracer::runtime);
    }

    /**
     * Binds an explicitly declared contract.
     *
     * @throws TraceException if the contract is invalid
     */
    public static BoundContract bind(ContractSpec spec, String ownerName) {
        return ContractRegistry.global()
                .getOrCompile(spec)
                .bind(ownerName, Tracer::runtime);
    }

    /**
     * Replaces the sink used by every bound contract.
     */
    public static void init(LogSink sink) {
        if (sink == null) {
            throw new IllegalArgumentException("sink must not be null");
        }
        update(runtime -> runtime.withSink(sink));
        log.info("Trace sink set to {}", sink);
    }

    /**
     * Discards every record from now on. Activity listeners stay registered.
     */
    public static void disable() {
        update(runtime -> runtime.withSink(LogSink.NOOP));
        log.info("Trace output disabled");
    }

    /**
     * Applies new settings. A disabled configuration also installs {@link LogSink#NOOP}.
     */
    public static void configure(TraceSettings settings) {
        if (settings == null) {
            throw new IllegalArgumentException("settings must not be null");
        }
        update(runtime -> settings.enabled()
                ? runtime.withSettings(settings)
                : runtime.withSettings(settings).withSink(LogSink.NOOP));
        log.info("Trace settings applied: enabled={}, minimumLevel={}", settings.enabled(), settings.minimumLevel());
    }

    /**
     * Registers a listener notified of every activity started from now on.
     */
    public static void addActivityListener(ActivityListener listener) {
        update(runtime -> runtime.withListener(listener));
    }

    /**
     * Returns the current runtime, creating it from {@link TraceSettings#load()} if needed.
     */
    public static TraceRuntime runtime() {
        TraceRuntime current = RUNTIME.get();
        if (current != null) {
            return current;
        }
        return RUNTIME.updateAndGet(existing -> existing != null
                ? existing
                : TraceRuntime.fromSettings(TraceSettings.load()));
    }

    /**
     * Drops the current runtime so the next call reloads it from settings. Intended for tests.
     */
    public static void reset() {
        RUNTIME.set(null);
    }

    private static void update(UnaryOperator<TraceRuntime> change) {
        RUNTIME.updateAndGet(existing -> change.apply(existing != null
                ? existing
                : TraceRuntime.fromSettings(TraceSettings.load())));
    }
}
