package com.tracecontract.core;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * A compiled contract bound to an owner name. Dispatches operations by name; annotated
 * interfaces reach it through a proxy.
 */
public final class BoundContract {

    private static final Object[] NO_ARGS = new Object[0];

    private final CompiledContract contract;
    private final String ownerName;
    private final Supplier<TraceRuntime> runtime;

    BoundContract(CompiledContract contract, String ownerName, Supplier<TraceRuntime> runtime) {
        if (ownerName == null || ownerName.isBlank()) {
            throw new IllegalArgumentException("ownerName must not be null or blank");
        }
        if (runtime == null) {
            throw new IllegalArgumentException("runtime must not be null");
        }
        this.contract = contract;
        this.ownerName = ownerName;
        this.runtime = runtime;
    }

    public CompiledContract contract() {
        return contract;
    }

    public String ownerName() {
        return ownerName;
    }

    /**
     * Emits the record of a fire-and-forget operation.
     *
     * @throws IllegalArgumentException if the operation is unknown or returns an {@link Activity}
     * @throws FormatException          if the arguments cannot be rendered
     */
    public void log(String operationName, Object... args) {
        CompiledOperation operation = contract.operation(operationName);
        if (operation.returnsActivity()) {
            throw new IllegalArgumentException(
                    "Operation %s.%s returns an Activity; use start()".formatted(contract.name(), operationName));
        }
        fire(operation, args);
    }

    /**
     * Starts the activity of a timed operation.
     *
     * @throws IllegalArgumentException if the operation is unknown or does not return an {@link Activity}
     * @throws FormatException          if the arguments cannot be rendered
     */
    public Activity start(String operationName, Object... args) {
        CompiledOperation operation = contract.operation(operationName);
        if (!operation.returnsActivity()) {
            throw new IllegalArgumentException(
                    "Operation %s.%s does not return an Activity; use log()".formatted(contract.name(), operationName));
        }
        return startActivity(operation, args);
    }

    /**
     * Invokes an operation whatever its kind.
     *
     * @return the started {@link Activity}, or null for fire-and-forget operations
     */
    public Object invoke(String operationName, Object[] args) {
        CompiledOperation operation = contract.operation(operationName);
        if (operation.returnsActivity()) {
            return startActivity(operation, args);
        }
        fire(operation, args);
        return null;
    }

    private void fire(CompiledOperation operation, Object[] args) {
        TraceRuntime current = runtime.get();
        if (!current.isEnabled(ownerName, operation.level())) {
            checkArity(operation, args);
            return;
        }
        emit(current.sink(), operation.format(args == null ? NO_ARGS : args));
    }

    private Activity startActivity(CompiledOperation operation, Object[] args) {
        TraceRuntime current = runtime.get();
        FormattedRecord head = operation.format(args == null ? NO_ARGS : args);

        ActivityInfo info = new ActivityInfo(ownerName, operation.name(), head.message(), head.level(), head.context());
        List<ActivityListener.Scope> scopes = new ArrayList<>(current.listeners().size());
        try {
            for (ActivityListener listener : current.listeners()) {
                scopes.add(listener.onStart(info));
            }
            return Activity.start(head.message(), head.context(), head.level(), this::emitIfEnabled,
                    System::nanoTime, scopes);
        } catch (RuntimeException | Error e) {
            endAll(scopes, e);
            throw e;
        }
    }

    // Ends scopes opened for an activity that failed to start.
    private static void endAll(List<ActivityListener.Scope> scopes, Throwable failure) {
        for (ActivityListener.Scope scope : scopes) {
            try {
                scope.end(Duration.ZERO);
            } catch (RuntimeException e) {
                failure.addSuppressed(e);
            }
        }
    }

    private void emitIfEnabled(FormattedRecord record) {
        TraceRuntime current = runtime.get();
        if (current.isEnabled(ownerName, record.level())) {
            emit(current.sink(), record);
        }
    }

    private void emit(LogSink sink, FormattedRecord record) {
        sink.emit(ownerName, record.level(), record.message(), record.context(), record.exception());
    }

    private void checkArity(CompiledOperation operation, Object[] args) {
        int given = args == null ? 0 : args.length;
        int declared = operation.spec().parameters().size();
        if (given != declared) {
            throw new FormatException(contract.name(), operation.name(),
                    "expected %d argument(s) but got %d".formatted(declared, given), null);
        }
    }

    @Override
    public String toString() {
        return "BoundContract[" + contract.name() + " -> " + ownerName + "]";
    }
}
