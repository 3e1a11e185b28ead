package com.tracecontract.core;

import java.lang.reflect.Proxy;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Immutable dispatch table of a compiled contract: operation name to {@link CompiledOperation}.
 * <p>
 * One instance exists per contract in a {@link ContractRegistry}. It holds no owner name and no
 * sink; those are supplied by {@link #bind(String, Supplier)}, so every owner of the same contract
 * shares the compiled operations.
 */
public final class CompiledContract {

    private final String name;
    private final Class<?> contractType;
    private final Map<String, CompiledOperation> operations;

    CompiledContract(String name, Class<?> contractType, Map<String, CompiledOperation> operations) {
        this.name = name;
        this.contractType = contractType;
        this.operations = Collections.unmodifiableMap(new LinkedHashMap<>(operations));
    }

    public String name() {
        return name;
    }

    /**
     * Returns the annotated interface this contract was read from, if any.
     */
    public Optional<Class<?>> contractType() {
        return Optional.ofNullable(contractType);
    }

    /**
     * Returns the dispatch table in declaration order.
     */
    public Map<String, CompiledOperation> operations() {
        return operations;
    }

    /**
     * Returns the compiled operation with the given name.
     *
     * @throws IllegalArgumentException if the contract declares no such operation
     */
    public CompiledOperation operation(String operationName) {
        CompiledOperation operation = operations.get(operationName);
        if (operation == null) {
            throw new IllegalArgumentException("Contract %s has no operation '%s'".formatted(name, operationName));
        }
        return operation;
    }

    /**
     * Binds this contract to an owner name. The runtime is resolved on every call, so a sink
     * installed after binding is still used.
     *
     * @param ownerName logger name passed to the sink
     * @param runtime   supplier of the current sink, settings and listeners
     */
    public BoundContract bind(String ownerName, Supplier<TraceRuntime> runtime) {
        return new BoundContract(this, ownerName, runtime);
    }

    /**
     * Binds this contract to an owner name and a fixed runtime.
     */
    public BoundContract bind(String ownerName, TraceRuntime runtime) {
        if (runtime == null) {
            throw new IllegalArgumentException("runtime must not be null");
        }
        return bind(ownerName, () -> runtime);
    }

    /**
     * Creates an implementation of the annotated interface this contract was compiled from.
     *
     * @param type      the contract interface; must be the one this contract was read from
     * @param ownerName logger name passed to the sink
     * @param runtime   supplier of the current sink, settings and listeners
     * @param <T>       contract type
     * @return a proxy dispatching every operation to this contract
     */
    public <T> T bind(Class<T> type, String ownerName, Supplier<TraceRuntime> runtime) {
        if (type == null || type != contractType) {
            throw new IllegalArgumentException("Contract %s was not compiled from %s".formatted(name, type));
        }
        BoundContract bound = bind(ownerName, runtime);
        Object proxy = Proxy.newProxyInstance(
                type.getClassLoader(),
                new Class<?>[] {type},
                new TraceInvocationHandler(type, bound));
        return type.cast(proxy);
    }

    @Override
    public String toString() {
        return "CompiledContract[" + name + ", operations=" + operations.keySet() + "]";
    }
}
