package com.tracecontract.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Process-wide cache of compiled contracts.
 * <p>
 * Each contract identity (an annotated interface, or the name of an explicit
 * {@link ContractSpec}) is compiled at most once. Lookups of already-compiled contracts do not
 * lock; compilation is serialized by a single registry-wide lock, so concurrent first uses of
 * the same contract all observe one {@link CompiledContract}. A contract that fails to compile
 * is not cached and the error is raised again on the next attempt.
 */
public final class ContractRegistry {

    private static final Logger log = LoggerFactory.getLogger(ContractRegistry.class);

    private static final ContractRegistry GLOBAL = new ContractRegistry();

    private final Map<Object, CompiledContract> compiled = new ConcurrentHashMap<>();
    private final Map<String, ContractSpec> explicitSpecs = new ConcurrentHashMap<>();
    private final Object compileLock = new Object();

    /**
     * Creates an empty registry. Most callers should use {@link #global()}.
     */
    public ContractRegistry() {
        // empty until first use
    }

    /**
     * Returns the registry shared by {@link Tracer}.
     */
    public static ContractRegistry global() {
        return GLOBAL;
    }

    /**
     * Returns the compiled form of an annotated contract interface, compiling it on first use.
     *
     * @param contractType interface extending {@link TraceContract}
     * @return the cached compiled contract
     * @throws TraceException if the contract is invalid
     */
    public CompiledContract getOrCompile(Class<?> contractType) {
        if (contractType == null) {
            throw new IllegalArgumentException("contractType must not be null");
        }
        return getOrCompile(contractType, () -> AnnotatedContractReader.read(contractType), contractType);
    }

    /**
     * Returns the compiled form of an explicit contract spec, keyed by {@link ContractSpec#name()}.
     * A later spec with the same name must declare the same operations.
     *
     * @param spec the contract declaration
     * @return the cached compiled contract
     * @throws ContractException if a different spec was already compiled under the same name
     * @throws TraceException    if the contract is invalid
     */
    public CompiledContract getOrCompile(ContractSpec spec) {
        if (spec == null) {
            throw new IllegalArgumentException("spec must not be null");
        }
        CompiledContract contract = getOrCompile(spec.name(), () -> spec, null);
        ContractSpec registered = explicitSpecs.get(spec.name());
        if (!spec.equals(registered)) {
            throw new ContractException(spec.name(), null,
                    "a different contract with operations %s is already registered under this name"
                            .formatted(contract.operations().keySet()));
        }
        return contract;
    }

    /**
     * Returns true if the given interface has already been compiled.
     */
    public boolean isCompiled(Class<?> contractType) {
        return compiled.containsKey(contractType);
    }

    /**
     * Returns true if an explicit spec with the given name has already been compiled.
     */
    public boolean isCompiled(String contractName) {
        return compiled.containsKey(contractName);
    }

    /**
     * Returns the number of compiled contracts.
     */
    public int size() {
        return compiled.size();
    }

    private CompiledContract getOrCompile(Object key, Supplier<ContractSpec> source, Class<?> contractType) {
        CompiledContract existing = compiled.get(key);
        if (existing != null) {
            return existing;
        }

        synchronized (compileLock) {
            existing = compiled.get(key);
            if (existing != null) {
                return existing;
            }
            ContractSpec spec = source.get();
            CompiledContract contract = ContractCompiler.compile(spec, contractType);
            if (contractType == null) {
                explicitSpecs.put(spec.name(), spec);
            }
            compiled.put(key, contract);
            log.debug("Compiled trace contract {} with {} operation(s)", spec.name(), contract.operations().size());
            return contract;
        }
    }
}
