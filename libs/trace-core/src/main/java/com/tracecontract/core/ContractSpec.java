package com.tracecontract.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * An ordered set of operations sharing one logical contract name.
 * <p>
 * Operation-name uniqueness is checked when the contract is compiled, so a spec with duplicates
 * can still be built and reported with a {@link ContractException}.
 *
 * @param name       contract name, used in error reports and as registry key for explicit specs
 * @param operations declared operations in order
 */
public record ContractSpec(String name, List<OperationSpec> operations) {

    public ContractSpec {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        operations = operations == null ? List.of() : List.copyOf(operations);
    }

    /**
     * Returns the first operation with the given name, if declared.
     */
    public Optional<OperationSpec> operation(String operationName) {
        return operations.stream()
                .filter(op -> op.name().equals(operationName))
                .findFirst();
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    /**
     * Fluent builder for contracts.
     */
    public static final class Builder {

        private final String name;
        private final List<OperationSpec> operations = new ArrayList<>();

        private Builder(String name) {
            this.name = name;
        }

        public Builder operation(OperationSpec operation) {
            if (operation == null) {
                throw new IllegalArgumentException("operation must not be null");
            }
            operations.add(operation);
            return this;
        }

        public Builder operation(OperationSpec.Builder operation) {
            return operation(operation.build());
        }

        public ContractSpec build() {
            return new ContractSpec(name, operations);
        }
    }
}
