package com.tracecontract.core;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Turns a {@link ContractSpec} into a {@link CompiledContract}, failing on the first invalid
 * operation. Never returns a partial result.
 */
final class ContractCompiler {

    private ContractCompiler() {
        // utility class
    }

    static CompiledContract compile(ContractSpec spec, Class<?> contractType) {
        String contractName = spec.name();
        Map<String, CompiledOperation> operations = new LinkedHashMap<>();

        for (OperationSpec operation : spec.operations()) {
            if (operations.containsKey(operation.name())) {
                throw new ContractException(contractName, operation.name(),
                        "duplicate operation name; operations must be uniquely named (no overloads)");
            }
            if (operation.level() == null) {
                throw new ContractException(contractName, operation.name(),
                        "operation must declare a log level");
            }
            if (operation.returnType() != void.class && operation.returnType() != Activity.class) {
                throw new ContractException(contractName, operation.name(),
                        "return type %s not supported, expected void or %s"
                                .formatted(operation.returnType().getName(), Activity.class.getSimpleName()));
            }

            ValidatedTemplate template = TemplateValidator.validate(
                    contractName, operation.name(), operation.template(), operation.parameterNames());
            Classification classification = ParameterClassifier.classify(contractName, operation);

            operations.put(operation.name(), new CompiledOperation(contractName, operation, template, classification));
        }

        return new CompiledContract(contractName, contractType, operations);
    }
}
