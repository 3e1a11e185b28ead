package com.tracecontract.core;

/**
 * Thrown when a contract declaration is unusable: missing severity, unsupported return type,
 * duplicate operation name or unnamed parameter.
 */
public class ContractException extends TraceException {

    public ContractException(String contractName, String operationName, String message) {
        super(contractName, operationName,
                "%s: %s".formatted(location(contractName, operationName), message), null);
    }
}
