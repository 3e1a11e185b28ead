package com.tracecontract.core;

/**
 * Thrown to the caller of a logging operation when its arguments cannot be rendered.
 */
public class FormatException extends TraceException {

    public FormatException(String contractName, String operationName, String message, Throwable cause) {
        super(contractName, operationName,
                "%s: %s".formatted(location(contractName, operationName), message), cause);
    }
}
