package com.tracecontract.core;

/**
 * Thrown when an operation's parameters cannot be classified: a second exception parameter,
 * or an exception parameter on an operation that returns an {@link Activity}.
 */
public class ClassificationException extends TraceException {

    private final String parameterName;

    public ClassificationException(String contractName, String operationName, String parameterName, String reason) {
        super(contractName, operationName,
                "Parameter '%s' of operation %s: %s"
                        .formatted(parameterName, location(contractName, operationName), reason),
                null);
        this.parameterName = parameterName;
    }

    public String parameterName() {
        return parameterName;
    }
}
