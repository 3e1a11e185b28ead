package com.tracecontract.core;

/**
 * Base class of every error raised by the contract compiler or by a compiled operation.
 * <p>
 * Compile-time subclasses ({@link TemplateException}, {@link ClassificationException},
 * {@link ContractException}) abort registration of one contract; {@link FormatException} is
 * raised to the caller of a logging operation.
 */
public abstract class TraceException extends RuntimeException {

    private final String contractName;
    private final String operationName;

    protected TraceException(String contractName, String operationName, String message, Throwable cause) {
        super(message, cause);
        this.contractName = contractName;
        this.operationName = operationName;
    }

    /**
     * Returns the name of the contract being compiled or invoked, or null if unknown.
     */
    public String contractName() {
        return contractName;
    }

    /**
     * Returns the name of the offending operation, or null if the error is contract-wide.
     */
    public String operationName() {
        return operationName;
    }

    /**
     * Renders {@code Contract.operation} for error messages, omitting whichever part is missing.
     */
    protected static String location(String contractName, String operationName) {
        if (contractName == null) {
            return operationName == null ? "<unnamed>" : operationName;
        }
        return operationName == null ? contractName : contractName + "." + operationName;
    }
}
