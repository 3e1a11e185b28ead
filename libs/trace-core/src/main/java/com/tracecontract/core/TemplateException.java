package com.tracecontract.core;

/**
 * Thrown when a message template references an undeclared parameter or contains a brace
 * sequence that is not a valid placeholder.
 */
public class TemplateException extends TraceException {

    private final String template;
    private final String token;

    public TemplateException(String contractName, String operationName, String template, String token) {
        super(contractName, operationName,
                "Invalid format argument '%s' in template \"%s\" for operation %s"
                        .formatted(token, template, location(contractName, operationName)),
                null);
        this.template = template;
        this.token = token;
    }

    public String template() {
        return template;
    }

    /**
     * Returns the offending token, e.g. {@code {unknown}} or a lone {@code }}.
     */
    public String token() {
        return token;
    }
}
