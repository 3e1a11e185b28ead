package com.tracecontract.core;

/**
 * One declared parameter of a trace operation.
 *
 * @param name     parameter name, used both as template placeholder and as context key
 * @param type     declared Java type of the argument
 * @param position zero-based position in the operation's argument list
 */
public record ParameterSpec(String name, Class<?> type, int position) {

    public ParameterSpec {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        if (type == null) {
            throw new IllegalArgumentException("type must not be null");
        }
        if (position < 0) {
            throw new IllegalArgumentException("position must be >= 0");
        }
    }
}
