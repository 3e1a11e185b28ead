package com.tracecontract.core;

import java.util.ArrayList;
import java.util.List;

/**
 * One declared logging operation of a trace contract.
 * <p>
 * A {@code null} level is representable so that declarations missing a severity can be reported
 * by the compiler as a {@link ContractException} instead of failing while the spec is read.
 *
 * @param name       operation name, unique within its contract
 * @param level      severity of every record this operation emits (null when undeclared)
 * @param template   message template with {@code {paramName}} placeholders
 * @param parameters ordered parameter list
 * @param returnType {@code void.class} for operations that emit immediately,
 *                   {@code Activity.class} for timed spans
 */
public record OperationSpec(
        String name,
        LogLevel level,
        String template,
        List<ParameterSpec> parameters,
        Class<?> returnType
) {

    /** Template used by operations declared as ignored when no message is given. */
    public static final String IGNORED_TEMPLATE = "ignored";

    public OperationSpec {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        if (template == null) {
            throw new IllegalArgumentException("template must not be null");
        }
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
        if (returnType == null) {
            returnType = void.class;
        }
    }

    /**
     * Returns true if calling this operation starts a timed {@link Activity}.
     */
    public boolean returnsActivity() {
        return returnType == Activity.class;
    }

    /**
     * Returns the parameter names in declared order. Duplicates are preserved.
     */
    public List<String> parameterNames() {
        return parameters.stream().map(ParameterSpec::name).toList();
    }

    /**
     * Starts building an operation with the given name.
     */
    public static Builder builder(String name) {
        return new Builder(name);
    }

    /**
     * Fluent builder for operations declared as plain data rather than through annotations.
     */
    public static final class Builder {

        private final String name;
        private final List<ParameterSpec> parameters = new ArrayList<>();
        private LogLevel level;
        private String template;
        private Class<?> returnType = void.class;

        private Builder(String name) {
            this.name = name;
        }

        public Builder level(LogLevel level) {
            this.level = level;
            return this;
        }

        public Builder template(String template) {
            this.template = template;
            return this;
        }

        public Builder debug(String template) {
            return level(LogLevel.DEBUG).template(template);
        }

        public Builder info(String template) {
            return level(LogLevel.INFO).template(template);
        }

        public Builder warning(String template) {
            return level(LogLevel.WARNING).template(template);
        }

        public Builder error(String template) {
            return level(LogLevel.ERROR).template(template);
        }

        /**
         * Declares the operation as ignored: level {@link LogLevel#NONE}, template "ignored".
         */
        public Builder ignored() {
            return level(LogLevel.NONE).template(IGNORED_TEMPLATE);
        }

        /**
         * Appends a parameter; its position is the number of parameters declared before it.
         */
        public Builder parameter(String parameterName, Class<?> type) {
            parameters.add(new ParameterSpec(parameterName, type, parameters.size()));
            return this;
        }

        public Builder returnType(Class<?> returnType) {
            this.returnType = returnType;
            return this;
        }

        public Builder returnsActivity() {
            return returnType(Activity.class);
        }

        public OperationSpec build() {
            return new OperationSpec(name, level, template, parameters, returnType);
        }
    }
}
