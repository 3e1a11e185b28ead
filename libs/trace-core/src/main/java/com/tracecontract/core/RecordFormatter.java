package com.tracecontract.core;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds a {@link FormattedRecord} from a validated template and call-time argument values.
 * <p>
 * Pure: no I/O, no shared state. Values are rendered with {@link String#valueOf(Object)}.
 */
public final class RecordFormatter {

    private RecordFormatter() {
        // utility class
    }

    /**
     * Formats one invocation of {@code operation}.
     *
     * @param contractName   contract name reported on failure (nullable)
     * @param operation      the invoked operation
     * @param template       its validated template
     * @param classification its parameter classification
     * @param values         argument values in declared order
     * @return the formatted record
     * @throws FormatException if the argument count does not match, or a value cannot be rendered
     */
    public static FormattedRecord format(String contractName, OperationSpec operation,
                                         ValidatedTemplate template, Classification classification,
                                         Object[] values) {
        Object[] args = values == null ? new Object[0] : values;
        List<ParameterSpec> parameters = operation.parameters();
        if (args.length != parameters.size()) {
            throw new FormatException(contractName, operation.name(),
                    "expected %d argument(s) but got %d".formatted(parameters.size(), args.length), null);
        }

        String message = template.render(index -> render(contractName, operation, parameters.get(index), args[index]));

        // first write wins: a repeated parameter name keeps the earlier value
        Map<String, Object> context = new LinkedHashMap<>();
        for (int index : classification.contextIndices()) {
            String key = parameters.get(index).name();
            if (!context.containsKey(key)) {
                context.put(key, args[index]);
            }
        }

        Throwable exception = null;
        if (classification.hasException()) {
            Object value = args[classification.exceptionIndex()];
            if (value != null && !(value instanceof Throwable)) {
                throw new FormatException(contractName, operation.name(),
                        "argument '%s' must be a Throwable but was %s"
                                .formatted(parameters.get(classification.exceptionIndex()).name(),
                                        value.getClass().getName()),
                        null);
            }
            exception = (Throwable) value;
        }

        return new FormattedRecord(message, context, operation.level(), exception);
    }

    private static String render(String contractName, OperationSpec operation, ParameterSpec parameter, Object value) {
        try {
            return String.valueOf(value);
        } catch (RuntimeException e) {
            throw new FormatException(contractName, operation.name(),
                    "could not render argument '%s' of type %s".formatted(parameter.name(), parameter.type().getName()),
                    e);
        }
    }
}
