package com.tracecontract.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Partitions an operation's parameters into the exception slot and the structured-context
 * fields.
 * <p>
 * Context-eligible types are {@link String}, the Java primitives and their wrapper classes.
 * Other types only take part in message substitution.
 */
public final class ParameterClassifier {

    private static final Set<Class<?>> BOXED_PRIMITIVES = Set.of(
            Boolean.class, Byte.class, Character.class, Short.class,
            Integer.class, Long.class, Float.class, Double.class
    );

    private ParameterClassifier() {
        // utility class
    }

    /**
     * Classifies the parameters of {@code operation}.
     *
     * @param contractName contract name reported on failure (nullable)
     * @param operation    the operation to classify
     * @return the classification
     * @throws ClassificationException if a second exception parameter is declared, or if an
     *                                 activity operation declares one
     */
    public static Classification classify(String contractName, OperationSpec operation) {
        List<ParameterSpec> parameters = operation.parameters();
        int exceptionIndex = Classification.NO_EXCEPTION;
        List<Integer> contextIndices = new ArrayList<>();
        List<Integer> allIndices = new ArrayList<>(parameters.size());

        for (int i = 0; i < parameters.size(); i++) {
            ParameterSpec parameter = parameters.get(i);
            allIndices.add(i);

            if (isException(parameter.type())) {
                if (operation.returnsActivity()) {
                    throw new ClassificationException(contractName, operation.name(), parameter.name(),
                            "exception parameters are not allowed on operations returning an Activity");
                }
                if (exceptionIndex != Classification.NO_EXCEPTION) {
                    throw new ClassificationException(contractName, operation.name(), parameter.name(),
                            "only one exception parameter is allowed, '%s' is already declared"
                                    .formatted(parameters.get(exceptionIndex).name()));
                }
                exceptionIndex = i;
            } else if (isContextEligible(parameter.type())) {
                contextIndices.add(i);
            }
        }

        return new Classification(exceptionIndex, contextIndices, allIndices);
    }

    /**
     * Returns true if values of {@code type} are recorded as the record's exception.
     */
    public static boolean isException(Class<?> type) {
        return Throwable.class.isAssignableFrom(type);
    }

    /**
     * Returns true if values of {@code type} are copied into the structured context.
     */
    public static boolean isContextEligible(Class<?> type) {
        return type == String.class
                || (type.isPrimitive() && type != void.class)
                || BOXED_PRIMITIVES.contains(type);
    }
}
