package com.tracecontract.core;

import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.Parameter;
import java.util.Arrays;
import java.util.Comparator;

/**
 * Reads a {@link ContractSpec} from an interface extending {@link TraceContract}.
 * <p>
 * Every abstract method becomes one operation named after the method. When several level
 * annotations are present the most severe one wins. Methods without a level annotation produce
 * an operation without level, which the compiler rejects. Static and default methods are not
 * operations.
 */
public final class AnnotatedContractReader {

    private AnnotatedContractReader() {
        // utility class
    }

    /**
     * Reads the contract declared by {@code type}.
     *
     * @param type interface extending {@link TraceContract}
     * @return the declared contract, named after the interface's binary name
     * @throws IllegalArgumentException if {@code type} is not such an interface
     * @throws ContractException        if a parameter name cannot be determined
     */
    public static ContractSpec read(Class<?> type) {
        if (type == null) {
            throw new IllegalArgumentException("type must not be null");
        }
        if (!type.isInterface()) {
            throw new IllegalArgumentException(type.getName() + " is not an interface type");
        }
        if (!TraceContract.class.isAssignableFrom(type)) {
            throw new IllegalArgumentException(type.getName() + " must extend " + TraceContract.class.getName());
        }

        ContractSpec.Builder contract = ContractSpec.builder(type.getName());
        Arrays.stream(type.getMethods())
                .filter(AnnotatedContractReader::isOperation)
                .sorted(Comparator.comparing(Method::getName)
                        .thenComparing(m -> Arrays.toString(m.getParameterTypes())))
                .forEach(method -> contract.operation(readOperation(type, method)));
        return contract.build();
    }

    private static boolean isOperation(Method method) {
        return !Modifier.isStatic(method.getModifiers())
                && !method.isDefault()
                && !method.isSynthetic()
                && !method.isBridge();
    }

    private static OperationSpec readOperation(Class<?> type, Method method) {
        OperationSpec.Builder operation = OperationSpec.builder(method.getName())
                .returnType(method.getReturnType());
        applyLevel(method, operation);

        for (Parameter parameter : method.getParameters()) {
            operation.parameter(parameterName(type, method, parameter), parameter.getType());
        }
        return operation.build();
    }

    private static void applyLevel(Method method, OperationSpec.Builder operation) {
        LogError error = method.getAnnotation(LogError.class);
        if (error != null) {
            operation.error(error.value());
            return;
        }
        LogWarning warning = method.getAnnotation(LogWarning.class);
        if (warning != null) {
            operation.warning(warning.value());
            return;
        }
        LogInfo info = method.getAnnotation(LogInfo.class);
        if (info != null) {
            operation.info(info.value());
            return;
        }
        LogDebug debug = method.getAnnotation(LogDebug.class);
        if (debug != null) {
            operation.debug(debug.value());
            return;
        }
        LogIgnored ignored = method.getAnnotation(LogIgnored.class);
        if (ignored != null) {
            operation.level(LogLevel.NONE).template(ignored.value());
            return;
        }
        // no level: left null for the compiler to report
        operation.template("");
    }

    private static String parameterName(Class<?> type, Method method, Parameter parameter) {
        TraceParam explicit = parameter.getAnnotation(TraceParam.class);
        if (explicit != null) {
            return explicit.value();
        }
        if (!parameter.isNamePresent()) {
            throw new ContractException(type.getName(), method.getName(),
                    "parameter names are not available; compile with -parameters or annotate with @"
                            + TraceParam.class.getSimpleName());
        }
        return parameter.getName();
    }
}
