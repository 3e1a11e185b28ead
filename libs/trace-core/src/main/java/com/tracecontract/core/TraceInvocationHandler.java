package com.tracecontract.core;

import java.lang.reflect.InvocationHandler;
import java.lang.reflect.Method;

/**
 * Routes calls on a contract proxy to its {@link BoundContract}. {@code Object} methods are
 * answered by the proxy itself and default methods run as written.
 */
final class TraceInvocationHandler implements InvocationHandler {

    private final Class<?> contractType;
    private final BoundContract bound;

    TraceInvocationHandler(Class<?> contractType, BoundContract bound) {
        this.contractType = contractType;
        this.bound = bound;
    }

    @Override
    public Object invoke(Object proxy, Method method, Object[] args) throws Throwable {
        if (method.getDeclaringClass() == Object.class) {
            return switch (method.getName()) {
                case "equals" -> proxy == args[0];
                case "hashCode" -> System.identityHashCode(proxy);
                case "toString" -> contractType.getSimpleName() + "[" + bound.ownerName() + "]";
                default -> throw new UnsupportedOperationException(method.toString());
            };
        }
        if (method.isDefault()) {
            return InvocationHandler.invokeDefault(proxy, method, args);
        }
        return bound.invoke(method.getName(), args);
    }
}
