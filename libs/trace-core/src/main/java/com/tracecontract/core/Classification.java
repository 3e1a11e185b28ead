package com.tracecontract.core;

import java.util.List;
import java.util.OptionalInt;

/**
 * How the parameters of one operation are used when a record is built.
 *
 * @param exceptionIndex position of the exception parameter, or {@link #NO_EXCEPTION}
 * @param contextIndices positions copied into the structured context, in declared order
 * @param allIndices     every position, all of which are available to the template
 */
public record Classification(int exceptionIndex, List<Integer> contextIndices, List<Integer> allIndices) {

    /** Marker for operations without an exception parameter. */
    public static final int NO_EXCEPTION = -1;

    public Classification {
        if (exceptionIndex < NO_EXCEPTION) {
            throw new IllegalArgumentException("exceptionIndex must be >= -1");
        }
        contextIndices = List.copyOf(contextIndices);
        allIndices = List.copyOf(allIndices);
    }

    public boolean hasException() {
        return exceptionIndex != NO_EXCEPTION;
    }

    public OptionalInt exception() {
        return hasException() ? OptionalInt.of(exceptionIndex) : OptionalInt.empty();
    }
}
