package com.tracecontract.core;

import java.util.Arrays;
import java.util.List;
import java.util.function.IntFunction;

/**
 * A message template whose placeholders have all been resolved to positional markers.
 * <p>
 * Stored as alternating literal text and argument indices: {@code literals} always has one
 * more element than {@code indices}, so rendering is a single pass with no parsing.
 */
public final class ValidatedTemplate {

    private final String source;
    private final String positional;
    private final List<String> literals;
    private final int[] indices;

    ValidatedTemplate(String source, String positional, List<String> literals, int[] indices) {
        if (literals.size() != indices.length + 1) {
            throw new IllegalArgumentException("literals must have exactly one more element than indices");
        }
        this.source = source;
        this.positional = positional;
        this.literals = List.copyOf(literals);
        this.indices = indices.clone();
    }

    /**
     * Returns the template as declared, with named placeholders.
     */
    public String source() {
        return source;
    }

    /**
     * Returns the template with every placeholder rewritten to {@code {index}}.
     */
    public String positional() {
        return positional;
    }

    /**
     * Returns the argument index of each placeholder, in template order.
     */
    public int[] placeholderIndices() {
        return indices.clone();
    }

    /**
     * Substitutes each positional marker with the text produced by {@code renderer} for its index.
     */
    public String render(IntFunction<String> renderer) {
        StringBuilder sb = new StringBuilder(positional.length() + 16 * indices.length);
        sb.append(literals.get(0));
        for (int i = 0; i < indices.length; i++) {
            sb.append(renderer.apply(indices[i]));
            sb.append(literals.get(i + 1));
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ValidatedTemplate other)) {
            return false;
        }
        return source.equals(other.source) && positional.equals(other.positional);
    }

    @Override
    public int hashCode() {
        return 31 * source.hashCode() + positional.hashCode();
    }

    @Override
    public String toString() {
        return "ValidatedTemplate[" + positional + ", indices=" + Arrays.toString(indices) + "]";
    }
}
