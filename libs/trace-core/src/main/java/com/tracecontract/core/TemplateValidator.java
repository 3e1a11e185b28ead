package com.tracecontract.core;

import java.util.ArrayList;
import java.util.List;

/**
 * Validates message templates against declared parameter names.
 * <p>
 * Every {@code {name}} token whose content exactly matches a parameter name (case-sensitive)
 * becomes the positional marker {@code {i}}, where {@code i} is the first position of that name.
 * A token that is already a number is kept as a positional marker. Anything else made of braces
 * is rejected: a lone {@code {} or {@code }}, an empty {@code {}}, an undeclared name, or a
 * number that does not address a declared parameter.
 */
public final class TemplateValidator {

    /** Longest digit run accepted as a positional marker without overflowing an int. */
    private static final int MAX_INDEX_DIGITS = 9;

    private TemplateValidator() {
        // utility class
    }

    /**
     * Validates a template outside of any contract.
     *
     * @see #validate(String, String, String, List)
     */
    public static ValidatedTemplate validate(String template, List<String> parameterNames) {
        return validate(null, null, template, parameterNames);
    }

    /**
     * Validates {@code template} for the given operation.
     *
     * @param contractName   contract name reported on failure (nullable)
     * @param operationName  operation name reported on failure (nullable)
     * @param template       the declared template
     * @param parameterNames declared parameter names in order
     * @return the template rewritten to positional markers
     * @throws TemplateException naming the first offending token
     */
    public static ValidatedTemplate validate(String contractName, String operationName,
                                             String template, List<String> parameterNames) {
        if (template == null) {
            throw new IllegalArgumentException("template must not be null");
        }
        if (parameterNames == null) {
            throw new IllegalArgumentException("parameterNames must not be null");
        }

        StringBuilder positional = new StringBuilder(template.length());
        StringBuilder literal = new StringBuilder();
        List<String> literals = new ArrayList<>();
        List<Integer> indices = new ArrayList<>();

        int i = 0;
        while (i < template.length()) {
            char c = template.charAt(i);
            if (c == '}') {
                throw new TemplateException(contractName, operationName, template, "}");
            }
            if (c != '{') {
                literal.append(c);
                positional.append(c);
                i++;
                continue;
            }

            int close = template.indexOf('}', i + 1);
            int nextOpen = template.indexOf('{', i + 1);
            if (close < 0 || (nextOpen >= 0 && nextOpen < close)) {
                throw new TemplateException(contractName, operationName, template, "{");
            }

            String content = template.substring(i + 1, close);
            int index = resolve(content, parameterNames);
            if (index < 0) {
                throw new TemplateException(contractName, operationName, template, "{" + content + "}");
            }

            literals.add(literal.toString());
            literal.setLength(0);
            indices.add(index);
            positional.append('{').append(index).append('}');
            i = close + 1;
        }
        literals.add(literal.toString());

        int[] indexArray = indices.stream().mapToInt(Integer::intValue).toArray();
        return new ValidatedTemplate(template, positional.toString(), literals, indexArray);
    }

    /**
     * Returns the argument index addressed by a placeholder's content, or -1 if it addresses none.
     */
    private static int resolve(String content, List<String> parameterNames) {
        int named = parameterNames.indexOf(content);
        if (named >= 0) {
            return named;
        }
        if (!isDigits(content) || content.length() > MAX_INDEX_DIGITS) {
            return -1;
        }
        int index = Integer.parseInt(content);
        return index < parameterNames.size() ? index : -1;
    }

    private static boolean isDigits(String s) {
        if (s.isEmpty()) {
            return false;
        }
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
        }
        return true;
    }
}
