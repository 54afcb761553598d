package com.converge.core.plan;

import java.util.List;
import java.util.Map;

/**
 * Template whose {@code {name}} placeholders are filled from the variable pool
 * at execution time.
 *
 * @param template  text with {@code {name}} placeholders
 * @param variables names of the pool entries the template references
 */
public record StringFormat(String template, List<String> variables) {

    public StringFormat {
        variables = List.copyOf(variables);
    }

    /**
     * Substitutes every referenced variable.
     *
     * @param values resolved values keyed by variable name
     * @throws IllegalArgumentException if a referenced variable has no value
     */
    public String render(Map<String, ?> values) {
        String result = template;
        for (String name : variables) {
            if (!values.containsKey(name)) {
                throw new IllegalArgumentException("No value for '" + name + "' in template: " + template);
            }
            result = result.replace("{" + name + "}", String.valueOf(values.get(name)));
        }
        return result;
    }
}
