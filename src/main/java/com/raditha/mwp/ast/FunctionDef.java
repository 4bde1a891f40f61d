package com.raditha.mwp.ast;

import java.util.List;

/**
 * A function definition ready for analysis.
 *
 * @param name       function name
 * @param parameters parameter names in declaration order
 * @param variables  every variable the function refers to, sorted and unique
 * @param body       the function body; null when the definition has no body
 */
public record FunctionDef(String name, List<String> parameters, List<String> variables, Compound body)
        implements Node {
    public FunctionDef {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Function name cannot be empty");
        }
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
        variables = variables == null ? List.of() : List.copyOf(variables);
    }

    public boolean hasBody() {
        return body != null && !body.isEmpty();
    }
}
