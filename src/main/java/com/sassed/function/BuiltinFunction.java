package com.sassed.function;

import com.sassed.syntax.ParameterList;
import com.sassed.value.Value;

/**
 * A function implemented in Java. Arguments are bound against {@code parameters} exactly like
 * a user-defined function's before {@code body} runs.
 */
public record BuiltinFunction(String name, ParameterList parameters, Body body) {

    @FunctionalInterface
    public interface Body {
        Value apply(Arguments arguments);
    }

    public String signature() {
        StringBuilder sb = new StringBuilder(name).append('(');
        for (int i = 0; i < parameters.parameters().size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append('$').append(parameters.parameters().get(i).name());
        }
        if (parameters.restParameter() != null) {
            if (!parameters.parameters().isEmpty()) {
                sb.append(", ");
            }
            sb.append('$').append(parameters.restParameter()).append("...");
        }
        return sb.append(')').toString();
    }
}
