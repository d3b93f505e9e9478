package com.sassed.syntax;

import java.util.List;

/**
 * Declared parameters, with the name of the trailing {@code $rest...} parameter or null.
 */
public record ParameterList(List<Parameter> parameters, String restParameter) {
    public static final ParameterList EMPTY = new ParameterList(List.of(), null);

    public ParameterList {
        parameters = List.copyOf(parameters);
    }
}
