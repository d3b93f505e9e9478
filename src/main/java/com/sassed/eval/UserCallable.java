package com.sassed.eval;

import com.sassed.syntax.ParameterList;
import com.sassed.syntax.Statement;

import java.util.List;

/**
 * A mixin or function declared in a stylesheet, closed over the scope it was declared in.
 */
public record UserCallable(String name, ParameterList parameters, List<Statement> body, int closureScope) {
}
