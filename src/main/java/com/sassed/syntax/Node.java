package com.sassed.syntax;

import com.sassed.lexer.SourcePosition;

import java.util.List;

/**
 * Syntax tree produced by the {@link Parser}. Owned top-down with no back references.
 */
public sealed interface Node permits Node.Stylesheet, Statement, Expression {
    SourcePosition position();

    record Stylesheet(List<Statement> children, String source, SourcePosition position) implements Node {
        public Stylesheet {
            children = List.copyOf(children);
        }
    }
}
