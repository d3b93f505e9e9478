package com.sassed.syntax;

import com.sassed.lexer.SourcePosition;
import com.sassed.value.ListSeparator;
import com.sassed.value.SassColor;

import java.util.List;

public sealed interface Expression extends Node {
    record NumberLiteral(double value, String unit, SourcePosition position) implements Expression {}

    record ColorLiteral(SassColor color, SourcePosition position) implements Expression {}

    /**
     * Quoted strings and identifiers, possibly interpolated.
     */
    record StringLiteral(Interpolation text, boolean quoted, SourcePosition position) implements Expression {}

    record BooleanLiteral(boolean value, SourcePosition position) implements Expression {}

    record NullLiteral(SourcePosition position) implements Expression {}

    record VariableReference(String name, SourcePosition position) implements Expression {}

    record Binary(Operator operator, Expression left, Expression right, SourcePosition position) implements Expression {}

    record Unary(String operator, Expression operand, SourcePosition position) implements Expression {}

    record ListExpression(List<Expression> items, ListSeparator separator, boolean bracketed,
                          SourcePosition position) implements Expression {
        public ListExpression {
            items = List.copyOf(items);
        }
    }

    record MapExpression(List<Expression> keys, List<Expression> values, SourcePosition position) implements Expression {
        public MapExpression {
            keys = List.copyOf(keys);
            values = List.copyOf(values);
        }
    }

    record FunctionCall(String name, ArgumentList arguments, SourcePosition position) implements Expression {}

    record Parenthesized(Expression inner, SourcePosition position) implements Expression {}

    record ParentReference(SourcePosition position) implements Expression {}
}
