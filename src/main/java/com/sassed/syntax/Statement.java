package com.sassed.syntax;

import com.sassed.lexer.SourcePosition;

import java.util.List;

public sealed interface Statement extends Node {
    record RuleBlock(Interpolation selector, List<Statement> children, SourcePosition position) implements Statement {}

    /**
     * A property. {@code value} is null for a pure nested-property block such as {@code font: { ... }}.
     */
    record Declaration(Interpolation name, Expression value, boolean important, List<Statement> children,
                       SourcePosition position) implements Statement {}

    record VariableDeclaration(String name, Expression value, boolean isDefault, boolean global,
                               SourcePosition position) implements Statement {}

    record Comment(String text, SourcePosition position) implements Statement {}

    record MixinDeclaration(String name, ParameterList parameters, List<Statement> body,
                            SourcePosition position) implements Statement {}

    /**
     * {@code content} is null when the include has no block.
     */
    record Include(String name, ArgumentList arguments, List<Statement> content,
                   SourcePosition position) implements Statement {}

    record Content(SourcePosition position) implements Statement {}

    record FunctionDeclaration(String name, ParameterList parameters, List<Statement> body,
                               SourcePosition position) implements Statement {}

    record Return(Expression value, SourcePosition position) implements Statement {}

    record IfClause(Expression condition, List<Statement> body) {}

    record If(List<IfClause> clauses, List<Statement> orElse, SourcePosition position) implements Statement {}

    record Each(List<String> variables, Expression list, List<Statement> body, SourcePosition position) implements Statement {}

    record For(String variable, Expression from, Expression to, boolean inclusive, List<Statement> body,
               SourcePosition position) implements Statement {}

    record While(Expression condition, List<Statement> body, SourcePosition position) implements Statement {}

    record Extend(Interpolation selector, boolean optional, SourcePosition position) implements Statement {}

    record Media(Interpolation query, List<Statement> body, SourcePosition position) implements Statement {}

    /**
     * {@code selector} is null for {@code @at-root { ... }}.
     */
    record AtRoot(Interpolation selector, List<Statement> body, SourcePosition position) implements Statement {}

    enum MessageKind { DEBUG, WARN, ERROR }

    record Message(MessageKind kind, Expression value, SourcePosition position) implements Statement {}

    sealed interface ImportTarget {
        record SassImport(String url, SourcePosition position) implements ImportTarget {}

        record CssImport(Interpolation text) implements ImportTarget {}
    }

    record Import(List<ImportTarget> targets, SourcePosition position) implements Statement {}

    /**
     * Any other at-rule; {@code body} is null for body-less rules such as {@code @charset}.
     */
    record GenericAtRule(String name, Interpolation prelude, List<Statement> body,
                         SourcePosition position) implements Statement {}
}
