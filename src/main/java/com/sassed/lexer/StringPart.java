package com.sassed.lexer;

import java.util.List;

/**
 * A piece of a quoted string or {@code url(...)} token: either literal text or an interpolated
 * expression that was tokenized on its own.
 */
public sealed interface StringPart {
    record Literal(String text) implements StringPart {}

    record Interpolation(List<Token> tokens, SourcePosition position) implements StringPart {}
}
