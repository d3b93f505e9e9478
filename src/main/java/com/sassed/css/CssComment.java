package com.sassed.css;

import com.sassed.lexer.SourcePosition;

/**
 * A block comment, {@code text} including the delimiters.
 */
public record CssComment(String text, SourcePosition position) implements CssNode {

    /**
     * Comments starting with {@code /*!} survive compressed output.
     */
    public boolean isLoud() {
        return text.startsWith("/*!");
    }
}
