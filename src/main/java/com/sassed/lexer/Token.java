package com.sassed.lexer;

import java.util.List;

/**
 * A lexical token. {@code text} is the raw source text of the token, quotes included for strings.
 */
public record Token(TokenKind kind, String text, SourcePosition position, int end,
                    boolean spaceBefore, List<StringPart> parts) {

    public Token(TokenKind kind, String text, SourcePosition position, int end, boolean spaceBefore) {
        this(kind, text, position, end, spaceBefore, List.of());
    }

    public boolean is(TokenKind expected) {
        return kind == expected;
    }

    public boolean is(TokenKind expected, String value) {
        return kind == expected && text.equals(value);
    }

    public boolean isIdentifier(String value) {
        return kind == TokenKind.IDENTIFIER && text.equalsIgnoreCase(value);
    }

    /**
     * Name without the leading sigil, for variables, at-keywords and flags.
     */
    public String name() {
        return switch (kind) {
            case VARIABLE, AT_KEYWORD -> text.substring(1);
            case FLAG -> text.substring(1).strip();
            default -> text;
        };
    }

    public int offset() {
        return position.offset();
    }

    @Override
    public String toString() {
        return kind == TokenKind.EOF ? "end of file" : text;
    }
}
