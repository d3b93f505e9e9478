package com.sassed.lexer;

/**
 * Location of a token in its source. Lines and columns are 1-based, the offset is 0-based.
 */
public record SourcePosition(String source, int line, int column, int offset) {
    public static final SourcePosition UNKNOWN = new SourcePosition("stdin", 0, 0, -1);

    @Override
    public String toString() {
        return source + ":" + line + ":" + column;
    }
}
