package com.sassed.error;

import com.sassed.lexer.SourcePosition;

public class ParseException extends SassCompileException {
    private final String expected;
    private final String found;

    public ParseException(SourcePosition position, String expected, String found) {
        super("expected " + expected + ", was \"" + found + "\"", position);
        this.expected = expected;
        this.found = found;
    }

    public ParseException(String message, SourcePosition position) {
        super(message, position);
        this.expected = null;
        this.found = null;
    }

    public String expected() {
        return expected;
    }

    public String found() {
        return found;
    }
}
