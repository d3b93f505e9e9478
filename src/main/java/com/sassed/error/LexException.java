package com.sassed.error;

import com.sassed.lexer.SourcePosition;

public class LexException extends SassCompileException {
    public LexException(String message, SourcePosition start) {
        super(message, start);
    }
}
