package com.sassed.error;

import com.sassed.lexer.SourcePosition;

/**
 * Failure tied to the contents of one input. Never leaves state behind for later compiles.
 */
public abstract class SassCompileException extends SassException {
    protected SassCompileException(String message, SourcePosition position) {
        super(message, position);
    }
}
