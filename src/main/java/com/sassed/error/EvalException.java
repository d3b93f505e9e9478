package com.sassed.error;

import com.sassed.lexer.SourcePosition;

public class EvalException extends SassCompileException {
    public EvalException(String message) {
        super(message, null);
    }

    public EvalException(String message, SourcePosition position) {
        super(message, position);
    }

    /**
     * Attaches a position to an error raised somewhere without one, such as a value operation.
     */
    public EvalException at(SourcePosition position) {
        if (position().isPresent() || position == null) {
            return this;
        }
        EvalException located = new EvalException(reason(), position);
        located.setStackTrace(getStackTrace());
        return located;
    }
}
