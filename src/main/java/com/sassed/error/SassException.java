package com.sassed.error;

import com.sassed.lexer.SourcePosition;

import java.util.Optional;

public abstract class SassException extends RuntimeException {
    private final SourcePosition position;

    protected SassException(String message, SourcePosition position) {
        super(message);
        this.position = position;
    }

    protected SassException(String message, SourcePosition position, Throwable cause) {
        super(message, cause);
        this.position = position;
    }

    public Optional<SourcePosition> position() {
        return Optional.ofNullable(position);
    }

    @Override
    public String getMessage() {
        if (position == null || position.offset() < 0) {
            return super.getMessage();
        }
        return super.getMessage() + "\n  on line " + position.line() + " of " + position.source();
    }

    /**
     * The message without the position suffix.
     */
    public String reason() {
        return super.getMessage();
    }
}
