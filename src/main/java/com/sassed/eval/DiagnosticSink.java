package com.sassed.eval;

import com.sassed.lexer.SourcePosition;

/**
 * Receives {@code @debug} and {@code @warn} output.
 */
public interface DiagnosticSink {

    void debug(String message, SourcePosition position);

    void warn(String message, SourcePosition position);
}
