package com.sassed.eval;

import com.sassed.lexer.SourcePosition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class LoggingDiagnosticSink implements DiagnosticSink {
    private static final Logger logger = LoggerFactory.getLogger(LoggingDiagnosticSink.class);

    @Override
    public void debug(String message, SourcePosition position) {
        logger.debug("{}:{} DEBUG: {}", position.source(), position.line(), message);
    }

    @Override
    public void warn(String message, SourcePosition position) {
        logger.warn("WARNING: {}\n         on line {} of {}", message, position.line(), position.source());
    }
}
