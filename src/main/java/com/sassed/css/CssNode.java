package com.sassed.css;

import com.sassed.lexer.SourcePosition;

/**
 * Fully evaluated CSS, as produced by the evaluator and consumed by the renderer.
 */
public sealed interface CssNode permits CssRule, CssDeclaration, CssComment, CssAtRule {
    SourcePosition position();
}
