package com.sassed.extend;

import com.sassed.lexer.SourcePosition;
import com.sassed.selector.ComplexSelector;
import com.sassed.selector.CompoundSelector;

/**
 * One {@code @extend}: {@code extender} should also match wherever {@code target} does.
 * {@code media} is the query of the enclosing {@code @media}, or null outside any.
 * {@code order} is the source order of the rule that declared it.
 */
public record Extension(CompoundSelector target, ComplexSelector extender, boolean optional, String media,
                        int order, SourcePosition position) {

    public boolean appliesIn(String ruleMedia) {
        return media == null || media.equals(ruleMedia);
    }
}
