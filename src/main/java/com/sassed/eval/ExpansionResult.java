package com.sassed.eval;

import com.sassed.css.CssNode;
import com.sassed.extend.ExtendGraph;

import java.util.List;

/**
 * Evaluated CSS before {@code @extend} is applied, with the extends collected on the way.
 */
public record ExpansionResult(List<CssNode> nodes, ExtendGraph extendGraph) {
}
