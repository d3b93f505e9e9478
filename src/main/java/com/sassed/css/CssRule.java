package com.sassed.css;

import com.sassed.lexer.SourcePosition;
import com.sassed.selector.SelectorList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

/**
 * A style rule with its declarations. Rules are flat: a rule nested in the source appears after
 * its parent in the output list and keeps a reference to it for indentation. The selector is
 * replaced by the extend resolver, so it is mutable.
 */
public final class CssRule implements CssNode {
    private SelectorList selector;
    private final String rawSelector;
    private final MutableList<CssNode> children = Lists.mutable.empty();
    private final CssRule parent;
    private final int order;
    private final SourcePosition position;

    public CssRule(SelectorList selector, CssRule parent, int order, SourcePosition position) {
        this.selector = selector;
        this.rawSelector = null;
        this.parent = parent;
        this.order = order;
        this.position = position;
    }

    /**
     * A rule whose selector is not a regular selector, such as a keyframe selector ({@code 50%}).
     */
    public CssRule(String rawSelector, CssRule parent, int order, SourcePosition position) {
        this.selector = null;
        this.rawSelector = rawSelector;
        this.parent = parent;
        this.order = order;
        this.position = position;
    }

    public SelectorList selector() {
        return selector;
    }

    public void setSelector(SelectorList selector) {
        this.selector = selector;
    }

    public boolean hasRawSelector() {
        return rawSelector != null;
    }

    public String selectorText(boolean compressed) {
        return rawSelector != null ? rawSelector : selector.toCss(compressed);
    }

    public MutableList<CssNode> children() {
        return children;
    }

    public CssRule parent() {
        return parent;
    }

    /**
     * Position of this rule in source order, used to order extended selectors.
     */
    public int order() {
        return order;
    }

    @Override
    public SourcePosition position() {
        return position;
    }

    public boolean hasDeclarations() {
        return children.anySatisfy(child -> child instanceof CssDeclaration);
    }

    public boolean isEmpty() {
        return children.isEmpty() || (rawSelector == null && selector.isEmpty());
    }

    @Override
    public String toString() {
        return selectorText(false) + " " + children;
    }
}
