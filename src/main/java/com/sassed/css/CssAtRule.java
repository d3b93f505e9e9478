package com.sassed.css;

import com.sassed.lexer.SourcePosition;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

/**
 * An at-rule in the output, such as {@code @media}, {@code @font-face} or {@code @charset}.
 * Rules without a body ({@code hasBody == false}) print as {@code @name prelude;}.
 */
public record CssAtRule(String name, String prelude, MutableList<CssNode> children, boolean hasBody,
                        SourcePosition position) implements CssNode {

    public static CssAtRule withBody(String name, String prelude, SourcePosition position) {
        return new CssAtRule(name, prelude, Lists.mutable.empty(), true, position);
    }

    public static CssAtRule statement(String name, String prelude, SourcePosition position) {
        return new CssAtRule(name, prelude, Lists.mutable.empty(), false, position);
    }

    public boolean isMedia() {
        return name.equalsIgnoreCase("media");
    }

    /**
     * {@code @keyframes} and its vendor-prefixed forms.
     */
    public boolean isKeyframes() {
        return name.toLowerCase().endsWith("keyframes");
    }
}
