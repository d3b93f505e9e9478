package com.sassed.selector;

import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.List;

/**
 * Compound selectors joined by combinators, e.g. {@code nav > ul li}.
 */
public record ComplexSelector(List<Component> components) {

    /**
     * A compound and the combinator in front of it: {@code ""} for none (only on the first
     * component), {@code " "} for descendant, or one of {@code > + ~}. The first component may
     * carry a leading combinator, as in a nested {@code > li}.
     */
    public record Component(String combinator, CompoundSelector compound) {
    }

    public ComplexSelector {
        components = List.copyOf(components);
    }

    public static ComplexSelector of(CompoundSelector compound) {
        return new ComplexSelector(List.of(new Component("", compound)));
    }

    public CompoundSelector last() {
        return components.get(components.size() - 1).compound();
    }

    public boolean hasParent() {
        return components.stream().anyMatch(component -> component.compound().hasParent());
    }

    public boolean hasPlaceholder() {
        return components.stream().anyMatch(component -> component.compound().hasPlaceholder());
    }

    public boolean hasLeadingCombinator() {
        return !components.isEmpty() && !components.get(0).combinator().isEmpty()
                && !components.get(0).combinator().equals(" ");
    }

    /**
     * Appends {@code child}'s components as descendants (or with the child's own leading
     * combinator) of this selector.
     */
    public ComplexSelector append(ComplexSelector child) {
        MutableList<Component> joined = Lists.mutable.withAll(components);
        for (int i = 0; i < child.components.size(); i++) {
            Component component = child.components.get(i);
            if (i == 0 && component.combinator().isEmpty()) {
                joined.add(new Component(" ", component.compound()));
            } else {
                joined.add(component);
            }
        }
        return new ComplexSelector(joined);
    }

    public String toCss(boolean compressed) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < components.size(); i++) {
            Component component = components.get(i);
            String combinator = component.combinator();
            if (combinator.equals(" ")) {
                if (i > 0) {
                    sb.append(' ');
                }
            } else if (!combinator.isEmpty()) {
                if (compressed) {
                    sb.append(combinator);
                } else if (i == 0) {
                    sb.append(combinator).append(' ');
                } else {
                    sb.append(' ').append(combinator).append(' ');
                }
            }
            sb.append(component.compound().toCss());
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return toCss(false);
    }
}
