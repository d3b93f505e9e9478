package com.sassed.selector;

import com.sassed.error.EvalException;
import com.sassed.selector.ComplexSelector.Component;
import com.sassed.selector.SimpleSelector.ClassName;
import com.sassed.selector.SimpleSelector.Id;
import com.sassed.selector.SimpleSelector.Parent;
import com.sassed.selector.SimpleSelector.Placeholder;
import com.sassed.selector.SimpleSelector.Pseudo;
import com.sassed.selector.SimpleSelector.Type;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.List;
import java.util.stream.Collectors;

public record SelectorList(List<ComplexSelector> selectors) {

    public SelectorList {
        selectors = List.copyOf(selectors);
    }

    /**
     * Joins this (child) selector list to its parent: every {@code &} is replaced by each
     * parent selector, and selectors without {@code &} become descendants of the parent.
     * A null parent means top level, where {@code &} is an error.
     */
    public SelectorList resolveParent(SelectorList parent) {
        if (parent == null) {
            for (ComplexSelector selector : selectors) {
                if (selector.hasParent()) {
                    throw new EvalException("Base-level rules cannot contain the parent-selector-referencing character '&'.");
                }
            }
            return this;
        }
        MutableList<ComplexSelector> resolved = Lists.mutable.empty();
        for (ComplexSelector base : parent.selectors) {
            for (ComplexSelector child : selectors) {
                resolved.add(child.hasParent() ? substitute(child, base) : base.append(child));
            }
        }
        return new SelectorList(resolved);
    }

    private static ComplexSelector substitute(ComplexSelector child, ComplexSelector base) {
        MutableList<Component> components = Lists.mutable.empty();
        for (Component component : child.components()) {
            CompoundSelector compound = component.compound();
            if (!compound.hasParent()) {
                components.add(component);
                continue;
            }
            Parent parentRef = (Parent) compound.simples().get(0);
            MutableList<Component> baseComponents = Lists.mutable.withAll(base.components());
            Component baseLast = baseComponents.remove(baseComponents.size() - 1);
            MutableList<SimpleSelector> merged = Lists.mutable.withAll(baseLast.compound().simples());
            if (!parentRef.suffix().isEmpty()) {
                if (merged.isEmpty()) {
                    throw new EvalException("Invalid parent selector for \"" + compound.toCss() + "\"");
                }
                merged.set(merged.size() - 1, withSuffix(merged.getLast(), parentRef.suffix()));
            }
            merged.addAll(compound.simples().subList(1, compound.simples().size()));
            baseComponents.add(new Component(baseLast.combinator(), new CompoundSelector(merged)));
            if (components.isEmpty()) {
                if (!component.combinator().isEmpty() && !component.combinator().equals(" ")) {
                    throw new EvalException("Invalid parent selector position in \"" + child.toCss(false) + "\"");
                }
                components.addAll(baseComponents);
            } else {
                Component first = baseComponents.get(0);
                baseComponents.set(0, new Component(component.combinator(), first.compound()));
                components.addAll(baseComponents);
            }
        }
        return new ComplexSelector(components);
    }

    private static SimpleSelector withSuffix(SimpleSelector simple, String suffix) {
        if (simple instanceof ClassName c) {
            return new ClassName(c.name() + suffix);
        }
        if (simple instanceof Id id) {
            return new Id(id.name() + suffix);
        }
        if (simple instanceof Placeholder p) {
            return new Placeholder(p.name() + suffix);
        }
        if (simple instanceof Type t && !t.isUniversal()) {
            return new Type(t.name() + suffix);
        }
        if (simple instanceof Pseudo p && p.argument() == null) {
            return new Pseudo(p.name() + suffix, null, p.element());
        }
        throw new EvalException("Invalid parent selector for suffix \"" + suffix + "\" on \"" + simple.toCss() + "\"");
    }

    public boolean isEmpty() {
        return selectors.isEmpty();
    }

    public String toCss(boolean compressed) {
        return selectors.stream()
                .map(selector -> selector.toCss(compressed))
                .collect(Collectors.joining(compressed ? "," : ", "));
    }

    @Override
    public String toString() {
        return toCss(false);
    }
}
