package com.sassed.selector;

import com.sassed.selector.SimpleSelector.Id;
import com.sassed.selector.SimpleSelector.Pseudo;
import com.sassed.selector.SimpleSelector.Type;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Simple selectors with no combinator between them, such as {@code a.active:hover}.
 */
public record CompoundSelector(List<SimpleSelector> simples) {

    public CompoundSelector {
        simples = List.copyOf(simples);
    }

    public static CompoundSelector of(SimpleSelector... simples) {
        return new CompoundSelector(List.of(simples));
    }

    public boolean hasParent() {
        return simples.stream().anyMatch(simple -> simple instanceof SimpleSelector.Parent);
    }

    public boolean hasPlaceholder() {
        return simples.stream().anyMatch(simple -> simple instanceof SimpleSelector.Placeholder);
    }

    /**
     * True when every simple selector of {@code target} also appears here.
     */
    public boolean containsAll(CompoundSelector target) {
        return simples.containsAll(target.simples);
    }

    /**
     * This compound with the simple selectors of {@code target} removed.
     */
    public CompoundSelector without(CompoundSelector target) {
        MutableList<SimpleSelector> remaining = Lists.mutable.withAll(simples);
        remaining.removeAll(target.simples);
        return new CompoundSelector(remaining);
    }

    /**
     * Merges two compounds into one that matches elements matching both, or returns null when no
     * element can (two different ids or two different element types).
     */
    public CompoundSelector unify(CompoundSelector other) {
        Type ownType = type();
        Type otherType = other.type();
        if (ownType != null && otherType != null && !ownType.isUniversal() && !otherType.isUniversal()
                && !ownType.equals(otherType)) {
            return null;
        }
        Id ownId = id();
        Id otherId = other.id();
        if (ownId != null && otherId != null && !ownId.equals(otherId)) {
            return null;
        }

        MutableList<SimpleSelector> merged = Lists.mutable.empty();
        Type type = ownType != null && !ownType.isUniversal() ? ownType : otherType != null ? otherType : ownType;
        if (type != null) {
            merged.add(type);
        }
        // pseudo selectors stay last
        addAll(merged, other.simples, false);
        addAll(merged, simples, false);
        addAll(merged, other.simples, true);
        addAll(merged, simples, true);
        return new CompoundSelector(merged);
    }

    private static void addAll(MutableList<SimpleSelector> target, List<SimpleSelector> source, boolean pseudo) {
        for (SimpleSelector simple : source) {
            if (simple instanceof Type || (simple instanceof Pseudo) != pseudo || target.contains(simple)) {
                continue;
            }
            target.add(simple);
        }
    }

    private Type type() {
        for (SimpleSelector simple : simples) {
            if (simple instanceof Type type) {
                return type;
            }
        }
        return null;
    }

    private Id id() {
        for (SimpleSelector simple : simples) {
            if (simple instanceof Id id) {
                return id;
            }
        }
        return null;
    }

    public String toCss() {
        return simples.stream().map(SimpleSelector::toCss).collect(Collectors.joining());
    }

    @Override
    public String toString() {
        return toCss();
    }
}
