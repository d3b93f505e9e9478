package com.sassed.extend;

import com.sassed.css.CssAtRule;
import com.sassed.css.CssNode;
import com.sassed.css.CssRule;
import com.sassed.error.EvalException;
import com.sassed.selector.ComplexSelector;
import com.sassed.selector.ComplexSelector.Component;
import com.sassed.selector.CompoundSelector;
import com.sassed.selector.SelectorList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.list.primitive.MutableIntList;
import org.eclipse.collections.api.set.MutableSet;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.Sets;

import java.util.ArrayDeque;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;

/**
 * Rewrites rule selectors so that every extender also matches where its target does, then
 * removes placeholder selectors. Runs once, after evaluation, over the whole output.
 */
public class ExtendResolver {
    private final ExtendGraph graph;
    private final MutableSet<Extension> matched = Sets.mutable.empty();

    private record Origin(ComplexSelector selector, int order) {
    }

    public ExtendResolver(ExtendGraph graph) {
        this.graph = graph;
    }

    public static void resolve(List<CssNode> nodes, ExtendGraph graph) {
        new ExtendResolver(graph).resolve(nodes);
    }

    public void resolve(List<CssNode> nodes) {
        graph.checkCycles();
        visit(nodes, null);
        for (int id = 0; id < graph.size(); id++) {
            for (Extension extension : graph.extensionsOf(id)) {
                if (!extension.optional() && !matched.contains(extension)) {
                    String target = extension.target().toCss();
                    throw new EvalException("\"" + extension.extender() + "\" failed to @extend \"" + target + "\".\n"
                            + "The selector \"" + target + "\" was not found.\n"
                            + "Use \"@extend " + target + " !optional\" if the extend should be able to fail.",
                            extension.position());
                }
            }
        }
    }

    private void visit(List<CssNode> nodes, String media) {
        for (CssNode node : nodes) {
            if (node instanceof CssRule rule && !rule.hasRawSelector()) {
                rule.setSelector(extend(rule, media));
            } else if (node instanceof CssAtRule atRule) {
                visit(atRule.children(), atRule.isMedia() ? atRule.prelude() : media);
            }
        }
    }

    private SelectorList extend(CssRule rule, String media) {
        MutableList<Origin> result = Lists.mutable.empty();
        MutableSet<ComplexSelector> seen = Sets.mutable.empty();
        Deque<ComplexSelector> queue = new ArrayDeque<>();
        for (ComplexSelector selector : rule.selector().selectors()) {
            if (seen.add(selector)) {
                result.add(new Origin(selector, rule.order()));
                queue.add(selector);
            }
        }

        if (!graph.isEmpty()) {
            while (!queue.isEmpty()) {
                ComplexSelector selector = queue.poll();
                List<Component> components = selector.components();
                for (int i = 0; i < components.size(); i++) {
                    CompoundSelector compound = components.get(i).compound();
                    MutableIntList targets = graph.targetsMatching(compound);
                    for (int t = 0; t < targets.size(); t++) {
                        int target = targets.get(t);
                        for (Extension extension : graph.extensionsOf(target)) {
                            if (!extension.appliesIn(media)) {
                                continue;
                            }
                            matched.add(extension);
                            for (ComplexSelector extended : extendAt(selector, i, graph.target(target), extension.extender())) {
                                if (seen.add(extended)) {
                                    result.add(new Origin(extended, extension.order()));
                                    queue.add(extended);
                                }
                            }
                        }
                    }
                }
            }
        }

        MutableList<ComplexSelector> selectors = result
                .reject(origin -> origin.selector().hasPlaceholder())
                .sortThis(Comparator.comparingInt(Origin::order))
                .collect(Origin::selector);
        return new SelectorList(selectors);
    }

    /**
     * Replaces {@code target} within the {@code index}-th compound of {@code selector} by the
     * extender, weaving the extender's ancestors with the selector's own.
     */
    static List<ComplexSelector> extendAt(ComplexSelector selector, int index, CompoundSelector target,
                                          ComplexSelector extender) {
        List<Component> components = selector.components();
        Component matchedComponent = components.get(index);
        CompoundSelector remaining = matchedComponent.compound().without(target);
        CompoundSelector unified = remaining.simples().isEmpty()
                ? extender.last()
                : remaining.unify(extender.last());
        if (unified == null) {
            return List.of();
        }

        List<Component> ownPrefix = components.subList(0, index);
        List<Component> suffix = components.subList(index + 1, components.size());
        List<Component> extenderComponents = extender.components();
        List<Component> extenderPrefix = extenderComponents.subList(0, extenderComponents.size() - 1);
        String extenderCombinator = extenderComponents.get(extenderComponents.size() - 1).combinator();

        MutableList<ComplexSelector> results = Lists.mutable.empty();
        if (extenderPrefix.isEmpty()) {
            results.add(build(ownPrefix, List.of(), matchedComponent.combinator(), unified, suffix));
        } else if (ownPrefix.isEmpty()) {
            String combinator = matchedComponent.combinator().isEmpty() || matchedComponent.combinator().equals(" ")
                    ? extenderCombinator : matchedComponent.combinator();
            results.add(build(extenderPrefix, List.of(), combinator, unified, suffix));
        } else {
            String combinator = matchedComponent.combinator().equals(" ") ? extenderCombinator : matchedComponent.combinator();
            results.add(build(ownPrefix, extenderPrefix, combinator, unified, suffix));
            ComplexSelector reversed = build(extenderPrefix, ownPrefix, combinator, unified, suffix);
            if (!results.contains(reversed)) {
                results.add(reversed);
            }
        }
        return results;
    }

    private static ComplexSelector build(List<Component> first, List<Component> second, String combinator,
                                         CompoundSelector compound, List<Component> suffix) {
        MutableList<Component> components = Lists.mutable.withAll(first);
        for (int i = 0; i < second.size(); i++) {
            Component component = second.get(i);
            if (i == 0 && !components.isEmpty() && component.combinator().isEmpty()) {
                components.add(new Component(" ", component.compound()));
            } else {
                components.add(component);
            }
        }
        components.add(new Component(components.isEmpty() ? leading(combinator) : combinator, compound));
        components.addAll(suffix);
        return new ComplexSelector(components);
    }

    private static String leading(String combinator) {
        return combinator.equals(" ") ? "" : combinator;
    }
}
