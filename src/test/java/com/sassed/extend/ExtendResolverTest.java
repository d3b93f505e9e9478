package com.sassed.extend;

import com.sassed.css.CssAtRule;
import com.sassed.css.CssNode;
import com.sassed.css.CssRule;
import com.sassed.error.EvalException;
import com.sassed.lexer.SourcePosition;
import com.sassed.selector.SelectorParser;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ExtendResolverTest {

    private final ExtendGraph graph = new ExtendGraph();
    private final List<CssNode> nodes = new ArrayList<>();

    private CssRule rule(String selector, int order) {
        CssRule rule = new CssRule(SelectorParser.parse(selector), null, order, SourcePosition.UNKNOWN);
        nodes.add(rule);
        return rule;
    }

    private void extend(String extender, String target, int order) {
        extend(extender, target, order, false, null);
    }

    private void extend(String extender, String target, int order, boolean optional, String media) {
        graph.add(new Extension(SelectorParser.parse(target).selectors().get(0).last(),
                SelectorParser.parse(extender).selectors().get(0), optional, media, order, SourcePosition.UNKNOWN));
    }

    private void resolve() {
        ExtendResolver.resolve(nodes, graph);
    }

    // ============================================================
    // Basic extends
    // ============================================================

    @Test
    public void testExtenderIsAddedInDeclarationOrder() {
        extend(".a", ".b", 0);
        CssRule b = rule(".b", 1);
        resolve();
        assertEquals(".a, .b", b.selectorText(false));
    }

    @Test
    public void testExtenderAfterTarget() {
        CssRule b = rule(".b", 0);
        extend(".a", ".b", 1);
        resolve();
        assertEquals(".b, .a", b.selectorText(false));
    }

    @Test
    public void testRepeatedExtendAddsSelectorOnce() {
        CssRule b = rule(".b", 0);
        extend(".a", ".b", 1);
        extend(".a", ".b", 2);
        resolve();
        assertEquals(".b, .a", b.selectorText(false));
    }

    @Test
    public void testChainedExtends() {
        CssRule b = rule(".b", 0);
        extend(".a", ".b", 1);
        extend(".c", ".a", 2);
        resolve();
        assertEquals(".b, .a, .c", b.selectorText(false));
    }

    @Test
    public void testTargetInsideCompound() {
        CssRule rule = rule("a.b", 0);
        extend(".c", ".b", 1);
        resolve();
        assertEquals("a.b, a.c", rule.selectorText(false));
    }

    @Test
    public void testTargetInsideComplexSelector() {
        CssRule rule = rule(".list .b:hover", 0);
        extend(".c", ".b", 1);
        resolve();
        assertEquals(".list .b:hover, .list .c:hover", rule.selectorText(false));
    }

    @Test
    public void testExtenderWithAncestorsIsWoven() {
        CssRule rule = rule(".p .b", 0);
        extend(".q .c", ".b", 1);
        resolve();
        assertEquals(".p .b, .p .q .c, .q .p .c", rule.selectorText(false));
    }

    @Test
    public void testConflictingIdsAreNotUnified() {
        CssRule rule = rule("#x.b", 0);
        extend("#y", ".b", 1);
        resolve();
        assertEquals("#x.b", rule.selectorText(false));
    }

    // ============================================================
    // Placeholders
    // ============================================================

    @Test
    public void testPlaceholderIsReplaced() {
        CssRule rule = rule("%tip", 1);
        extend(".note", "%tip", 0);
        resolve();
        assertEquals(".note", rule.selectorText(false));
    }

    @Test
    public void testUnusedPlaceholderLeavesEmptySelector() {
        CssRule rule = rule("%tip, .x", 0);
        resolve();
        assertEquals(".x", rule.selectorText(false));

        CssRule only = new CssRule(SelectorParser.parse("%only"), null, 1, SourcePosition.UNKNOWN);
        ExtendResolver.resolve(List.of(only), new ExtendGraph());
        assertTrue(only.selector().isEmpty());
    }

    // ============================================================
    // Media scoping
    // ============================================================

    @Test
    public void testExtendInsideMediaOnlyAppliesThere() {
        CssRule outside = rule(".b", 0);
        CssAtRule media = CssAtRule.withBody("media", "screen", SourcePosition.UNKNOWN);
        CssRule inside = new CssRule(SelectorParser.parse(".b"), null, 1, SourcePosition.UNKNOWN);
        media.children().add(inside);
        nodes.add(media);
        extend(".a", ".b", 2, false, "screen");
        resolve();
        assertEquals(".b", outside.selectorText(false));
        assertEquals(".b, .a", inside.selectorText(false));
    }

    @Test
    public void testExtendOutsideMediaAppliesInside() {
        CssAtRule media = CssAtRule.withBody("media", "print", SourcePosition.UNKNOWN);
        CssRule inside = new CssRule(SelectorParser.parse(".b"), null, 1, SourcePosition.UNKNOWN);
        media.children().add(inside);
        nodes.add(media);
        extend(".a", ".b", 0);
        resolve();
        assertEquals(".a, .b", inside.selectorText(false));
    }

    @Test
    public void testRawSelectorsAreSkipped() {
        CssRule keyframe = new CssRule("50%", null, 0, SourcePosition.UNKNOWN);
        nodes.add(keyframe);
        extend(".a", ".b", 1, true, null);
        resolve();
        assertEquals("50%", keyframe.selectorText(false));
    }

    // ============================================================
    // Errors
    // ============================================================

    @Test
    public void testFailedExtend() {
        rule(".a", 0);
        extend(".x", ".missing", 1);
        EvalException e = assertThrows(EvalException.class, this::resolve);
        assertTrue(e.reason().startsWith("\".x\" failed to @extend \".missing\"."), e.reason());
    }

    @Test
    public void testOptionalExtendMayFail() {
        CssRule rule = rule(".a", 0);
        extend(".x", ".missing", 1, true, null);
        resolve();
        assertEquals(".a", rule.selectorText(false));
    }

    @Test
    public void testCircularExtend() {
        rule(".a", 0);
        rule(".b", 1);
        extend(".a", ".b", 2);
        extend(".b", ".a", 3);
        EvalException e = assertThrows(EvalException.class, this::resolve);
        assertTrue(e.reason().startsWith("Circular @extend between"), e.reason());
    }

    @Test
    public void testSelfExtend() {
        rule(".a", 0);
        extend(".a", ".a", 1);
        EvalException e = assertThrows(EvalException.class, this::resolve);
        assertEquals("\".a\" cannot extend itself", e.reason());
    }
}
