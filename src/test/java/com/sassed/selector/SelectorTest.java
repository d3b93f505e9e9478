package com.sassed.selector;

import com.sassed.error.EvalException;
import com.sassed.error.ParseException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class SelectorTest {

    private String resolve(String child, String parent) {
        SelectorList parentList = parent == null ? null : SelectorParser.parse(parent);
        return SelectorParser.parse(child).resolveParent(parentList).toCss(false);
    }

    private CompoundSelector compound(String text) {
        return SelectorParser.parse(text).selectors().get(0).last();
    }

    // ============================================================
    // Parsing and printing
    // ============================================================

    @Test
    public void testNormalizedOutput() {
        SelectorList list = SelectorParser.parse("a.b:hover ,  #x>.y");
        assertEquals("a.b:hover, #x > .y", list.toCss(false));
        assertEquals("a.b:hover,#x>.y", list.toCss(true));
    }

    @Test
    public void testSimpleSelectorKinds() {
        CompoundSelector compound = compound("input.field#name[type=\"text\"]:not(.a)::before");
        assertEquals(6, compound.simples().size());
        assertEquals(new SimpleSelector.Type("input"), compound.simples().get(0));
        assertEquals(new SimpleSelector.Attribute("type=\"text\""), compound.simples().get(3));
        assertEquals(new SimpleSelector.Pseudo("not", ".a", false), compound.simples().get(4));
        assertEquals(new SimpleSelector.Pseudo("before", null, true), compound.simples().get(5));
    }

    @Test
    public void testDescendantAndSiblingCombinators() {
        assertEquals("a b + c ~ d", SelectorParser.parse("a  b+c ~d").toCss(false));
    }

    @Test
    public void testPlaceholderDetection() {
        assertTrue(SelectorParser.parse("a %tip").selectors().get(0).hasPlaceholder());
        assertFalse(SelectorParser.parse("a .tip").selectors().get(0).hasPlaceholder());
    }

    @Test
    public void testInvalidSelector() {
        assertThrows(ParseException.class, () -> SelectorParser.parse("a{"));
        assertThrows(ParseException.class, () -> SelectorParser.parse(".a, , .b"));
    }

    // ============================================================
    // Parent resolution
    // ============================================================

    @Test
    public void testDescendantOfEveryParent() {
        assertEquals(".a .c, .a .d, .b .c, .b .d", resolve(".c, .d", ".a, .b"));
    }

    @Test
    public void testParentWithPseudoClass() {
        assertEquals(".a:hover", resolve("&:hover", ".a"));
    }

    @Test
    public void testParentSuffix() {
        assertEquals(".nav .btn-active", resolve("&-active", ".nav .btn"));
    }

    @Test
    public void testParentInTheMiddle() {
        assertEquals(".x .a .b", resolve(".x &", ".a .b"));
    }

    @Test
    public void testLeadingCombinator() {
        assertEquals("ul > li", resolve("> li", "ul"));
    }

    @Test
    public void testTopLevelParentIsAnError() {
        assertThrows(EvalException.class, () -> resolve("&:hover", null));
    }

    @Test
    public void testTopLevelSelectorIsUnchanged() {
        assertEquals("a b", resolve("a b", null));
    }

    @Test
    public void testSuffixOnAttributeIsAnError() {
        assertThrows(EvalException.class, () -> resolve("&-x", "[type]"));
    }

    // ============================================================
    // Compound operations
    // ============================================================

    @Test
    public void testUnifyKeepsPseudoLast() {
        assertEquals(".b.a:hover", compound(".a").unify(compound(".b:hover")).toCss());
    }

    @Test
    public void testUnifyTypeComesFirst() {
        assertEquals("a.b", compound(".b").unify(compound("a")).toCss());
        assertEquals("a", compound("*").unify(compound("a")).toCss());
    }

    @Test
    public void testUnifyConflicts() {
        assertNull(compound("#x").unify(compound("#y")));
        assertNull(compound("a").unify(compound("b")));
    }

    @Test
    public void testContainsAllAndWithout() {
        CompoundSelector compound = compound("a.b.c");
        assertTrue(compound.containsAll(compound(".c.b")));
        assertFalse(compound.containsAll(compound(".d")));
        assertEquals("a.c", compound.without(compound(".b")).toCss());
    }
}
