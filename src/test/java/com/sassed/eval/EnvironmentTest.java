package com.sassed.eval;

import com.sassed.value.SassNull;
import com.sassed.value.SassNumber;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class EnvironmentTest {

    private final Environment environment = new Environment();

    @Test
    public void testLookupWalksParents() {
        environment.assign(Environment.GLOBAL, "x", SassNumber.of(1), false, false);
        int inner = environment.push(environment.push(Environment.GLOBAL));
        assertEquals(SassNumber.of(1), environment.lookup(inner, "x"));
        assertNull(environment.lookup(inner, "y"));
    }

    @Test
    public void testDashAndUnderscoreAreTheSameName() {
        environment.assign(Environment.GLOBAL, "main_color", SassNumber.of(1), false, false);
        assertEquals(SassNumber.of(1), environment.lookup(Environment.GLOBAL, "main-color"));
        assertTrue(environment.isGlobal("main-color"));
    }

    @Test
    public void testLocalAssignmentShadowsGlobal() {
        environment.assign(Environment.GLOBAL, "x", SassNumber.of(1), false, false);
        int rule = environment.push(Environment.GLOBAL);
        environment.assign(rule, "x", SassNumber.of(2), false, false);
        assertEquals(SassNumber.of(2), environment.lookup(rule, "x"));
        assertEquals(SassNumber.of(1), environment.lookup(Environment.GLOBAL, "x"));
    }

    @Test
    public void testGlobalFlag() {
        int rule = environment.push(Environment.GLOBAL);
        environment.assign(rule, "x", SassNumber.of(3), false, true);
        assertTrue(environment.isGlobal("x"));
    }

    @Test
    public void testInnerScopeUpdatesEnclosingLocal() {
        int mixin = environment.push(Environment.GLOBAL);
        environment.define(mixin, "x", SassNumber.of(1));
        int loop = environment.pushTransparent(mixin);
        environment.assign(loop, "x", SassNumber.of(2), false, false);
        assertEquals(SassNumber.of(2), environment.lookup(mixin, "x"));
    }

    @Test
    public void testTopLevelControlScopeUpdatesGlobal() {
        environment.assign(Environment.GLOBAL, "i", SassNumber.of(0), false, false);
        int loop = environment.pushTransparent(environment.pushTransparent(Environment.GLOBAL));
        environment.assign(loop, "i", SassNumber.of(5), false, false);
        assertEquals(SassNumber.of(5), environment.lookup(Environment.GLOBAL, "i"));
    }

    @Test
    public void testDefaultKeepsExistingValue() {
        environment.assign(Environment.GLOBAL, "x", SassNumber.of(1), false, false);
        environment.assign(Environment.GLOBAL, "x", SassNumber.of(2), true, false);
        assertEquals(SassNumber.of(1), environment.lookup(Environment.GLOBAL, "x"));
    }

    @Test
    public void testDefaultReplacesNull() {
        environment.assign(Environment.GLOBAL, "x", SassNull.INSTANCE, false, false);
        environment.assign(Environment.GLOBAL, "x", SassNumber.of(2), true, false);
        assertEquals(SassNumber.of(2), environment.lookup(Environment.GLOBAL, "x"));
    }

    @Test
    public void testExitedScopeIsInvisibleButStaysAddressable() {
        int call = environment.push(Environment.GLOBAL);
        environment.define(call, "local", SassNumber.of(7));

        assertNull(environment.lookup(Environment.GLOBAL, "local"));
        assertEquals(SassNumber.of(7), environment.lookup(call, "local"));
        assertEquals(2, environment.size());
    }
}
