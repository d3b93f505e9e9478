package com.sassed.eval;

import com.sassed.value.SassNull;
import com.sassed.value.Value;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Lexical scopes stored in an arena and referenced by index. Scope 0 is the global scope.
 * Mixins and functions remember the index of the scope they were declared in, so a call can
 * open its own scope on top of that one instead of holding a live reference.
 * <p>
 * Leaving a block only means its index is no longer used for lookups; the scope itself stays
 * in the arena until the compile ends. An index captured by a mixin, function or content block
 * therefore never dangles, and the whole arena is dropped with the {@code Environment} after
 * one compile.
 */
public class Environment {
    public static final int GLOBAL = 0;

    private final MutableList<Scope> scopes = Lists.mutable.empty();

    private static final class Scope {
        private final int parent;
        private final boolean transparent;
        private final Map<String, Value> variables = new LinkedHashMap<>();
        private final Map<String, UserCallable> mixins = new LinkedHashMap<>();
        private final Map<String, UserCallable> functions = new LinkedHashMap<>();

        private Scope(int parent, boolean transparent) {
            this.parent = parent;
            this.transparent = transparent;
        }
    }

    public Environment() {
        scopes.add(new Scope(-1, false));
    }

    /**
     * Opens a scope nested in {@code parent} and returns its index.
     */
    public int push(int parent) {
        return push(parent, false);
    }

    /**
     * Opens a scope for a control directive body. Assignments in a chain of such scopes that
     * starts at the global scope still reach existing global variables.
     */
    public int pushTransparent(int parent) {
        return push(parent, true);
    }

    private int push(int parent, boolean transparent) {
        scopes.add(new Scope(parent, transparent));
        return scopes.size() - 1;
    }

    public int parentOf(int scope) {
        return scopes.get(scope).parent;
    }

    public Value lookup(int scope, String name) {
        String key = normalize(name);
        for (int index = scope; index >= 0; index = scopes.get(index).parent) {
            Value value = scopes.get(index).variables.get(key);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    public boolean isGlobal(String name) {
        return scopes.get(GLOBAL).variables.containsKey(normalize(name));
    }

    /**
     * Assigns a variable. {@code global} writes to the global scope; otherwise the innermost
     * non-global scope that already holds the name is updated, or the variable is created in
     * {@code scope}. Control directive bodies at the top level update globals. With {@code isDefault}, an existing non-null value is kept.
     */
    public void assign(int scope, String name, Value value, boolean isDefault, boolean global) {
        String key = normalize(name);
        int target = global ? GLOBAL : findLocal(scope, key);
        Map<String, Value> variables = scopes.get(target).variables;
        if (isDefault) {
            Value existing = global ? variables.get(key) : lookup(scope, key);
            if (existing != null && !(existing instanceof SassNull)) {
                return;
            }
        }
        variables.put(key, value);
    }

    /**
     * Binds a name in exactly {@code scope}, shadowing outer definitions. Used for parameters
     * and loop variables.
     */
    public void define(int scope, String name, Value value) {
        scopes.get(scope).variables.put(normalize(name), value);
    }

    private int findLocal(int scope, String key) {
        boolean transparent = true;
        for (int index = scope; index > GLOBAL; index = scopes.get(index).parent) {
            if (scopes.get(index).variables.containsKey(key)) {
                return index;
            }
            transparent &= scopes.get(index).transparent;
        }
        if (transparent && scopes.get(GLOBAL).variables.containsKey(key)) {
            return GLOBAL;
        }
        return scope;
    }

    public void defineMixin(int scope, UserCallable mixin) {
        scopes.get(scope).mixins.put(normalize(mixin.name()), mixin);
    }

    public UserCallable findMixin(int scope, String name) {
        String key = normalize(name);
        for (int index = scope; index >= 0; index = scopes.get(index).parent) {
            UserCallable mixin = scopes.get(index).mixins.get(key);
            if (mixin != null) {
                return mixin;
            }
        }
        return null;
    }

    public void defineFunction(int scope, UserCallable function) {
        scopes.get(scope).functions.put(normalize(function.name()), function);
    }

    public UserCallable findFunction(int scope, String name) {
        String key = normalize(name);
        for (int index = scope; index >= 0; index = scopes.get(index).parent) {
            UserCallable function = scopes.get(index).functions.get(key);
            if (function != null) {
                return function;
            }
        }
        return null;
    }

    public int size() {
        return scopes.size();
    }

    /**
     * Sass treats {@code -} and {@code _} in names as the same character.
     */
    public static String normalize(String name) {
        return name.replace('_', '-');
    }
}
