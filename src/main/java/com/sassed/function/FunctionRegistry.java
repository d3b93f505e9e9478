package com.sassed.function;

import com.sassed.syntax.Parser;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Maps;

/**
 * Name to built-in lookup. Signatures are written in Sass syntax, e.g.
 * {@code "lighten($color, $amount)"}, and parsed by the regular parameter parser.
 */
public class FunctionRegistry {
    private final MutableMap<String, BuiltinFunction> functions = Maps.mutable.empty();

    public static FunctionRegistry standard() {
        FunctionRegistry registry = new FunctionRegistry();
        ColorFunctions.register(registry);
        MathFunctions.register(registry);
        StringFunctions.register(registry);
        ListFunctions.register(registry);
        MapFunctions.register(registry);
        IntrospectionFunctions.register(registry);
        return registry;
    }

    public void define(String signature, BuiltinFunction.Body body) {
        int open = signature.indexOf('(');
        String name = signature.substring(0, open);
        String parameters = signature.substring(open + 1, signature.lastIndexOf(')'));
        functions.put(normalize(name), new BuiltinFunction(name, Parser.parseParameters(parameters), body));
    }

    public BuiltinFunction get(String name) {
        return functions.get(normalize(name));
    }

    public boolean contains(String name) {
        return functions.containsKey(normalize(name));
    }

    private static String normalize(String name) {
        return name.replace('_', '-');
    }
}
