package com.sassed.function;

import com.sassed.value.SassBoolean;
import com.sassed.value.SassList;
import com.sassed.value.SassString;
import com.sassed.value.Value;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

final class IntrospectionFunctions {
    private static final Set<String> FEATURES = Set.of("global-variable-shadowing", "extend-selector-pseudoclass",
            "units-level-3", "at-error");

    private IntrospectionFunctions() {
    }

    static void register(FunctionRegistry registry) {
        registry.define("type-of($value)", args -> SassString.unquoted(args.value("value").typeName()));
        registry.define("inspect($value)", args -> SassString.unquoted(args.formatter().inspect(args.value("value"))));

        registry.define("variable-exists($name)", args ->
                SassBoolean.of(args.context().variableExists(args.string("name").text())));
        registry.define("global-variable-exists($name)", args ->
                SassBoolean.of(args.context().globalVariableExists(args.string("name").text())));
        registry.define("function-exists($name)", args ->
                SassBoolean.of(args.context().functionExists(args.string("name").text())));
        registry.define("mixin-exists($name)", args ->
                SassBoolean.of(args.context().mixinExists(args.string("name").text())));
        registry.define("feature-exists($feature)", args ->
                SassBoolean.of(FEATURES.contains(args.string("feature").text())));

        registry.define("call($name, $args...)", args -> {
            Value rest = args.value("args");
            Map<String, Value> keywords = new LinkedHashMap<>();
            if (rest instanceof SassList list) {
                args.context().keywordsOf(list).entries().forEach((key, value) ->
                        keywords.put(((SassString) key).text(), value));
            }
            return args.context().call(args.string("name").text(), rest.asList(), keywords);
        });

        registry.define("image-url($path, $only-path: false, $cache-buster: false)", args -> {
            String base = args.context().imagePath();
            String path = args.string("path").text();
            String url = base.isEmpty() ? path : base.replaceAll("/+$", "") + "/" + path;
            if (args.value("cache-buster") instanceof SassString buster) {
                url += "?" + buster.text();
            }
            if (args.value("only-path").isTruthy()) {
                return SassString.quoted(url);
            }
            return SassString.unquoted("url(\"" + url + "\")");
        });

        registry.define("if($condition, $if-true, $if-false)", args ->
                args.value("condition").isTruthy() ? args.value("if-true") : args.value("if-false"));
    }
}
