package com.sassed.function;

import com.sassed.value.ListSeparator;
import com.sassed.value.SassBoolean;
import com.sassed.value.SassList;
import com.sassed.value.SassMap;
import com.sassed.value.Value;
import org.eclipse.collections.impl.factory.Lists;

import java.util.LinkedHashMap;
import java.util.Map;

final class MapFunctions {

    private MapFunctions() {
    }

    static void register(FunctionRegistry registry) {
        registry.define("map-get($map, $key)", args -> args.map("map").get(args.value("key")));

        registry.define("map-merge($map1, $map2)", args -> {
            Map<Value, Value> merged = new LinkedHashMap<>(args.map("map1").entries());
            merged.putAll(args.map("map2").entries());
            return new SassMap(merged);
        });

        registry.define("map-remove($map, $keys...)", args -> {
            Map<Value, Value> remaining = new LinkedHashMap<>(args.map("map").entries());
            for (Value key : args.list("keys")) {
                remaining.remove(key);
            }
            return new SassMap(remaining);
        });

        registry.define("map-keys($map)", args ->
                new SassList(Lists.mutable.withAll(args.map("map").entries().keySet()), ListSeparator.COMMA));
        registry.define("map-values($map)", args ->
                new SassList(Lists.mutable.withAll(args.map("map").entries().values()), ListSeparator.COMMA));
        registry.define("map-has-key($map, $key)", args ->
                SassBoolean.of(args.map("map").entries().containsKey(args.value("key"))));

        registry.define("keywords($args)", args -> {
            if (args.value("args") instanceof SassList list) {
                return args.context().keywordsOf(list);
            }
            throw args.error("argument `$args` of `keywords($args)` must be an argument list");
        });
    }
}
