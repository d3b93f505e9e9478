package com.sassed.value;

import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered map with unique keys. As a list, each entry is a two-element space list.
 */
public record SassMap(Map<Value, Value> entries) implements Value {
    public static final SassMap EMPTY = new SassMap(Map.of());

    public SassMap {
        entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    public Value get(Value key) {
        Value value = entries.get(key);
        return value != null ? value : SassNull.INSTANCE;
    }

    @Override
    public String typeName() {
        return "map";
    }

    @Override
    public List<Value> asList() {
        MutableList<Value> pairs = Lists.mutable.empty();
        entries.forEach((key, value) -> pairs.add(new SassList(List.of(key, value), ListSeparator.SPACE)));
        return pairs;
    }

    @Override
    public ListSeparator separator() {
        return ListSeparator.COMMA;
    }
}
