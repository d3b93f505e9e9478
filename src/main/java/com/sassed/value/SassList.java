package com.sassed.value;

import java.util.List;

public record SassList(List<Value> items, ListSeparator separator, boolean bracketed) implements Value {
    public static final SassList EMPTY = new SassList(List.of(), ListSeparator.UNDECIDED, false);

    public SassList {
        items = List.copyOf(items);
    }

    public SassList(List<Value> items, ListSeparator separator) {
        this(items, separator, false);
    }

    @Override
    public String typeName() {
        return "list";
    }

    @Override
    public List<Value> asList() {
        return items;
    }
}
