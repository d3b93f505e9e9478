package com.sassed.value;

import java.util.List;

public record SassNull() implements Value {
    public static final SassNull INSTANCE = new SassNull();

    @Override
    public boolean isTruthy() {
        return false;
    }

    @Override
    public String typeName() {
        return "null";
    }

    @Override
    public List<Value> asList() {
        return List.of();
    }
}
