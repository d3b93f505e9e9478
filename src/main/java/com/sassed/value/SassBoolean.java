package com.sassed.value;

public record SassBoolean(boolean value) implements Value {
    public static final SassBoolean TRUE = new SassBoolean(true);
    public static final SassBoolean FALSE = new SassBoolean(false);

    public static SassBoolean of(boolean value) {
        return value ? TRUE : FALSE;
    }

    @Override
    public boolean isTruthy() {
        return value;
    }

    @Override
    public String typeName() {
        return "bool";
    }
}
