package com.sassed.value;

public record SassString(String text, boolean quoted) implements Value {
    public static final SassString EMPTY = new SassString("", false);

    public static SassString quoted(String text) {
        return new SassString(text, true);
    }

    public static SassString unquoted(String text) {
        return new SassString(text, false);
    }

    @Override
    public String typeName() {
        return "string";
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof SassString string && string.text.equals(text);
    }

    @Override
    public int hashCode() {
        return text.hashCode();
    }
}
