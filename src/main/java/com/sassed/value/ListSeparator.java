package com.sassed.value;

public enum ListSeparator {
    SPACE(" "),
    COMMA(", "),
    UNDECIDED(" ");

    private final String text;

    ListSeparator(String text) {
        this.text = text;
    }

    public String text(boolean compressed) {
        return compressed && this == COMMA ? "," : text;
    }
}
