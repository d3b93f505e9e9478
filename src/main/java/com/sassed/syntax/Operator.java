package com.sassed.syntax;

public enum Operator {
    OR("or", 0),
    AND("and", 1),
    EQUALS("==", 2),
    NOT_EQUALS("!=", 2),
    LESS_THAN("<", 3),
    LESS_THAN_OR_EQUALS("<=", 3),
    GREATER_THAN(">", 3),
    GREATER_THAN_OR_EQUALS(">=", 3),
    PLUS("+", 4),
    MINUS("-", 4),
    TIMES("*", 5),
    DIVIDE("/", 5),
    MODULO("%", 5);

    private final String symbol;
    private final int precedence;

    Operator(String symbol, int precedence) {
        this.symbol = symbol;
        this.precedence = precedence;
    }

    public String symbol() {
        return symbol;
    }

    public int precedence() {
        return precedence;
    }

    public static Operator fromSymbol(String symbol) {
        for (Operator operator : values()) {
            if (operator.symbol.equals(symbol)) {
                return operator;
            }
        }
        return null;
    }
}
