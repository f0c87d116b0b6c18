package com.twbconvert.translate.dax;

/** Binary operators with their DAX precedence; higher binds tighter. */
public enum DaxOperator {
    POWER("^", 7),
    MULTIPLY("*", 5),
    DIVIDE("/", 5),
    ADD("+", 4),
    SUBTRACT("-", 4),
    CONCATENATE("&", 3),
    EQUALS("=", 2),
    NOT_EQUALS("<>", 2),
    LESS("<", 2),
    LESS_OR_EQUAL("<=", 2),
    GREATER(">", 2),
    GREATER_OR_EQUAL(">=", 2),
    AND("&&", 1),
    OR("||", 0);

    private final String symbol;
    private final int precedence;

    DaxOperator(String symbol, int precedence) {
        this.symbol = symbol;
        this.precedence = precedence;
    }

    public String getSymbol() {
        return symbol;
    }

    public int getPrecedence() {
        return precedence;
    }
}
