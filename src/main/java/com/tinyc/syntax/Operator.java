package com.tinyc.syntax;

import java.util.Optional;

public enum Operator {
    SUM("sum", "+"),
    SUB("sub", "-"),
    DIV("div", "/"),
    MUL("mul", "*");

    private final String keyword;
    private final String symbol;

    Operator(String keyword, String symbol) {
        this.keyword = keyword;
        this.symbol = symbol;
    }

    /** The prefix-notation keyword, e.g. {@code sum}. */
    public String keyword() {
        return keyword;
    }

    /** The infix symbol emitted by the code generator, e.g. {@code +}. */
    public String symbol() {
        return symbol;
    }

    public static Optional<Operator> fromKeyword(String keyword) {
        for (Operator operator : values()) {
            if (operator.keyword.equals(keyword)) {
                return Optional.of(operator);
            }
        }
        return Optional.empty();
    }
}
