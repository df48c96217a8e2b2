package com.jnix.expr;

/**
 * Binary operators. Function application is modelled as a binary operator with an empty symbol.
 */
public enum NBinaryOp {
    EQ("==", 4, Associativity.NONE),
    NEQ("!=", 4, Associativity.NONE),
    LT("<", 5, Associativity.NONE),
    LTE("<=", 5, Associativity.NONE),
    GT(">", 5, Associativity.NONE),
    GTE(">=", 5, Associativity.NONE),
    AND("&&", 3, Associativity.LEFT),
    OR("||", 2, Associativity.LEFT),
    IMPL("->", 1, Associativity.RIGHT),
    UPDATE("//", 6, Associativity.RIGHT),
    PLUS("+", 8, Associativity.LEFT),
    MINUS("-", 8, Associativity.LEFT),
    MULT("*", 9, Associativity.LEFT),
    DIV("/", 9, Associativity.LEFT),
    CONCAT("++", 10, Associativity.RIGHT),
    APP("", 13, Associativity.LEFT);

    private final String symbol;
    private final Fixity fixity;

    NBinaryOp(String symbol, int precedence, Associativity associativity) {
        this.symbol = symbol;
        this.fixity = new Fixity(precedence, associativity);
    }

    public String symbol() {
        return symbol;
    }

    public Fixity fixity() {
        return fixity;
    }
}
