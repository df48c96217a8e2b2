package com.jnix.expr;

public enum NUnaryOp {
    NEG("-", new Fixity(12, Associativity.NONE)),
    NOT("!", new Fixity(7, Associativity.NONE));

    private final String symbol;
    private final Fixity fixity;

    NUnaryOp(String symbol, Fixity fixity) {
        this.symbol = symbol;
        this.fixity = fixity;
    }

    public String symbol() {
        return symbol;
    }

    public Fixity fixity() {
        return fixity;
    }
}
