package com.jnix.expr;

import java.util.Objects;

/**
 * How tightly an operator binds when printed without parentheses. A higher precedence binds
 * tighter. The tree itself never needs this; printers do.
 */
public record Fixity(int precedence, Associativity associativity) {
    public static final Fixity LAMBDA = new Fixity(0, Associativity.RIGHT);
    public static final Fixity HAS_ATTR = new Fixity(11, Associativity.NONE);
    public static final Fixity SELECT = new Fixity(14, Associativity.LEFT);

    public Fixity {
        Objects.requireNonNull(associativity, "associativity");
    }

    public boolean bindsTighterThan(Fixity other) {
        return precedence > other.precedence;
    }
}
