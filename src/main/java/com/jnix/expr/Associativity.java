package com.jnix.expr;

public enum Associativity {
    LEFT,
    RIGHT,
    NONE
}
