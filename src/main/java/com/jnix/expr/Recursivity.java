package com.jnix.expr;

/**
 * Tag on attribute sets. Whether {@code rec} bindings see each other is decided by an evaluator,
 * not here.
 */
public enum Recursivity {
    NON_RECURSIVE,
    RECURSIVE
}
