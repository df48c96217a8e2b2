package com.jnix.expr;

import java.util.Objects;

/**
 * One segment of a string literal: literal text, or an interpolated {@code ${...}} expression.
 */
public sealed interface StrPart {
    record Plain(String text) implements StrPart {
        public Plain {
            Objects.requireNonNull(text, "text");
        }
    }

    record Antiquoted(NExpr expression) implements StrPart {
        public Antiquoted {
            Objects.requireNonNull(expression, "expression");
        }
    }
}
