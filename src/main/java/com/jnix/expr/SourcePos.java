package com.jnix.expr;

import java.util.Objects;

/**
 * A location in parsed source. Trees built through {@link Shorthands} never carry one.
 */
public record SourcePos(String sourceName, int line, int column) {
    public SourcePos {
        Objects.requireNonNull(sourceName, "sourceName");
    }

    @Override
    public String toString() {
        return sourceName + ":" + line + ":" + column;
    }
}
