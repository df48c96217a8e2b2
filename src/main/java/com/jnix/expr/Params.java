package com.jnix.expr;

import org.eclipse.collections.api.list.ImmutableList;

import java.util.Objects;
import java.util.Optional;

/**
 * The left-hand side of a lambda: a single name ({@code x: ...}) or a destructuring set
 * ({@code { a, b ? 1, ... } @ args: ...}).
 */
public sealed interface Params {
    record Param(String name) implements Params {
        public Param {
            Objects.requireNonNull(name, "name");
        }
    }

    record ParamSet(ImmutableList<Formal> formals, boolean variadic, Optional<String> alias)
            implements Params {
        public ParamSet {
            Objects.requireNonNull(formals, "formals");
            Objects.requireNonNull(alias, "alias");
        }
    }

    record Formal(String name, Optional<NExpr> defaultValue) {
        public Formal {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(defaultValue, "defaultValue");
        }
    }
}
