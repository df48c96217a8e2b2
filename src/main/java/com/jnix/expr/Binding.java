package com.jnix.expr;

import org.eclipse.collections.api.list.ImmutableList;

import java.util.Objects;
import java.util.Optional;

/**
 * An entry of a set or {@code let}: {@code path = value;} or {@code inherit (source) keys;}.
 * Positions take no part in equality, so a synthetic binding equals the parsed one.
 */
public sealed interface Binding {
    Optional<SourcePos> position();

    record NamedVar(AttrPath path, NExpr value, Optional<SourcePos> position) implements Binding {
        public NamedVar {
            Objects.requireNonNull(path, "path");
            Objects.requireNonNull(value, "value");
            Objects.requireNonNull(position, "position");
        }

        public NamedVar(AttrPath path, NExpr value) {
            this(path, value, Optional.empty());
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof NamedVar other
                && path.equals(other.path)
                && value.equals(other.value);
        }

        @Override
        public int hashCode() {
            return Objects.hash(path, value);
        }
    }

    record Inherit(Optional<NExpr> source, ImmutableList<KeyName> keys, Optional<SourcePos> position)
            implements Binding {
        public Inherit {
            Objects.requireNonNull(source, "source");
            Objects.requireNonNull(keys, "keys");
            Objects.requireNonNull(position, "position");
        }

        public Inherit(Optional<NExpr> source, ImmutableList<KeyName> keys) {
            this(source, keys, Optional.empty());
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Inherit other
                && source.equals(other.source)
                && keys.equals(other.keys);
        }

        @Override
        public int hashCode() {
            return Objects.hash(source, keys);
        }
    }
}
