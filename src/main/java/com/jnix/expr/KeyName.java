package com.jnix.expr;

import java.util.Objects;

public sealed interface KeyName {
    record StaticKey(String name) implements KeyName {
        public StaticKey {
            Objects.requireNonNull(name, "name");
        }

        @Override
        public String toString() {
            return name;
        }
    }

    // ${e} or "a${b}" in key position
    record DynamicKey(NExpr key) implements KeyName {
        public DynamicKey {
            Objects.requireNonNull(key, "key");
        }
    }

    static KeyName of(String name) {
        return new StaticKey(name);
    }
}
