package com.jnix.atom;

/**
 * Primitive literal values of the expression language.
 */
public sealed interface NAtom {
    record NNull() implements NAtom {
        @Override
        public String toString() {
            return "null";
        }
    }

    record NBool(boolean value) implements NAtom {
        @Override
        public String toString() {
            return Boolean.toString(value);
        }
    }

    record NInt(long value) implements NAtom {
        @Override
        public String toString() {
            return Long.toString(value);
        }
    }

    record NFloat(float value) implements NAtom {
        @Override
        public String toString() {
            return Float.toString(value);
        }
    }

    static NAtom ofNull() {
        return new NNull();
    }

    static NAtom of(boolean value) {
        return new NBool(value);
    }

    static NAtom of(long value) {
        return new NInt(value);
    }

    static NAtom of(float value) {
        return new NFloat(value);
    }
}
