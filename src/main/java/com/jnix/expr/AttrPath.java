package com.jnix.expr;

import org.eclipse.collections.api.block.function.Function;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.Arrays;
import java.util.Objects;

/**
 * A dotted attribute path such as {@code a.b."c"}. Always has at least one key.
 */
public record AttrPath(ImmutableList<KeyName> keys) {
    public AttrPath {
        Objects.requireNonNull(keys, "keys");
        if (keys.isEmpty()) {
            throw new IllegalArgumentException("Attribute path must have at least one key");
        }
    }

    public static AttrPath of(String first, String... rest) {
        var keys = Lists.mutable.<KeyName>of(new KeyName.StaticKey(first));
        for (String name : rest) {
            keys.add(new KeyName.StaticKey(name));
        }
        return new AttrPath(keys.toImmutable());
    }

    public static AttrPath of(KeyName first, KeyName... rest) {
        return new AttrPath(Lists.immutable.of(first).newWithAll(Arrays.asList(rest)));
    }

    AttrPath mapKeys(Function<KeyName, KeyName> function) {
        return new AttrPath(keys.collect(function));
    }

    @Override
    public String toString() {
        return keys.makeString(".");
    }
}
