package com.jnix.expr;

import org.eclipse.collections.api.list.ImmutableList;

import java.util.function.UnaryOperator;

/**
 * One-level mapping over the expressions embedded in the auxiliary node models.
 */
final class Children {
    private Children() {
    }

    static ImmutableList<StrPart> mapParts(ImmutableList<StrPart> parts, UnaryOperator<NExpr> function) {
        return parts.collect(part -> mapPart(part, function));
    }

    static StrPart mapPart(StrPart part, UnaryOperator<NExpr> function) {
        if (part instanceof StrPart.Antiquoted antiquoted) {
            return new StrPart.Antiquoted(function.apply(antiquoted.expression()));
        }
        return part;
    }

    static KeyName mapKey(KeyName key, UnaryOperator<NExpr> function) {
        if (key instanceof KeyName.DynamicKey dynamic) {
            return new KeyName.DynamicKey(function.apply(dynamic.key()));
        }
        return key;
    }

    static AttrPath mapPath(AttrPath path, UnaryOperator<NExpr> function) {
        return path.mapKeys(key -> mapKey(key, function));
    }

    static ImmutableList<Binding> mapBindings(ImmutableList<Binding> bindings, UnaryOperator<NExpr> function) {
        return bindings.collect(binding -> mapBinding(binding, function));
    }

    static Binding mapBinding(Binding binding, UnaryOperator<NExpr> function) {
        if (binding instanceof Binding.NamedVar named) {
            return new Binding.NamedVar(
                mapPath(named.path(), function),
                function.apply(named.value()),
                named.position());
        }
        var inherit = (Binding.Inherit) binding;
        return new Binding.Inherit(
            inherit.source().map(function),
            inherit.keys().collect(key -> mapKey(key, function)),
            inherit.position());
    }

    static Params mapParams(Params params, UnaryOperator<NExpr> function) {
        if (params instanceof Params.ParamSet set) {
            var formals = set.formals().collect(formal ->
                new Params.Formal(formal.name(), formal.defaultValue().map(function)));
            return new Params.ParamSet(formals, set.variadic(), set.alias());
        }
        return params;
    }
}
