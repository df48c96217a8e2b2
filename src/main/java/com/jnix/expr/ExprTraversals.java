package com.jnix.expr;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Shape-generic traversals over expression trees.
 */
public final class ExprTraversals {
    private static final NExprVisitor<ImmutableList<NExpr>> CHILDREN = new ChildCollector();

    private ExprTraversals() {
    }

    /**
     * Direct child expressions of {@code expr}, in source order.
     */
    public static ImmutableList<NExpr> children(NExpr expr) {
        return expr.accept(CHILDREN);
    }

    /**
     * Rewrites the tree bottom-up: children are transformed first, then {@code function} is
     * applied to the rebuilt parent.
     */
    public static NExpr transformUp(NExpr expr, UnaryOperator<NExpr> function) {
        return function.apply(expr.mapChildren(child -> transformUp(child, function)));
    }

    public static int size(NExpr expr) {
        return 1 + (int) children(expr).sumOfInt(ExprTraversals::size);
    }

    public static int depth(NExpr expr) {
        return 1 + children(expr).collectInt(ExprTraversals::depth).maxIfEmpty(0);
    }

    private static final class ChildCollector implements NExprVisitor<ImmutableList<NExpr>> {
        @Override
        public ImmutableList<NExpr> visitConstant(NExpr.Constant constant) {
            return Lists.immutable.empty();
        }

        @Override
        public ImmutableList<NExpr> visitStr(NExpr.Str str) {
            return partExpressions(str.parts());
        }

        @Override
        public ImmutableList<NExpr> visitIndentedStr(NExpr.IndentedStr str) {
            return partExpressions(str.parts());
        }

        @Override
        public ImmutableList<NExpr> visitLiteralPath(NExpr.LiteralPath path) {
            return Lists.immutable.empty();
        }

        @Override
        public ImmutableList<NExpr> visitEnvPath(NExpr.EnvPath path) {
            return Lists.immutable.empty();
        }

        @Override
        public ImmutableList<NExpr> visitSym(NExpr.Sym sym) {
            return Lists.immutable.empty();
        }

        @Override
        public ImmutableList<NExpr> visitSynHole(NExpr.SynHole hole) {
            return Lists.immutable.empty();
        }

        @Override
        public ImmutableList<NExpr> visitUnary(NExpr.Unary unary) {
            return Lists.immutable.of(unary.operand());
        }

        @Override
        public ImmutableList<NExpr> visitBinary(NExpr.Binary binary) {
            return Lists.immutable.of(binary.left(), binary.right());
        }

        @Override
        public ImmutableList<NExpr> visitSelect(NExpr.Select select) {
            MutableList<NExpr> result = Lists.mutable.of(select.subject());
            addKeyExpressions(select.path().keys(), result);
            select.alternative().ifPresent(result::add);
            return result.toImmutable();
        }

        @Override
        public ImmutableList<NExpr> visitHasAttr(NExpr.HasAttr hasAttr) {
            MutableList<NExpr> result = Lists.mutable.of(hasAttr.subject());
            addKeyExpressions(hasAttr.path().keys(), result);
            return result.toImmutable();
        }

        @Override
        public ImmutableList<NExpr> visitAttrSet(NExpr.AttrSet set) {
            return bindingExpressions(set.bindings(), Optional.empty());
        }

        @Override
        public ImmutableList<NExpr> visitList(NExpr.ListExpr list) {
            return list.elements();
        }

        @Override
        public ImmutableList<NExpr> visitLet(NExpr.Let let) {
            return bindingExpressions(let.bindings(), Optional.of(let.body()));
        }

        @Override
        public ImmutableList<NExpr> visitWith(NExpr.With with) {
            return Lists.immutable.of(with.scope(), with.body());
        }

        @Override
        public ImmutableList<NExpr> visitAssert(NExpr.Assert assertion) {
            return Lists.immutable.of(assertion.condition(), assertion.body());
        }

        @Override
        public ImmutableList<NExpr> visitIf(NExpr.If ifExpr) {
            return Lists.immutable.of(ifExpr.condition(), ifExpr.then(), ifExpr.otherwise());
        }

        @Override
        public ImmutableList<NExpr> visitLambda(NExpr.Lambda lambda) {
            MutableList<NExpr> result = Lists.mutable.empty();
            if (lambda.params() instanceof Params.ParamSet set) {
                set.formals().each(formal -> formal.defaultValue().ifPresent(result::add));
            }
            result.add(lambda.body());
            return result.toImmutable();
        }

        private static ImmutableList<NExpr> partExpressions(ImmutableList<StrPart> parts) {
            return parts
                .selectInstancesOf(StrPart.Antiquoted.class)
                .collect(StrPart.Antiquoted::expression);
        }

        private static void addKeyExpressions(ImmutableList<KeyName> keys, MutableList<NExpr> result) {
            keys.selectInstancesOf(KeyName.DynamicKey.class)
                .each(key -> result.add(key.key()));
        }

        private static ImmutableList<NExpr> bindingExpressions(ImmutableList<Binding> bindings, Optional<NExpr> body) {
            MutableList<NExpr> result = Lists.mutable.empty();
            for (Binding binding : bindings) {
                if (binding instanceof Binding.NamedVar named) {
                    addKeyExpressions(named.path().keys(), result);
                    result.add(named.value());
                } else {
                    var inherit = (Binding.Inherit) binding;
                    inherit.source().ifPresent(result::add);
                    addKeyExpressions(inherit.keys(), result);
                }
            }
            body.ifPresent(result::add);
            return result.toImmutable();
        }
    }
}
