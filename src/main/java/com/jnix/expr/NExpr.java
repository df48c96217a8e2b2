package com.jnix.expr;

import com.jnix.atom.NAtom;
import org.eclipse.collections.api.list.ImmutableList;

import java.util.Objects;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * An expression tree. Every node is immutable and compared structurally.
 */
public sealed interface NExpr {

    <R> R accept(NExprVisitor<R> visitor);

    /**
     * Rebuilds this node with {@code function} applied to each direct child expression, including
     * children nested in bindings, keys, string parts and parameter defaults. Leaves are returned
     * unchanged.
     */
    NExpr mapChildren(UnaryOperator<NExpr> function);

    /**
     * Nodes that own a binding list and can be extended with more bindings.
     */
    sealed interface BindingContainer extends NExpr {
        ImmutableList<Binding> bindings();

        BindingContainer appendBindings(Iterable<? extends Binding> newBindings);
    }

    record Constant(NAtom atom) implements NExpr {
        public Constant {
            Objects.requireNonNull(atom, "atom");
        }

        @Override
        public <R> R accept(NExprVisitor<R> visitor) {
            return visitor.visitConstant(this);
        }

        @Override
        public NExpr mapChildren(UnaryOperator<NExpr> function) {
            return this;
        }
    }

    record Str(ImmutableList<StrPart> parts) implements NExpr {
        public Str {
            Objects.requireNonNull(parts, "parts");
        }

        @Override
        public <R> R accept(NExprVisitor<R> visitor) {
            return visitor.visitStr(this);
        }

        @Override
        public NExpr mapChildren(UnaryOperator<NExpr> function) {
            return new Str(Children.mapParts(parts, function));
        }
    }

    // ''...'' strings; indentation is the common leading whitespace stripped from each line
    record IndentedStr(int indentation, ImmutableList<StrPart> parts) implements NExpr {
        public IndentedStr {
            Objects.requireNonNull(parts, "parts");
        }

        @Override
        public <R> R accept(NExprVisitor<R> visitor) {
            return visitor.visitIndentedStr(this);
        }

        @Override
        public NExpr mapChildren(UnaryOperator<NExpr> function) {
            return new IndentedStr(indentation, Children.mapParts(parts, function));
        }
    }

    record LiteralPath(String path) implements NExpr {
        public LiteralPath {
            Objects.requireNonNull(path, "path");
        }

        @Override
        public <R> R accept(NExprVisitor<R> visitor) {
            return visitor.visitLiteralPath(this);
        }

        @Override
        public NExpr mapChildren(UnaryOperator<NExpr> function) {
            return this;
        }
    }

    // <nixpkgs>, looked up through the search path
    record EnvPath(String path) implements NExpr {
        public EnvPath {
            Objects.requireNonNull(path, "path");
        }

        @Override
        public <R> R accept(NExprVisitor<R> visitor) {
            return visitor.visitEnvPath(this);
        }

        @Override
        public NExpr mapChildren(UnaryOperator<NExpr> function) {
            return this;
        }
    }

    record Sym(String name) implements NExpr {
        public Sym {
            Objects.requireNonNull(name, "name");
        }

        @Override
        public <R> R accept(NExprVisitor<R> visitor) {
            return visitor.visitSym(this);
        }

        @Override
        public NExpr mapChildren(UnaryOperator<NExpr> function) {
            return this;
        }
    }

    record SynHole(String label) implements NExpr {
        public SynHole {
            Objects.requireNonNull(label, "label");
        }

        @Override
        public <R> R accept(NExprVisitor<R> visitor) {
            return visitor.visitSynHole(this);
        }

        @Override
        public NExpr mapChildren(UnaryOperator<NExpr> function) {
            return this;
        }
    }

    record Unary(NUnaryOp op, NExpr operand) implements NExpr {
        public Unary {
            Objects.requireNonNull(op, "op");
            Objects.requireNonNull(operand, "operand");
        }

        @Override
        public <R> R accept(NExprVisitor<R> visitor) {
            return visitor.visitUnary(this);
        }

        @Override
        public NExpr mapChildren(UnaryOperator<NExpr> function) {
            return new Unary(op, function.apply(operand));
        }
    }

    record Binary(NBinaryOp op, NExpr left, NExpr right) implements NExpr {
        public Binary {
            Objects.requireNonNull(op, "op");
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }

        @Override
        public <R> R accept(NExprVisitor<R> visitor) {
            return visitor.visitBinary(this);
        }

        @Override
        public NExpr mapChildren(UnaryOperator<NExpr> function) {
            return new Binary(op, function.apply(left), function.apply(right));
        }
    }

    record Select(NExpr subject, AttrPath path, Optional<NExpr> alternative) implements NExpr {
        public Select {
            Objects.requireNonNull(subject, "subject");
            Objects.requireNonNull(path, "path");
            Objects.requireNonNull(alternative, "alternative");
        }

        @Override
        public <R> R accept(NExprVisitor<R> visitor) {
            return visitor.visitSelect(this);
        }

        @Override
        public NExpr mapChildren(UnaryOperator<NExpr> function) {
            return new Select(
                function.apply(subject),
                Children.mapPath(path, function),
                alternative.map(function));
        }
    }

    record HasAttr(NExpr subject, AttrPath path) implements NExpr {
        public HasAttr {
            Objects.requireNonNull(subject, "subject");
            Objects.requireNonNull(path, "path");
        }

        @Override
        public <R> R accept(NExprVisitor<R> visitor) {
            return visitor.visitHasAttr(this);
        }

        @Override
        public NExpr mapChildren(UnaryOperator<NExpr> function) {
            return new HasAttr(function.apply(subject), Children.mapPath(path, function));
        }
    }

    record AttrSet(Recursivity recursivity, ImmutableList<Binding> bindings) implements BindingContainer {
        public AttrSet {
            Objects.requireNonNull(recursivity, "recursivity");
            Objects.requireNonNull(bindings, "bindings");
        }

        public boolean isRecursive() {
            return recursivity == Recursivity.RECURSIVE;
        }

        @Override
        public AttrSet appendBindings(Iterable<? extends Binding> newBindings) {
            return new AttrSet(recursivity, bindings.newWithAll(newBindings));
        }

        @Override
        public <R> R accept(NExprVisitor<R> visitor) {
            return visitor.visitAttrSet(this);
        }

        @Override
        public NExpr mapChildren(UnaryOperator<NExpr> function) {
            return new AttrSet(recursivity, Children.mapBindings(bindings, function));
        }
    }

    record ListExpr(ImmutableList<NExpr> elements) implements NExpr {
        public ListExpr {
            Objects.requireNonNull(elements, "elements");
        }

        @Override
        public <R> R accept(NExprVisitor<R> visitor) {
            return visitor.visitList(this);
        }

        @Override
        public NExpr mapChildren(UnaryOperator<NExpr> function) {
            return new ListExpr(elements.collect(function::apply));
        }
    }

    record Let(ImmutableList<Binding> bindings, NExpr body) implements BindingContainer {
        public Let {
            Objects.requireNonNull(bindings, "bindings");
            Objects.requireNonNull(body, "body");
        }

        @Override
        public Let appendBindings(Iterable<? extends Binding> newBindings) {
            return new Let(bindings.newWithAll(newBindings), body);
        }

        @Override
        public <R> R accept(NExprVisitor<R> visitor) {
            return visitor.visitLet(this);
        }

        @Override
        public NExpr mapChildren(UnaryOperator<NExpr> function) {
            return new Let(Children.mapBindings(bindings, function), function.apply(body));
        }
    }

    record With(NExpr scope, NExpr body) implements NExpr {
        public With {
            Objects.requireNonNull(scope, "scope");
            Objects.requireNonNull(body, "body");
        }

        @Override
        public <R> R accept(NExprVisitor<R> visitor) {
            return visitor.visitWith(this);
        }

        @Override
        public NExpr mapChildren(UnaryOperator<NExpr> function) {
            return new With(function.apply(scope), function.apply(body));
        }
    }

    record Assert(NExpr condition, NExpr body) implements NExpr {
        public Assert {
            Objects.requireNonNull(condition, "condition");
            Objects.requireNonNull(body, "body");
        }

        @Override
        public <R> R accept(NExprVisitor<R> visitor) {
            return visitor.visitAssert(this);
        }

        @Override
        public NExpr mapChildren(UnaryOperator<NExpr> function) {
            return new Assert(function.apply(condition), function.apply(body));
        }
    }

    record If(NExpr condition, NExpr then, NExpr otherwise) implements NExpr {
        public If {
            Objects.requireNonNull(condition, "condition");
            Objects.requireNonNull(then, "then");
            Objects.requireNonNull(otherwise, "otherwise");
        }

        @Override
        public <R> R accept(NExprVisitor<R> visitor) {
            return visitor.visitIf(this);
        }

        @Override
        public NExpr mapChildren(UnaryOperator<NExpr> function) {
            return new If(function.apply(condition), function.apply(then), function.apply(otherwise));
        }
    }

    record Lambda(Params params, NExpr body) implements NExpr {
        public Lambda {
            Objects.requireNonNull(params, "params");
            Objects.requireNonNull(body, "body");
        }

        public Lambda mapBody(UnaryOperator<NExpr> transform) {
            return new Lambda(params, transform.apply(body));
        }

        @Override
        public <R> R accept(NExprVisitor<R> visitor) {
            return visitor.visitLambda(this);
        }

        @Override
        public NExpr mapChildren(UnaryOperator<NExpr> function) {
            return new Lambda(Children.mapParams(params, function), function.apply(body));
        }
    }
}
