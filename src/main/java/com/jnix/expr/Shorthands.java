package com.jnix.expr;

import com.jnix.atom.NAtom;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.tuple.Pair;
import org.eclipse.collections.impl.factory.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Builders for expression trees.
 *
 * <p>Everything here is total except {@link #appendBindings(Iterable, NExpr)} and
 * {@link #modifyFunctionBody(UnaryOperator, NExpr)}, which reject nodes of the wrong shape. Callers
 * that already hold a {@link NExpr.BindingContainer} or {@link NExpr.Lambda} should use
 * {@link NExpr.BindingContainer#appendBindings(Iterable)} and
 * {@link NExpr.Lambda#mapBody(UnaryOperator)} instead.
 *
 * <p>Bindings produced here never carry a source position.
 */
public final class Shorthands {
    private static final Logger LOGGER = LoggerFactory.getLogger(Shorthands.class);

    private Shorthands() {
    }

    // Literals

    public static NExpr.Constant mkConst(NAtom atom) {
        return new NExpr.Constant(atom);
    }

    public static NExpr.Constant mkNull() {
        return mkConst(NAtom.ofNull());
    }

    public static NExpr.Constant mkBool(boolean value) {
        return mkConst(NAtom.of(value));
    }

    public static NExpr.Constant mkInt(long value) {
        return mkConst(NAtom.of(value));
    }

    public static NExpr.Constant mkFloat(float value) {
        return mkConst(NAtom.of(value));
    }

    /**
     * A double-quoted string. Interpolated strings have to be built from {@link StrPart}s directly.
     */
    public static NExpr.Str mkStr(String text) {
        return new NExpr.Str(plainParts(text));
    }

    public static NExpr.IndentedStr mkIndentedStr(int indentation, String text) {
        return new NExpr.IndentedStr(indentation, plainParts(text));
    }

    /**
     * @param searchPath {@code true} for {@code <path>} looked up through the search path,
     *                   {@code false} for a literal relative or absolute path
     */
    public static NExpr mkPath(boolean searchPath, String path) {
        return searchPath ? new NExpr.EnvPath(path) : new NExpr.LiteralPath(path);
    }

    public static NExpr mkEnvPath(String path) {
        return mkPath(true, path);
    }

    public static NExpr mkRelPath(String path) {
        return mkPath(false, path);
    }

    public static NExpr.Sym mkSym(String name) {
        return new NExpr.Sym(name);
    }

    public static NExpr.SynHole mkSynHole(String label) {
        return new NExpr.SynHole(label);
    }

    public static AttrPath mkSelector(String name) {
        return AttrPath.of(name);
    }

    // Operators

    public static NExpr.Unary mkOp(NUnaryOp op, NExpr operand) {
        return new NExpr.Unary(op, operand);
    }

    public static NExpr.Unary mkNot(NExpr operand) {
        return mkOp(NUnaryOp.NOT, operand);
    }

    public static NExpr.Unary mkNeg(NExpr operand) {
        return mkOp(NUnaryOp.NEG, operand);
    }

    public static NExpr.Binary mkOp2(NBinaryOp op, NExpr left, NExpr right) {
        return new NExpr.Binary(op, left, right);
    }

    public static NExpr.HasAttr mkHasAttr(NExpr subject, String key) {
        return new NExpr.HasAttr(subject, mkSelector(key));
    }

    /** {@code f x} */
    public static NExpr.Binary app(NExpr function, NExpr argument) {
        return mkOp2(NBinaryOp.APP, function, argument);
    }

    /** {@code a ++ b} */
    public static NExpr.Binary concat(NExpr left, NExpr right) {
        return mkOp2(NBinaryOp.CONCAT, left, right);
    }

    public static NExpr.Binary mult(NExpr left, NExpr right) {
        return mkOp2(NBinaryOp.MULT, left, right);
    }

    public static NExpr.Binary div(NExpr left, NExpr right) {
        return mkOp2(NBinaryOp.DIV, left, right);
    }

    public static NExpr.Binary plus(NExpr left, NExpr right) {
        return mkOp2(NBinaryOp.PLUS, left, right);
    }

    public static NExpr.Binary minus(NExpr left, NExpr right) {
        return mkOp2(NBinaryOp.MINUS, left, right);
    }

    /** {@code a // b}: attributes of {@code b} override those of {@code a}. */
    public static NExpr.Binary update(NExpr left, NExpr right) {
        return mkOp2(NBinaryOp.UPDATE, left, right);
    }

    public static NExpr.Binary gt(NExpr left, NExpr right) {
        return mkOp2(NBinaryOp.GT, left, right);
    }

    public static NExpr.Binary gte(NExpr left, NExpr right) {
        return mkOp2(NBinaryOp.GTE, left, right);
    }

    public static NExpr.Binary lte(NExpr left, NExpr right) {
        return mkOp2(NBinaryOp.LTE, left, right);
    }

    public static NExpr.Binary lt(NExpr left, NExpr right) {
        return mkOp2(NBinaryOp.LT, left, right);
    }

    public static NExpr.Binary eq(NExpr left, NExpr right) {
        return mkOp2(NBinaryOp.EQ, left, right);
    }

    public static NExpr.Binary neq(NExpr left, NExpr right) {
        return mkOp2(NBinaryOp.NEQ, left, right);
    }

    public static NExpr.Binary and(NExpr left, NExpr right) {
        return mkOp2(NBinaryOp.AND, left, right);
    }

    public static NExpr.Binary or(NExpr left, NExpr right) {
        return mkOp2(NBinaryOp.OR, left, right);
    }

    /** {@code a -> b} */
    public static NExpr.Binary impl(NExpr left, NExpr right) {
        return mkOp2(NBinaryOp.IMPL, left, right);
    }

    // Sets and lists

    public static NExpr.AttrSet mkSet(Recursivity recursivity, Iterable<? extends Binding> bindings) {
        return new NExpr.AttrSet(recursivity, Lists.immutable.ofAll(bindings));
    }

    public static NExpr.AttrSet mkRecSet(Iterable<? extends Binding> bindings) {
        return mkSet(Recursivity.RECURSIVE, bindings);
    }

    public static NExpr.AttrSet mkNonRecSet(Iterable<? extends Binding> bindings) {
        return mkSet(Recursivity.NON_RECURSIVE, bindings);
    }

    /**
     * {@code {}}. Extend it with {@link #update(NExpr, NExpr)} or {@link #appendBindings}.
     */
    public static NExpr.AttrSet emptySet() {
        return mkNonRecSet(Lists.immutable.empty());
    }

    public static NExpr.ListExpr mkList(Iterable<? extends NExpr> elements) {
        return new NExpr.ListExpr(Lists.immutable.ofAll(elements));
    }

    public static NExpr.ListExpr emptyList() {
        return mkList(Lists.immutable.empty());
    }

    // Bindings

    /** {@code name = value;} */
    public static Binding.NamedVar bindTo(String name, NExpr value) {
        return new Binding.NamedVar(mkSelector(name), value);
    }

    /** {@code inherit a b;}: each key comes from the enclosing scope. */
    public static Binding.Inherit inherit(Iterable<? extends KeyName> keys) {
        return new Binding.Inherit(Optional.empty(), Lists.immutable.ofAll(keys));
    }

    public static Binding.Inherit inherit(String... names) {
        return inherit(staticKeys(names));
    }

    /** {@code inherit (source) a b;}: same as {@code a = source.a; b = source.b;}. */
    public static Binding.Inherit inheritFrom(NExpr source, Iterable<? extends KeyName> keys) {
        return new Binding.Inherit(Optional.of(source), Lists.immutable.ofAll(keys));
    }

    public static Binding.Inherit inheritFrom(NExpr source, String... names) {
        return inheritFrom(source, staticKeys(names));
    }

    public static NExpr.AttrSet attrsE(Iterable<? extends Pair<String, ? extends NExpr>> pairs) {
        return mkNonRecSet(bindAll(pairs));
    }

    public static NExpr.AttrSet recAttrsE(Iterable<? extends Pair<String, ? extends NExpr>> pairs) {
        return mkRecSet(bindAll(pairs));
    }

    // Control forms

    /** {@code let bindings; in body} */
    public static NExpr.Let mkLets(Iterable<? extends Binding> bindings, NExpr body) {
        return new NExpr.Let(Lists.immutable.ofAll(bindings), body);
    }

    public static NExpr.Let letsE(Iterable<? extends Pair<String, ? extends NExpr>> pairs, NExpr body) {
        return mkLets(bindAll(pairs), body);
    }

    public static NExpr.Let letE(String name, NExpr value, NExpr body) {
        return mkLets(Lists.immutable.of(bindTo(name, value)), body);
    }

    /** {@code with scope; body} */
    public static NExpr.With mkWith(NExpr scope, NExpr body) {
        return new NExpr.With(scope, body);
    }

    /** {@code assert condition; body} */
    public static NExpr.Assert mkAssert(NExpr condition, NExpr body) {
        return new NExpr.Assert(condition, body);
    }

    public static NExpr.If mkIf(NExpr condition, NExpr then, NExpr otherwise) {
        return new NExpr.If(condition, then, otherwise);
    }

    // Functions

    /** {@code params: body} */
    public static NExpr.Lambda mkFunction(Params params, NExpr body) {
        return new NExpr.Lambda(params, body);
    }

    public static NExpr.Lambda lambda(Params params, NExpr body) {
        return mkFunction(params, body);
    }

    public static Params.Param mkParam(String name) {
        return new Params.Param(name);
    }

    /**
     * {@code { a, b ? default }} or, when {@code variadic}, {@code { a, b ? default, ... }}. The
     * {@code @ alias} slot is always left empty.
     */
    public static Params.ParamSet mkParamset(Iterable<? extends Params.Formal> formals, boolean variadic) {
        return new Params.ParamSet(Lists.immutable.ofAll(formals), variadic, Optional.empty());
    }

    public static Params.Formal formal(String name) {
        return new Params.Formal(name, Optional.empty());
    }

    public static Params.Formal formal(String name, NExpr defaultValue) {
        return new Params.Formal(name, Optional.of(defaultValue));
    }

    // Selection

    /** {@code obj.key} or, with an alternative, {@code obj.key or alternative} */
    public static NExpr.Select getRefOrDefault(NExpr obj, String key, Optional<NExpr> alternative) {
        return new NExpr.Select(obj, mkSelector(key), alternative);
    }

    public static NExpr.Select dot(NExpr obj, String key) {
        return getRefOrDefault(obj, key, Optional.empty());
    }

    public static NExpr.Select dotOr(NExpr obj, String key, NExpr alternative) {
        return getRefOrDefault(obj, key, Optional.of(alternative));
    }

    // Structural transformers

    /**
     * Appends {@code newBindings} after the existing bindings of a set or {@code let}. Adding
     * {@code [a = 1, b = 2]} to {@code let c = 3; in 4} gives {@code let c = 3; a = 1; b = 2; in 4}.
     *
     * @throws IllegalArgumentException if {@code expr} is neither a set nor a {@code let}
     */
    public static NExpr.BindingContainer appendBindings(Iterable<? extends Binding> newBindings, NExpr expr) {
        if (!(expr instanceof NExpr.BindingContainer container)) {
            throw new IllegalArgumentException(
                "Can only append bindings to a set or a let, got " + expr.getClass().getSimpleName());
        }
        LOGGER.debug("Appending bindings to {}", container.getClass().getSimpleName());
        return container.appendBindings(newBindings);
    }

    /**
     * Replaces the body of a function with {@code transform} applied to it.
     *
     * @throws IllegalArgumentException if {@code expr} is not a function
     */
    public static NExpr.Lambda modifyFunctionBody(UnaryOperator<NExpr> transform, NExpr expr) {
        if (!(expr instanceof NExpr.Lambda function)) {
            throw new IllegalArgumentException("Not a function: " + expr.getClass().getSimpleName());
        }
        LOGGER.debug("Modifying body of function with {}", function.params().getClass().getSimpleName());
        return function.mapBody(transform);
    }

    private static ImmutableList<StrPart> plainParts(String text) {
        return text.isEmpty()
            ? Lists.immutable.empty()
            : Lists.immutable.of(new StrPart.Plain(text));
    }

    private static ImmutableList<KeyName> staticKeys(String... names) {
        return Lists.immutable.ofAll(Arrays.asList(names)).collect(KeyName::of);
    }

    private static ImmutableList<Binding> bindAll(Iterable<? extends Pair<String, ? extends NExpr>> pairs) {
        return Lists.immutable.<Pair<String, ? extends NExpr>>ofAll(pairs)
            .collect(pair -> bindTo(pair.getOne(), pair.getTwo()));
    }
}
