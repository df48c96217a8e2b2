package com.jnix.expr;

import com.jnix.atom.NAtom;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.tuple.Tuples;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static com.jnix.expr.Shorthands.*;
import static org.junit.jupiter.api.Assertions.*;

public class NExprTest {

    private static NExpr bump(NExpr expr) {
        if (expr instanceof NExpr.Constant constant && constant.atom() instanceof NAtom.NInt n) {
            return mkInt(n.value() + 1);
        }
        return expr;
    }

    @Test
    public void testAttrPathRejectsEmptyKeys() {
        assertThrows(IllegalArgumentException.class, () -> new AttrPath(Lists.immutable.empty()));
    }

    @Test
    public void testAttrPathOfNames() {
        AttrPath path = AttrPath.of("a", "b", "c");
        assertEquals(3, path.keys().size());
        assertEquals(KeyName.of("a"), path.keys().getFirst());
        assertEquals("a.b.c", path.toString());
    }

    @Test
    public void testDynamicKeyPath() {
        AttrPath path = AttrPath.of(new KeyName.DynamicKey(mkSym("k")), KeyName.of("b"));
        assertEquals(Lists.immutable.of(new KeyName.DynamicKey(mkSym("k")), new KeyName.StaticKey("b")), path.keys());
    }

    @Test
    public void testBindingEqualityIgnoresPosition() {
        var synthetic = bindTo("a", mkInt(1));
        var parsed = new Binding.NamedVar(AttrPath.of("a"), mkInt(1), Optional.of(new SourcePos("default.nix", 3, 5)));
        assertEquals(synthetic, parsed);
        assertEquals(synthetic.hashCode(), parsed.hashCode());

        var inherited = new Binding.Inherit(Optional.empty(), Lists.immutable.of(KeyName.of("x")),
            Optional.of(new SourcePos("default.nix", 1, 1)));
        assertEquals(inherit("x"), inherited);
        assertEquals(inherit("x").hashCode(), inherited.hashCode());
    }

    @Test
    public void testTreesWithParsedPositionsCompareEqual() {
        var parsed = new NExpr.AttrSet(Recursivity.NON_RECURSIVE, Lists.immutable.of(
            new Binding.NamedVar(AttrPath.of("a"), mkInt(1), Optional.of(new SourcePos("f.nix", 1, 3)))));
        assertEquals(attrsE(List.of(Tuples.pair("a", mkInt(1)))), parsed);
    }

    @Test
    public void testStructuralSharingIsSafe() {
        NExpr shared = mkList(List.of(mkInt(1)));
        NExpr.Binary tree = concat(shared, shared);
        assertSame(tree.left(), tree.right());
        assertEquals(concat(mkList(List.of(mkInt(1))), mkList(List.of(mkInt(1)))), tree);
    }

    @Test
    public void testMapChildrenOnLeafReturnsSameNode() {
        NExpr sym = mkSym("x");
        assertSame(sym, sym.mapChildren(NExprTest::bump));
        NExpr constant = mkInt(1);
        assertSame(constant, constant.mapChildren(NExprTest::bump));
    }

    @Test
    public void testMapChildrenIsOneLevel() {
        NExpr tree = plus(mkInt(1), plus(mkInt(2), mkInt(3)));
        assertEquals(plus(mkInt(2), plus(mkInt(2), mkInt(3))), tree.mapChildren(NExprTest::bump));
    }

    @Test
    public void testMapChildrenReachesBindingsAndDefaults() {
        NExpr.Let let = mkLets(List.of(bindTo("a", mkInt(1)), inheritFrom(mkInt(5), "b")), mkInt(9));
        assertEquals(
            mkLets(List.of(bindTo("a", mkInt(2)), inheritFrom(mkInt(6), "b")), mkInt(10)),
            let.mapChildren(NExprTest::bump));

        NExpr.Lambda function = mkFunction(mkParamset(List.of(formal("x", mkInt(0))), true), mkInt(0));
        assertEquals(
            mkFunction(mkParamset(List.of(formal("x", mkInt(1))), true), mkInt(1)),
            function.mapChildren(NExprTest::bump));
    }

    @Test
    public void testMapChildrenReachesSelectAlternativeAndDynamicKeys() {
        var select = new NExpr.Select(mkInt(0), AttrPath.of(new KeyName.DynamicKey(mkInt(0))), Optional.of(mkInt(0)));
        var expected = new NExpr.Select(mkInt(1), AttrPath.of(new KeyName.DynamicKey(mkInt(1))), Optional.of(mkInt(1)));
        assertEquals(expected, select.mapChildren(NExprTest::bump));
    }

    @Test
    public void testMapChildrenReachesAntiquotes() {
        var str = new NExpr.IndentedStr(2, Lists.immutable.of(new StrPart.Plain("n = "), new StrPart.Antiquoted(mkInt(0))));
        var expected = new NExpr.IndentedStr(2, Lists.immutable.of(new StrPart.Plain("n = "), new StrPart.Antiquoted(mkInt(1))));
        assertEquals(expected, str.mapChildren(NExprTest::bump));
    }

    @Test
    public void testVisitorDispatchesOnShape() {
        NExprVisitor<String> kind = new ShapeNameVisitor();
        assertEquals("set", emptySet().accept(kind));
        assertEquals("let", letE("x", mkInt(1), mkSym("x")).accept(kind));
        assertEquals("binary", app(mkSym("f"), mkSym("x")).accept(kind));
        assertEquals("env-path", mkEnvPath("nixpkgs").accept(kind));
        assertEquals("path", mkRelPath("./a").accept(kind));
        assertEquals("lambda", mkFunction(mkParam("x"), mkSym("x")).accept(kind));
    }

    @Test
    public void testBindingContainersAreSetsAndLets() {
        assertTrue(emptySet() instanceof NExpr.BindingContainer);
        assertTrue(mkLets(List.of(), mkNull()) instanceof NExpr.BindingContainer);
        NExpr list = emptyList();
        assertFalse(list instanceof NExpr.BindingContainer);
    }

    private static final class ShapeNameVisitor implements NExprVisitor<String> {
        @Override
        public String visitConstant(NExpr.Constant constant) {
            return "constant";
        }

        @Override
        public String visitStr(NExpr.Str str) {
            return "string";
        }

        @Override
        public String visitIndentedStr(NExpr.IndentedStr str) {
            return "indented-string";
        }

        @Override
        public String visitLiteralPath(NExpr.LiteralPath path) {
            return "path";
        }

        @Override
        public String visitEnvPath(NExpr.EnvPath path) {
            return "env-path";
        }

        @Override
        public String visitSym(NExpr.Sym sym) {
            return "symbol";
        }

        @Override
        public String visitSynHole(NExpr.SynHole hole) {
            return "hole";
        }

        @Override
        public String visitUnary(NExpr.Unary unary) {
            return "unary";
        }

        @Override
        public String visitBinary(NExpr.Binary binary) {
            return "binary";
        }

        @Override
        public String visitSelect(NExpr.Select select) {
            return "select";
        }

        @Override
        public String visitHasAttr(NExpr.HasAttr hasAttr) {
            return "has-attr";
        }

        @Override
        public String visitAttrSet(NExpr.AttrSet set) {
            return "set";
        }

        @Override
        public String visitList(NExpr.ListExpr list) {
            return "list";
        }

        @Override
        public String visitLet(NExpr.Let let) {
            return "let";
        }

        @Override
        public String visitWith(NExpr.With with) {
            return "with";
        }

        @Override
        public String visitAssert(NExpr.Assert assertion) {
            return "assert";
        }

        @Override
        public String visitIf(NExpr.If ifExpr) {
            return "if";
        }

        @Override
        public String visitLambda(NExpr.Lambda lambda) {
            return "lambda";
        }
    }
}
