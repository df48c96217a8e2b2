package com.jnix.expr;

import org.junit.jupiter.api.Test;

import java.util.List;

import static com.jnix.expr.Shorthands.*;
import static org.junit.jupiter.api.Assertions.*;

public class StructuralTransformersTest {

    private final Binding a = bindTo("a", mkInt(1));
    private final Binding b = bindTo("b", mkInt(2));
    private final Binding c = bindTo("c", mkInt(3));

    @Test
    public void testAppendToEmptySet() {
        assertEquals(mkNonRecSet(List.of(b)), appendBindings(List.of(b), mkNonRecSet(List.of())));
    }

    @Test
    public void testAppendToEmptyLet() {
        NExpr body = mkSym("e");
        assertEquals(mkLets(List.of(b), body), appendBindings(List.of(b), mkLets(List.of(), body)));
    }

    @Test
    public void testAppendGoesAfterExistingBindings() {
        NExpr.Let let = mkLets(List.of(c), mkInt(4));
        NExpr result = appendBindings(List.of(a, b), let);
        assertEquals(mkLets(List.of(c, a, b), mkInt(4)), result);
    }

    @Test
    public void testAppendKeepsRecursivity() {
        NExpr result = appendBindings(List.of(b), mkRecSet(List.of(a)));
        assertEquals(mkRecSet(List.of(a, b)), result);
    }

    @Test
    public void testAppendLeavesOriginalUnchanged() {
        NExpr.AttrSet original = mkNonRecSet(List.of(a));
        appendBindings(List.of(b), original);
        assertEquals(1, original.bindings().size());
    }

    @Test
    public void testTypedAppendReturnsSameShape() {
        NExpr.AttrSet set = mkNonRecSet(List.of(a)).appendBindings(List.of(inherit("x")));
        assertEquals(2, set.bindings().size());

        NExpr.Let let = mkLets(List.of(), mkNull()).appendBindings(List.of(a));
        assertEquals(mkNull(), let.body());
    }

    @Test
    public void testAppendToOtherShapesFails() {
        assertThrows(IllegalArgumentException.class, () -> appendBindings(List.of(b), mkList(List.of())));
        assertThrows(IllegalArgumentException.class, () -> appendBindings(List.of(b), mkInt(1)));
        assertThrows(IllegalArgumentException.class,
            () -> appendBindings(List.of(b), mkWith(mkSym("s"), emptySet())));
    }

    @Test
    public void testAppendFailureNamesShape() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
            () -> appendBindings(List.of(b), mkList(List.of())));
        assertTrue(e.getMessage().contains("ListExpr"), e.getMessage());
    }

    @Test
    public void testModifyFunctionBody() {
        Params params = mkParamset(List.of(formal("x")), false);
        NExpr body = mkSym("x");
        NExpr result = modifyFunctionBody(e -> plus(e, mkInt(1)), mkFunction(params, body));
        assertEquals(mkFunction(params, plus(body, mkInt(1))), result);
    }

    @Test
    public void testMapBodyKeepsParams() {
        NExpr.Lambda function = mkFunction(mkParam("x"), mkSym("x"));
        NExpr.Lambda result = function.mapBody(e -> mkNot(e));
        assertEquals(function.params(), result.params());
        assertEquals(mkNot(mkSym("x")), result.body());
    }

    @Test
    public void testModifyNonFunctionFails() {
        assertThrows(IllegalArgumentException.class, () -> modifyFunctionBody(e -> e, mkInt(1)));
        assertThrows(IllegalArgumentException.class, () -> modifyFunctionBody(e -> e, emptySet()));
    }
}
