package com.jnix.atom;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class NAtomTest {

    @Test
    public void testFactoriesPickVariant() {
        assertTrue(NAtom.ofNull() instanceof NAtom.NNull);
        assertEquals(new NAtom.NBool(false), NAtom.of(false));
        assertEquals(new NAtom.NInt(3L), NAtom.of(3L));
        assertEquals(new NAtom.NFloat(0.5f), NAtom.of(0.5f));
    }

    @Test
    public void testIntAndFloatAreDistinct() {
        assertNotEquals(NAtom.of(1L), NAtom.of(1.0f));
    }

    @Test
    public void testToStringUsesLiteralSyntax() {
        assertEquals("null", NAtom.ofNull().toString());
        assertEquals("true", NAtom.of(true).toString());
        assertEquals("-12", NAtom.of(-12L).toString());
        assertEquals("2.5", NAtom.of(2.5f).toString());
    }
}
