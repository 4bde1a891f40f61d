package com.raditha.mwp.algebra;

import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ScalarTest {

    @Property(tries = 100)
    void sumIsCommutative(@ForAll Scalar a, @ForAll Scalar b) {
        assertEquals(a.sum(b), b.sum(a));
    }

    @Property(tries = 100)
    void productIsCommutative(@ForAll Scalar a, @ForAll Scalar b) {
        assertEquals(a.product(b), b.product(a));
    }

    @Property(tries = 200)
    void sumIsAssociative(@ForAll Scalar a, @ForAll Scalar b, @ForAll Scalar c) {
        assertEquals(a.sum(b).sum(c), a.sum(b.sum(c)));
    }

    @Property(tries = 200)
    void productIsAssociative(@ForAll Scalar a, @ForAll Scalar b, @ForAll Scalar c) {
        assertEquals(a.product(b).product(c), a.product(b.product(c)));
    }

    @Property(tries = 50)
    void identities(@ForAll Scalar a) {
        assertEquals(a, Scalar.O.sum(a), "o is the identity of sum");
        assertEquals(a, Scalar.M.product(a), "m is the identity of product");
    }

    @Property(tries = 50)
    void infinityAbsorbs(@ForAll Scalar a) {
        assertEquals(Scalar.I, Scalar.I.sum(a));
        assertEquals(Scalar.I, a.sum(Scalar.I));
        assertEquals(Scalar.I, Scalar.I.product(a));
        assertEquals(Scalar.I, a.product(Scalar.I));
    }

    @Test
    void testProductTable() {
        assertEquals(Scalar.O, Scalar.O.product(Scalar.P));
        assertEquals(Scalar.I, Scalar.O.product(Scalar.I));
        assertEquals(Scalar.W, Scalar.M.product(Scalar.W));
        assertEquals(Scalar.P, Scalar.W.product(Scalar.P));
        assertEquals(Scalar.W, Scalar.W.product(Scalar.W));
    }

    @Test
    void testSumIsMax() {
        assertEquals(Scalar.P, Scalar.M.sum(Scalar.P));
        assertEquals(Scalar.W, Scalar.W.sum(Scalar.O));
    }

    @Test
    void testNullOperandIsRejected() {
        assertThrows(IllegalStateException.class, () -> Scalar.M.sum(null));
        assertThrows(IllegalStateException.class, () -> Scalar.product(null, Scalar.M));
    }

    @Test
    void testFromSymbol() {
        assertEquals(Scalar.W, Scalar.fromSymbol("w"));
        assertThrows(IllegalArgumentException.class, () -> Scalar.fromSymbol("x"));
    }
}
