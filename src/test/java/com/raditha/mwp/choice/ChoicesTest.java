package com.raditha.mwp.choice;

import com.raditha.mwp.algebra.Delta;
import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.Combinators;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.Provide;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ChoicesTest {

    private static final List<Integer> DOMAIN = Choices.DEFAULT_DOMAIN;

    private static List<Delta> witness(Delta... deltas) {
        return List.of(deltas);
    }

    @Test
    void testSingleWitnessRemovesOneValue() {
        Choices choices = Choices.generate(DOMAIN, 2, Set.of(witness(new Delta(0, 1))));
        assertEquals(List.of(List.of(0, 1, 2), List.of(1, 2)), choices.allowed());
        assertFalse(choices.infinite());
    }

    @Test
    void testNoWitnesses() {
        Choices choices = Choices.generate(DOMAIN, 3, List.of());
        assertFalse(choices.infinite());
        assertArrayEquals(new int[]{0, 0, 0}, choices.first());
        assertEquals(BigInteger.valueOf(27), choices.count());
    }

    @Test
    void testNoIndices() {
        Choices choices = Choices.generate(DOMAIN, 0, List.of());
        assertFalse(choices.infinite());
        assertEquals(0, choices.first().length);
        assertTrue(choices.isValid());
    }

    @Test
    void testCoveringWitnessesAreUnconditional() {
        Choices choices = Choices.generate(DOMAIN, 1, List.of(
                witness(new Delta(0, 0)), witness(new Delta(1, 0)), witness(new Delta(2, 0))));
        assertTrue(choices.infinite());
        assertEquals(List.of(List.of()), choices.allowed());
        assertThrows(IllegalStateException.class, choices::first);
        assertEquals(BigInteger.ZERO, choices.count());
    }

    @Test
    void testEmptyWitnessEmptiesEverything() {
        Choices choices = Choices.generate(DOMAIN, 2, List.of(List.of()));
        assertTrue(choices.infinite());
        assertEquals(List.of(List.of(), List.of()), choices.allowed());
    }

    @Test
    void testContractionOfLeadingDelta() {
        // the leading deltas cover the domain, so (1,2) alone forces infinity
        Choices choices = Choices.generate(DOMAIN, 3, List.of(
                witness(new Delta(0, 0), new Delta(1, 2)),
                witness(new Delta(1, 0), new Delta(1, 2)),
                witness(new Delta(2, 0), new Delta(1, 2))));
        assertEquals(List.of(List.of(0, 1, 2), List.of(0, 1, 2), List.of(0, 2)), choices.allowed());
    }

    @Test
    void testContractionAtAnyPosition() {
        Choices choices = Choices.generate(DOMAIN, 2, List.of(
                witness(new Delta(0, 0), new Delta(0, 1)),
                witness(new Delta(0, 0), new Delta(1, 1)),
                witness(new Delta(0, 0), new Delta(2, 1))));
        assertEquals(List.of(List.of(1, 2), List.of(0, 1, 2)), choices.allowed());
    }

    @Test
    void testSubsumedWitnessIsIgnored() {
        Choices choices = Choices.generate(DOMAIN, 2, List.of(
                witness(new Delta(1, 0)),
                witness(new Delta(1, 0), new Delta(2, 1))));
        assertEquals(List.of(List.of(0, 2), List.of(0, 1, 2)), choices.allowed());
    }

    @Test
    void testUnachievableWitness() {
        assertThrows(IllegalStateException.class,
                () -> Choices.generate(DOMAIN, 1, List.of(witness(new Delta(0, 4)))));
        assertThrows(IllegalStateException.class,
                () -> Choices.generate(DOMAIN, 2, List.of(witness(new Delta(5, 0)))));
    }

    @Test
    void testIsValid() {
        Choices choices = Choices.generate(DOMAIN, 2, List.of(witness(new Delta(0, 1))));
        assertTrue(choices.isValid(2, 1));
        assertFalse(choices.isValid(2, 0));
        assertFalse(choices.isValid(2));
    }

    @Test
    void testInvalidConstruction() {
        assertThrows(IllegalArgumentException.class, () -> new Choices(List.of(), 0, List.of(), false));
        assertThrows(IllegalArgumentException.class, () -> new Choices(DOMAIN, 2, List.of(List.of(0)), false));
    }

    @Property(tries = 200)
    void moreWitnessesNeverEnlargeAllowedSets(@ForAll("singleDeltaWitnesses") List<List<Delta>> witnesses,
                                              @ForAll("singleDeltaWitness") List<Delta> extra) {
        Choices before = Choices.generate(DOMAIN, 3, witnesses);
        List<List<Delta>> more = new ArrayList<>(witnesses);
        more.add(extra);
        Choices after = Choices.generate(DOMAIN, 3, more);
        for (int k = 0; k < 3; k++) {
            assertTrue(before.allowed().get(k).containsAll(after.allowed().get(k)));
        }
    }

    @Property(tries = 200)
    void graphAndSetReductionAgree(@ForAll("witnessSets") List<List<Delta>> witnesses) {
        Choices set = Choices.generate(DOMAIN, 3, witnesses, ReductionStrategy.SET);
        Choices graph = Choices.generate(DOMAIN, 3, witnesses, ReductionStrategy.GRAPH);
        assertEquals(set, graph);
    }

    @Provide
    Arbitrary<List<Delta>> singleDeltaWitness() {
        return Combinators.combine(
                Arbitraries.integers().between(0, 2),
                Arbitraries.integers().between(0, 2)).as((v, i) -> List.of(new Delta(v, i)));
    }

    @Provide
    Arbitrary<List<List<Delta>>> singleDeltaWitnesses() {
        return singleDeltaWitness().list().ofMaxSize(6);
    }

    @Provide
    Arbitrary<List<List<Delta>>> witnessSets() {
        // one optional value per index gives a well formed witness
        Arbitrary<List<Delta>> witness = Arbitraries.integers().between(-1, 2).list().ofSize(3).map(values -> {
            List<Delta> deltas = new ArrayList<>();
            for (int index = 0; index < values.size(); index++) {
                if (values.get(index) >= 0) {
                    deltas.add(new Delta(values.get(index), index));
                }
            }
            return List.copyOf(deltas);
        });
        return witness.list().ofMaxSize(12);
    }
}
