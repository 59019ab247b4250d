package org.koa.encoding;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.koa.formula.BooleanFormula;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

class VariableSpaceTest {

    private static VariableSpace space(int slots, String... symbols) {
        return new VariableSpace(new AlphabetIndex(List.of(symbols)), slots);
    }

    @Test
    void testSizes() {
        VariableSpace space = space(2, "a", "b");

        Assertions.assertEquals(5, space.getNumber());
        Assertions.assertEquals(25, space.edgeCount());
        Assertions.assertEquals(27, space.universeSize());
        Assertions.assertEquals(0, space.trueIndex());
        Assertions.assertEquals(26, space.falseIndex());
    }

    @Test
    void testInvalidSlots() {
        AlphabetIndex alphabet = new AlphabetIndex(List.of("a"));
        Assertions.assertThrows(IllegalArgumentException.class, () -> new VariableSpace(alphabet, 0));
        Assertions.assertThrows(IllegalArgumentException.class, () -> new VariableSpace(alphabet, -3));
    }

    @Test
    void testDecodeIsInverseOfEncodeOverWholeRange() {
        VariableSpace space = space(3, "a", "b", "c");

        for (int index = 1; index <= space.edgeCount(); index++) {
            EdgeVariable edge = space.decode(index);
            Assertions.assertEquals(index, space.indexOf(edge), "indice " + index + " -> " + edge.describe());
        }
    }

    @Test
    void testInteriorTuplesRoundTrip() {
        VariableSpace space = space(2, "a", "b");
        AlphabetIndex alphabet = space.getAlphabet();
        Set<Integer> seen = new HashSet<>();

        for (int id1 = 1; id1 <= 2; id1++) {
            for (int k1 = 1; k1 <= 2; k1++) {
                for (int id2 = 1; id2 <= 2; id2++) {
                    for (int k2 = 1; k2 <= 2; k2++) {
                        int index = space.indexOf(id1, k1, id2, k2);
                        Assertions.assertTrue(space.isInterior(index));
                        Assertions.assertTrue(seen.add(index));
                        Assertions.assertEquals(
                                new EdgeVariable(alphabet.position(id1), k1, alphabet.position(id2), k2),
                                space.decode(index));
                    }
                }
            }
        }
        Assertions.assertEquals(16, seen.size());
    }

    @Test
    void testBlockLayout() {
        VariableSpace space = space(2, "a", "b");
        AlphabetIndex alphabet = space.getAlphabet();
        Position a = alphabet.symbol("a");
        Position b = alphabet.symbol("b");

        // src -> simbolo: indirizzati dalla sola colonna
        Assertions.assertEquals(List.of(1, 2), space.sourceEdges(a));
        Assertions.assertEquals(List.of(3, 4), space.sourceEdges(b));
        // src -> snk: indice fisso N
        Assertions.assertEquals(5, space.indexOf(alphabet.source(), 0, alphabet.sink(), 0));
        // simbolo -> snk: (r + 1) * N
        Assertions.assertEquals(List.of(10, 15), space.sinkEdges(a));
        Assertions.assertEquals(List.of(20, 25), space.sinkEdges(b));
        // interno: r * N + c
        Assertions.assertEquals(6, space.indexOf(a, 1, a, 1));
        Assertions.assertEquals(24, space.indexOf(b, 2, b, 2));
    }

    @Test
    void testInvalidAddressing() {
        VariableSpace space = space(2, "a", "b");
        AlphabetIndex alphabet = space.getAlphabet();
        Position a = alphabet.symbol("a");

        Assertions.assertThrows(IllegalArgumentException.class, () -> space.indexOf(a, 0, a, 1));
        Assertions.assertThrows(IllegalArgumentException.class, () -> space.indexOf(a, 1, a, 3));
        Assertions.assertThrows(IllegalArgumentException.class, () -> space.indexOf(alphabet.source(), 1, a, 1));
        Assertions.assertThrows(IllegalArgumentException.class, () -> space.indexOf(alphabet.sink(), 0, a, 1));
        Assertions.assertThrows(IllegalArgumentException.class, () -> space.indexOf(a, 1, alphabet.source(), 0));
        Assertions.assertThrows(IllegalArgumentException.class, () -> space.indexOf(5, 1, 1, 1));
        Assertions.assertThrows(IllegalArgumentException.class, () -> space.decode(0));
        Assertions.assertThrows(IllegalArgumentException.class, () -> space.decode(26));
        Assertions.assertThrows(IllegalArgumentException.class, () -> space.formula(27));
    }

    @Test
    void testFormulaNodes() {
        VariableSpace space = space(2, "a", "b");

        Assertions.assertEquals(BooleanFormula.constant(true), space.formula(0));
        Assertions.assertEquals(BooleanFormula.constant(false), space.formula(26));
        Assertions.assertEquals("A_7", space.formula(7).toString());
        Assertions.assertSame(space.formula(7), space.formula(7));
    }

    @Test
    void testEmptyListsGiveTrueSentinel() {
        VariableSpace space = space(2, "a");

        Assertions.assertEquals(space.trueSentinel(), space.allOf(List.of(), true));
        Assertions.assertEquals(space.trueSentinel(), space.anyOf(List.of(), false));
        Assertions.assertEquals("And(Not(A_1), Not(A_2))", space.allOf(List.of(1, 2), false).toString());
        Assertions.assertEquals("Or(A_1, A_2)", space.anyOf(List.of(1, 2), true).toString());
    }

    @Test
    void testEmptyAlphabet() {
        VariableSpace space = space(3);

        Assertions.assertEquals(1, space.getNumber());
        Assertions.assertEquals(1, space.edgeCount());
        EdgeVariable emptyString = space.decode(1);
        Assertions.assertTrue(emptyString.getFrom().isSource());
        Assertions.assertTrue(emptyString.getTo().isSink());
        Assertions.assertEquals("src -> snk", emptyString.describe());
    }

    @Test
    void testEdgeVariableEquality() {
        VariableSpace space = space(2, "a", "b");
        AlphabetIndex alphabet = space.getAlphabet();
        EdgeVariable edge = new EdgeVariable(alphabet.symbol("a"), 1, alphabet.symbol("b"), 2);
        int index = space.indexOf(edge);

        Assertions.assertEquals(edge, space.decode(index));
        Assertions.assertEquals(edge.hashCode(), space.decode(index).hashCode());
        Assertions.assertNotEquals(edge, new EdgeVariable(alphabet.symbol("a"), 2, alphabet.symbol("b"), 2));
        Assertions.assertEquals(Set.of(edge), Set.of(space.decode(index)));
    }
}
