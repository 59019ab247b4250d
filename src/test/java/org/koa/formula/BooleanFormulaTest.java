package org.koa.formula;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;

class BooleanFormulaTest {

    private static final BooleanFormula A1 = BooleanFormula.variable(1, "A_1");
    private static final BooleanFormula A2 = BooleanFormula.variable(2, "A_2");
    private static final BooleanFormula A3 = BooleanFormula.variable(3, "A_3");

    @Test
    void testStructuralSimplifications() {
        Assertions.assertEquals(BooleanFormula.constant(true), BooleanFormula.and(List.of()));
        Assertions.assertEquals(BooleanFormula.constant(false), BooleanFormula.or(List.of()));
        Assertions.assertSame(A1, BooleanFormula.and(A1));
        Assertions.assertSame(A2, BooleanFormula.or(List.of(A2)));
        // le costanti restano nell'albero
        Assertions.assertEquals("And(A_1, True)", BooleanFormula.and(A1, BooleanFormula.constant(true)).toString());
    }

    @Test
    void testRendering() {
        BooleanFormula formula = BooleanFormula.and(
                BooleanFormula.or(A1, BooleanFormula.not(A2)),
                BooleanFormula.implies(A2, A3),
                BooleanFormula.constant(false));

        Assertions.assertEquals("And(Or(A_1, Not(A_2)), Implies(A_2, A_3), False)", formula.toString());
    }

    @Test
    void testEvaluate() {
        BooleanFormula formula = BooleanFormula.and(BooleanFormula.implies(A1, A2), BooleanFormula.or(A1, A3));

        Assertions.assertTrue(formula.evaluate(Map.of(1, true, 2, true)));
        Assertions.assertFalse(formula.evaluate(Map.of(1, true)));
        Assertions.assertTrue(formula.evaluate(Map.of(3, true)));
        Assertions.assertFalse(formula.evaluate(Map.of()));
    }

    @Test
    void testStructuralEquality() {
        BooleanFormula first = BooleanFormula.or(A1, BooleanFormula.not(BooleanFormula.variable(2, "A_2")));
        BooleanFormula second = BooleanFormula.or(BooleanFormula.variable(1, "A_1"), BooleanFormula.not(A2));

        Assertions.assertEquals(first, second);
        Assertions.assertEquals(first.hashCode(), second.hashCode());
        Assertions.assertNotEquals(first, BooleanFormula.or(BooleanFormula.not(A2), A1));
        Assertions.assertNotEquals(BooleanFormula.and(A1, A2), BooleanFormula.or(A1, A2));
    }

    @Test
    void testAnalysis() {
        BooleanFormula formula = BooleanFormula.and(A3, BooleanFormula.not(A1), A3);

        Assertions.assertEquals(Set.of(1, 3), formula.variables());
        Assertions.assertEquals(5, formula.size());
        Assertions.assertFalse(formula.isConstant());
        Assertions.assertTrue(BooleanFormula.constant(false).isConstant());
    }

    @Test
    void testInvalidConstruction() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> BooleanFormula.variable(0, "A_0"));
        Assertions.assertThrows(IllegalArgumentException.class, () -> BooleanFormula.variable(4, " "));
        Assertions.assertThrows(IllegalArgumentException.class, () -> BooleanFormula.and(Arrays.asList(A1, null)));
        Assertions.assertThrows(NullPointerException.class, () -> BooleanFormula.not(null));
        Assertions.assertThrows(IllegalStateException.class, () -> BooleanFormula.not(A1).getVariable());
        Assertions.assertThrows(UnsupportedOperationException.class,
                () -> BooleanFormula.and(A1, A2).getOperands().add(A3));
    }
}
