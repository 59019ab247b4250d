package org.koa.encoding;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.koa.formula.BooleanFormula;

import java.util.ArrayList;
import java.util.List;

class GlobalConstraintBuilderTest {

    private static final List<List<String>> SAMPLES = List.of(
            List.of("a"),
            List.of("a", "b"),
            List.of("b", "a"),
            List.of("a", "b", "b"),
            List.of("a", "b", "a", "b"),
            List.of("b", "b", "a", "a", "b"));

    private static EncodingContext aggregate(int slots, List<List<String>> samples) {
        EncodingContext context = new EncodingContext(List.of("a", "b"), slots);
        new PositiveAggregator(context).addAll(samples);
        return context;
    }

    @Test
    void testNoEvidenceIsTrue() {
        EncodingContext context = aggregate(2, List.of());

        Assertions.assertEquals(BooleanFormula.constant(true), new GlobalConstraintBuilder(context).build());
    }

    @Test
    void testSourceEdgesShareOneConjunction() {
        EncodingContext context = aggregate(2, List.of(List.of("a"), List.of("b")));
        List<BooleanFormula> existence = new GlobalConstraintBuilder(context).buildExistence();

        // src->{a,b} in un'unica congiunzione, poi a->snk e b->snk
        Assertions.assertEquals(3, existence.size());
        Assertions.assertEquals("And(A_1, A_3)", existence.get(0).toString());
    }

    @Test
    void testAggregationIsIdempotent() {
        List<List<String>> twice = new ArrayList<>(SAMPLES);
        twice.addAll(SAMPLES);

        BooleanFormula once = new GlobalConstraintBuilder(aggregate(2, SAMPLES)).build();
        BooleanFormula repeated = new GlobalConstraintBuilder(aggregate(2, twice)).build();

        Assertions.assertEquals(once, repeated);
    }

    @Test
    void testExistencePartMatchesPerSampleConstruction() {
        for (int slots = 1; slots <= 2; slots++) {
            EncodingContext context = aggregate(slots, SAMPLES);
            SentenceConstraintBuilder sentences = new SentenceConstraintBuilder(context);

            List<BooleanFormula> perSample = new ArrayList<>();
            for (List<String> sample : SAMPLES) {
                perSample.add(sentences.buildExistence(context.getAlphabet().positionsOf(sample)));
            }
            BooleanFormula aggregated = BooleanFormula.and(new GlobalConstraintBuilder(context).buildExistence());

            FormulaAssertions.assertEquivalent(context.getSpace(), BooleanFormula.and(perSample), aggregated);
        }
    }

    @Test
    void testWholeFormulaMatchesPerSampleConstruction() {
        for (int slots = 1; slots <= 2; slots++) {
            EncodingContext context = aggregate(slots, SAMPLES);
            SentenceConstraintBuilder sentences = new SentenceConstraintBuilder(context);

            List<BooleanFormula> perSample = new ArrayList<>();
            for (List<String> sample : SAMPLES) {
                perSample.add(sentences.build(sample));
            }
            BooleanFormula aggregated = new GlobalConstraintBuilder(context).build();

            FormulaAssertions.assertEquivalent(context.getSpace(), BooleanFormula.and(perSample), aggregated);
        }
    }

    @Test
    void testContinuityImplicationsPerMiddleSlot() {
        EncodingContext context = aggregate(3, List.of(List.of("a", "b", "a")));
        List<BooleanFormula> continuity = new GlobalConstraintBuilder(context).buildContinuity();

        // prima tripla (a, b, a) e coppia (b, a) prima di snk: k implicazioni ciascuna
        Assertions.assertEquals(6, continuity.size());
        for (BooleanFormula implication : continuity) {
            Assertions.assertEquals(BooleanFormula.Type.IMPLIES, implication.getType());
        }
    }
}
