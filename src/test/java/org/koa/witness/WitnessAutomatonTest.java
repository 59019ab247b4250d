package org.koa.witness;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.koa.encoding.AlphabetIndex;
import org.koa.encoding.EncodingContext;
import org.koa.encoding.Position;
import org.koa.encoding.VariableSpace;
import org.koa.formula.BooleanFormula;
import org.koa.solver.ConstraintSolver;
import org.koa.solver.ModelValue;
import org.koa.solver.SolverStatistics;
import org.koa.solver.SolverStatus;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

class WitnessAutomatonTest {

    /**
     * Solver con modello fissato: veri solo gli indici indicati.
     */
    private static final class FixedModelSolver implements ConstraintSolver {

        private final Set<Integer> trueVariables;

        FixedModelSolver(Set<Integer> trueVariables) {
            this.trueVariables = trueVariables;
        }

        @Override
        public void add(BooleanFormula formula) {
            throw new UnsupportedOperationException();
        }

        @Override
        public SolverStatus check() {
            return SolverStatus.SATISFIABLE;
        }

        @Override
        public ModelValue model(int variable) {
            return trueVariables.contains(variable) ? ModelValue.TRUE : ModelValue.FALSE;
        }

        @Override
        public void setTimeout(int seconds) {
            // modello già fissato
        }

        @Override
        public SolverStatistics getStatistics() {
            return SolverStatistics.empty();
        }
    }

    private EncodingContext context;
    private WitnessAutomaton witness;

    @BeforeEach
    void setUp() {
        context = new EncodingContext(List.of("a", "b"), 2);
        AlphabetIndex alphabet = context.getAlphabet();
        VariableSpace space = context.getSpace();
        Position a = alphabet.symbol("a");
        Position b = alphabet.symbol("b");

        Set<Integer> edges = new HashSet<>();
        edges.add(space.canonicalSourceEdge(a));
        edges.add(space.indexOf(a, 1, b, 2));
        edges.add(space.sinkEdge(b, 2));
        edges.add(space.sinkEdge(a, 1));

        witness = WitnessAutomaton.fromModel(new FixedModelSolver(edges), context);
    }

    @Test
    void testAcceptance() {
        Assertions.assertTrue(witness.accepts(List.of("a")));
        Assertions.assertTrue(witness.accepts(List.of("a", "b")));
        Assertions.assertTrue(witness.accepts(List.of()));

        Assertions.assertFalse(witness.accepts(List.of("b")));
        Assertions.assertFalse(witness.accepts(List.of("a", "a")));
        Assertions.assertFalse(witness.accepts(List.of("a", "b", "b")));
    }

    @Test
    void testUnknownSymbol() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> witness.accepts(List.of("z")));
    }

    @Test
    void testTransitions() {
        Assertions.assertEquals(4, witness.getTransitions().size());
        Assertions.assertTrue(witness.hasEdge(context.getSpace().sinkEdge(context.getAlphabet().symbol("a"), 1)));
        Assertions.assertEquals("src -> a#1\na#1 -> b#2\na#1 -> snk\nb#2 -> snk\n", witness.describe());
        Assertions.assertEquals("WitnessAutomaton[4 transizioni]", witness.toString());
    }
}
