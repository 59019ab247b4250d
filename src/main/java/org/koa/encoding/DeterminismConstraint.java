package org.koa.encoding;

import org.koa.formula.BooleanFormula;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * VINCOLO DI DETERMINISMO - Buona formazione indipendente dagli esempi
 *
 * CANONICALIZZAZIONE (una clausola per simbolo c):
 *   src → (c, 1)  OR  nessun arco src → (c, m) per alcun m
 * Rompe la simmetria tra gli slot: se c è raggiungibile da src, lo è dallo slot 1.
 *
 * DETERMINISMO LOCALE (una clausola per ogni terna c1, c2, k1):
 *   OR_m [ (c1, k1) → (c2, m) AND NOT gli altri slot ]  OR  nessun arco verso c2
 * Da ogni coppia (simbolo, slot) esiste al più una transizione verso un dato simbolo.
 *
 * Con k = 1 il determinismo è automatico e il vincolo degenera nella sentinella True.
 */
public final class DeterminismConstraint {

    private static final Logger LOGGER = Logger.getLogger(DeterminismConstraint.class.getName());

    private final EncodingContext context;

    public DeterminismConstraint(EncodingContext context) {
        this.context = Objects.requireNonNull(context, "Contesto non può essere null");
    }

    /**
     * Costruisce il vincolo per la configurazione del contesto.
     *
     * CONTEGGIO DEI CONGIUNTI (k &gt; 1):
     * • S clausole di canonicalizzazione
     * • S·S·k clausole di determinismo locale
     *
     * @return congiunzione delle clausole, sentinella True se k = 1
     */
    public BooleanFormula build() {
        VariableSpace space = context.getSpace();
        int slots = space.getSlots();
        if (slots == 1) {
            return space.trueSentinel();
        }

        List<Position> symbols = context.getAlphabet().positionsOf(context.getAlphabet().symbols());
        List<BooleanFormula> clauses = new ArrayList<>();

        for (Position symbol : symbols) {
            clauses.add(BooleanFormula.or(
                    space.formula(space.canonicalSourceEdge(symbol)),
                    space.allOf(space.sourceEdges(symbol), false)));
        }

        for (Position from : symbols) {
            for (Position to : symbols) {
                for (int k1 = 1; k1 <= slots; k1++) {
                    clauses.add(atMostOneSuccessor(space, from, k1, to));
                }
            }
        }

        LOGGER.fine("Vincolo di determinismo: " + clauses.size() + " clausole");
        return BooleanFormula.and(clauses);
    }

    /**
     * Al più uno tra gli archi (from, fromSlot) → (to, m): uno scelto e gli altri falsi, oppure nessuno.
     */
    private static BooleanFormula atMostOneSuccessor(VariableSpace space, Position from, int fromSlot, Position to) {
        List<Integer> candidates = space.successorEdges(from, fromSlot, to);
        List<BooleanFormula> alternatives = new ArrayList<>(candidates.size() + 1);

        for (int chosen : candidates) {
            List<Integer> others = new ArrayList<>(candidates);
            others.remove(Integer.valueOf(chosen));
            alternatives.add(BooleanFormula.and(space.formula(chosen), space.allOf(others, false)));
        }
        // nessun successore
        alternatives.add(space.allOf(candidates, false));

        return BooleanFormula.or(alternatives);
    }
}
