package org.koa.encoding;

import org.koa.formula.BooleanFormula;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Formula autonoma "questa stringa è accettata", costruita dalle posizioni letterali.
 *
 * Usata negata per gli esempi negativi, oppure direttamente come predicato di
 * appartenenza. La stringa vuota produce la sentinella True.
 */
public final class SentenceConstraintBuilder {

    private final EncodingContext context;
    private final EdgePatterns patterns;

    public SentenceConstraintBuilder(EncodingContext context) {
        this.context = Objects.requireNonNull(context, "Contesto non può essere null");
        this.patterns = new EdgePatterns(context.getSpace());
    }

    /**
     * Costruisce la formula di accettazione di una stringa.
     *
     * @param sample stringa di simboli dell'alfabeto
     * @return parte A ∧ parte B, sentinella True per la stringa vuota
     * @throws IllegalArgumentException se la stringa contiene simboli fuori dall'alfabeto
     */
    public BooleanFormula build(List<String> sample) {
        Objects.requireNonNull(sample, "Esempio non può essere null");
        if (sample.isEmpty()) {
            return context.getSpace().trueSentinel();
        }
        List<Position> positions = context.getAlphabet().positionsOf(sample);
        return BooleanFormula.and(buildExistence(positions), buildContinuity(positions));
    }

    //region PARTE A

    /**
     * Esistenza degli archi lungo la stringa: partenza canonica, successore canonico,
     * coppie interne con ricerca k×k, arco verso snk (dallo slot canonico se n = 1).
     */
    BooleanFormula buildExistence(List<Position> s) {
        int n = s.size();
        List<BooleanFormula> parts = new ArrayList<>();

        parts.add(patterns.canonicalStart(s.get(0)));
        if (n > 1) {
            parts.add(patterns.canonicalSuccessor(s.get(0), s.get(1)));
        }
        if (n > 2) {
            List<BooleanFormula> interior = new ArrayList<>();
            for (int i = 1; i < n - 1; i++) {
                interior.add(patterns.anyPair(s.get(i), s.get(i + 1)));
            }
            parts.add(BooleanFormula.and(interior));
        }
        parts.add(patterns.reachSink(s.get(n - 1), n == 1));

        return BooleanFormula.and(parts);
    }

    //endregion

    //region PARTE B

    BooleanFormula buildContinuity(List<Position> s) {
        VariableSpace space = context.getSpace();
        int n = s.size();
        if (space.getSlots() <= 1 || n <= 1) {
            return space.trueSentinel();
        }

        List<BooleanFormula> parts = new ArrayList<>();
        if (n > 2) {
            parts.add(BooleanFormula.and(patterns.continueFromCanonical(s.get(0), s.get(1), s.get(2))));

            List<BooleanFormula> interior = new ArrayList<>();
            for (int i = 1; i < n - 2; i++) {
                interior.addAll(patterns.continueFromAnySlot(s.get(i), s.get(i + 1), s.get(i + 2)));
            }
            parts.add(interior.isEmpty() ? space.trueSentinel() : BooleanFormula.and(interior));
        }
        parts.add(BooleanFormula.and(patterns.continueIntoSink(s.get(n - 2), s.get(n - 1), n == 2)));

        return BooleanFormula.and(parts);
    }

    //endregion
}
