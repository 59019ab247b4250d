package org.koa.encoding;

import org.koa.formula.BooleanFormula;

import java.util.ArrayList;
import java.util.List;

/**
 * Sotto-formule condivise dal vincolo globale e dal vincolo per singola stringa.
 *
 * Entrambi i costruttori descrivono gli stessi pattern (un arco, una coppia, una tripla)
 * e devono produrre esattamente le stesse sotto-formule perché l'aggregazione resti
 * equivalente alla costruzione per stringa.
 */
final class EdgePatterns {

    private final VariableSpace space;

    EdgePatterns(VariableSpace space) {
        this.space = space;
    }

    //region PARTE A - ESISTENZA DEGLI ARCHI

    /**
     * src → (c, 1)
     */
    BooleanFormula canonicalStart(Position first) {
        return space.formula(space.canonicalSourceEdge(first));
    }

    /**
     * OR_m (c1, 1) → (c2, m)
     */
    BooleanFormula canonicalSuccessor(Position first, Position second) {
        return space.anyOf(space.successorEdges(first, Position.CANONICAL_SLOT, second), true);
    }

    /**
     * OR_{k1,k2} (c1, k1) → (c2, k2)
     */
    BooleanFormula anyPair(Position from, Position to) {
        return space.anyOf(space.slotPairEdges(from, to), true);
    }

    /**
     * Arco verso snk: dallo slot canonico se ancorato, altrimenti da uno slot qualsiasi.
     */
    BooleanFormula reachSink(Position last, boolean anchored) {
        if (anchored) {
            return space.formula(space.sinkEdge(last, Position.CANONICAL_SLOT));
        }
        return space.anyOf(space.sinkEdges(last), true);
    }

    //endregion

    //region PARTE B - CONTINUITÀ DEL CAMMINO

    /**
     * Per ogni k2: (c1, 1) → (c2, k2) implica OR_k3 (c2, k2) → (c3, k3).
     */
    List<BooleanFormula> continueFromCanonical(Position first, Position middle, Position last) {
        List<BooleanFormula> result = new ArrayList<>(space.getSlots());
        for (int k2 = 1; k2 <= space.getSlots(); k2++) {
            BooleanFormula pre = space.formula(space.indexOf(first, Position.CANONICAL_SLOT, middle, k2));
            BooleanFormula post = space.anyOf(space.successorEdges(middle, k2, last), true);
            result.add(BooleanFormula.implies(pre, post));
        }
        return result;
    }

    /**
     * Per ogni k2: OR_k1 (c1, k1) → (c2, k2) implica OR_k3 (c2, k2) → (c3, k3).
     */
    List<BooleanFormula> continueFromAnySlot(Position first, Position middle, Position last) {
        List<BooleanFormula> result = new ArrayList<>(space.getSlots());
        for (int k2 = 1; k2 <= space.getSlots(); k2++) {
            BooleanFormula pre = space.anyOf(space.predecessorEdges(first, middle, k2), true);
            BooleanFormula post = space.anyOf(space.successorEdges(middle, k2, last), true);
            result.add(BooleanFormula.implies(pre, post));
        }
        return result;
    }

    /**
     * Per ogni k2: arco entrante in (c2, k2) da c1 implica (c2, k2) → snk.
     * Se ancorato il predecessore è lo slot canonico di c1.
     */
    List<BooleanFormula> continueIntoSink(Position previous, Position last, boolean anchored) {
        List<BooleanFormula> result = new ArrayList<>(space.getSlots());
        for (int k2 = 1; k2 <= space.getSlots(); k2++) {
            BooleanFormula pre = anchored
                    ? space.formula(space.indexOf(previous, Position.CANONICAL_SLOT, last, k2))
                    : space.anyOf(space.predecessorEdges(previous, last, k2), true);
            BooleanFormula post = space.formula(space.sinkEdge(last, k2));
            result.add(BooleanFormula.implies(pre, post));
        }
        return result;
    }

    //endregion
}
