package org.koa.witness;

import org.koa.encoding.AlphabetIndex;
import org.koa.encoding.EdgeVariable;
import org.koa.encoding.EncodingContext;
import org.koa.encoding.Position;
import org.koa.encoding.VariableSpace;
import org.koa.solver.ConstraintSolver;
import org.koa.solver.ModelValue;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/**
 * AUTOMA TESTIMONE - Transizioni lette dal modello di una formula soddisfacibile
 *
 * Ogni variabile di arco vera nel modello diventa una transizione. L'automa permette
 * di verificare a posteriori quali stringhe sono accettate e di stampare la soluzione.
 */
public final class WitnessAutomaton {

    private static final Logger LOGGER = Logger.getLogger(WitnessAutomaton.class.getName());

    private final EncodingContext context;
    private final BitSet trueEdges;
    private final List<EdgeVariable> transitions;

    private WitnessAutomaton(EncodingContext context, BitSet trueEdges) {
        this.context = context;
        this.trueEdges = trueEdges;

        List<EdgeVariable> decoded = new ArrayList<>();
        VariableSpace space = context.getSpace();
        for (int index = trueEdges.nextSetBit(1); index >= 0; index = trueEdges.nextSetBit(index + 1)) {
            decoded.add(space.decode(index));
        }
        this.transitions = Collections.unmodifiableList(decoded);
    }

    /**
     * Legge il modello del solver. Le variabili non assegnate sono considerate false.
     *
     * @throws IllegalStateException se l'ultimo check() del solver non era SATISFIABLE
     */
    public static WitnessAutomaton fromModel(ConstraintSolver solver, EncodingContext context) {
        Objects.requireNonNull(solver, "Solver non può essere null");
        Objects.requireNonNull(context, "Contesto non può essere null");

        int edgeCount = context.getSpace().edgeCount();
        BitSet trueEdges = new BitSet(edgeCount + 1);
        for (int index = 1; index <= edgeCount; index++) {
            if (solver.model(index) == ModelValue.TRUE) {
                trueEdges.set(index);
            }
        }
        WitnessAutomaton witness = new WitnessAutomaton(context, trueEdges);
        LOGGER.fine("Automa testimone con " + witness.transitions.size() + " transizioni");
        return witness;
    }

    public List<EdgeVariable> getTransitions() {
        return transitions;
    }

    public boolean hasEdge(int index) {
        return trueEdges.get(index);
    }

    /**
     * Simula la stringa sugli slot: si parte dallo slot canonico del primo simbolo e si
     * seguono gli archi veri; la stringa è accettata se uno slot finale raggiunge snk.
     * La stringa vuota è sempre accettata.
     *
     * @throws IllegalArgumentException se la stringa contiene simboli fuori dall'alfabeto
     */
    public boolean accepts(List<String> sample) {
        Objects.requireNonNull(sample, "Esempio non può essere null");
        if (sample.isEmpty()) {
            return true;
        }

        AlphabetIndex alphabet = context.getAlphabet();
        VariableSpace space = context.getSpace();
        List<Position> positions = alphabet.positionsOf(sample);

        Position first = positions.get(0);
        if (!hasEdge(space.canonicalSourceEdge(first))) {
            return false;
        }

        Set<Integer> current = new LinkedHashSet<>();
        current.add(Position.CANONICAL_SLOT);
        for (int i = 1; i < positions.size() && !current.isEmpty(); i++) {
            Set<Integer> next = new LinkedHashSet<>();
            for (int slot : current) {
                for (int m = 1; m <= space.getSlots(); m++) {
                    if (hasEdge(space.indexOf(positions.get(i - 1), slot, positions.get(i), m))) {
                        next.add(m);
                    }
                }
            }
            current = next;
        }

        Position last = positions.get(positions.size() - 1);
        for (int slot : current) {
            if (hasEdge(space.sinkEdge(last, slot))) {
                return true;
            }
        }
        return false;
    }

    /**
     * Una transizione per riga, nella forma {@code src -> a#1}.
     */
    public String describe() {
        StringBuilder sb = new StringBuilder();
        for (EdgeVariable transition : transitions) {
            sb.append(transition.describe()).append('\n');
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return "WitnessAutomaton[" + transitions.size() + " transizioni]";
    }
}
