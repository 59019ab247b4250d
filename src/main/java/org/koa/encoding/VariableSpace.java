package org.koa.encoding;

import org.koa.formula.BooleanFormula;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * SPAZIO DELLE VARIABILI - Biiezione tra quadruple (id1, slot1, id2, slot2) e indici densi
 *
 * Con N = k·S + 1 ogni coppia (simbolo, slot) ha una riga r = (id-1)·k + slot in [1..N-1];
 * la riga/colonna 0 è riservata a src/snk. L'universo conta N² + 2 indici:
 *
 * LAYOUT DEGLI INDICI:
 * • 0                  → sentinella costante True
 * • [1 .. N-1]         → archi src → (simbolo, slot), indirizzati dalla sola colonna
 * • N                  → arco src → snk (stringa vuota), indice fisso
 * • r·N + c            → blocco interno (simbolo, slot) → (simbolo, slot), r, c in [1..N-1]
 * • (r+1)·N            → archi (simbolo, slot) → snk, uno per riga, fuori dal blocco interno
 * • N² + 1             → sentinella costante False
 *
 * Gli archi verso snk occupano la colonna 0 della riga successiva: è l'unica colonna che il
 * blocco interno non usa, quindi la mappa resta iniettiva e la decodifica è totale.
 */
public final class VariableSpace {

    private static final Logger LOGGER = Logger.getLogger(VariableSpace.class.getName());

    /** Prefisso dei nomi di variabile */
    private static final String VARIABLE_PREFIX = "A_";

    private final AlphabetIndex alphabet;
    private final int slots;
    private final int number;
    private final int edgeCount;

    /** Nodi variabile creati su richiesta, uno per indice */
    private final BooleanFormula[] variables;

    //region COSTRUZIONE

    /**
     * @param alphabet indice dell'alfabeto
     * @param slots k, numero di copie interne per simbolo (≥ 1)
     * @throws IllegalArgumentException se k &lt; 1
     */
    public VariableSpace(AlphabetIndex alphabet, int slots) {
        this.alphabet = Objects.requireNonNull(alphabet, "Alfabeto non può essere null");
        if (slots < 1) {
            throw new IllegalArgumentException("Configurazione non valida: k deve essere ≥ 1, ricevuto: " + slots);
        }
        this.slots = slots;
        this.number = slots * alphabet.size() + 1;
        this.edgeCount = Math.multiplyExact(number, number);
        this.variables = new BooleanFormula[edgeCount + 2];

        LOGGER.fine("Spazio variabili creato: S=" + alphabet.size() + ", k=" + slots
                + ", N=" + number + ", variabili=" + edgeCount);
    }

    //endregion

    //region DIMENSIONI

    /**
     * @return N = k·S + 1
     */
    public int getNumber() {
        return number;
    }

    /**
     * @return k, numero di slot per simbolo
     */
    public int getSlots() {
        return slots;
    }

    /**
     * @return indice dell'alfabeto su cui è costruito lo spazio
     */
    public AlphabetIndex getAlphabet() {
        return alphabet;
    }

    /**
     * @return N², numero di variabili di decisione (indici 1..N²)
     */
    public int edgeCount() {
        return edgeCount;
    }

    /**
     * @return N² + 2, dimensione dell'universo comprese le due sentinelle
     */
    public int universeSize() {
        return edgeCount + 2;
    }

    /**
     * @return 0, indice della sentinella True
     */
    public int trueIndex() {
        return 0;
    }

    /**
     * @return N² + 1, indice della sentinella False
     */
    public int falseIndex() {
        return edgeCount + 1;
    }

    //endregion

    //region CODIFICA QUADRUPLA → INDICE

    /**
     * Mappa un arco nel suo indice.
     *
     * @throws IllegalArgumentException se posizioni o slot non sono validi per la configurazione
     */
    public int indexOf(Position from, int fromSlot, Position to, int toSlot) {
        validateEndpoint(from, fromSlot, "partenza");
        validateEndpoint(to, toSlot, "arrivo");

        return switch (from.getKind()) {
            case SINK -> throw new IllegalArgumentException("Nessun arco può partire da snk");
            case SOURCE -> switch (to.getKind()) {
                case SOURCE -> throw new IllegalArgumentException("Nessun arco può arrivare in src");
                case SINK -> number;
                case SYMBOL -> rowOf(to, toSlot);
            };
            case SYMBOL -> switch (to.getKind()) {
                case SOURCE -> throw new IllegalArgumentException("Nessun arco può arrivare in src");
                case SINK -> (rowOf(from, fromSlot) + 1) * number;
                case SYMBOL -> rowOf(from, fromSlot) * number + rowOf(to, toSlot);
            };
        };
    }

    /**
     * @throws IllegalArgumentException se la quadrupla non è valida per la configurazione
     */
    public int indexOf(EdgeVariable edge) {
        return indexOf(edge.getFrom(), edge.getFromSlot(), edge.getTo(), edge.getToSlot());
    }

    /**
     * Forma per id interi, usata dalle tabelle delle occorrenze.
     */
    public int indexOf(int id1, int slot1, int id2, int slot2) {
        return indexOf(alphabet.position(id1), slot1, alphabet.position(id2), slot2);
    }

    private int rowOf(Position symbol, int slot) {
        return (symbol.getId() - 1) * slots + slot;
    }

    private void validateEndpoint(Position position, int slot, String role) {
        Objects.requireNonNull(position, "Posizione di " + role + " non può essere null");
        if (!position.equals(alphabet.position(position.getId()))) {
            throw new IllegalArgumentException("Posizione di " + role + " non appartiene alla configurazione: " + position);
        }
        if (position.isSymbol()) {
            if (slot < 1 || slot > slots) {
                throw new IllegalArgumentException("Slot non valido per " + position + ": " + slot + " (ammessi 1.." + slots + ")");
            }
        } else if (slot != Position.DEGENERATE_SLOT) {
            throw new IllegalArgumentException("Slot non valido per " + position + ": " + slot + " (ammesso solo 0)");
        }
    }

    //endregion

    //region DECODIFICA INDICE → QUADRUPLA

    /**
     * Decodifica un indice di variabile nella quadrupla corrispondente.
     *
     * @param index indice in [1..N²]
     * @throws IllegalArgumentException se l'indice è una sentinella o fuori dall'universo
     */
    public EdgeVariable decode(int index) {
        if (index < 1 || index > edgeCount) {
            throw new IllegalArgumentException("Indice non valido: " + index + " (ammessi 1.." + edgeCount + ")");
        }
        if (index < number) {
            return new EdgeVariable(alphabet.source(), Position.DEGENERATE_SLOT, symbolAt(index), slotAt(index));
        }
        if (index == number) {
            return new EdgeVariable(alphabet.source(), Position.DEGENERATE_SLOT, alphabet.sink(), Position.DEGENERATE_SLOT);
        }

        int row = index / number;
        int col = index % number;
        if (col == 0) {
            // (r+1)·N: arco verso snk della riga precedente
            int sinkRow = row - 1;
            return new EdgeVariable(symbolAt(sinkRow), slotAt(sinkRow), alphabet.sink(), Position.DEGENERATE_SLOT);
        }
        return new EdgeVariable(symbolAt(row), slotAt(row), symbolAt(col), slotAt(col));
    }

    private Position symbolAt(int row) {
        return alphabet.position((row - 1) / slots + 1);
    }

    private int slotAt(int row) {
        return (row - 1) % slots + 1;
    }

    /**
     * @return true se l'indice cade nel blocco interno simbolo → simbolo
     */
    public boolean isInterior(int index) {
        return index > number && index <= edgeCount && index % number != 0;
    }

    //endregion

    //region FORMULE SU INDICI

    /**
     * Restituisce il nodo associato a un indice dell'universo: le due sentinelle
     * diventano costanti, gli altri indici variabili {@code A_i}.
     */
    public BooleanFormula formula(int index) {
        if (index == trueIndex()) {
            return BooleanFormula.constant(true);
        }
        if (index == falseIndex()) {
            return BooleanFormula.constant(false);
        }
        if (index < 0 || index > falseIndex()) {
            throw new IllegalArgumentException("Indice non valido: " + index + " (universo 0.." + falseIndex() + ")");
        }
        BooleanFormula variable = variables[index];
        if (variable == null) {
            variable = BooleanFormula.variable(index, VARIABLE_PREFIX + index);
            variables[index] = variable;
        }
        return variable;
    }

    public BooleanFormula trueSentinel() {
        return formula(trueIndex());
    }

    public BooleanFormula falseSentinel() {
        return formula(falseIndex());
    }

    /**
     * Congiunzione delle variabili indicate, positive o negate.
     * Lista vuota → sentinella True.
     */
    public BooleanFormula allOf(List<Integer> indices, boolean positive) {
        if (indices.isEmpty()) {
            return trueSentinel();
        }
        return BooleanFormula.and(literals(indices, positive));
    }

    /**
     * Disgiunzione delle variabili indicate, positive o negate.
     * Lista vuota → sentinella True (nessun vincolo).
     */
    public BooleanFormula anyOf(List<Integer> indices, boolean positive) {
        if (indices.isEmpty()) {
            return trueSentinel();
        }
        return BooleanFormula.or(literals(indices, positive));
    }

    private List<BooleanFormula> literals(List<Integer> indices, boolean positive) {
        List<BooleanFormula> result = new ArrayList<>(indices.size());
        for (int index : indices) {
            BooleanFormula literal = formula(index);
            result.add(positive ? literal : BooleanFormula.not(literal));
        }
        return result;
    }

    //endregion

    //region LISTE DI ARCHI NOTEVOLI

    /**
     * Arco canonico src → (c, 1).
     */
    public int canonicalSourceEdge(Position symbol) {
        return indexOf(alphabet.source(), Position.DEGENERATE_SLOT, symbol, Position.CANONICAL_SLOT);
    }

    /**
     * Tutti gli archi src → (c, m), m in [1..k].
     */
    public List<Integer> sourceEdges(Position symbol) {
        List<Integer> result = new ArrayList<>(slots);
        for (int m = 1; m <= slots; m++) {
            result.add(indexOf(alphabet.source(), Position.DEGENERATE_SLOT, symbol, m));
        }
        return result;
    }

    /**
     * Archi (c1, slot1) → (c2, m), m in [1..k].
     */
    public List<Integer> successorEdges(Position from, int fromSlot, Position to) {
        List<Integer> result = new ArrayList<>(slots);
        for (int m = 1; m <= slots; m++) {
            result.add(indexOf(from, fromSlot, to, m));
        }
        return result;
    }

    /**
     * Archi (c1, k1) → (c2, k2) per una destinazione fissata, k1 in [1..k].
     */
    public List<Integer> predecessorEdges(Position from, Position to, int toSlot) {
        List<Integer> result = new ArrayList<>(slots);
        for (int k1 = 1; k1 <= slots; k1++) {
            result.add(indexOf(from, k1, to, toSlot));
        }
        return result;
    }

    /**
     * Ricerca completa k×k: tutti gli archi (c1, k1) → (c2, k2).
     */
    public List<Integer> slotPairEdges(Position from, Position to) {
        List<Integer> result = new ArrayList<>(slots * slots);
        for (int k1 = 1; k1 <= slots; k1++) {
            for (int k2 = 1; k2 <= slots; k2++) {
                result.add(indexOf(from, k1, to, k2));
            }
        }
        return result;
    }

    /**
     * Archi (c, k1) → snk, k1 in [1..k].
     */
    public List<Integer> sinkEdges(Position symbol) {
        List<Integer> result = new ArrayList<>(slots);
        for (int k1 = 1; k1 <= slots; k1++) {
            result.add(sinkEdge(symbol, k1));
        }
        return result;
    }

    /**
     * Arco (c, slot) → snk.
     */
    public int sinkEdge(Position symbol, int slot) {
        return indexOf(symbol, slot, alphabet.sink(), Position.DEGENERATE_SLOT);
    }

    //endregion
}
