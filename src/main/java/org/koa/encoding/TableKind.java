package org.koa.encoding;

/**
 * Le sette tabelle delle occorrenze alimentate dagli esempi positivi.
 *
 * Le prime quattro producono la parte A del vincolo globale (esistenza degli archi),
 * le ultime tre la parte B (continuità del cammino su triple di simboli).
 */
public enum TableKind {
    SOURCE_TO_FIRST(1, "src->primo"),
    FIRST_TO_SECOND(2, "primo->secondo"),
    INTERIOR_PAIR(2, "simbolo->simbolo"),
    LAST_TO_SINK(1, "ultimo->snk"),
    FIRST_TRIPLE(3, "(primo)id1->id2->id3"),
    INTERIOR_TRIPLE(3, "id1->id2->id3"),
    PAIR_BEFORE_SINK(2, "id1->id2->snk");

    private final int arity;
    private final String label;

    TableKind(int arity, String label) {
        this.arity = arity;
        this.label = label;
    }

    /**
     * @return numero di id che compongono una chiave della tabella
     */
    public int getArity() {
        return arity;
    }

    public String getLabel() {
        return label;
    }

    /**
     * @return true se la tabella contribuisce alla parte B (implicazioni)
     */
    public boolean isTransitivity() {
        return ordinal() >= FIRST_TRIPLE.ordinal();
    }
}
