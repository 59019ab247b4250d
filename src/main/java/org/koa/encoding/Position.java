package org.koa.encoding;

/**
 * Posizione di un estremo di arco: la sorgente {@code src} (prima del primo simbolo),
 * un simbolo dell'alfabeto, oppure il pozzo {@code snk} (dopo l'ultimo simbolo).
 *
 * Le istanze sono create solo da {@link AlphabetIndex}, che conosce l'id del pozzo
 * ({@code S+1}). Sorgente e pozzo usano lo slot degenere {@link #DEGENERATE_SLOT}.
 */
public final class Position {

    /**
     * Natura della posizione, su cui si basano indirizzamento e consultazione delle tabelle.
     */
    public enum Kind {
        /** Prima del primo simbolo */
        SOURCE,
        /** Simbolo dell'alfabeto */
        SYMBOL,
        /** Dopo l'ultimo simbolo */
        SINK
    }

    /** Unico slot ammesso per src e snk */
    public static final int DEGENERATE_SLOT = 0;

    /** Slot fissato dalla rottura di simmetria per il primo arco uscente da src */
    public static final int CANONICAL_SLOT = 1;

    private final Kind kind;
    private final int id;
    private final String symbol;

    /**
     * Riservato ad {@link AlphabetIndex}.
     */
    Position(Kind kind, int id, String symbol) {
        this.kind = kind;
        this.id = id;
        this.symbol = symbol;
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * @return id denso: 0 per src, 1..S per i simboli, S+1 per snk
     */
    public int getId() {
        return id;
    }

    /**
     * @return il simbolo dell'alfabeto, null per src e snk
     */
    public String getSymbol() {
        return symbol;
    }

    public boolean isSource() {
        return kind == Kind.SOURCE;
    }

    public boolean isSink() {
        return kind == Kind.SINK;
    }

    public boolean isSymbol() {
        return kind == Kind.SYMBOL;
    }

    /**
     * Uguaglianza su natura e id: il simbolo è determinato dall'id.
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Position)) return false;
        Position other = (Position) o;
        return kind == other.kind && id == other.id;
    }

    @Override
    public int hashCode() {
        return 31 * kind.hashCode() + id;
    }

    @Override
    public String toString() {
        return switch (kind) {
            case SOURCE -> "src";
            case SINK -> "snk";
            case SYMBOL -> symbol;
        };
    }
}
