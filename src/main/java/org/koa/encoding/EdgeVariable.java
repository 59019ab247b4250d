package org.koa.encoding;

import java.util.Objects;

/**
 * VARIABILE DI ARCO - Quadrupla (id1, slot1, id2, slot2)
 *
 * Afferma "esiste un arco da (from, fromSlot) a (to, toSlot)". È la forma decodificata
 * di un indice di VariableSpace e la forma in cui l'automa testimone espone le transizioni.
 *
 * INVARIANTI:
 * • estremi non null
 * • immutabile, uguaglianza sui quattro componenti
 */
public final class EdgeVariable {

    //region ATTRIBUTI

    /** Posizione di partenza (src o simbolo) */
    private final Position from;

    /** Slot di partenza: 0 per src, 1..k per un simbolo */
    private final int fromSlot;

    /** Posizione di arrivo (simbolo o snk) */
    private final Position to;

    /** Slot di arrivo: 0 per snk, 1..k per un simbolo */
    private final int toSlot;

    //endregion

    /**
     * @throws NullPointerException se una delle due posizioni è null
     */
    public EdgeVariable(Position from, int fromSlot, Position to, int toSlot) {
        this.from = Objects.requireNonNull(from, "Posizione di partenza non può essere null");
        this.fromSlot = fromSlot;
        this.to = Objects.requireNonNull(to, "Posizione di arrivo non può essere null");
        this.toSlot = toSlot;
    }

    //region ACCESSORS

    public Position getFrom() {
        return from;
    }

    public int getFromSlot() {
        return fromSlot;
    }

    public Position getTo() {
        return to;
    }

    public int getToSlot() {
        return toSlot;
    }

    //endregion

    //region RAPPRESENTAZIONE E UGUAGLIANZA

    /**
     * Forma compatta per output: {@code src -> a#1}, {@code a#1 -> b#2}, {@code b#2 -> snk}.
     */
    public String describe() {
        return label(from, fromSlot) + " -> " + label(to, toSlot);
    }

    private static String label(Position position, int slot) {
        return position.isSymbol() ? position + "#" + slot : position.toString();
    }

    @Override
    public String toString() {
        return "EdgeVariable{" + describe() + '}';
    }

    /**
     * Uguaglianza sui quattro componenti della quadrupla.
     */
    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        EdgeVariable other = (EdgeVariable) obj;
        return fromSlot == other.fromSlot
                && toSlot == other.toSlot
                && from.equals(other.from)
                && to.equals(other.to);
    }

    @Override
    public int hashCode() {
        return Objects.hash(from, fromSlot, to, toSlot);
    }

    //endregion
}
