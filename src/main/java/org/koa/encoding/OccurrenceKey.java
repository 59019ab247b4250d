package org.koa.encoding;

import java.util.List;
import java.util.Objects;

/**
 * Chiave di una tabella delle occorrenze: la sequenza di id del pattern osservato.
 *
 * {@code anchored} marca i pattern verso snk che iniziano in posizione 0 (l'unico
 * simbolo di una stringa lunga 1, la coppia di una stringa lunga 2): per questi il
 * predecessore è vincolato allo slot canonico.
 *
 * Usata come chiave di LinkedHashMap: uguaglianza e hash su id e flag di ancoraggio.
 */
public final class OccurrenceKey {

    /** Id del pattern, nell'ordine della stringa */
    private final List<Integer> ids;

    /** Pattern verso snk che parte dalla posizione 0 */
    private final boolean anchored;

    /**
     * @param ids id del pattern, copiati in una lista immutabile
     * @param anchored true per i pattern ancorati alla posizione 0
     */
    public OccurrenceKey(List<Integer> ids, boolean anchored) {
        Objects.requireNonNull(ids, "Id della chiave non possono essere null");
        this.ids = List.copyOf(ids);
        this.anchored = anchored;
    }

    //region FACTORY

    public static OccurrenceKey of(int... ids) {
        return new OccurrenceKey(toList(ids), false);
    }

    public static OccurrenceKey anchored(int... ids) {
        return new OccurrenceKey(toList(ids), true);
    }

    private static List<Integer> toList(int[] ids) {
        Integer[] boxed = new Integer[ids.length];
        for (int i = 0; i < ids.length; i++) {
            boxed[i] = ids[i];
        }
        return List.of(boxed);
    }

    //endregion

    //region ACCESSORS

    /**
     * @return id non modificabili del pattern
     */
    public List<Integer> getIds() {
        return ids;
    }

    public boolean isAnchored() {
        return anchored;
    }

    /**
     * @param position posizione nel pattern, da 0
     * @return id in quella posizione
     */
    public int id(int position) {
        return ids.get(position);
    }

    public int arity() {
        return ids.size();
    }

    //endregion

    //region UGUAGLIANZA E RAPPRESENTAZIONE

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        OccurrenceKey other = (OccurrenceKey) obj;
        return anchored == other.anchored && ids.equals(other.ids);
    }

    @Override
    public int hashCode() {
        return Objects.hash(ids, anchored);
    }

    /**
     * Forma "(1, 2)", con "*" finale per le chiavi ancorate.
     */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("(");
        for (int i = 0; i < ids.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(ids.get(i));
        }
        sb.append(')');
        if (anchored) sb.append('*');
        return sb.toString();
    }

    //endregion
}
