package org.koa.encoding;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * TABELLE DELLE OCCORRENZE - Accumulatori deduplicanti dell'evidenza positiva
 *
 * Ogni tabella mappa una chiave (uno, due o tre id di simbolo) nel numero di volte
 * in cui il pattern è stato osservato. Conta solo che il contatore sia positivo;
 * il valore esatto serve alla diagnostica. L'ordine di inserimento è conservato,
 * così la formula globale prodotta è deterministica.
 *
 * Le tabelle non vengono mai svuotate: vivono quanto il contesto che le possiede.
 */
public final class OccurrenceTables {

    private final AlphabetIndex alphabet;
    private final Map<TableKind, Map<OccurrenceKey, Integer>> tables = new EnumMap<>(TableKind.class);

    public OccurrenceTables(AlphabetIndex alphabet) {
        this.alphabet = Objects.requireNonNull(alphabet, "Alfabeto non può essere null");
        for (TableKind kind : TableKind.values()) {
            tables.put(kind, new LinkedHashMap<>());
        }
    }

    //region AGGIORNAMENTO

    /**
     * Registra un'occorrenza del pattern nella tabella indicata.
     *
     * @throws IllegalArgumentException se l'arità non corrisponde alla tabella o un id
     *                                  non è un simbolo dell'alfabeto
     */
    public void record(TableKind kind, OccurrenceKey key) {
        Objects.requireNonNull(kind, "Tabella non può essere null");
        Objects.requireNonNull(key, "Chiave non può essere null");
        if (key.arity() != kind.getArity()) {
            throw new IllegalArgumentException("Chiave " + key + " non valida per la tabella "
                    + kind.getLabel() + " (arità attesa " + kind.getArity() + ")");
        }
        for (int id : key.getIds()) {
            if (id < 1 || id > alphabet.size()) {
                throw new IllegalArgumentException("Id non valido nella chiave " + key + ": " + id
                        + " (ammessi 1.." + alphabet.size() + ")");
            }
        }
        tables.get(kind).merge(key, 1, Integer::sum);
    }

    //endregion

    //region CONSULTAZIONE

    /**
     * @return vista non modificabile della tabella, in ordine di inserimento
     */
    public Map<OccurrenceKey, Integer> entries(TableKind kind) {
        return Collections.unmodifiableMap(tables.get(kind));
    }

    public int count(TableKind kind, OccurrenceKey key) {
        return tables.get(kind).getOrDefault(key, 0);
    }

    /**
     * @return numero di chiavi distinte con contatore positivo, su tutte le tabelle
     */
    public int distinctKeys() {
        int result = 0;
        for (Map<OccurrenceKey, Integer> table : tables.values()) {
            for (int count : table.values()) {
                if (count > 0) result++;
            }
        }
        return result;
    }

    /**
     * @return somma di tutti i contatori, ripetizioni comprese
     */
    public int totalOccurrences() {
        int result = 0;
        for (Map<OccurrenceKey, Integer> table : tables.values()) {
            for (int count : table.values()) {
                result += count;
            }
        }
        return result;
    }

    public boolean isEmpty() {
        return distinctKeys() == 0;
    }

    /**
     * Stampa leggibile delle tabelle, divise tra parte A e parte B.
     */
    public String dump() {
        String separator = "*".repeat(60);
        StringBuilder sb = new StringBuilder();
        sb.append("vincolo A:\n").append(separator).append('\n');
        boolean transitivity = false;
        for (TableKind kind : TableKind.values()) {
            if (kind.isTransitivity() && !transitivity) {
                transitivity = true;
                sb.append(separator).append('\n');
                sb.append("vincolo B:\n").append(separator).append('\n');
            }
            sb.append(kind.getLabel()).append(": ").append(tables.get(kind)).append('\n');
        }
        sb.append(separator).append('\n');
        return sb.toString();
    }

    //endregion
}
