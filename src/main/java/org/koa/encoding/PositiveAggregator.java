package org.koa.encoding;

import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Scorre gli esempi positivi e alimenta le tabelle delle occorrenze, senza costruire formule.
 *
 * Per una stringa s[0..n-1]:
 * • s[0] in src→primo, s[n-1] in ultimo→snk (ancorata se n = 1)
 * • n > 1: (s[0], s[1]) in primo→secondo e (s[n-2], s[n-1]) in id1->id2->snk (ancorata se n = 2)
 * • n > 2: coppie interne (s[i], s[i+1]) con i in [1..n-2], la prima tripla e le triple interne
 *
 * La stringa vuota non aggiorna nulla.
 */
public final class PositiveAggregator {

    private final AlphabetIndex alphabet;
    private final OccurrenceTables tables;

    public PositiveAggregator(EncodingContext context) {
        Objects.requireNonNull(context, "Contesto non può essere null");
        this.alphabet = context.getAlphabet();
        this.tables = context.getTables();
    }

    /**
     * @throws IllegalArgumentException se la stringa contiene simboli fuori dall'alfabeto
     */
    public void add(List<String> sample) {
        Objects.requireNonNull(sample, "Esempio non può essere null");
        int n = sample.size();
        if (n == 0) {
            return;
        }

        int[] ids = new int[n];
        for (int i = 0; i < n; i++) {
            ids[i] = alphabet.idOf(sample.get(i));
        }

        tables.record(TableKind.SOURCE_TO_FIRST, OccurrenceKey.of(ids[0]));
        tables.record(TableKind.LAST_TO_SINK, n == 1
                ? OccurrenceKey.anchored(ids[n - 1])
                : OccurrenceKey.of(ids[n - 1]));

        if (n > 1) {
            tables.record(TableKind.FIRST_TO_SECOND, OccurrenceKey.of(ids[0], ids[1]));
            tables.record(TableKind.PAIR_BEFORE_SINK, n == 2
                    ? OccurrenceKey.anchored(ids[0], ids[1])
                    : OccurrenceKey.of(ids[n - 2], ids[n - 1]));
        }

        if (n > 2) {
            for (int i = 1; i < n - 1; i++) {
                tables.record(TableKind.INTERIOR_PAIR, OccurrenceKey.of(ids[i], ids[i + 1]));
            }
            tables.record(TableKind.FIRST_TRIPLE, OccurrenceKey.of(ids[0], ids[1], ids[2]));
            for (int i = 1; i < n - 2; i++) {
                tables.record(TableKind.INTERIOR_TRIPLE, OccurrenceKey.of(ids[i], ids[i + 1], ids[i + 2]));
            }
        }
    }

    /**
     * Aggrega gli esempi nell'ordine della collezione.
     */
    public void addAll(Collection<? extends List<String>> samples) {
        Objects.requireNonNull(samples, "Esempi non possono essere null");
        for (List<String> sample : samples) {
            add(sample);
        }
    }
}
