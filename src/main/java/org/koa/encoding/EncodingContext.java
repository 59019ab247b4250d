package org.koa.encoding;

import java.util.List;
import java.util.logging.Logger;

/**
 * CONTESTO DI CODIFICA - Stato esplicito di una configurazione (alfabeto, k)
 *
 * Configurazioni diverse vivono in contesti diversi e non interferiscono: nessuno
 * stato del motore è condiviso a livello di classe.
 *
 * COMPONENTI:
 * • {@link AlphabetIndex}: id densi dei simboli e sentinelle src/snk
 * • {@link VariableSpace}: biiezione archi ↔ indici, sentinelle costanti
 * • {@link OccurrenceTables}: evidenza aggregata degli esempi positivi (unico stato mutabile)
 */
public final class EncodingContext {

    private static final Logger LOGGER = Logger.getLogger(EncodingContext.class.getName());

    private final AlphabetIndex alphabet;
    private final VariableSpace space;

    /** Tabelle alimentate dagli esempi positivi aggregati in questo contesto */
    private final OccurrenceTables tables;

    /**
     * @param alphabet simboli distinti, eventualmente nessuno
     * @param slots k, numero di slot per simbolo
     * @throws IllegalArgumentException se k &lt; 1 o l'alfabeto contiene simboli ripetuti
     */
    public EncodingContext(List<String> alphabet, int slots) {
        this.alphabet = new AlphabetIndex(alphabet);
        this.space = new VariableSpace(this.alphabet, slots);
        this.tables = new OccurrenceTables(this.alphabet);

        LOGGER.fine("Contesto di codifica inizializzato: " + this.alphabet + ", k=" + slots);
    }

    //region ACCESSORS

    public AlphabetIndex getAlphabet() {
        return alphabet;
    }

    public VariableSpace getSpace() {
        return space;
    }

    /**
     * @return tabelle delle occorrenze, modificate dall'aggregazione dei positivi
     */
    public OccurrenceTables getTables() {
        return tables;
    }

    /**
     * @return k, numero di slot per simbolo
     */
    public int getSlots() {
        return space.getSlots();
    }

    //endregion
}
