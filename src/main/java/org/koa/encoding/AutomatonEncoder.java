package org.koa.encoding;

import org.koa.formula.BooleanFormula;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * CODIFICATORE DI AUTOMI - Facciata di sessione del motore di codifica
 *
 * Ciclo di vita:
 * 1. initialize(alfabeto, k), una sola volta
 * 2. aggregatePositive()/aggregatePositives() per l'evidenza positiva
 * 3. deterministicConstraint(), globalConstraint(), sentenceConstraint(), negativeConstraint()
 *    oppure encode() per la formula completa
 *
 * Qualsiasi operazione prima di initialize fallisce con IllegalStateException, così
 * come una seconda inizializzazione: la configurazione non si cambia a metà sessione.
 */
public final class AutomatonEncoder {

    private static final Logger LOGGER = Logger.getLogger(AutomatonEncoder.class.getName());

    /** Contesto della sessione, null fino a initialize() */
    private EncodingContext context;

    private PositiveAggregator aggregator;
    private GlobalConstraintBuilder globalBuilder;
    private SentenceConstraintBuilder sentenceBuilder;

    /** Vincolo di determinismo, costruito alla prima richiesta */
    private BooleanFormula determinism;

    //region INIZIALIZZAZIONE

    /**
     * @throws IllegalStateException se già inizializzato
     * @throws IllegalArgumentException se la configurazione non è valida
     */
    public void initialize(List<String> alphabet, int slots) {
        if (context != null) {
            throw new IllegalStateException("Configurazione già inizializzata: " + context.getAlphabet()
                    + ", k=" + context.getSlots());
        }
        EncodingContext created = new EncodingContext(alphabet, slots);
        this.aggregator = new PositiveAggregator(created);
        this.globalBuilder = new GlobalConstraintBuilder(created);
        this.sentenceBuilder = new SentenceConstraintBuilder(created);
        this.context = created;

        LOGGER.info("Codificatore inizializzato: S=" + created.getAlphabet().size() + ", k=" + slots
                + ", variabili=" + created.getSpace().edgeCount());
    }

    /**
     * @return true dopo una initialize() riuscita
     */
    public boolean isInitialized() {
        return context != null;
    }

    /**
     * @throws IllegalStateException se non inizializzato
     */
    public EncodingContext getContext() {
        requireInitialized();
        return context;
    }

    private void requireInitialized() {
        if (context == null) {
            throw new IllegalStateException("Configurazione non inizializzata: chiamare initialize(alfabeto, k)");
        }
    }

    //endregion

    //region OPERAZIONI

    /**
     * Vincolo di determinismo della configurazione, calcolato una volta e riusato.
     *
     * @return True se k = 1
     * @throws IllegalStateException se non inizializzato
     */
    public BooleanFormula deterministicConstraint() {
        requireInitialized();
        if (determinism == null) {
            determinism = new DeterminismConstraint(context).build();
        }
        return determinism;
    }

    /**
     * Registra i pattern di un esempio positivo nelle tabelle delle occorrenze.
     *
     * @throws IllegalStateException se non inizializzato
     * @throws IllegalArgumentException se l'esempio contiene simboli fuori dall'alfabeto
     */
    public void aggregatePositive(List<String> sample) {
        requireInitialized();
        aggregator.add(sample);
    }

    public void aggregatePositives(Collection<? extends List<String>> samples) {
        requireInitialized();
        aggregator.addAll(samples);
    }

    /**
     * Vincolo globale costruito dalle tabelle: riflette tutti i positivi aggregati finora.
     *
     * @throws IllegalStateException se non inizializzato
     */
    public BooleanFormula globalConstraint() {
        requireInitialized();
        return globalBuilder.build();
    }

    /**
     * Formula autonoma di una stringa, indipendente dalle tabelle.
     *
     * @return True per la stringa vuota
     * @throws IllegalStateException se non inizializzato
     * @throws IllegalArgumentException se la stringa contiene simboli fuori dall'alfabeto
     */
    public BooleanFormula sentenceConstraint(List<String> sample) {
        requireInitialized();
        return sentenceBuilder.build(sample);
    }

    /**
     * Congiunzione delle negazioni delle formule autonome; True se non ci sono esempi negativi.
     */
    public BooleanFormula negativeConstraint(Collection<? extends List<String>> samples) {
        requireInitialized();
        Objects.requireNonNull(samples, "Esempi negativi non possono essere null");
        if (samples.isEmpty()) {
            return context.getSpace().trueSentinel();
        }
        List<BooleanFormula> negated = new ArrayList<>(samples.size());
        for (List<String> sample : samples) {
            negated.add(BooleanFormula.not(sentenceBuilder.build(sample)));
        }
        return BooleanFormula.and(negated);
    }

    /**
     * Formula completa: determinismo ∧ vincolo globale dei positivi ∧ negazione dei negativi.
     * Gli esempi positivi vengono aggregati nelle tabelle del contesto.
     */
    public BooleanFormula encode(Collection<? extends List<String>> positives,
                                 Collection<? extends List<String>> negatives) {
        requireInitialized();
        aggregatePositives(positives);
        BooleanFormula result = BooleanFormula.and(
                deterministicConstraint(),
                globalConstraint(),
                negativeConstraint(negatives));

        LOGGER.fine("Formula completa: " + result.size() + " nodi, "
                + context.getTables().distinctKeys() + " pattern positivi distinti");
        return result;
    }

    //endregion
}
