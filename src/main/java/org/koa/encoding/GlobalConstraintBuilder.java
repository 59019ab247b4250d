package org.koa.encoding;

import org.koa.formula.BooleanFormula;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * VINCOLO GLOBALE - Una formula per tutta l'evidenza positiva distinta
 *
 * Traduce le tabelle delle occorrenze in una congiunzione di:
 * • PARTE A: archi canonici src→c (un'unica congiunzione), successori del primo simbolo,
 *   coppie interne con ricerca k×k, archi verso snk
 * • PARTE B: implicazioni di continuità per ogni tripla osservata e ogni slot intermedio
 *
 * Ogni pattern distinto produce un solo congiunto, qualunque sia il numero di esempi
 * che lo contengono. Le chiavi con contatore nullo sono ignorate.
 */
public final class GlobalConstraintBuilder {

    private static final Logger LOGGER = Logger.getLogger(GlobalConstraintBuilder.class.getName());

    private final EncodingContext context;
    private final EdgePatterns patterns;

    /**
     * @param context contesto le cui tabelle vengono lette a ogni build()
     */
    public GlobalConstraintBuilder(EncodingContext context) {
        this.context = Objects.requireNonNull(context, "Contesto non può essere null");
        this.patterns = new EdgePatterns(context.getSpace());
    }

    /**
     * Legge lo stato corrente delle tabelle: chiamate successive riflettono i positivi
     * aggregati nel frattempo, chiamate senza nuove aggregazioni producono la stessa formula.
     *
     * @return congiunzione di parte A e parte B
     */
    public BooleanFormula build() {
        List<BooleanFormula> parts = new ArrayList<>();
        parts.addAll(buildExistence());
        parts.addAll(buildContinuity());

        LOGGER.fine("Vincolo globale: " + parts.size() + " congiunti da "
                + context.getTables().distinctKeys() + " chiavi distinte");
        return BooleanFormula.and(parts);
    }

    //region PARTE A

    /**
     * Congiunti della parte A. Il primo è sempre la congiunzione degli archi canonici
     * src→(c, 1), True se nessun positivo è stato aggregato.
     */
    List<BooleanFormula> buildExistence() {
        VariableSpace space = context.getSpace();
        List<BooleanFormula> parts = new ArrayList<>();

        List<Integer> starts = new ArrayList<>();
        for (OccurrenceKey key : observed(TableKind.SOURCE_TO_FIRST)) {
            starts.add(space.canonicalSourceEdge(position(key, 0)));
        }
        parts.add(space.allOf(starts, true));

        for (OccurrenceKey key : observed(TableKind.FIRST_TO_SECOND)) {
            parts.add(patterns.canonicalSuccessor(position(key, 0), position(key, 1)));
        }
        for (OccurrenceKey key : observed(TableKind.INTERIOR_PAIR)) {
            parts.add(patterns.anyPair(position(key, 0), position(key, 1)));
        }
        for (OccurrenceKey key : observed(TableKind.LAST_TO_SINK)) {
            parts.add(patterns.reachSink(position(key, 0), key.isAnchored()));
        }
        return parts;
    }

    //endregion

    //region PARTE B

    /**
     * Implicazioni della parte B, una per slot intermedio di ogni tripla osservata.
     */
    List<BooleanFormula> buildContinuity() {
        List<BooleanFormula> parts = new ArrayList<>();

        for (OccurrenceKey key : observed(TableKind.FIRST_TRIPLE)) {
            parts.addAll(patterns.continueFromCanonical(position(key, 0), position(key, 1), position(key, 2)));
        }
        for (OccurrenceKey key : observed(TableKind.INTERIOR_TRIPLE)) {
            parts.addAll(patterns.continueFromAnySlot(position(key, 0), position(key, 1), position(key, 2)));
        }
        for (OccurrenceKey key : observed(TableKind.PAIR_BEFORE_SINK)) {
            parts.addAll(patterns.continueIntoSink(position(key, 0), position(key, 1), key.isAnchored()));
        }
        return parts;
    }

    //endregion

    private List<OccurrenceKey> observed(TableKind kind) {
        List<OccurrenceKey> result = new ArrayList<>();
        for (Map.Entry<OccurrenceKey, Integer> entry : context.getTables().entries(kind).entrySet()) {
            if (entry.getValue() > 0) {
                result.add(entry.getKey());
            }
        }
        return result;
    }

    private Position position(OccurrenceKey key, int index) {
        return context.getAlphabet().position(key.id(index));
    }
}
