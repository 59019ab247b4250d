package org.koa.encoding;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * INDICE DELL'ALFABETO - Assegna a ogni simbolo un id denso in [1..S]
 *
 * Mantiene l'ordine dei simboli così come forniti e riserva due id sentinella:
 * 0 per la sorgente {@code src} e S+1 per il pozzo {@code snk}. Dopo la mappatura
 * i simboli non vengono più confrontati per valore: il resto del motore lavora
 * solo con {@link Position} e id interi.
 *
 * LAYOUT DEGLI ID:
 * • 0          → src, prima del primo simbolo di ogni stringa
 * • 1 .. S     → simboli, nell'ordine dell'alfabeto fornito
 * • S + 1      → snk, dopo l'ultimo simbolo di ogni stringa
 *
 * INVARIANTI:
 * • simboli distinti e non null, alfabeto vuoto ammesso (S = 0, snk ha id 1)
 * • unica fabbrica di {@link Position}: ogni posizione del motore proviene da qui
 * • immutabile dopo la costruzione
 */
public final class AlphabetIndex {

    /** Id riservato alla sorgente src */
    public static final int SOURCE_ID = 0;

    //region ATTRIBUTI

    /** Simboli nell'ordine che determina gli id, lista non modificabile */
    private final List<String> symbols;

    /** Posizione di ogni simbolo, per la risoluzione simbolo → id */
    private final Map<String, Position> bySymbol;

    private final Position source;
    private final Position sink;

    //endregion

    /**
     * @param alphabet simboli distinti, nell'ordine che determina gli id (può essere vuoto)
     * @throws IllegalArgumentException se un simbolo è null o ripetuto
     */
    public AlphabetIndex(List<String> alphabet) {
        Objects.requireNonNull(alphabet, "Alfabeto non può essere null");

        List<String> copy = new ArrayList<>(alphabet.size());
        Map<String, Position> positions = new HashMap<>();
        int id = 1;
        for (String symbol : alphabet) {
            if (symbol == null) {
                throw new IllegalArgumentException("Alfabeto non può contenere simboli null");
            }
            if (positions.containsKey(symbol)) {
                throw new IllegalArgumentException("Simbolo ripetuto nell'alfabeto: '" + symbol + "'");
            }
            positions.put(symbol, new Position(Position.Kind.SYMBOL, id++, symbol));
            copy.add(symbol);
        }

        this.symbols = Collections.unmodifiableList(copy);
        this.bySymbol = positions;
        this.source = new Position(Position.Kind.SOURCE, SOURCE_ID, null);
        this.sink = new Position(Position.Kind.SINK, copy.size() + 1, null);
    }

    /**
     * @return S, numero di simboli dell'alfabeto
     */
    public int size() {
        return symbols.size();
    }

    /**
     * @return simboli non modificabili, nell'ordine degli id
     */
    public List<String> symbols() {
        return symbols;
    }

    /**
     * @return posizione della sorgente src (id 0)
     */
    public Position source() {
        return source;
    }

    /**
     * @return posizione del pozzo snk (id S+1)
     */
    public Position sink() {
        return sink;
    }

    /**
     * @return S+1, id del pozzo
     */
    public int sinkId() {
        return sink.getId();
    }

    /**
     * Risolve un simbolo nella sua posizione.
     *
     * @param symbol simbolo da cercare
     * @return posizione con id in [1..S]
     * @throws IllegalArgumentException se il simbolo non appartiene all'alfabeto
     */
    public Position symbol(String symbol) {
        Position position = bySymbol.get(symbol);
        if (position == null) {
            throw new IllegalArgumentException("Simbolo non presente nell'alfabeto: '" + symbol + "'");
        }
        return position;
    }

    /**
     * @throws IllegalArgumentException se il simbolo non appartiene all'alfabeto
     */
    public int idOf(String symbol) {
        return symbol(symbol).getId();
    }

    /**
     * Risolve un id denso nella posizione corrispondente.
     *
     * @throws IllegalArgumentException se id fuori da [0..S+1]
     */
    public Position position(int id) {
        if (id == SOURCE_ID) {
            return source;
        }
        if (id == sink.getId()) {
            return sink;
        }
        if (id < 0 || id > symbols.size()) {
            throw new IllegalArgumentException("Id non valido: " + id + " (ammessi 0.." + sink.getId() + ")");
        }
        return bySymbol.get(symbols.get(id - 1));
    }

    /**
     * Mappa una stringa di simboli nelle rispettive posizioni.
     *
     * @param sample stringa di simboli, eventualmente vuota
     * @return posizioni nell'ordine della stringa
     * @throws IllegalArgumentException se un simbolo non appartiene all'alfabeto
     */
    public List<Position> positionsOf(List<String> sample) {
        List<Position> result = new ArrayList<>(sample.size());
        for (String symbol : sample) {
            result.add(symbol(symbol));
        }
        return result;
    }

    @Override
    public String toString() {
        return "AlphabetIndex" + symbols;
    }
}
