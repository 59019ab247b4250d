package org.koa.samples;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;

/**
 * INSIEME DI ESEMPI - Stringhe lette da un file e relativo alfabeto
 *
 * Gli esempi mantengono l'ordine del file, duplicati compresi; l'alfabeto è l'insieme
 * ordinato dei simboli che vi compaiono. Entrambe le liste sono copie immutabili.
 */
public final class SampleSet {

    /** Esempi nell'ordine del file */
    private final List<List<String>> samples;

    /** Simboli distinti, in ordine lessicografico */
    private final List<String> alphabet;

    /**
     * @throws NullPointerException se una delle due liste è null
     */
    public SampleSet(List<List<String>> samples, List<String> alphabet) {
        Objects.requireNonNull(samples, "Esempi non possono essere null");
        Objects.requireNonNull(alphabet, "Alfabeto non può essere null");
        List<List<String>> copy = new ArrayList<>(samples.size());
        for (List<String> sample : samples) {
            copy.add(List.copyOf(sample));
        }
        this.samples = List.copyOf(copy);
        this.alphabet = List.copyOf(alphabet);
    }

    public static SampleSet empty() {
        return new SampleSet(List.of(), List.of());
    }

    public List<List<String>> getSamples() {
        return samples;
    }

    public List<String> getAlphabet() {
        return alphabet;
    }

    public int size() {
        return samples.size();
    }

    /**
     * Unione ordinata degli alfabeti di più insiemi di esempi.
     */
    public static List<String> mergedAlphabet(SampleSet... sets) {
        TreeSet<String> symbols = new TreeSet<>();
        for (SampleSet set : sets) {
            symbols.addAll(set.getAlphabet());
        }
        return new ArrayList<>(symbols);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        SampleSet other = (SampleSet) obj;
        return samples.equals(other.samples) && alphabet.equals(other.alphabet);
    }

    @Override
    public int hashCode() {
        return Objects.hash(samples, alphabet);
    }

    @Override
    public String toString() {
        return "SampleSet{esempi=" + samples.size() + ", alfabeto=" + alphabet + '}';
    }
}
