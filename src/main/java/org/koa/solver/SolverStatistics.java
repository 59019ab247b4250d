package org.koa.solver;

import java.util.Objects;

/**
 * STATISTICHE DI RISOLUZIONE - Metriche dell'ultima verifica
 *
 * Dimensione della CNF passata al solver e tempo di risoluzione. Le variabili del
 * problema sono gli indici del motore di codifica, quelle ausiliarie sono introdotte
 * dalla trasformazione di Tseitin.
 */
public final class SolverStatistics {

    /** Variabili del motore, indici 1..problemVariables */
    private final int problemVariables;

    /** Variabili introdotte dalla trasformazione di Tseitin */
    private final int auxiliaryVariables;

    /** Clausole effettivamente passate al solver */
    private final int clauses;

    /** Durata dell'ultima verifica in millisecondi */
    private final long solvingTimeMs;

    public SolverStatistics(int problemVariables, int auxiliaryVariables, int clauses, long solvingTimeMs) {
        this.problemVariables = problemVariables;
        this.auxiliaryVariables = auxiliaryVariables;
        this.clauses = clauses;
        this.solvingTimeMs = solvingTimeMs;
    }

    /**
     * @return statistiche vuote, prima di qualsiasi verifica
     */
    public static SolverStatistics empty() {
        return new SolverStatistics(0, 0, 0, 0);
    }

    //region ACCESSORS

    public int getProblemVariables() {
        return problemVariables;
    }

    public int getAuxiliaryVariables() {
        return auxiliaryVariables;
    }

    public int getClauses() {
        return clauses;
    }

    public long getSolvingTimeMs() {
        return solvingTimeMs;
    }

    public int totalVariables() {
        return problemVariables + auxiliaryVariables;
    }

    //endregion

    /**
     * Report testuale multi-riga, una metrica per riga.
     */
    public String format() {
        return "Variabili del problema: " + problemVariables + "\n"
                + "Variabili ausiliarie: " + auxiliaryVariables + "\n"
                + "Clausole: " + clauses + "\n"
                + "Tempo di risoluzione: " + solvingTimeMs + " ms";
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        SolverStatistics other = (SolverStatistics) obj;
        return problemVariables == other.problemVariables
                && auxiliaryVariables == other.auxiliaryVariables
                && clauses == other.clauses
                && solvingTimeMs == other.solvingTimeMs;
    }

    @Override
    public int hashCode() {
        return Objects.hash(problemVariables, auxiliaryVariables, clauses, solvingTimeMs);
    }

    @Override
    public String toString() {
        return "SolverStatistics{variabili=" + problemVariables + "+" + auxiliaryVariables
                + ", clausole=" + clauses + ", tempo=" + solvingTimeMs + "ms}";
    }
}
