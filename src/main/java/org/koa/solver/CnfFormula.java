package org.koa.solver;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * FORMULA CNF - Clausole su letterali interi
 *
 * Le variabili 1..problemVariables sono quelle del motore di codifica (stesso indice),
 * quelle successive sono ausiliarie introdotte dalla trasformazione di Tseitin.
 * Un letterale positivo indica la variabile vera, uno negativo la variabile negata.
 */
public final class CnfFormula {

    private final int problemVariables;
    private final List<int[]> clauses = new ArrayList<>();
    private int variableCount;

    public CnfFormula(int problemVariables) {
        if (problemVariables < 0) {
            throw new IllegalArgumentException("Numero di variabili non valido: " + problemVariables);
        }
        this.problemVariables = problemVariables;
        this.variableCount = problemVariables;
    }

    /**
     * @return indice della nuova variabile ausiliaria
     */
    int newAuxiliaryVariable() {
        return ++variableCount;
    }

    /**
     * @throws IllegalArgumentException se un letterale è 0 o riferisce una variabile inesistente
     */
    void addClause(int... literals) {
        for (int literal : literals) {
            if (literal == 0 || Math.abs(literal) > variableCount) {
                throw new IllegalArgumentException("Letterale non valido: " + literal
                        + " (variabili 1.." + variableCount + ")");
            }
        }
        clauses.add(literals.clone());
    }

    public List<int[]> getClauses() {
        return Collections.unmodifiableList(clauses);
    }

    public int getClauseCount() {
        return clauses.size();
    }

    public int getVariableCount() {
        return variableCount;
    }

    public int getProblemVariableCount() {
        return problemVariables;
    }

    public int getAuxiliaryVariableCount() {
        return variableCount - problemVariables;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (int[] clause : clauses) {
            if (sb.length() > 0) sb.append(" ∧ ");
            sb.append(Arrays.toString(clause));
        }
        return sb.toString();
    }
}
