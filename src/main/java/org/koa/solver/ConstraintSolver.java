package org.koa.solver;

import org.koa.formula.BooleanFormula;

/**
 * Contratto del solver esterno consumato dal motore di codifica.
 *
 * Le formule aggiunte si accumulano; check() decide la loro congiunzione. Dopo un
 * esito SATISFIABLE il modello è consultabile per variabile.
 */
public interface ConstraintSolver {

    void add(BooleanFormula formula);

    SolverStatus check();

    /**
     * @throws IllegalStateException se l'ultimo check() non ha restituito SATISFIABLE
     * @throws IllegalArgumentException se la variabile non appartiene al problema
     */
    ModelValue model(int variable);

    /**
     * @param seconds tempo massimo per check(), almeno 1
     */
    void setTimeout(int seconds);

    SolverStatistics getStatistics();
}
