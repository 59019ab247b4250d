package org.koa.solver;

/**
 * Esito di una verifica di soddisfacibilità.
 */
public enum SolverStatus {
    SATISFIABLE,
    UNSATISFIABLE,
    /** Tempo limite scaduto prima di una risposta */
    UNKNOWN
}
