package org.koa.solver;

/**
 * Valore di una variabile nel modello restituito dal solver.
 */
public enum ModelValue {
    TRUE,
    FALSE,
    /** Il solver non ha fissato la variabile: qualsiasi valore va bene */
    UNASSIGNED;

    public boolean isTrue() {
        return this == TRUE;
    }
}
