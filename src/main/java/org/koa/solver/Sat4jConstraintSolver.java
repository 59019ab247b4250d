package org.koa.solver;

import org.koa.formula.BooleanFormula;
import org.sat4j.core.VecInt;
import org.sat4j.minisat.SolverFactory;
import org.sat4j.specs.ContradictionException;
import org.sat4j.specs.ISolver;
import org.sat4j.specs.TimeoutException;

import java.util.Arrays;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * SOLVER SAT4J - Implementazione del contratto ConstraintSolver
 *
 * Le formule vengono tradotte in CNF dal TseitinEncoder man mano che arrivano; ogni
 * check() costruisce un'istanza SAT4J nuova con tutte le clausole accumulate, così
 * si possono aggiungere vincoli tra una verifica e l'altra.
 *
 * MAPPATURA DEGLI ESITI:
 * • isSatisfiable() true          → SATISFIABLE, modello letto sulle variabili del problema
 * • isSatisfiable() false         → UNSATISFIABLE
 * • ContradictionException        → UNSATISFIABLE (clausola vuota in fase di inserimento)
 * • TimeoutException di SAT4J     → UNKNOWN
 */
public final class Sat4jConstraintSolver implements ConstraintSolver {

    private static final Logger LOGGER = Logger.getLogger(Sat4jConstraintSolver.class.getName());

    /** Tempo limite predefinito in secondi */
    public static final int DEFAULT_TIMEOUT_SECONDS = 10;

    /** Variabili del motore, indici 1..problemVariables */
    private final int problemVariables;

    /** Traduzione incrementale delle formule aggiunte */
    private final TseitinEncoder encoder;

    private int timeoutSeconds = DEFAULT_TIMEOUT_SECONDS;

    /** Esito dell'ultimo check(), null dopo ogni add() */
    private SolverStatus lastStatus;

    /** Valori delle variabili del problema, indicizzati da 1; valido solo dopo SATISFIABLE */
    private ModelValue[] model;

    private SolverStatistics statistics = SolverStatistics.empty();

    /**
     * @param problemVariables numero di variabili del motore (indici 1..problemVariables)
     */
    public Sat4jConstraintSolver(int problemVariables) {
        this.problemVariables = problemVariables;
        this.encoder = new TseitinEncoder(problemVariables);
    }

    /**
     * Traduce la formula in clausole e invalida l'esito precedente.
     *
     * @throws NullPointerException se la formula è null
     * @throws IllegalArgumentException se la formula usa variabili fuori dal problema
     */
    @Override
    public void add(BooleanFormula formula) {
        Objects.requireNonNull(formula, "Formula non può essere null");
        encoder.assertFormula(formula);
        lastStatus = null;
        model = null;
    }

    /**
     * Decide la congiunzione delle formule aggiunte con un'istanza SAT4J nuova,
     * rispettando il timeout configurato. Aggiorna esito, modello e statistiche.
     *
     * @return SATISFIABLE, UNSATISFIABLE oppure UNKNOWN se scade il timeout
     */
    @Override
    public SolverStatus check() {
        CnfFormula cnf = encoder.getFormula();
        long start = System.currentTimeMillis();

        ISolver solver = SolverFactory.newDefault();
        solver.newVar(cnf.getVariableCount());
        solver.setExpectedNumberOfClauses(cnf.getClauseCount());
        solver.setTimeout(timeoutSeconds);

        SolverStatus status;
        try {
            for (int[] clause : cnf.getClauses()) {
                solver.addClause(new VecInt(clause));
            }
            if (solver.isSatisfiable()) {
                status = SolverStatus.SATISFIABLE;
                model = readModel(solver.model());
            } else {
                status = SolverStatus.UNSATISFIABLE;
            }
        } catch (ContradictionException e) {
            LOGGER.fine("Contraddizione rilevata in fase di inserimento clausole");
            status = SolverStatus.UNSATISFIABLE;
        } catch (TimeoutException e) {
            LOGGER.warning("Tempo limite di " + timeoutSeconds + " s superato");
            status = SolverStatus.UNKNOWN;
        } finally {
            solver.reset();
        }

        lastStatus = status;
        statistics = new SolverStatistics(problemVariables, cnf.getAuxiliaryVariableCount(),
                cnf.getClauseCount(), System.currentTimeMillis() - start);

        LOGGER.fine("Esito " + status + " in " + statistics.getSolvingTimeMs() + " ms su "
                + cnf.getClauseCount() + " clausole");
        return status;
    }

    private ModelValue[] readModel(int[] literals) {
        ModelValue[] values = new ModelValue[problemVariables + 1];
        Arrays.fill(values, ModelValue.UNASSIGNED);
        for (int literal : literals) {
            int variable = Math.abs(literal);
            if (variable <= problemVariables) {
                values[variable] = literal > 0 ? ModelValue.TRUE : ModelValue.FALSE;
            }
        }
        return values;
    }

    @Override
    public ModelValue model(int variable) {
        if (lastStatus != SolverStatus.SATISFIABLE) {
            throw new IllegalStateException("Modello non disponibile: ultimo esito " + lastStatus);
        }
        if (variable < 1 || variable > problemVariables) {
            throw new IllegalArgumentException("Variabile non valida: " + variable
                    + " (ammesse 1.." + problemVariables + ")");
        }
        return model[variable];
    }

    @Override
    public void setTimeout(int seconds) {
        if (seconds < 1) {
            throw new IllegalArgumentException("Timeout deve essere almeno 1 secondo, ricevuto: " + seconds);
        }
        this.timeoutSeconds = seconds;
    }

    @Override
    public SolverStatistics getStatistics() {
        return statistics;
    }

    /**
     * @return la CNF accumulata, per l'esportazione DIMACS
     */
    public CnfFormula getCnf() {
        return encoder.getFormula();
    }
}
