package org.koa.solver;

import org.koa.formula.BooleanFormula;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * TRASFORMAZIONE DI TSEITIN - Da BooleanFormula a CNF equisoddisfacibile
 *
 * Ogni sotto-formula composta riceve una variabile ausiliaria t con le clausole
 * di equivalenza:
 * • t ↔ AND(l1..ln):  (¬t ∨ li) per ogni i,  (t ∨ ¬l1 ∨ ... ∨ ¬ln)
 * • t ↔ OR(l1..ln):   (¬t ∨ l1 ∨ ... ∨ ln),  (t ∨ ¬li) per ogni i
 * • IMPLIES(a, b) è trattata come OR(¬a, b)
 *
 * La conversione è incrementale: le asserzioni successive condividono le variabili
 * ausiliarie già create per sotto-formule strutturalmente uguali. Le congiunzioni al
 * livello più alto diventano asserzioni separate e le disgiunzioni di letterali
 * diventano direttamente clausole.
 */
public final class TseitinEncoder {

    private static final Logger LOGGER = Logger.getLogger(TseitinEncoder.class.getName());

    private final CnfFormula cnf;
    private final Map<BooleanFormula, Integer> cache = new HashMap<>();

    /** Variabile ausiliaria forzata a vero, creata alla prima costante incontrata */
    private int trueVariable;

    /**
     * @param problemVariables numero di variabili del motore (indici 1..problemVariables)
     */
    public TseitinEncoder(int problemVariables) {
        this.cnf = new CnfFormula(problemVariables);
    }

    //region ASSERZIONI

    /**
     * Aggiunge la formula come vincolo da soddisfare.
     *
     * @throws IllegalArgumentException se la formula usa variabili fuori dal problema
     */
    public void assertFormula(BooleanFormula formula) {
        int before = cnf.getClauseCount();
        assertTopLevel(formula);
        LOGGER.finest("Asserzione tradotta in " + (cnf.getClauseCount() - before) + " clausole");
    }

    private void assertTopLevel(BooleanFormula formula) {
        switch (formula.getType()) {
            case TRUE -> {
                // nessun vincolo
            }
            case AND -> {
                for (BooleanFormula operand : formula.getOperands()) {
                    assertTopLevel(operand);
                }
            }
            case OR -> {
                if (allLiterals(formula.getOperands())) {
                    List<BooleanFormula> operands = formula.getOperands();
                    int[] clause = new int[operands.size()];
                    for (int i = 0; i < clause.length; i++) {
                        clause[i] = literalOf(operands.get(i));
                    }
                    cnf.addClause(clause);
                } else {
                    cnf.addClause(literalOf(formula));
                }
            }
            default -> cnf.addClause(literalOf(formula));
        }
    }

    private static boolean allLiterals(List<BooleanFormula> operands) {
        for (BooleanFormula operand : operands) {
            boolean literal = operand.getType() == BooleanFormula.Type.VARIABLE
                    || (operand.getType() == BooleanFormula.Type.NOT
                    && operand.getOperands().get(0).getType() == BooleanFormula.Type.VARIABLE);
            if (!literal) {
                return false;
            }
        }
        return true;
    }

    //endregion

    //region LETTERALI

    private int literalOf(BooleanFormula formula) {
        return switch (formula.getType()) {
            case TRUE -> trueLiteral();
            case FALSE -> -trueLiteral();
            case VARIABLE -> problemVariable(formula.getVariable());
            case NOT -> -literalOf(formula.getOperands().get(0));
            case AND, OR, IMPLIES -> auxiliaryLiteral(formula);
        };
    }

    private int problemVariable(int variable) {
        if (variable > cnf.getProblemVariableCount()) {
            throw new IllegalArgumentException("Variabile fuori dal problema: " + variable
                    + " (ammesse 1.." + cnf.getProblemVariableCount() + ")");
        }
        return variable;
    }

    private int trueLiteral() {
        if (trueVariable == 0) {
            trueVariable = cnf.newAuxiliaryVariable();
            cnf.addClause(trueVariable);
        }
        return trueVariable;
    }

    private int auxiliaryLiteral(BooleanFormula formula) {
        Integer cached = cache.get(formula);
        if (cached != null) {
            return cached;
        }

        List<BooleanFormula> operands = formula.getOperands();
        int[] literals = new int[operands.size()];
        for (int i = 0; i < literals.length; i++) {
            literals[i] = literalOf(operands.get(i));
        }

        int t = cnf.newAuxiliaryVariable();
        switch (formula.getType()) {
            case AND -> encodeAnd(t, literals);
            case OR -> encodeOr(t, literals);
            case IMPLIES -> encodeOr(t, new int[]{-literals[0], literals[1]});
            default -> throw new IllegalStateException("Tipo non composto: " + formula.getType());
        }
        cache.put(formula, t);
        return t;
    }

    private void encodeAnd(int t, int[] literals) {
        int[] back = new int[literals.length + 1];
        back[0] = t;
        for (int i = 0; i < literals.length; i++) {
            cnf.addClause(-t, literals[i]);
            back[i + 1] = -literals[i];
        }
        cnf.addClause(back);
    }

    private void encodeOr(int t, int[] literals) {
        int[] forward = new int[literals.length + 1];
        forward[0] = -t;
        for (int i = 0; i < literals.length; i++) {
            cnf.addClause(t, -literals[i]);
            forward[i + 1] = literals[i];
        }
        cnf.addClause(forward);
    }

    //endregion

    public CnfFormula getFormula() {
        return cnf;
    }
}
