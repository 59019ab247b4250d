package org.koa.formula;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * FORMULA BOOLEANA - Albero immutabile delle formule prodotte dal motore di codifica
 *
 * Rappresenta le formule proposizionali costruite dai vincoli di determinismo, dal
 * vincolo globale degli esempi positivi e dai vincoli per singola stringa. Ogni nodo
 * ha un tipo e, a seconda del tipo, un indice di variabile oppure una lista di operandi.
 *
 * REGOLE DI SEMPLIFICAZIONE (solo strutturali):
 * • and() senza operandi → True, or() senza operandi → False
 * • and()/or() con un solo operando → l'operando stesso
 * • nessun'altra riscrittura: le costanti restano nell'albero come nodi foglia
 *
 * L'uguaglianza è strutturale e l'hash viene calcolato una sola volta in costruzione,
 * così che formule grandi possano essere usate come chiavi (es. nella trasformazione
 * di Tseitin) senza visite ripetute.
 */
public final class BooleanFormula {

    //region TIPI E STRUTTURA DATI

    /**
     * Tipi di nodo supportati.
     */
    public enum Type {
        TRUE,       // Costante vera
        FALSE,      // Costante falsa
        VARIABLE,   // Variabile di decisione A_i
        NOT,        // Negazione: Not(A)
        AND,        // Congiunzione n-aria
        OR,         // Disgiunzione n-aria
        IMPLIES     // Implicazione: Implies(A, B)
    }

    private static final BooleanFormula TRUE = new BooleanFormula(Type.TRUE, 0, null, List.of());
    private static final BooleanFormula FALSE = new BooleanFormula(Type.FALSE, 0, null, List.of());

    private final Type type;

    /** Indice della variabile (solo per nodi VARIABLE) */
    private final int variable;

    /** Nome leggibile della variabile (solo per nodi VARIABLE) */
    private final String name;

    /** Operandi: uno per NOT, due per IMPLIES (premessa, conseguenza), n per AND/OR */
    private final List<BooleanFormula> operands;

    private final int hash;

    //endregion

    //region COSTRUZIONE

    private BooleanFormula(Type type, int variable, String name, List<BooleanFormula> operands) {
        this.type = type;
        this.variable = variable;
        this.name = name;
        this.operands = operands;
        this.hash = Objects.hash(type, variable, operands);
    }

    /**
     * @return la costante booleana richiesta
     */
    public static BooleanFormula constant(boolean value) {
        return value ? TRUE : FALSE;
    }

    /**
     * Costruisce una foglia variabile.
     *
     * @param index indice positivo della variabile nell'universo
     * @param name nome leggibile (es. "A_7")
     * @throws IllegalArgumentException se indice non positivo o nome vuoto
     */
    public static BooleanFormula variable(int index, String name) {
        if (index <= 0) {
            throw new IllegalArgumentException("Indice variabile deve essere positivo, ricevuto: " + index);
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Nome variabile non può essere null o vuoto");
        }
        return new BooleanFormula(Type.VARIABLE, index, name, List.of());
    }

    public static BooleanFormula not(BooleanFormula operand) {
        Objects.requireNonNull(operand, "Operando per negazione non può essere null");
        return new BooleanFormula(Type.NOT, 0, null, List.of(operand));
    }

    public static BooleanFormula and(BooleanFormula... operands) {
        return and(Arrays.asList(operands));
    }

    /**
     * Congiunzione n-aria. Lista vuota → True, un solo operando → l'operando.
     */
    public static BooleanFormula and(List<BooleanFormula> operands) {
        return nary(Type.AND, operands, TRUE);
    }

    public static BooleanFormula or(BooleanFormula... operands) {
        return or(Arrays.asList(operands));
    }

    /**
     * Disgiunzione n-aria. Lista vuota → False, un solo operando → l'operando.
     */
    public static BooleanFormula or(List<BooleanFormula> operands) {
        return nary(Type.OR, operands, FALSE);
    }

    public static BooleanFormula implies(BooleanFormula premise, BooleanFormula conclusion) {
        Objects.requireNonNull(premise, "Premessa dell'implicazione non può essere null");
        Objects.requireNonNull(conclusion, "Conseguenza dell'implicazione non può essere null");
        return new BooleanFormula(Type.IMPLIES, 0, null, List.of(premise, conclusion));
    }

    private static BooleanFormula nary(Type type, List<BooleanFormula> operands, BooleanFormula neutral) {
        Objects.requireNonNull(operands, "Lista operandi non può essere null");
        for (BooleanFormula operand : operands) {
            if (operand == null) {
                throw new IllegalArgumentException("Lista operandi non può contenere elementi null");
            }
        }
        if (operands.isEmpty()) {
            return neutral;
        }
        if (operands.size() == 1) {
            return operands.get(0);
        }
        return new BooleanFormula(type, 0, null, List.copyOf(operands));
    }

    //endregion

    //region ACCESSORS

    public Type getType() {
        return type;
    }

    /**
     * @return indice della variabile
     * @throws IllegalStateException se il nodo non è una variabile
     */
    public int getVariable() {
        if (type != Type.VARIABLE) {
            throw new IllegalStateException("Nodo " + type + " non è una variabile");
        }
        return variable;
    }

    public String getName() {
        return name;
    }

    /**
     * @return operandi non modificabili (vuoti per foglie)
     */
    public List<BooleanFormula> getOperands() {
        return Collections.unmodifiableList(operands);
    }

    public boolean isConstant() {
        return type == Type.TRUE || type == Type.FALSE;
    }

    //endregion

    //region VALUTAZIONE E ANALISI

    /**
     * Valuta la formula sotto un assegnamento parziale.
     * Le variabili assenti dall'assegnamento valgono false.
     *
     * @param assignment mappa indice variabile → valore
     * @return valore di verità della formula
     */
    public boolean evaluate(Map<Integer, Boolean> assignment) {
        return switch (type) {
            case TRUE -> true;
            case FALSE -> false;
            case VARIABLE -> Boolean.TRUE.equals(assignment.get(variable));
            case NOT -> !operands.get(0).evaluate(assignment);
            case AND -> {
                for (BooleanFormula operand : operands) {
                    if (!operand.evaluate(assignment)) {
                        yield false;
                    }
                }
                yield true;
            }
            case OR -> {
                for (BooleanFormula operand : operands) {
                    if (operand.evaluate(assignment)) {
                        yield true;
                    }
                }
                yield false;
            }
            case IMPLIES -> !operands.get(0).evaluate(assignment) || operands.get(1).evaluate(assignment);
        };
    }

    /**
     * @return insieme ordinato degli indici di variabile presenti nella formula
     */
    public Set<Integer> variables() {
        Set<Integer> result = new TreeSet<>();
        collectVariables(this, result);
        return result;
    }

    private static void collectVariables(BooleanFormula formula, Set<Integer> result) {
        if (formula.type == Type.VARIABLE) {
            result.add(formula.variable);
            return;
        }
        for (BooleanFormula operand : formula.operands) {
            collectVariables(operand, result);
        }
    }

    /**
     * @return numero totale di nodi dell'albero
     */
    public int size() {
        int count = 1;
        for (BooleanFormula operand : operands) {
            count += operand.size();
        }
        return count;
    }

    //endregion

    //region UGUAGLIANZA E RAPPRESENTAZIONE

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BooleanFormula)) return false;
        BooleanFormula other = (BooleanFormula) o;
        return hash == other.hash
                && type == other.type
                && variable == other.variable
                && operands.equals(other.operands);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    /**
     * Rappresentazione testuale nello stile And(...), Or(...), Not(...), Implies(a, b).
     */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        appendTo(sb);
        return sb.toString();
    }

    private void appendTo(StringBuilder sb) {
        switch (type) {
            case TRUE -> sb.append("True");
            case FALSE -> sb.append("False");
            case VARIABLE -> sb.append(name);
            case NOT -> appendOperator(sb, "Not");
            case AND -> appendOperator(sb, "And");
            case OR -> appendOperator(sb, "Or");
            case IMPLIES -> appendOperator(sb, "Implies");
        }
    }

    private void appendOperator(StringBuilder sb, String operator) {
        sb.append(operator).append('(');
        for (int i = 0; i < operands.size(); i++) {
            if (i > 0) sb.append(", ");
            operands.get(i).appendTo(sb);
        }
        sb.append(')');
    }

    //endregion
}
