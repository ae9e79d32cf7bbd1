package org.prop.semantics;

import org.prop.formula.FormulaException;

/**
 * Sollevata quando una formula ha più variabili del limite configurato per
 * l'enumerazione esaustiva degli assegnamenti (2^n righe).
 */
public class TooManyVariablesException extends FormulaException {

    private final int variableCount;
    private final int limit;

    public TooManyVariablesException(int variableCount, int limit) {
        super("Formula con " + variableCount + " variabili: il limite per l'enumerazione è " + limit);
        this.variableCount = variableCount;
        this.limit = limit;
    }

    public int getVariableCount() {
        return variableCount;
    }

    public int getLimit() {
        return limit;
    }
}
