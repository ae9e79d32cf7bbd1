package org.prop.formula;

/**
 * Sollevata quando un nodo della formula viene costruito con argomenti non validi:
 * congiunzioni o disgiunzioni senza operandi, figli null, nomi di variabile vuoti.
 */
public class FormulaConstructionException extends FormulaException {

    public FormulaConstructionException(String message) {
        super(message);
    }
}
