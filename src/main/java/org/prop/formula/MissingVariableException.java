package org.prop.formula;

/**
 * Sollevata da {@link Formula#evaluate(java.util.Map)} quando l'assegnamento di verità
 * non contiene una variabile raggiungibile dalla formula valutata.
 */
public class MissingVariableException extends FormulaException {

    /** Nome della variabile assente dall'assegnamento */
    private final String variable;

    public MissingVariableException(String variable) {
        super("Assegnamento di verità privo della variabile: " + variable);
        this.variable = variable;
    }

    public String getVariable() {
        return variable;
    }
}
