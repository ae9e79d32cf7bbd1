package org.prop.formula;

import java.util.List;

/**
 * Congiunzione n-aria: A AND B AND ...
 *
 * Gli operandi sono una sequenza ordinata con almeno un elemento; una congiunzione con un
 * solo operando è valida e ha lo stesso valore di verità di quell'operando.
 */
public final class And extends Formula {

    private final List<Formula> operands;

    /**
     * @param operands operandi della congiunzione, nell'ordine di rappresentazione
     * @throws FormulaConstructionException se la lista è null, vuota o contiene null
     */
    public And(List<? extends Formula> operands) {
        this(operands, null);
    }

    public And(List<? extends Formula> operands, String label) {
        super(Type.AND, label);
        this.operands = copyOperands(operands, Type.AND);
    }

    public List<Formula> operands() {
        return operands;
    }

    @Override
    public List<Formula> children() {
        return operands;
    }

    @Override
    public And withLabel(String label) {
        return new And(operands, label);
    }
}
