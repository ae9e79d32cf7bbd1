package org.prop.formula;

import java.util.List;

/**
 * Disgiunzione n-aria: A OR B OR ...
 *
 * Stessa disciplina di {@link And}: operandi ordinati, almeno uno. L'ordine partecipa
 * al testo canonico e quindi all'uguaglianza.
 */
public final class Or extends Formula {

    private final List<Formula> operands;

    /**
     * @param operands operandi della disgiunzione, nell'ordine di rappresentazione
     * @throws FormulaConstructionException se la lista è null, vuota o contiene null
     */
    public Or(List<? extends Formula> operands) {
        this(operands, null);
    }

    public Or(List<? extends Formula> operands, String label) {
        super(Type.OR, label);
        this.operands = copyOperands(operands, Type.OR);
    }

    public List<Formula> operands() {
        return operands;
    }

    @Override
    public List<Formula> children() {
        return operands;
    }

    @Override
    public Or withLabel(String label) {
        return new Or(operands, label);
    }
}
