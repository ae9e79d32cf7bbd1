package org.prop.formula;

import java.util.List;

/**
 * Negazione di una sottoformula: NOT(A).
 */
public final class Not extends Formula {

    private final Formula operand;

    public Not(Formula operand) {
        this(operand, null);
    }

    public Not(Formula operand, String label) {
        super(Type.NOT, label);
        this.operand = requireOperand(operand, "della negazione");
    }

    public Formula operand() {
        return operand;
    }

    @Override
    public List<Formula> children() {
        return List.of(operand);
    }

    @Override
    public Not withLabel(String label) {
        return new Not(operand, label);
    }
}
