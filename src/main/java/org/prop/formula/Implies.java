package org.prop.formula;

import java.util.List;

/**
 * Implicazione: ipotesi IMPLIES conclusione. L'ordine degli operandi è significativo.
 */
public final class Implies extends Formula {

    private final Formula hypothesis;
    private final Formula conclusion;

    public Implies(Formula hypothesis, Formula conclusion) {
        this(hypothesis, conclusion, null);
    }

    public Implies(Formula hypothesis, Formula conclusion, String label) {
        super(Type.IMPLIES, label);
        this.hypothesis = requireOperand(hypothesis, "ipotesi");
        this.conclusion = requireOperand(conclusion, "conclusione");
    }

    public Formula hypothesis() {
        return hypothesis;
    }

    public Formula conclusion() {
        return conclusion;
    }

    @Override
    public List<Formula> children() {
        return List.of(hypothesis, conclusion);
    }

    @Override
    public Implies withLabel(String label) {
        return new Implies(hypothesis, conclusion, label);
    }
}
