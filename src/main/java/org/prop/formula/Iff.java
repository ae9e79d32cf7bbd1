package org.prop.formula;

import java.util.List;

/**
 * Biimplicazione: sinistro IFF destro.
 * Simmetrica nel significato, ma gli operandi mantengono l'ordine per la rappresentazione.
 */
public final class Iff extends Formula {

    private final Formula left;
    private final Formula right;

    public Iff(Formula left, Formula right) {
        this(left, right, null);
    }

    public Iff(Formula left, Formula right, String label) {
        super(Type.IFF, label);
        this.left = requireOperand(left, "sinistro");
        this.right = requireOperand(right, "destro");
    }

    public Formula left() {
        return left;
    }

    public Formula right() {
        return right;
    }

    @Override
    public List<Formula> children() {
        return List.of(left, right);
    }

    @Override
    public Iff withLabel(String label) {
        return new Iff(left, right, label);
    }
}
