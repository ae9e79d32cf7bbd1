package org.prop.normalform;

import org.prop.formula.Formula;

/**
 * Riconoscitori di forme normali. Controllano solo la forma dell'albero, non l'equivalenza.
 */
public final class NormalForms {

    private NormalForms() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * NNF: ogni NOT ha come operando una variabile. IMPLIES e IFF sono ammessi.
     */
    public static boolean isNNF(Formula formula) {
        if (formula.type() == Formula.Type.NOT) {
            return formula.isLiteral();
        }
        for (Formula child : formula.children()) {
            if (!isNNF(child)) return false;
        }
        return true;
    }

    /**
     * CNF: letterale, clausola (OR di letterali) o AND di letterali e clausole.
     */
    public static boolean isCNF(Formula formula) {
        return isFlatCombination(formula, Formula.Type.AND, Formula.Type.OR);
    }

    /**
     * DNF: letterale, termine (AND di letterali) o OR di letterali e termini.
     */
    public static boolean isDNF(Formula formula) {
        return isFlatCombination(formula, Formula.Type.OR, Formula.Type.AND);
    }

    private static boolean isFlatCombination(Formula formula, Formula.Type outer, Formula.Type inner) {
        if (formula.type() == outer) {
            for (Formula child : formula.children()) {
                if (!isLiteralGroup(child, inner)) return false;
            }
            return true;
        }
        return isLiteralGroup(formula, inner);
    }

    private static boolean isLiteralGroup(Formula formula, Formula.Type inner) {
        if (formula.isLiteral()) {
            return true;
        }
        if (formula.type() != inner) {
            return false;
        }
        for (Formula child : formula.children()) {
            if (!child.isLiteral()) return false;
        }
        return true;
    }
}
