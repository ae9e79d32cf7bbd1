package org.prop.semantics;

import org.prop.formula.Formula;

import java.util.List;

/**
 * TABELLA DI VERITÀ - Contenitore immutabile delle righe prodotte dall'enumerazione
 *
 * Associa a ogni assegnamento completo delle variabili della formula il valore di verità
 * corrispondente. L'ordine delle righe segue quello di
 * {@link SemanticAnalyzer#enumerateAssignments(Formula)} ed è significativo solo per la
 * visualizzazione.
 */
public final class TruthTable {

    /** Formula a cui si riferisce la tabella */
    private final Formula formula;

    /** Variabili in ordine di colonna (lessicografico) */
    private final List<String> variables;

    /** Righe nell'ordine di enumerazione */
    private final List<TruthTableRow> rows;

    TruthTable(Formula formula, List<String> variables, List<TruthTableRow> rows) {
        this.formula = formula;
        this.variables = List.copyOf(variables);
        this.rows = List.copyOf(rows);
    }

    public Formula formula() {
        return formula;
    }

    public List<String> variables() {
        return variables;
    }

    public List<TruthTableRow> rows() {
        return rows;
    }

    public int size() {
        return rows.size();
    }

    /**
     * @return true se ogni riga ha valore vero
     */
    public boolean allTrue() {
        for (TruthTableRow row : rows) {
            if (!row.result()) return false;
        }
        return true;
    }

    /**
     * @return true se almeno una riga ha valore vero
     */
    public boolean anyTrue() {
        for (TruthTableRow row : rows) {
            if (row.result()) return true;
        }
        return false;
    }

    //region RAPPRESENTAZIONE TESTUALE

    /**
     * Genera la tabella in formato testuale a colonne allineate.
     *
     * FORMATO OUTPUT:
     * <pre>
     * p | q | p IMPLIES q
     * --+---+------------
     * T | T | T
     * T | F | F
     * </pre>
     */
    public String format() {
        String formulaHeader = formula.toText();
        StringBuilder result = new StringBuilder();

        // Intestazione
        for (String variable : variables) {
            result.append(variable).append(" | ");
        }
        result.append(formulaHeader).append('\n');

        // Separatore
        for (String variable : variables) {
            result.append("-".repeat(variable.length())).append("-+-");
        }
        result.append("-".repeat(formulaHeader.length())).append('\n');

        // Righe
        for (TruthTableRow row : rows) {
            for (String variable : variables) {
                result.append(pad(symbol(row.assignment().get(variable)), variable.length())).append(" | ");
            }
            result.append(symbol(row.result())).append('\n');
        }
        return result.toString();
    }

    private static String symbol(boolean value) {
        return value ? "T" : "F";
    }

    private static String pad(String value, int width) {
        return value + " ".repeat(Math.max(0, width - value.length()));
    }

    //endregion

    @Override
    public String toString() {
        return format();
    }
}
