package org.prop.semantics;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Riga di una tabella di verità: assegnamento completo e valore della formula.
 */
public final class TruthTableRow {

    private final Map<String, Boolean> assignment;
    private final boolean result;

    public TruthTableRow(Map<String, Boolean> assignment, boolean result) {
        this.assignment = Collections.unmodifiableMap(new LinkedHashMap<>(assignment));
        this.result = result;
    }

    /**
     * @return assegnamento immutabile, con le variabili in ordine lessicografico
     */
    public Map<String, Boolean> assignment() {
        return assignment;
    }

    public boolean result() {
        return result;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        TruthTableRow other = (TruthTableRow) obj;
        return result == other.result && assignment.equals(other.assignment);
    }

    @Override
    public int hashCode() {
        return Objects.hash(assignment, result);
    }

    @Override
    public String toString() {
        return assignment + " -> " + result;
    }
}
