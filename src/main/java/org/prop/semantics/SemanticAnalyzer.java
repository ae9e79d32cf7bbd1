package org.prop.semantics;

import org.prop.formula.Formula;
import org.prop.formula.Iff;
import org.prop.formula.Implies;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * ANALIZZATORE SEMANTICO - Interrogazioni sul significato di una formula per enumerazione
 *
 * Tutte le interrogazioni sono costruite esclusivamente su {@link Formula#evaluate(Map)}
 * valutando la formula sotto ogni assegnamento possibile delle sue variabili.
 *
 * COMPLESSITÀ:
 * - Una formula con n variabili richiede 2^n valutazioni: il costo è esponenziale per
 *   costruzione, non si tratta di una procedura SAT
 * - Il numero di variabili ammesso è limitato da {@link #getMaxVariables()}; oltre il
 *   limite l'enumerazione viene rifiutata prima di iniziare
 *
 * INTERROGAZIONI:
 * - Tautologia: vera sotto ogni assegnamento
 * - Soddisfacibilità: vera sotto almeno un assegnamento
 * - Contraddizione (fallacy): non soddisfacibile
 * - Equivalenza: f1 IFF f2 è una tautologia
 * - Implicazione logica: f1 IMPLIES f2 è una tautologia
 */
public class SemanticAnalyzer {

    private static final Logger LOGGER = Logger.getLogger(SemanticAnalyzer.class.getName());

    //region CONFIGURAZIONE E COSTANTI

    /** Limite di default sul numero di variabili enumerabili */
    public static final int DEFAULT_MAX_VARIABLES = 20;

    /** Limite massimo configurabile (2^30 righe) */
    public static final int MAX_ALLOWED_VARIABLES = 30;

    /** Numero massimo di variabili accettato da questa istanza */
    private final int maxVariables;

    public SemanticAnalyzer() {
        this(DEFAULT_MAX_VARIABLES);
    }

    /**
     * @param maxVariables numero massimo di variabili enumerabili
     * @throws IllegalArgumentException se fuori dall'intervallo 1..{@value #MAX_ALLOWED_VARIABLES}
     */
    public SemanticAnalyzer(int maxVariables) {
        if (maxVariables < 1 || maxVariables > MAX_ALLOWED_VARIABLES) {
            throw new IllegalArgumentException("Limite variabili deve essere tra 1 e "
                    + MAX_ALLOWED_VARIABLES + ", ricevuto: " + maxVariables);
        }
        this.maxVariables = maxVariables;
    }

    public int getMaxVariables() {
        return maxVariables;
    }

    //endregion

    //region ENUMERAZIONE ASSEGNAMENTI

    /**
     * Genera tutti i 2^n assegnamenti completi per le variabili della formula.
     *
     * ORDINE:
     * - Variabili in ordine lessicografico
     * - Prima riga: tutte le variabili vere; le righe procedono come un conteggio binario
     *   verso tutte false, con l'ultima variabile che alterna più velocemente
     *
     * @param formula formula di cui enumerare le variabili
     * @return lista immutabile di assegnamenti immutabili
     * @throws TooManyVariablesException se le variabili superano il limite configurato
     */
    public List<Map<String, Boolean>> enumerateAssignments(Formula formula) {
        List<String> variables = new ArrayList<>(formula.variables());
        checkLimit(variables.size());

        int n = variables.size();
        int rowCount = 1 << n;
        List<Map<String, Boolean>> assignments = new ArrayList<>(rowCount);

        for (int row = 0; row < rowCount; row++) {
            Map<String, Boolean> assignment = new LinkedHashMap<>();
            for (int j = 0; j < n; j++) {
                // Bit a 0 -> vero, così la prima riga assegna vero a tutte le variabili
                boolean value = ((row >> (n - 1 - j)) & 1) == 0;
                assignment.put(variables.get(j), value);
            }
            assignments.add(Collections.unmodifiableMap(assignment));
        }

        LOGGER.finest("Enumerati " + rowCount + " assegnamenti per " + n + " variabili");
        return Collections.unmodifiableList(assignments);
    }

    /**
     * Costruisce la tabella di verità della formula.
     *
     * @throws TooManyVariablesException se le variabili superano il limite configurato
     */
    public TruthTable truthTable(Formula formula) {
        List<TruthTableRow> rows = new ArrayList<>();
        for (Map<String, Boolean> assignment : enumerateAssignments(formula)) {
            rows.add(new TruthTableRow(assignment, formula.evaluate(assignment)));
        }
        return new TruthTable(formula, new ArrayList<>(formula.variables()), rows);
    }

    private void checkLimit(int variableCount) {
        if (variableCount > maxVariables) {
            LOGGER.warning("Enumerazione rifiutata: " + variableCount + " variabili, limite " + maxVariables);
            throw new TooManyVariablesException(variableCount, maxVariables);
        }
    }

    //endregion

    //region INTERROGAZIONI SEMANTICHE

    /**
     * @return true se la formula è vera sotto ogni assegnamento
     */
    public boolean isTautology(Formula formula) {
        for (Map<String, Boolean> assignment : enumerateAssignments(formula)) {
            if (!formula.evaluate(assignment)) {
                return false;
            }
        }
        return true;
    }

    /**
     * @return true se la formula è vera sotto almeno un assegnamento
     */
    public boolean isSatisfiable(Formula formula) {
        for (Map<String, Boolean> assignment : enumerateAssignments(formula)) {
            if (formula.evaluate(assignment)) {
                return true;
            }
        }
        return false;
    }

    /**
     * @return true se la formula è falsa sotto ogni assegnamento
     */
    public boolean isFallacy(Formula formula) {
        return !isSatisfiable(formula);
    }

    /**
     * Equivalenza logica: le due formule hanno lo stesso valore sotto ogni assegnamento
     * delle variabili di entrambe.
     */
    public boolean equivalent(Formula first, Formula second) {
        return isTautology(new Iff(first, second));
    }

    /**
     * Implicazione logica: ogni assegnamento che rende vera la prima rende vera la seconda.
     */
    public boolean implies(Formula first, Formula second) {
        return isTautology(new Implies(first, second));
    }

    /**
     * @return assegnamenti (nell'ordine di enumerazione) sotto cui la formula è vera
     */
    public List<Map<String, Boolean>> models(Formula formula) {
        return filterByResult(formula, true);
    }

    /**
     * @return assegnamenti (nell'ordine di enumerazione) sotto cui la formula è falsa
     */
    public List<Map<String, Boolean>> counterexamples(Formula formula) {
        return filterByResult(formula, false);
    }

    private List<Map<String, Boolean>> filterByResult(Formula formula, boolean expected) {
        List<Map<String, Boolean>> selected = new ArrayList<>();
        for (Map<String, Boolean> assignment : enumerateAssignments(formula)) {
            if (formula.evaluate(assignment) == expected) {
                selected.add(assignment);
            }
        }
        return Collections.unmodifiableList(selected);
    }

    //endregion
}
