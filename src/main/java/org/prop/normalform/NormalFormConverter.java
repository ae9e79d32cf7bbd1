package org.prop.normalform;

import org.prop.formula.And;
import org.prop.formula.Formula;
import org.prop.formula.Not;
import org.prop.formula.Or;
import org.prop.formula.Var;
import org.prop.semantics.SemanticAnalyzer;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * CONVERTITORE FORME NORMALI - Costruzione di NNF, CNF e DNF equivalenti
 *
 * La NNF è ottenuta per riscrittura dell'albero ({@link Formula#toNNF()}); CNF e DNF sono
 * costruite dalla tabella di verità della formula, quindi con costo esponenziale nel
 * numero di variabili e soggette al limite dell'{@link SemanticAnalyzer} usato.
 *
 * COSTRUZIONE CNF:
 * - Per ogni assegnamento che rende falsa la formula si costruisce una clausola
 *   (disgiunzione di letterali) falsa esattamente in quell'assegnamento:
 *   v se l'assegnamento ha v falsa, NOT(v) altrimenti
 * - La CNF è la congiunzione di tutte le clausole
 * - Tautologia (nessuna riga falsa): una clausola v OR NOT(v) per ogni variabile
 *
 * COSTRUZIONE DNF (simmetrica):
 * - Per ogni assegnamento che rende vera la formula si costruisce un termine
 *   (congiunzione di letterali): v se vera, NOT(v) se falsa
 * - La DNF è la disgiunzione di tutti i termini
 * - Contraddizione (nessuna riga vera): un termine v AND NOT(v) per ogni variabile
 *
 * Una formula ha sempre almeno una variabile (le variabili sono le sole foglie), quindi
 * i casi degeneri producono sempre almeno una clausola o un termine.
 */
public class NormalFormConverter {

    private static final Logger LOGGER = Logger.getLogger(NormalFormConverter.class.getName());

    /** Analizzatore usato per enumerare gli assegnamenti */
    private final SemanticAnalyzer analyzer;

    public NormalFormConverter() {
        this(new SemanticAnalyzer());
    }

    public NormalFormConverter(SemanticAnalyzer analyzer) {
        if (analyzer == null) {
            throw new IllegalArgumentException("Analizzatore semantico non può essere null");
        }
        this.analyzer = analyzer;
    }

    //region INTERFACCIA PUBBLICA

    /**
     * Forma Normale Negativa: le negazioni compaiono solo sopra le variabili.
     * IMPLIES e IFF non vengono eliminati.
     */
    public Formula toNNF(Formula formula) {
        Formula result = formula.toNNF();
        LOGGER.fine("NNF di " + formula + ": " + result);
        return result;
    }

    /**
     * Forma Normale Congiuntiva costruita dalle righe false della tabella di verità.
     *
     * @return congiunzione di clausole equivalente alla formula
     * @throws org.prop.semantics.TooManyVariablesException se le variabili superano il limite
     */
    public Formula toCNF(Formula formula) {
        List<Map<String, Boolean>> falseRows = analyzer.counterexamples(formula);
        List<Formula> clauses = new ArrayList<>();

        if (falseRows.isEmpty()) {
            LOGGER.fine("Formula tautologica, CNF banale per: " + formula);
            for (String variable : formula.variables()) {
                clauses.add(new Or(List.of(new Var(variable), new Not(new Var(variable)))));
            }
        } else {
            for (Map<String, Boolean> row : falseRows) {
                clauses.add(maxterm(row));
            }
        }

        Formula result = new And(clauses);
        LOGGER.fine("CNF con " + clauses.size() + " clausole: " + result);
        return result;
    }

    /**
     * Forma Normale Disgiuntiva costruita dalle righe vere della tabella di verità.
     *
     * @return disgiunzione di termini equivalente alla formula
     * @throws org.prop.semantics.TooManyVariablesException se le variabili superano il limite
     */
    public Formula toDNF(Formula formula) {
        List<Map<String, Boolean>> trueRows = analyzer.models(formula);
        List<Formula> terms = new ArrayList<>();

        if (trueRows.isEmpty()) {
            LOGGER.fine("Formula contraddittoria, DNF banale per: " + formula);
            for (String variable : formula.variables()) {
                terms.add(new And(List.of(new Var(variable), new Not(new Var(variable)))));
            }
        } else {
            for (Map<String, Boolean> row : trueRows) {
                terms.add(minterm(row));
            }
        }

        Formula result = new Or(terms);
        LOGGER.fine("DNF con " + terms.size() + " termini: " + result);
        return result;
    }

    //endregion

    //region CLAUSOLE E TERMINI

    /**
     * Clausola falsa esattamente sotto l'assegnamento dato.
     */
    public static Or maxterm(Map<String, Boolean> assignment) {
        List<Formula> literals = new ArrayList<>();
        for (Map.Entry<String, Boolean> entry : assignment.entrySet()) {
            literals.add(literal(entry.getKey(), !entry.getValue()));
        }
        return new Or(literals);
    }

    /**
     * Termine vero esattamente sotto l'assegnamento dato.
     */
    public static And minterm(Map<String, Boolean> assignment) {
        List<Formula> literals = new ArrayList<>();
        for (Map.Entry<String, Boolean> entry : assignment.entrySet()) {
            literals.add(literal(entry.getKey(), entry.getValue()));
        }
        return new And(literals);
    }

    private static Formula literal(String variable, boolean positive) {
        Var atom = new Var(variable);
        return positive ? atom : new Not(atom);
    }

    //endregion
}
