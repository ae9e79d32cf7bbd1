package org.prop.formula;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Formula della logica proposizionale rappresentata come albero immutabile.
 *
 * L'insieme delle varianti è chiuso: {@link Var} (foglia), {@link Not}, {@link And},
 * {@link Or}, {@link Implies} e {@link Iff}. Ogni operazione è implementata una sola volta
 * in questa classe tramite switch sul {@link Type} del nodo, così che l'aggiunta di un
 * nuovo tipo di nodo renda incompleti (e quindi non compilabili) tutti gli switch.
 *
 * PROPRIETÀ:
 * - Immutabilità: i nodi non vengono mai modificati dopo la costruzione, ogni
 *   trasformazione restituisce un nuovo albero
 * - Uguaglianza testuale: due formule sono uguali se e solo se hanno lo stesso testo
 *   canonico (vedi {@link #toText()}), indipendentemente dall'etichetta
 * - Etichetta: metadato descrittivo opzionale, non influenza valutazione, uguaglianza,
 *   hash o rappresentazione testuale
 *
 * OPERAZIONI PER NODO:
 * - {@link #evaluate(Map)}: valore di verità sotto un assegnamento
 * - {@link #variables()}: nomi delle variabili raggiungibili
 * - {@link #connectiveCount()}: numero di connettivi, metrica di complessità
 * - {@link #negate()}: negazione strutturale locale
 * - {@link #toNNF()}: forma normale negativa
 */
public abstract sealed class Formula permits Var, Not, And, Or, Implies, Iff {

    //region TIPI E STRUTTURA DATI

    /**
     * Tipi di nodi supportati nella rappresentazione ad albero.
     */
    public enum Type {
        VAR,        // Variabile proposizionale: p, q, r, ...
        NOT,        // Negazione: NOT(A)
        AND,        // Congiunzione n-aria: A AND B AND ...
        OR,         // Disgiunzione n-aria: A OR B OR ...
        IMPLIES,    // Implicazione: A IMPLIES B
        IFF         // Biimplicazione: A IFF B
    }

    /** Tipo del nodo corrente */
    private final Type type;

    /** Descrizione opzionale del nodo (può essere null) */
    private final String label;

    /** Testo canonico calcolato alla prima richiesta */
    private String canonicalText;

    Formula(Type type, String label) {
        this.type = type;
        this.label = label;
    }

    //endregion

    //region COSTRUTTORI DI COMODO

    public static Var var(String name) {
        return new Var(name);
    }

    public static Not not(Formula operand) {
        return new Not(operand);
    }

    public static And and(Formula... operands) {
        return new And(Arrays.asList(operands));
    }

    public static And and(List<? extends Formula> operands) {
        return new And(operands);
    }

    public static Or or(Formula... operands) {
        return new Or(Arrays.asList(operands));
    }

    public static Or or(List<? extends Formula> operands) {
        return new Or(operands);
    }

    public static Implies implies(Formula hypothesis, Formula conclusion) {
        return new Implies(hypothesis, conclusion);
    }

    public static Iff iff(Formula left, Formula right) {
        return new Iff(left, right);
    }

    //endregion

    //region ACCESSO ALLA STRUTTURA

    public final Type type() {
        return type;
    }

    /**
     * @return etichetta descrittiva del nodo, oppure null se assente
     */
    public final String label() {
        return label;
    }

    /**
     * Sottoformule dirette nell'ordine in cui sono memorizzate.
     * Vuota per {@link Var}, un elemento per {@link Not}, due per {@link Implies} e {@link Iff}.
     *
     * @return lista immutabile dei figli
     */
    public abstract List<Formula> children();

    /**
     * Restituisce una copia del nodo con l'etichetta indicata; i figli sono condivisi.
     *
     * @param label nuova etichetta (null per rimuoverla)
     * @return nodo strutturalmente identico con etichetta aggiornata
     */
    public abstract Formula withLabel(String label);

    /**
     * Indica se il nodo è un letterale, cioè una variabile o la negazione di una variabile.
     */
    public final boolean isLiteral() {
        return type == Type.VAR || (type == Type.NOT && children().get(0).type == Type.VAR);
    }

    //endregion

    //region VALUTAZIONE

    /**
     * Valuta la formula sotto l'assegnamento di verità fornito.
     *
     * SEMANTICA:
     * - AND vero se tutti gli operandi sono veri, OR vero se almeno uno lo è
     * - A IMPLIES B equivale a NOT(A) OR B
     * - A IFF B vero se e solo se A e B hanno lo stesso valore
     *
     * Tutti i figli vengono sempre valutati (nessun corto circuito), quindi una variabile
     * mancante viene segnalata anche quando il risultato sarebbe già determinato.
     *
     * @param assignment mappa nome variabile -> valore di verità
     * @return valore di verità della formula
     * @throws MissingVariableException se una variabile della formula non è assegnata
     */
    public final boolean evaluate(Map<String, Boolean> assignment) {
        return switch (type) {
            case VAR -> {
                String name = ((Var) this).name();
                Boolean value = assignment.get(name);
                if (value == null) {
                    throw new MissingVariableException(name);
                }
                yield value;
            }

            case NOT -> !children().get(0).evaluate(assignment);

            case AND -> {
                boolean result = true;
                for (Formula operand : children()) {
                    result &= operand.evaluate(assignment);
                }
                yield result;
            }

            case OR -> {
                boolean result = false;
                for (Formula operand : children()) {
                    result |= operand.evaluate(assignment);
                }
                yield result;
            }

            case IMPLIES -> {
                boolean hypothesis = children().get(0).evaluate(assignment);
                boolean conclusion = children().get(1).evaluate(assignment);
                yield !hypothesis || conclusion;
            }

            case IFF -> children().get(0).evaluate(assignment) == children().get(1).evaluate(assignment);
        };
    }

    //endregion

    //region METRICHE E VARIABILI

    /**
     * Raccoglie i nomi di tutte le variabili raggiungibili da questo nodo.
     *
     * @return insieme immutabile, ordinato lessicograficamente
     */
    public final Set<String> variables() {
        SortedSet<String> variables = new TreeSet<>();
        collectVariables(variables);
        return Collections.unmodifiableSortedSet(variables);
    }

    private void collectVariables(Set<String> variables) {
        if (type == Type.VAR) {
            variables.add(((Var) this).name());
            return;
        }
        for (Formula child : children()) {
            child.collectVariables(variables);
        }
    }

    /**
     * Conta i connettivi presenti nel sottoalbero.
     * Una congiunzione o disgiunzione con k operandi conta k-1 connettivi, gli altri
     * connettivi contano 1. Le variabili contano 0.
     */
    public final int connectiveCount() {
        int own = switch (type) {
            case VAR -> 0;
            case AND, OR -> children().size() - 1;
            case NOT, IMPLIES, IFF -> 1;
        };
        for (Formula child : children()) {
            own += child.connectiveCount();
        }
        return own;
    }

    /**
     * Profondità massima dell'albero: 0 per una variabile.
     */
    public final int depth() {
        int maxDepth = -1;
        for (Formula child : children()) {
            maxDepth = Math.max(maxDepth, child.depth());
        }
        return maxDepth + 1;
    }

    /**
     * Numero totale di nodi del sottoalbero, radice compresa.
     */
    public final int nodeCount() {
        int count = 1;
        for (Formula child : children()) {
            count += child.nodeCount();
        }
        return count;
    }

    //endregion

    //region NEGAZIONE STRUTTURALE

    /**
     * Negazione strutturale locale (non ricorsiva).
     *
     * TRASFORMAZIONI:
     * - p -> NOT(p)
     * - NOT(A) -> A
     * - A AND B -> NOT(A) OR NOT(B) (De Morgan, negando ogni operando)
     * - A OR B -> NOT(A) AND NOT(B)
     * - A IMPLIES B -> A AND neg(B)
     * - A IFF B -> (A AND neg(B)) OR (neg(A) AND B)
     *
     * Il risultato non è normalizzato: per spingere le negazioni fino alle foglie
     * combinare con {@link #toNNF()}.
     *
     * @return formula logicamente equivalente alla negazione di questa
     */
    public final Formula negate() {
        return switch (type) {
            case VAR -> new Not(this);

            case NOT -> children().get(0);

            case AND -> new Or(negateAll(children()));

            case OR -> new And(negateAll(children()));

            case IMPLIES -> new And(List.of(children().get(0), children().get(1).negate()));

            case IFF -> {
                Formula left = children().get(0);
                Formula right = children().get(1);
                yield new Or(List.of(
                        new And(List.of(left, right.negate())),
                        new And(List.of(left.negate(), right))));
            }
        };
    }

    private static List<Formula> negateAll(List<Formula> operands) {
        List<Formula> negated = new ArrayList<>(operands.size());
        for (Formula operand : operands) {
            negated.add(operand.negate());
        }
        return negated;
    }

    //endregion

    //region FORMA NORMALE NEGATIVA

    /**
     * Riscrive la formula in Forma Normale Negativa: ogni NOT compare solo
     * immediatamente sopra una variabile.
     *
     * ALGORITMO per NOT(sub):
     * - Conta le negazioni annidate fino al primo discendente che non è un NOT
     * - Numero pari: le negazioni si annullano, si normalizza il discendente
     * - Numero dispari su variabile: resta un solo NOT
     * - Numero dispari su AND/OR: De Morgan, negando e normalizzando ogni operando
     * - Numero dispari su IMPLIES/IFF: negazione locale del discendente, poi normalizzazione
     *
     * Gli altri connettivi (IMPLIES e IFF compresi) vengono preservati e la
     * normalizzazione procede ricorsivamente sui figli.
     *
     * @return formula equivalente in NNF
     */
    public final Formula toNNF() {
        return switch (type) {
            case VAR -> this;

            case NOT -> normalizeNegation();

            case AND -> new And(toNNFAll(children()));

            case OR -> new Or(toNNFAll(children()));

            case IMPLIES -> new Implies(children().get(0).toNNF(), children().get(1).toNNF());

            case IFF -> new Iff(children().get(0).toNNF(), children().get(1).toNNF());
        };
    }

    private Formula normalizeNegation() {
        int negations = 0;
        Formula inner = this;
        while (inner.type == Type.NOT) {
            negations++;
            inner = inner.children().get(0);
        }

        if (negations % 2 == 0) {
            return inner.toNNF();
        }

        return switch (inner.type) {
            case VAR -> new Not(inner);
            case AND -> new Or(negateToNNFAll(inner.children()));
            case OR -> new And(negateToNNFAll(inner.children()));
            case IMPLIES, IFF -> inner.negate().toNNF();
            case NOT -> throw new IllegalStateException("Negazioni annidate non consumate: " + this);
        };
    }

    private static List<Formula> toNNFAll(List<Formula> operands) {
        List<Formula> normalized = new ArrayList<>(operands.size());
        for (Formula operand : operands) {
            normalized.add(operand.toNNF());
        }
        return normalized;
    }

    private static List<Formula> negateToNNFAll(List<Formula> operands) {
        List<Formula> normalized = new ArrayList<>(operands.size());
        for (Formula operand : operands) {
            normalized.add(operand.negate().toNNF());
        }
        return normalized;
    }

    //endregion

    //region RAPPRESENTAZIONE TESTUALE

    /**
     * Testo canonico della formula in notazione infissa, rileggibile dal parser.
     *
     * FORMATO:
     * - Variabili: nome nudo
     * - Negazioni: sempre NOT(...), qualunque sia l'operando
     * - AND, OR, IMPLIES, IFF: operandi uniti da " AND ", " OR ", " IMPLIES ", " IFF ";
     *   un operando resta nudo se è una variabile o una negazione, altrimenti va tra parentesi
     *
     * Il testo dipende solo da tipo dei nodi, ordine dei figli e testo dei figli: è la
     * chiave di uguaglianza e hash della formula.
     */
    public final String toText() {
        String text = canonicalText;
        if (text == null) {
            text = render();
            canonicalText = text;
        }
        return text;
    }

    private String render() {
        return switch (type) {
            case VAR -> ((Var) this).name();
            case NOT -> "NOT(" + children().get(0).toText() + ")";
            case AND -> joinOperands(" AND ");
            case OR -> joinOperands(" OR ");
            case IMPLIES -> joinOperands(" IMPLIES ");
            case IFF -> joinOperands(" IFF ");
        };
    }

    private String joinOperands(String separator) {
        StringBuilder result = new StringBuilder();
        List<Formula> operands = children();
        for (int i = 0; i < operands.size(); i++) {
            if (i > 0) {
                result.append(separator);
            }
            Formula operand = operands.get(i);
            if (operand.type == Type.VAR || operand.type == Type.NOT) {
                result.append(operand.toText());
            } else {
                // Parentesi esplicite: il parser non risolve precedenze
                result.append('(').append(operand.toText()).append(')');
            }
        }
        return result.toString();
    }

    //endregion

    //region UGUAGLIANZA E HASH

    /**
     * Due formule sono uguali se e solo se il loro testo canonico coincide.
     * L'ordine degli operandi è significativo sia per AND sia per OR.
     */
    @Override
    public final boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Formula)) return false;
        return toText().equals(((Formula) obj).toText());
    }

    @Override
    public final int hashCode() {
        return toText().hashCode();
    }

    @Override
    public final String toString() {
        return toText();
    }

    //endregion

    //region VALIDAZIONE

    static Formula requireOperand(Formula operand, String role) {
        if (operand == null) {
            throw new FormulaConstructionException("Operando " + role + " non può essere null");
        }
        return operand;
    }

    static List<Formula> copyOperands(List<? extends Formula> operands, Type type) {
        if (operands == null || operands.isEmpty()) {
            throw new FormulaConstructionException("Lista operandi " + type + " non può essere null o vuota");
        }
        for (Formula operand : operands) {
            if (operand == null) {
                throw new FormulaConstructionException("Lista operandi " + type + " non può contenere elementi null");
            }
        }
        return List.copyOf(operands);
    }

    //endregion
}
