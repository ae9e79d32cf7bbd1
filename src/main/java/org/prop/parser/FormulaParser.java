package org.prop.parser;

import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.Token;
import org.prop.formula.And;
import org.prop.formula.Formula;
import org.prop.formula.FormulaConstructionException;
import org.prop.formula.Iff;
import org.prop.formula.Implies;
import org.prop.formula.Not;
import org.prop.formula.Or;
import org.prop.formula.Var;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * PARSER FORMULE LOGICHE - Lettore a discesa ricorsiva della notazione infissa con parentesi
 *
 * Converte il testo di una formula in un albero {@link Formula}. I token sono prodotti dal
 * lexer ANTLR {@code FormulaLexer}; la struttura viene ricostruita a mano perché la
 * grammatica non ammette precedenze: connettivi diversi allo stesso livello di
 * annidamento devono essere separati da parentesi esplicite.
 *
 * GRAMMATICA:
 * <pre>
 * formula := NOT '(' formula ')'
 *          | '(' formula ')'
 *          | IDENT
 *          | formula (AND formula)+
 *          | formula (OR formula)+
 *          | formula IMPLIES formula
 *          | formula IFF formula
 * </pre>
 *
 * ALGORITMO IN DUE FASI:
 * 1. Scansione: separa i gruppi tra parentesi dalle sequenze di token semplici che li
 *    circondano, scendendo ricorsivamente in ogni gruppo (che viene risolto subito)
 * 2. Risoluzione: per ogni livello percorre la lista ordinata di sequenze e sottoformule
 *    già risolte, tenendo traccia di un unico connettivo per livello
 *
 * La posizione di lettura non è condivisa: ogni chiamata ricorsiva restituisce gli
 * elementi letti insieme all'indice del primo token non consumato.
 *
 * ERRORI RILEVATI ({@link FormulaParseException}):
 * - NOT non seguito immediatamente da '('
 * - due connettivi o due operandi adiacenti
 * - livello che inizia o termina con un connettivo
 * - connettivi diversi allo stesso livello senza parentesi (es. "p OR q AND r")
 * - IMPLIES o IFF con un numero di operandi diverso da 2
 * - parentesi vuote o non bilanciate
 * - annidamento oltre {@link #getMaxNestingDepth()} livelli di parentesi
 */
public class FormulaParser {

    private static final Logger LOGGER = Logger.getLogger(FormulaParser.class.getName());

    //region CONFIGURAZIONE

    /** Livelli di parentesi annidate accettati di default */
    public static final int DEFAULT_MAX_NESTING_DEPTH = 256;

    /**
     * Limite massimo configurabile. Parser, rendering e valutazione sono ricorsivi sulla
     * profondità dell'albero, che non supera mai il numero di livelli di parentesi + 1.
     */
    public static final int MAX_ALLOWED_NESTING_DEPTH = 2048;

    /** Numero massimo di livelli di parentesi accettato da questa istanza */
    private final int maxNestingDepth;

    public FormulaParser() {
        this(DEFAULT_MAX_NESTING_DEPTH);
    }

    /**
     * @param maxNestingDepth numero massimo di parentesi aperte contemporaneamente
     * @throws IllegalArgumentException se fuori dall'intervallo 1..{@value #MAX_ALLOWED_NESTING_DEPTH}
     */
    public FormulaParser(int maxNestingDepth) {
        if (maxNestingDepth < 1 || maxNestingDepth > MAX_ALLOWED_NESTING_DEPTH) {
            throw new IllegalArgumentException("Limite di annidamento deve essere tra 1 e "
                    + MAX_ALLOWED_NESTING_DEPTH + ", ricevuto: " + maxNestingDepth);
        }
        this.maxNestingDepth = maxNestingDepth;
    }

    public int getMaxNestingDepth() {
        return maxNestingDepth;
    }

    //endregion

    //region PUNTO DI INGRESSO

    /**
     * Analizza il testo di una formula.
     *
     * @param text formula in notazione infissa
     * @return albero della formula
     * @throws FormulaParseException se il testo viola la grammatica
     */
    public Formula parse(String text) {
        if (text == null) {
            throw new FormulaParseException("Testo della formula null", 0);
        }

        List<Token> tokens = tokenize(text);
        if (tokens.isEmpty()) {
            throw new FormulaParseException("Formula vuota", text.length());
        }

        Scan topLevel = scan(tokens, 0, 0);
        if (topLevel.next < tokens.size()) {
            // La scansione si ferma solo su una ')' che non ha apertura corrispondente
            Token unmatched = tokens.get(topLevel.next);
            throw new FormulaParseException("Parentesi ')' senza corrispondente apertura",
                    unmatched.getStartIndex());
        }

        Formula formula = resolve(topLevel.elements, 0);
        LOGGER.fine("Formula analizzata: " + formula);
        return formula;
    }

    private List<Token> tokenize(String text) {
        FormulaLexer lexer = new FormulaLexer(CharStreams.fromString(text));
        lexer.removeErrorListeners();
        lexer.addErrorListener(ThrowingErrorListener.INSTANCE);
        return new ArrayList<>(lexer.getAllTokens());
    }

    //endregion

    //region FASE 1: SCANSIONE E GRUPPI TRA PARENTESI

    /**
     * Legge un livello di annidamento a partire da {@code start}, fermandosi sulla prima
     * ')' non consumata o a fine input. I gruppi interni vengono scansionati e risolti
     * ricorsivamente.
     *
     * @param depth numero di parentesi aperte che racchiudono questo livello
     */
    private Scan scan(List<Token> tokens, int start, int depth) {
        List<Element> elements = new ArrayList<>();
        int index = start;

        while (index < tokens.size() && tokens.get(index).getType() != FormulaLexer.RPAR) {
            Token token = tokens.get(index);

            if (token.getType() == FormulaLexer.LPAR) {
                if (depth >= maxNestingDepth) {
                    LOGGER.warning("Formula rifiutata: più di " + maxNestingDepth + " livelli di parentesi");
                    throw new FormulaParseException("Annidamento oltre il limite di " + maxNestingDepth
                            + " livelli di parentesi", token.getStartIndex());
                }
                Scan inner = scan(tokens, index + 1, depth + 1);
                if (inner.next >= tokens.size()) {
                    throw new FormulaParseException("Parentesi '(' non chiusa", token.getStartIndex());
                }
                Formula group = resolve(inner.elements, token.getStartIndex());
                elements.add(Element.group(group, token.getStartIndex()));
                index = inner.next + 1;
            } else {
                if (elements.isEmpty() || !elements.get(elements.size() - 1).isRun()) {
                    elements.add(Element.run());
                }
                elements.get(elements.size() - 1).run.add(token);
                index++;
            }
        }

        return new Scan(elements, index);
    }

    //endregion

    //region FASE 2: RISOLUZIONE DI UN LIVELLO

    /**
     * Risolve la lista di elementi di un livello in una singola formula.
     *
     * @param elements sequenze di token e sottoformule già risolte, nell'ordine del testo
     * @param position posizione da riportare se il livello è vuoto
     */
    private Formula resolve(List<Element> elements, int position) {
        LevelState state = new LevelState();

        for (int e = 0; e < elements.size(); e++) {
            Element element = elements.get(e);

            if (!element.isRun()) {
                state.addOperand(element.group, element.position);
                continue;
            }

            List<Token> run = element.run;
            for (int t = 0; t < run.size(); t++) {
                Token token = run.get(t);

                switch (token.getType()) {
                    case FormulaLexer.IDENTIFIER -> state.addOperand(variable(token), token.getStartIndex());

                    case FormulaLexer.NOT -> {
                        // NOT deve chiudere la sequenza ed essere seguito da un gruppo tra parentesi
                        boolean followedByGroup = t == run.size() - 1
                                && e + 1 < elements.size()
                                && !elements.get(e + 1).isRun();
                        if (!followedByGroup) {
                            throw new FormulaParseException(
                                    "NOT deve essere seguito da '(' (es. \"NOT(p)\" e non \"NOT p\")",
                                    token.getStartIndex());
                        }
                        state.addOperand(new Not(elements.get(e + 1).group), token.getStartIndex());
                        e++;
                    }

                    case FormulaLexer.AND, FormulaLexer.OR, FormulaLexer.IMPLIES, FormulaLexer.IFF ->
                            state.addConnective(token);

                    default -> throw new FormulaParseException("Token inatteso: " + token.getText(),
                            token.getStartIndex());
                }
            }
        }

        return state.build(position);
    }

    private static Var variable(Token token) {
        try {
            return new Var(token.getText());
        } catch (FormulaConstructionException e) {
            throw new FormulaParseException(e.getMessage(), token.getStartIndex(), e);
        }
    }

    /**
     * Stato di risoluzione di un singolo livello: operandi raccolti e unico connettivo ammesso.
     */
    private static final class LevelState {

        private final List<Formula> operands = new ArrayList<>();

        /** Primo connettivo incontrato nel livello, null se nessuno */
        private Token connective;

        /** Ultimo connettivo letto, usato per segnalare connettivi finali */
        private Token lastConnective;

        private boolean expectOperand = true;

        void addOperand(Formula operand, int position) {
            if (!expectOperand) {
                throw new FormulaParseException("Due sottoformule adiacenti senza connettivo", position);
            }
            operands.add(operand);
            expectOperand = false;
        }

        void addConnective(Token token) {
            if (expectOperand) {
                String message = operands.isEmpty()
                        ? "La formula non può iniziare con il connettivo " + token.getText()
                        : "Connettivi adiacenti senza sottoformula: " + lastConnective.getText() + " " + token.getText();
                throw new FormulaParseException(message, token.getStartIndex());
            }
            if (connective == null) {
                connective = token;
            } else if (connective.getType() != token.getType()) {
                throw new FormulaParseException("Formula ambigua: " + connective.getText() + " e "
                        + token.getText() + " allo stesso livello senza parentesi", token.getStartIndex());
            }
            lastConnective = token;
            expectOperand = true;
        }

        Formula build(int position) {
            if (operands.isEmpty()) {
                throw new FormulaParseException("Formula o parentesi vuota", position);
            }
            if (expectOperand) {
                throw new FormulaParseException("La formula non può terminare con il connettivo "
                        + lastConnective.getText(), lastConnective.getStartIndex());
            }
            if (connective == null) {
                return operands.get(0);
            }

            return switch (connective.getType()) {
                case FormulaLexer.AND -> new And(operands);
                case FormulaLexer.OR -> new Or(operands);
                case FormulaLexer.IMPLIES -> {
                    requireBinary();
                    yield new Implies(operands.get(0), operands.get(1));
                }
                case FormulaLexer.IFF -> {
                    requireBinary();
                    yield new Iff(operands.get(0), operands.get(1));
                }
                default -> throw new IllegalStateException("Connettivo non gestito: " + connective.getText());
            };
        }

        private void requireBinary() {
            if (operands.size() != 2) {
                throw new FormulaParseException(connective.getText() + " richiede esattamente 2 operandi, trovati "
                        + operands.size(), connective.getStartIndex());
            }
        }
    }

    //endregion

    //region STRUTTURE DI SUPPORTO

    /**
     * Risultato della scansione di un livello: elementi letti e indice del primo token non consumato.
     */
    private static final class Scan {
        final List<Element> elements;
        final int next;

        Scan(List<Element> elements, int next) {
            this.elements = elements;
            this.next = next;
        }
    }

    /**
     * Elemento di un livello: sequenza di token semplici oppure gruppo tra parentesi già risolto.
     */
    private static final class Element {
        final List<Token> run;
        final Formula group;

        /** Posizione della '(' di apertura, solo per i gruppi */
        final int position;

        private Element(List<Token> run, Formula group, int position) {
            this.run = run;
            this.group = group;
            this.position = position;
        }

        static Element run() {
            return new Element(new ArrayList<>(), null, -1);
        }

        static Element group(Formula formula, int position) {
            return new Element(null, formula, position);
        }

        boolean isRun() {
            return run != null;
        }
    }

    //endregion
}
