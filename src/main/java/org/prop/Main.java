package org.prop;

import org.prop.formula.Formula;
import org.prop.formula.FormulaException;
import org.prop.graph.DotExporter;
import org.prop.graph.FormulaGraphBuilder;
import org.prop.normalform.NormalFormConverter;
import org.prop.parser.FormulaParser;
import org.prop.semantics.SemanticAnalyzer;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * FORMULE PROPOSIZIONALI - Interfaccia a riga di comando
 *
 * PIPELINE DI ELABORAZIONE:
 * 1. INPUT: Formula in notazione infissa da parametro (-e) o da file di testo (-f)
 * 2. PARSING: Lexer ANTLR + parser a discesa ricorsiva -> albero della formula
 * 3. OPERAZIONI RICHIESTE (-op=...):
 *    - neg: Negazione strutturale
 *    - nnf / cnf / dnf: Forme normali equivalenti
 *    - table: Tabella di verità completa
 *    - check: Tautologia, soddisfacibilità, contraddizione
 *    - graph: Descrizione a grafo in formato Graphviz DOT
 * 4. VALUTAZIONE: Se fornito un assegnamento (-ta=...), valore della formula e grafo annotato
 *
 * CODICI DI USCITA:
 * - 0: Elaborazione completata
 * - 1: Parametri non validi, formula non valida o errore inatteso
 */
public final class Main {

    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    //region CONFIGURAZIONE PARAMETRI APPLICAZIONE

    /**
     * Parametri linea di comando supportati
     * */
    private static final String HELP_PARAM = "-h";
    private static final String EXPRESSION_PARAM = "-e";
    private static final String FILE_PARAM = "-f";
    private static final String OPERATION_PARAM = "-op=";
    private static final String ASSIGNMENT_PARAM = "-ta=";
    private static final String MAX_VARIABLES_PARAM = "-max=";

    /**
     * Operazioni disponibili
     * */
    private static final String OP_ALL = "all";

    enum Operation {
        NEG, NNF, CNF, DNF, TABLE, CHECK, GRAPH
    }

    /**
     * Codici di uscita
     * */
    static final int EXIT_OK = 0;
    static final int EXIT_ERROR = 1;

    /**
     * Previene istanziazione - classe utility
     * */
    private Main() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //endregion

    //region PUNTO PRINCIPALE

    /**
     * Punto principale dell'applicazione.
     *
     * @param args parametri linea di comando forniti dall'utente
     */
    public static void main(String[] args) {
        int exitCode = run(args, System.out);
        if (exitCode != EXIT_OK) {
            System.exit(exitCode);
        }
    }

    /**
     * Esegue l'intera pipeline scrivendo i risultati sullo stream indicato.
     *
     * @param args parametri linea di comando
     * @param out destinazione dell'output
     * @return codice di uscita
     */
    static int run(String[] args, PrintStream out) {
        if (args.length == 0) {
            out.println("[E] Nessun parametro fornito. Usa -h per visualizzare l'help.");
            return EXIT_ERROR;
        }

        CliConfiguration config;
        try {
            config = new ArgumentParser().parse(args);
        } catch (IllegalArgumentException e) {
            out.println("[E] Errore nella validazione dei parametri: " + e.getMessage());
            out.println("Usa -h per visualizzare l'help completo.");
            return EXIT_ERROR;
        }

        if (config == null) {
            printApplicationHelp(out);
            return EXIT_OK;
        }

        try {
            executePipeline(config, out);
            return EXIT_OK;
        } catch (FormulaException e) {
            LOGGER.warning("Formula rifiutata: " + e.getMessage());
            out.println("[E] " + e.getMessage());
            return EXIT_ERROR;
        } catch (IOException e) {
            LOGGER.log(Level.SEVERE, "Errore di lettura del file " + config.formulaFile, e);
            out.println("[E] Impossibile leggere il file: " + config.formulaFile);
            return EXIT_ERROR;
        } catch (RuntimeException e) {
            LOGGER.log(Level.SEVERE, "Errore inatteso durante l'elaborazione", e);
            out.println("[E] Errore critico nell'applicazione: " + e.getMessage());
            return EXIT_ERROR;
        }
    }

    //endregion

    //region ELABORAZIONE FORMULA

    private static void executePipeline(CliConfiguration config, PrintStream out) throws IOException {
        String text = config.formulaText != null ? config.formulaText : readFormulaFromFile(config.formulaFile);

        Formula formula = new FormulaParser().parse(text);
        out.println("[I] Formula: " + formula);
        out.println("[I] Variabili: " + formula.variables() + ", connettivi: " + formula.connectiveCount()
                + ", profondità: " + formula.depth());

        SemanticAnalyzer analyzer = new SemanticAnalyzer(config.maxVariables);
        NormalFormConverter converter = new NormalFormConverter(analyzer);

        if (config.assignment != null) {
            out.println("[I] Valore sotto " + TruthAssignmentFormat.format(config.assignment) + ": "
                    + formula.evaluate(config.assignment));
        }

        for (Operation operation : config.operations) {
            switch (operation) {
                case NEG -> out.println("[I] Negazione: " + formula.negate());
                case NNF -> out.println("[I] NNF: " + converter.toNNF(formula));
                case CNF -> out.println("[I] CNF: " + converter.toCNF(formula));
                case DNF -> out.println("[I] DNF: " + converter.toDNF(formula));
                case TABLE -> {
                    out.println("[I] Tabella di verità:");
                    out.print(analyzer.truthTable(formula).format());
                }
                case CHECK -> {
                    out.println("[I] Tautologia: " + analyzer.isTautology(formula));
                    out.println("[I] Soddisfacibile: " + analyzer.isSatisfiable(formula));
                    out.println("[I] Contraddizione: " + analyzer.isFallacy(formula));
                }
                case GRAPH -> {
                    out.println("[I] Grafo (DOT):");
                    out.print(DotExporter.export(new FormulaGraphBuilder().build(formula, config.assignment)));
                }
            }
        }
    }

    /**
     * Legge il contenuto testuale di una formula logica da file.
     */
    private static String readFormulaFromFile(String filePath) throws IOException {
        String content = Files.readString(Path.of(filePath)).trim();
        LOGGER.fine("Formula letta da " + filePath + ": " + content);
        return content;
    }

    //endregion

    //region HELP E DOCUMENTAZIONE

    private static void printApplicationHelp(PrintStream out) {
        out.println("\n::>> FORMULE PROPOSIZIONALI <<::");
        out.println("Parsing, valutazione e forme normali (NNF, CNF, DNF) di formule proposizionali\n");

        out.println("UTILIZZO:");
        out.println("  java -jar formule-proposizionali.jar [opzioni]\n");

        out.println("PARAMETRI:");
        out.println("  -e <formula>      Formula da elaborare");
        out.println("  -f <file>         File di testo contenente la formula");
        out.println("  -op=<operazioni>  Operazioni separate da virgola: neg, nnf, cnf, dnf, table, check, graph, all");
        out.println("                    (default: check)");
        out.println("  -ta=<assegnamento> Assegnamento di verità, es. p=true,q=false (accetta anche 1/0)");
        out.println("  -max=<n>          Numero massimo di variabili enumerabili (1-"
                + SemanticAnalyzer.MAX_ALLOWED_VARIABLES + ", default: " + SemanticAnalyzer.DEFAULT_MAX_VARIABLES + ")");
        out.println("  -h                Mostra questa guida\n");

        out.println("SINTASSI FORMULE:");
        out.println("  Connettivi: AND, OR, IMPLIES, IFF, NOT(...)");
        out.println("  Connettivi diversi allo stesso livello richiedono parentesi: (p OR q) AND r");
        out.println("  IMPLIES e IFF accettano esattamente due operandi\n");

        out.println("ESEMPI DI UTILIZZO:");
        out.println("  java -jar formule-proposizionali.jar -e \"(p IMPLIES q) IFF (NOT(q) IMPLIES NOT(p))\"");
        out.println("  java -jar formule-proposizionali.jar -f formula.txt -op=cnf,dnf,table");
        out.println("  java -jar formule-proposizionali.jar -e \"p AND NOT(q)\" -op=graph -ta=p=1,q=0\n");
    }

    //endregion

    //region CLASSI DI SUPPORTO E CONFIGURAZIONE

    /**
     * Configurazione validata dell'applicazione.
     */
    static final class CliConfiguration {
        final String formulaText;
        final String formulaFile;
        final Set<Operation> operations;
        final Map<String, Boolean> assignment;
        final int maxVariables;

        CliConfiguration(String formulaText, String formulaFile, Set<Operation> operations,
                         Map<String, Boolean> assignment, int maxVariables) {
            this.formulaText = formulaText;
            this.formulaFile = formulaFile;
            this.operations = operations;
            this.assignment = assignment;
            this.maxVariables = maxVariables;
        }
    }

    /**
     * Parser dei parametri linea di comando con messaggi di errore informativi.
     */
    static final class ArgumentParser {

        /**
         * @param args parametri da linea di comando
         * @return configurazione validata, null se è stato richiesto l'help
         * @throws IllegalArgumentException se i parametri non sono validi
         */
        CliConfiguration parse(String[] args) {
            String formulaText = null;
            String formulaFile = null;
            Set<Operation> operations = null;
            Map<String, Boolean> assignment = null;
            int maxVariables = SemanticAnalyzer.DEFAULT_MAX_VARIABLES;

            for (int i = 0; i < args.length; i++) {
                switch (args[i]) {
                    case HELP_PARAM -> {
                        return null;
                    }

                    case EXPRESSION_PARAM -> {
                        validateSingleInput(formulaText, formulaFile);
                        formulaText = getNextArgument(args, ++i, "una formula");
                    }

                    case FILE_PARAM -> {
                        validateSingleInput(formulaText, formulaFile);
                        formulaFile = getNextArgument(args, ++i, "un file");
                        validateFileExists(formulaFile);
                    }

                    default -> {
                        if (args[i].startsWith(OPERATION_PARAM)) {
                            operations = parseOperations(args[i].substring(OPERATION_PARAM.length()));
                        } else if (args[i].startsWith(ASSIGNMENT_PARAM)) {
                            assignment = TruthAssignmentFormat.parse(args[i].substring(ASSIGNMENT_PARAM.length()));
                        } else if (args[i].startsWith(MAX_VARIABLES_PARAM)) {
                            maxVariables = parseMaxVariables(args[i].substring(MAX_VARIABLES_PARAM.length()));
                        } else {
                            throw new IllegalArgumentException("Parametro sconosciuto: " + args[i]);
                        }
                    }
                }
            }

            if (formulaText == null && formulaFile == null) {
                throw new IllegalArgumentException("Specificare la formula con -e <formula> o -f <file>");
            }
            if (operations == null) {
                operations = EnumSet.of(Operation.CHECK);
            }
            return new CliConfiguration(formulaText, formulaFile, operations, assignment, maxVariables);
        }

        private void validateSingleInput(String formulaText, String formulaFile) {
            if (formulaText != null || formulaFile != null) {
                throw new IllegalArgumentException("Specificare una sola formula (-e e -f sono mutualmente esclusivi)");
            }
        }

        private String getNextArgument(String[] args, int currentIndex, String argumentType) {
            if (currentIndex >= args.length) {
                throw new IllegalArgumentException("Parametro " + args[currentIndex - 1] + " richiede " + argumentType);
            }
            return args[currentIndex];
        }

        private Set<Operation> parseOperations(String value) {
            if (value.isBlank()) {
                throw new IllegalArgumentException("Valore -op vuoto");
            }
            if (value.equals(OP_ALL)) {
                return EnumSet.allOf(Operation.class);
            }

            Set<Operation> operations = EnumSet.noneOf(Operation.class);
            for (String name : value.split(",")) {
                try {
                    operations.add(Operation.valueOf(name.trim().toUpperCase()));
                } catch (IllegalArgumentException e) {
                    throw new IllegalArgumentException("Operazione non supportata: " + name.trim(), e);
                }
            }
            return operations;
        }

        private int parseMaxVariables(String value) {
            int max;
            try {
                max = Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Valore -max non valido: " + value, e);
            }
            if (max < 1 || max > SemanticAnalyzer.MAX_ALLOWED_VARIABLES) {
                throw new IllegalArgumentException("Valore -max deve essere tra 1 e "
                        + SemanticAnalyzer.MAX_ALLOWED_VARIABLES + ", ricevuto: " + max);
            }
            return max;
        }

        private void validateFileExists(String filePath) {
            File file = new File(filePath);
            if (!file.exists()) {
                throw new IllegalArgumentException("File non esistente: " + filePath);
            }
            if (!file.isFile()) {
                throw new IllegalArgumentException("Non è un file: " + filePath);
            }
            if (!file.canRead()) {
                throw new IllegalArgumentException("File non leggibile: " + filePath);
            }
        }
    }

    //endregion
}
