package org.prop;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class MainTest {
    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private final PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8);

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    @Test
    public void testNoArguments() {
        assertThat(Main.run(new String[0], out), is(Main.EXIT_ERROR));
        assertThat(output(), containsString("[E] Nessun parametro fornito"));
    }

    @Test
    public void testHelp() {
        assertThat(Main.run(new String[] {"-h"}, out), is(Main.EXIT_OK));
        assertThat(output(), containsString("UTILIZZO:"));
    }

    @Test
    public void testDefaultCheck() {
        int code = Main.run(new String[] {"-e", "(p IMPLIES q) IFF (NOT(q) IMPLIES NOT(p))"}, out);
        assertThat(code, is(Main.EXIT_OK));
        assertThat(output(), containsString("[I] Formula: (p IMPLIES q) IFF (NOT(q) IMPLIES NOT(p))"));
        assertThat(output(), containsString("[I] Variabili: [p, q]"));
        assertThat(output(), containsString("[I] Tautologia: true"));
        assertThat(output(), containsString("[I] Contraddizione: false"));
        assertThat(output(), not(containsString("CNF")));
    }

    @Test
    public void testNormalFormsAndAssignment() {
        int code = Main.run(new String[] {"-e", "p IMPLIES q", "-op=neg,cnf,dnf", "-ta=p=1,q=0"}, out);
        assertThat(code, is(Main.EXIT_OK));
        assertThat(output(), containsString("[I] Valore sotto p=true,q=false: false"));
        assertThat(output(), containsString("[I] Negazione: p AND NOT(q)"));
        assertThat(output(), containsString("[I] CNF: (NOT(p) OR q)"));
        assertThat(output(), containsString("[I] DNF: (p AND q) OR (NOT(p) AND q) OR (NOT(p) AND NOT(q))"));
        assertThat(output(), not(containsString("Tautologia")));
    }

    @Test
    public void testTableAndGraph() {
        int code = Main.run(new String[] {"-e", "p AND q", "-op=table,graph", "-ta=p=true,q=true"}, out);
        assertThat(code, is(Main.EXIT_OK));
        assertThat(output(), containsString("p | q | p AND q\n"));
        assertThat(output(), containsString("digraph formula {"));
        assertThat(output(), containsString("fillcolor=palegreen"));
    }

    @Test
    public void testAllOperations() {
        assertThat(Main.run(new String[] {"-e", "NOT(p OR q)", "-op=all"}, out), is(Main.EXIT_OK));
        assertThat(output(), containsString("[I] NNF: NOT(p) AND NOT(q)"));
        assertThat(output(), containsString("[I] Soddisfacibile: true"));
        assertThat(output(), containsString("digraph formula {"));
    }

    @Test
    public void testFormulaFromFile(@TempDir Path directory) throws IOException {
        Path file = directory.resolve("formula.txt");
        Files.writeString(file, "p OR NOT(p)\n");
        assertThat(Main.run(new String[] {"-f", file.toString()}, out), is(Main.EXIT_OK));
        assertThat(output(), containsString("[I] Tautologia: true"));
    }

    @Test
    public void testInvalidFormula() {
        assertThat(Main.run(new String[] {"-e", "p OR q AND r"}, out), is(Main.EXIT_ERROR));
        assertThat(output(), containsString("[E] Formula ambigua"));
    }

    @Test
    public void testDeeplyNestedFormulaIsReported() {
        String deep = "NOT(".repeat(50000) + "p" + ")".repeat(50000);
        assertThat(Main.run(new String[] {"-e", deep}, out), is(Main.EXIT_ERROR));
        assertThat(output(), containsString("[E] Annidamento oltre il limite"));
    }

    @Test
    public void testTooManyVariables() {
        assertThat(Main.run(new String[] {"-e", "p AND q AND r", "-max=2"}, out), is(Main.EXIT_ERROR));
        assertThat(output(), containsString("[E] "));
    }

    @Test
    public void testMissingVariableInAssignment() {
        assertThat(Main.run(new String[] {"-e", "p AND q", "-ta=p=true"}, out), is(Main.EXIT_ERROR));
        assertThat(output(), containsString("[E] "));
    }

    @Test
    public void testInvalidParameters() {
        assertThat(Main.run(new String[] {"-e"}, out), is(Main.EXIT_ERROR));
        assertThat(Main.run(new String[] {"-e", "p", "-e", "q"}, out), is(Main.EXIT_ERROR));
        assertThat(Main.run(new String[] {"-e", "p", "-op=sat"}, out), is(Main.EXIT_ERROR));
        assertThat(Main.run(new String[] {"-e", "p", "-max=31"}, out), is(Main.EXIT_ERROR));
        assertThat(Main.run(new String[] {"-e", "p", "-ta=p=forse"}, out), is(Main.EXIT_ERROR));
        assertThat(Main.run(new String[] {"-f", "/non/esiste/formula.txt"}, out), is(Main.EXIT_ERROR));
        assertThat(Main.run(new String[] {"-x"}, out), is(Main.EXIT_ERROR));
        assertThat(Main.run(new String[] {"-op=cnf"}, out), is(Main.EXIT_ERROR));
        assertThat(output(), containsString("[E] Errore nella validazione dei parametri"));
    }
}
