package org.prop.normalform;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.prop.RandomFormulaGenerator;
import org.prop.formula.Formula;
import org.prop.parser.FormulaParser;
import org.prop.semantics.SemanticAnalyzer;
import org.prop.semantics.TooManyVariablesException;

public class NormalFormConverterTest {
    private final FormulaParser parser = new FormulaParser();
    private final SemanticAnalyzer analyzer = new SemanticAnalyzer();
    private final NormalFormConverter converter = new NormalFormConverter(analyzer);

    @Test
    public void testCNFFromCounterexamples() {
        assertThat(converter.toCNF(parser.parse("p AND p")).toText(), is("(p)"));
        assertThat(converter.toCNF(parser.parse("p IMPLIES q")).toText(), is("(NOT(p) OR q)"));
        assertThat(converter.toCNF(parser.parse("p AND q")).toText(),
            is("(NOT(p) OR q) AND (p OR NOT(q)) AND (p OR q)"));
    }

    @Test
    public void testDNFFromModels() {
        assertThat(converter.toDNF(parser.parse("p IMPLIES q")).toText(),
            is("(p AND q) OR (NOT(p) AND q) OR (NOT(p) AND NOT(q))"));
        assertThat(converter.toDNF(parser.parse("p OR NOT(p)")).toText(), is("(p) OR (NOT(p))"));
    }

    @Test
    public void testDegenerateCases() {
        assertThat(converter.toCNF(parser.parse("p OR NOT(p)")).toText(), is("(p OR NOT(p))"));
        assertThat(converter.toCNF(parser.parse("(p OR NOT(p)) AND (q OR NOT(q))")).toText(),
            is("(p OR NOT(p)) AND (q OR NOT(q))"));
        assertThat(converter.toDNF(parser.parse("p AND NOT(p)")).toText(), is("(p AND NOT(p))"));
        assertThat(converter.toDNF(parser.parse("(p AND NOT(p)) OR (q AND NOT(q))")).toText(),
            is("(p AND NOT(p)) OR (q AND NOT(q))"));
    }

    @Test
    public void testMintermAndMaxterm() {
        Map<String, Boolean> assignment = new LinkedHashMap<>();
        assignment.put("p", true);
        assignment.put("q", false);
        assertThat(NormalFormConverter.minterm(assignment).toText(), is("p AND NOT(q)"));
        assertThat(NormalFormConverter.maxterm(assignment).toText(), is("NOT(p) OR q"));
        assertThat(NormalFormConverter.minterm(assignment).evaluate(assignment), is(true));
        assertThat(NormalFormConverter.maxterm(assignment).evaluate(assignment), is(false));
    }

    @Test
    public void testConversionsAreEquivalent() {
        List<Formula> corpus = RandomFormulaGenerator.corpus(23L, 80, 4, 4);
        for (Formula formula : corpus) {
            Formula nnf = converter.toNNF(formula);
            Formula cnf = converter.toCNF(formula);
            Formula dnf = converter.toDNF(formula);

            assertThat(analyzer.equivalent(formula, nnf), is(true));
            assertThat(analyzer.equivalent(formula, cnf), is(true));
            assertThat(analyzer.equivalent(formula, dnf), is(true));

            assertThat(NormalForms.isNNF(nnf), is(true));
            assertThat(NormalForms.isCNF(cnf), is(true));
            assertThat(NormalForms.isDNF(dnf), is(true));
        }
    }

    @Test
    public void testRespectsVariableLimit() {
        NormalFormConverter limited = new NormalFormConverter(new SemanticAnalyzer(2));
        Formula formula = parser.parse("p AND q AND r");
        assertThrows(TooManyVariablesException.class, () -> limited.toCNF(formula));
        assertThrows(TooManyVariablesException.class, () -> limited.toDNF(formula));
        assertThat(limited.toNNF(parser.parse("NOT(p AND q AND r)")).toText(), is("NOT(p) OR NOT(q) OR NOT(r)"));
    }

    @Test
    public void testRejectsMissingAnalyzer() {
        assertThrows(IllegalArgumentException.class, () -> new NormalFormConverter(null));
    }
}
