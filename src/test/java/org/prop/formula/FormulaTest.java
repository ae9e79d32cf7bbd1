package org.prop.formula;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.prop.formula.Formula.and;
import static org.prop.formula.Formula.iff;
import static org.prop.formula.Formula.implies;
import static org.prop.formula.Formula.or;
import static org.prop.formula.Formula.var;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

public class FormulaTest {
    private static final Var P = var("p");
    private static final Var Q = var("q");
    private static final Var R = var("r");

    @Test
    public void testEvaluate() {
        Map<String, Boolean> assignment = Map.of("p", true, "q", false);

        assertThat(P.evaluate(assignment), is(true));
        assertThat(Formula.not(P).evaluate(assignment), is(false));
        assertThat(and(P, Q).evaluate(assignment), is(false));
        assertThat(or(P, Q).evaluate(assignment), is(true));
        assertThat(implies(P, Q).evaluate(assignment), is(false));
        assertThat(implies(Q, P).evaluate(assignment), is(true));
        assertThat(iff(P, Q).evaluate(assignment), is(false));
        assertThat(iff(Q, Formula.not(P)).evaluate(assignment), is(true));
    }

    @Test
    public void testSingleOperandDegeneratesToOperand() {
        assertThat(and(P).evaluate(Map.of("p", true)), is(true));
        assertThat(or(P).evaluate(Map.of("p", false)), is(false));
    }

    @Test
    public void testMissingVariableIsReportedWithoutShortCircuit() {
        MissingVariableException exception = assertThrows(MissingVariableException.class,
            () -> and(P, Q).evaluate(Map.of("p", false)));
        assertThat(exception.getVariable(), is("q"));

        assertThrows(MissingVariableException.class, () -> implies(P, R).evaluate(Map.of("p", false)));
    }

    @Test
    public void testVariables() {
        Formula formula = implies(and(R, P), or(Q, Formula.not(P)));
        assertThat(formula.variables(), contains("p", "q", "r"));
        assertThat(P.children(), is(empty()));
    }

    @Test
    public void testMetrics() {
        Formula formula = implies(Formula.not(P), or(Q, R));
        assertThat(formula.connectiveCount(), is(3));
        assertThat(formula.depth(), is(2));
        assertThat(formula.nodeCount(), is(6));

        assertThat(and(P, Q, R).connectiveCount(), is(2));
        assertThat(P.connectiveCount(), is(0));
        assertThat(P.depth(), is(0));
    }

    @Test
    public void testRendering() {
        assertThat(Formula.not(and(P, Q)).toText(), is("NOT(p AND q)"));
        assertThat(and(P, Formula.not(Q), or(Q, R)).toText(), is("p AND NOT(q) AND (q OR r)"));
        assertThat(implies(and(P, Q), R).toText(), is("(p AND q) IMPLIES r"));
        assertThat(iff(implies(P, Q), Formula.not(R)).toText(), is("(p IMPLIES q) IFF NOT(r)"));
        assertThat(and(and(P, Q), R).toText(), is("(p AND q) AND r"));
    }

    @Test
    public void testEqualityIsTextual() {
        assertThat(and(P, Q), is(and(var("p"), var("q"))));
        assertThat(and(P, Q).hashCode(), is(and(var("p"), var("q")).hashCode()));
        assertThat(and(P, Q), is(not(and(Q, P))));
        assertThat(or(P, Q), is(not(or(Q, P))));
        assertThat(implies(P, Q), is(not(implies(Q, P))));
        assertThat(and(P, Q), is(not(or(P, Q))));
    }

    @Test
    public void testLabelIsMetadataOnly() {
        Formula labelled = and(P, Q).withLabel("premessa");
        assertThat(labelled.label(), is("premessa"));
        assertThat(and(P, Q).label(), is(nullValue()));
        assertThat(labelled, is(and(P, Q)));
        assertThat(labelled.hashCode(), is(and(P, Q).hashCode()));
        assertThat(labelled.toText(), is("p AND q"));
        assertThat(new Var("p", "ipotesi").evaluate(Map.of("p", true)), is(true));
    }

    @Test
    public void testConstructionErrors() {
        assertThrows(FormulaConstructionException.class, () -> new And(List.of()));
        assertThrows(FormulaConstructionException.class, () -> Formula.or());
        assertThrows(FormulaConstructionException.class, () -> and(P, null));
        assertThrows(FormulaConstructionException.class, () -> new Var("  "));
        assertThrows(FormulaConstructionException.class, () -> new Var(null));
        assertThrows(FormulaConstructionException.class, () -> new Not(null));
        assertThrows(FormulaConstructionException.class, () -> new Implies(P, null));
        assertThrows(FormulaConstructionException.class, () -> new Iff(null, Q));
        assertThrows(FormulaConstructionException.class, () -> new Var(""));
    }

    @ParameterizedTest
    @ValueSource(strings = {"p AND q", "p q", "p\tq", "p\u2003", "\u00A0", "(p)", "p(", "q)", "NOT", "AND", "OR",
        "IMPLIES", "IFF"})
    public void testRejectsNamesThatDoNotReadBack(String name) {
        assertThrows(FormulaConstructionException.class, () -> new Var(name));
    }

    @Test
    public void testVariableCannotImpersonateCompoundFormula() {
        assertThrows(FormulaConstructionException.class, () -> var("p AND q"));
        assertThat(var("p_AND_q"), is(not(and(P, Q))));
        assertThat(var("ANDp").toText(), is("ANDp"));
        assertThat(var("x'").toText(), is("x'"));
    }

    @Test
    public void testNegate() {
        assertThat(P.negate().toText(), is("NOT(p)"));
        assertThat(Formula.not(P).negate(), is(P));
        assertThat(and(P, Q).negate().toText(), is("NOT(p) OR NOT(q)"));
        assertThat(or(P, Q).negate().toText(), is("NOT(p) AND NOT(q)"));
        assertThat(and(Formula.not(P), Q).negate().toText(), is("p OR NOT(q)"));
        assertThat(implies(P, Q).negate().toText(), is("p AND NOT(q)"));
        assertThat(iff(P, Q).negate().toText(), is("(p AND NOT(q)) OR (NOT(p) AND q)"));
    }

    @Test
    public void testNegateKeepsNestedNegations() {
        // negate is local: NOT(NOT(p)) loses exactly one level
        Formula doubleNegation = Formula.not(Formula.not(P));
        assertThat(doubleNegation.negate().toText(), is("NOT(p)"));
    }

    @Test
    public void testSingleOperandRendering() {
        assertThat(and(P).toText(), is("p"));
        assertThat(or(Formula.not(Q)).toText(), is("NOT(q)"));
        // A compound single operand keeps its parentheses, as in a one-clause CNF
        assertThat(and(or(Formula.not(P), Q)).toText(), is("(NOT(p) OR q)"));
        assertThat(and(or(Formula.not(P), Q)), is(not(or(Formula.not(P), Q))));
    }

    @Test
    public void testToNNF() {
        assertThat(P.toNNF(), is(P));
        assertThat(Formula.not(Formula.not(P)).toNNF(), is(P));
        assertThat(Formula.not(Formula.not(Formula.not(P))).toNNF().toText(), is("NOT(p)"));
        assertThat(Formula.not(Formula.not(and(P, Q))).toNNF().toText(), is("p AND q"));
        assertThat(Formula.not(and(P, Q)).toNNF().toText(), is("NOT(p) OR NOT(q)"));
        assertThat(Formula.not(or(P, Formula.not(Q))).toNNF().toText(), is("NOT(p) AND q"));
        assertThat(Formula.not(implies(P, Q)).toNNF().toText(), is("p AND NOT(q)"));
        assertThat(Formula.not(iff(P, Q)).toNNF().toText(), is("(p AND NOT(q)) OR (NOT(p) AND q)"));
    }

    @Test
    public void testToNNFPreservesImpliesAndIff() {
        Formula formula = implies(Formula.not(Formula.not(P)), iff(Q, Formula.not(and(P, R))));
        assertThat(formula.toNNF().toText(), is("p IMPLIES (q IFF (NOT(p) OR NOT(r)))"));
    }

    @Test
    public void testIsLiteral() {
        assertThat(P.isLiteral(), is(true));
        assertThat(Formula.not(P).isLiteral(), is(true));
        assertThat(Formula.not(Formula.not(P)).isLiteral(), is(false));
        assertThat(and(P, Q).isLiteral(), is(false));
    }
}
