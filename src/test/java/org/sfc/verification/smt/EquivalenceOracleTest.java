package org.sfc.verification.smt;

import org.junit.jupiter.api.Test;
import org.sfc.verification.config.DataComparison;
import org.sfc.verification.config.VerifierConfig;
import org.sfc.verification.expression.ExpressionTranslator;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EquivalenceOracleTest {
    private final EquivalenceOracle oracle = new EquivalenceOracle();
    private final EquivalenceOracle semantic = new EquivalenceOracle(DataComparison.SEMANTIC, 0);

    @Test
    void shouldProveEquivalentConditions() {
        assertTrue(oracle.areConditionsEquivalent("(> x 0)", "(not (<= x 0))"));
        assertTrue(oracle.areConditionsEquivalent("(and a b)", "(and b a)"));
        assertTrue(oracle.areConditionsEquivalent("(= (mod x 2) 0)", "(not (= (mod x 2) 1))"));
        assertTrue(oracle.areConditionsEquivalent("(< i n)", "(<= (+ i 1) n)"));
    }

    @Test
    void shouldRejectDifferentConditions() {
        assertFalse(oracle.areConditionsEquivalent("(> x 0)", "(> x 1)"));
        assertFalse(oracle.areConditionsEquivalent("(< i n)", "(<= i n)"));
        assertFalse(oracle.areConditionsEquivalent("true", "(> i n)"));
    }

    @Test
    void shouldTreatInitAsTrue() {
        assertTrue(oracle.areConditionsEquivalent("init", "true"));
        assertTrue(oracle.areConditionsEquivalent("init", "(or p (not p))"));
    }

    @Test
    void shouldFailClosedOnUnreadableConditions() {
        assertFalse(oracle.areConditionsEquivalent("(> x", "(> x"));
        assertFalse(oracle.areConditionsEquivalent("(foo x)", "(foo x)"));
        assertFalse(oracle.areConditionsEquivalent("i <= n", "(<= i n)"));
    }

    @Test
    void shouldFailClosedOnSortConflict() {
        assertFalse(oracle.areConditionsEquivalent("(and x (> x 1))", "(and x (> x 1))"));
    }

    @Test
    void shouldTypeEqualityOperandsIndependentlyOfOrder() {
        assertTrue(oracle.areConditionsEquivalent("(and (= ready done) ready)", "(and (= ready done) ready)"));
        assertTrue(oracle.areConditionsEquivalent("(and (= ready done) ready)", "(and ready done)"));
        assertTrue(oracle.areConditionsEquivalent("(and ready (= ready done))", "(and (= ready done) ready)"));
    }

    @Test
    void shouldCompareNonDecimalIntegerLiteralsByValue() {
        String hex = ExpressionTranslator.translate("x > 0x10");

        assertTrue(oracle.areConditionsEquivalent(hex, "(> x 16)"));
        assertTrue(oracle.areConditionsEquivalent(ExpressionTranslator.translate("x < 1_000L"), "(< x 1000)"));
    }

    @Test
    void shouldFailClosedOnAtomsThatAreNotIntegersOrIdentifiers() {
        assertFalse(oracle.areConditionsEquivalent("(> x 1.5)", "(> x 1.5)"));
        assertFalse(oracle.areConditionsEquivalent("(= c 'a')", "(= c 'a')"));
    }

    @Test
    void shouldReadAssignmentsWithLaterFactWinning() {
        Map<String, String> facts = EquivalenceOracle.parseAssignments("(and (= x (+ x 1)) (= y 2) (= x 5))");

        assertEquals(Map.of("x", "5", "y", "2"), facts);
        assertEquals(List.of("x", "y"), List.copyOf(facts.keySet()));
        assertTrue(EquivalenceOracle.parseAssignments("true").isEmpty());
        assertEquals(Map.of("fact", "(* fact i)"), EquivalenceOracle.parseAssignments("(= fact (* fact i))"));
    }

    @Test
    void shouldCompareDataTransformationsSyntactically() {
        assertTrue(oracle.areDataTransformationsEquivalent("(= x (+ x 1))", "(= x (+ x 1))", List.of("x")));
        assertFalse(oracle.areDataTransformationsEquivalent("(= x (+ x 1))", "(= x (+ 1 x))", List.of("x")));
        assertTrue(oracle.areDataTransformationsEquivalent("(= temp 0)", "true", List.of("x")));
        assertFalse(oracle.areDataTransformationsEquivalent("(= x 1)", "true", List.of("x")));
    }

    @Test
    void shouldCompareDataTransformationsSemanticallyWhenEnabled() {
        assertTrue(semantic.areDataTransformationsEquivalent("(= x (+ x 1))", "(= x (+ 1 x))", List.of("x")));
        assertTrue(semantic.areDataTransformationsEquivalent("true", "(= x x)", List.of("x")));
        assertFalse(semantic.areDataTransformationsEquivalent("(= x (* 2 x))", "(= x (+ x 1))", List.of("x")));
    }

    @Test
    void shouldFailClosedOnUnreadableDataTransformations() {
        assertFalse(oracle.areDataTransformationsEquivalent("(= x", "(= x 1)", List.of("x")));
    }

    @Test
    void shouldBuildFromConfig() {
        VerifierConfig config = VerifierConfig.defaults();
        config.dataComparison = DataComparison.SEMANTIC;
        config.solverTimeoutMillis = 2000;

        EquivalenceOracle configured = new EquivalenceOracle(config);

        assertTrue(configured.areDataTransformationsEquivalent("(= y (- y 0))", "(= y y)", List.of("y")));
        assertTrue(configured.areConditionsEquivalent("(>= x 3)", "(> x 2)"));
    }
}
