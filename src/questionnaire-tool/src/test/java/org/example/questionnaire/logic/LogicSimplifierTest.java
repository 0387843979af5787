package org.example.questionnaire.logic;

import java.math.BigDecimal;

import org.junit.jupiter.api.Test;

import org.example.questionnaire.validation.FindingCollector;
import org.example.questionnaire.validation.Severity;
import org.example.questionnaire.validation.ValidationLevel;

import static org.example.questionnaire.logic.LogicExpr.and;
import static org.example.questionnaire.logic.LogicExpr.condition;
import static org.example.questionnaire.logic.LogicExpr.not;
import static org.example.questionnaire.logic.LogicExpr.or;
import static org.junit.jupiter.api.Assertions.*;

public class LogicSimplifierTest {

    private final LogicSimplifier simplifier = new LogicSimplifier();

    private static LogicExpr x(Operation op, int value) {
        return condition("x", op, value);
    }

    private static final LogicExpr A = condition("a", Operation.EQ, true);
    private static final LogicExpr B = condition("b", Operation.EQ, "Red");
    private static final LogicExpr C = condition("c", Operation.IN, "Fever");

    // ── Numeric bounds ──

    @Test
    void conjunctionKeepsTighterLowerBound() {
        assertEquals(x(Operation.GT, 5), simplifier.simplify(and(x(Operation.GT, 5), x(Operation.GT, 3))));
    }

    @Test
    void disjunctionKeepsLooserLowerBound() {
        assertEquals(x(Operation.GT, 3), simplifier.simplify(or(x(Operation.GT, 5), x(Operation.GT, 3))));
    }

    @Test
    void strictBoundIsTighterAtEqualValue() {
        assertEquals(x(Operation.GT, 5), simplifier.simplify(and(x(Operation.GE, 5), x(Operation.GT, 5))));
        assertEquals(x(Operation.LE, 5), simplifier.simplify(or(x(Operation.LE, 5), x(Operation.LT, 5))));
    }

    @Test
    void emptyRangeIsFalse() {
        assertTrue(simplifier.simplify(and(x(Operation.GT, 5), x(Operation.LT, 3))).isFalse());
        assertTrue(simplifier.simplify(and(x(Operation.GT, 3), x(Operation.LT, 3))).isFalse());
    }

    @Test
    void closedPointRangeIsEquality() {
        assertEquals(x(Operation.EQ, 3), simplifier.simplify(and(x(Operation.GE, 3), x(Operation.LE, 3))));
    }

    @Test
    void rangeIsOrderedLowerThenUpper() {
        assertEquals(and(x(Operation.GT, 2), x(Operation.LT, 10)),
            simplifier.simplify(and(x(Operation.LT, 10), x(Operation.GT, 2))));
    }

    @Test
    void boundsOnDifferentSubjectsStayApart() {
        LogicExpr y = condition("y", Operation.GT, 1);
        assertEquals(and(x(Operation.GT, 5), y), simplifier.simplify(and(x(Operation.GT, 5), y, x(Operation.GT, 3))));
    }

    @Test
    void equalityInsideRangeSurvivesAlone() {
        assertEquals(x(Operation.EQ, 5), simplifier.simplify(and(x(Operation.EQ, 5), x(Operation.GT, 3))));
        assertTrue(simplifier.simplify(and(x(Operation.EQ, 5), x(Operation.LT, 5))).isFalse());
        assertTrue(simplifier.simplify(and(x(Operation.EQ, 5), x(Operation.EQ, 6))).isFalse());
    }

    @Test
    void numbersCompareByValue() {
        assertEquals(condition("x", Operation.EQ, 5), condition("x", Operation.EQ, new BigDecimal("5.00")));
        assertEquals(condition("x", Operation.GT, new BigDecimal("2.5")),
            simplifier.simplify(and(condition("x", Operation.GT, new BigDecimal("2.50")), x(Operation.GT, 1))));
    }

    // ── Constants ──

    @Test
    void identityConstantsAreDropped() {
        assertEquals(A, simplifier.simplify(and(A, LogicExpr.TRUE)));
        assertEquals(A, simplifier.simplify(or(A, LogicExpr.FALSE)));
    }

    @Test
    void dominantConstantsWin() {
        assertTrue(simplifier.simplify(and(A, LogicExpr.FALSE)).isFalse());
        assertTrue(simplifier.simplify(or(A, LogicExpr.TRUE)).isTrue());
    }

    @Test
    void constantsAreFixedPoints() {
        assertTrue(simplifier.simplify(LogicExpr.TRUE).isTrue());
        assertTrue(simplifier.simplify(LogicExpr.FALSE).isFalse());
        assertEquals("true", LogicExpr.TRUE.toString());
        assertEquals("false", LogicExpr.FALSE.toString());
    }

    // ── Negation ──

    @Test
    void doubleNegationCancels() {
        assertEquals(C, simplifier.simplify(not(not(C))));
    }

    @Test
    void negatedConstantFlips() {
        assertTrue(simplifier.simplify(not(LogicExpr.TRUE)).isFalse());
        assertTrue(simplifier.simplify(not(LogicExpr.FALSE)).isTrue());
    }

    @Test
    void negatedComparisonIsComplement() {
        assertEquals(x(Operation.LE, 5), simplifier.simplify(not(x(Operation.GT, 5))));
        assertEquals(condition("b", Operation.NE, "Red"), simplifier.simplify(not(B)));
    }

    @Test
    void negatedMembershipStays() {
        assertEquals(not(C), simplifier.simplify(not(C)));
    }

    // ── Structure ──

    @Test
    void duplicatesAreRemoved() {
        assertEquals(A, simplifier.simplify(and(A, A)));
        assertEquals(or(A, B), simplifier.simplify(or(A, B, A)));
    }

    @Test
    void nestedJunctionsAreFlattened() {
        assertEquals(and(A, B, C), simplifier.simplify(and(A, and(B, C))));
        assertEquals(or(A, B, C), simplifier.simplify(or(or(A, B), C)));
    }

    @Test
    void absorption() {
        assertEquals(A, simplifier.simplify(and(A, or(A, B))));
        assertEquals(A, simplifier.simplify(or(A, and(A, B))));
    }

    @Test
    void membershipConditionsAreOnlyDeduplicated() {
        LogicExpr rash = condition("c", Operation.IN, "Rash");
        assertEquals(or(C, rash), simplifier.simplify(or(C, rash, C)));
    }

    @Test
    void simplificationIsIdempotent() {
        LogicExpr expr = or(
            and(x(Operation.GT, 2), and(x(Operation.LT, 10), A), LogicExpr.TRUE),
            not(not(and(B, or(B, C)))),
            and(x(Operation.GE, 4), x(Operation.LE, 4)));
        LogicExpr once = simplifier.simplify(expr);
        assertEquals(once, simplifier.simplify(once));
    }

    @Test
    void roundLimitIsReportedAsWarning() {
        FindingCollector findings = new FindingCollector(ValidationLevel.STRICT);
        LogicExpr out = new LogicSimplifier(1).simplify(and(x(Operation.GT, 5), x(Operation.GT, 3)), findings, "n1");

        assertEquals(x(Operation.GT, 5), out);
        assertEquals(1, findings.getFindings(Severity.WARNING).size());
        assertEquals("n1", findings.getFindings().get(0).location());
    }

    @Test
    void settledTreeReportsNothing() {
        FindingCollector findings = new FindingCollector(ValidationLevel.STRICT);
        simplifier.simplify(and(x(Operation.GT, 5), x(Operation.GT, 3)), findings, "n1");
        assertTrue(findings.getFindings().isEmpty());
    }

    @Test
    void nullStaysNull() {
        assertNull(simplifier.simplify(null));
    }
}
