package org.Aayush.probcheck.formula;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.Aayush.probcheck.formula.Formulas.*;
import static org.junit.jupiter.api.Assertions.*;

class FormulaTest {

    @Test
    @DisplayName("Propositions are collected once each, left to right")
    void testCollectAtomicPropositions() {
        CollectAtomicPropositionsVisitor collector = new CollectAtomicPropositionsVisitor();
        collector.collect(until(proposition("b"), and(proposition("a"), proposition("b"))));
        collector.collect(cumulativeReward(proposition("c"), 4));
        collector.collect(probability(ComparisonOperator.LESS_EQUAL, 0.1d, eventuallyWithin(proposition("a"), 2)));

        assertEquals(List.of("b", "a", "c"), List.copyOf(collector.propositions()));
        assertThrows(UnsupportedOperationException.class, () -> collector.propositions().add("d"));
    }

    @Test
    @DisplayName("Formulas are values")
    void testValueEquality() {
        assertEquals(eventually(proposition("a")), eventually(proposition("a")));
        assertNotEquals(eventually(proposition("a")), globally(proposition("a")));
        assertEquals(eventuallyWithin(proposition("a"), 3).hashCode(), eventuallyWithin(proposition("a"), 3).hashCode());
        assertEquals("F(a)", eventually(proposition("a")).toString());
        assertEquals("(a U b)", until(proposition("a"), proposition("b")).toString());
    }

    @Test
    @DisplayName("Validation: malformed constructor arguments are rejected")
    void testValidation() {
        assertThrows(IllegalArgumentException.class, () -> proposition(" "));
        assertThrows(IllegalArgumentException.class, () -> new BoundedUnaryFormula(UnaryOperator.NEXT, proposition("a"), 1));
        assertThrows(IllegalArgumentException.class, () -> eventuallyWithin(proposition("a"), -1));
        assertThrows(IllegalArgumentException.class, () -> probability(ComparisonOperator.GREATER_THAN, 1.5d, eventually(proposition("a"))));
        assertThrows(NullPointerException.class, () -> not(null));
    }

    @Test
    @DisplayName("Comparison operators and their scheduler bound")
    void testComparisonOperators() {
        assertTrue(ComparisonOperator.GREATER_EQUAL.test(0.5d, 0.5d));
        assertFalse(ComparisonOperator.GREATER_THAN.test(0.5d, 0.5d));
        assertTrue(ComparisonOperator.LESS_THAN.test(0.4d, 0.5d));
        assertTrue(ComparisonOperator.GREATER_THAN.isLowerBound());
        assertFalse(ComparisonOperator.LESS_EQUAL.isLowerBound());
    }
}
