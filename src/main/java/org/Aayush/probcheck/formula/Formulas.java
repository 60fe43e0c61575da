package org.Aayush.probcheck.formula;

import lombok.experimental.UtilityClass;

/**
 * Factory shorthands for building formula trees.
 */
@UtilityClass
public class Formulas {

    public AtomicPropositionFormula proposition(String label) {
        return new AtomicPropositionFormula(label);
    }

    public Formula not(Formula operand) {
        return new UnaryFormula(UnaryOperator.NOT, operand);
    }

    public Formula and(Formula left, Formula right) {
        return new BinaryFormula(left, BinaryOperator.AND, right);
    }

    public Formula or(Formula left, Formula right) {
        return new BinaryFormula(left, BinaryOperator.OR, right);
    }

    public Formula implies(Formula left, Formula right) {
        return new BinaryFormula(left, BinaryOperator.IMPLICATION, right);
    }

    public Formula equivalent(Formula left, Formula right) {
        return new BinaryFormula(left, BinaryOperator.EQUIVALENCE, right);
    }

    public Formula next(Formula operand) {
        return new UnaryFormula(UnaryOperator.NEXT, operand);
    }

    public Formula eventually(Formula operand) {
        return new UnaryFormula(UnaryOperator.FINALLY, operand);
    }

    public Formula globally(Formula operand) {
        return new UnaryFormula(UnaryOperator.GLOBALLY, operand);
    }

    public Formula until(Formula left, Formula right) {
        return new BinaryFormula(left, BinaryOperator.UNTIL, right);
    }

    public Formula eventuallyWithin(Formula operand, int steps) {
        return new BoundedUnaryFormula(UnaryOperator.FINALLY, operand, steps);
    }

    public Formula globallyWithin(Formula operand, int steps) {
        return new BoundedUnaryFormula(UnaryOperator.GLOBALLY, operand, steps);
    }

    public Formula probability(ComparisonOperator comparator, double bound, Formula pathFormula) {
        return new ProbabilisticFormula(comparator, bound, pathFormula);
    }

    public Formula cumulativeReward(Formula condition, int steps) {
        return new CumulativeRewardFormula(condition, steps);
    }
}
