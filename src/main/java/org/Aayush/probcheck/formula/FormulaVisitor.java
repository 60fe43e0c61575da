package org.Aayush.probcheck.formula;

/**
 * Double-dispatch visitor over the formula tree.
 *
 * @param <R> result type.
 */
public interface FormulaVisitor<R> {

    R visitAtomicProposition(AtomicPropositionFormula formula);

    R visitUnary(UnaryFormula formula);

    R visitBinary(BinaryFormula formula);

    R visitBoundedUnary(BoundedUnaryFormula formula);

    R visitProbabilistic(ProbabilisticFormula formula);

    R visitCumulativeReward(CumulativeRewardFormula formula);
}
