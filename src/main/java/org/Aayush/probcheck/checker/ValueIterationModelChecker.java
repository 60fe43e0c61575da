package org.Aayush.probcheck.checker;

import lombok.extern.slf4j.Slf4j;
import org.Aayush.probcheck.formula.AtomicPropositionFormula;
import org.Aayush.probcheck.formula.BinaryFormula;
import org.Aayush.probcheck.formula.BinaryOperator;
import org.Aayush.probcheck.formula.BoundedUnaryFormula;
import org.Aayush.probcheck.formula.CumulativeRewardFormula;
import org.Aayush.probcheck.formula.Formula;
import org.Aayush.probcheck.formula.FormulaKind;
import org.Aayush.probcheck.formula.FormulaKindVisitor;
import org.Aayush.probcheck.formula.ProbabilisticFormula;
import org.Aayush.probcheck.formula.UnaryFormula;
import org.Aayush.probcheck.formula.UnaryOperator;
import org.Aayush.probcheck.graph.CompactProbabilityMatrix;
import org.Aayush.probcheck.model.Probability;

import java.util.BitSet;
import java.util.Objects;

/**
 * Default numeric back end: value iteration over the compact matrix.
 * <p>
 * Path formulas are evaluated on paths starting in the states reached by the initial
 * distributions; the reported value folds the configured extremum over those distributions.
 * Step bounds and cumulative rewards count the initial step as step 1.
 * Globally operators are computed through the complement of finally with the extremum
 * flipped. Probabilistic state formulas use minimal probabilities for lower bounds and maximal
 * ones for upper bounds, so they hold under every scheduler.
 * </p>
 */
@Slf4j
public final class ValueIterationModelChecker implements ProbabilisticModelChecker {
    private final Extremum extremum;
    private final double convergenceEpsilon;
    private final int maxIterations;

    public ValueIterationModelChecker(Extremum extremum, double convergenceEpsilon, int maxIterations) {
        this.extremum = Objects.requireNonNull(extremum, "extremum");
        if (!(convergenceEpsilon > 0.0d)) {
            throw new IllegalArgumentException("convergenceEpsilon must be positive");
        }
        if (maxIterations <= 0) {
            throw new IllegalArgumentException("maxIterations must be positive");
        }
        this.convergenceEpsilon = convergenceEpsilon;
        this.maxIterations = maxIterations;
    }

    public ValueIterationModelChecker(AnalysisConfiguration configuration) {
        this(configuration.getExtremum(), configuration.getConvergenceEpsilon(), configuration.getMaxIterations());
    }

    public ValueIterationModelChecker() {
        this(AnalysisConfiguration.defaultConfiguration());
    }

    // ========================================================================
    // ENTRY POINTS
    // ========================================================================

    @Override
    public Probability calculateProbability(CompactProbabilityMatrix matrix, Formula formula) {
        FormulaKindVisitor.requireKind(formula, FormulaKind.PATH);
        Formula fromStart = formula;
        if (formula instanceof BoundedUnaryFormula) {
            // the initial step uses up one step of the bound
            BoundedUnaryFormula bounded = (BoundedUnaryFormula) formula;
            if (bounded.steps() == 0) {
                return bounded.operator() == UnaryOperator.FINALLY ? Probability.ZERO : Probability.ONE;
            }
            fromStart = new BoundedUnaryFormula(bounded.operator(), bounded.operand(), bounded.steps() - 1);
        }
        double[] values = pathValues(matrix, fromStart, extremum);
        return clamp(initialValue(matrix, values, extremum));
    }

    @Override
    public boolean calculateFormula(CompactProbabilityMatrix matrix, Formula formula) {
        FormulaKindVisitor.requireKind(formula, FormulaKind.STATE);
        BitSet satisfied = stateSet(matrix, formula);
        for (int d = matrix.firstInitialDistribution(); d < matrix.initialDistributionEnd(); d++) {
            for (int t = matrix.firstTransitionOfDistribution(d); t < matrix.transitionEndOfDistribution(d); t++) {
                if (matrix.transitionProbability(t) > 0.0d && !satisfied.get(matrix.transitionTarget(t))) {
                    return false;
                }
            }
        }
        return true;
    }

    @Override
    public RewardResult calculateReward(CompactProbabilityMatrix matrix, Formula formula) {
        FormulaKindVisitor.requireKind(formula, FormulaKind.REWARD);
        CumulativeRewardFormula reward = (CumulativeRewardFormula) formula;
        int steps = reward.steps();
        if (steps == 0) {
            return new RewardResult(0.0d, 0);
        }
        BitSet rewarded = stateSet(matrix, reward.condition());
        int n = matrix.stateCount();
        double[] current = new double[n];
        double[] next = new double[n];
        // current[s]: expected reward collected in the next i steps starting in s
        for (int i = 1; i < steps; i++) {
            for (int s = 0; s < n; s++) {
                next[s] = rewardBellman(matrix, matrix.firstDistributionOfState(s), matrix.distributionEndOfState(s),
                        current, rewarded, extremum);
            }
            double[] swap = current;
            current = next;
            next = swap;
        }
        double value = rewardBellman(matrix, matrix.firstInitialDistribution(), matrix.initialDistributionEnd(),
                current, rewarded, extremum);
        return new RewardResult(value, steps);
    }

    // ========================================================================
    // STATE FORMULAS
    // ========================================================================

    /**
     * Evaluates a state formula to the set of states satisfying it.
     */
    BitSet stateSet(CompactProbabilityMatrix matrix, Formula formula) {
        int n = matrix.stateCount();
        if (formula instanceof AtomicPropositionFormula) {
            AtomicPropositionFormula proposition = (AtomicPropositionFormula) formula;
            int index = matrix.propositionIndex(proposition.label());
            if (index < 0) {
                throw new IllegalArgumentException("proposition '" + proposition.label() + "' was not serialized with the model");
            }
            BitSet result = new BitSet(n);
            for (int s = 0; s < n; s++) {
                if (matrix.stateLabeling(s).get(index)) {
                    result.set(s);
                }
            }
            return result;
        }
        if (formula instanceof UnaryFormula && ((UnaryFormula) formula).operator() == UnaryOperator.NOT) {
            BitSet result = stateSet(matrix, ((UnaryFormula) formula).operand());
            result.flip(0, n);
            return result;
        }
        if (formula instanceof BinaryFormula && ((BinaryFormula) formula).operator() != BinaryOperator.UNTIL) {
            BinaryFormula binary = (BinaryFormula) formula;
            BitSet left = stateSet(matrix, binary.left());
            BitSet right = stateSet(matrix, binary.right());
            switch (binary.operator()) {
                case AND -> left.and(right);
                case OR -> left.or(right);
                case IMPLICATION -> {
                    left.flip(0, n);
                    left.or(right);
                }
                case EQUIVALENCE -> {
                    left.xor(right);
                    left.flip(0, n);
                }
                default -> throw new IllegalStateException("unexpected operator " + binary.operator());
            }
            return left;
        }
        if (formula instanceof ProbabilisticFormula) {
            ProbabilisticFormula probabilistic = (ProbabilisticFormula) formula;
            Extremum bound = probabilistic.comparator().isLowerBound() ? Extremum.MINIMUM : Extremum.MAXIMUM;
            double[] values = pathValues(matrix, probabilistic.pathFormula(), bound);
            BitSet result = new BitSet(n);
            for (int s = 0; s < n; s++) {
                if (probabilistic.comparator().test(values[s], probabilistic.bound())) {
                    result.set(s);
                }
            }
            return result;
        }
        throw new IllegalArgumentException("not a state formula: " + formula);
    }

    // ========================================================================
    // PATH FORMULAS
    // ========================================================================

    /**
     * Per-state probability of {@code formula} on paths starting in that state.
     */
    double[] pathValues(CompactProbabilityMatrix matrix, Formula formula, Extremum ext) {
        if (formula instanceof UnaryFormula) {
            UnaryFormula unary = (UnaryFormula) formula;
            switch (unary.operator()) {
                case NEXT -> {
                    return next(matrix, stateSet(matrix, unary.operand()), ext);
                }
                case FINALLY -> {
                    return until(matrix, all(matrix), stateSet(matrix, unary.operand()), ext);
                }
                case GLOBALLY -> {
                    BitSet violating = stateSet(matrix, unary.operand());
                    violating.flip(0, matrix.stateCount());
                    return complement(until(matrix, all(matrix), violating, ext.flip()));
                }
                default -> throw new IllegalArgumentException("not a path formula: " + formula);
            }
        }
        if (formula instanceof BinaryFormula && ((BinaryFormula) formula).operator() == BinaryOperator.UNTIL) {
            BinaryFormula binary = (BinaryFormula) formula;
            return until(matrix, stateSet(matrix, binary.left()), stateSet(matrix, binary.right()), ext);
        }
        if (formula instanceof BoundedUnaryFormula) {
            BoundedUnaryFormula bounded = (BoundedUnaryFormula) formula;
            BitSet operand = stateSet(matrix, bounded.operand());
            if (bounded.operator() == UnaryOperator.FINALLY) {
                return boundedFinally(matrix, operand, bounded.steps(), ext);
            }
            operand.flip(0, matrix.stateCount());
            return complement(boundedFinally(matrix, operand, bounded.steps(), ext.flip()));
        }
        throw new IllegalArgumentException("not a path formula: " + formula);
    }

    private double[] next(CompactProbabilityMatrix matrix, BitSet target, Extremum ext) {
        int n = matrix.stateCount();
        double[] indicator = indicator(target, n);
        double[] result = new double[n];
        for (int s = 0; s < n; s++) {
            result[s] = bellman(matrix, matrix.firstDistributionOfState(s), matrix.distributionEndOfState(s), indicator, ext);
        }
        return result;
    }

    private double[] until(CompactProbabilityMatrix matrix, BitSet stay, BitSet goal, Extremum ext) {
        int n = matrix.stateCount();
        double[] current = indicator(goal, n);
        double[] next = new double[n];
        for (int iteration = 0; iteration < maxIterations; iteration++) {
            double delta = 0.0d;
            for (int s = 0; s < n; s++) {
                if (goal.get(s)) {
                    next[s] = 1.0d;
                } else if (!stay.get(s)) {
                    next[s] = 0.0d;
                } else {
                    next[s] = bellman(matrix, matrix.firstDistributionOfState(s), matrix.distributionEndOfState(s), current, ext);
                }
                delta = Math.max(delta, Math.abs(next[s] - current[s]));
            }
            double[] swap = current;
            current = next;
            next = swap;
            if (delta <= convergenceEpsilon) {
                return current;
            }
        }
        log.warn("Value iteration stopped after {} iterations without converging to epsilon {}",
                maxIterations, convergenceEpsilon);
        return current;
    }

    private double[] boundedFinally(CompactProbabilityMatrix matrix, BitSet goal, int steps, Extremum ext) {
        int n = matrix.stateCount();
        double[] current = indicator(goal, n);
        double[] next = new double[n];
        for (int i = 0; i < steps; i++) {
            for (int s = 0; s < n; s++) {
                next[s] = goal.get(s)
                        ? 1.0d
                        : bellman(matrix, matrix.firstDistributionOfState(s), matrix.distributionEndOfState(s), current, ext);
            }
            double[] swap = current;
            current = next;
            next = swap;
        }
        return current;
    }

    // ========================================================================
    // HELPERS
    // ========================================================================

    private double bellman(CompactProbabilityMatrix matrix, int firstDistribution, int distributionEnd,
                           double[] values, Extremum ext) {
        double best = ext.identity();
        for (int d = firstDistribution; d < distributionEnd; d++) {
            double sum = 0.0d;
            for (int t = matrix.firstTransitionOfDistribution(d); t < matrix.transitionEndOfDistribution(d); t++) {
                sum += matrix.transitionProbability(t) * values[matrix.transitionTarget(t)];
            }
            best = ext.select(best, sum);
        }
        return firstDistribution == distributionEnd ? 0.0d : best;
    }

    private double rewardBellman(CompactProbabilityMatrix matrix, int firstDistribution, int distributionEnd,
                                 double[] values, BitSet rewarded, Extremum ext) {
        double best = ext.identity();
        for (int d = firstDistribution; d < distributionEnd; d++) {
            double sum = 0.0d;
            for (int t = matrix.firstTransitionOfDistribution(d); t < matrix.transitionEndOfDistribution(d); t++) {
                int target = matrix.transitionTarget(t);
                sum += matrix.transitionProbability(t) * ((rewarded.get(target) ? 1.0d : 0.0d) + values[target]);
            }
            best = ext.select(best, sum);
        }
        return firstDistribution == distributionEnd ? 0.0d : best;
    }

    private double initialValue(CompactProbabilityMatrix matrix, double[] values, Extremum ext) {
        return bellman(matrix, matrix.firstInitialDistribution(), matrix.initialDistributionEnd(), values, ext);
    }

    private static BitSet all(CompactProbabilityMatrix matrix) {
        BitSet all = new BitSet(matrix.stateCount());
        all.set(0, matrix.stateCount());
        return all;
    }

    private static double[] indicator(BitSet set, int n) {
        double[] values = new double[n];
        for (int s = set.nextSetBit(0); s >= 0 && s < n; s = set.nextSetBit(s + 1)) {
            values[s] = 1.0d;
        }
        return values;
    }

    private static double[] complement(double[] values) {
        for (int i = 0; i < values.length; i++) {
            values[i] = 1.0d - values[i];
        }
        return values;
    }

    private static Probability clamp(double value) {
        return Probability.of(Math.max(0.0d, Math.min(1.0d, value)));
    }
}
