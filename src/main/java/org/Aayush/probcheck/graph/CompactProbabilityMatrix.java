package org.Aayush.probcheck.graph;

import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import lombok.Getter;
import lombok.experimental.Accessors;
import lombok.extern.slf4j.Slf4j;
import org.Aayush.probcheck.core.error.OrderingException;
import org.Aayush.probcheck.model.StateFormulaSet;

import java.util.List;
import java.util.Objects;

/**
 * Flat, read-only probability matrix consumed by numeric checkers.
 * <p>
 * Layout (CSR, two levels):
 * <ul>
 *     <li>{@code firstDistribution[s] .. firstDistribution[s+1]} are the distributions of state {@code s}.
 *     Row {@code stateCount} holds the initial distributions.</li>
 *     <li>{@code firstTransition[d] .. firstTransition[d+1]} are the transitions of distribution {@code d}.</li>
 * </ul>
 * Transitions keep the order the enumerator produced them in; a target may occur more than once
 * within one distribution.
 * </p>
 */
@Slf4j
public final class CompactProbabilityMatrix {
    public static final String REASON_MODEL_NOT_SEALED = NestedMarkovDecisionProcess.REASON_MODEL_NOT_SEALED;

    @Getter
    @Accessors(fluent = true)
    private final int stateCount;
    @Getter
    @Accessors(fluent = true)
    private final List<String> stateFormulaLabels;

    private final int[] firstDistribution;
    private final int[] firstTransition;
    private final int[] transitionTarget;
    private final double[] transitionProbability;
    private final StateFormulaSet[] labelings;

    CompactProbabilityMatrix(int stateCount, List<String> stateFormulaLabels,
                             int[] firstDistribution, int[] firstTransition,
                             int[] transitionTarget, double[] transitionProbability,
                             StateFormulaSet[] labelings) {
        this.stateCount = stateCount;
        this.stateFormulaLabels = List.copyOf(stateFormulaLabels);
        this.firstDistribution = firstDistribution;
        this.firstTransition = firstTransition;
        this.transitionTarget = transitionTarget;
        this.transitionProbability = transitionProbability;
        this.labelings = labelings;
    }

    /**
     * Flattens every distribution of a sealed NMDP.
     *
     * @throws OrderingException when the NMDP is still under construction.
     */
    public static CompactProbabilityMatrix derive(NestedMarkovDecisionProcess nmdp) {
        Objects.requireNonNull(nmdp, "nmdp");
        if (!nmdp.isSealed()) {
            throw new OrderingException(REASON_MODEL_NOT_SEALED, "matrix can only be derived from a sealed model");
        }
        long started = System.nanoTime();
        int states = nmdp.stateCount();

        int[] firstDistribution = new int[states + 2];
        IntArrayList firstTransition = new IntArrayList();
        IntArrayList targets = new IntArrayList();
        DoubleArrayList probabilities = new DoubleArrayList();

        NmdpDistributionEnumerator enumerator = nmdp.distributionEnumerator();
        for (int row = 0; row <= states; row++) {
            firstDistribution[row] = firstTransition.size();
            if (row < states) {
                enumerator.selectState(row);
            } else {
                enumerator.selectInitialState();
            }
            while (enumerator.moveNextDistribution()) {
                firstTransition.add(targets.size());
                while (enumerator.moveNextTransition()) {
                    targets.add(enumerator.currentTargetState());
                    probabilities.add(enumerator.currentProbability());
                }
            }
        }
        firstDistribution[states + 1] = firstTransition.size();
        firstTransition.add(targets.size());

        StateFormulaSet[] labelings = new StateFormulaSet[states];
        for (int state = 0; state < states; state++) {
            labelings[state] = nmdp.stateLabeling(state);
        }

        CompactProbabilityMatrix matrix = new CompactProbabilityMatrix(
                states,
                nmdp.stateFormulaLabels(),
                firstDistribution,
                firstTransition.toIntArray(),
                targets.toIntArray(),
                probabilities.toDoubleArray(),
                labelings
        );
        log.info("Derived probability matrix in {} ms: {} states, {} distributions, {} transitions",
                (System.nanoTime() - started) / 1_000_000L, states, matrix.distributionCount(), matrix.transitionCount());
        return matrix;
    }

    // ========================================================================
    // SIZES
    // ========================================================================

    public int distributionCount() {
        return firstTransition.length - 1;
    }

    public int transitionCount() {
        return transitionTarget.length;
    }

    // ========================================================================
    // CSR ACCESS
    // ========================================================================

    public int firstDistributionOfState(int state) {
        requireState(state);
        return firstDistribution[state];
    }

    /**
     * Exclusive end of the distribution range of {@code state}.
     */
    public int distributionEndOfState(int state) {
        requireState(state);
        return firstDistribution[state + 1];
    }

    public int firstInitialDistribution() {
        return firstDistribution[stateCount];
    }

    public int initialDistributionEnd() {
        return firstDistribution[stateCount + 1];
    }

    public int firstTransitionOfDistribution(int distribution) {
        return firstTransition[distribution];
    }

    /**
     * Exclusive end of the transition range of {@code distribution}.
     */
    public int transitionEndOfDistribution(int distribution) {
        return firstTransition[distribution + 1];
    }

    /**
     * UNCHECKED - caller must pass a transition index from a distribution range.
     */
    public int transitionTarget(int transition) {
        return transitionTarget[transition];
    }

    public double transitionProbability(int transition) {
        return transitionProbability[transition];
    }

    // ========================================================================
    // LABELS
    // ========================================================================

    public StateFormulaSet stateLabeling(int state) {
        requireState(state);
        return labelings[state];
    }

    /**
     * Returns the index of {@code proposition} in the label table, or -1.
     */
    public int propositionIndex(String proposition) {
        return stateFormulaLabels.indexOf(proposition);
    }

    private void requireState(int state) {
        if (state < 0 || state >= stateCount) {
            throw new IndexOutOfBoundsException("state out of bounds: " + state);
        }
    }
}
