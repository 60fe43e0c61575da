package org.Aayush.probcheck.checker;

import org.Aayush.probcheck.formula.Formula;
import org.Aayush.probcheck.graph.CompactProbabilityMatrix;
import org.Aayush.probcheck.model.Probability;

/**
 * Numeric back end evaluating formulas on a built probability matrix.
 */
public interface ProbabilisticModelChecker {

    Probability calculateProbability(CompactProbabilityMatrix matrix, Formula formula);

    boolean calculateFormula(CompactProbabilityMatrix matrix, Formula formula);

    RewardResult calculateReward(CompactProbabilityMatrix matrix, Formula formula);

    /**
     * Largest state count this back end can address.
     */
    default int maxAddressableStates() {
        return Integer.MAX_VALUE;
    }
}
