package org.Aayush.probcheck.graph;

import org.Aayush.probcheck.core.error.OrderingException;
import org.Aayush.probcheck.exploration.StateSpaceExplorer;
import org.Aayush.probcheck.formula.Formulas;
import org.Aayush.probcheck.model.AnalysisModel;
import org.Aayush.probcheck.testutil.CoinFlipModel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CompactProbabilityMatrixTest {

    @Test
    @DisplayName("CSR layout: initial distribution row follows the state rows")
    void testDeriveCoinFlip() {
        StateSpaceExplorer<String> explorer = new StateSpaceExplorer<>(
                AnalysisModel.serialize(new CoinFlipModel(), List.of(Formulas.eventually(Formulas.proposition("a")))),
                1, true, ModelCapacity.defaultCapacity());
        explorer.explore();
        CompactProbabilityMatrix matrix = CompactProbabilityMatrix.derive(new LtmdpToNmdpConverter(explorer.ltmdp()).convert());

        assertEquals(2, matrix.stateCount());
        assertEquals(3, matrix.distributionCount());
        assertEquals(4, matrix.transitionCount());
        assertEquals(List.of("a"), matrix.stateFormulaLabels());
        assertEquals(0, matrix.propositionIndex("a"));
        assertEquals(-1, matrix.propositionIndex("b"));
        assertTrue(matrix.stateLabeling(0).get(0));
        assertFalse(matrix.stateLabeling(1).get(0));

        for (int state = 0; state < 2; state++) {
            int distribution = matrix.firstDistributionOfState(state);
            assertEquals(distribution + 1, matrix.distributionEndOfState(state));
            int transition = matrix.firstTransitionOfDistribution(distribution);
            assertEquals(transition + 1, matrix.transitionEndOfDistribution(distribution));
            assertEquals(state, matrix.transitionTarget(transition));
            assertEquals(1.0d, matrix.transitionProbability(transition));
        }

        int initial = matrix.firstInitialDistribution();
        assertEquals(initial + 1, matrix.initialDistributionEnd());
        int first = matrix.firstTransitionOfDistribution(initial);
        assertEquals(0, matrix.transitionTarget(first));
        assertEquals(0.6d, matrix.transitionProbability(first), 1e-12);
        assertEquals(1, matrix.transitionTarget(first + 1));
        assertEquals(0.4d, matrix.transitionProbability(first + 1), 1e-12);
        assertThrows(IndexOutOfBoundsException.class, () -> matrix.firstDistributionOfState(2));
    }

    @Test
    @DisplayName("Deriving from an unsealed model is an ordering fault")
    void testUnsealedModelRejected() {
        NestedMarkovDecisionProcess nmdp = new NestedMarkovDecisionProcess(new ModelCapacity(1, 4), 1, List.of());
        OrderingException ex = assertThrows(OrderingException.class, () -> CompactProbabilityMatrix.derive(nmdp));
        assertEquals(NestedMarkovDecisionProcess.REASON_MODEL_NOT_SEALED, ex.reasonCode());
    }
}
