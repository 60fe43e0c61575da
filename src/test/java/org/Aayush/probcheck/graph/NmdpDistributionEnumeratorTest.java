package org.Aayush.probcheck.graph;

import org.Aayush.probcheck.exploration.StateSpaceExplorer;
import org.Aayush.probcheck.model.AnalysisModel;
import org.Aayush.probcheck.testutil.CounterModel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

class NmdpDistributionEnumeratorTest {

    /**
     * State 0: probabilistic 0.5/0.5 between a nondeterministic choice {leaf to 0, leaf to 1}
     * and a leaf to 1. State 1: absorbing.
     */
    private static NestedMarkovDecisionProcess nestedNondeterminism() {
        NestedMarkovDecisionProcess nmdp = new NestedMarkovDecisionProcess(new ModelCapacity(2, 16), 2, List.of());
        int root = nmdp.reservePlaces(1);
        int halves = nmdp.reservePlaces(2);
        nmdp.addInnerNode(root, ChoiceKind.PROBABILISTIC, halves, halves + 1, 1.0d);
        int options = nmdp.reservePlaces(2);
        nmdp.addInnerNode(halves, ChoiceKind.NONDETERMINISTIC, options, options + 1, 0.5d);
        nmdp.addLeaf(options, 0, 1.0d);
        nmdp.addLeaf(options + 1, 1, 1.0d);
        nmdp.addLeaf(halves + 1, 1, 0.5d);
        nmdp.setRootLocationOfState(0, root);

        int absorbing = nmdp.reservePlaces(1);
        nmdp.addLeaf(absorbing, 1, 1.0d);
        nmdp.setRootLocationOfState(1, absorbing);

        int initial = nmdp.reservePlaces(1);
        nmdp.addLeaf(initial, 0, 1.0d);
        nmdp.setRootLocationOfInitialState(initial);
        nmdp.seal();
        return nmdp;
    }

    private static List<String> distributions(NmdpDistributionEnumerator enumerator) {
        List<String> result = new ArrayList<>();
        while (enumerator.moveNextDistribution()) {
            StringBuilder sb = new StringBuilder();
            while (enumerator.moveNextTransition()) {
                sb.append(enumerator.currentTargetState()).append(':').append(enumerator.currentProbability()).append(' ');
            }
            result.add(sb.toString().trim());
        }
        return result;
    }

    @Test
    @DisplayName("Nested nondeterminism is flattened into one distribution per decision")
    void testNestedNondeterminismFlattened() {
        NmdpDistributionEnumerator enumerator = nestedNondeterminism().distributionEnumerator();

        enumerator.selectState(0);
        assertEquals(List.of("0:0.5 1:0.5", "1:0.5 1:0.5"), distributions(enumerator));

        enumerator.selectState(1);
        assertEquals(List.of("1:1.0"), distributions(enumerator));

        enumerator.selectInitialState();
        assertEquals(List.of("0:1.0"), distributions(enumerator));
    }

    @Test
    @DisplayName("Enumeration is restartable and cursor misuse is rejected")
    void testRestartAndCursorState() {
        NmdpDistributionEnumerator enumerator = nestedNondeterminism().distributionEnumerator();
        enumerator.selectState(0);
        assertThrows(IllegalStateException.class, enumerator::currentTargetState);

        assertTrue(enumerator.moveNextDistribution());
        assertEquals(0, enumerator.currentDistributionIndex());
        assertEquals(2, enumerator.currentDistributionSize());

        enumerator.selectState(0);
        assertEquals(2, distributions(enumerator).size());
        assertFalse(enumerator.moveNextDistribution());
    }

    @Test
    @DisplayName("Round-trip: enumerated relation equals the relation the model was built from")
    void testRoundTripCounterModel() {
        int max = 4;
        StateSpaceExplorer<Integer> explorer = new StateSpaceExplorer<>(
                AnalysisModel.serialize(new CounterModel(max), List.of()), 2, true, ModelCapacity.defaultCapacity());
        explorer.explore();
        LtmdpToNmdpConverter converter = new LtmdpToNmdpConverter(explorer.ltmdp());
        NestedMarkovDecisionProcess nmdp = converter.convert();

        List<String> actual = new ArrayList<>();
        NmdpDistributionEnumerator enumerator = nmdp.distributionEnumerator();
        for (int state = 0; state < nmdp.stateCount(); state++) {
            int value = explorer.stateStorage().get(converter.transitionTargetOfState(state).targetStorageId());
            enumerator.selectState(state);
            while (enumerator.moveNextDistribution()) {
                double sum = 0.0d;
                List<String> transitions = new ArrayList<>();
                while (enumerator.moveNextTransition()) {
                    int target = explorer.stateStorage().get(
                            converter.transitionTargetOfState(enumerator.currentTargetState()).targetStorageId());
                    transitions.add(edge(value, target, enumerator.currentProbability()));
                    sum += enumerator.currentProbability();
                }
                assertEquals(1.0d, sum, 1e-9);
                Collections.sort(transitions);
                actual.add(String.join(",", transitions));
            }
        }

        List<String> expected = new ArrayList<>();
        for (int value = 0; value < max; value++) {
            expected.add(edge(value, value, 1.0d));
            List<String> attempt = new ArrayList<>(List.of(edge(value, value + 1, 0.9d), edge(value, 0, 0.1d)));
            Collections.sort(attempt);
            expected.add(String.join(",", attempt));
        }
        expected.add(edge(max, max, 1.0d));

        Collections.sort(actual);
        Collections.sort(expected);
        assertEquals(expected, actual);
    }

    private static String edge(int from, int to, double probability) {
        return String.format(Locale.ROOT, "%d->%d@%.6f", from, to, probability);
    }
}
