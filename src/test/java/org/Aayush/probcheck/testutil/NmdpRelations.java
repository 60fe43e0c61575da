package org.Aayush.probcheck.testutil;

import org.Aayush.probcheck.graph.LtmdpToNmdpConverter;
import org.Aayush.probcheck.graph.NestedMarkovDecisionProcess;
import org.Aayush.probcheck.graph.NmdpDistributionEnumerator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Renders the transition relation of a converted NMDP in terms of source storage ids, so that
 * models differing only in state numbering compare equal.
 */
public final class NmdpRelations {

    private NmdpRelations() {
    }

    public static List<String> byStorageId(LtmdpToNmdpConverter converter, NestedMarkovDecisionProcess nmdp) {
        List<String> relation = new ArrayList<>();
        NmdpDistributionEnumerator enumerator = nmdp.distributionEnumerator();
        for (int state = 0; state < nmdp.stateCount(); state++) {
            String source = converter.transitionTargetOfState(state).targetStorageId()
                    + "/" + nmdp.stateLabeling(state);
            enumerator.selectState(state);
            while (enumerator.moveNextDistribution()) {
                List<String> transitions = new ArrayList<>();
                while (enumerator.moveNextTransition()) {
                    transitions.add(converter.transitionTargetOfState(enumerator.currentTargetState()).targetStorageId()
                            + ":" + String.format(Locale.ROOT, "%.6f", enumerator.currentProbability()));
                }
                Collections.sort(transitions);
                relation.add(source + " -> " + transitions);
            }
        }
        Collections.sort(relation);
        return relation;
    }
}
