package org.Aayush.probcheck.graph;

import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.Aayush.probcheck.exploration.NondeterministicChoiceResolver;

import java.util.Objects;

/**
 * Restartable cursor over the distributions and transitions of one NMDP state.
 * <p>
 * Nested nondeterminism is flattened: every nondeterministic node reached in a depth-first
 * walk of the state's continuation graph is one decision of a scheduler, and each combination
 * of decisions yields one distribution. Combinations are enumerated in odometer order by a
 * {@link NondeterministicChoiceResolver}. Transition probabilities are products of the local
 * probabilities along the path; a forward node contributes its own probability in place of
 * its target's.
 * </p>
 * <pre>{@code
 * enumerator.selectState(s);
 * while (enumerator.moveNextDistribution()) {
 *     while (enumerator.moveNextTransition()) {
 *         use(enumerator.currentTargetState(), enumerator.currentProbability());
 *     }
 * }
 * }</pre>
 * <p>
 * <strong>Usage Warning:</strong> NOT thread-safe; create one enumerator per thread.
 * </p>
 */
public final class NmdpDistributionEnumerator {
    private static final int NO_STATE = -1;

    private final NestedMarkovDecisionProcess nmdp;
    private final NondeterministicChoiceResolver resolver = new NondeterministicChoiceResolver(false);

    // depth-first work stack: location + probability accumulated up to and including it
    private final IntArrayList pendingLocations = new IntArrayList();
    private final DoubleArrayList pendingProbabilities = new DoubleArrayList();

    // transitions of the current distribution
    private final IntArrayList targets = new IntArrayList();
    private final DoubleArrayList transitionProbabilities = new DoubleArrayList();

    private int rootLocation = NO_STATE;
    private int distributionIndex = -1;
    private int transitionIndex = -1;
    private boolean exhausted = true;

    NmdpDistributionEnumerator(NestedMarkovDecisionProcess nmdp) {
        this.nmdp = Objects.requireNonNull(nmdp, "nmdp");
    }

    /**
     * Restarts the enumeration at {@code state}.
     */
    public void selectState(int state) {
        restart(nmdp.rootLocationOfState(state));
    }

    /**
     * Restarts the enumeration at the initial distributions.
     */
    public void selectInitialState() {
        int root = nmdp.rootLocationOfInitialState();
        if (root < 0) {
            throw new IllegalStateException("initial state root has not been set");
        }
        restart(root);
    }

    private void restart(int root) {
        rootLocation = root;
        resolver.clear();
        resolver.prepareNextState();
        distributionIndex = -1;
        transitionIndex = -1;
        targets.clear();
        transitionProbabilities.clear();
        exhausted = false;
    }

    /**
     * Advances to the next distribution of the selected state.
     *
     * @return {@code false} when all distributions have been enumerated.
     */
    public boolean moveNextDistribution() {
        if (exhausted || !resolver.prepareNextPath()) {
            exhausted = true;
            targets.clear();
            transitionProbabilities.clear();
            transitionIndex = -1;
            return false;
        }
        collectTransitions();
        distributionIndex++;
        transitionIndex = -1;
        return true;
    }

    private void collectTransitions() {
        targets.clear();
        transitionProbabilities.clear();
        pendingLocations.clear();
        pendingProbabilities.clear();
        pendingLocations.add(rootLocation);
        pendingProbabilities.add(1.0d);

        while (!pendingLocations.isEmpty()) {
            int location = pendingLocations.popInt();
            double probability = pendingProbabilities.popDouble();
            switch (nmdp.kind(location)) {
                case LEAF -> {
                    targets.add(nmdp.to(location));
                    transitionProbabilities.add(probability);
                }
                case FORWARD -> {
                    pendingLocations.add(nmdp.to(location));
                    pendingProbabilities.add(probability);
                }
                case NONDETERMINISTIC -> {
                    int first = nmdp.from(location);
                    int chosen = first + resolver.handleChoice(nmdp.to(location) - first + 1);
                    pendingLocations.add(chosen);
                    pendingProbabilities.add(probability * nmdp.probability(chosen));
                }
                case PROBABILISTIC -> {
                    // reverse push keeps children in ascending order
                    for (int child = nmdp.to(location); child >= nmdp.from(location); child--) {
                        pendingLocations.add(child);
                        pendingProbabilities.add(probability * nmdp.probability(child));
                    }
                }
            }
        }
    }

    /**
     * Advances to the next transition of the current distribution.
     */
    public boolean moveNextTransition() {
        if (transitionIndex + 1 >= targets.size()) {
            transitionIndex = targets.size();
            return false;
        }
        transitionIndex++;
        return true;
    }

    public int currentTargetState() {
        requireTransition();
        return targets.getInt(transitionIndex);
    }

    public double currentProbability() {
        requireTransition();
        return transitionProbabilities.getDouble(transitionIndex);
    }

    /**
     * Returns the 0-based index of the current distribution of the selected state.
     */
    public int currentDistributionIndex() {
        return distributionIndex;
    }

    /**
     * Returns the number of transitions of the current distribution.
     */
    public int currentDistributionSize() {
        return targets.size();
    }

    private void requireTransition() {
        if (transitionIndex < 0 || transitionIndex >= targets.size()) {
            throw new IllegalStateException("no current transition; call moveNextTransition first");
        }
    }
}
