package org.Aayush.probcheck.exploration;

import org.Aayush.probcheck.graph.LtmdpStepGraph;

import java.util.Objects;

/**
 * Choice resolver that records the branching structure of the current state.
 *
 * <p>Every choice first encountered on a path splits the continuation node of the path
 * prefix into a contiguous block of children: probabilistic choices carry their weights as
 * child probabilities, nondeterministic children carry probability 1. When a replay ends,
 * {@link #currentContinuationId()} names the leaf the path's transition target belongs to.
 * Forwarded choices turn their untaken siblings into forwards to the first sibling.</p>
 */
public final class LtmdpChoiceResolver extends ChoiceResolver {
    private final LtmdpStepGraph stepGraph;
    // first child cid of each choice on the stack; the chosen cid is blockStart + chosenValue
    private final ChoiceStack blockStarts = new ChoiceStack(INITIAL_CAPACITY);

    public LtmdpChoiceResolver(LtmdpStepGraph stepGraph, boolean useForwardOptimization) {
        super(useForwardOptimization);
        this.stepGraph = Objects.requireNonNull(stepGraph, "stepGraph");
    }

    @Override
    public void prepareNextState() {
        super.prepareNextState();
        stepGraph.clear();
        blockStarts.clear();
    }

    @Override
    public int handleProbabilisticChoice(double... probabilities) {
        return resolve(probabilities.length, probabilities);
    }

    @Override
    protected void onChoiceRecorded(int index, int valueCount, double[] probabilities) {
        int parent = index == 0 ? LtmdpStepGraph.ROOT : continuationIdAt(index - 1);
        int first = probabilities == null
                ? stepGraph.nondeterministicSplit(parent, valueCount)
                : stepGraph.probabilisticSplit(parent, probabilities);
        blockStarts.push(first);
    }

    @Override
    protected void onChoiceDropped(int index) {
        blockStarts.pop();
    }

    @Override
    protected void onChoiceForwarded(int index, int valueCount) {
        int first = blockStarts.get(index);
        for (int value = 1; value < valueCount; value++) {
            stepGraph.forward(first + value, first);
        }
    }

    /**
     * Path replay is not supported while recording; use {@link NondeterministicChoiceResolver}.
     */
    @Override
    public void setChoices(int... choices) {
        throw new UnsupportedOperationException("choices cannot be pre-seeded while recording a continuation graph");
    }

    @Override
    public void clear() {
        super.clear();
        blockStarts.clear();
    }

    /**
     * Returns the continuation id reached by the choices of the current path.
     */
    public int currentContinuationId() {
        int depth = chosenValues.size();
        return depth == 0 ? LtmdpStepGraph.ROOT : continuationIdAt(depth - 1);
    }

    private int continuationIdAt(int index) {
        return blockStarts.get(index) + chosenValues.get(index);
    }

    public LtmdpStepGraph stepGraph() {
        return stepGraph;
    }
}
