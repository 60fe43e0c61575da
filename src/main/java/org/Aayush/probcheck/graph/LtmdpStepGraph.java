package org.Aayush.probcheck.graph;

import it.unimi.dsi.fastutil.bytes.ByteArrayList;
import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.Aayush.probcheck.model.Probability;

/**
 * Continuation graph of the state currently being explored.
 * <p>
 * Nodes live in one SoA arena and are addressed by local continuation ids; the root is
 * always cid 0. All children of one split are allocated as one contiguous cid block, so a
 * split is fully described by its child range. New nodes start out as unresolved leaves and
 * are later turned into splits, forwards, or leaves with a transition target.
 * </p>
 * <p>
 * <strong>Usage Warning:</strong> NOT thread-safe. Each exploration worker owns one step graph
 * and hands it to {@link LabeledTransitionMarkovDecisionProcess} once the state is done.
 * </p>
 */
public final class LtmdpStepGraph {
    public static final int ROOT = 0;
    static final int UNRESOLVED = -1;

    private final ByteArrayList kinds = new ByteArrayList();
    private final IntArrayList from = new IntArrayList();
    private final IntArrayList to = new IntArrayList();
    private final DoubleArrayList probabilities = new DoubleArrayList();

    public LtmdpStepGraph() {
        clear();
    }

    /**
     * Resets the graph to a single unresolved root.
     */
    public void clear() {
        kinds.clear();
        from.clear();
        to.clear();
        probabilities.clear();
        append(1.0d);
    }

    private int append(double probability) {
        kinds.add(ChoiceKind.LEAF.code());
        from.add(UNRESOLVED);
        to.add(UNRESOLVED);
        probabilities.add(probability);
        return kinds.size() - 1;
    }

    /**
     * Turns {@code cid} into a nondeterministic split over {@code valueCount} new children.
     *
     * @return cid of the first child; children occupy {@code [first, first + valueCount)}.
     */
    public int nondeterministicSplit(int cid, int valueCount) {
        requireUnresolvedLeaf(cid);
        if (valueCount <= 0) {
            throw new IllegalArgumentException("valueCount must be positive");
        }
        int first = kinds.size();
        for (int i = 0; i < valueCount; i++) {
            append(1.0d);
        }
        resolve(cid, ChoiceKind.NONDETERMINISTIC, first, first + valueCount - 1);
        return first;
    }

    /**
     * Turns {@code cid} into a probabilistic split with one child per probability.
     *
     * @return cid of the first child.
     * @throws IllegalArgumentException when the probabilities do not sum to 1.
     */
    public int probabilisticSplit(int cid, double... childProbabilities) {
        requireUnresolvedLeaf(cid);
        if (childProbabilities.length == 0) {
            throw new IllegalArgumentException("a probabilistic split needs at least one option");
        }
        double sum = 0.0d;
        for (double p : childProbabilities) {
            Probability.of(p);
            sum += p;
        }
        if (!Probability.isApproximately(1.0d, sum)) {
            throw new IllegalArgumentException("probabilities of a split must sum to 1, got " + sum);
        }
        int first = kinds.size();
        for (double p : childProbabilities) {
            append(p);
        }
        resolve(cid, ChoiceKind.PROBABILISTIC, first, first + childProbabilities.length - 1);
        return first;
    }

    /**
     * Redirects {@code cid} to the already allocated node {@code targetCid}.
     */
    public void forward(int cid, int targetCid) {
        requireUnresolvedLeaf(cid);
        requireCid(targetCid);
        if (targetCid == cid) {
            throw new IllegalArgumentException("a node cannot forward to itself: " + cid);
        }
        resolve(cid, ChoiceKind.FORWARD, targetCid, targetCid);
    }

    /**
     * Makes {@code cid} a leaf pointing at transition target {@code transitionTargetId}.
     */
    public void setLeafTarget(int cid, int transitionTargetId) {
        requireUnresolvedLeaf(cid);
        if (transitionTargetId < 0) {
            throw new IllegalArgumentException("transitionTargetId must be non-negative");
        }
        to.set(cid, transitionTargetId);
    }

    private void resolve(int cid, ChoiceKind kind, int first, int last) {
        kinds.set(cid, kind.code());
        from.set(cid, first);
        to.set(cid, last);
    }

    private void requireCid(int cid) {
        if (cid < 0 || cid >= kinds.size()) {
            throw new IndexOutOfBoundsException("cid out of bounds: " + cid);
        }
    }

    private void requireUnresolvedLeaf(int cid) {
        requireCid(cid);
        if (kinds.getByte(cid) != ChoiceKind.LEAF.code() || to.getInt(cid) != UNRESOLVED) {
            throw new IllegalStateException("cid " + cid + " has already been resolved");
        }
    }

    public int size() {
        return kinds.size();
    }

    public ChoiceKind kind(int cid) {
        requireCid(cid);
        return ChoiceKind.fromCode(kinds.getByte(cid));
    }

    public int from(int cid) {
        requireCid(cid);
        return from.getInt(cid);
    }

    public int to(int cid) {
        requireCid(cid);
        return to.getInt(cid);
    }

    public double probability(int cid) {
        requireCid(cid);
        return probabilities.getDouble(cid);
    }

    public ContinuationGraphElement element(int cid) {
        return new ContinuationGraphElement(kind(cid), from(cid), to(cid), probability(cid));
    }

    /**
     * Returns whether {@code cid} is a leaf that still lacks a transition target.
     */
    public boolean isUnresolved(int cid) {
        requireCid(cid);
        return kinds.getByte(cid) == ChoiceKind.LEAF.code() && to.getInt(cid) == UNRESOLVED;
    }
}
