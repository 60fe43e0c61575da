package org.Aayush.probcheck.graph;

import lombok.Getter;
import lombok.experimental.Accessors;
import org.Aayush.probcheck.core.error.CapacityException;
import org.Aayush.probcheck.core.error.OrderingException;
import org.Aayush.probcheck.model.Probability;
import org.Aayush.probcheck.model.StateFormulaSet;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Nested Markov Decision Process: the deduplicated, canonical result graph.
 * <p>
 * Fixed-capacity SoA arena sized from a {@link ModelCapacity} estimate. Each state owns a
 * root continuation-graph location and a labeling. The arena is append-only while the model
 * is being constructed and read-only once {@link #seal()} was called.
 * </p>
 * <p>
 * Leaf nodes store the target state in {@code to}; forward nodes store the redirect location
 * in both {@code from} and {@code to}; inner nodes span their child range.
 * </p>
 * <p>
 * <strong>Thread Safety:</strong> construction is single-threaded; a sealed model is safe
 * for concurrent reads.
 * </p>
 */
public final class NestedMarkovDecisionProcess {
    public static final String REASON_CAPACITY_EXCEEDED = "GR_NMDP_CAPACITY_EXCEEDED";
    public static final String REASON_MODEL_SEALED = "GR_MODEL_SEALED";
    public static final String REASON_MODEL_NOT_SEALED = "GR_MODEL_NOT_SEALED";

    private static final int NO_LOCATION = -1;

    @Getter
    @Accessors(fluent = true)
    private final int stateCount;
    @Getter
    @Accessors(fluent = true)
    private final List<String> stateFormulaLabels;
    private final ModelCapacity capacity;

    private final int[] rootLocations;
    private final StateFormulaSet[] labelings;

    private final byte[] kinds;
    private final int[] from;
    private final int[] to;
    private final double[] probabilities;
    private int size;
    private int initialRootLocation = NO_LOCATION;
    private volatile boolean sealed;

    public NestedMarkovDecisionProcess(ModelCapacity capacity, int stateCount, List<String> stateFormulaLabels) {
        this.capacity = Objects.requireNonNull(capacity, "capacity");
        this.stateFormulaLabels = List.copyOf(Objects.requireNonNull(stateFormulaLabels, "stateFormulaLabels"));
        if (stateCount < 0 || stateCount > capacity.getMaxStates()) {
            throw new CapacityException(
                    REASON_CAPACITY_EXCEEDED,
                    "state count " + stateCount + " exceeds capacity of " + capacity.getMaxStates()
            );
        }
        this.stateCount = stateCount;
        this.rootLocations = new int[stateCount];
        Arrays.fill(rootLocations, NO_LOCATION);
        this.labelings = new StateFormulaSet[stateCount];
        Arrays.fill(labelings, StateFormulaSet.EMPTY);

        int arenaSize = capacity.getMaxContinuationGraphSize();
        this.kinds = new byte[arenaSize];
        this.from = new int[arenaSize];
        this.to = new int[arenaSize];
        this.probabilities = new double[arenaSize];
    }

    // ========================================================================
    // CONSTRUCTION (append-only)
    // ========================================================================

    /**
     * Reserves {@code count} contiguous locations.
     *
     * @return the first reserved location.
     * @throws CapacityException when the arena is full.
     */
    public int reservePlaces(int count) {
        requireMutable();
        if (count <= 0) {
            throw new IllegalArgumentException("count must be positive");
        }
        if ((long) size + count > kinds.length) {
            throw new CapacityException(
                    REASON_CAPACITY_EXCEEDED,
                    "continuation graph capacity of " + kinds.length + " locations exceeded"
            );
        }
        int first = size;
        size += count;
        return first;
    }

    public void addLeaf(int location, int targetState, double probability) {
        requireReserved(location);
        requireState(targetState);
        kinds[location] = ChoiceKind.LEAF.code();
        from[location] = NO_LOCATION;
        to[location] = targetState;
        probabilities[location] = probability;
    }

    public void addInnerNode(int location, ChoiceKind kind, int firstChild, int lastChild, double probability) {
        requireReserved(location);
        Objects.requireNonNull(kind, "kind");
        if (kind == ChoiceKind.LEAF) {
            throw new IllegalArgumentException("leaves are added with addLeaf");
        }
        requireReserved(firstChild);
        requireReserved(lastChild);
        if (lastChild < firstChild || (kind == ChoiceKind.FORWARD && firstChild != lastChild)) {
            throw new IllegalArgumentException("invalid child range [" + firstChild + ", " + lastChild + "] for " + kind);
        }
        kinds[location] = kind.code();
        from[location] = firstChild;
        to[location] = lastChild;
        probabilities[location] = probability;
    }

    public void setRootLocationOfState(int state, int location) {
        requireState(state);
        requireReserved(location);
        rootLocations[state] = location;
    }

    public void setRootLocationOfInitialState(int location) {
        requireReserved(location);
        initialRootLocation = location;
    }

    public void setStateLabeling(int state, StateFormulaSet labeling) {
        requireMutable();
        requireState(state);
        labelings[state] = Objects.requireNonNull(labeling, "labeling");
    }

    /**
     * Ends construction; all later writes fail with an ordering fault.
     */
    public void seal() {
        if (initialRootLocation == NO_LOCATION) {
            throw new OrderingException(REASON_MODEL_NOT_SEALED, "initial state root has not been set");
        }
        for (int state = 0; state < stateCount; state++) {
            if (rootLocations[state] == NO_LOCATION) {
                throw new OrderingException(REASON_MODEL_NOT_SEALED, "state " + state + " has no root location");
            }
        }
        sealed = true;
    }

    private void requireMutable() {
        if (sealed) {
            throw new OrderingException(REASON_MODEL_SEALED, "model is read-only after construction");
        }
    }

    private void requireReserved(int location) {
        requireMutable();
        if (location < 0 || location >= size) {
            throw new IndexOutOfBoundsException("location " + location + " has not been reserved");
        }
    }

    private void requireState(int state) {
        if (state < 0 || state >= stateCount) {
            throw new IndexOutOfBoundsException("state out of bounds: " + state);
        }
    }

    // ========================================================================
    // READ ACCESS
    // ========================================================================

    public boolean isSealed() {
        return sealed;
    }

    public int continuationGraphSize() {
        return size;
    }

    public ModelCapacity capacity() {
        return capacity;
    }

    public int rootLocationOfState(int state) {
        requireState(state);
        return rootLocations[state];
    }

    public int rootLocationOfInitialState() {
        return initialRootLocation;
    }

    public StateFormulaSet stateLabeling(int state) {
        requireState(state);
        return labelings[state];
    }

    public ChoiceKind kind(int location) {
        return ChoiceKind.fromCode(kinds[location]);
    }

    public int from(int location) {
        return from[location];
    }

    public int to(int location) {
        return to[location];
    }

    public double probability(int location) {
        return probabilities[location];
    }

    public ContinuationGraphElement element(int location) {
        if (location < 0 || location >= size) {
            throw new IndexOutOfBoundsException("location out of bounds: " + location);
        }
        return new ContinuationGraphElement(kind(location), from(location), to(location), probability(location));
    }

    /**
     * Checks that the children of every probabilistic node sum to 1.
     *
     * @throws IllegalStateException naming the first offending location.
     */
    public void validateProbabilities() {
        for (int location = 0; location < size; location++) {
            if (kinds[location] != ChoiceKind.PROBABILISTIC.code()) {
                continue;
            }
            double sum = 0.0d;
            for (int child = from[location]; child <= to[location]; child++) {
                sum += probabilities[child];
            }
            if (!Probability.isApproximately(1.0d, sum)) {
                throw new IllegalStateException(
                        "children of probabilistic location " + location + " sum to " + sum
                );
            }
        }
    }

    /**
     * Creates a restartable enumerator over distributions and transitions.
     */
    public NmdpDistributionEnumerator distributionEnumerator() {
        return new NmdpDistributionEnumerator(this);
    }
}
