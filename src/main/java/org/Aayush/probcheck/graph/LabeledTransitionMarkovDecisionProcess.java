package org.Aayush.probcheck.graph;

import it.unimi.dsi.fastutil.bytes.ByteArrayList;
import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import org.Aayush.probcheck.core.error.CapacityException;
import org.Aayush.probcheck.core.error.OrderingException;
import org.Aayush.probcheck.model.StateFormulaSet;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Labeled Transition Markov Decision Process accumulated during exploration.
 * <p>
 * Pairs the continuation graphs of all explored states, stored in one global SoA arena, with
 * the table of reached transition targets. A step graph appended for a state receives one
 * contiguous global cid block; local cid {@code c} becomes {@code base + c}. Transition targets
 * are deduplicated by their {@code (labeling, storageId)} key with an atomic insert-if-absent,
 * so leaves referencing the same logical state share one target id.
 * </p>
 * <p>
 * <strong>Thread Safety:</strong> targets and step graphs may be added concurrently by
 * exploration workers. Readers must only start after exploration has finished.
 * </p>
 */
public final class LabeledTransitionMarkovDecisionProcess {
    public static final String REASON_CONTINUATION_CAPACITY_EXCEEDED = "GR_LTMDP_CAPACITY_EXCEEDED";
    public static final String REASON_STATE_ALREADY_ADDED = "GR_STATE_ALREADY_ADDED";
    public static final String REASON_INITIAL_STATE_MISSING = "GR_INITIAL_STATE_MISSING";
    public static final String REASON_STATE_MISSING = "GR_STATE_MISSING";
    public static final String REASON_UNRESOLVED_LEAF = "GR_UNRESOLVED_LEAF";

    private static final int NO_ROOT = -1;

    private final ModelCapacity capacity;
    private final List<String> stateFormulaLabels;

    // continuation graph arena (SoA); guarded by this
    private final ByteArrayList kinds = new ByteArrayList();
    private final IntArrayList from = new IntArrayList();
    private final IntArrayList to = new IntArrayList();
    private final DoubleArrayList probabilities = new DoubleArrayList();

    // storage id -> root cid / graph size; guarded by this
    private final IntArrayList rootCidOfState = new IntArrayList();
    private final IntArrayList graphSizeOfState = new IntArrayList();
    private int sourceStates;
    private int initialRootCid = NO_ROOT;
    private int initialGraphSize;

    private final ConcurrentHashMap<TransitionTarget, Integer> targetIds = new ConcurrentHashMap<>();
    // guarded by itself
    private final ObjectArrayList<TransitionTarget> targets = new ObjectArrayList<>();

    public LabeledTransitionMarkovDecisionProcess(List<String> stateFormulaLabels, ModelCapacity capacity) {
        this.stateFormulaLabels = List.copyOf(Objects.requireNonNull(stateFormulaLabels, "stateFormulaLabels"));
        this.capacity = Objects.requireNonNull(capacity, "capacity");
    }

    // ========================================================================
    // CONSTRUCTION
    // ========================================================================

    /**
     * Returns the id of the transition target {@code (labeling, targetStorageId)}, adding it
     * if it has not been seen before. The first insert wins.
     */
    public int addTransitionTarget(StateFormulaSet labeling, int targetStorageId) {
        TransitionTarget key = new TransitionTarget(labeling, targetStorageId);
        Integer existing = targetIds.get(key);
        if (existing != null) {
            return existing;
        }
        // map writes happen under the targets lock only
        synchronized (targets) {
            existing = targetIds.get(key);
            if (existing != null) {
                return existing;
            }
            targets.add(key);
            int id = targets.size() - 1;
            targetIds.put(key, id);
            return id;
        }
    }

    /**
     * Appends a transition target without deduplication.
     *
     * <p>Produces raw, possibly duplicated targets; the converter deduplicates them by key.</p>
     */
    public int appendTransitionTarget(StateFormulaSet labeling, int targetStorageId) {
        TransitionTarget key = new TransitionTarget(labeling, targetStorageId);
        synchronized (targets) {
            targets.add(key);
            int id = targets.size() - 1;
            targetIds.putIfAbsent(key, id);
            return id;
        }
    }

    /**
     * Appends the continuation graph of the initial step.
     */
    public synchronized void addInitialStepGraph(LtmdpStepGraph stepGraph) {
        if (initialRootCid != NO_ROOT) {
            throw new OrderingException(REASON_STATE_ALREADY_ADDED, "initial step graph has already been added");
        }
        initialRootCid = append(stepGraph);
        initialGraphSize = stepGraph.size();
    }

    /**
     * Appends the continuation graph of the state stored under {@code storageId}.
     */
    public synchronized void addStateStepGraph(int storageId, LtmdpStepGraph stepGraph) {
        if (storageId < 0) {
            throw new IllegalArgumentException("storageId must be non-negative");
        }
        while (rootCidOfState.size() <= storageId) {
            rootCidOfState.add(NO_ROOT);
            graphSizeOfState.add(0);
        }
        if (rootCidOfState.getInt(storageId) != NO_ROOT) {
            throw new OrderingException(REASON_STATE_ALREADY_ADDED, "state " + storageId + " has already been added");
        }
        rootCidOfState.set(storageId, append(stepGraph));
        graphSizeOfState.set(storageId, stepGraph.size());
        sourceStates++;
    }

    private int append(LtmdpStepGraph stepGraph) {
        int size = stepGraph.size();
        int base = kinds.size();
        if ((long) base + size > capacity.getMaxContinuationGraphSize()) {
            throw new CapacityException(
                    REASON_CONTINUATION_CAPACITY_EXCEEDED,
                    "continuation graph capacity of " + capacity.getMaxContinuationGraphSize() + " nodes exceeded"
            );
        }
        for (int cid = 0; cid < size; cid++) {
            if (stepGraph.isUnresolved(cid)) {
                throw new OrderingException(REASON_UNRESOLVED_LEAF, "leaf " + cid + " has no transition target");
            }
        }
        for (int cid = 0; cid < size; cid++) {
            ChoiceKind kind = stepGraph.kind(cid);
            kinds.add(kind.code());
            probabilities.add(stepGraph.probability(cid));
            switch (kind) {
                case LEAF -> {
                    from.add(LtmdpStepGraph.UNRESOLVED);
                    to.add(stepGraph.to(cid));
                }
                case FORWARD, PROBABILISTIC, NONDETERMINISTIC -> {
                    from.add(base + stepGraph.from(cid));
                    to.add(base + stepGraph.to(cid));
                }
            }
        }
        return base;
    }

    // ========================================================================
    // READ ACCESS
    // ========================================================================

    public ChoiceKind kind(int cid) {
        return ChoiceKind.fromCode(kinds.getByte(cid));
    }

    public int from(int cid) {
        return from.getInt(cid);
    }

    public int to(int cid) {
        return to.getInt(cid);
    }

    public double probability(int cid) {
        return probabilities.getDouble(cid);
    }

    public ContinuationGraphElement element(int cid) {
        return new ContinuationGraphElement(kind(cid), from(cid), to(cid), probability(cid));
    }

    public TransitionTarget transitionTarget(int targetId) {
        synchronized (targets) {
            return targets.get(targetId);
        }
    }

    public int transitionTargetCount() {
        synchronized (targets) {
            return targets.size();
        }
    }

    public synchronized int continuationGraphSize() {
        return kinds.size();
    }

    public synchronized int sourceStateCount() {
        return sourceStates;
    }

    /**
     * Returns whether a step graph was recorded for {@code storageId}.
     */
    public synchronized boolean hasState(int storageId) {
        return storageId >= 0 && storageId < rootCidOfState.size() && rootCidOfState.getInt(storageId) != NO_ROOT;
    }

    /**
     * @throws OrderingException when no step graph was recorded for the state.
     */
    public synchronized int rootContinuationIdOfState(int storageId) {
        if (!hasState(storageId)) {
            throw new OrderingException(REASON_STATE_MISSING, "no continuation graph recorded for state " + storageId);
        }
        return rootCidOfState.getInt(storageId);
    }

    public synchronized int graphSizeOfState(int storageId) {
        rootContinuationIdOfState(storageId);
        return graphSizeOfState.getInt(storageId);
    }

    public synchronized boolean hasInitialState() {
        return initialRootCid != NO_ROOT;
    }

    /**
     * @throws OrderingException when the initial step has not been explored yet.
     */
    public synchronized int rootContinuationIdOfInitialState() {
        if (initialRootCid == NO_ROOT) {
            throw new OrderingException(REASON_INITIAL_STATE_MISSING, "initial step has not been explored");
        }
        return initialRootCid;
    }

    public synchronized int initialGraphSize() {
        rootContinuationIdOfInitialState();
        return initialGraphSize;
    }

    public List<String> stateFormulaLabels() {
        return stateFormulaLabels;
    }
}
