package org.Aayush.probcheck.graph;

import it.unimi.dsi.fastutil.booleans.BooleanArrayList;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import lombok.extern.slf4j.Slf4j;
import org.Aayush.probcheck.core.error.CapacityException;
import org.Aayush.probcheck.core.error.OrderingException;

import java.util.Objects;

/**
 * Rewrites an LTMDP into a self-contained, deduplicated {@link NestedMarkovDecisionProcess}.
 * <p>
 * Result states are exactly the distinct transition-target keys, numbered densely in first-seen
 * order. Each state's continuation graph is rebuilt in the result arena by a depth-first walk
 * with an explicit work stack. Forward nodes are never expanded again: their target location is
 * looked up in a per-state cid buffer, which keeps the conversion linear in the number of LTMDP
 * nodes instead of the number of paths. Forwards may only target nodes of the same state that
 * were visited before them.
 * </p>
 * <p>
 * The source LTMDP is consumed once and released after {@link #convert()}.
 * <strong>Usage Warning:</strong> NOT thread-safe.
 * </p>
 */
@Slf4j
public final class LtmdpToNmdpConverter {
    public static final String REASON_ALREADY_CONVERTED = "GR_ALREADY_CONVERTED";
    public static final String REASON_NOT_CONVERTED = "GR_NOT_CONVERTED";
    public static final String REASON_FORWARD_TARGET_NOT_BUFFERED = "GR_FORWARD_TARGET_NOT_BUFFERED";
    public static final String REASON_BUFFER_POSITION_OVERFLOW = "GR_BUFFER_POSITION_OVERFLOW";
    public static final String REASON_UNKNOWN_TRANSITION_TARGET = "GR_UNKNOWN_TRANSITION_TARGET";

    private static final int NOT_BUFFERED = -1;

    private LabeledTransitionMarkovDecisionProcess ltmdp;
    private final ModelCapacity limits;
    private final long maxBufferPosition;

    private final Object2IntOpenHashMap<TransitionTarget> stateOfTarget = new Object2IntOpenHashMap<>();
    private final ObjectArrayList<TransitionTarget> targetOfState = new ObjectArrayList<>();

    // ltmdp cid -> nmdp location for the state being converted; position = cid - offset
    private final IntArrayList cidBuffer = new IntArrayList();
    // set once the whole subgraph below a buffered cid has been rebuilt
    private final BooleanArrayList cidCompleted = new BooleanArrayList();
    private long cidBufferOffset;

    private final IntArrayList pendingCids = new IntArrayList();
    private final IntArrayList pendingLocations = new IntArrayList();

    // result locations written per state
    private final IntArrayList convertedNodeCounts = new IntArrayList();
    private int convertedInitialNodeCount;

    private NestedMarkovDecisionProcess nmdp;

    public LtmdpToNmdpConverter(LabeledTransitionMarkovDecisionProcess ltmdp) {
        this(ltmdp, ModelCapacity.defaultCapacity(), ModelCapacity.MAX_ARENA_SIZE);
    }

    /**
     * @param ltmdp source process; consumed by {@link #convert()}.
     * @param limits upper bounds the result model must fit.
     * @param maxBufferPosition largest cid-buffer position addressable per state.
     */
    public LtmdpToNmdpConverter(LabeledTransitionMarkovDecisionProcess ltmdp, ModelCapacity limits, long maxBufferPosition) {
        this.ltmdp = Objects.requireNonNull(ltmdp, "ltmdp");
        this.limits = Objects.requireNonNull(limits, "limits");
        if (maxBufferPosition <= 0) {
            throw new IllegalArgumentException("maxBufferPosition must be positive");
        }
        this.maxBufferPosition = maxBufferPosition;
        this.stateOfTarget.defaultReturnValue(-1);
    }

    /**
     * Performs the conversion.
     *
     * @return the sealed result model.
     * @throws OrderingException when the LTMDP has not been explored or was already converted.
     * @throws CapacityException when the result exceeds the configured limits.
     */
    public NestedMarkovDecisionProcess convert() {
        if (ltmdp == null) {
            throw new OrderingException(REASON_ALREADY_CONVERTED, "the source LTMDP has already been converted");
        }
        long started = System.nanoTime();
        log.info("Converting LTMDP to NMDP: {} source states, {} transition targets, continuation graph size {}",
                ltmdp.sourceStateCount(), ltmdp.transitionTargetCount(), ltmdp.continuationGraphSize());

        int rootCidOfInitialState = ltmdp.rootContinuationIdOfInitialState();
        createStates();
        log.info("NMDP will have {} states", targetOfState.size());

        nmdp = new NestedMarkovDecisionProcess(estimateCapacity(), targetOfState.size(), ltmdp.stateFormulaLabels());
        for (int state = 0; state < targetOfState.size(); state++) {
            nmdp.setStateLabeling(state, targetOfState.get(state).labeling());
        }

        int before = nmdp.continuationGraphSize();
        nmdp.setRootLocationOfInitialState(convertContinuationGraph(rootCidOfInitialState));
        convertedInitialNodeCount = nmdp.continuationGraphSize() - before;
        for (int state = 0; state < targetOfState.size(); state++) {
            int rootCid = ltmdp.rootContinuationIdOfState(targetOfState.get(state).targetStorageId());
            before = nmdp.continuationGraphSize();
            nmdp.setRootLocationOfState(state, convertContinuationGraph(rootCid));
            convertedNodeCounts.add(nmdp.continuationGraphSize() - before);
        }
        nmdp.seal();
        nmdp.validateProbabilities();

        ltmdp = null;
        cidBuffer.clear();
        cidBuffer.trim();
        cidCompleted.clear();
        cidCompleted.trim();
        log.info("Completed transformation in {} ms: NMDP states {}, continuation graph size {}",
                (System.nanoTime() - started) / 1_000_000L, nmdp.stateCount(), nmdp.continuationGraphSize());
        return nmdp;
    }

    public NestedMarkovDecisionProcess result() {
        if (nmdp == null) {
            throw new OrderingException(REASON_NOT_CONVERTED, "convert() has not been called");
        }
        return nmdp;
    }

    /**
     * Returns the transition target the result state {@code state} was created for.
     */
    public TransitionTarget transitionTargetOfState(int state) {
        return targetOfState.get(state);
    }

    public int stateCount() {
        return targetOfState.size();
    }

    /**
     * Returns how many result locations were written for {@code state}.
     */
    public int convertedNodeCountOfState(int state) {
        result();
        return convertedNodeCounts.getInt(state);
    }

    public int convertedNodeCountOfInitialState() {
        result();
        return convertedInitialNodeCount;
    }

    private void createStates() {
        int targets = ltmdp.transitionTargetCount();
        for (int targetId = 0; targetId < targets; targetId++) {
            TransitionTarget target = ltmdp.transitionTarget(targetId);
            if (!stateOfTarget.containsKey(target)) {
                if (targetOfState.size() >= limits.getMaxStates()) {
                    throw new CapacityException(
                            NestedMarkovDecisionProcess.REASON_CAPACITY_EXCEEDED,
                            "NMDP state capacity of " + limits.getMaxStates() + " exceeded"
                    );
                }
                stateOfTarget.put(target, targetOfState.size());
                targetOfState.add(target);
            }
        }
    }

    /**
     * Every state converts the full step graph recorded for its storage id, so the exact
     * result size is the sum of those graph sizes plus the initial graph.
     */
    private ModelCapacity estimateCapacity() {
        long size = ltmdp.initialGraphSize();
        for (TransitionTarget target : targetOfState) {
            size += ltmdp.graphSizeOfState(target.targetStorageId());
        }
        if (size > limits.getMaxContinuationGraphSize()) {
            throw new CapacityException(
                    NestedMarkovDecisionProcess.REASON_CAPACITY_EXCEEDED,
                    "NMDP continuation graph of " + size + " locations exceeds capacity of "
                            + limits.getMaxContinuationGraphSize()
            );
        }
        return ModelCapacity.byExactSize(targetOfState.size(), size);
    }

    /**
     * Rebuilds the continuation graph rooted at {@code rootCid} and returns its new root location.
     */
    private int convertContinuationGraph(int rootCid) {
        clearCidBuffer(rootCid);
        int rootLocation = nmdp.reservePlaces(1);

        pendingCids.clear();
        pendingLocations.clear();
        pendingCids.add(rootCid);
        pendingLocations.add(rootLocation);

        while (!pendingCids.isEmpty()) {
            int cid = pendingCids.popInt();
            int location = pendingLocations.popInt();
            if (cid < 0) {
                // all children of -cid - 1 have been rebuilt
                markCompleted(-cid - 1);
                continue;
            }
            bufferCidMapping(cid, location);

            ChoiceKind kind = ltmdp.kind(cid);
            double probability = ltmdp.probability(cid);
            switch (kind) {
                case LEAF -> {
                    nmdp.addLeaf(location, stateOf(ltmdp.to(cid)), probability);
                    markCompleted(cid);
                }
                case FORWARD -> {
                    // no descent: the target subgraph was already rebuilt for this state
                    int bufferedLocation = bufferedLocation(ltmdp.to(cid));
                    nmdp.addInnerNode(location, ChoiceKind.FORWARD, bufferedLocation, bufferedLocation, probability);
                    markCompleted(cid);
                }
                case PROBABILISTIC, NONDETERMINISTIC -> {
                    int first = ltmdp.from(cid);
                    int childCount = ltmdp.to(cid) - first + 1;
                    int places = nmdp.reservePlaces(childCount);
                    nmdp.addInnerNode(location, kind, places, places + childCount - 1, probability);
                    pendingCids.add(-cid - 1);
                    pendingLocations.add(location);
                    for (int child = childCount - 1; child >= 0; child--) {
                        pendingCids.add(first + child);
                        pendingLocations.add(places + child);
                    }
                }
            }
        }
        return rootLocation;
    }

    private int stateOf(int transitionTargetId) {
        int state = stateOfTarget.getInt(ltmdp.transitionTarget(transitionTargetId));
        if (state < 0) {
            throw new OrderingException(REASON_UNKNOWN_TRANSITION_TARGET,
                    "transition target " + transitionTargetId + " was added after state creation");
        }
        return state;
    }

    private void clearCidBuffer(int rootCid) {
        cidBuffer.clear();
        cidCompleted.clear();
        cidBufferOffset = rootCid;
    }

    private int bufferPosition(int cid) {
        long position = (long) cid - cidBufferOffset;
        if (position > maxBufferPosition || position >= ModelCapacity.MAX_ARENA_SIZE) {
            throw new CapacityException(
                    REASON_BUFFER_POSITION_OVERFLOW,
                    "cid buffer position " + position + " exceeds addressable limit " + maxBufferPosition
            );
        }
        return (int) position;
    }

    private void bufferCidMapping(int cid, int location) {
        int position = bufferPosition(cid);
        if (position < 0) {
            throw new IllegalStateException("cid " + cid + " lies before the root of the state being converted");
        }
        while (cidBuffer.size() <= position) {
            cidBuffer.add(NOT_BUFFERED);
            cidCompleted.add(false);
        }
        if (cidBuffer.getInt(position) != NOT_BUFFERED) {
            throw new IllegalStateException("cid " + cid + " must not have been buffered already");
        }
        cidBuffer.set(position, location);
    }

    private void markCompleted(int cid) {
        cidCompleted.set(bufferPosition(cid), true);
    }

    /**
     * A forward may only target a subgraph that is fully rebuilt; targets still on the current
     * descent path would close a cycle.
     */
    private int bufferedLocation(int cid) {
        int position = bufferPosition(cid);
        if (position < 0 || position >= cidBuffer.size() || cidBuffer.getInt(position) == NOT_BUFFERED) {
            throw new OrderingException(
                    REASON_FORWARD_TARGET_NOT_BUFFERED,
                    "forward target cid " + cid + " has not been visited in the current state"
            );
        }
        if (!cidCompleted.getBoolean(position)) {
            throw new OrderingException(
                    REASON_FORWARD_TARGET_NOT_BUFFERED,
                    "forward target cid " + cid + " is an ancestor of the forward in the current state"
            );
        }
        return cidBuffer.getInt(position);
    }
}
