package org.Aayush.probcheck.graph;

import lombok.Value;

/**
 * Hard size limits for state storage and continuation-graph arenas.
 */
@Value
public class ModelCapacity {
    public static final int MAX_ARENA_SIZE = Integer.MAX_VALUE - 8;

    int maxStates;
    int maxContinuationGraphSize;

    public ModelCapacity(int maxStates, int maxContinuationGraphSize) {
        if (maxStates <= 0) {
            throw new IllegalArgumentException("maxStates must be positive");
        }
        if (maxContinuationGraphSize <= 0 || maxContinuationGraphSize > MAX_ARENA_SIZE) {
            throw new IllegalArgumentException("maxContinuationGraphSize must be within (0, " + MAX_ARENA_SIZE + "]");
        }
        this.maxStates = maxStates;
        this.maxContinuationGraphSize = maxContinuationGraphSize;
    }

    /**
     * Default limits: 16M states and the largest addressable arena.
     */
    public static ModelCapacity defaultCapacity() {
        return new ModelCapacity(1 << 24, MAX_ARENA_SIZE);
    }

    /**
     * Capacity sized from an exact estimate of state count and continuation-graph size.
     *
     * @throws IllegalArgumentException when the estimate does not fit the addressing width.
     */
    public static ModelCapacity byExactSize(int states, long continuationGraphSize) {
        if (continuationGraphSize > MAX_ARENA_SIZE) {
            throw new IllegalArgumentException("continuation graph size " + continuationGraphSize + " exceeds arena limit");
        }
        return new ModelCapacity(Math.max(1, states), (int) Math.max(1L, continuationGraphSize));
    }
}
