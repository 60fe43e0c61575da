package org.Aayush.probcheck.graph;

/**
 * Node kinds of a continuation graph.
 */
public enum ChoiceKind {
    /** Terminal node naming a transition target (LTMDP) or a state (NMDP). */
    LEAF,
    /** Redirect to an already built node; contributes its own probability instead of the target's. */
    FORWARD,
    /** Probabilistic split over a contiguous child range; child probabilities sum to 1. */
    PROBABILISTIC,
    /** Nondeterministic split over a contiguous child range, resolved by a scheduler. */
    NONDETERMINISTIC;

    private static final ChoiceKind[] VALUES = values();

    static ChoiceKind fromCode(byte code) {
        return VALUES[code];
    }

    byte code() {
        return (byte) ordinal();
    }

    public boolean isInner() {
        return this == PROBABILISTIC || this == NONDETERMINISTIC;
    }
}
