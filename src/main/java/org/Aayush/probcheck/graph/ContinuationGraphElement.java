package org.Aayush.probcheck.graph;

/**
 * Read-only view of one continuation-graph node.
 *
 * <p>For {@link ChoiceKind#LEAF} nodes {@code to} is the target (transition-target id in an
 * LTMDP, state id in an NMDP) and {@code from} is unused. For {@link ChoiceKind#FORWARD}
 * nodes {@code from == to} names the redirect target. Inner nodes span the child range
 * {@code [from, to]}.</p>
 */
public record ContinuationGraphElement(ChoiceKind kind, int from, int to, double probability) {

    public int childCount() {
        return kind.isInner() ? to - from + 1 : 0;
    }
}
