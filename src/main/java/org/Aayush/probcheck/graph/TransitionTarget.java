package org.Aayush.probcheck.graph;

import org.Aayush.probcheck.model.StateFormulaSet;

import java.util.Objects;

/**
 * Identity key of a reached state: its labeling plus the storage id of its state vector.
 */
public record TransitionTarget(StateFormulaSet labeling, int targetStorageId) {

    public TransitionTarget {
        Objects.requireNonNull(labeling, "labeling");
        if (targetStorageId < 0) {
            throw new IllegalArgumentException("targetStorageId must be non-negative");
        }
    }
}
