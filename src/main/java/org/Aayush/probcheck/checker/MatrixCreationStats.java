package org.Aayush.probcheck.checker;

import lombok.Builder;
import lombok.Value;
import org.Aayush.probcheck.exploration.ExplorationStats;

/**
 * Immutable snapshot of one probability-matrix build.
 */
@Value
@Builder
public class MatrixCreationStats {

    ExplorationStats exploration;

    int ltmdpContinuationGraphSize;

    int nmdpStateCount;

    int nmdpContinuationGraphSize;

    int distributionCount;

    int transitionCount;

    long conversionNanos;

    long derivationNanos;
}
