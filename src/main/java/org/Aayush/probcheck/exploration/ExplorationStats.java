package org.Aayush.probcheck.exploration;

import lombok.Builder;
import lombok.Value;

/**
 * Immutable exploration snapshot.
 */
@Value
@Builder
public class ExplorationStats {

    /**
     * Distinct serialized states discovered.
     */
    int stateCount;

    /**
     * Distinct transition targets recorded in the LTMDP.
     */
    int transitionTargetCount;

    /**
     * Total continuation-graph nodes over all step graphs.
     */
    int continuationGraphSize;

    /**
     * Number of exploration workers that ran.
     */
    int workerCount;

    long elapsedNanos;
}
