package org.Aayush.probcheck.checker;

import lombok.Builder;
import lombok.Value;
import org.Aayush.probcheck.graph.ModelCapacity;

/**
 * Startup configuration of a {@link ProbabilityChecker}.
 *
 * <p>Bound once when the checker is created; it cannot change between the matrix build and
 * the queries.</p>
 */
@Value
@Builder
public class AnalysisConfiguration {

    /**
     * Number of exploration workers, at least 1.
     */
    @Builder.Default
    int workerCount = Runtime.getRuntime().availableProcessors();

    /**
     * Hard limits for state storage and continuation-graph arenas.
     */
    @Builder.Default
    ModelCapacity modelCapacity = ModelCapacity.defaultCapacity();

    /**
     * When false, forward requests by the model are ignored and every value is enumerated.
     */
    @Builder.Default
    boolean useForwardOptimization = true;

    /**
     * Scheduler bound reported by the default checker.
     */
    @Builder.Default
    Extremum extremum = Extremum.MAXIMUM;

    /**
     * Value iteration stops once no value changes by more than this.
     */
    @Builder.Default
    double convergenceEpsilon = 1e-9;

    @Builder.Default
    int maxIterations = 100_000;

    public static AnalysisConfiguration defaultConfiguration() {
        return AnalysisConfiguration.builder().build();
    }

    /**
     * @throws IllegalArgumentException naming the first invalid field.
     */
    public AnalysisConfiguration validate() {
        if (workerCount <= 0) {
            throw new IllegalArgumentException("workerCount must be positive");
        }
        if (modelCapacity == null) {
            throw new IllegalArgumentException("modelCapacity must be non-null");
        }
        if (extremum == null) {
            throw new IllegalArgumentException("extremum must be non-null");
        }
        if (!(convergenceEpsilon > 0.0d) || Double.isInfinite(convergenceEpsilon)) {
            throw new IllegalArgumentException("convergenceEpsilon must be finite and positive");
        }
        if (maxIterations <= 0) {
            throw new IllegalArgumentException("maxIterations must be positive");
        }
        return this;
    }
}
