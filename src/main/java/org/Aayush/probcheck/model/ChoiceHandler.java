package org.Aayush.probcheck.model;

/**
 * Decision protocol a {@link SteppableModel} uses at each of its own choice points.
 *
 * <p>A state's step logic is replayed once per combination of decisions. Implementations
 * return the value to take for the current replay; the model must reach its choice points
 * in the same order on every replay of the same state.</p>
 */
public interface ChoiceHandler {

    /**
     * Resolves a nondeterministic choice between {@code valueCount} values.
     *
     * @param valueCount number of values, at least 1.
     * @return chosen value in {@code [0, valueCount)}.
     */
    int handleChoice(int valueCount);

    /**
     * Resolves a probabilistic choice between two options.
     *
     * @return chosen option index.
     */
    int handleProbabilisticChoice(double p0, double p1);

    /**
     * Resolves a probabilistic choice between three options.
     *
     * @return chosen option index.
     */
    int handleProbabilisticChoice(double p0, double p1, double p2);

    /**
     * Resolves a probabilistic choice between {@code probabilities.length} options.
     *
     * @return chosen option index.
     */
    int handleProbabilisticChoice(double... probabilities);

    /**
     * Returns the index of the most recent choice of the current replay, or {@code -1}.
     */
    int lastChoiceIndex();

    /**
     * Turns the choice at {@code choiceIndex} into a deterministic selection of its first value.
     *
     * <p>Only valid while the choice currently resolves to value 0. Models call this when a
     * decision turned out not to influence the step, so the untaken values need not be replayed.</p>
     */
    void forwardUntakenChoicesAtIndex(int choiceIndex);
}
