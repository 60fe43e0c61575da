package org.Aayush.probcheck.model;

/**
 * Model collaborator consumed by state-space exploration.
 *
 * <p>States are serialized state vectors: {@code S} must implement value equality and
 * must not be mutated after it was returned. Both step functions must be pure functions of
 * their inputs and the values returned by the {@link ChoiceHandler}.</p>
 *
 * @param <S> serialized state type.
 */
public interface SteppableModel<S> {

    /**
     * Executes the initial step and returns the resulting initial state.
     */
    S initialStep(ChoiceHandler choices);

    /**
     * Executes one step from {@code state} and returns the successor for the current decisions.
     */
    S step(S state, ChoiceHandler choices);

    /**
     * Evaluates the atomic proposition {@code proposition} in {@code state}.
     *
     * @throws IllegalArgumentException when the proposition is unknown to the model.
     */
    boolean evaluateProposition(String proposition, S state);
}
