package org.Aayush.probcheck.exploration;

import org.Aayush.probcheck.core.error.NondeterminismException;
import org.Aayush.probcheck.model.SteppableModel;

import java.util.Objects;

/**
 * Reproduces single steps of a model for externally supplied choice vectors, e.g. to
 * rebuild a counterexample path from the choices recorded during exploration.
 *
 * @param <S> serialized state type.
 */
public final class PathReplayer<S> {
    private final SteppableModel<S> model;
    private final NondeterministicChoiceResolver resolver = new NondeterministicChoiceResolver(false);

    public PathReplayer(SteppableModel<S> model) {
        this.model = Objects.requireNonNull(model, "model");
    }

    /**
     * Replays the initial step taking exactly {@code choices}.
     *
     * @throws NondeterminismException when the step resolves a different number of choices.
     */
    public S replayInitialStep(int... choices) {
        seed(choices);
        S result = model.initialStep(resolver);
        requireAllConsumed(choices.length);
        return result;
    }

    /**
     * Replays one step from {@code state} taking exactly {@code choices}.
     *
     * @throws NondeterminismException when the step resolves a different number of choices.
     */
    public S replayStep(S state, int... choices) {
        Objects.requireNonNull(state, "state");
        seed(choices);
        S result = model.step(state, resolver);
        requireAllConsumed(choices.length);
        return result;
    }

    private void seed(int[] choices) {
        Objects.requireNonNull(choices, "choices");
        resolver.clear();
        resolver.prepareNextState();
        resolver.prepareNextPath();
        resolver.setChoices(choices);
    }

    private void requireAllConsumed(int expected) {
        if (resolver.lastChoiceIndex() != expected - 1) {
            throw new NondeterminismException(
                    ChoiceResolver.REASON_CHOICE_COUNT_MISMATCH,
                    "replay resolved " + (resolver.lastChoiceIndex() + 1) + " choices but " + expected + " were supplied"
            );
        }
    }
}
