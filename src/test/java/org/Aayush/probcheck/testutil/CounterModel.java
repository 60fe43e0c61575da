package org.Aayush.probcheck.testutil;

import org.Aayush.probcheck.model.ChoiceHandler;
import org.Aayush.probcheck.model.SteppableModel;

/**
 * Counter on {@code [0, max]}. Each step either waits (stays put) or attempts to advance;
 * an attempt succeeds with 0.9 and resets the counter to 0 otherwise. {@code max} is absorbing.
 * Propositions: {@code zero}, {@code done}.
 */
public final class CounterModel implements SteppableModel<Integer> {
    private final int max;

    public CounterModel(int max) {
        this.max = max;
    }

    @Override
    public Integer initialStep(ChoiceHandler handler) {
        return 0;
    }

    @Override
    public Integer step(Integer state, ChoiceHandler handler) {
        if (state == max) {
            return state;
        }
        if (handler.handleChoice(2) == 0) {
            return state;
        }
        return handler.handleProbabilisticChoice(0.9d, 0.1d) == 0 ? state + 1 : 0;
    }

    @Override
    public boolean evaluateProposition(String proposition, Integer state) {
        switch (proposition) {
            case "zero":
                return state == 0;
            case "done":
                return state == max;
            default:
                throw new IllegalArgumentException("unknown proposition " + proposition);
        }
    }
}
