package org.Aayush.probcheck.testutil;

import org.Aayush.probcheck.model.ChoiceHandler;
import org.Aayush.probcheck.model.SteppableModel;

/**
 * From "start" the scheduler either moves to "goal" for sure or gambles 0.5/0.5 between
 * "goal" and "sink". Both are absorbing. Propositions: {@code goal}, {@code sink}.
 */
public final class GambleModel implements SteppableModel<String> {

    @Override
    public String initialStep(ChoiceHandler handler) {
        return "start";
    }

    @Override
    public String step(String state, ChoiceHandler handler) {
        if (!state.equals("start")) {
            return state;
        }
        if (handler.handleChoice(2) == 0) {
            return "goal";
        }
        return handler.handleProbabilisticChoice(0.5d, 0.5d) == 0 ? "goal" : "sink";
    }

    @Override
    public boolean evaluateProposition(String proposition, String state) {
        switch (proposition) {
            case "goal":
                return state.equals("goal");
            case "sink":
                return state.equals("sink");
            default:
                throw new IllegalArgumentException("unknown proposition " + proposition);
        }
    }
}
