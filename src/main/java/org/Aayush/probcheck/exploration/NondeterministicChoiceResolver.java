package org.Aayush.probcheck.exploration;

/**
 * Choice resolver that treats probabilistic choices like nondeterministic ones.
 *
 * <p>Probability weights are ignored; every option of every choice is enumerated.</p>
 */
public final class NondeterministicChoiceResolver extends ChoiceResolver {

    public NondeterministicChoiceResolver(boolean useForwardOptimization) {
        super(useForwardOptimization);
    }

    public NondeterministicChoiceResolver() {
        this(true);
    }

    @Override
    public int handleProbabilisticChoice(double p0, double p1) {
        return handleChoice(2);
    }

    @Override
    public int handleProbabilisticChoice(double p0, double p1, double p2) {
        return handleChoice(3);
    }

    @Override
    public int handleProbabilisticChoice(double... probabilities) {
        return handleChoice(probabilities.length);
    }
}
