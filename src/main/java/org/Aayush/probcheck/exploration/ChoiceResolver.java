package org.Aayush.probcheck.exploration;

import org.Aayush.probcheck.core.error.NondeterminismException;
import org.Aayush.probcheck.model.ChoiceHandler;

import java.util.Objects;

/**
 * Enumerates every combination of decisions of one state's step logic exactly once.
 *
 * <p>The step logic is replayed once per path. Chosen values form the digits of a
 * mixed-radix counter whose radices are the value counts of the choices; the most recently
 * introduced choice varies fastest. Usage per state:</p>
 * <pre>{@code
 * resolver.prepareNextState();
 * while (resolver.prepareNextPath()) {
 *     model.step(state, resolver);
 * }
 * }</pre>
 *
 * <p><strong>Usage Warning:</strong> resolvers are NOT thread-safe; each exploration worker
 * owns exactly one.</p>
 */
public abstract class ChoiceResolver implements ChoiceHandler {
    public static final String REASON_CHOICE_COUNT_MISMATCH = "EX_CHOICE_COUNT_MISMATCH";
    public static final String REASON_ONLY_FIRST_VALUE_FORWARDABLE = "EX_ONLY_FIRST_VALUE_FORWARDABLE";

    protected static final int INITIAL_CAPACITY = 64;

    // values chosen along the current path
    protected final ChoiceStack chosenValues = new ChoiceStack(INITIAL_CAPACITY);
    // value counts of all choices along the current path; 0 marks a choice made deterministic
    protected final ChoiceStack valueCounts = new ChoiceStack(INITIAL_CAPACITY);

    private final boolean useForwardOptimization;
    protected int choiceIndex = -1;
    private boolean firstPath;

    protected ChoiceResolver(boolean useForwardOptimization) {
        this.useForwardOptimization = useForwardOptimization;
    }

    /**
     * Prepares the resolver for the choices of the next state.
     */
    public void prepareNextState() {
        firstPath = true;
    }

    /**
     * Advances to the next unexplored combination of values.
     *
     * @return {@code true} when another path has to be replayed, {@code false} when all
     * paths of the current state have been enumerated.
     * @throws NondeterminismException when the previous replay resolved a different number
     * of choices than recorded for it.
     */
    public boolean prepareNextPath() {
        if (choiceIndex != valueCounts.size() - 1) {
            throw new NondeterminismException(
                    REASON_CHOICE_COUNT_MISMATCH,
                    "replay resolved " + (choiceIndex + 1) + " choices but " + valueCounts.size()
                            + " were recorded; the step function is not deterministic"
            );
        }
        choiceIndex = -1;

        if (firstPath) {
            firstPath = false;
            onPathStarted();
            return true;
        }

        while (!chosenValues.isEmpty()) {
            int chosenValue = chosenValues.pop();
            if (valueCounts.peek() > chosenValue + 1) {
                chosenValues.push(chosenValue + 1);
                onValueAdvanced(chosenValues.size() - 1, chosenValue + 1);
                onPathStarted();
                return true;
            }
            valueCounts.pop();
            onChoiceDropped(chosenValues.size());
        }
        return false;
    }

    @Override
    public int handleChoice(int valueCount) {
        return resolve(valueCount, null);
    }

    @Override
    public int handleProbabilisticChoice(double p0, double p1) {
        return handleProbabilisticChoice(new double[]{p0, p1});
    }

    @Override
    public int handleProbabilisticChoice(double p0, double p1, double p2) {
        return handleProbabilisticChoice(new double[]{p0, p1, p2});
    }

    /**
     * Resolves the next choice of the current replay.
     *
     * <p>On replay the buffered value for this choice index is returned; on first encounter
     * the value count is recorded and value 0 is seeded.</p>
     *
     * @param probabilities branch weights of a probabilistic choice, {@code null} for a
     * nondeterministic one.
     */
    protected final int resolve(int valueCount, double[] probabilities) {
        if (valueCount <= 0) {
            throw new IllegalArgumentException("valueCount must be positive, got " + valueCount);
        }
        ++choiceIndex;
        if (choiceIndex < chosenValues.size()) {
            return chosenValues.get(choiceIndex);
        }
        valueCounts.push(valueCount);
        chosenValues.push(0);
        onChoiceRecorded(choiceIndex, valueCount, probabilities);
        return 0;
    }

    @Override
    public int lastChoiceIndex() {
        return choiceIndex;
    }

    @Override
    public void forwardUntakenChoicesAtIndex(int index) {
        if (index < 0 || index > choiceIndex) {
            throw new IndexOutOfBoundsException("choice index out of bounds: " + index);
        }
        if (chosenValues.get(index) != 0) {
            throw new NondeterminismException(
                    REASON_ONLY_FIRST_VALUE_FORWARDABLE,
                    "only a choice currently resolved to value 0 can be made deterministic, index " + index
            );
        }
        if (!useForwardOptimization || valueCounts.get(index) == 0) {
            return;
        }
        onChoiceForwarded(index, valueCounts.get(index));
        valueCounts.set(index, 0);
    }

    /**
     * Pre-seeds the stack so that the next replay takes exactly {@code choices}.
     *
     * <p>The seeded choices are deterministic: no alternative values are enumerated for them.
     * Only {@link NondeterministicChoiceResolver} supports seeding; {@link LtmdpChoiceResolver}
     * throws {@link UnsupportedOperationException}, and {@link PathReplayer} covers replay.</p>
     */
    public void setChoices(int... choices) {
        Objects.requireNonNull(choices, "choices");
        for (int choice : choices) {
            if (choice < 0) {
                throw new IllegalArgumentException("choice values must be non-negative, got " + choice);
            }
            chosenValues.push(choice);
            valueCounts.push(0);
        }
    }

    /**
     * Returns the values chosen on the most recent path.
     */
    public int[] getChoices() {
        return chosenValues.toIntArray();
    }

    /**
     * Clears all choice information.
     */
    public void clear() {
        chosenValues.clear();
        valueCounts.clear();
        choiceIndex = -1;
    }

    public boolean usesForwardOptimization() {
        return useForwardOptimization;
    }

    /**
     * Called when a new choice is first encountered at {@code index}.
     *
     * @param probabilities branch weights of a probabilistic choice, {@code null} for a
     * nondeterministic one.
     */
    protected void onChoiceRecorded(int index, int valueCount, double[] probabilities) {
    }

    /**
     * Called when the choice at {@code index} advances to {@code newValue}.
     */
    protected void onValueAdvanced(int index, int newValue) {
    }

    /**
     * Called when the exhausted choice at {@code index} is removed from the stack.
     */
    protected void onChoiceDropped(int index) {
    }

    /**
     * Called before its values {@code 1..valueCount-1} of the choice at {@code index} are disabled.
     */
    protected void onChoiceForwarded(int index, int valueCount) {
    }

    /**
     * Called at the start of every path.
     */
    protected void onPathStarted() {
    }
}
