package org.Aayush.probcheck.model;

import org.Aayush.probcheck.formula.CollectAtomicPropositionsVisitor;
import org.Aayush.probcheck.formula.Formula;

import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Serialized form of a model prepared for analysis.
 *
 * <p>Pairs the steppable model with the ordered table of atomic propositions referenced by
 * the formulas to check. The table fixes the bit layout of every {@link StateFormulaSet}
 * produced during exploration.</p>
 *
 * @param <S> serialized state type.
 */
public final class AnalysisModel<S> {
    private final SteppableModel<S> model;
    private final List<String> stateFormulaLabels;

    private AnalysisModel(SteppableModel<S> model, List<String> stateFormulaLabels) {
        this.model = model;
        this.stateFormulaLabels = stateFormulaLabels;
    }

    /**
     * Serializes {@code model} together with the propositions of {@code formulas}.
     *
     * @throws org.Aayush.probcheck.core.error.CapacityException when the formulas reference
     *         more than {@link StateFormulaSet#MAX_PROPOSITIONS} propositions.
     */
    public static <S> AnalysisModel<S> serialize(SteppableModel<S> model, Collection<? extends Formula> formulas) {
        Objects.requireNonNull(model, "model");
        Objects.requireNonNull(formulas, "formulas");
        CollectAtomicPropositionsVisitor collector = new CollectAtomicPropositionsVisitor();
        for (Formula formula : formulas) {
            collector.collect(Objects.requireNonNull(formula, "formula"));
        }
        List<String> labels = List.copyOf(collector.propositions());
        StateFormulaSet.requireCapacity(labels.size());
        return new AnalysisModel<>(model, labels);
    }

    public SteppableModel<S> model() {
        return model;
    }

    /**
     * Returns the proposition names in bit order.
     */
    public List<String> stateFormulaLabels() {
        return stateFormulaLabels;
    }

    /**
     * Evaluates every proposition of the table in {@code state}.
     */
    public StateFormulaSet label(S state) {
        long bits = 0L;
        for (int i = 0; i < stateFormulaLabels.size(); i++) {
            if (model.evaluateProposition(stateFormulaLabels.get(i), state)) {
                bits |= 1L << i;
            }
        }
        return StateFormulaSet.fromBits(bits);
    }
}
