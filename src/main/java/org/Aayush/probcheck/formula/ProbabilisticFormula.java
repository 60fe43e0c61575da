package org.Aayush.probcheck.formula;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.experimental.Accessors;
import org.Aayush.probcheck.model.Probability;

import java.util.Objects;

/**
 * {@code P ⋈ bound [path]}: a state formula comparing the probability of a path formula.
 */
@Getter
@Accessors(fluent = true)
@EqualsAndHashCode(callSuper = false)
public final class ProbabilisticFormula extends Formula {
    private final ComparisonOperator comparator;
    private final double bound;
    private final Formula pathFormula;

    public ProbabilisticFormula(ComparisonOperator comparator, double bound, Formula pathFormula) {
        this.comparator = Objects.requireNonNull(comparator, "comparator");
        this.bound = Probability.of(bound).value();
        this.pathFormula = Objects.requireNonNull(pathFormula, "pathFormula");
    }

    @Override
    public <R> R accept(FormulaVisitor<R> visitor) {
        return visitor.visitProbabilistic(this);
    }

    @Override
    public String toString() {
        return "P" + comparator.symbol() + bound + " [" + pathFormula + "]";
    }
}
