package org.Aayush.probcheck.formula;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Objects;

/**
 * Expected number of steps among the first {@code steps} in which {@code condition} holds.
 * A step counts the state it ends in.
 */
@Getter
@Accessors(fluent = true)
@EqualsAndHashCode(callSuper = false)
public final class CumulativeRewardFormula extends Formula {
    private final Formula condition;
    private final int steps;

    public CumulativeRewardFormula(Formula condition, int steps) {
        this.condition = Objects.requireNonNull(condition, "condition");
        if (steps < 0) {
            throw new IllegalArgumentException("steps must be non-negative");
        }
        this.steps = steps;
    }

    @Override
    public <R> R accept(FormulaVisitor<R> visitor) {
        return visitor.visitCumulativeReward(this);
    }

    @Override
    public String toString() {
        return "R[C<=" + steps + "](" + condition + ")";
    }
}
