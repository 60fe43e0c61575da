package org.Aayush.probcheck.formula;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Objects;

/**
 * {@code F<=k φ} or {@code G<=k φ}: the operand holds eventually, or always, within the first
 * {@code steps} steps.
 */
@Getter
@Accessors(fluent = true)
@EqualsAndHashCode(callSuper = false)
public final class BoundedUnaryFormula extends Formula {
    private final UnaryOperator operator;
    private final Formula operand;
    private final int steps;

    public BoundedUnaryFormula(UnaryOperator operator, Formula operand, int steps) {
        this.operator = Objects.requireNonNull(operator, "operator");
        if (operator != UnaryOperator.FINALLY && operator != UnaryOperator.GLOBALLY) {
            throw new IllegalArgumentException("only FINALLY and GLOBALLY can be bounded, got " + operator);
        }
        if (steps < 0) {
            throw new IllegalArgumentException("steps must be non-negative");
        }
        this.operand = Objects.requireNonNull(operand, "operand");
        this.steps = steps;
    }

    @Override
    public <R> R accept(FormulaVisitor<R> visitor) {
        return visitor.visitBoundedUnary(this);
    }

    @Override
    public String toString() {
        return operator.symbol() + "<=" + steps + "(" + operand + ")";
    }
}
