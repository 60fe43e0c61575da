package org.Aayush.probcheck.formula;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Objects;

@Getter
@Accessors(fluent = true)
@EqualsAndHashCode(callSuper = false)
public final class UnaryFormula extends Formula {
    private final UnaryOperator operator;
    private final Formula operand;

    public UnaryFormula(UnaryOperator operator, Formula operand) {
        this.operator = Objects.requireNonNull(operator, "operator");
        this.operand = Objects.requireNonNull(operand, "operand");
    }

    @Override
    public <R> R accept(FormulaVisitor<R> visitor) {
        return visitor.visitUnary(this);
    }

    @Override
    public String toString() {
        return operator.symbol() + "(" + operand + ")";
    }
}
