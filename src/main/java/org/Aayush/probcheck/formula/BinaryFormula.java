package org.Aayush.probcheck.formula;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Objects;

@Getter
@Accessors(fluent = true)
@EqualsAndHashCode(callSuper = false)
public final class BinaryFormula extends Formula {
    private final Formula left;
    private final BinaryOperator operator;
    private final Formula right;

    public BinaryFormula(Formula left, BinaryOperator operator, Formula right) {
        this.left = Objects.requireNonNull(left, "left");
        this.operator = Objects.requireNonNull(operator, "operator");
        this.right = Objects.requireNonNull(right, "right");
    }

    @Override
    public <R> R accept(FormulaVisitor<R> visitor) {
        return visitor.visitBinary(this);
    }

    @Override
    public String toString() {
        return "(" + left + " " + operator.symbol() + " " + right + ")";
    }
}
