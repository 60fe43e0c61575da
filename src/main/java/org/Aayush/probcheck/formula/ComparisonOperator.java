package org.Aayush.probcheck.formula;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Comparison of a computed probability against a bound.
 */
@Getter
@Accessors(fluent = true)
public enum ComparisonOperator {
    LESS_THAN("<"),
    LESS_EQUAL("<="),
    GREATER_THAN(">"),
    GREATER_EQUAL(">=");

    private final String symbol;

    ComparisonOperator(String symbol) {
        this.symbol = symbol;
    }

    /**
     * Lower bounds must hold for every scheduler, so they are checked against the minimum.
     */
    public boolean isLowerBound() {
        return this == GREATER_THAN || this == GREATER_EQUAL;
    }

    public boolean test(double value, double bound) {
        return switch (this) {
            case LESS_THAN -> value < bound;
            case LESS_EQUAL -> value <= bound;
            case GREATER_THAN -> value > bound;
            case GREATER_EQUAL -> value >= bound;
        };
    }
}
