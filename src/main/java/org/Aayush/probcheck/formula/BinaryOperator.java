package org.Aayush.probcheck.formula;

import lombok.Getter;
import lombok.experimental.Accessors;

@Getter
@Accessors(fluent = true)
public enum BinaryOperator {
    AND("&&", false),
    OR("||", false),
    IMPLICATION("->", false),
    EQUIVALENCE("<->", false),
    UNTIL("U", true);

    private final String symbol;
    private final boolean temporal;

    BinaryOperator(String symbol, boolean temporal) {
        this.symbol = symbol;
        this.temporal = temporal;
    }
}
