package org.Aayush.probcheck.formula;

import lombok.Getter;
import lombok.experimental.Accessors;

@Getter
@Accessors(fluent = true)
public enum UnaryOperator {
    NOT("!", false),
    NEXT("X", true),
    FINALLY("F", true),
    GLOBALLY("G", true);

    private final String symbol;
    private final boolean temporal;

    UnaryOperator(String symbol, boolean temporal) {
        this.symbol = symbol;
        this.temporal = temporal;
    }
}
