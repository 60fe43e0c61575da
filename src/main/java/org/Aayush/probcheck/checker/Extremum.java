package org.Aayush.probcheck.checker;

/**
 * Which scheduler bound a probability or reward query reports.
 */
public enum Extremum {
    MAXIMUM,
    MINIMUM;

    public Extremum flip() {
        return this == MAXIMUM ? MINIMUM : MAXIMUM;
    }

    /**
     * Returns the preferred of two values.
     */
    public double select(double a, double b) {
        return this == MAXIMUM ? Math.max(a, b) : Math.min(a, b);
    }

    /**
     * Start value for folding with {@link #select(double, double)}.
     */
    public double identity() {
        return this == MAXIMUM ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
    }
}
