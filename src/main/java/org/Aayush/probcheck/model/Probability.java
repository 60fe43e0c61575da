package org.Aayush.probcheck.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Immutable probability value in {@code [0, 1]}.
 *
 * <p>Values that overshoot the unit interval by less than {@link #TOLERANCE} are clamped;
 * anything further out is rejected.</p>
 */
@Getter
@Accessors(fluent = true)
@EqualsAndHashCode
public final class Probability implements Comparable<Probability> {
    public static final double TOLERANCE = 1e-9;

    public static final Probability ZERO = new Probability(0.0d);
    public static final Probability ONE = new Probability(1.0d);

    private final double value;

    private Probability(double value) {
        this.value = value;
    }

    /**
     * Creates a probability from a raw double.
     *
     * @param value probability value.
     * @return validated probability.
     * @throws IllegalArgumentException when the value is NaN or outside {@code [0, 1]}.
     */
    public static Probability of(double value) {
        if (Double.isNaN(value) || value < -TOLERANCE || value > 1.0d + TOLERANCE) {
            throw new IllegalArgumentException("probability must be within [0, 1], got " + value);
        }
        return new Probability(Math.max(0.0d, Math.min(1.0d, value)));
    }

    public boolean isOne() {
        return Math.abs(value - 1.0d) <= TOLERANCE;
    }

    public boolean isZero() {
        return Math.abs(value) <= TOLERANCE;
    }

    public Probability complement() {
        return new Probability(1.0d - value);
    }

    public Probability multiply(Probability other) {
        return new Probability(value * other.value);
    }

    /**
     * Checks whether two raw probability values are equal within {@link #TOLERANCE}.
     */
    public static boolean isApproximately(double expected, double actual) {
        return Math.abs(expected - actual) <= TOLERANCE;
    }

    @Override
    public int compareTo(Probability other) {
        return Double.compare(value, other.value);
    }

    @Override
    public String toString() {
        return Double.toString(value);
    }
}
