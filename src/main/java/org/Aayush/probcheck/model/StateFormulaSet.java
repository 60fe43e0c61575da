package org.Aayush.probcheck.model;

import org.Aayush.probcheck.core.error.CapacityException;

/**
 * Immutable labeling bitset: bit {@code i} is set when atomic proposition {@code i} holds.
 *
 * <p>Used as part of the transition-target identity key, so equality and hashing are by value.</p>
 */
public final class StateFormulaSet {
    public static final int MAX_PROPOSITIONS = Long.SIZE;
    public static final String REASON_TOO_MANY_PROPOSITIONS = "ID_TOO_MANY_PROPOSITIONS";

    public static final StateFormulaSet EMPTY = new StateFormulaSet(0L);

    private final long bits;

    private StateFormulaSet(long bits) {
        this.bits = bits;
    }

    /**
     * Creates a labeling from per-proposition truth values.
     *
     * @throws CapacityException when more than {@link #MAX_PROPOSITIONS} values are supplied.
     */
    public static StateFormulaSet of(boolean... values) {
        requireCapacity(values.length);
        long bits = 0L;
        for (int i = 0; i < values.length; i++) {
            if (values[i]) {
                bits |= 1L << i;
            }
        }
        return bits == 0L ? EMPTY : new StateFormulaSet(bits);
    }

    public static StateFormulaSet fromBits(long bits) {
        return bits == 0L ? EMPTY : new StateFormulaSet(bits);
    }

    static void requireCapacity(int propositionCount) {
        if (propositionCount > MAX_PROPOSITIONS) {
            throw new CapacityException(
                    REASON_TOO_MANY_PROPOSITIONS,
                    "at most " + MAX_PROPOSITIONS + " atomic propositions are supported, got " + propositionCount
            );
        }
    }

    public boolean get(int index) {
        if (index < 0 || index >= MAX_PROPOSITIONS) {
            throw new IndexOutOfBoundsException("proposition index out of bounds: " + index);
        }
        return (bits & (1L << index)) != 0L;
    }

    public long bits() {
        return bits;
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof StateFormulaSet && ((StateFormulaSet) o).bits == bits);
    }

    @Override
    public int hashCode() {
        return Long.hashCode(bits);
    }

    @Override
    public String toString() {
        return Long.toBinaryString(bits);
    }
}
