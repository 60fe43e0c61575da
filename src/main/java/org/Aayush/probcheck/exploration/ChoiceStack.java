package org.Aayush.probcheck.exploration;

import it.unimi.dsi.fastutil.ints.IntArrayList;

/**
 * Growable stack of ints with O(1) push, pop, peek and indexed access.
 * <p>
 * <strong>Usage Warning:</strong> This class is NOT thread-safe. Each resolver owns its stacks.
 * </p>
 */
final class ChoiceStack {
    private final IntArrayList values;

    ChoiceStack(int initialCapacity) {
        this.values = new IntArrayList(initialCapacity);
    }

    void push(int value) {
        values.add(value);
    }

    int pop() {
        return values.popInt();
    }

    int peek() {
        return values.topInt();
    }

    int get(int index) {
        return values.getInt(index);
    }

    void set(int index, int value) {
        values.set(index, value);
    }

    int size() {
        return values.size();
    }

    boolean isEmpty() {
        return values.isEmpty();
    }

    void clear() {
        values.clear();
    }

    int[] toIntArray() {
        return values.toIntArray();
    }
}
