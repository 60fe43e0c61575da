package org.Aayush.probcheck.formula;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Objects;

/**
 * Named predicate over model states, evaluated by the steppable model.
 */
@Getter
@Accessors(fluent = true)
@EqualsAndHashCode(callSuper = false)
public final class AtomicPropositionFormula extends Formula {
    private final String label;

    public AtomicPropositionFormula(String label) {
        String value = Objects.requireNonNull(label, "label");
        if (value.isBlank()) {
            throw new IllegalArgumentException("label must be non-blank");
        }
        this.label = value;
    }

    @Override
    public <R> R accept(FormulaVisitor<R> visitor) {
        return visitor.visitAtomicProposition(this);
    }

    @Override
    public String toString() {
        return label;
    }
}
