package org.Aayush.probcheck.formula;

/**
 * Node of a temporal-logic formula tree.
 * <p>
 * Formulas are immutable values. Their semantic kind (state, path, reward) is not encoded in
 * the type hierarchy; it is derived by {@link FormulaKindVisitor}, which also rejects
 * malformed nesting.
 * </p>
 */
public abstract class Formula {

    Formula() {
    }

    public abstract <R> R accept(FormulaVisitor<R> visitor);
}
