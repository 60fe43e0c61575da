package org.Aayush.probcheck.formula;

/**
 * Semantic kind of a formula: what evaluating it in the initial states yields.
 */
public enum FormulaKind {
    /** Boolean-valued. */
    STATE,
    /** Probability-valued. */
    PATH,
    /** Reward-valued. */
    REWARD
}
