package org.Aayush.probcheck.formula;

import org.Aayush.probcheck.core.error.FormulaTypeException;

/**
 * Classifies a formula and rejects malformed nesting.
 * <p>
 * Temporal operators take state formulas and yield path formulas; path formulas may only
 * occur at the top level or directly under a probabilistic operator. Rewards only occur at
 * the top level.
 * </p>
 */
public final class FormulaKindVisitor implements FormulaVisitor<FormulaKind> {
    public static final String REASON_NOT_PROBABILITY = "FM_NOT_PROBABILITY";
    public static final String REASON_NOT_BOOLEAN = "FM_NOT_BOOLEAN";
    public static final String REASON_NOT_REWARD = "FM_NOT_REWARD";
    public static final String REASON_MALFORMED = "FM_MALFORMED";

    private static final FormulaKindVisitor INSTANCE = new FormulaKindVisitor();

    private FormulaKindVisitor() {
    }

    /**
     * @throws FormulaTypeException when the formula is malformed.
     */
    public static FormulaKind kindOf(Formula formula) {
        return formula.accept(INSTANCE);
    }

    /**
     * @throws FormulaTypeException when the formula is not of kind {@code expected}.
     */
    public static void requireKind(Formula formula, FormulaKind expected) {
        FormulaKind actual = kindOf(formula);
        if (actual != expected) {
            String reason = switch (expected) {
                case PATH -> REASON_NOT_PROBABILITY;
                case STATE -> REASON_NOT_BOOLEAN;
                case REWARD -> REASON_NOT_REWARD;
            };
            throw new FormulaTypeException(reason, "formula " + formula + " is of kind " + actual + ", expected " + expected);
        }
    }

    @Override
    public FormulaKind visitAtomicProposition(AtomicPropositionFormula formula) {
        return FormulaKind.STATE;
    }

    @Override
    public FormulaKind visitUnary(UnaryFormula formula) {
        requireStateOperand(formula, formula.operand());
        return formula.operator().temporal() ? FormulaKind.PATH : FormulaKind.STATE;
    }

    @Override
    public FormulaKind visitBinary(BinaryFormula formula) {
        requireStateOperand(formula, formula.left());
        requireStateOperand(formula, formula.right());
        return formula.operator().temporal() ? FormulaKind.PATH : FormulaKind.STATE;
    }

    @Override
    public FormulaKind visitBoundedUnary(BoundedUnaryFormula formula) {
        requireStateOperand(formula, formula.operand());
        return FormulaKind.PATH;
    }

    @Override
    public FormulaKind visitProbabilistic(ProbabilisticFormula formula) {
        FormulaKind inner = formula.pathFormula().accept(this);
        if (inner != FormulaKind.PATH) {
            throw new FormulaTypeException(REASON_MALFORMED,
                    "probabilistic operator expects a path formula, got " + inner + " in " + formula);
        }
        return FormulaKind.STATE;
    }

    @Override
    public FormulaKind visitCumulativeReward(CumulativeRewardFormula formula) {
        requireStateOperand(formula, formula.condition());
        return FormulaKind.REWARD;
    }

    private void requireStateOperand(Formula parent, Formula operand) {
        FormulaKind kind = operand.accept(this);
        if (kind != FormulaKind.STATE) {
            throw new FormulaTypeException(REASON_MALFORMED,
                    "operand " + operand + " of " + parent + " must be a state formula, got " + kind);
        }
    }
}
