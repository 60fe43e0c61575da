package org.Aayush.probcheck.formula;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Gathers atomic proposition labels in first-seen order, left to right.
 * Reusable across formulas; the table accumulates.
 */
public final class CollectAtomicPropositionsVisitor implements FormulaVisitor<Void> {
    private final LinkedHashSet<String> propositions = new LinkedHashSet<>();

    public void collect(Formula formula) {
        formula.accept(this);
    }

    public Set<String> propositions() {
        return Collections.unmodifiableSet(propositions);
    }

    @Override
    public Void visitAtomicProposition(AtomicPropositionFormula formula) {
        propositions.add(formula.label());
        return null;
    }

    @Override
    public Void visitUnary(UnaryFormula formula) {
        return formula.operand().accept(this);
    }

    @Override
    public Void visitBinary(BinaryFormula formula) {
        formula.left().accept(this);
        return formula.right().accept(this);
    }

    @Override
    public Void visitBoundedUnary(BoundedUnaryFormula formula) {
        return formula.operand().accept(this);
    }

    @Override
    public Void visitProbabilistic(ProbabilisticFormula formula) {
        return formula.pathFormula().accept(this);
    }

    @Override
    public Void visitCumulativeReward(CumulativeRewardFormula formula) {
        return formula.condition().accept(this);
    }
}
