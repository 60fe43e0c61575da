package org.Aayush.probcheck.checker;

import org.Aayush.probcheck.core.error.FormulaTypeException;
import org.Aayush.probcheck.exploration.StateSpaceExplorer;
import org.Aayush.probcheck.formula.ComparisonOperator;
import org.Aayush.probcheck.formula.Formula;
import org.Aayush.probcheck.formula.FormulaKindVisitor;
import org.Aayush.probcheck.graph.CompactProbabilityMatrix;
import org.Aayush.probcheck.graph.LtmdpToNmdpConverter;
import org.Aayush.probcheck.graph.ModelCapacity;
import org.Aayush.probcheck.model.AnalysisModel;
import org.Aayush.probcheck.model.SteppableModel;
import org.Aayush.probcheck.testutil.CoinFlipModel;
import org.Aayush.probcheck.testutil.CounterModel;
import org.Aayush.probcheck.testutil.GambleModel;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.Aayush.probcheck.formula.Formulas.*;
import static org.junit.jupiter.api.Assertions.*;

class ValueIterationModelCheckerTest {

    private static final double EPS = 1e-9;

    private static final Formula GOAL = proposition("goal");
    private static final Formula SINK = proposition("sink");

    private static CompactProbabilityMatrix gamble;

    private final ValueIterationModelChecker max = new ValueIterationModelChecker(Extremum.MAXIMUM, 1e-12, 10_000);
    private final ValueIterationModelChecker min = new ValueIterationModelChecker(Extremum.MINIMUM, 1e-12, 10_000);

    @BeforeAll
    static void buildMatrix() {
        gamble = matrixOf(new GambleModel(), List.of(GOAL, SINK));
    }

    private static <S> CompactProbabilityMatrix matrixOf(SteppableModel<S> model, List<Formula> formulas) {
        StateSpaceExplorer<S> explorer = new StateSpaceExplorer<>(
                AnalysisModel.serialize(model, formulas), 1, true, ModelCapacity.defaultCapacity());
        explorer.explore();
        return CompactProbabilityMatrix.derive(new LtmdpToNmdpConverter(explorer.ltmdp()).convert());
    }

    @Nested
    @DisplayName("Probabilities")
    class Probabilities {

        @Test
        @DisplayName("Finally: maximal and minimal scheduler")
        void testFinally() {
            assertEquals(1.0d, max.calculateProbability(gamble, eventually(GOAL)).value(), EPS);
            assertEquals(0.5d, min.calculateProbability(gamble, eventually(GOAL)).value(), EPS);
        }

        @Test
        @DisplayName("Globally is the complement of finally with the extremum flipped")
        void testGlobally() {
            assertEquals(0.5d, max.calculateProbability(gamble, globally(not(GOAL))).value(), EPS);
            assertEquals(0.0d, min.calculateProbability(gamble, globally(not(GOAL))).value(), EPS);
        }

        @Test
        @DisplayName("Next and until")
        void testNextAndUntil() {
            assertEquals(1.0d, max.calculateProbability(gamble, next(GOAL)).value(), EPS);
            assertEquals(0.5d, min.calculateProbability(gamble, next(GOAL)).value(), EPS);
            assertEquals(0.5d, min.calculateProbability(gamble, until(not(SINK), GOAL)).value(), EPS);
            assertEquals(0.0d, max.calculateProbability(gamble, until(SINK, GOAL)).value(), EPS);
        }

        @Test
        @DisplayName("Step bounds count the initial step")
        void testBounded() {
            assertEquals(0.0d, max.calculateProbability(gamble, eventuallyWithin(GOAL, 0)).value(), EPS);
            assertEquals(0.0d, max.calculateProbability(gamble, eventuallyWithin(GOAL, 1)).value(), EPS);
            assertEquals(1.0d, max.calculateProbability(gamble, eventuallyWithin(GOAL, 2)).value(), EPS);
            assertEquals(0.5d, min.calculateProbability(gamble, eventuallyWithin(GOAL, 5)).value(), EPS);
            assertEquals(1.0d, max.calculateProbability(gamble, globallyWithin(not(GOAL), 0)).value(), EPS);
            assertEquals(1.0d, max.calculateProbability(gamble, globallyWithin(not(GOAL), 1)).value(), EPS);
            assertEquals(0.5d, max.calculateProbability(gamble, globallyWithin(not(GOAL), 2)).value(), EPS);
            assertEquals(0.0d, min.calculateProbability(gamble, globallyWithin(not(GOAL), 2)).value(), EPS);
        }

        @Test
        @DisplayName("Initial distribution weights the start states")
        void testInitialDistribution() {
            CompactProbabilityMatrix coin = matrixOf(new CoinFlipModel(), List.of(proposition("a")));
            assertEquals(0.6d, max.calculateProbability(coin, eventually(proposition("a"))).value(), EPS);
            assertEquals(0.6d, max.calculateProbability(coin, eventuallyWithin(proposition("a"), 1)).value(), EPS);
            assertEquals(0.4d, max.calculateProbability(coin, globally(not(proposition("a")))).value(), EPS);
        }

        @Test
        @DisplayName("Counter reaches its maximum almost surely under the eager scheduler")
        void testCounterReachability() {
            CompactProbabilityMatrix counter = matrixOf(new CounterModel(3), List.of(proposition("done")));
            assertEquals(1.0d, max.calculateProbability(counter, eventually(proposition("done"))).value(), 1e-6);
            assertEquals(0.0d, min.calculateProbability(counter, eventually(proposition("done"))).value(), EPS);
            assertEquals(0.729d, max.calculateProbability(counter, eventuallyWithin(proposition("done"), 4)).value(), EPS);
        }
    }

    @Nested
    @DisplayName("Booleans")
    class Booleans {

        @Test
        @DisplayName("Propositional formulas hold in every reachable start state")
        void testPropositional() {
            assertFalse(max.calculateFormula(gamble, GOAL));
            assertTrue(max.calculateFormula(gamble, not(GOAL)));
            assertTrue(max.calculateFormula(gamble, implies(GOAL, not(SINK))));
            assertTrue(max.calculateFormula(gamble, equivalent(GOAL, SINK)));
            assertFalse(max.calculateFormula(gamble, or(GOAL, SINK)));
        }

        @Test
        @DisplayName("Lower bounds use the minimal and upper bounds the maximal probability")
        void testProbabilisticBounds() {
            assertTrue(max.calculateFormula(gamble, probability(ComparisonOperator.GREATER_EQUAL, 0.5d, eventually(GOAL))));
            assertFalse(max.calculateFormula(gamble, probability(ComparisonOperator.GREATER_THAN, 0.5d, eventually(GOAL))));
            assertFalse(max.calculateFormula(gamble, probability(ComparisonOperator.LESS_EQUAL, 0.4d, globally(not(GOAL)))));
            assertTrue(max.calculateFormula(gamble, probability(ComparisonOperator.LESS_THAN, 0.6d, globally(not(GOAL)))));
        }
    }

    @Nested
    @DisplayName("Rewards")
    class Rewards {

        @Test
        @DisplayName("Cumulative reward counts the state each step ends in")
        void testCumulativeReward() {
            RewardResult best = max.calculateReward(gamble, cumulativeReward(GOAL, 3));
            assertEquals(2.0d, best.value(), EPS);
            assertEquals(3, best.steps());
            assertEquals(1.0d, min.calculateReward(gamble, cumulativeReward(GOAL, 3)).value(), EPS);
            assertEquals(0.0d, max.calculateReward(gamble, cumulativeReward(GOAL, 0)).value(), EPS);
            assertEquals(0.0d, max.calculateReward(gamble, cumulativeReward(GOAL, 1)).value(), EPS);
        }
    }

    @Nested
    @DisplayName("Faults")
    class Faults {

        @Test
        @DisplayName("Formula kind mismatch per entry point")
        void testKindMismatch() {
            FormulaTypeException probability = assertThrows(FormulaTypeException.class,
                    () -> max.calculateProbability(gamble, GOAL));
            assertEquals(FormulaKindVisitor.REASON_NOT_PROBABILITY, probability.reasonCode());
            FormulaTypeException bool = assertThrows(FormulaTypeException.class,
                    () -> max.calculateFormula(gamble, eventually(GOAL)));
            assertEquals(FormulaKindVisitor.REASON_NOT_BOOLEAN, bool.reasonCode());
            FormulaTypeException reward = assertThrows(FormulaTypeException.class,
                    () -> max.calculateReward(gamble, eventually(GOAL)));
            assertEquals(FormulaKindVisitor.REASON_NOT_REWARD, reward.reasonCode());
        }

        @Test
        @DisplayName("Propositions not serialized with the model are rejected")
        void testUnknownProposition() {
            assertThrows(IllegalArgumentException.class, () -> max.calculateFormula(gamble, proposition("other")));
        }

        @Test
        @DisplayName("Constructor validation")
        void testValidation() {
            assertThrows(IllegalArgumentException.class, () -> new ValueIterationModelChecker(Extremum.MAXIMUM, 0.0d, 10));
            assertThrows(IllegalArgumentException.class, () -> new ValueIterationModelChecker(Extremum.MAXIMUM, 1e-6, 0));
            assertThrows(NullPointerException.class, () -> new ValueIterationModelChecker(null, 1e-6, 10));
        }
    }
}
