package org.Aayush.probcheck.checker;

import lombok.extern.slf4j.Slf4j;
import org.Aayush.probcheck.core.error.CapacityException;
import org.Aayush.probcheck.core.error.OrderingException;
import org.Aayush.probcheck.exploration.ExplorationStats;
import org.Aayush.probcheck.exploration.StateSpaceExplorer;
import org.Aayush.probcheck.formula.Formula;
import org.Aayush.probcheck.formula.FormulaKind;
import org.Aayush.probcheck.formula.FormulaKindVisitor;
import org.Aayush.probcheck.graph.CompactProbabilityMatrix;
import org.Aayush.probcheck.graph.LabeledTransitionMarkovDecisionProcess;
import org.Aayush.probcheck.graph.LtmdpToNmdpConverter;
import org.Aayush.probcheck.graph.ModelCapacity;
import org.Aayush.probcheck.graph.NestedMarkovDecisionProcess;
import org.Aayush.probcheck.model.AnalysisModel;
import org.Aayush.probcheck.model.Probability;
import org.Aayush.probcheck.model.SteppableModel;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * One-shot orchestration of matrix construction and formula queries.
 * <p>
 * Lifecycle:
 * <ol>
 *     <li>Register every formula of interest through {@link #calculateProbability(Formula)},
 *     {@link #calculateFormula(Formula)} or {@link #calculateReward(Formula)}.</li>
 *     <li>Call {@link #createProbabilityMatrix()}. Exactly one caller performs the build:
 *     model serialization, state-space exploration, LTMDP to NMDP conversion and matrix
 *     derivation. Concurrent and later callers return immediately.</li>
 *     <li>Evaluate the returned {@link FormulaCalculator}s.</li>
 * </ol>
 * Registering after the build started and evaluating before the matrix is published are
 * ordering faults.
 * </p>
 * <p>
 * <strong>Thread Safety:</strong> all methods may be called concurrently.
 * </p>
 *
 * @param <S> serialized state type of the model.
 */
@Slf4j
public final class ProbabilityChecker<S> {
    public static final String REASON_MATRIX_NOT_CREATED = "PC_MATRIX_NOT_CREATED";
    public static final String REASON_BUILD_ALREADY_STARTED = "PC_BUILD_ALREADY_STARTED";
    public static final String REASON_CHECKER_ADDRESS_WIDTH = "PC_CHECKER_ADDRESS_WIDTH";

    private final SteppableModel<S> model;
    private final AnalysisConfiguration configuration;
    private final ProbabilisticModelChecker defaultChecker;

    // append-only until the build starts
    private final ConcurrentLinkedQueue<Formula> formulasToCheck = new ConcurrentLinkedQueue<>();
    private final AtomicBoolean buildStarted = new AtomicBoolean();
    private final AtomicInteger buildCount = new AtomicInteger();

    // written once by the building thread
    private volatile CompactProbabilityMatrix matrix;
    private volatile MatrixCreationStats creationStats;

    public ProbabilityChecker(SteppableModel<S> model) {
        this(model, AnalysisConfiguration.defaultConfiguration());
    }

    public ProbabilityChecker(SteppableModel<S> model, AnalysisConfiguration configuration) {
        this(model, configuration, new ValueIterationModelChecker(configuration));
    }

    public ProbabilityChecker(SteppableModel<S> model,
                              AnalysisConfiguration configuration,
                              ProbabilisticModelChecker defaultChecker) {
        this.model = Objects.requireNonNull(model, "model");
        this.configuration = Objects.requireNonNull(configuration, "configuration").validate();
        this.defaultChecker = Objects.requireNonNull(defaultChecker, "defaultChecker");
    }

    // ========================================================================
    // REGISTRATION
    // ========================================================================

    /**
     * Registers a probability-valued (path) formula.
     */
    public FormulaCalculator<Probability> calculateProbability(Formula formula) {
        return register(formula, FormulaKind.PATH, ProbabilisticModelChecker::calculateProbability);
    }

    /**
     * Registers a boolean-valued (state) formula.
     */
    public FormulaCalculator<Boolean> calculateFormula(Formula formula) {
        return register(formula, FormulaKind.STATE, ProbabilisticModelChecker::calculateFormula);
    }

    /**
     * Registers a reward-valued formula.
     */
    public FormulaCalculator<RewardResult> calculateReward(Formula formula) {
        return register(formula, FormulaKind.REWARD, ProbabilisticModelChecker::calculateReward);
    }

    private <T> FormulaCalculator<T> register(
            Formula formula,
            FormulaKind kind,
            Evaluation<T> evaluation
    ) {
        Objects.requireNonNull(formula, "formula");
        FormulaKindVisitor.requireKind(formula, kind);
        requireBuildNotStarted();
        formulasToCheck.add(formula);
        // a build that started after the first check might not have seen the formula
        if (buildStarted.get()) {
            formulasToCheck.remove(formula);
            requireBuildNotStarted();
        }
        return new FormulaCalculator<>(
                () -> evaluate(defaultChecker, formula, evaluation),
                checker -> evaluate(checker, formula, evaluation)
        );
    }

    private void requireBuildNotStarted() {
        if (buildStarted.get()) {
            throw new OrderingException(
                    REASON_BUILD_ALREADY_STARTED,
                    "formulas must be registered before createProbabilityMatrix() is called"
            );
        }
    }

    private <T> T evaluate(ProbabilisticModelChecker checker, Formula formula, Evaluation<T> evaluation) {
        CompactProbabilityMatrix built = probabilityMatrix();
        requireAddressable(checker, built);
        return evaluation.apply(checker, built, formula);
    }

    private static void requireAddressable(ProbabilisticModelChecker checker, CompactProbabilityMatrix built) {
        if (built.stateCount() > checker.maxAddressableStates()) {
            throw new CapacityException(
                    REASON_CHECKER_ADDRESS_WIDTH,
                    "checker addresses at most " + checker.maxAddressableStates() + " states, matrix has "
                            + built.stateCount()
            );
        }
    }

    // ========================================================================
    // BUILD
    // ========================================================================

    /**
     * Builds the probability matrix exactly once per checker instance.
     * <p>
     * Only the caller winning the start flag performs the build; all others return
     * immediately, possibly before the matrix is published.
     * </p>
     */
    public void createProbabilityMatrix() {
        if (!buildStarted.compareAndSet(false, true)) {
            log.debug("Probability matrix build already started; skipping");
            return;
        }
        buildCount.incrementAndGet();

        List<Formula> formulas = List.copyOf(formulasToCheck);
        log.info("Creating probability matrix for {} formula(s)", formulas.size());
        AnalysisModel<S> analysisModel = AnalysisModel.serialize(model, formulas);

        StateSpaceExplorer<S> explorer = new StateSpaceExplorer<>(
                analysisModel,
                configuration.getWorkerCount(),
                configuration.isUseForwardOptimization(),
                configuration.getModelCapacity()
        );
        ExplorationStats explorationStats = explorer.explore();
        LabeledTransitionMarkovDecisionProcess ltmdp = explorer.ltmdp();
        int ltmdpSize = ltmdp.continuationGraphSize();

        long conversionStarted = System.nanoTime();
        NestedMarkovDecisionProcess nmdp = new LtmdpToNmdpConverter(
                ltmdp, configuration.getModelCapacity(), ModelCapacity.MAX_ARENA_SIZE
        ).convert();
        long conversionNanos = System.nanoTime() - conversionStarted;

        long derivationStarted = System.nanoTime();
        CompactProbabilityMatrix built = CompactProbabilityMatrix.derive(nmdp);
        long derivationNanos = System.nanoTime() - derivationStarted;
        requireAddressable(defaultChecker, built);

        creationStats = MatrixCreationStats.builder()
                .exploration(explorationStats)
                .ltmdpContinuationGraphSize(ltmdpSize)
                .nmdpStateCount(nmdp.stateCount())
                .nmdpContinuationGraphSize(nmdp.continuationGraphSize())
                .distributionCount(built.distributionCount())
                .transitionCount(built.transitionCount())
                .conversionNanos(conversionNanos)
                .derivationNanos(derivationNanos)
                .build();
        // publish last: readers check the matrix field first
        matrix = built;
    }

    // ========================================================================
    // READ ACCESS
    // ========================================================================

    public boolean isMatrixCreated() {
        return matrix != null;
    }

    /**
     * @throws OrderingException when the matrix has not been published yet.
     */
    public CompactProbabilityMatrix probabilityMatrix() {
        CompactProbabilityMatrix built = matrix;
        if (built == null) {
            throw new OrderingException(REASON_MATRIX_NOT_CREATED, "createProbabilityMatrix() has not completed");
        }
        return built;
    }

    /**
     * @throws OrderingException when the matrix has not been published yet.
     */
    public MatrixCreationStats creationStats() {
        probabilityMatrix();
        return creationStats;
    }

    public AnalysisConfiguration configuration() {
        return configuration;
    }

    int buildCount() {
        return buildCount.get();
    }

    @FunctionalInterface
    private interface Evaluation<T> {
        T apply(ProbabilisticModelChecker checker, CompactProbabilityMatrix matrix, Formula formula);
    }
}
