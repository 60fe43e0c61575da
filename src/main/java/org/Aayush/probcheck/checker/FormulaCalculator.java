package org.Aayush.probcheck.checker;

import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Deferred evaluation of one registered formula.
 *
 * <p>Both closures may only be invoked after the probability matrix was created.</p>
 *
 * @param <T> result type ({@code Probability}, {@code Boolean} or {@link RewardResult}).
 */
public record FormulaCalculator<T>(Supplier<T> defaultCalculation,
                                   Function<ProbabilisticModelChecker, T> customCalculation) {

    public FormulaCalculator {
        Objects.requireNonNull(defaultCalculation, "defaultCalculation");
        Objects.requireNonNull(customCalculation, "customCalculation");
    }

    /**
     * Evaluates with the checker's default numeric back end.
     */
    public T calculate() {
        return defaultCalculation.get();
    }

    /**
     * Evaluates with {@code checker}.
     */
    public T calculateWith(ProbabilisticModelChecker checker) {
        return customCalculation.apply(Objects.requireNonNull(checker, "checker"));
    }
}
