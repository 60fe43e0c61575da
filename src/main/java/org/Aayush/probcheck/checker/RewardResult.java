package org.Aayush.probcheck.checker;

/**
 * Expected cumulative reward in the initial distribution.
 *
 * @param value expected reward under the selected extremum.
 * @param steps number of steps accumulated.
 */
public record RewardResult(double value, int steps) {
}
