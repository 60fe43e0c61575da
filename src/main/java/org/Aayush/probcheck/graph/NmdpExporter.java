package org.Aayush.probcheck.graph;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import lombok.experimental.UtilityClass;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Diagnostic renderings of a sealed NMDP.
 */
@UtilityClass
public class NmdpExporter {

    /**
     * Renders states and continuation graphs as a GraphViz digraph.
     * <p>
     * States are boxes named {@code s<i>}; continuation locations are points or diamonds named
     * {@code c<loc>}. Forward edges are dashed.
     * </p>
     */
    public String toDot(NestedMarkovDecisionProcess nmdp) {
        Objects.requireNonNull(nmdp, "nmdp");
        StringBuilder sb = new StringBuilder();
        sb.append("digraph NMDP {\n");
        sb.append("  initial [shape=point];\n");
        sb.append("  initial -> c").append(nmdp.rootLocationOfInitialState()).append(";\n");
        for (int state = 0; state < nmdp.stateCount(); state++) {
            sb.append("  s").append(state)
                    .append(" [shape=box, label=\"").append(state).append(' ')
                    .append(labelText(nmdp.stateFormulaLabels(), nmdp.stateLabeling(state).bits()))
                    .append("\"];\n");
            sb.append("  s").append(state).append(" -> c").append(nmdp.rootLocationOfState(state)).append(";\n");
        }
        for (int location = 0; location < nmdp.continuationGraphSize(); location++) {
            ChoiceKind kind = nmdp.kind(location);
            String probability = format(nmdp.probability(location));
            switch (kind) {
                case LEAF -> {
                    sb.append("  c").append(location).append(" [shape=point];\n");
                    sb.append("  c").append(location).append(" -> s").append(nmdp.to(location))
                            .append(" [label=\"").append(probability).append("\"];\n");
                }
                case FORWARD -> {
                    sb.append("  c").append(location).append(" [shape=point];\n");
                    sb.append("  c").append(location).append(" -> c").append(nmdp.to(location))
                            .append(" [style=dashed, label=\"").append(probability).append("\"];\n");
                }
                case PROBABILISTIC, NONDETERMINISTIC -> {
                    sb.append("  c").append(location)
                            .append(kind == ChoiceKind.NONDETERMINISTIC ? " [shape=diamond, label=\"n\"];\n" : " [shape=circle, label=\"p\"];\n");
                    for (int child = nmdp.from(location); child <= nmdp.to(location); child++) {
                        sb.append("  c").append(location).append(" -> c").append(child)
                                .append(" [label=\"").append(format(nmdp.probability(child))).append("\"];\n");
                    }
                }
            }
        }
        sb.append("}\n");
        return sb.toString();
    }

    /**
     * Lists every state with its labeling and distributions, one transition per line.
     */
    public String dump(NestedMarkovDecisionProcess nmdp) {
        Objects.requireNonNull(nmdp, "nmdp");
        StringBuilder sb = new StringBuilder();
        NmdpDistributionEnumerator enumerator = nmdp.distributionEnumerator();
        sb.append("initial\n");
        enumerator.selectInitialState();
        appendDistributions(sb, enumerator);
        for (int state = 0; state < nmdp.stateCount(); state++) {
            sb.append("state ").append(state)
                    .append(' ').append(labelText(nmdp.stateFormulaLabels(), nmdp.stateLabeling(state).bits()))
                    .append('\n');
            enumerator.selectState(state);
            appendDistributions(sb, enumerator);
        }
        return sb.toString();
    }

    private void appendDistributions(StringBuilder sb, NmdpDistributionEnumerator enumerator) {
        while (enumerator.moveNextDistribution()) {
            sb.append("  distribution ").append(enumerator.currentDistributionIndex()).append('\n');
            while (enumerator.moveNextTransition()) {
                sb.append("    -> ").append(enumerator.currentTargetState())
                        .append(" : ").append(format(enumerator.currentProbability())).append('\n');
            }
        }
    }

    /**
     * Follows, for up to {@code steps} steps, the single most probable transition over all
     * distributions of the current state, starting with the initial distributions.
     * Ties keep the first transition found.
     *
     * @return visited states in order; at most {@code steps} entries.
     */
    public int[] pathWithStepwiseHighestProbability(NestedMarkovDecisionProcess nmdp, int steps) {
        Objects.requireNonNull(nmdp, "nmdp");
        if (steps < 0) {
            throw new IllegalArgumentException("steps must be non-negative");
        }
        IntArrayList path = new IntArrayList(steps);
        NmdpDistributionEnumerator enumerator = nmdp.distributionEnumerator();
        enumerator.selectInitialState();
        for (int step = 0; step < steps; step++) {
            int best = -1;
            double bestProbability = -1.0d;
            while (enumerator.moveNextDistribution()) {
                while (enumerator.moveNextTransition()) {
                    if (enumerator.currentProbability() > bestProbability) {
                        bestProbability = enumerator.currentProbability();
                        best = enumerator.currentTargetState();
                    }
                }
            }
            if (best < 0) {
                break;
            }
            path.add(best);
            enumerator.selectState(best);
        }
        return path.toIntArray();
    }

    private String labelText(List<String> labels, long bits) {
        StringBuilder sb = new StringBuilder("{");
        boolean first = true;
        for (int i = 0; i < labels.size(); i++) {
            if ((bits & (1L << i)) != 0) {
                if (!first) {
                    sb.append(',');
                }
                sb.append(labels.get(i));
                first = false;
            }
        }
        return sb.append('}').toString();
    }

    private String format(double probability) {
        return String.format(Locale.ROOT, "%.4g", probability);
    }
}
