package org.Aayush.probcheck.exploration;

import org.Aayush.probcheck.graph.ChoiceKind;
import org.Aayush.probcheck.graph.LtmdpStepGraph;
import org.Aayush.probcheck.testutil.ForwardingModel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LtmdpChoiceResolverTest {

    private static int recordState(LtmdpChoiceResolver resolver, int state) {
        ForwardingModel model = new ForwardingModel();
        int paths = 0;
        resolver.prepareNextState();
        while (resolver.prepareNextPath()) {
            model.step(state, resolver);
            resolver.stepGraph().setLeafTarget(resolver.currentContinuationId(), paths++);
        }
        return paths;
    }

    @Test
    @DisplayName("Forwarded branch becomes a forward node onto the first sibling")
    void testForwardRecording() {
        LtmdpStepGraph graph = new LtmdpStepGraph();
        LtmdpChoiceResolver resolver = new LtmdpChoiceResolver(graph, true);

        assertEquals(3, recordState(resolver, 0));
        assertEquals(6, graph.size());

        assertEquals(ChoiceKind.NONDETERMINISTIC, graph.kind(0));
        assertEquals(1, graph.from(0));
        assertEquals(2, graph.to(0));

        assertEquals(ChoiceKind.PROBABILISTIC, graph.kind(1));
        assertEquals(3, graph.from(1));
        assertEquals(5, graph.to(1));
        assertEquals(1.0d, graph.probability(1));

        assertEquals(ChoiceKind.FORWARD, graph.kind(2));
        assertEquals(1, graph.to(2));
        assertEquals(1.0d, graph.probability(2));

        for (int leaf = 3; leaf <= 5; leaf++) {
            assertEquals(ChoiceKind.LEAF, graph.kind(leaf));
            assertEquals(leaf - 3, graph.to(leaf));
            assertEquals(ForwardingModel.SPLIT[leaf - 3], graph.probability(leaf), 1e-12);
        }
    }

    @Test
    @DisplayName("Without forwarding the second branch is expanded again")
    void testNoForwardRecording() {
        LtmdpStepGraph graph = new LtmdpStepGraph();
        LtmdpChoiceResolver resolver = new LtmdpChoiceResolver(graph, false);

        assertEquals(6, recordState(resolver, 0));
        assertEquals(9, graph.size());
        assertEquals(ChoiceKind.PROBABILISTIC, graph.kind(2));
        assertEquals(6, graph.from(2));
        assertEquals(8, graph.to(2));
    }

    @Test
    @DisplayName("A state without choices records only its root leaf")
    void testNoChoices() {
        LtmdpStepGraph graph = new LtmdpStepGraph();
        LtmdpChoiceResolver resolver = new LtmdpChoiceResolver(graph, true);

        assertEquals(1, recordState(resolver, 2));
        assertEquals(1, graph.size());
        assertEquals(LtmdpStepGraph.ROOT, resolver.currentContinuationId());
        assertEquals(ChoiceKind.LEAF, graph.kind(LtmdpStepGraph.ROOT));
        assertFalse(graph.isUnresolved(LtmdpStepGraph.ROOT));
    }

    @Test
    @DisplayName("Preparing the next state resets the step graph")
    void testPrepareNextStateClearsGraph() {
        LtmdpStepGraph graph = new LtmdpStepGraph();
        LtmdpChoiceResolver resolver = new LtmdpChoiceResolver(graph, true);
        recordState(resolver, 0);

        resolver.prepareNextState();
        assertEquals(1, graph.size());
        assertTrue(graph.isUnresolved(LtmdpStepGraph.ROOT));
        assertThrows(UnsupportedOperationException.class, () -> resolver.setChoices(0));
    }
}
