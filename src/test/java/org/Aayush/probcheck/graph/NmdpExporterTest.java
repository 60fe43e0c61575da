package org.Aayush.probcheck.graph;

import org.Aayush.probcheck.exploration.StateSpaceExplorer;
import org.Aayush.probcheck.model.AnalysisModel;
import org.Aayush.probcheck.testutil.ForwardingModel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NmdpExporterTest {

    private NestedMarkovDecisionProcess nmdp;

    @BeforeEach
    void setUp() {
        StateSpaceExplorer<Integer> explorer = new StateSpaceExplorer<>(
                AnalysisModel.serialize(new ForwardingModel(), List.of()), 1, true, ModelCapacity.defaultCapacity());
        explorer.explore();
        nmdp = new LtmdpToNmdpConverter(explorer.ltmdp()).convert();
    }

    @Test
    @DisplayName("Dot export names every state and draws forwards dashed")
    void testDotExport() {
        String dot = NmdpExporter.toDot(nmdp);

        assertTrue(dot.startsWith("digraph NMDP {"));
        assertTrue(dot.trim().endsWith("}"));
        for (int state = 0; state < nmdp.stateCount(); state++) {
            assertTrue(dot.contains("  s" + state + " [shape=box"), "state " + state);
        }
        assertTrue(dot.contains("style=dashed"));
        assertTrue(dot.contains("shape=diamond"));
    }

    @Test
    @DisplayName("Textual dump lists the initial distribution and every state")
    void testDump() {
        String dump = NmdpExporter.dump(nmdp);

        assertTrue(dump.startsWith("initial\n  distribution 0\n    -> 0 : 1.000\n"));
        assertTrue(dump.contains("state 3 {}"));
        assertTrue(dump.contains("    -> 3 : 0.5000"));
    }

    @Test
    @DisplayName("Stepwise most probable path follows the heaviest transition")
    void testPathWithStepwiseHighestProbability() {
        assertArrayEquals(new int[]{0, 3, 3}, NmdpExporter.pathWithStepwiseHighestProbability(nmdp, 3));
        assertEquals(0, NmdpExporter.pathWithStepwiseHighestProbability(nmdp, 0).length);
        assertThrows(IllegalArgumentException.class, () -> NmdpExporter.pathWithStepwiseHighestProbability(nmdp, -1));
    }
}
