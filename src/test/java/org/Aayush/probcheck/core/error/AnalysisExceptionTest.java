package org.Aayush.probcheck.core.error;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AnalysisExceptionTest {

    @Test
    @DisplayName("Message carries the reason code prefix and the cause is kept")
    void testReasonCodeFormatting() {
        IllegalStateException cause = new IllegalStateException("boom");
        OrderingException ex = new OrderingException("PC_MATRIX_NOT_CREATED", "not yet", cause);

        assertEquals("PC_MATRIX_NOT_CREATED", ex.reasonCode());
        assertEquals("[PC_MATRIX_NOT_CREATED] not yet", ex.getMessage());
        assertSame(cause, ex.getCause());
        assertInstanceOf(AnalysisException.class, ex);
    }

    @Test
    @DisplayName("Blank or null reason codes are rejected")
    void testReasonCodeValidation() {
        assertThrows(IllegalArgumentException.class, () -> new CapacityException(" ", "x"));
        assertThrows(NullPointerException.class, () -> new NondeterminismException(null, "x"));
        assertThrows(NullPointerException.class, () -> new FormulaTypeException("FM_MALFORMED", null));
    }
}
