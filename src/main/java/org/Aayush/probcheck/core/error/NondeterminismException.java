package org.Aayush.probcheck.core.error;

/**
 * A replayed path did not reproduce the choices recorded for it; the model violates the replay contract.
 */
public final class NondeterminismException extends AnalysisException {

    public NondeterminismException(String reasonCode, String message) {
        super(reasonCode, message);
    }

    public NondeterminismException(String reasonCode, String message, Throwable cause) {
        super(reasonCode, message, cause);
    }
}
