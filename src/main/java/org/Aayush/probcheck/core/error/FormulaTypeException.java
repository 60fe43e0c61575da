package org.Aayush.probcheck.core.error;

/**
 * A formula of the wrong semantic kind was passed to an operation, or the formula is malformed.
 */
public final class FormulaTypeException extends AnalysisException {

    public FormulaTypeException(String reasonCode, String message) {
        super(reasonCode, message);
    }

    public FormulaTypeException(String reasonCode, String message, Throwable cause) {
        super(reasonCode, message, cause);
    }
}
