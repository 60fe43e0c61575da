package org.Aayush.probcheck.core.error;

/**
 * An id, arena location or buffer position exceeds the configured addressing width or capacity.
 */
public final class CapacityException extends AnalysisException {

    public CapacityException(String reasonCode, String message) {
        super(reasonCode, message);
    }

    public CapacityException(String reasonCode, String message, Throwable cause) {
        super(reasonCode, message, cause);
    }
}
