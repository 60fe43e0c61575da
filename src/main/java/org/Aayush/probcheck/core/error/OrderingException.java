package org.Aayush.probcheck.core.error;

/**
 * An operation was invoked before its precondition was established (query before build, conversion before exploration).
 */
public final class OrderingException extends AnalysisException {

    public OrderingException(String reasonCode, String message) {
        super(reasonCode, message);
    }

    public OrderingException(String reasonCode, String message, Throwable cause) {
        super(reasonCode, message, cause);
    }
}
