package org.Aayush.probcheck.core.error;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Objects;

/**
 * Base type of all analysis faults.
 *
 * <p>Faults are raised eagerly when a local precondition fails and are never retried:
 * exploration and conversion are deterministic functions of the model, so a failed run
 * has to be re-executed as a whole. Messages are prefixed with a deterministic reason code.</p>
 */
@Getter
@Accessors(fluent = true)
public abstract class AnalysisException extends RuntimeException {
    private final String reasonCode;

    protected AnalysisException(String reasonCode, String message) {
        this(reasonCode, message, null);
    }

    protected AnalysisException(String reasonCode, String message, Throwable cause) {
        super(prefixed(validCode(reasonCode), message), cause);
        this.reasonCode = reasonCode;
    }

    private static String prefixed(String code, String message) {
        Objects.requireNonNull(message, "message");
        return "[" + code + "] " + message;
    }

    private static String validCode(String reasonCode) {
        Objects.requireNonNull(reasonCode, "reasonCode");
        if (reasonCode.isBlank()) {
            throw new IllegalArgumentException("blank reason code for fault type");
        }
        return reasonCode;
    }
}
