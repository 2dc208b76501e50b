package org.ismcore.analysis.core;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Objects;

/**
 * Analysis contract failure with a deterministic reason code.
 *
 * <p>Messages are prefixed with the reason code, e.g. {@code [ISM_INVALID_INPUT] ...}.</p>
 */
@Getter
@Accessors(fluent = true)
public final class IsmAnalysisException extends RuntimeException {
    private final String reasonCode;

    /**
     * Creates a reason-coded analysis failure.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive message.
     */
    public IsmAnalysisException(String reasonCode, String message) {
        super(formatMessage(reasonCode, message));
        this.reasonCode = requireReasonCode(reasonCode);
    }

    /**
     * Creates a reason-coded analysis failure with a cause.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive message.
     * @param cause underlying exception.
     */
    public IsmAnalysisException(String reasonCode, String message, Throwable cause) {
        super(formatMessage(reasonCode, message), cause);
        this.reasonCode = requireReasonCode(reasonCode);
    }

    private static String formatMessage(String reasonCode, String message) {
        return "[" + requireReasonCode(reasonCode) + "] " + Objects.requireNonNull(message, "message");
    }

    private static String requireReasonCode(String reasonCode) {
        String code = Objects.requireNonNull(reasonCode, "reasonCode");
        if (code.isBlank()) {
            throw new IllegalArgumentException("reasonCode must be non-blank");
        }
        return code;
    }
}
