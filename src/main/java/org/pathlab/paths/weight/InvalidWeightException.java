package org.pathlab.paths.weight;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Objects;

/**
 * Thrown when a resolved edge weight cannot be used for shortest-path search.
 *
 * <p>Messages are prefixed with deterministic reason-code text.</p>
 */
@Getter
@Accessors(fluent = true)
public final class InvalidWeightException extends IllegalArgumentException {
    private final String reasonCode;

    /**
     * Creates a reason-coded weight failure.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive message.
     */
    public InvalidWeightException(String reasonCode, String message) {
        super("[" + requireReasonCode(reasonCode) + "] " + Objects.requireNonNull(message, "message"));
        this.reasonCode = reasonCode;
    }

    private static String requireReasonCode(String reasonCode) {
        String code = Objects.requireNonNull(reasonCode, "reasonCode");
        if (code.isBlank()) {
            throw new IllegalArgumentException("reasonCode must be non-blank");
        }
        return code;
    }
}
