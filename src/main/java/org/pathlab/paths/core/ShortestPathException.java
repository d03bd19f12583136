package org.pathlab.paths.core;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;

import java.util.Objects;

/**
 * Base failure of the shortest-path entry points.
 *
 * <p>Every instance carries a {@link Reason}; the message is prefixed with the reason code in
 * brackets so log lines stay greppable.</p>
 */
@Getter
public class ShortestPathException extends RuntimeException {

    /**
     * Failure categories with their stable external codes.
     */
    @Getter
    @Accessors(fluent = true)
    @RequiredArgsConstructor
    public enum Reason {
        NODE_NOT_FOUND("BMSSP_NODE_NOT_FOUND"),
        NO_PATH("BMSSP_NO_PATH"),
        UNDIRECTED_GRAPH("BMSSP_UNDIRECTED_GRAPH"),
        SEARCH_BUDGET_EXCEEDED("BMSSP_SEARCH_BUDGET_EXCEEDED");

        /** Code written in front of the message. */
        private final String code;
    }

    private final Reason reason;

    public ShortestPathException(Reason reason, String message) {
        this(reason, message, null);
    }

    public ShortestPathException(Reason reason, String message, Throwable cause) {
        super("[" + Objects.requireNonNull(reason, "reason").code() + "] " + message, cause);
        this.reason = reason;
    }

    public String getReasonCode() {
        return reason.code();
    }
}
