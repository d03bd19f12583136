package org.pathlab.paths.core;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Per-call deterministic bound on frontier work.
 *
 * <p>Unbounded unless configured through {@value #PROP_MAX_FRONTIER_PULLS} or
 * {@link #of(int)}. Correct inputs never need the bound; it is a guard against
 * pathological graphs in latency-sensitive callers.</p>
 */
public final class BmsspSearchBudget {
    public static final int UNBOUNDED = Integer.MAX_VALUE;

    static final String REASON_FRONTIER_PULLS_EXCEEDED = "BMSSP_BUDGET_FRONTIER_PULLS_EXCEEDED";

    public static final String PROP_MAX_FRONTIER_PULLS = "pathlab.bmssp.maxFrontierPulls";

    @Getter
    @Accessors(fluent = true)
    private final int maxFrontierPulls;

    private BmsspSearchBudget(int maxFrontierPulls) {
        this.maxFrontierPulls = normalizeBound(maxFrontierPulls);
    }

    /**
     * Creates a budget with an explicit bound; {@code <= 0} means unbounded.
     */
    public static BmsspSearchBudget of(int maxFrontierPulls) {
        return new BmsspSearchBudget(maxFrontierPulls);
    }

    public static BmsspSearchBudget unbounded() {
        return new BmsspSearchBudget(UNBOUNDED);
    }

    /**
     * Loads the budget from system properties.
     */
    public static BmsspSearchBudget defaults() {
        return BmsspSearchBudget.of(readBound(PROP_MAX_FRONTIER_PULLS));
    }

    /**
     * Validates the running frontier pull count against the configured bound.
     */
    void checkFrontierPulls(long pulls) {
        if (pulls > maxFrontierPulls) {
            throw new BudgetExceededException(
                    REASON_FRONTIER_PULLS_EXCEEDED,
                    "frontier pull budget exceeded: " + pulls + " > " + maxFrontierPulls
            );
        }
    }

    private static int normalizeBound(int bound) {
        if (bound <= 0) {
            return UNBOUNDED;
        }
        return bound;
    }

    private static int readBound(String property) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return UNBOUNDED;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException ex) {
            return UNBOUNDED;
        }
    }

    /**
     * Deterministic exception for budget fail-fast paths.
     */
    @Getter
    @Accessors(fluent = true)
    static final class BudgetExceededException extends RuntimeException {
        private final String reasonCode;

        BudgetExceededException(String reasonCode, String message) {
            super(message);
            this.reasonCode = reasonCode;
        }
    }
}
