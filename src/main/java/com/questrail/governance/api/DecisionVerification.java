package com.questrail.governance.api;

import java.util.Objects;

/**
 * Result of verifying a consensus decision by request id.
 *
 * <p>Unknown ids verify as {@code (false, "", 0)}; verification never fails.</p>
 */
public record DecisionVerification(
        boolean valid,
        String decision,
        double confidence
) {
    private static final DecisionVerification UNKNOWN = new DecisionVerification(false, "", 0.0);

    public DecisionVerification {
        Objects.requireNonNull(decision, "decision");
    }

    public static DecisionVerification unknown() {
        return UNKNOWN;
    }

    public static DecisionVerification of(ConsensusDecision decision) {
        return new DecisionVerification(decision.validated(),
                decision.finalDecision(),
                decision.consensusConfidence());
    }
}
