package com.questrail.governance.api;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * ConsensusDecision
 * -----------------------------------------------------------------------------
 * A finalized multi-agent decision produced by an external evaluation process
 * and recorded exactly once under its {@code requestId}.
 *
 * <p>The ordering of {@code participatingAgents} is informational only.
 * Records are immutable; a second submission under the same request id is
 * rejected rather than merged or overwritten.</p>
 */
public record ConsensusDecision(
        String requestId,
        String decisionType,
        String finalDecision,
        double consensusConfidence,
        List<String> participatingAgents,
        Instant timestamp,
        String proofHash,
        boolean validated,
        AgentId recordedBy
) {
    public ConsensusDecision {
        Objects.requireNonNull(requestId, "requestId");
        Objects.requireNonNull(decisionType, "decisionType");
        Objects.requireNonNull(finalDecision, "finalDecision");
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(proofHash, "proofHash");
        Objects.requireNonNull(recordedBy, "recordedBy");
        participatingAgents = List.copyOf(participatingAgents);
    }
}
