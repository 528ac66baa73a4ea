package com.questrail.governance.api;

import java.util.Objects;

/**
 * Point-in-time tally of a proposal, including whether it can be executed now.
 */
public record ProposalTally(
        long proposalId,
        ProposalStatus status,
        long yesVotes,
        long noVotes,
        long totalVotes,
        boolean quorumMet,
        boolean votingEnded,
        boolean executionReady
) {
    public ProposalTally {
        Objects.requireNonNull(status, "status");
    }
}
