package com.questrail.governance.api;

import java.time.Instant;
import java.util.Objects;

/**
 * A single agent's vote on a single proposal.
 *
 * @param voter   the agent that voted
 * @param approve {@code true} for yes, {@code false} for no
 * @param weight  the voter's power at the time the vote was cast
 * @param castAt  ledger time of the vote
 */
public record CastVote(
        AgentId voter,
        boolean approve,
        long weight,
        Instant castAt
) {
    public CastVote {
        Objects.requireNonNull(voter, "voter");
        Objects.requireNonNull(castAt, "castAt");
    }
}
