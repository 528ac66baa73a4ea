package com.questrail.governance.api;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Proposal
 * -----------------------------------------------------------------------------
 * Immutable snapshot of a governance proposal.
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   Created → Voting → {Passed | Failed} → Executed
 *                 \________________________/
 *                          Cancelled
 * </pre>
 * <p>
 * Voting is open on the closed interval {@code [votingStart, votingEnd]}.
 * Execution becomes possible strictly after {@code votingEnd} and no earlier
 * than {@link #executableAt()}.
 *
 * <h2>Invariants</h2>
 * <ul>
 *   <li>{@code votingStart <= votingEnd}</li>
 *   <li>{@code yesVotes} and {@code noVotes} never decrease</li>
 *   <li>{@code executed} and {@code cancelled} are terminal and exclusive</li>
 * </ul>
 *
 * Per-agent votes are not part of this snapshot; they live in the ledger's
 * vote table and are reached through {@link GovernanceLedger#getVote}.
 */
public record Proposal(
        long id,
        AgentId proposer,
        String proposalType,
        String contentHash,
        Instant votingStart,
        Instant votingEnd,
        Duration executionDelay,
        long yesVotes,
        long noVotes,
        boolean executed,
        boolean cancelled
)
{
    public Proposal {
        Objects.requireNonNull(proposer, "proposer");
        Objects.requireNonNull(proposalType, "proposalType");
        Objects.requireNonNull(contentHash, "contentHash");
        Objects.requireNonNull(votingStart, "votingStart");
        Objects.requireNonNull(votingEnd, "votingEnd");
        Objects.requireNonNull(executionDelay, "executionDelay");

        if (id < 1) {
            throw new IllegalArgumentException("id must be >= 1");
        }
        if (votingEnd.isBefore(votingStart)) {
            throw new IllegalArgumentException("votingEnd must not precede votingStart");
        }
        if (yesVotes < 0 || noVotes < 0) {
            throw new IllegalArgumentException("tallies must be non-negative");
        }
        if (executed && cancelled) {
            throw new IllegalArgumentException("a proposal cannot be both executed and cancelled");
        }
    }

    // ---------------------------------------------------------------------
    // Factory / transitions
    // ---------------------------------------------------------------------

    /**
     * Creates a fresh proposal whose voting window opens at {@code now}.
     */
    public static Proposal open(long id,
                                AgentId proposer,
                                String proposalType,
                                String contentHash,
                                Instant now,
                                Duration votingPeriod,
                                Duration executionDelay) {
        return new Proposal(id, proposer, proposalType, contentHash,
                now, now.plus(votingPeriod), executionDelay,
                0L, 0L, false, false);
    }

    public Proposal withVote(boolean approve, long weight) {
        if (weight <= 0) {
            throw new IllegalArgumentException("weight must be positive");
        }
        return new Proposal(id, proposer, proposalType, contentHash,
                votingStart, votingEnd, executionDelay,
                approve ? Math.addExact(yesVotes, weight) : yesVotes,
                approve ? noVotes : Math.addExact(noVotes, weight),
                executed, cancelled);
    }

    public Proposal markExecuted() {
        return new Proposal(id, proposer, proposalType, contentHash,
                votingStart, votingEnd, executionDelay,
                yesVotes, noVotes, true, cancelled);
    }

    public Proposal markCancelled() {
        return new Proposal(id, proposer, proposalType, contentHash,
                votingStart, votingEnd, executionDelay,
                yesVotes, noVotes, executed, true);
    }

    // ---------------------------------------------------------------------
    // Derived facts
    // ---------------------------------------------------------------------

    public long totalVotes() {
        return yesVotes + noVotes;
    }

    /**
     * Earliest instant at which execution may be attempted.
     */
    public Instant executableAt() {
        return votingEnd.plus(executionDelay);
    }

    public boolean isTerminal() {
        return executed || cancelled;
    }

    public boolean isVotingOpen(Instant now) {
        return !now.isBefore(votingStart) && !now.isAfter(votingEnd);
    }

    public boolean hasVotingEnded(Instant now) {
        return now.isAfter(votingEnd);
    }

    /**
     * Strict majority; a tie does not pass.
     */
    public boolean hasMajority() {
        return yesVotes > noVotes;
    }
}
