package com.questrail.governance.core;

import com.questrail.governance.api.Agent;
import com.questrail.governance.api.AgentId;
import com.questrail.governance.api.CastVote;
import com.questrail.governance.api.GovernanceException;
import com.questrail.governance.api.Proposal;
import com.questrail.governance.api.ProposalStatus;
import com.questrail.governance.api.ProposalTally;
import com.questrail.governance.config.GovernanceConfig;
import com.questrail.governance.execution.ProposalHandlerRegistry;
import com.questrail.governance.store.LedgerStorageException;
import com.questrail.governance.store.LedgerStore;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

import static com.questrail.governance.api.GovernanceErrorKind.ALREADY_VOTED;
import static com.questrail.governance.api.GovernanceErrorKind.INVALID_STATE;
import static com.questrail.governance.api.GovernanceErrorKind.NOT_FOUND;
import static com.questrail.governance.api.GovernanceErrorKind.PROPOSAL_REJECTED;
import static com.questrail.governance.api.GovernanceErrorKind.QUORUM_NOT_MET;

/**
 * ProposalEngine
 * -----------------------------------------------------------------------------
 * Proposal lifecycle: creation, time-boxed voting, tallying, delayed execution
 * and cancellation.
 *
 * <h2>Role in the architecture</h2>
 * Every transition takes the current ledger time as an explicit argument and
 * either commits a new immutable {@link Proposal} to the store or throws a
 * {@link GovernanceException} without touching the store. Caller
 * authorization (active agent, administrator) and the pause gate are checked
 * by {@link GovernanceEngine} before these methods run. Callers must hold the
 * ledger write lock for mutations and at least the read lock for queries.
 *
 * <h2>Timing rules</h2>
 * <pre>
 *   votingStart ≤ now ≤ votingEnd             → votes accepted
 *   now > votingEnd and now ≥ executableAt    → execution may be attempted
 * </pre>
 *
 * <h2>Quorum</h2>
 * Quorum compares the summed voting power ({@code yes + no}) against
 * {@link GovernanceConfig#quorumThreshold()}, not the number of voters.
 */
final class ProposalEngine
{
    /**
     * Result of a successful vote.
     *
     * @param proposal the proposal with the vote applied
     * @param vote     the stored vote
     */
    record VoteOutcome(Proposal proposal, CastVote vote) {}

    /**
     * Result of a successful execution.
     *
     * @param proposal the proposal, now marked executed
     * @param success  the handler's report; {@code false} for unrecognized types
     */
    record ExecutionOutcome(Proposal proposal, boolean success) {}

    private final LedgerStore store;
    private final GovernanceConfig config;
    private final ProposalHandlerRegistry handlers;

    ProposalEngine(LedgerStore store, GovernanceConfig config, ProposalHandlerRegistry handlers) {
        this.store = Objects.requireNonNull(store, "store");
        this.config = Objects.requireNonNull(config, "config");
        this.handlers = Objects.requireNonNull(handlers, "handlers");
    }

    // ---------------------------------------------------------------------
    // Transitions
    // ---------------------------------------------------------------------

    Proposal create(Agent proposer, String proposalType, String contentHash, Instant now) {
        Objects.requireNonNull(proposer, "proposer");
        Objects.requireNonNull(proposalType, "proposalType");
        Objects.requireNonNull(contentHash, "contentHash");

        // Ids are dense and proposals are never deleted, so count + 1 is the next id.
        long id = store.proposalCount() + 1;

        Proposal proposal = Proposal.open(id, proposer.id(), proposalType, contentHash,
                now, config.votingPeriod(), config.executionDelay());
        store.saveProposal(proposal);
        return proposal;
    }

    VoteOutcome vote(Agent voter, long proposalId, boolean approve, Instant now) {
        Objects.requireNonNull(voter, "voter");

        Proposal proposal = require(proposalId);

        if (proposal.isTerminal()) {
            throw GovernanceException.of(INVALID_STATE,
                    "proposal %d is %s", proposalId, proposal.executed() ? "executed" : "cancelled");
        }
        if (!proposal.isVotingOpen(now)) {
            throw GovernanceException.of(INVALID_STATE,
                    "voting on proposal %d is open from %s to %s, not at %s",
                    proposalId, proposal.votingStart(), proposal.votingEnd(), now);
        }
        if (store.findVote(proposalId, voter.id()).isPresent()) {
            throw GovernanceException.of(ALREADY_VOTED,
                    "%s has already voted on proposal %d", voter.id(), proposalId);
        }

        CastVote vote = new CastVote(voter.id(), approve, voter.votingPower(), now);
        Proposal updated = proposal.withVote(approve, voter.votingPower());

        // Tally first, then the vote row. If the vote row fails the tally is
        // restored, so a stored vote always implies a counted vote.
        store.saveProposal(updated);
        try {
            store.saveVote(proposalId, vote);
        } catch (LedgerStorageException e) {
            try {
                store.saveProposal(proposal);
            } catch (LedgerStorageException restoreFailure) {
                e.addSuppressed(restoreFailure);
            }
            throw e;
        }
        return new VoteOutcome(updated, vote);
    }

    ExecutionOutcome execute(long proposalId, Instant now) {
        Proposal proposal = require(proposalId);

        if (proposal.executed()) {
            throw GovernanceException.of(INVALID_STATE, "proposal %d is already executed", proposalId);
        }
        if (proposal.cancelled()) {
            throw GovernanceException.of(INVALID_STATE, "proposal %d is cancelled", proposalId);
        }
        if (!proposal.hasVotingEnded(now)) {
            throw GovernanceException.of(INVALID_STATE,
                    "voting on proposal %d is still open until %s", proposalId, proposal.votingEnd());
        }
        if (now.isBefore(proposal.executableAt())) {
            throw GovernanceException.of(INVALID_STATE,
                    "proposal %d is in its execution delay until %s", proposalId, proposal.executableAt());
        }
        if (!isQuorumMet(proposal)) {
            throw GovernanceException.of(QUORUM_NOT_MET,
                    "proposal %d has %d voting power against a quorum of %d",
                    proposalId, proposal.totalVotes(), config.quorumThreshold());
        }
        if (!proposal.hasMajority()) {
            throw GovernanceException.of(PROPOSAL_REJECTED,
                    "proposal %d did not pass (yes=%d, no=%d)",
                    proposalId, proposal.yesVotes(), proposal.noVotes());
        }

        // Dispatch before committing: a handler that throws leaves the proposal unexecuted.
        boolean success = handlers.dispatch(proposal);

        Proposal executed = proposal.markExecuted();
        store.saveProposal(executed);
        return new ExecutionOutcome(executed, success);
    }

    Proposal cancel(long proposalId) {
        Proposal proposal = require(proposalId);

        if (proposal.isTerminal()) {
            throw GovernanceException.of(INVALID_STATE,
                    "proposal %d is already %s", proposalId, proposal.executed() ? "executed" : "cancelled");
        }

        Proposal cancelled = proposal.markCancelled();
        store.saveProposal(cancelled);
        return cancelled;
    }

    // ---------------------------------------------------------------------
    // Queries
    // ---------------------------------------------------------------------

    Optional<Proposal> find(long proposalId) {
        return store.findProposal(proposalId);
    }

    boolean hasVoted(long proposalId, AgentId agentId) {
        Objects.requireNonNull(agentId, "agentId");
        return store.findVote(proposalId, agentId).isPresent();
    }

    CastVote getVote(long proposalId, AgentId agentId) {
        Objects.requireNonNull(agentId, "agentId");
        require(proposalId);
        return store.findVote(proposalId, agentId)
                .orElseThrow(() -> GovernanceException.of(NOT_FOUND,
                        "%s has not voted on proposal %d", agentId, proposalId));
    }

    ProposalTally tally(long proposalId, Instant now) {
        Proposal proposal = require(proposalId);

        boolean votingEnded = proposal.hasVotingEnded(now);
        boolean quorumMet = isQuorumMet(proposal);

        ProposalStatus status;
        if (proposal.executed()) {
            status = ProposalStatus.EXECUTED;
        } else if (proposal.cancelled()) {
            status = ProposalStatus.CANCELLED;
        } else if (!votingEnded) {
            status = ProposalStatus.ACTIVE;
        } else if (quorumMet && proposal.hasMajority()) {
            status = ProposalStatus.PASSED;
        } else if (quorumMet) {
            status = ProposalStatus.REJECTED;
        } else {
            status = ProposalStatus.FAILED_QUORUM;
        }

        boolean executionReady = status == ProposalStatus.PASSED
                && !now.isBefore(proposal.executableAt());

        return new ProposalTally(proposalId, status,
                proposal.yesVotes(), proposal.noVotes(), proposal.totalVotes(),
                quorumMet, votingEnded, executionReady);
    }

    long count() {
        return store.proposalCount();
    }

    // ---------------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------------

    private Proposal require(long proposalId) {
        return store.findProposal(proposalId)
                .orElseThrow(() -> GovernanceException.of(NOT_FOUND, "proposal %d not found", proposalId));
    }

    private boolean isQuorumMet(Proposal proposal) {
        return proposal.totalVotes() >= config.quorumThreshold();
    }
}
