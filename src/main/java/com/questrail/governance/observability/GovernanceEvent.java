package com.questrail.governance.observability;

import com.questrail.governance.api.AgentId;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * GovernanceEvent
 * -----------------------------------------------------------------------------
 * Structured record of one committed ledger mutation.
 *
 * <h2>Role in the architecture</h2>
 * Events are the integration point for audit logging and for the off-ledger
 * evaluation pipeline. Exactly one event is emitted per successful
 * state-changing operation; rejected operations emit none (they are reported
 * separately through {@link GovernanceEventSink#onRejected}).
 *
 * <h2>Ordering</h2>
 * {@link #sequence()} is assigned under the ledger's write lock and is
 * strictly increasing in commit order, starting at 1. Sinks are invoked after
 * the lock is released, so concurrent operations may reach a sink out of
 * order; consumers that need commit order sort by sequence.
 */
public sealed interface GovernanceEvent
{
    long sequence();

    /**
     * Ledger time at which the mutation was committed.
     */
    Instant timestamp();

    record AgentRegistered(long sequence, Instant timestamp,
                           AgentId agentId, String agentType, long votingPower)
            implements GovernanceEvent {
        public AgentRegistered {
            Objects.requireNonNull(timestamp, "timestamp");
            Objects.requireNonNull(agentId, "agentId");
            Objects.requireNonNull(agentType, "agentType");
        }
    }

    record AgentDeactivated(long sequence, Instant timestamp, AgentId agentId)
            implements GovernanceEvent {
        public AgentDeactivated {
            Objects.requireNonNull(timestamp, "timestamp");
            Objects.requireNonNull(agentId, "agentId");
        }
    }

    record ProposalCreated(long sequence, Instant timestamp,
                           long proposalId, AgentId proposer, String proposalType,
                           String contentHash, Instant votingEnd)
            implements GovernanceEvent {
        public ProposalCreated {
            Objects.requireNonNull(timestamp, "timestamp");
            Objects.requireNonNull(proposer, "proposer");
            Objects.requireNonNull(proposalType, "proposalType");
            Objects.requireNonNull(contentHash, "contentHash");
            Objects.requireNonNull(votingEnd, "votingEnd");
        }
    }

    /**
     * Carries the tally after the vote was applied.
     */
    record VoteCast(long sequence, Instant timestamp,
                    long proposalId, AgentId voter, boolean approve, long weight,
                    long yesVotes, long noVotes)
            implements GovernanceEvent {
        public VoteCast {
            Objects.requireNonNull(timestamp, "timestamp");
            Objects.requireNonNull(voter, "voter");
        }
    }

    record ProposalExecuted(long sequence, Instant timestamp,
                            long proposalId, String proposalType, boolean success)
            implements GovernanceEvent {
        public ProposalExecuted {
            Objects.requireNonNull(timestamp, "timestamp");
            Objects.requireNonNull(proposalType, "proposalType");
        }
    }

    record ProposalCancelled(long sequence, Instant timestamp, long proposalId)
            implements GovernanceEvent {
        public ProposalCancelled {
            Objects.requireNonNull(timestamp, "timestamp");
        }
    }

    record ConsensusRecorded(long sequence, Instant timestamp,
                             String requestId, String decisionType, String finalDecision,
                             double confidence, List<String> participatingAgents,
                             AgentId recordedBy)
            implements GovernanceEvent {
        public ConsensusRecorded {
            Objects.requireNonNull(timestamp, "timestamp");
            Objects.requireNonNull(requestId, "requestId");
            Objects.requireNonNull(decisionType, "decisionType");
            Objects.requireNonNull(finalDecision, "finalDecision");
            Objects.requireNonNull(recordedBy, "recordedBy");
            participatingAgents = List.copyOf(participatingAgents);
        }
    }

    record LedgerPaused(long sequence, Instant timestamp, AgentId by)
            implements GovernanceEvent {
        public LedgerPaused {
            Objects.requireNonNull(timestamp, "timestamp");
            Objects.requireNonNull(by, "by");
        }
    }

    record LedgerUnpaused(long sequence, Instant timestamp, AgentId by)
            implements GovernanceEvent {
        public LedgerUnpaused {
            Objects.requireNonNull(timestamp, "timestamp");
            Objects.requireNonNull(by, "by");
        }
    }
}
