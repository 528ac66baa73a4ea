package com.questrail.governance.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of GovernanceEventSink that emits logs via SLF4J.
 */
public final class Slf4jGovernanceEventSink implements GovernanceEventSink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jGovernanceEventSink.class);

    @Override
    public void onEvent(GovernanceEvent event) {
        if (event instanceof GovernanceEvent.AgentRegistered e) {
            log.info("[{}] Agent registered: {} (type={}, power={})",
                e.sequence(), e.agentId(), e.agentType(), e.votingPower());
        } else if (event instanceof GovernanceEvent.AgentDeactivated e) {
            log.info("[{}] Agent deactivated: {}", e.sequence(), e.agentId());
        } else if (event instanceof GovernanceEvent.ProposalCreated e) {
            log.info("[{}] Proposal {} created by {}: type={}, content={}, voting ends {}",
                e.sequence(), e.proposalId(), e.proposer(), e.proposalType(),
                e.contentHash(), e.votingEnd());
        } else if (event instanceof GovernanceEvent.VoteCast e) {
            log.info("[{}] Vote on proposal {}: {} voted {} with weight {} (yes={}, no={})",
                e.sequence(), e.proposalId(), e.voter(), e.approve() ? "YES" : "NO",
                e.weight(), e.yesVotes(), e.noVotes());
        } else if (event instanceof GovernanceEvent.ProposalExecuted e) {
            log.info("[{}] Proposal {} executed: type={}, success={}",
                e.sequence(), e.proposalId(), e.proposalType(), e.success());
        } else if (event instanceof GovernanceEvent.ProposalCancelled e) {
            log.info("[{}] Proposal {} cancelled", e.sequence(), e.proposalId());
        } else if (event instanceof GovernanceEvent.ConsensusRecorded e) {
            log.info("[{}] Consensus recorded for {}: {} -> {} (confidence={}, agents={})",
                e.sequence(), e.requestId(), e.decisionType(), e.finalDecision(),
                e.confidence(), e.participatingAgents());
        } else if (event instanceof GovernanceEvent.LedgerPaused e) {
            log.warn("[{}] Ledger paused by {}", e.sequence(), e.by());
        } else if (event instanceof GovernanceEvent.LedgerUnpaused e) {
            log.info("[{}] Ledger unpaused by {}", e.sequence(), e.by());
        }
    }

    @Override
    public void onRejected(OperationRejectedEvent event) {
        log.debug("Rejected {} from {}: {} ({})",
            event.operation(), event.caller(), event.kind(), event.message());
    }

    @Override
    public void onError(LedgerErrorEvent event) {
        log.error("Ledger error during {}: {}", event.operation(), event.message(), event.cause());
    }
}
