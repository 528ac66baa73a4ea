package com.questrail.governance.api;

/**
 * Aggregate view of the ledger, suitable for status endpoints and dashboards.
 *
 * @param registeredAgents   agents ever registered, active or not
 * @param activeAgents       agents currently allowed to propose, vote and record
 * @param activeVotingPower  summed voting power of active agents
 * @param proposalCount      proposals created so far; also the highest proposal id
 * @param decisionCount      consensus decisions recorded so far
 * @param paused             whether gated mutations are currently rejected
 */
public record LedgerSummary(
        int registeredAgents,
        int activeAgents,
        long activeVotingPower,
        long proposalCount,
        long decisionCount,
        boolean paused
) {
}
