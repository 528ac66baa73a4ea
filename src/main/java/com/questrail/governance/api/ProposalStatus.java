package com.questrail.governance.api;

/**
 * Coarse outcome of a proposal as seen at a given ledger time.
 */
public enum ProposalStatus
{
    /**
     * The voting window has not closed yet.
     */
    ACTIVE,

    /**
     * Voting closed with quorum and a strict yes majority. The proposal may
     * still be inside its execution delay; see {@link ProposalTally#executionReady()}.
     */
    PASSED,

    /**
     * Voting closed with quorum but without a strict yes majority.
     */
    REJECTED,

    /**
     * Voting closed without reaching the quorum threshold.
     */
    FAILED_QUORUM,

    EXECUTED,

    CANCELLED
}
