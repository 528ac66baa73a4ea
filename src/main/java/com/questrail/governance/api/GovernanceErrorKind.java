package com.questrail.governance.api;

/**
 * GovernanceErrorKind
 * -----------------------------------------------------------------------------
 * Taxonomy of expected, recoverable rejections surfaced by the ledger.
 *
 * <p>None of these indicate a malfunction. Storage-layer failures are
 * reported separately as {@code LedgerStorageException} and never carry one
 * of these kinds.</p>
 *
 * <p>{@link #ALREADY_VOTED} and {@link #ALREADY_RECORDED} are terminal for the
 * caller: retrying the same submission can never succeed.</p>
 */
public enum GovernanceErrorKind
{
    /**
     * Caller is not the administrator, or not an active agent, as the
     * operation requires.
     */
    UNAUTHORIZED,

    /**
     * Malformed input: empty identity, empty request id, non-positive power.
     */
    INVALID_ARGUMENT,

    ALREADY_EXISTS,

    ALREADY_RECORDED,

    ALREADY_VOTED,

    /**
     * Unknown proposal, or a vote that was never cast.
     */
    NOT_FOUND,

    /**
     * Operation attempted outside its time window or after a terminal state.
     */
    INVALID_STATE,

    QUORUM_NOT_MET,

    PROPOSAL_REJECTED,

    /**
     * The ledger is paused; only reads, deactivation and unpausing are accepted.
     */
    SYSTEM_PAUSED
}
