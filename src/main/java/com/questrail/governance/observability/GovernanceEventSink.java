package com.questrail.governance.observability;

/**
 * Main interface for receiving ledger observability events.
 * Implementations can provide audit logging, metrics, or forwarding to an
 * external pipeline.
 *
 * <p>Callbacks run on the thread that performed the operation, after the
 * ledger lock has been released. They must not call back into mutating
 * ledger operations from the same thread expecting ordering guarantees.</p>
 */
public interface GovernanceEventSink {
    /**
     * Called once for every committed mutation.
     * @param event the committed event
     */
    void onEvent(GovernanceEvent event);

    /**
     * Called when an operation is rejected with a typed governance error.
     * @param event the rejection details
     */
    void onRejected(OperationRejectedEvent event);

    /**
     * Called when an operation fails for infrastructure reasons.
     * @param event the error event
     */
    void onError(LedgerErrorEvent event);
}
