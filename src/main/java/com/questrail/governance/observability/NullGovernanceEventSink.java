package com.questrail.governance.observability;

/**
 * No-op implementation of GovernanceEventSink.
 */
public final class NullGovernanceEventSink implements GovernanceEventSink {
    public static final NullGovernanceEventSink INSTANCE = new NullGovernanceEventSink();

    private NullGovernanceEventSink() {}

    @Override
    public void onEvent(GovernanceEvent event) {}

    @Override
    public void onRejected(OperationRejectedEvent event) {}

    @Override
    public void onError(LedgerErrorEvent event) {}
}
