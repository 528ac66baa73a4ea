package com.questrail.governance.observability;

import com.questrail.governance.api.AgentId;
import com.questrail.governance.api.GovernanceErrorKind;

import java.time.Instant;

/**
 * Record of an operation the ledger refused. The ledger state is unchanged.
 */
public record OperationRejectedEvent(
    Instant timestamp,
    String operation,
    AgentId caller,
    GovernanceErrorKind kind,
    String message
) {
}
