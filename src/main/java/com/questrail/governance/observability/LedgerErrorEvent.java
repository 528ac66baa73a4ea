package com.questrail.governance.observability;

import java.time.Instant;

/**
 * Record representing an infrastructure failure inside a ledger operation:
 * a storage failure or a proposal handler that threw.
 */
public record LedgerErrorEvent(
    Instant timestamp,
    String operation,
    String message,
    Throwable cause
) {
}
