package com.questrail.governance.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Time source for every ledger window check (voting start/end, execution
 * eligibility) and for event and decision timestamps.
 *
 * <p>
 * The ledger reads this clock once per operation, under its lock, so a single
 * operation always sees one consistent "now". Implementations must not be
 * read elsewhere for ledger decisions.
 * </p>
 */
public interface WallClock
{
    /**
     * Returns the current ledger time.
     */
    Instant now();
}
