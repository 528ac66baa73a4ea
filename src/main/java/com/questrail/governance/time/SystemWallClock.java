package com.questrail.governance.time;

import java.time.Instant;

/**
 * SystemWallClock
 * =============================================================================
 * Production {@link WallClock} implementation backed by {@link Instant#now()}.
 *
 * <h2>Properties</h2>
 * <ul>
 *   <li>Returns the current wall-clock time as an {@link Instant}</li>
 *   <li>May jump due to NTP or manual adjustments; voting windows are
 *       evaluated against whatever the host reports</li>
 * </ul>
 *
 * <p>For deterministic testing, use a manually advanced clock instead.</p>
 *
 * <h2>Thread Safety</h2>
 * <p>This implementation is thread-safe.</p>
 */
public enum SystemWallClock implements WallClock {
    /**
     * Singleton instance.
     */
    INSTANCE;

    @Override
    public Instant now() {
        return Instant.now();
    }
}
