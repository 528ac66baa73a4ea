package com.questrail.governance.time;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Deterministic wall clock for tests.
 *
 * - Starts at a fixed instant
 * - Advances only when explicitly instructed
 * - Never goes backwards
 */
public final class ManualWallClock implements WallClock {

    public static final Instant EPOCH = Instant.parse("2025-01-01T00:00:00Z");

    private final AtomicReference<Instant> now;

    public ManualWallClock() {
        this(EPOCH);
    }

    public ManualWallClock(Instant start) {
        this.now = new AtomicReference<>(start);
    }

    @Override
    public Instant now() {
        return now.get();
    }

    public void advance(Duration delta) {
        if (delta.isNegative()) {
            throw new IllegalArgumentException("Cannot advance wall clock backwards");
        }
        now.updateAndGet(t -> t.plus(delta));
    }

    public void advanceMinutes(long minutes) {
        advance(Duration.ofMinutes(minutes));
    }

    public void advanceHours(long hours) {
        advance(Duration.ofHours(hours));
    }

    public void advanceTo(Instant target) {
        advance(Duration.between(now.get(), target));
    }
}
