package com.questrail.governance.api;

import java.util.Objects;

/**
 * AgentId
 * -----------------------------------------------------------------------------
 * Stable principal identity of a caller or registered agent.
 *
 * <p>The value is opaque: an address, a key fingerprint, a service name. The
 * ledger compares identities by value and never interprets them.</p>
 *
 * <p>The empty identity ({@link #NONE}) is representable so that callers can
 * pass it and receive a typed {@link GovernanceErrorKind#INVALID_ARGUMENT}
 * rejection rather than a construction failure.</p>
 */
public record AgentId(String value)
{
    /**
     * The null/empty identity. Never registrable.
     */
    public static final AgentId NONE = new AgentId("");

    public AgentId {
        Objects.requireNonNull(value, "value");
    }

    public static AgentId of(String value) {
        return new AgentId(value);
    }

    public boolean isEmpty() {
        return value.isBlank();
    }

    @Override
    public String toString() {
        return value;
    }
}
