package com.questrail.governance.api;

import java.util.Objects;

/**
 * Agent
 * -----------------------------------------------------------------------------
 * Registry record of a voting participant.
 *
 * <p>{@code agentType} is an opaque label ("neutral", "permissive", "strict",
 * "watchdog", ...). It carries no behavior inside the ledger.</p>
 *
 * <p>A registered agent always has {@code votingPower > 0}; power is never
 * updated in place. The zero-valued record returned for unknown identities
 * by {@link GovernanceLedger#getAgent(AgentId)} is the only instance with
 * zero power.</p>
 */
public record Agent(
        AgentId id,
        String agentType,
        long votingPower,
        boolean active,
        String publicKey
)
{
    public Agent {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(agentType, "agentType");
        Objects.requireNonNull(publicKey, "publicKey");
    }

    /**
     * Zero-valued record for an identity the registry has never seen.
     */
    public static Agent unregistered(AgentId id) {
        return new Agent(id, "", 0L, false, "");
    }

    public Agent deactivated() {
        return new Agent(id, agentType, votingPower, false, publicKey);
    }
}
