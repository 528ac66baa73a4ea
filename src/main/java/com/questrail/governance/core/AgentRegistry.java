package com.questrail.governance.core;

import com.questrail.governance.api.Agent;
import com.questrail.governance.api.AgentId;
import com.questrail.governance.api.GovernanceException;
import com.questrail.governance.store.LedgerStore;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

import static com.questrail.governance.api.GovernanceErrorKind.ALREADY_EXISTS;
import static com.questrail.governance.api.GovernanceErrorKind.INVALID_ARGUMENT;
import static com.questrail.governance.api.GovernanceErrorKind.INVALID_STATE;
import static com.questrail.governance.api.GovernanceErrorKind.UNAUTHORIZED;

/**
 * AgentRegistry
 * -----------------------------------------------------------------------------
 * Registration, deactivation and authorization lookups over the agent table.
 *
 * <p>Role checks that depend on the administrator identity or the pause flag
 * belong to {@link GovernanceEngine}; this class only knows about agents.
 * Callers must hold the ledger lock.</p>
 */
final class AgentRegistry
{
    private final LedgerStore store;

    AgentRegistry(LedgerStore store) {
        this.store = Objects.requireNonNull(store, "store");
    }

    Agent register(AgentId agentId, String agentType, long votingPower, String publicKey) {
        Objects.requireNonNull(agentType, "agentType");
        Objects.requireNonNull(publicKey, "publicKey");

        if (agentId == null || agentId.isEmpty()) {
            throw GovernanceException.of(INVALID_ARGUMENT, "agent id must not be empty");
        }
        if (votingPower <= 0) {
            throw GovernanceException.of(INVALID_ARGUMENT,
                    "voting power must be positive, got %d", votingPower);
        }

        Optional<Agent> existing = store.findAgent(agentId);
        if (existing.isPresent() && existing.get().active()) {
            throw GovernanceException.of(ALREADY_EXISTS, "agent %s is already registered", agentId);
        }

        // An inactive record is overwritten; this is how agents are re-activated.
        Agent agent = new Agent(agentId, agentType, votingPower, true, publicKey);
        store.saveAgent(agent);
        return agent;
    }

    Agent deactivate(AgentId agentId) {
        Objects.requireNonNull(agentId, "agentId");

        Agent agent = store.findAgent(agentId)
                .filter(Agent::active)
                .orElseThrow(() -> GovernanceException.of(INVALID_STATE,
                        "agent %s is not active", agentId));

        Agent deactivated = agent.deactivated();
        store.saveAgent(deactivated);
        return deactivated;
    }

    /**
     * Resolves the caller to an active agent or rejects with {@code UNAUTHORIZED}.
     */
    Agent requireActive(AgentId caller) {
        return store.findAgent(caller)
                .filter(Agent::active)
                .orElseThrow(() -> GovernanceException.of(UNAUTHORIZED,
                        "%s is not an active agent", caller));
    }

    /**
     * Zero-value-on-miss view used by the public façade.
     */
    Agent get(AgentId agentId) {
        Objects.requireNonNull(agentId, "agentId");
        return store.findAgent(agentId).orElseGet(() -> Agent.unregistered(agentId));
    }

    List<Agent> all() {
        return store.findAllAgents();
    }
}
