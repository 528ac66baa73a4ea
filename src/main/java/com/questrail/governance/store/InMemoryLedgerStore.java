package com.questrail.governance.store;

import com.questrail.governance.api.Agent;
import com.questrail.governance.api.AgentId;
import com.questrail.governance.api.CastVote;
import com.questrail.governance.api.ConsensusDecision;
import com.questrail.governance.api.Proposal;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Heap-backed {@link LedgerStore}.
 *
 * <p>Votes are kept as a proposal-keyed outer map whose values are
 * voter-keyed inner maps. Not thread-safe on its own; the owning ledger
 * provides mutual exclusion.</p>
 */
public final class InMemoryLedgerStore implements LedgerStore {

    private final Map<AgentId, Agent> agents = new HashMap<>();
    private final Map<Long, Proposal> proposals = new HashMap<>();
    private final Map<Long, Map<AgentId, CastVote>> votes = new HashMap<>();
    private final Map<String, ConsensusDecision> decisions = new HashMap<>();

    @Override
    public Optional<Agent> findAgent(AgentId agentId) {
        Objects.requireNonNull(agentId, "agentId");
        return Optional.ofNullable(agents.get(agentId));
    }

    @Override
    public void saveAgent(Agent agent) {
        Objects.requireNonNull(agent, "agent");
        agents.put(agent.id(), agent);
    }

    @Override
    public List<Agent> findAllAgents() {
        return List.copyOf(agents.values());
    }

    @Override
    public Optional<Proposal> findProposal(long proposalId) {
        return Optional.ofNullable(proposals.get(proposalId));
    }

    @Override
    public void saveProposal(Proposal proposal) {
        Objects.requireNonNull(proposal, "proposal");
        proposals.put(proposal.id(), proposal);
    }

    @Override
    public long proposalCount() {
        return proposals.size();
    }

    @Override
    public Optional<CastVote> findVote(long proposalId, AgentId voter) {
        Objects.requireNonNull(voter, "voter");
        Map<AgentId, CastVote> perProposal = votes.get(proposalId);
        if (perProposal == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(perProposal.get(voter));
    }

    @Override
    public void saveVote(long proposalId, CastVote vote) {
        Objects.requireNonNull(vote, "vote");
        votes.computeIfAbsent(proposalId, id -> new LinkedHashMap<>())
                .put(vote.voter(), vote);
    }

    @Override
    public Optional<ConsensusDecision> findDecision(String requestId) {
        Objects.requireNonNull(requestId, "requestId");
        return Optional.ofNullable(decisions.get(requestId));
    }

    @Override
    public void saveDecision(ConsensusDecision decision) {
        Objects.requireNonNull(decision, "decision");
        decisions.put(decision.requestId(), decision);
    }

    @Override
    public long decisionCount() {
        return decisions.size();
    }
}
