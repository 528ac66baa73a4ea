package com.questrail.governance.store;

import com.questrail.governance.api.Agent;
import com.questrail.governance.api.AgentId;
import com.questrail.governance.api.CastVote;
import com.questrail.governance.api.ConsensusDecision;
import com.questrail.governance.api.Proposal;

import java.util.List;
import java.util.Optional;

/**
 * LedgerStore
 * -----------------------------------------------------------------------------
 * Storage interface for the authoritative governance state: agents,
 * proposals, per-proposal votes and consensus decisions.
 *
 * <h2>Contract</h2>
 * <ul>
 *   <li>Stores hold immutable values; a save replaces the value for its key</li>
 *   <li>Nothing is ever deleted</li>
 *   <li>Absence is reported as {@link Optional#empty()}, never as a
 *       default-filled value</li>
 *   <li>Failures are reported as {@link LedgerStorageException}</li>
 * </ul>
 *
 * <h2>Threading</h2>
 * Stores need not be thread-safe for writers. The ledger serializes every
 * write and never runs a read concurrently with a write.
 */
public interface LedgerStore
{
    // ---------------------------------------------------------------------
    // Agents
    // ---------------------------------------------------------------------

    Optional<Agent> findAgent(AgentId agentId);

    void saveAgent(Agent agent);

    /**
     * @return all agents ever registered, in no particular order
     */
    List<Agent> findAllAgents();

    // ---------------------------------------------------------------------
    // Proposals
    // ---------------------------------------------------------------------

    Optional<Proposal> findProposal(long proposalId);

    void saveProposal(Proposal proposal);

    /**
     * @return number of proposals ever saved; proposal ids are {@code 1..count}
     */
    long proposalCount();

    // ---------------------------------------------------------------------
    // Votes (nested per proposal)
    // ---------------------------------------------------------------------

    Optional<CastVote> findVote(long proposalId, AgentId voter);

    void saveVote(long proposalId, CastVote vote);

    // ---------------------------------------------------------------------
    // Consensus decisions
    // ---------------------------------------------------------------------

    Optional<ConsensusDecision> findDecision(String requestId);

    void saveDecision(ConsensusDecision decision);

    long decisionCount();
}
