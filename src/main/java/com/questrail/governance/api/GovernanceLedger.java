package com.questrail.governance.api;

import java.util.List;
import java.util.Optional;

/**
 * GovernanceLedger
 * -----------------------------------------------------------------------------
 * {@code GovernanceLedger} is the semantic façade over the shared governance
 * state: the agent registry, the proposal table and the consensus decision
 * table.
 *
 * <h2>Core responsibilities</h2>
 * <ul>
 *   <li>Gate every mutation on the caller's role (administrator or active agent)</li>
 *   <li>Enforce exactly-once voting and exactly-once decision recording</li>
 *   <li>Apply time-windowed proposal transitions against an injected clock</li>
 *   <li>Emit one structured event per committed mutation</li>
 * </ul>
 *
 * It is explicitly <b>not</b> responsible for:
 * <ul>
 *   <li>Deciding how agents vote or how decisions are reached</li>
 *   <li>Verifying signatures against agent public keys</li>
 *   <li>Transport, serialization or authentication of callers</li>
 * </ul>
 * The {@code caller} argument is trusted to have been authenticated by the
 * layer that hosts the ledger.
 *
 * <h2>Errors</h2>
 * Rejections are reported by throwing {@link GovernanceException}; the ledger
 * state is unchanged when that happens. Read accessors follow a
 * zero-value-on-miss convention where noted and otherwise report
 * {@link GovernanceErrorKind#NOT_FOUND}.
 *
 * <h2>Threading and concurrency</h2>
 * Implementations must serialize mutations against each other and must let
 * reads observe only committed state. See {@code GovernanceEngine} for the
 * reference implementation's model.
 */
public interface GovernanceLedger
{
    // ---------------------------------------------------------------------
    // Agent registry
    // ---------------------------------------------------------------------

    /**
     * Registers (or re-activates) an agent. Administrator only.
     *
     * @return the stored, active record
     * @throws GovernanceException {@code SYSTEM_PAUSED}, {@code UNAUTHORIZED},
     *         {@code INVALID_ARGUMENT} or {@code ALREADY_EXISTS}
     */
    Agent registerAgent(AgentId caller, AgentId agentId, String agentType, long votingPower, String publicKey);

    /**
     * Soft-disables an agent. Administrator only; allowed while paused.
     * Votes already cast remain counted.
     *
     * @throws GovernanceException {@code UNAUTHORIZED} or {@code INVALID_STATE}
     *         if the agent is not currently active
     */
    void deactivateAgent(AgentId caller, AgentId agentId);

    /**
     * Returns the registry record, or a zero-valued record
     * ({@link Agent#unregistered(AgentId)}) for unknown identities.
     */
    Agent getAgent(AgentId agentId);

    // ---------------------------------------------------------------------
    // Proposals and voting
    // ---------------------------------------------------------------------

    /**
     * Opens a new proposal for voting. Active agents only.
     *
     * @return the new proposal id; ids are sequential starting at 1
     */
    long createProposal(AgentId caller, String proposalType, String contentHash);

    /**
     * Casts the caller's weighted vote. Active agents only, once per proposal,
     * inside the voting window.
     */
    void vote(AgentId caller, long proposalId, boolean approve);

    /**
     * Executes a proposal whose voting window and execution delay have both
     * elapsed. Open to any caller.
     *
     * @return the handler's success flag; {@code false} for unrecognized
     *         proposal types, which still count as executed
     * @throws GovernanceException {@code NOT_FOUND}, {@code INVALID_STATE},
     *         {@code QUORUM_NOT_MET} or {@code PROPOSAL_REJECTED}
     */
    boolean executeProposal(AgentId caller, long proposalId);

    /**
     * Cancels a proposal that has not been executed. Administrator only.
     */
    void cancelProposal(AgentId caller, long proposalId);

    Optional<Proposal> getProposal(long proposalId);

    /**
     * @throws GovernanceException {@code NOT_FOUND} for unknown proposals
     */
    ProposalTally getProposalTally(long proposalId);

    /**
     * @return {@code false} for unknown proposals as well as for agents that
     *         have not voted
     */
    boolean hasVoted(long proposalId, AgentId agentId);

    /**
     * @throws GovernanceException {@code NOT_FOUND} if the proposal is unknown
     *         or the agent never voted on it
     */
    CastVote getVote(long proposalId, AgentId agentId);

    // ---------------------------------------------------------------------
    // Consensus decisions
    // ---------------------------------------------------------------------

    /**
     * Records a finalized consensus decision exactly once. Active agents only.
     *
     * @throws GovernanceException {@code INVALID_ARGUMENT} for an empty request
     *         id, {@code ALREADY_RECORDED} for a reused one
     */
    ConsensusDecision recordDecision(AgentId caller,
                                     String requestId,
                                     String decisionType,
                                     String finalDecision,
                                     double confidence,
                                     List<String> participatingAgents,
                                     String proofHash);

    /**
     * Never fails; unknown ids verify as {@link DecisionVerification#unknown()}.
     */
    DecisionVerification verifyDecision(String requestId);

    Optional<ConsensusDecision> getDecision(String requestId);

    // ---------------------------------------------------------------------
    // Administration
    // ---------------------------------------------------------------------

    void pause(AgentId caller);

    void unpause(AgentId caller);

    boolean isPaused();

    LedgerSummary summary();
}
