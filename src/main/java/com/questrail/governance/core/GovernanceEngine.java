package com.questrail.governance.core;

import com.questrail.governance.api.Agent;
import com.questrail.governance.api.AgentId;
import com.questrail.governance.api.CastVote;
import com.questrail.governance.api.ConsensusDecision;
import com.questrail.governance.api.DecisionVerification;
import com.questrail.governance.api.GovernanceException;
import com.questrail.governance.api.GovernanceLedger;
import com.questrail.governance.api.LedgerSummary;
import com.questrail.governance.api.Proposal;
import com.questrail.governance.api.ProposalTally;
import com.questrail.governance.config.GovernanceConfig;
import com.questrail.governance.execution.ProposalExecutionException;
import com.questrail.governance.execution.ProposalHandlerRegistry;
import com.questrail.governance.observability.GovernanceEvent;
import com.questrail.governance.observability.GovernanceEventSink;
import com.questrail.governance.observability.LedgerErrorEvent;
import com.questrail.governance.observability.OperationRejectedEvent;
import com.questrail.governance.observability.Slf4jGovernanceEventSink;
import com.questrail.governance.store.InMemoryLedgerStore;
import com.questrail.governance.store.LedgerStorageException;
import com.questrail.governance.store.LedgerStore;
import com.questrail.governance.time.SystemWallClock;
import com.questrail.governance.time.WallClock;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;

import static com.questrail.governance.api.GovernanceErrorKind.INVALID_STATE;
import static com.questrail.governance.api.GovernanceErrorKind.SYSTEM_PAUSED;
import static com.questrail.governance.api.GovernanceErrorKind.UNAUTHORIZED;

/**
 * GovernanceEngine
 * -----------------------------------------------------------------------------
 * Reference {@link GovernanceLedger}: the single owner of the ledger store,
 * the pause flag and the event sequence.
 *
 * <h2>What this class is</h2>
 * <ul>
 *   <li>The composition point for {@link AgentRegistry}, {@link ProposalEngine}
 *       and {@link DecisionLedger}, which share one {@link LedgerStore}</li>
 *   <li>The place where caller roles and the pause gate are enforced</li>
 *   <li>The only reader of the injected {@link WallClock}</li>
 * </ul>
 *
 * <h2>Execution model</h2>
 * <pre>
 *   write lock → now = clock.now() → gate checks → component transition → sequence++
 *   unlock → sink.onEvent(event)
 * </pre>
 * <p>Every mutation runs to completion under the write half of a
 * {@link ReentrantReadWriteLock}, so tally updates and idempotency checks are
 * atomic with respect to each other. Queries run under the read half and may
 * proceed concurrently; because stored values are immutable records they
 * always observe a committed state.</p>
 *
 * <p>Sink callbacks run after the lock is released, on the calling thread.
 * A slow sink therefore never blocks other ledger operations, at the cost of
 * events from concurrent callers possibly arriving out of order; each event
 * carries its commit sequence.</p>
 *
 * <h2>Failures</h2>
 * <ul>
 *   <li>{@link GovernanceException}: reported via
 *       {@link GovernanceEventSink#onRejected} and rethrown; state unchanged</li>
 *   <li>{@link LedgerStorageException} and {@link ProposalExecutionException}:
 *       reported via {@link GovernanceEventSink#onError} and rethrown</li>
 *   <li>Anything else is a caller bug and propagates unreported</li>
 * </ul>
 */
public final class GovernanceEngine implements GovernanceLedger
{
    /**
     * Value committed by a mutation together with the event describing it.
     */
    private record Commit<T>(T value, GovernanceEvent event) {}

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private final GovernanceConfig config;
    private final WallClock clock;
    private final GovernanceEventSink sink;

    private final AgentRegistry agents;
    private final ProposalEngine proposals;
    private final DecisionLedger decisions;

    // Guarded by lock.
    private boolean paused;
    private long eventSequence;

    public GovernanceEngine(GovernanceConfig config,
                            WallClock clock,
                            LedgerStore store,
                            ProposalHandlerRegistry handlers,
                            GovernanceEventSink sink)
    {
        this.config = Objects.requireNonNull(config, "config");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.sink = Objects.requireNonNull(sink, "sink");
        Objects.requireNonNull(store, "store");
        Objects.requireNonNull(handlers, "handlers");

        this.agents = new AgentRegistry(store);
        this.proposals = new ProposalEngine(store, config, handlers);
        this.decisions = new DecisionLedger(store);
    }

    public GovernanceConfig config() {
        return config;
    }

    // ---------------------------------------------------------------------
    // Agent registry
    // ---------------------------------------------------------------------

    @Override
    public Agent registerAgent(AgentId caller, AgentId agentId, String agentType, long votingPower, String publicKey) {
        return mutate("registerAgent", caller, now -> {
            requireNotPaused();
            requireAdmin(caller);
            Agent agent = agents.register(agentId, agentType, votingPower, publicKey);
            return new Commit<>(agent, new GovernanceEvent.AgentRegistered(
                    nextSequence(), now, agent.id(), agent.agentType(), agent.votingPower()));
        });
    }

    @Override
    public void deactivateAgent(AgentId caller, AgentId agentId) {
        // Not gated on pause: removing a compromised agent must stay possible.
        mutate("deactivateAgent", caller, now -> {
            requireAdmin(caller);
            Agent agent = agents.deactivate(agentId);
            return new Commit<>(agent, new GovernanceEvent.AgentDeactivated(nextSequence(), now, agent.id()));
        });
    }

    @Override
    public Agent getAgent(AgentId agentId) {
        return query(now -> agents.get(agentId));
    }

    // ---------------------------------------------------------------------
    // Proposals and voting
    // ---------------------------------------------------------------------

    @Override
    public long createProposal(AgentId caller, String proposalType, String contentHash) {
        Proposal proposal = mutate("createProposal", caller, now -> {
            requireNotPaused();
            Agent proposer = agents.requireActive(caller);
            Proposal created = proposals.create(proposer, proposalType, contentHash, now);
            return new Commit<>(created, new GovernanceEvent.ProposalCreated(
                    nextSequence(), now, created.id(), created.proposer(),
                    created.proposalType(), created.contentHash(), created.votingEnd()));
        });
        return proposal.id();
    }

    @Override
    public void vote(AgentId caller, long proposalId, boolean approve) {
        mutate("vote", caller, now -> {
            requireNotPaused();
            Agent voter = agents.requireActive(caller);
            ProposalEngine.VoteOutcome outcome = proposals.vote(voter, proposalId, approve, now);
            CastVote vote = outcome.vote();
            return new Commit<>(outcome, new GovernanceEvent.VoteCast(
                    nextSequence(), now, proposalId, vote.voter(), vote.approve(), vote.weight(),
                    outcome.proposal().yesVotes(), outcome.proposal().noVotes()));
        });
    }

    @Override
    public boolean executeProposal(AgentId caller, long proposalId) {
        ProposalEngine.ExecutionOutcome outcome = mutate("executeProposal", caller, now -> {
            requireNotPaused();
            ProposalEngine.ExecutionOutcome executed = proposals.execute(proposalId, now);
            return new Commit<>(executed, new GovernanceEvent.ProposalExecuted(
                    nextSequence(), now, proposalId, executed.proposal().proposalType(), executed.success()));
        });
        return outcome.success();
    }

    @Override
    public void cancelProposal(AgentId caller, long proposalId) {
        mutate("cancelProposal", caller, now -> {
            requireNotPaused();
            requireAdmin(caller);
            Proposal cancelled = proposals.cancel(proposalId);
            return new Commit<>(cancelled, new GovernanceEvent.ProposalCancelled(nextSequence(), now, cancelled.id()));
        });
    }

    @Override
    public Optional<Proposal> getProposal(long proposalId) {
        return query(now -> proposals.find(proposalId));
    }

    @Override
    public ProposalTally getProposalTally(long proposalId) {
        return query(now -> proposals.tally(proposalId, now));
    }

    @Override
    public boolean hasVoted(long proposalId, AgentId agentId) {
        return query(now -> proposals.hasVoted(proposalId, agentId));
    }

    @Override
    public CastVote getVote(long proposalId, AgentId agentId) {
        return query(now -> proposals.getVote(proposalId, agentId));
    }

    // ---------------------------------------------------------------------
    // Consensus decisions
    // ---------------------------------------------------------------------

    @Override
    public ConsensusDecision recordDecision(AgentId caller,
                                            String requestId,
                                            String decisionType,
                                            String finalDecision,
                                            double confidence,
                                            List<String> participatingAgents,
                                            String proofHash)
    {
        return mutate("recordDecision", caller, now -> {
            requireNotPaused();
            Agent submitter = agents.requireActive(caller);
            ConsensusDecision decision = decisions.record(submitter, requestId, decisionType,
                    finalDecision, confidence, participatingAgents, proofHash, now);
            return new Commit<>(decision, new GovernanceEvent.ConsensusRecorded(
                    nextSequence(), now, decision.requestId(), decision.decisionType(),
                    decision.finalDecision(), decision.consensusConfidence(),
                    decision.participatingAgents(), decision.recordedBy()));
        });
    }

    @Override
    public DecisionVerification verifyDecision(String requestId) {
        return query(now -> decisions.verify(requestId));
    }

    @Override
    public Optional<ConsensusDecision> getDecision(String requestId) {
        return query(now -> decisions.find(requestId));
    }

    // ---------------------------------------------------------------------
    // Administration
    // ---------------------------------------------------------------------

    @Override
    public void pause(AgentId caller) {
        mutate("pause", caller, now -> {
            requireAdmin(caller);
            if (paused) {
                throw GovernanceException.of(INVALID_STATE, "ledger is already paused");
            }
            paused = true;
            return new Commit<>(Boolean.TRUE, new GovernanceEvent.LedgerPaused(nextSequence(), now, caller));
        });
    }

    @Override
    public void unpause(AgentId caller) {
        mutate("unpause", caller, now -> {
            requireAdmin(caller);
            if (!paused) {
                throw GovernanceException.of(INVALID_STATE, "ledger is not paused");
            }
            paused = false;
            return new Commit<>(Boolean.FALSE, new GovernanceEvent.LedgerUnpaused(nextSequence(), now, caller));
        });
    }

    @Override
    public boolean isPaused() {
        return query(now -> paused);
    }

    @Override
    public LedgerSummary summary() {
        return query(now -> {
            List<Agent> all = agents.all();
            int active = 0;
            long activePower = 0;
            for (Agent agent : all) {
                if (agent.active()) {
                    active++;
                    activePower += agent.votingPower();
                }
            }
            return new LedgerSummary(all.size(), active, activePower,
                    proposals.count(), decisions.count(), paused);
        });
    }

    // ---------------------------------------------------------------------
    // Gate checks (write lock held)
    // ---------------------------------------------------------------------

    private void requireNotPaused() {
        if (paused) {
            throw GovernanceException.of(SYSTEM_PAUSED, "ledger is paused");
        }
    }

    private void requireAdmin(AgentId caller) {
        if (!config.admin().equals(caller)) {
            throw GovernanceException.of(UNAUTHORIZED, "%s is not the administrator", caller);
        }
    }

    private long nextSequence() {
        return ++eventSequence;
    }

    // ---------------------------------------------------------------------
    // Lock discipline
    // ---------------------------------------------------------------------

    private <T> T mutate(String operation, AgentId caller, Function<Instant, Commit<T>> transition) {
        Objects.requireNonNull(caller, "caller");

        Commit<T> commit;
        try {
            commit = underWriteLock(transition);
        } catch (GovernanceException e) {
            sink.onRejected(new OperationRejectedEvent(clock.now(), operation, caller, e.kind(), e.getMessage()));
            throw e;
        } catch (LedgerStorageException | ProposalExecutionException e) {
            sink.onError(new LedgerErrorEvent(clock.now(), operation, String.valueOf(e.getMessage()), e));
            throw e;
        }

        sink.onEvent(commit.event());
        return commit.value();
    }

    private <T> Commit<T> underWriteLock(Function<Instant, Commit<T>> transition) {
        lock.writeLock().lock();
        try {
            return transition.apply(clock.now());
        } finally {
            lock.writeLock().unlock();
        }
    }

    private <T> T query(Function<Instant, T> read) {
        try {
            return underReadLock(read);
        } catch (LedgerStorageException e) {
            sink.onError(new LedgerErrorEvent(clock.now(), "query", String.valueOf(e.getMessage()), e));
            throw e;
        }
    }

    private <T> T underReadLock(Function<Instant, T> read) {
        lock.readLock().lock();
        try {
            return read.apply(clock.now());
        } finally {
            lock.readLock().unlock();
        }
    }

    // ---------------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------------

    public static Builder builder(GovernanceConfig config) {
        return new Builder(config);
    }

    public static final class Builder {
        private final GovernanceConfig config;
        private WallClock clock = SystemWallClock.INSTANCE;
        private LedgerStore store;
        private ProposalHandlerRegistry handlers = ProposalHandlerRegistry.defaults();
        private GovernanceEventSink eventSink;

        private Builder(GovernanceConfig config) {
            this.config = Objects.requireNonNull(config, "config");
        }

        public Builder withClock(WallClock clock) {
            this.clock = clock;
            return this;
        }

        public Builder withStore(LedgerStore store) {
            this.store = store;
            return this;
        }

        public Builder withHandlers(ProposalHandlerRegistry handlers) {
            this.handlers = handlers;
            return this;
        }

        public Builder withEventSink(GovernanceEventSink sink) {
            this.eventSink = sink;
            return this;
        }

        public GovernanceEngine build() {
            return new GovernanceEngine(
                    config,
                    clock,
                    store != null ? store : new InMemoryLedgerStore(),
                    handlers,
                    eventSink != null ? eventSink : new Slf4jGovernanceEventSink());
        }
    }
}
