package com.questrail.governance.core;

import com.questrail.governance.api.AgentId;
import com.questrail.governance.api.GovernanceErrorKind;
import com.questrail.governance.api.GovernanceException;
import com.questrail.governance.api.Proposal;
import com.questrail.governance.config.GovernanceConfig;
import com.questrail.governance.execution.ProposalTypes;
import com.questrail.governance.observability.GovernanceEvent;
import com.questrail.governance.observability.RecordingGovernanceEventSink;
import com.questrail.governance.time.ManualWallClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * GovernanceEngineConcurrencyTest
 * -----------------------------------------------------------------------------
 * Many callers racing on the same ledger.
 *
 * Each test releases all workers from one latch so the write lock is actually
 * contended, then checks that the committed state is what a serial history
 * would have produced.
 */
@Timeout(30)
class GovernanceEngineConcurrencyTest {

    private static final AgentId ADMIN = AgentId.of("admin");
    private static final int AGENTS = 32;

    private RecordingGovernanceEventSink sink;
    private GovernanceEngine engine;

    @BeforeEach
    void setUp() {
        sink = new RecordingGovernanceEventSink();
        engine = GovernanceEngine.builder(GovernanceConfig.defaults(ADMIN))
                .withClock(new ManualWallClock())
                .withEventSink(sink)
                .build();

        for (int i = 0; i < AGENTS; i++) {
            engine.registerAgent(ADMIN, agent(i), "neutral", i + 1, "pk-" + i);
        }
    }

    private static AgentId agent(int i) {
        return AgentId.of("agent-" + i);
    }

    private static <T> List<Future<T>> race(List<Callable<T>> tasks) throws InterruptedException {
        ExecutorService pool = Executors.newFixedThreadPool(tasks.size());
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<T>> futures = new ArrayList<>();
            for (Callable<T> task : tasks) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return task.call();
                }));
            }
            start.countDown();
            return futures;
        } finally {
            pool.shutdown();
            assertTrue(pool.awaitTermination(20, TimeUnit.SECONDS));
        }
    }

    @Test
    void concurrentVotesProduceExactTallies() throws Exception {
        long id = engine.createProposal(agent(0), ProposalTypes.TRUST_UPDATE, "Qm123");

        List<Callable<Void>> tasks = new ArrayList<>();
        for (int i = 0; i < AGENTS; i++) {
            final int n = i;
            tasks.add(() -> {
                engine.vote(agent(n), id, n % 2 == 0);
                return null;
            });
        }
        for (Future<Void> f : race(tasks)) {
            f.get();
        }

        long expectedYes = 0;
        long expectedNo = 0;
        for (int i = 0; i < AGENTS; i++) {
            if (i % 2 == 0) {
                expectedYes += i + 1;
            } else {
                expectedNo += i + 1;
            }
        }

        Proposal p = engine.getProposal(id).orElseThrow();
        assertEquals(expectedYes, p.yesVotes());
        assertEquals(expectedNo, p.noVotes());
        assertEquals(AGENTS, sink.eventsOfType(GovernanceEvent.VoteCast.class).size());
    }

    @Test
    void sameAgentRacingItselfVotesOnce() throws Exception {
        long id = engine.createProposal(agent(0), ProposalTypes.TRUST_UPDATE, "Qm123");
        AtomicInteger alreadyVoted = new AtomicInteger();

        List<Callable<Boolean>> tasks = new ArrayList<>();
        for (int i = 0; i < 16; i++) {
            tasks.add(() -> {
                try {
                    engine.vote(agent(5), id, true);
                    return true;
                } catch (GovernanceException e) {
                    assertEquals(GovernanceErrorKind.ALREADY_VOTED, e.kind());
                    alreadyVoted.incrementAndGet();
                    return false;
                }
            });
        }

        int successes = 0;
        for (Future<Boolean> f : race(tasks)) {
            if (f.get()) {
                successes++;
            }
        }

        assertEquals(1, successes);
        assertEquals(15, alreadyVoted.get());
        assertEquals(6, engine.getProposal(id).orElseThrow().yesVotes());
    }

    @Test
    void concurrentRecordsOfOneRequestIdHaveOneWinner() throws Exception {
        List<Callable<String>> tasks = new ArrayList<>();
        for (int i = 0; i < AGENTS; i++) {
            final int n = i;
            tasks.add(() -> {
                try {
                    engine.recordDecision(agent(n), "req-race", "access_request",
                            "decision-" + n, n, List.of(agent(n).value()), "0x" + n);
                    return "decision-" + n;
                } catch (GovernanceException e) {
                    assertEquals(GovernanceErrorKind.ALREADY_RECORDED, e.kind());
                    return null;
                }
            });
        }

        List<String> winners = new ArrayList<>();
        for (Future<String> f : race(tasks)) {
            String result = f.get();
            if (result != null) {
                winners.add(result);
            }
        }

        assertEquals(1, winners.size());
        assertEquals(winners.get(0), engine.verifyDecision("req-race").decision());
        assertEquals(AGENTS - 1, sink.getRejections().size());
    }

    @Test
    void concurrentProposalsGetDistinctDenseIds() throws Exception {
        List<Callable<Long>> tasks = new ArrayList<>();
        for (int i = 0; i < AGENTS; i++) {
            final int n = i;
            tasks.add(() -> engine.createProposal(agent(n), ProposalTypes.SYSTEM_UPGRADE, "Qm" + n));
        }

        List<Long> ids = new ArrayList<>();
        for (Future<Long> f : race(tasks)) {
            ids.add(f.get());
        }

        ids.sort(Long::compare);
        for (int i = 0; i < AGENTS; i++) {
            assertEquals(i + 1L, ids.get(i));
        }
        assertEquals(AGENTS, engine.summary().proposalCount());
    }
}
