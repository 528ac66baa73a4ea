package com.questrail.governance.store;

import com.questrail.governance.api.Agent;
import com.questrail.governance.api.AgentId;
import com.questrail.governance.api.CastVote;
import com.questrail.governance.api.ConsensusDecision;
import com.questrail.governance.api.Proposal;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryLedgerStoreTest {

    private static final Instant NOW = Instant.parse("2025-01-01T00:00:00Z");
    private static final AgentId ALICE = AgentId.of("alice");
    private static final AgentId BOB = AgentId.of("bob");

    private InMemoryLedgerStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryLedgerStore();
    }

    @Test
    void absentKeysAreEmptyNotDefaulted() {
        assertTrue(store.findAgent(ALICE).isEmpty());
        assertTrue(store.findProposal(1).isEmpty());
        assertTrue(store.findVote(1, ALICE).isEmpty());
        assertTrue(store.findDecision("req-1").isEmpty());
        assertEquals(0, store.proposalCount());
        assertEquals(0, store.decisionCount());
    }

    @Test
    void saveAgentReplacesByIdentity() {
        store.saveAgent(new Agent(ALICE, "strict", 2, true, "pk"));
        store.saveAgent(new Agent(ALICE, "strict", 2, false, "pk"));

        assertEquals(1, store.findAllAgents().size());
        assertFalse(store.findAgent(ALICE).orElseThrow().active());
    }

    @Test
    void votesAreNestedPerProposal() {
        store.saveProposal(Proposal.open(1, ALICE, "T", "h", NOW, Duration.ofHours(1), Duration.ZERO));
        store.saveProposal(Proposal.open(2, ALICE, "T", "h", NOW, Duration.ofHours(1), Duration.ZERO));

        store.saveVote(1, new CastVote(ALICE, true, 2, NOW));
        store.saveVote(2, new CastVote(BOB, false, 1, NOW));

        assertTrue(store.findVote(1, ALICE).isPresent());
        assertTrue(store.findVote(1, BOB).isEmpty());
        assertTrue(store.findVote(2, ALICE).isEmpty());
        assertTrue(store.findVote(2, BOB).isPresent());
        assertEquals(2, store.proposalCount());
    }

    @Test
    void laterVoteReplacesEarlierForSameVoter() {
        store.saveVote(1, new CastVote(ALICE, true, 2, NOW));
        store.saveVote(1, new CastVote(ALICE, false, 2, NOW.plusSeconds(1)));

        assertFalse(store.findVote(1, ALICE).orElseThrow().approve());
    }

    @Test
    void decisionsAreKeyedByRequestId() {
        store.saveDecision(new ConsensusDecision("req-1", "access_request", "allow", 92.0,
                List.of("agentA"), NOW, "0xabc", true, ALICE));

        assertEquals("allow", store.findDecision("req-1").orElseThrow().finalDecision());
        assertEquals(1, store.decisionCount());
    }
}
