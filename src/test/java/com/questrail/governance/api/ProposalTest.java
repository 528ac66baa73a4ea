package com.questrail.governance.api;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ProposalTest
 * -----------------------------------------------------------------------------
 * Window arithmetic and tally transitions of the immutable proposal snapshot.
 */
class ProposalTest {

    private static final Instant START = Instant.parse("2025-01-01T00:00:00Z");

    private static Proposal fresh() {
        return Proposal.open(1, AgentId.of("alice"), "TRUST_UPDATE", "Qm123",
                START, Duration.ofHours(24), Duration.ofHours(2));
    }

    @Test
    void openSetsWindowAndZeroTallies() {
        Proposal p = fresh();

        assertEquals(START, p.votingStart());
        assertEquals(START.plus(Duration.ofHours(24)), p.votingEnd());
        assertEquals(START.plus(Duration.ofHours(26)), p.executableAt());
        assertEquals(0, p.yesVotes());
        assertEquals(0, p.noVotes());
        assertFalse(p.executed());
        assertFalse(p.cancelled());
    }

    @Test
    void votingWindowIsClosedOnBothEnds() {
        Proposal p = fresh();

        assertTrue(p.isVotingOpen(p.votingStart()));
        assertTrue(p.isVotingOpen(p.votingEnd()));
        assertFalse(p.isVotingOpen(p.votingStart().minusNanos(1)));
        assertFalse(p.isVotingOpen(p.votingEnd().plusNanos(1)));

        assertFalse(p.hasVotingEnded(p.votingEnd()));
        assertTrue(p.hasVotingEnded(p.votingEnd().plusNanos(1)));
    }

    @Test
    void withVoteAddsWeightToTheMatchingSide() {
        Proposal p = fresh().withVote(true, 2).withVote(false, 1).withVote(true, 5);

        assertEquals(7, p.yesVotes());
        assertEquals(1, p.noVotes());
        assertEquals(8, p.totalVotes());
    }

    @Test
    void withVoteRejectsNonPositiveWeight() {
        assertThrows(IllegalArgumentException.class, () -> fresh().withVote(true, 0));
    }

    @Test
    void tieDoesNotHaveMajority() {
        Proposal p = fresh().withVote(true, 3).withVote(false, 3);
        assertFalse(p.hasMajority());
    }

    @Test
    void transitionsAreTerminal() {
        assertTrue(fresh().markExecuted().isTerminal());
        assertTrue(fresh().markCancelled().isTerminal());
        assertThrows(IllegalArgumentException.class, () -> fresh().markExecuted().markCancelled());
    }

    @Test
    void constructorRejectsInvertedWindow() {
        assertThrows(IllegalArgumentException.class, () -> new Proposal(
                1, AgentId.of("alice"), "T", "h",
                START, START.minusSeconds(1), Duration.ZERO,
                0, 0, false, false));
    }

    @Test
    void constructorRejectsZeroId() {
        assertThrows(IllegalArgumentException.class, () -> new Proposal(
                0, AgentId.of("alice"), "T", "h",
                START, START, Duration.ZERO,
                0, 0, false, false));
    }
}
