package com.questrail.governance.api;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AgentTests
{
    @Test
    void unregisteredRecordIsZeroValued() {
        Agent agent = Agent.unregistered(AgentId.of("ghost"));

        assertEquals(AgentId.of("ghost"), agent.id());
        assertEquals("", agent.agentType());
        assertEquals(0, agent.votingPower());
        assertFalse(agent.active());
        assertEquals("", agent.publicKey());
    }

    @Test
    void deactivatedKeepsEverythingButTheActiveFlag() {
        Agent agent = new Agent(AgentId.of("alice"), "strict", 2, true, "pk-alice");
        Agent off = agent.deactivated();

        assertFalse(off.active());
        assertEquals(agent.agentType(), off.agentType());
        assertEquals(agent.votingPower(), off.votingPower());
        assertEquals(agent.publicKey(), off.publicKey());
    }

    @Test
    void agentIdEqualityIsByValue() {
        assertEquals(AgentId.of("alice"), new AgentId("alice"));
        assertNotEquals(AgentId.of("alice"), AgentId.of("bob"));
    }

    @Test
    void blankAgentIdIsEmpty() {
        assertTrue(AgentId.NONE.isEmpty());
        assertTrue(AgentId.of("   ").isEmpty());
        assertFalse(AgentId.of("alice").isEmpty());
        assertThrows(NullPointerException.class, () -> AgentId.of(null));
    }
}
