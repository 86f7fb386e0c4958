package com.agentdeck.core.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class MdcContextTest {

    @AfterEach
    void tearDown() {
        MdcContext.clear();
    }

    @Test
    @DisplayName("setNetwork puts networkId in MDC")
    void setNetwork() {
        MdcContext.setNetwork("N-1");
        assertEquals("N-1", MDC.get("networkId"));
    }

    @Test
    @DisplayName("setAgent puts networkId, agentId and sessionId in MDC")
    void setAgent() {
        MdcContext.setAgent("N-1", "A-1", "S-1");
        assertEquals("N-1", MDC.get("networkId"));
        assertEquals("A-1", MDC.get("agentId"));
        assertEquals("S-1", MDC.get("sessionId"));
    }

    @Test
    @DisplayName("setAgent keeps the network when none is given")
    void setAgentWithoutNetwork() {
        MdcContext.setNetwork("N-1");
        MdcContext.setAgent(null, "A-2", "S-2");
        assertEquals("N-1", MDC.get("networkId"));
        assertEquals("A-2", MDC.get("agentId"));
    }

    @Test
    @DisplayName("clear removes all agentdeck MDC keys")
    void clear() {
        MdcContext.setAgent("N-1", "A-1", "S-1");
        MdcContext.clear();
        assertNull(MDC.get("networkId"));
        assertNull(MDC.get("agentId"));
        assertNull(MDC.get("sessionId"));
    }
}
