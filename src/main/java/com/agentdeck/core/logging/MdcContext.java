package com.agentdeck.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing agentdeck MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setNetwork(String networkId) {
        MDC.put("networkId", networkId);
    }

    public static void setAgent(String networkId, String agentId, String sessionId) {
        if (networkId != null) {
            MDC.put("networkId", networkId);
        }
        MDC.put("agentId", agentId);
        MDC.put("sessionId", sessionId);
    }

    public static void clear() {
        MDC.remove("networkId");
        MDC.remove("agentId");
        MDC.remove("sessionId");
    }
}
