package com.agentdeck.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Locale;

/**
 * Centralised Micrometer metrics for agent sessions.
 */
@Service
public class AgentDeckMetrics {

    private final MeterRegistry registry;

    public AgentDeckMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordPermissionDecision(String decision, String source) {
        Counter.builder("agentdeck.permission.decisions")
                .tag("decision", decision.toLowerCase(Locale.ROOT))
                .tag("source", source.toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
    }

    /**
     * Counts protocol lines by outcome: {@code decoded}, {@code empty} or {@code control}.
     */
    public void recordProtocolLine(String outcome) {
        Counter.builder("agentdeck.protocol.lines")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordTurn(String outcome, Duration duration) {
        Counter.builder("agentdeck.turns.total")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
        Timer.builder("agentdeck.turn.duration")
                .register(registry)
                .record(duration);
    }

    public void recordTokens(String kind, long count) {
        if (count <= 0) {
            return;
        }
        DistributionSummary.builder("agentdeck.tokens")
                .tag("kind", kind)
                .register(registry)
                .record(count);
    }

    public void recordAbort(boolean forced) {
        Counter.builder("agentdeck.aborts.total")
                .tag("forced", String.valueOf(forced))
                .register(registry)
                .increment();
    }

    public void incrementOrphanedToolResults() {
        Counter.builder("agentdeck.tool_results.orphaned")
                .description("Tool results that arrived without a matching tool call")
                .register(registry)
                .increment();
    }

    public void recordPermissionWait(Duration waited, boolean timedOut) {
        Timer.builder("agentdeck.permission.wait")
                .tag("timed_out", String.valueOf(timedOut))
                .register(registry)
                .record(waited);
    }
}
