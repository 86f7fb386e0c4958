package com.agentdeck.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub event bus for agent network events.
 * <p>
 * Supports per-network subscriptions and global subscriptions that receive all events.
 * Each subscriber gets its own {@link Mailbox}, so publishing never waits on a consumer.
 * Every network keeps a bounded journal of recent events, numbered with a monotonic
 * sequence, so a reconnecting observer can catch up from the last event it saw.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    static final int DEFAULT_JOURNAL_CAPACITY = 1000;

    private final int journalCapacity;

    /** Per-network state keyed by networkId. */
    private final ConcurrentHashMap<String, NetworkChannel> channels = new ConcurrentHashMap<>();

    /** Global subscribers that receive events from all networks. */
    private final CopyOnWriteArrayList<Mailbox<AgentEvent>> globalSubscribers = new CopyOnWriteArrayList<>();

    public EventBus() {
        this(DEFAULT_JOURNAL_CAPACITY);
    }

    public EventBus(int journalCapacity) {
        this.journalCapacity = journalCapacity;
    }

    /**
     * Publish an event to all matching subscribers (network-specific and global).
     *
     * @return the published event with its sequence number
     */
    public AgentEvent publish(AgentEventType type, AgentRef agent, Map<String, Object> payload) {
        NetworkChannel channel = channelFor(agent.networkId());
        AgentEvent event;
        synchronized (channel) {
            event = new AgentEvent(++channel.lastSeq, UUID.randomUUID().toString(), type,
                    agent.networkId(), agent.agentId(), agent.agentType(), agent.agentName(),
                    payload, Instant.now());
            channel.journal.addLast(event);
            if (channel.journal.size() > journalCapacity) {
                channel.journal.removeFirst();
            }
            for (Mailbox<AgentEvent> subscriber : channel.subscribers) {
                subscriber.post(event);
            }
            for (Mailbox<AgentEvent> subscriber : globalSubscribers) {
                subscriber.post(event);
            }
        }
        log.debug("Published {} #{} for network {}", type.wireName(), event.seq(), agent.networkId());
        return event;
    }

    /**
     * Subscribe to live events for a specific network.
     *
     * @param networkId the network to subscribe to
     * @param consumer  callback invoked for each event
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(String networkId, Consumer<AgentEvent> consumer) {
        NetworkChannel channel = channelFor(networkId);
        Mailbox<AgentEvent> mailbox = new Mailbox<>(networkId, consumer);
        channel.subscribers.add(mailbox);
        log.debug("Subscribed to network {}", networkId);
        return () -> {
            channel.subscribers.remove(mailbox);
            mailbox.close();
        };
    }

    /**
     * Subscribe with replay. The consumer first receives a {@code connected} event,
     * then a {@code history} event listing journaled events after {@code afterSeq},
     * then every live event, with nothing missed or repeated in between.
     */
    public Subscription subscribe(String networkId, long afterSeq, Consumer<AgentEvent> consumer) {
        NetworkChannel channel = channelFor(networkId);
        Mailbox<AgentEvent> mailbox = new Mailbox<>(networkId, consumer);
        synchronized (channel) {
            List<AgentEvent> missed = new ArrayList<>();
            for (AgentEvent event : channel.journal) {
                if (event.seq() > afterSeq) {
                    missed.add(event);
                }
            }
            AgentRef ref = AgentRef.network(networkId);
            mailbox.post(synthetic(AgentEventType.CONNECTED, ref, channel.lastSeq, Map.of("lastSeq", channel.lastSeq)));
            mailbox.post(synthetic(AgentEventType.HISTORY, ref, channel.lastSeq, Map.of("events", List.copyOf(missed))));
            channel.subscribers.add(mailbox);
        }
        return () -> {
            channel.subscribers.remove(mailbox);
            mailbox.close();
        };
    }

    /**
     * Subscribe to events from all networks (global subscription).
     *
     * @param consumer callback invoked for each event regardless of network
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribeAll(Consumer<AgentEvent> consumer) {
        Mailbox<AgentEvent> mailbox = new Mailbox<>("global", consumer);
        globalSubscribers.add(mailbox);
        log.debug("Subscribed to all events (global)");
        return () -> {
            globalSubscribers.remove(mailbox);
            mailbox.close();
        };
    }

    /**
     * Journaled events of a network with a sequence number above {@code afterSeq}.
     */
    public List<AgentEvent> history(String networkId, long afterSeq) {
        NetworkChannel channel = channels.get(networkId);
        if (channel == null) {
            return List.of();
        }
        synchronized (channel) {
            return channel.journal.stream().filter(e -> e.seq() > afterSeq).toList();
        }
    }

    /**
     * Drops a network's journal and closes its subscribers.
     */
    public void closeNetwork(String networkId) {
        NetworkChannel channel = channels.remove(networkId);
        if (channel != null) {
            channel.subscribers.forEach(Mailbox::close);
        }
    }

    /**
     * Handle for cancelling a subscription.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private NetworkChannel channelFor(String networkId) {
        return channels.computeIfAbsent(networkId, k -> new NetworkChannel());
    }

    private static AgentEvent synthetic(AgentEventType type, AgentRef ref, long seq, Map<String, Object> payload) {
        return new AgentEvent(seq, UUID.randomUUID().toString(), type, ref.networkId(), null, null, null,
                payload, Instant.now());
    }

    private static final class NetworkChannel {
        final Deque<AgentEvent> journal = new ArrayDeque<>();
        final CopyOnWriteArrayList<Mailbox<AgentEvent>> subscribers = new CopyOnWriteArrayList<>();
        long lastSeq;
    }
}
