package com.agentdeck.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Delivers items to one subscriber on its own thread, in order.
 * Publishing only enqueues, so a slow subscriber never holds up the publisher.
 */
public final class Mailbox<T> {

    private static final Logger log = LoggerFactory.getLogger(Mailbox.class);

    private final Consumer<T> subscriber;
    private final ExecutorService executor;

    public Mailbox(String name, Consumer<T> subscriber) {
        this.subscriber = subscriber;
        this.executor = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "mailbox-" + name);
            thread.setDaemon(true);
            return thread;
        });
    }

    public void post(T item) {
        try {
            executor.execute(() -> deliverSafely(item));
        } catch (RejectedExecutionException e) {
            log.debug("Dropping item for closed mailbox");
        }
    }

    public void close() {
        executor.shutdown();
    }

    /**
     * Waits until everything posted so far has been delivered. Closes the mailbox.
     */
    public boolean drain(long timeout, TimeUnit unit) throws InterruptedException {
        executor.shutdown();
        return executor.awaitTermination(timeout, unit);
    }

    private void deliverSafely(T item) {
        try {
            subscriber.accept(item);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing {}: {}", item.getClass().getSimpleName(), e.getMessage(), e);
        }
    }
}
