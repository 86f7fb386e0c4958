package com.agentdeck.core.events;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class MailboxTest {

    @Test
    @DisplayName("post does not wait for a slow subscriber")
    void postDoesNotBlock() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        List<Integer> received = new CopyOnWriteArrayList<>();
        Mailbox<Integer> mailbox = new Mailbox<>("slow", i -> {
            try {
                release.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            received.add(i);
        });

        long start = System.nanoTime();
        for (int i = 0; i < 100; i++) {
            mailbox.post(i);
        }
        assertTrue(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start) < 1000);

        release.countDown();
        assertTrue(mailbox.drain(5, TimeUnit.SECONDS));
        assertEquals(100, received.size());
        assertEquals(0, received.get(0));
        assertEquals(99, received.get(99));
    }

    @Test
    @DisplayName("posting to a closed mailbox is ignored")
    void closed() {
        Mailbox<String> mailbox = new Mailbox<>("closed", s -> {});
        mailbox.close();

        assertDoesNotThrow(() -> mailbox.post("late"));
    }
}
