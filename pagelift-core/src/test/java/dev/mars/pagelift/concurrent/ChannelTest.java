package dev.mars.pagelift.concurrent;

/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

class ChannelTest {

    @Test
    @DisplayName("Items are received in send order")
    void testFifo() throws InterruptedException {
        Channel<String> channel = new Channel<>(3);
        channel.send("a");
        channel.send("b");
        channel.send("c");

        assertEquals("a", channel.receive());
        assertEquals("b", channel.receive());
        assertEquals("c", channel.receive());
    }

    @Test
    @DisplayName("Closing keeps queued items receivable")
    void testCloseDrains() throws InterruptedException {
        Channel<Integer> channel = new Channel<>(2);
        channel.send(1);
        channel.send(2);

        assertTrue(channel.close());
        assertFalse(channel.close());
        assertFalse(channel.isDrained());

        assertEquals(1, channel.receive());
        assertEquals(2, channel.receive());
        assertNull(channel.receive());
        assertTrue(channel.isDrained());
    }

    @Test
    void testSendAfterCloseFails() {
        Channel<Integer> channel = new Channel<>(1);
        channel.close();

        assertThrows(IllegalStateException.class, () -> channel.send(1));
        assertFalse(channel.trySend(1));
    }

    @Test
    @DisplayName("Full channel rejects trySend and blocks send until space frees up")
    void testBackpressure() throws Exception {
        Channel<Integer> channel = new Channel<>(1);
        assertTrue(channel.trySend(1));
        assertFalse(channel.trySend(2));

        AtomicBoolean sent = new AtomicBoolean(false);
        CompletableFuture<Void> sender = CompletableFuture.runAsync(() -> {
            try {
                channel.send(2);
                sent.set(true);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });

        Thread.sleep(50);
        assertFalse(sent.get());

        assertEquals(1, channel.receive());
        sender.get(5, TimeUnit.SECONDS);
        assertTrue(sent.get());
        assertEquals(2, channel.receive());
    }

    @Test
    @DisplayName("Capacity zero hands items over directly")
    void testSynchronousHandoff() throws Exception {
        Channel<String> channel = Channel.synchronous();
        assertFalse(channel.trySend("nobody waiting"));

        CompletableFuture<String> receiver = CompletableFuture.supplyAsync(() -> {
            try {
                return channel.receive();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return null;
            }
        });

        channel.send("handoff");
        assertEquals("handoff", receiver.get(5, TimeUnit.SECONDS));
    }

    @Test
    @DisplayName("Blocked receiver wakes up on close")
    void testReceiverWakesOnClose() {
        Channel<String> channel = new Channel<>(4);
        CompletableFuture<String> receiver = CompletableFuture.supplyAsync(() -> {
            try {
                return channel.receive();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return "interrupted";
            }
        });

        channel.close();

        await().atMost(Duration.ofSeconds(2)).until(receiver::isDone);
        assertNull(receiver.join());
    }

    @Test
    void testPollTimesOut() throws InterruptedException {
        Channel<String> channel = new Channel<>(1);
        assertNull(channel.poll(10, TimeUnit.MILLISECONDS));
        assertFalse(channel.isDrained());
    }

    @Test
    void testNegativeCapacityRejected() {
        assertThrows(IllegalArgumentException.class, () -> new Channel<>(-1));
    }
}
