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


import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Bounded, closable queue used to pass messages between the threads of an upload session.
 *
 * <p>A capacity of zero gives a synchronous handoff: {@link #send(Object)} returns only once
 * a receiver has taken the item. Senders block while the channel is full, which is how the
 * dispatch loop is throttled by the workers.</p>
 *
 * <p>Closing never discards queued items. Receivers keep draining them and get {@code null}
 * once the channel is closed and empty. Blocked parties wake up within
 * {@value #POLL_INTERVAL_MS} ms of a close.</p>
 *
 * @param <T> message type
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class Channel<T> {

    static final long POLL_INTERVAL_MS = 10;

    private final BlockingQueue<T> queue;
    private final int capacity;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public Channel(int capacity) {
        if (capacity < 0) {
            throw new IllegalArgumentException("Channel capacity must not be negative: " + capacity);
        }
        this.capacity = capacity;
        this.queue = capacity == 0 ? new SynchronousQueue<>() : new LinkedBlockingQueue<>(capacity);
    }

    public static <T> Channel<T> unbounded() {
        return new Channel<>(Integer.MAX_VALUE);
    }

    public static <T> Channel<T> synchronous() {
        return new Channel<>(0);
    }

    /**
     * Sends an item, blocking while the channel is full.
     *
     * @throws IllegalStateException if the channel is or becomes closed before the item is accepted
     * @throws InterruptedException if interrupted while waiting
     */
    public void send(T item) throws InterruptedException {
        Objects.requireNonNull(item, "item");
        while (true) {
            if (closed.get()) {
                throw new IllegalStateException("Channel is closed");
            }
            if (queue.offer(item, POLL_INTERVAL_MS, TimeUnit.MILLISECONDS)) {
                return;
            }
        }
    }

    /**
     * Sends an item only if that is possible without waiting.
     *
     * @return false if the channel is closed, full, or (for capacity zero) no receiver is waiting
     */
    public boolean trySend(T item) {
        Objects.requireNonNull(item, "item");
        return !closed.get() && queue.offer(item);
    }

    /**
     * Receives the next item, blocking until one is available.
     *
     * @return the item, or {@code null} once the channel is closed and drained
     * @throws InterruptedException if interrupted while waiting
     */
    public T receive() throws InterruptedException {
        while (true) {
            T item = queue.poll(POLL_INTERVAL_MS, TimeUnit.MILLISECONDS);
            if (item != null) {
                return item;
            }
            if (closed.get()) {
                // a sender may have slipped an item in just before the close
                return queue.poll();
            }
        }
    }

    /**
     * Receives the next item, waiting at most the given time.
     *
     * @return the item, or {@code null} on timeout or when the channel is closed and drained;
     *         use {@link #isDrained()} to tell the two apart
     */
    public T poll(long timeout, TimeUnit unit) throws InterruptedException {
        return queue.poll(timeout, unit);
    }

    /**
     * Closes the channel. Further sends fail; queued items remain receivable.
     *
     * @return true if this call closed the channel
     */
    public boolean close() {
        return closed.compareAndSet(false, true);
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * True once the channel is closed and holds no more items.
     */
    public boolean isDrained() {
        return closed.get() && queue.isEmpty();
    }

    public int getCapacity() {
        return capacity;
    }

    @Override
    public String toString() {
        return "Channel{capacity=" + capacity + ", queued=" + queue.size() + ", closed=" + closed.get() + "}";
    }
}
