package dev.mars.pagelift.transfer;

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


import dev.mars.pagelift.concurrent.Channel;
import dev.mars.pagelift.config.PageliftConfiguration;
import dev.mars.pagelift.core.ProgressRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Turns acknowledged byte counts into a periodic stream of {@link ProgressRecord}s with
 * completion percentage, moving-average throughput and estimated remaining time.
 * Thread-safe: workers report bytes concurrently while a single ticker thread samples them.
 *
 * <p>Records are offered to a small bounded channel without blocking. A consumer that falls
 * behind misses ticks rather than stalling the ticker, and {@link #stop()} never waits on
 * the consumer.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class ProgressEstimator {
    private static final Logger logger = LoggerFactory.getLogger(ProgressEstimator.class);

    private static final int RECORD_BUFFER = 16;

    private final Duration tickInterval;
    private final ThroughputWindow window;
    private final AtomicLong bytesProcessed = new AtomicLong(0);
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    private volatile long totalBytes;
    private volatile Channel<ProgressRecord> records;
    private ScheduledExecutorService ticker;

    public ProgressEstimator(PageliftConfiguration configuration) {
        this(configuration.getProgressTickInterval(), configuration.getProgressWindowSize());
    }

    public ProgressEstimator(Duration tickInterval, int windowSize) {
        if (tickInterval.isZero() || tickInterval.isNegative()) {
            throw new IllegalArgumentException("Tick interval must be positive: " + tickInterval);
        }
        this.tickInterval = tickInterval;
        this.window = new ThroughputWindow(windowSize);
    }

    /**
     * Starts ticking.
     *
     * @param parallelism           number of workers reporting bytes
     * @param alreadyProcessedBytes bytes complete before this session started
     * @param totalBytes            bytes that make up 100%, including the already processed ones
     * @return the channel receiving one record per tick, closed by {@link #stop()}
     */
    public Channel<ProgressRecord> start(int parallelism, long alreadyProcessedBytes, long totalBytes) {
        if (alreadyProcessedBytes < 0 || totalBytes < alreadyProcessedBytes) {
            throw new IllegalArgumentException("Invalid progress bounds: already processed " + alreadyProcessedBytes
                    + " of " + totalBytes);
        }
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Progress estimator already started");
        }
        this.totalBytes = totalBytes;
        this.bytesProcessed.set(alreadyProcessedBytes);
        this.records = new Channel<>(RECORD_BUFFER);
        window.addSample(System.nanoTime(), alreadyProcessedBytes);

        ticker = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "pagelift-progress");
            t.setDaemon(true);
            return t;
        });
        long intervalMs = Math.max(1, tickInterval.toMillis());
        ticker.scheduleAtFixedRate(this::tick, intervalMs, intervalMs, TimeUnit.MILLISECONDS);

        logger.debug("Tracking progress of {} bytes ({} already processed) across {} workers",
                totalBytes, alreadyProcessedBytes, parallelism);
        return records;
    }

    /**
     * Adds bytes whose write has been acknowledged by the destination.
     */
    public void reportBytesProcessed(long bytes) {
        if (bytes < 0) {
            throw new IllegalArgumentException("Byte count must not be negative: " + bytes);
        }
        bytesProcessed.addAndGet(bytes);
    }

    public long getBytesProcessed() {
        return bytesProcessed.get();
    }

    public long getTotalBytes() {
        return totalBytes;
    }

    /**
     * Current progress without waiting for the next tick.
     */
    public ProgressRecord snapshot() {
        return buildRecord();
    }

    /**
     * Stops ticking and closes the record channel. Safe to call more than once.
     */
    public void stop() {
        if (!started.get() || !stopped.compareAndSet(false, true)) {
            return;
        }
        ticker.shutdownNow();
        records.close();
        logger.debug("Progress estimator stopped at {} of {} bytes", bytesProcessed.get(), totalBytes);
    }

    void tick() {
        if (stopped.get()) {
            return;
        }
        try {
            window.addSample(System.nanoTime(), bytesProcessed.get());
            ProgressRecord record = buildRecord();
            if (!records.trySend(record)) {
                logger.trace("Progress consumer behind, dropped {}", record);
            }
        } catch (RuntimeException e) {
            logger.warn("Progress tick failed: {}", e.getMessage(), e);
        }
    }

    private ProgressRecord buildRecord() {
        long processed = bytesProcessed.get();
        long total = totalBytes;
        double percent = total <= 0 ? 100.0 : Math.min(100.0, processed * 100.0 / total);
        double throughput = window.bytesPerSecond();

        long remainingBytes = Math.max(0, total - processed);
        Duration remaining;
        if (remainingBytes == 0) {
            remaining = Duration.ZERO;
        } else if (throughput > 0) {
            remaining = Duration.ofMillis((long) (remainingBytes / throughput * 1000.0));
        } else {
            remaining = null;
        }
        return new ProgressRecord(Instant.now(), processed, total, percent, throughput, remaining);
    }
}
