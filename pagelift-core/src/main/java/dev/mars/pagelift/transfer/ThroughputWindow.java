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


/**
 * Fixed-capacity ring buffer of {@code (timestamp, cumulative bytes)} samples giving a
 * moving-average throughput over the most recent samples.
 *
 * <p>Once full, each new sample overwrites the oldest one. Throughput is the byte delta
 * between the oldest and newest retained samples divided by their time delta, so bursts of
 * completions from concurrent workers are smoothed over the whole window.</p>
 */
public class ThroughputWindow {

    private final long[] timestampsNanos;
    private final long[] cumulativeBytes;
    private int head;  // index of the next write
    private int count;

    public ThroughputWindow(int capacity) {
        if (capacity < 2) {
            throw new IllegalArgumentException("Window needs at least two samples: " + capacity);
        }
        this.timestampsNanos = new long[capacity];
        this.cumulativeBytes = new long[capacity];
    }

    public synchronized void addSample(long timestampNanos, long bytes) {
        timestampsNanos[head] = timestampNanos;
        cumulativeBytes[head] = bytes;
        head = (head + 1) % timestampsNanos.length;
        if (count < timestampsNanos.length) {
            count++;
        }
    }

    /**
     * Average bytes per second across the retained samples; zero until two samples spanning
     * a positive interval exist.
     */
    public synchronized double bytesPerSecond() {
        if (count < 2) {
            return 0.0;
        }
        int newest = (head - 1 + timestampsNanos.length) % timestampsNanos.length;
        int oldest = (head - count + timestampsNanos.length) % timestampsNanos.length;
        long elapsedNanos = timestampsNanos[newest] - timestampsNanos[oldest];
        long bytes = cumulativeBytes[newest] - cumulativeBytes[oldest];
        if (elapsedNanos <= 0 || bytes <= 0) {
            return 0.0;
        }
        return bytes * 1_000_000_000.0 / elapsedNanos;
    }

    public synchronized int size() {
        return count;
    }

    public int capacity() {
        return timestampsNanos.length;
    }

    public synchronized void clear() {
        head = 0;
        count = 0;
    }
}
