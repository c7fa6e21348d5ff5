package dev.mars.pagelift.core;

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


import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Point-in-time snapshot of upload progress.
 *
 * <p>The remaining duration is absent while no throughput has been measured yet, which is
 * always the case for the first records of a session.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class ProgressRecord {

    private static final double BYTES_PER_MEGABIT = 1024.0 * 1024.0 / 8.0;

    private final Instant timestamp;
    private final long bytesProcessed;
    private final long totalBytes;
    private final double percentComplete;
    private final double averageThroughputBytesPerSecond;
    private final Duration remainingDuration;

    public ProgressRecord(Instant timestamp, long bytesProcessed, long totalBytes, double percentComplete,
                          double averageThroughputBytesPerSecond, Duration remainingDuration) {
        this.timestamp = timestamp;
        this.bytesProcessed = bytesProcessed;
        this.totalBytes = totalBytes;
        this.percentComplete = percentComplete;
        this.averageThroughputBytesPerSecond = averageThroughputBytesPerSecond;
        this.remainingDuration = remainingDuration;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public long getBytesProcessed() {
        return bytesProcessed;
    }

    public long getTotalBytes() {
        return totalBytes;
    }

    /**
     * Completion in the range 0 to 100.
     */
    public double getPercentComplete() {
        return percentComplete;
    }

    public double getAverageThroughputBytesPerSecond() {
        return averageThroughputBytesPerSecond;
    }

    /**
     * Throughput in megabits per second, the unit the console display uses.
     */
    public double getAverageThroughputMbPerSecond() {
        return averageThroughputBytesPerSecond / BYTES_PER_MEGABIT;
    }

    public Optional<Duration> getRemainingDuration() {
        return Optional.ofNullable(remainingDuration);
    }

    public boolean isComplete() {
        return percentComplete >= 100.0;
    }

    @Override
    public String toString() {
        return String.format("ProgressRecord{bytes=%d/%d, percent=%.1f%%, throughput=%.2f Mb/s, remaining=%s}",
                bytesProcessed, totalBytes, percentComplete, getAverageThroughputMbPerSecond(),
                remainingDuration == null ? "unknown" : remainingDuration.toString());
    }
}
