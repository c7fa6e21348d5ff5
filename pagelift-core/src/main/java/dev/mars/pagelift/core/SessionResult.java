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
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable outcome of one upload session.
 *
 * <p>A session is successful only when every upload request completed. When some ranges
 * failed permanently the result carries their identifiers and a message telling the caller
 * to run the upload again; a rerun recomputes the missing ranges from the destination, so it
 * only sends what is still absent.</p>
 *
 * <h3>Usage Example:</h3>
 * <pre>{@code
 * SessionResult result = SessionResult.builder()
 *     .successful(false)
 *     .failedRequestIds(List.of("[0, 4194303]"))
 *     .effectiveBytes(10485760)
 *     .bytesTransferred(6291456)
 *     .percentComplete(60.0)
 *     .message("Upload incomplete ...")
 *     .build();
 * }</pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class SessionResult {

    private final boolean successful;
    private final List<String> failedRequestIds;
    private final long effectiveBytes;
    private final long bytesTransferred;
    private final double percentComplete;
    private final Instant startTime;
    private final Instant endTime;
    private final String message;

    private SessionResult(Builder builder) {
        this.successful = builder.successful;
        this.failedRequestIds = List.copyOf(builder.failedRequestIds);
        this.effectiveBytes = builder.effectiveBytes;
        this.bytesTransferred = builder.bytesTransferred;
        this.percentComplete = builder.percentComplete;
        this.startTime = builder.startTime;
        this.endTime = builder.endTime;
        this.message = builder.message;
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isSuccessful() {
        return successful;
    }

    public List<String> getFailedRequestIds() {
        return failedRequestIds;
    }

    public int getFailedRequestCount() {
        return failedRequestIds.size();
    }

    /**
     * Bytes scheduled for transfer after skipped and empty ranges were removed.
     */
    public long getEffectiveBytes() {
        return effectiveBytes;
    }

    /**
     * Bytes whose write was acknowledged by the destination during this session.
     */
    public long getBytesTransferred() {
        return bytesTransferred;
    }

    public double getPercentComplete() {
        return percentComplete;
    }

    public Optional<Instant> getStartTime() {
        return Optional.ofNullable(startTime);
    }

    public Optional<Instant> getEndTime() {
        return Optional.ofNullable(endTime);
    }

    public Optional<Duration> getDuration() {
        if (startTime == null || endTime == null) {
            return Optional.empty();
        }
        return Optional.of(Duration.between(startTime, endTime));
    }

    public Optional<String> getMessage() {
        return Optional.ofNullable(message);
    }

    @Override
    public String toString() {
        return "SessionResult{" +
                "successful=" + successful +
                ", failedRequests=" + failedRequestIds.size() +
                ", effectiveBytes=" + effectiveBytes +
                ", bytesTransferred=" + bytesTransferred +
                ", percentComplete=" + String.format("%.1f", percentComplete) +
                '}';
    }

    public static final class Builder {
        private boolean successful;
        private List<String> failedRequestIds = List.of();
        private long effectiveBytes;
        private long bytesTransferred;
        private double percentComplete;
        private Instant startTime;
        private Instant endTime;
        private String message;

        private Builder() {
        }

        public Builder successful(boolean successful) {
            this.successful = successful;
            return this;
        }

        public Builder failedRequestIds(List<String> failedRequestIds) {
            this.failedRequestIds = Objects.requireNonNull(failedRequestIds, "failedRequestIds");
            return this;
        }

        public Builder effectiveBytes(long effectiveBytes) {
            this.effectiveBytes = effectiveBytes;
            return this;
        }

        public Builder bytesTransferred(long bytesTransferred) {
            this.bytesTransferred = bytesTransferred;
            return this;
        }

        public Builder percentComplete(double percentComplete) {
            this.percentComplete = percentComplete;
            return this;
        }

        public Builder startTime(Instant startTime) {
            this.startTime = startTime;
            return this;
        }

        public Builder endTime(Instant endTime) {
            this.endTime = endTime;
            return this;
        }

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public SessionResult build() {
            if (successful && !failedRequestIds.isEmpty()) {
                throw new IllegalStateException("A successful session cannot report failed requests");
            }
            return new SessionResult(this);
        }
    }
}
