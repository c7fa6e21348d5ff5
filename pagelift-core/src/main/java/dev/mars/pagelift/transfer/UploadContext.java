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


import dev.mars.pagelift.core.ByteRange;
import dev.mars.pagelift.source.SourceStream;
import dev.mars.pagelift.storage.PageBlobClient;

import java.util.List;
import java.util.Objects;

/**
 * Everything one upload session needs: where to read, what to send, where to send it and how
 * many writes may be in flight.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class UploadContext {

    private final SourceStream source;
    private final List<ByteRange> ranges;
    private final long alreadyProcessedBytes;
    private final PageBlobClient client;
    private final int parallelism;
    private final boolean resume;
    private final ProgressListener progressListener;

    private UploadContext(Builder builder) {
        this.source = builder.source;
        this.ranges = List.copyOf(builder.ranges);
        this.alreadyProcessedBytes = builder.alreadyProcessedBytes;
        this.client = builder.client;
        this.parallelism = builder.parallelism;
        this.resume = builder.resume;
        this.progressListener = builder.progressListener;
    }

    public static Builder builder() {
        return new Builder();
    }

    public SourceStream getSource() {
        return source;
    }

    /**
     * Ranges to upload, in the order they are read.
     */
    public List<ByteRange> getRanges() {
        return ranges;
    }

    /**
     * Bytes counted as complete before the session starts: skipped and empty ranges.
     */
    public long getAlreadyProcessedBytes() {
        return alreadyProcessedBytes;
    }

    public PageBlobClient getClient() {
        return client;
    }

    public int getParallelism() {
        return parallelism;
    }

    public boolean isResume() {
        return resume;
    }

    public ProgressListener getProgressListener() {
        return progressListener;
    }

    @Override
    public String toString() {
        return "UploadContext{" +
                "object='" + client.getName() + '\'' +
                ", ranges=" + ranges.size() +
                ", alreadyProcessedBytes=" + alreadyProcessedBytes +
                ", parallelism=" + parallelism +
                ", resume=" + resume +
                '}';
    }

    public static final class Builder {
        private SourceStream source;
        private List<ByteRange> ranges = List.of();
        private long alreadyProcessedBytes;
        private PageBlobClient client;
        private int parallelism = 1;
        private boolean resume;
        private ProgressListener progressListener = ProgressListener.NONE;

        private Builder() {
        }

        public Builder source(SourceStream source) {
            this.source = source;
            return this;
        }

        public Builder ranges(List<ByteRange> ranges) {
            this.ranges = Objects.requireNonNull(ranges, "ranges");
            return this;
        }

        public Builder alreadyProcessedBytes(long alreadyProcessedBytes) {
            this.alreadyProcessedBytes = alreadyProcessedBytes;
            return this;
        }

        public Builder client(PageBlobClient client) {
            this.client = client;
            return this;
        }

        public Builder parallelism(int parallelism) {
            this.parallelism = parallelism;
            return this;
        }

        public Builder resume(boolean resume) {
            this.resume = resume;
            return this;
        }

        public Builder progressListener(ProgressListener progressListener) {
            this.progressListener = Objects.requireNonNull(progressListener, "progressListener");
            return this;
        }

        public UploadContext build() {
            Objects.requireNonNull(source, "source");
            Objects.requireNonNull(client, "client");
            if (parallelism <= 0) {
                throw new IllegalArgumentException("Parallelism must be positive: " + parallelism);
            }
            if (alreadyProcessedBytes < 0) {
                throw new IllegalArgumentException("Already processed bytes must not be negative: " + alreadyProcessedBytes);
            }
            return new UploadContext(this);
        }
    }
}
