package dev.mars.pagelift.session;

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


import dev.mars.pagelift.transfer.ProgressListener;

import java.util.Objects;

/**
 * Per-invocation options of an image upload.
 */
public final class UploadOptions {

    /** Parallelism value meaning "use the configured default". */
    public static final int CONFIGURED_PARALLELISM = 0;

    private final int parallelism;
    private final boolean overwrite;
    private final ProgressListener progressListener;

    private UploadOptions(Builder builder) {
        this.parallelism = builder.parallelism;
        this.overwrite = builder.overwrite;
        this.progressListener = builder.progressListener;
    }

    public static UploadOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public int getParallelism() {
        return parallelism;
    }

    /**
     * Whether an existing destination object is replaced instead of resumed.
     */
    public boolean isOverwrite() {
        return overwrite;
    }

    public ProgressListener getProgressListener() {
        return progressListener;
    }

    @Override
    public String toString() {
        return "UploadOptions{parallelism=" + (parallelism == CONFIGURED_PARALLELISM ? "configured" : parallelism)
                + ", overwrite=" + overwrite + "}";
    }

    public static final class Builder {
        private int parallelism = CONFIGURED_PARALLELISM;
        private boolean overwrite;
        private ProgressListener progressListener = ProgressListener.NONE;

        private Builder() {
        }

        public Builder parallelism(int parallelism) {
            if (parallelism < 0) {
                throw new IllegalArgumentException("Parallelism must not be negative: " + parallelism);
            }
            this.parallelism = parallelism;
            return this;
        }

        public Builder overwrite(boolean overwrite) {
            this.overwrite = overwrite;
            return this;
        }

        public Builder progressListener(ProgressListener progressListener) {
            this.progressListener = Objects.requireNonNull(progressListener, "progressListener");
            return this;
        }

        public UploadOptions build() {
            return new UploadOptions(this);
        }
    }
}
