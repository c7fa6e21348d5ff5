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


import java.util.Objects;

/**
 * One unit of work for the {@link WorkerPool}: an identifier, idempotent work, and the
 * retry policy consulted when an attempt fails.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class UploadRequest {

    private final String id;
    private final UploadWork work;
    private final RetryPolicy retryPolicy;

    public UploadRequest(String id, UploadWork work, RetryPolicy retryPolicy) {
        this.id = Objects.requireNonNull(id, "id");
        this.work = Objects.requireNonNull(work, "work");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
    }

    public String getId() {
        return id;
    }

    public UploadWork getWork() {
        return work;
    }

    public RetryPolicy getRetryPolicy() {
        return retryPolicy;
    }

    @Override
    public String toString() {
        return "UploadRequest{id='" + id + "', retryPolicy=" + retryPolicy + "}";
    }
}
