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


import dev.mars.pagelift.core.exceptions.TransferException;

import java.util.Objects;

/**
 * A request that failed permanently, after its retry policy declined another attempt.
 */
public final class RequestFailure {

    private final String requestId;
    private final Throwable cause;
    private final int attempts;

    public RequestFailure(String requestId, Throwable cause, int attempts) {
        this.requestId = Objects.requireNonNull(requestId, "requestId");
        this.cause = Objects.requireNonNull(cause, "cause");
        this.attempts = attempts;
    }

    public String getRequestId() {
        return requestId;
    }

    /**
     * Failure of the last attempt.
     */
    public Throwable getCause() {
        return cause;
    }

    public int getAttempts() {
        return attempts;
    }

    public TransferException toException() {
        return new TransferException(requestId, "gave up after " + attempts + " attempt(s): " + cause.getMessage(), cause);
    }

    @Override
    public String toString() {
        return "RequestFailure{requestId='" + requestId + "', attempts=" + attempts + ", cause=" + cause + "}";
    }
}
