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


import dev.mars.pagelift.config.PageliftConfiguration;
import dev.mars.pagelift.core.exceptions.SourceReadException;

import java.time.Duration;

/**
 * Decides whether a failed attempt of an {@link UploadRequest} is tried again, and after
 * how long. Each request carries its own policy.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public interface RetryPolicy {

    /**
     * @param failure the failure of the attempt that just ended
     * @param attempt number of attempts made so far, starting at 1
     */
    boolean shouldRetry(Throwable failure, int attempt);

    /**
     * Delay before the attempt following {@code attempt}.
     */
    Duration backoff(int attempt);

    /**
     * Retries every failure immediately, forever.
     */
    static RetryPolicy always() {
        return new RetryPolicy() {
            @Override
            public boolean shouldRetry(Throwable failure, int attempt) {
                return isRetryable(failure);
            }

            @Override
            public Duration backoff(int attempt) {
                return Duration.ZERO;
            }

            @Override
            public String toString() {
                return "RetryPolicy.always";
            }
        };
    }

    static RetryPolicy never() {
        return new RetryPolicy() {
            @Override
            public boolean shouldRetry(Throwable failure, int attempt) {
                return false;
            }

            @Override
            public Duration backoff(int attempt) {
                return Duration.ZERO;
            }

            @Override
            public String toString() {
                return "RetryPolicy.never";
            }
        };
    }

    /**
     * Allows {@code maxRetries} retries after the first attempt, waiting
     * {@code initialDelay * 2^(attempt-1)} between attempts, capped at {@code maxDelay}.
     * A negative {@code maxRetries} removes the limit.
     */
    static RetryPolicy maxRetries(int maxRetries, Duration initialDelay, Duration maxDelay) {
        return new ExponentialBackoff(maxRetries, initialDelay, maxDelay);
    }

    static RetryPolicy fromConfiguration(PageliftConfiguration configuration) {
        return maxRetries(configuration.getMaxRetries(),
                Duration.ofMillis(configuration.getRetryDelayMs()),
                Duration.ofMillis(configuration.getRetryMaxDelayMs()));
    }

    /**
     * Source failures and interruptions end a request regardless of policy.
     */
    static boolean isRetryable(Throwable failure) {
        return !(failure instanceof SourceReadException) && !(failure instanceof InterruptedException);
    }

    final class ExponentialBackoff implements RetryPolicy {
        private final int maxRetries;
        private final Duration initialDelay;
        private final Duration maxDelay;

        ExponentialBackoff(int maxRetries, Duration initialDelay, Duration maxDelay) {
            if (initialDelay.isNegative() || maxDelay.isNegative()) {
                throw new IllegalArgumentException("Retry delays must not be negative");
            }
            this.maxRetries = maxRetries;
            this.initialDelay = initialDelay;
            this.maxDelay = maxDelay;
        }

        @Override
        public boolean shouldRetry(Throwable failure, int attempt) {
            if (!isRetryable(failure)) {
                return false;
            }
            return maxRetries < 0 || attempt <= maxRetries;
        }

        @Override
        public Duration backoff(int attempt) {
            if (initialDelay.isZero()) {
                return Duration.ZERO;
            }
            int shift = Math.min(Math.max(attempt - 1, 0), 30);
            long delayMs = initialDelay.toMillis() << shift;
            if (delayMs <= 0 || delayMs > maxDelay.toMillis()) {
                return maxDelay;
            }
            return Duration.ofMillis(delayMs);
        }

        public int getMaxRetries() {
            return maxRetries;
        }

        @Override
        public String toString() {
            return "RetryPolicy.maxRetries{maxRetries=" + (maxRetries < 0 ? "unbounded" : maxRetries)
                    + ", initialDelay=" + initialDelay.toMillis() + "ms, maxDelay=" + maxDelay.toMillis() + "ms}";
        }
    }
}
