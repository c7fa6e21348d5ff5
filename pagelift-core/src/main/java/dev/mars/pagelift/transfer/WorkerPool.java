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
import dev.mars.pagelift.monitoring.UploadTelemetryMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed set of workers consuming {@link UploadRequest}s from a shared channel.
 *
 * <p>Each worker takes one request at a time and runs it until it succeeds or its retry
 * policy gives up. Retries stay on the worker that owns the request. Permanent failures are
 * published on the error channel as they happen and also collected, so the completion
 * future returns the full list once every worker has exited.</p>
 *
 * <p>Closing the request channel lets the workers drain it and exit.
 * {@link #tearDownWorkers()} stops them early: a worker finishes the attempt it is running,
 * then takes no further requests and starts no further retries.</p>
 *
 * <pre>{@code
 * WorkerPool pool = new WorkerPool(8);
 * pool.init();
 * WorkerPool.Signals signals = pool.run(requests);
 * ... send requests, then requests.close()
 * List<RequestFailure> failures = signals.awaitCompletion();
 * }</pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class WorkerPool {
    private static final Logger logger = LoggerFactory.getLogger(WorkerPool.class);

    private static final long RECEIVE_TIMEOUT_MS = 20;

    /**
     * Request id reported when a worker ended abnormally and its request cannot be named.
     */
    public static final String WORKER_FAILURE_ID = "worker";

    private final int workerCount;
    private final UploadTelemetryMetrics metrics;
    private final AtomicBoolean initialized = new AtomicBoolean(false);
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean tornDown = new AtomicBoolean(false);
    private final CountDownLatch tearDownSignal = new CountDownLatch(1);
    private ThreadPoolExecutor executor;

    public WorkerPool(int workerCount) {
        this(workerCount, UploadTelemetryMetrics.noop());
    }

    public WorkerPool(int workerCount, UploadTelemetryMetrics metrics) {
        if (workerCount <= 0) {
            throw new IllegalArgumentException("Worker count must be positive: " + workerCount);
        }
        this.workerCount = workerCount;
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /**
     * Starts the worker threads. Calling it again has no effect.
     */
    public void init() {
        if (!initialized.compareAndSet(false, true)) {
            return;
        }
        AtomicInteger threadNumber = new AtomicInteger(1);
        executor = new ThreadPoolExecutor(
                workerCount,
                workerCount,
                60L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(),
                r -> {
                    Thread t = new Thread(r, "pagelift-worker-" + threadNumber.getAndIncrement());
                    t.setDaemon(true);
                    return t;
                }
        );
        executor.prestartAllCoreThreads();
        logger.debug("WorkerPool initialized with {} workers", workerCount);
    }

    /**
     * Starts consuming {@code requests}. May be called once, after {@link #init()}.
     */
    public Signals run(Channel<UploadRequest> requests) {
        Objects.requireNonNull(requests, "requests");
        if (!initialized.get()) {
            throw new IllegalStateException("init() must be called before run()");
        }
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("WorkerPool is already running");
        }

        Channel<RequestFailure> errors = Channel.unbounded();
        Queue<RequestFailure> failures = new ConcurrentLinkedQueue<>();
        List<CompletableFuture<Void>> workers = new ArrayList<>(workerCount);
        for (int i = 0; i < workerCount; i++) {
            int workerId = i + 1;
            workers.add(CompletableFuture.runAsync(() -> work(workerId, requests, errors, failures), executor));
        }

        CompletableFuture<List<RequestFailure>> completion = CompletableFuture
                .allOf(workers.toArray(new CompletableFuture[0]))
                .handle((ignored, error) -> {
                    errors.close();
                    executor.shutdown();
                    if (error != null) {
                        Throwable cause = error instanceof CompletionException && error.getCause() != null
                                ? error.getCause() : error;
                        logger.error("Worker terminated unexpectedly", cause);
                        failures.add(new RequestFailure(WORKER_FAILURE_ID, cause, 0));
                        // no worker may be left to receive, so senders must not wait
                        requests.close();
                    }
                    logger.debug("All {} workers finished, {} request(s) failed", workerCount, failures.size());
                    return List.copyOf(failures);
                });
        return new Signals(errors, completion);
    }

    /**
     * Forces shutdown without draining the request channel.
     */
    public void tearDownWorkers() {
        if (tornDown.compareAndSet(false, true)) {
            logger.info("Tearing down {} workers", workerCount);
            tearDownSignal.countDown();
        }
    }

    public boolean isTornDown() {
        return tornDown.get();
    }

    public int getWorkerCount() {
        return workerCount;
    }

    private void work(int workerId, Channel<UploadRequest> requests, Channel<RequestFailure> errors,
                      Queue<RequestFailure> failures) {
        int processed = 0;
        try {
            while (!tornDown.get()) {
                UploadRequest request = requests.poll(RECEIVE_TIMEOUT_MS, TimeUnit.MILLISECONDS);
                if (request == null) {
                    if (requests.isDrained()) {
                        break;
                    }
                    continue;
                }
                if (tornDown.get()) {
                    logger.debug("Worker {} dropping {} after teardown", workerId, request.getId());
                    break;
                }
                RequestFailure failure = execute(request);
                processed++;
                if (failure != null) {
                    failures.add(failure);
                    errors.trySend(failure);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Worker {} interrupted", workerId);
        }
        logger.debug("Worker {} exiting after {} request(s)", workerId, processed);
    }

    private RequestFailure execute(UploadRequest request) throws InterruptedException {
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                request.getWork().execute();
                if (attempt > 1) {
                    logger.info("Request {} succeeded on attempt {}", request.getId(), attempt);
                }
                return null;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw e;
            } catch (Error e) {
                // errors are never retried
                logger.error("Request {} failed permanently on attempt {} with {}",
                        request.getId(), attempt, e.toString(), e);
                metrics.recordRequestFailed(e.getClass().getSimpleName());
                return new RequestFailure(request.getId(), e, attempt);
            } catch (Exception e) {
                RetryPolicy policy = request.getRetryPolicy();
                if (tornDown.get() || !policy.shouldRetry(e, attempt)) {
                    logger.error("Request {} failed permanently after {} attempt(s): {}",
                            request.getId(), attempt, e.getMessage());
                    metrics.recordRequestFailed(e.getClass().getSimpleName());
                    return new RequestFailure(request.getId(), e, attempt);
                }

                Duration backoff = policy.backoff(attempt);
                logger.warn("Attempt {} of request {} failed, retrying in {} ms: {}",
                        attempt, request.getId(), backoff.toMillis(), e.getMessage());
                metrics.recordRetryAttempt();
                if (!backoff.isZero() && tearDownSignal.await(backoff.toMillis(), TimeUnit.MILLISECONDS)) {
                    logger.debug("Teardown during backoff of request {}", request.getId());
                    return new RequestFailure(request.getId(), e, attempt);
                }
            }
        }
    }

    /**
     * Completion signals of a running pool: the error channel and the done future.
     */
    public static final class Signals {
        private final Channel<RequestFailure> errors;
        private final CompletableFuture<List<RequestFailure>> completion;

        Signals(Channel<RequestFailure> errors, CompletableFuture<List<RequestFailure>> completion) {
            this.errors = errors;
            this.completion = completion;
        }

        /**
         * Permanent failures as they occur; closed once every worker has exited.
         */
        public Channel<RequestFailure> errors() {
            return errors;
        }

        /**
         * Completes with every permanent failure once every worker has exited.
         */
        public CompletableFuture<List<RequestFailure>> completion() {
            return completion;
        }

        public List<RequestFailure> awaitCompletion() throws InterruptedException {
            try {
                return completion.get();
            } catch (ExecutionException e) {
                throw new IllegalStateException("Worker pool completion failed", e.getCause());
            }
        }
    }
}
