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
import dev.mars.pagelift.core.Chunk;
import dev.mars.pagelift.core.ProgressRecord;
import dev.mars.pagelift.core.SessionResult;
import dev.mars.pagelift.core.exceptions.PartialSessionFailureException;
import dev.mars.pagelift.core.exceptions.SourceReadException;
import dev.mars.pagelift.core.exceptions.StorageException;
import dev.mars.pagelift.monitoring.UploadTelemetryMetrics;
import dev.mars.pagelift.range.RangeReconciler;
import dev.mars.pagelift.source.ChunkReader;
import dev.mars.pagelift.storage.PageBlobClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Runs one upload session: reads the selected ranges, fans them out to the worker pool as
 * page writes, tracks progress and reports the outcome.
 *
 * <p>Backpressure comes from the request channel. The dispatch loop blocks on
 * {@link Channel#send} until a worker is free, so at most {@code parallelism} chunks plus the
 * channel capacity are held in memory.</p>
 *
 * <p>A failed range does not stop the session. Once every request has run, the result lists
 * the ranges that could not be written; running the upload again sends only those. A source
 * read failure aborts the session and is rethrown.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class UploadOrchestrator {
    private static final Logger logger = LoggerFactory.getLogger(UploadOrchestrator.class);

    static final String INCOMPLETE_MESSAGE =
            "Upload incomplete: some ranges failed to upload, rerun the command to upload those ranges";

    private static final double ONE_MB = 1024.0 * 1024.0;

    private final PageliftConfiguration configuration;
    private final UploadTelemetryMetrics metrics;
    private final RetryPolicy retryPolicy;

    public UploadOrchestrator(PageliftConfiguration configuration) {
        this(configuration, UploadTelemetryMetrics.forConfiguration(configuration));
    }

    public UploadOrchestrator(PageliftConfiguration configuration, UploadTelemetryMetrics metrics) {
        this.configuration = Objects.requireNonNull(configuration, "configuration");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.retryPolicy = RetryPolicy.fromConfiguration(configuration);
    }

    /**
     * Uploads the ranges of {@code context}.
     *
     * @return the session outcome; unsuccessful when some ranges failed permanently
     * @throws SourceReadException  if the source could not be read; the session was aborted
     * @throws InterruptedException if the calling thread was interrupted; the session was aborted
     */
    public SessionResult upload(UploadContext context) throws SourceReadException, InterruptedException {
        Instant startTime = Instant.now();
        long effectiveBytes = RangeReconciler.totalLength(context.getRanges());
        long alreadyProcessed = context.getAlreadyProcessedBytes();
        ProgressListener listener = context.getProgressListener();

        logger.info("{} '{}': {} ranges, {} MB to send, {} MB already present or empty, {} workers",
                context.isResume() ? "Resuming upload of" : "Uploading",
                context.getClient().getName(), context.getRanges().size(),
                String.format("%.2f", effectiveBytes / ONE_MB), String.format("%.2f", alreadyProcessed / ONE_MB),
                context.getParallelism());

        ChunkReader reader = new ChunkReader(context.getSource(), context.getRanges(),
                configuration.getChunkQueueCapacity());
        Channel<UploadRequest> requests = new Channel<>(configuration.getQueueCapacity());
        WorkerPool pool = new WorkerPool(context.getParallelism(), metrics);
        ProgressEstimator progress = new ProgressEstimator(configuration);

        pool.init();
        WorkerPool.Signals signals = pool.run(requests);
        Channel<ProgressRecord> records = progress.start(context.getParallelism(), alreadyProcessed,
                alreadyProcessed + effectiveBytes);
        Thread errorListener = startDaemon("pagelift-error-listener", () -> logFailures(signals.errors()));

        List<RequestFailure> failures;
        Thread display;
        try {
            listener.onStart(context.isResume());
            display = startDaemon("pagelift-progress-display", () -> display(records, listener));
            reader.start();
            dispatch(reader, requests, context.getClient(), progress);
            requests.close();
            failures = signals.awaitCompletion();
        } catch (SourceReadException | InterruptedException | RuntimeException e) {
            logger.error("Aborting upload of '{}': {}", context.getClient().getName(), e.getMessage());
            requests.close();
            pool.tearDownWorkers();
            reader.close();
            signals.completion().join();
            progress.stop();
            throw e;
        } finally {
            reader.close();
        }

        progress.stop();
        display.join();
        errorListener.join();

        ProgressRecord finalRecord = progress.snapshot();
        SessionResult result = SessionResult.builder()
                .successful(failures.isEmpty())
                .failedRequestIds(failures.stream().map(RequestFailure::getRequestId).collect(Collectors.toList()))
                .effectiveBytes(effectiveBytes)
                .bytesTransferred(progress.getBytesProcessed() - alreadyProcessed)
                .percentComplete(finalRecord.getPercentComplete())
                .startTime(startTime)
                .endTime(Instant.now())
                .message(failures.isEmpty() ? null : INCOMPLETE_MESSAGE)
                .build();
        listener.onComplete(finalRecord, result);

        logger.info("Completed: {}% [{} MB] in {}", String.format("%.0f", finalRecord.getPercentComplete()),
                String.format("%.2f", finalRecord.getBytesProcessed() / ONE_MB),
                result.getDuration().map(Object::toString).orElse("?"));
        if (!result.isSuccessful()) {
            logger.warn("{} ({} of {} ranges failed)", INCOMPLETE_MESSAGE, failures.size(), context.getRanges().size());
        }
        return result;
    }

    /**
     * Like {@link #upload(UploadContext)}, but an incomplete session is an exception.
     */
    public SessionResult uploadOrThrow(UploadContext context)
            throws PartialSessionFailureException, SourceReadException, InterruptedException {
        SessionResult result = upload(context);
        if (!result.isSuccessful()) {
            throw new PartialSessionFailureException(result);
        }
        return result;
    }

    private void dispatch(ChunkReader reader, Channel<UploadRequest> requests, PageBlobClient client,
                          ProgressEstimator progress) throws SourceReadException, InterruptedException {
        Chunk chunk;
        while ((chunk = reader.next()) != null) {
            Chunk toWrite = chunk;
            UploadRequest request = new UploadRequest(toWrite.getRange().toString(),
                    () -> writeChunk(client, toWrite, progress), retryPolicy);
            try {
                requests.send(request);
            } catch (IllegalStateException e) {
                // closed by the pool after its workers ended abnormally
                logger.error("Workers stopped before {} could be dispatched; remaining ranges are skipped",
                        request.getId());
                return;
            }
        }
    }

    private void writeChunk(PageBlobClient client, Chunk chunk, ProgressEstimator progress) throws StorageException {
        long startNanos = System.nanoTime();
        metrics.recordWriteStarted();
        try {
            client.writePages(chunk.getRange().getStart(), chunk.getLength(), chunk.getData());
        } catch (StorageException | RuntimeException | Error e) {
            metrics.recordWriteFailed();
            throw e;
        }
        metrics.recordWriteCompleted(chunk.getLength(), (System.nanoTime() - startNanos) / 1_000_000_000.0);
        // counted only once the destination has acknowledged the write
        progress.reportBytesProcessed(chunk.getLength());
    }

    private static void display(Channel<ProgressRecord> records, ProgressListener listener) {
        try {
            ProgressRecord record;
            while ((record = records.receive()) != null) {
                try {
                    listener.onProgress(record);
                } catch (RuntimeException e) {
                    logger.warn("Progress listener failed: {}", e.getMessage(), e);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void logFailures(Channel<RequestFailure> errors) {
        try {
            RequestFailure failure;
            while ((failure = errors.receive()) != null) {
                logger.warn("Range {} was not uploaded after {} attempt(s): {}",
                        failure.getRequestId(), failure.getAttempts(), failure.getCause().getMessage());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static Thread startDaemon(String name, Runnable task) {
        Thread thread = new Thread(task, name);
        thread.setDaemon(true);
        thread.start();
        return thread;
    }
}
