package dev.mars.pagelift.monitoring;

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
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.DoubleHistogram;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;

/**
 * OpenTelemetry metrics for page uploads.
 * Provides:
 * - pagelift.upload.requests (counter) - Page write attempts started
 * - pagelift.upload.completed (counter) - Page writes acknowledged by the destination
 * - pagelift.upload.failed (counter) - Upload requests that failed permanently
 * - pagelift.upload.retries (counter) - Retried page write attempts
 * - pagelift.upload.bytes.total (counter) - Bytes acknowledged by the destination
 * - pagelift.upload.request.duration.seconds (histogram) - Page write latency
 * - pagelift.upload.inflight (gauge) - Page writes currently in flight
 *
 * <p>Without a registered OpenTelemetry SDK the global meter is a no-op, so recording is
 * always safe.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class UploadTelemetryMetrics {

    private static final Logger logger = LoggerFactory.getLogger(UploadTelemetryMetrics.class);
    private static final String METER_NAME = "pagelift-core";

    private static UploadTelemetryMetrics instance;

    private final LongCounter writesStarted;
    private final LongCounter writesCompleted;
    private final LongCounter requestsFailed;
    private final LongCounter retryAttempts;
    private final LongCounter bytesUploaded;
    private final DoubleHistogram writeDuration;

    private final AtomicLong inflightWrites = new AtomicLong(0);

    private static final AttributeKey<String> ERROR_TYPE_KEY = AttributeKey.stringKey("error.type");

    private UploadTelemetryMetrics(Meter meter) {
        writesStarted = meter.counterBuilder("pagelift.upload.requests")
                .setDescription("Number of page write attempts started")
                .setUnit("1")
                .build();

        writesCompleted = meter.counterBuilder("pagelift.upload.completed")
                .setDescription("Number of page writes acknowledged by the destination")
                .setUnit("1")
                .build();

        requestsFailed = meter.counterBuilder("pagelift.upload.failed")
                .setDescription("Number of upload requests that failed permanently")
                .setUnit("1")
                .build();

        retryAttempts = meter.counterBuilder("pagelift.upload.retries")
                .setDescription("Number of retried page write attempts")
                .setUnit("1")
                .build();

        bytesUploaded = meter.counterBuilder("pagelift.upload.bytes.total")
                .setDescription("Total bytes acknowledged by the destination")
                .setUnit("By")
                .build();

        writeDuration = meter.histogramBuilder("pagelift.upload.request.duration.seconds")
                .setDescription("Page write duration in seconds")
                .setUnit("s")
                .build();

        meter.gaugeBuilder("pagelift.upload.inflight")
                .setDescription("Number of page writes currently in flight")
                .ofLongs()
                .buildWithCallback(measurement -> measurement.record(inflightWrites.get()));
    }

    /**
     * Get the singleton instance bound to the global OpenTelemetry meter provider.
     */
    public static synchronized UploadTelemetryMetrics getInstance() {
        if (instance == null) {
            instance = new UploadTelemetryMetrics(GlobalOpenTelemetry.getMeter(METER_NAME));
            logger.info("UploadTelemetryMetrics initialized");
        }
        return instance;
    }

    /**
     * Metrics that record nothing.
     */
    public static UploadTelemetryMetrics noop() {
        return new UploadTelemetryMetrics(OpenTelemetry.noop().getMeter(METER_NAME));
    }

    public static UploadTelemetryMetrics forConfiguration(PageliftConfiguration configuration) {
        return configuration.isMetricsEnabled() ? getInstance() : noop();
    }

    public void recordWriteStarted() {
        writesStarted.add(1);
        inflightWrites.incrementAndGet();
    }

    public void recordWriteCompleted(long bytes, double durationSeconds) {
        inflightWrites.decrementAndGet();
        writesCompleted.add(1);
        bytesUploaded.add(bytes);
        writeDuration.record(durationSeconds);
    }

    public void recordWriteFailed() {
        inflightWrites.decrementAndGet();
    }

    public void recordRetryAttempt() {
        retryAttempts.add(1);
    }

    public void recordRequestFailed(String errorType) {
        requestsFailed.add(1, Attributes.of(ERROR_TYPE_KEY, errorType != null ? errorType : "unknown"));
    }

    public long getInflightWrites() {
        return inflightWrites.get();
    }
}
