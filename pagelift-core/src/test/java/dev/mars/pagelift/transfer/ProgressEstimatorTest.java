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
import dev.mars.pagelift.core.ProgressRecord;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

@DisplayName("ProgressEstimator Tests")
class ProgressEstimatorTest {

    private ProgressEstimator estimator;

    @AfterEach
    void tearDown() {
        if (estimator != null) {
            estimator.stop();
        }
    }

    @Nested
    @DisplayName("Completion percentage")
    class PercentTests {

        @Test
        @DisplayName("Already processed bytes count towards completion")
        void testAlreadyProcessed() {
            estimator = new ProgressEstimator(Duration.ofSeconds(10), 10);
            estimator.start(4, 600, 1000);

            ProgressRecord record = estimator.snapshot();
            assertThat(record.getBytesProcessed()).isEqualTo(600);
            assertThat(record.getPercentComplete()).isEqualTo(60.0);
        }

        @Test
        @DisplayName("Reaches exactly 100% once every byte is reported")
        void testReachesHundred() throws Exception {
            estimator = new ProgressEstimator(Duration.ofSeconds(10), 10);
            estimator.start(8, 1024, 10240);

            ExecutorService reporters = Executors.newFixedThreadPool(8);
            for (int i = 0; i < 18; i++) {
                reporters.submit(() -> estimator.reportBytesProcessed(512));
            }
            reporters.shutdown();
            assertThat(reporters.awaitTermination(5, TimeUnit.SECONDS)).isTrue();

            ProgressRecord record = estimator.snapshot();
            assertThat(record.getPercentComplete()).isEqualTo(100.0);
            assertThat(record.isComplete()).isTrue();
            assertThat(record.getRemainingDuration()).contains(Duration.ZERO);
        }

        @Test
        @DisplayName("Never exceeds 100%")
        void testCappedAtHundred() {
            estimator = new ProgressEstimator(Duration.ofSeconds(10), 10);
            estimator.start(1, 0, 100);
            estimator.reportBytesProcessed(150);

            assertThat(estimator.snapshot().getPercentComplete()).isEqualTo(100.0);
        }

        @Test
        @DisplayName("An empty session is complete from the start")
        void testZeroTotal() {
            estimator = new ProgressEstimator(Duration.ofSeconds(10), 10);
            estimator.start(1, 0, 0);

            assertThat(estimator.snapshot().getPercentComplete()).isEqualTo(100.0);
        }

        @Test
        void testInvalidBounds() {
            estimator = new ProgressEstimator(Duration.ofSeconds(10), 10);
            assertThatThrownBy(() -> estimator.start(1, 200, 100)).isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> estimator.reportBytesProcessed(-1)).isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("Ticking")
    class TickTests {

        @Test
        @DisplayName("Records arrive once per tick")
        void testRecordsPerTick() throws InterruptedException {
            estimator = new ProgressEstimator(Duration.ofMillis(10), 10);
            Channel<ProgressRecord> records = estimator.start(2, 0, 4096);
            estimator.reportBytesProcessed(1024);

            ProgressRecord record = records.receive();
            assertThat(record).isNotNull();
            assertThat(record.getTotalBytes()).isEqualTo(4096);
        }

        @Test
        @DisplayName("Throughput and remaining time follow reported bytes")
        void testThroughputAndEta() {
            estimator = new ProgressEstimator(Duration.ofMillis(20), 5);
            estimator.start(1, 0, 1_000_000_000L);

            await().atMost(Duration.ofSeconds(5)).pollInterval(Duration.ofMillis(5)).until(() -> {
                estimator.reportBytesProcessed(100_000);
                return estimator.snapshot().getAverageThroughputBytesPerSecond() > 0;
            });

            ProgressRecord record = estimator.snapshot();
            assertThat(record.getRemainingDuration()).isPresent();
            assertThat(record.getRemainingDuration().get()).isPositive();
        }

        @Test
        @DisplayName("Remaining time is unknown while nothing moves")
        void testUnknownEta() {
            estimator = new ProgressEstimator(Duration.ofMillis(10), 5);
            estimator.start(1, 0, 1000);
            estimator.tick();
            estimator.tick();

            ProgressRecord record = estimator.snapshot();
            assertThat(record.getAverageThroughputBytesPerSecond()).isZero();
            assertThat(record.getRemainingDuration()).isEmpty();
        }

        @Test
        @DisplayName("Stop closes the channel and is idempotent")
        void testStop() throws InterruptedException {
            estimator = new ProgressEstimator(Duration.ofMillis(10), 5);
            Channel<ProgressRecord> records = estimator.start(1, 0, 1000);

            estimator.stop();
            estimator.stop();

            List<ProgressRecord> remaining = new ArrayList<>();
            ProgressRecord record;
            while ((record = records.receive()) != null) {
                remaining.add(record);
            }
            assertThat(records.isDrained()).isTrue();
            assertThat(remaining.size()).isLessThanOrEqualTo(16);
        }

        @Test
        @DisplayName("Slow consumer loses ticks instead of blocking the ticker")
        void testSlowConsumer() {
            estimator = new ProgressEstimator(Duration.ofMillis(1), 5);
            Channel<ProgressRecord> records = estimator.start(1, 0, 1000);

            for (int i = 0; i < 100; i++) {
                estimator.tick();
            }
            estimator.stop();

            assertThat(records.isClosed()).isTrue();
        }

        @Test
        void testStartTwiceRejected() {
            estimator = new ProgressEstimator(Duration.ofMillis(10), 5);
            estimator.start(1, 0, 10);
            assertThatThrownBy(() -> estimator.start(1, 0, 10)).isInstanceOf(IllegalStateException.class);
        }
    }
}
