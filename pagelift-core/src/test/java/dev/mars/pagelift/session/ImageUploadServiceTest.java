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


import dev.mars.pagelift.config.PageliftConfiguration;
import dev.mars.pagelift.core.ByteRange;
import dev.mars.pagelift.core.SessionResult;
import dev.mars.pagelift.core.exceptions.PageliftException;
import dev.mars.pagelift.core.exceptions.ReconciliationPrecheckException;
import dev.mars.pagelift.metadata.ImageMetadata;
import dev.mars.pagelift.monitoring.UploadTelemetryMetrics;
import dev.mars.pagelift.simulator.ByteArraySourceStream;
import dev.mars.pagelift.simulator.InMemoryPageBlobSimulator;
import dev.mars.pagelift.storage.BlobProperties;
import dev.mars.pagelift.storage.ChecksumCalculator;
import dev.mars.pagelift.storage.PageBlobClient;
import dev.mars.pagelift.transfer.UploadOrchestrator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.InOrder;

import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("ImageUploadService Tests")
class ImageUploadServiceTest {

    private static final int SIZE = 64 * 1024;
    private static final int CHUNK = 4096;

    @TempDir
    Path tempDir;

    private ImageUploadService service;
    private InMemoryPageBlobSimulator blob;
    private ByteArraySourceStream source;
    private ImageMetadata localMetadata;

    @BeforeEach
    void setUp() throws Exception {
        Properties properties = new Properties();
        properties.setProperty(PageliftConfiguration.CHUNK_SIZE, String.valueOf(CHUNK));
        properties.setProperty(PageliftConfiguration.PARALLELISM, "4");
        properties.setProperty(PageliftConfiguration.RETRY_DELAY_MS, "1");
        properties.setProperty(PageliftConfiguration.RETRY_MAX_DELAY_MS, "5");
        properties.setProperty(PageliftConfiguration.PROGRESS_TICK_MS, "10");
        PageliftConfiguration configuration = new PageliftConfiguration(properties);
        service = new ImageUploadService(configuration,
                new UploadOrchestrator(configuration, UploadTelemetryMetrics.noop()));

        blob = new InMemoryPageBlobSimulator("disk.vhd");
        source = ByteArraySourceStream.random(SIZE, 5);
        localMetadata = new ImageMetadata("disk.img", SIZE, SIZE, "2025-03-01T12:00:00Z",
                new ChecksumCalculator().digest(source));
    }

    @Nested
    @DisplayName("New uploads")
    class NewUploadTests {

        @Test
        @DisplayName("Creates the object, uploads every range and stamps the hash")
        void testNewUpload() throws Exception {
            SessionResult result = service.upload(source, localMetadata, blob, UploadOptions.defaults());

            assertThat(result.isSuccessful()).isTrue();
            assertThat(blob.getContent()).isEqualTo(source.getData());
            assertThat(blob.getContentMd5()).isEqualTo(localMetadata.getMd5Hash());
            assertThat(ImageMetadata.fromBlobMetadata(blob.getMetadata())).contains(localMetadata);
        }

        @Test
        @DisplayName("Uploads a local image file, skipping its empty chunks")
        void testUploadFromFile() throws Exception {
            byte[] content = new byte[SIZE];
            System.arraycopy(source.getData(), 0, content, 0, CHUNK);
            System.arraycopy(source.getData(), 10 * CHUNK, content, 10 * CHUNK, CHUNK);
            Path image = Files.write(tempDir.resolve("disk.img"), content);

            SessionResult result = service.upload(image, blob, UploadOptions.builder().parallelism(2).build());

            assertThat(result.isSuccessful()).isTrue();
            assertThat(result.getEffectiveBytes()).isEqualTo(2L * CHUNK);
            assertThat(result.getPercentComplete()).isEqualTo(100.0);
            assertThat(blob.getWriteLog()).containsExactlyInAnyOrder(
                    ByteRange.ofLength(0, CHUNK), ByteRange.ofLength(10L * CHUNK, CHUNK));
            assertThat(blob.getContent()).isEqualTo(content);
            assertThat(blob.getContentMd5()).isEqualTo(MessageDigest.getInstance("MD5").digest(content));
        }
    }

    @Nested
    @DisplayName("Existing objects")
    class ExistingObjectTests {

        @Test
        @DisplayName("A completed object is not touched without overwrite")
        void testCompletedObjectRejected() {
            blob.seed(SIZE, Map.of(), new byte[]{1, 2, 3});

            assertThatThrownBy(() -> service.upload(source, localMetadata, blob, UploadOptions.defaults()))
                    .isInstanceOf(PageliftException.class)
                    .hasMessageContaining("overwrite");
            assertThat(blob.getWriteAttempts()).isZero();
        }

        @Test
        @DisplayName("Overwrite replaces a completed object")
        void testOverwrite() throws Exception {
            blob.seed(SIZE, Map.of(), new byte[]{1, 2, 3});

            SessionResult result = service.upload(source, localMetadata, blob,
                    UploadOptions.builder().overwrite(true).build());

            assertThat(result.isSuccessful()).isTrue();
            assertThat(blob.getContent()).isEqualTo(source.getData());
            assertThat(blob.getContentMd5()).isEqualTo(localMetadata.getMd5Hash());
        }

        @Test
        @DisplayName("An object without upload metadata cannot be resumed")
        void testMissingMetadata() {
            blob.seed(SIZE, Map.of("owner", "someone"), null);

            assertThatThrownBy(() -> service.upload(source, localMetadata, blob, UploadOptions.defaults()))
                    .isInstanceOf(ReconciliationPrecheckException.class)
                    .hasMessageContaining("cannot be resumed");
        }

        @Test
        @DisplayName("Metadata describing another image blocks the resume")
        void testMismatchedMetadata() throws Exception {
            ImageMetadata other = new ImageMetadata("disk.img", SIZE, 2L * SIZE, "2025-03-01T12:00:00Z",
                    new byte[16]);
            blob.seed(2L * SIZE, other.toBlobMetadata(), null);

            assertThatThrownBy(() -> service.upload(source, localMetadata, blob, UploadOptions.defaults()))
                    .isInstanceOfSatisfying(ReconciliationPrecheckException.class,
                            e -> assertThat(e.getMismatches()).hasSize(2));
            assertThat(blob.getWriteAttempts()).isZero();
        }
    }

    @Nested
    @DisplayName("Resuming")
    class ResumeTests {

        @Test
        @DisplayName("A failed range is the only one sent by the next run")
        void testResumeSendsOnlyFailedRange() throws Exception {
            ByteRange broken = ByteRange.ofLength(3L * CHUNK, CHUNK);
            blob.failWritesAlwaysAt(broken.getStart());

            SessionResult first = service.upload(source, localMetadata, blob, UploadOptions.defaults());

            assertThat(first.isSuccessful()).isFalse();
            assertThat(first.getFailedRequestIds()).containsExactly(broken.toString());
            assertThat(blob.getContentMd5()).isNull();

            blob.clearFailures();
            blob.resetStatistics();
            SessionResult second = service.upload(source, localMetadata, blob, UploadOptions.defaults());

            assertThat(second.isSuccessful()).isTrue();
            assertThat(second.getEffectiveBytes()).isEqualTo(CHUNK);
            assertThat(blob.getWriteLog()).containsExactly(broken);
            assertThat(blob.getContent()).isEqualTo(source.getData());
            assertThat(blob.getContentMd5()).isEqualTo(localMetadata.getMd5Hash());
        }

        @Test
        @DisplayName("Present ranges are collected across every listing page")
        void testPaginatedListing() throws Exception {
            blob.createObject(SIZE, localMetadata.toBlobMetadata());
            for (int i = 0; i < SIZE / CHUNK; i += 2) {
                ByteRange range = ByteRange.ofLength((long) i * CHUNK, CHUNK);
                blob.preload(range, Arrays.copyOfRange(source.getData(),
                        (int) range.getStart(), (int) range.getEndExclusive()));
            }
            blob.setListingPageLength(3);

            SessionResult result = service.upload(source, localMetadata, blob, UploadOptions.defaults());

            assertThat(result.isSuccessful()).isTrue();
            assertThat(blob.getListingCalls()).isEqualTo(3);
            assertThat(blob.getWriteLog()).hasSize(SIZE / CHUNK / 2);
            assertThat(blob.getContent()).isEqualTo(source.getData());
        }

        @Test
        @DisplayName("A fully uploaded but unstamped object only gets its hash")
        void testNothingLeftToSend() throws Exception {
            blob.createObject(SIZE, localMetadata.toBlobMetadata());
            blob.preload(ByteRange.ofLength(0, SIZE), source.getData());

            SessionResult result = service.upload(source, localMetadata, blob, UploadOptions.defaults());

            assertThat(result.isSuccessful()).isTrue();
            assertThat(result.getEffectiveBytes()).isZero();
            assertThat(blob.getWriteAttempts()).isZero();
            assertThat(blob.getContentMd5()).isEqualTo(localMetadata.getMd5Hash());
        }
    }

    @Nested
    @DisplayName("Client interaction")
    class ClientInteractionTests {

        @Test
        @DisplayName("Precheck failures neither create nor stamp the object")
        void testPrecheckFailureLeavesObjectAlone() throws Exception {
            PageBlobClient client = mock(PageBlobClient.class);
            when(client.getName()).thenReturn("mocked.vhd");
            when(client.getProperties()).thenReturn(Optional.of(new BlobProperties(SIZE, Map.of(), null)));

            assertThatThrownBy(() -> service.upload(source, localMetadata, client, UploadOptions.defaults()))
                    .isInstanceOf(ReconciliationPrecheckException.class);
            verify(client, never()).createObject(anyLong(), any());
            verify(client, never()).writePages(anyLong(), anyLong(), any());
            verify(client, never()).setFinalHash(any());
        }

        @Test
        @DisplayName("The object is created before pages are written and stamped last")
        void testCallOrder() throws Exception {
            PageBlobClient client = mock(PageBlobClient.class);
            when(client.getName()).thenReturn("mocked.vhd");
            when(client.getProperties()).thenReturn(Optional.empty());

            SessionResult result = service.upload(source, localMetadata, client, UploadOptions.defaults());

            assertThat(result.isSuccessful()).isTrue();
            InOrder order = inOrder(client);
            order.verify(client).getProperties();
            order.verify(client).createObject(SIZE, localMetadata.toBlobMetadata());
            order.verify(client, atLeastOnce()).writePages(anyLong(), anyLong(), any());
            order.verify(client).setFinalHash(localMetadata.getMd5Hash());
        }
    }
}
