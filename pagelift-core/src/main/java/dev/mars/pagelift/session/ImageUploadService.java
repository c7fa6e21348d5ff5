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
import dev.mars.pagelift.core.RangeSet;
import dev.mars.pagelift.core.SessionResult;
import dev.mars.pagelift.core.exceptions.PageliftException;
import dev.mars.pagelift.core.exceptions.ReconciliationPrecheckException;
import dev.mars.pagelift.metadata.ImageMetadata;
import dev.mars.pagelift.metadata.MetadataComparator;
import dev.mars.pagelift.range.RangeReconciler;
import dev.mars.pagelift.source.FileSourceStream;
import dev.mars.pagelift.source.SourceStream;
import dev.mars.pagelift.storage.BlobProperties;
import dev.mars.pagelift.storage.ChecksumCalculator;
import dev.mars.pagelift.storage.PageBlobClient;
import dev.mars.pagelift.transfer.UploadContext;
import dev.mars.pagelift.transfer.UploadOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Uploads a local image into a remote page object, creating the object or resuming an
 * interrupted upload into it.
 *
 * <p>A new object is created with the image's metadata stamped on it. An existing object is
 * resumed only when that metadata matches the local image; only the ranges missing remotely
 * are then sent. After a complete upload the image hash is stamped as the object's content
 * hash, which marks the object as finished.</p>
 *
 * <h3>Usage Example:</h3>
 * <pre>{@code
 * PageliftConfiguration config = new PageliftConfiguration();
 * ImageUploadService service = new ImageUploadService(config);
 * SessionResult result = service.upload(Path.of("disk.img"), client,
 *         UploadOptions.builder().progressListener(new ConsoleProgressPrinter()).build());
 * }</pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class ImageUploadService {
    private static final Logger logger = LoggerFactory.getLogger(ImageUploadService.class);

    private final PageliftConfiguration configuration;
    private final UploadOrchestrator orchestrator;
    private final RangeReconciler reconciler;

    public ImageUploadService(PageliftConfiguration configuration) {
        this(configuration, new UploadOrchestrator(configuration));
    }

    public ImageUploadService(PageliftConfiguration configuration, UploadOrchestrator orchestrator) {
        this.configuration = Objects.requireNonNull(configuration, "configuration");
        this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator");
        this.reconciler = new RangeReconciler(configuration);
    }

    /**
     * Uploads the image file at {@code localImage}. Its hash is computed first, which reads the
     * whole file once.
     */
    public SessionResult upload(Path localImage, PageBlobClient client, UploadOptions options)
            throws PageliftException, IOException, InterruptedException {
        try (FileSourceStream source = FileSourceStream.open(localImage)) {
            logger.info("Computing {} hash of '{}'..", configuration.getChecksumAlgorithm(), localImage);
            ImageMetadata local = ImageMetadata.fromLocalImage(localImage, source,
                    new ChecksumCalculator(configuration.getChecksumAlgorithm()));
            return upload(source, local, client, options);
        }
    }

    /**
     * Uploads {@code source}, described by {@code local}.
     *
     * @throws ReconciliationPrecheckException if an existing object cannot be resumed
     * @throws PageliftException if the object is already complete and overwrite is off, or the
     *                           source or destination fails
     */
    public SessionResult upload(SourceStream source, ImageMetadata local, PageBlobClient client, UploadOptions options)
            throws PageliftException, InterruptedException {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(local, "local");
        Objects.requireNonNull(client, "client");
        Objects.requireNonNull(options, "options");

        String name = client.getName();
        RangeSet alreadyPresent = RangeSet.empty();
        boolean resume = false;

        Optional<BlobProperties> existing = client.getProperties();
        if (existing.isPresent() && !options.isOverwrite()) {
            BlobProperties properties = existing.get();
            if (properties.hasContentMd5()) {
                throw new PageliftException("Image already exists in '" + name
                        + "'. To upload it again, use overwrite");
            }
            Optional<ImageMetadata> remote = ImageMetadata.fromBlobMetadata(properties.getMetadata());
            if (remote.isEmpty()) {
                throw new ReconciliationPrecheckException("There is no upload metadata associated with '" + name
                        + "', so the upload cannot be resumed, use overwrite");
            }
            logger.info("'{}' already exists, checking upload can be resumed", name);
            MetadataComparator.ensureResumable(name, remote.get(), local);
            alreadyPresent = client.listExistingRanges();
            resume = true;
        }

        if (!resume) {
            if (existing.isPresent()) {
                logger.info("Overwriting '{}'", name);
            }
            client.createObject(source.size(), local.toBlobMetadata());
            logger.debug("Created '{}' with {} bytes", name, source.size());
        }

        List<ByteRange> ranges = reconciler.reconcile(source, alreadyPresent);
        long alreadyProcessed = source.size() - RangeReconciler.totalLength(ranges);

        UploadContext context = UploadContext.builder()
                .source(source)
                .ranges(ranges)
                .alreadyProcessedBytes(alreadyProcessed)
                .client(client)
                .parallelism(options.getParallelism() == UploadOptions.CONFIGURED_PARALLELISM
                        ? configuration.getParallelism() : options.getParallelism())
                .resume(resume)
                .progressListener(options.getProgressListener())
                .build();

        SessionResult result = orchestrator.upload(context);
        if (result.isSuccessful()) {
            if (local.hasMd5Hash()) {
                client.setFinalHash(local.getMd5Hash());
            }
            logger.info("Upload completed");
        }
        return result;
    }
}
