package dev.mars.pagelift.range;

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
import dev.mars.pagelift.core.Chunk;
import dev.mars.pagelift.core.RangeSet;
import dev.mars.pagelift.core.exceptions.SourceReadException;
import dev.mars.pagelift.source.ChunkReader;
import dev.mars.pagelift.source.SourceStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Computes the work list of an upload session: the page-aligned, chunk-sized ranges of the
 * image that still have to be sent.
 *
 * <p>Reconciliation runs in two stages. {@link #locateUploadableRanges} is pure range algebra:
 * it takes the image extents, removes the ranges already present at the destination, aligns
 * what is left to page boundaries and cuts it into chunks. {@link #detectEmptyRanges} then
 * reads every candidate once and drops those that are entirely zero, since writing zeros to a
 * fresh page object changes nothing.</p>
 *
 * <p>The resulting list is sorted by start offset and its ranges are pairwise disjoint.
 * Together with the skipped ranges (when those are page-aligned, as the remote service
 * reports them) the candidate list covers every extent byte exactly once.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class RangeReconciler {
    private static final Logger logger = LoggerFactory.getLogger(RangeReconciler.class);

    private static final double ONE_MB = 1024.0 * 1024.0;

    private final long pageAlignment;
    private final long chunkGranularity;

    public RangeReconciler(PageliftConfiguration configuration) {
        this(configuration.getPageSize(), configuration.getChunkSize());
    }

    /**
     * @param pageAlignment    smallest unit the destination can address, in bytes
     * @param chunkGranularity largest range sent by one request; rounded down to whole pages
     */
    public RangeReconciler(long pageAlignment, long chunkGranularity) {
        if (pageAlignment <= 0) {
            throw new IllegalArgumentException("Page alignment must be positive: " + pageAlignment);
        }
        if (chunkGranularity <= 0) {
            throw new IllegalArgumentException("Chunk granularity must be positive: " + chunkGranularity);
        }
        this.pageAlignment = pageAlignment;
        this.chunkGranularity = Math.max(pageAlignment, chunkGranularity - chunkGranularity % pageAlignment);
    }

    public long getPageAlignment() {
        return pageAlignment;
    }

    /**
     * Effective chunk size after rounding down to whole pages.
     */
    public long getChunkGranularity() {
        return chunkGranularity;
    }

    /**
     * Runs both stages against {@code source}.
     *
     * @param source        the image to upload
     * @param alreadyPresent ranges confirmed present at the destination
     * @return the ranges that must be transmitted, in start order
     * @throws SourceReadException if probing the candidates for zeros fails; no partial list is returned
     */
    public List<ByteRange> reconcile(SourceStream source, RangeSet alreadyPresent) throws SourceReadException {
        List<ByteRange> candidates = locateUploadableRanges(source.size(), source.extents(), alreadyPresent);
        return detectEmptyRanges(source, candidates);
    }

    /**
     * Range algebra stage: extents minus present ranges, page-aligned and split into chunks.
     */
    public List<ByteRange> locateUploadableRanges(long imageSize, List<ByteRange> extents, RangeSet alreadyPresent) {
        Objects.requireNonNull(extents, "extents");
        Objects.requireNonNull(alreadyPresent, "alreadyPresent");
        if (imageSize <= 0 || imageSize % pageAlignment != 0) {
            throw new IllegalArgumentException("Image size " + imageSize
                    + " must be a positive multiple of the page size " + pageAlignment);
        }
        requireInside(imageSize, extents, "Extent");
        requireInside(imageSize, alreadyPresent.ranges(), "Present range");

        RangeSet missing = RangeSet.of(extents).subtract(alreadyPresent);

        List<ByteRange> aligned = new ArrayList<>(missing.size());
        for (ByteRange range : missing) {
            long start = range.getStart() - range.getStart() % pageAlignment;
            long endExclusive = Math.min(imageSize, roundUp(range.getEndExclusive()));
            aligned.add(ByteRange.of(start, endExclusive - 1));
        }

        List<ByteRange> chunks = new ArrayList<>();
        for (ByteRange range : RangeSet.of(aligned)) {
            long start = range.getStart();
            while (start <= range.getEnd()) {
                long length = Math.min(chunkGranularity, range.getEnd() - start + 1);
                chunks.add(ByteRange.ofLength(start, length));
                start += length;
            }
        }

        logger.debug("Located {} uploadable ranges ({} bytes) in image of {} bytes, {} bytes already present",
                chunks.size(), totalLength(chunks), imageSize, alreadyPresent.totalLength());
        return Collections.unmodifiableList(chunks);
    }

    /**
     * Empty range elimination: keeps only candidates holding at least one non-zero byte.
     */
    public List<ByteRange> detectEmptyRanges(SourceStream source, List<ByteRange> candidates) throws SourceReadException {
        logger.info("Detecting empty ranges..");
        List<ByteRange> nonEmpty = new ArrayList<>(candidates.size());
        int emptyCount = 0;
        for (ByteRange candidate : candidates) {
            Chunk chunk = ChunkReader.read(source, candidate);
            if (isAllZero(chunk.getData())) {
                emptyCount++;
            } else {
                nonEmpty.add(candidate);
            }
        }
        logger.info("Empty ranges: {}/{}", emptyCount, candidates.size());
        logger.info("Effective upload size: {} MB (from {} MB originally)",
                String.format("%.2f", totalLength(nonEmpty) / ONE_MB),
                String.format("%.2f", source.size() / ONE_MB));
        return Collections.unmodifiableList(nonEmpty);
    }

    public static long totalLength(List<ByteRange> ranges) {
        long total = 0;
        for (ByteRange range : ranges) {
            total += range.getLength();
        }
        return total;
    }

    static boolean isAllZero(byte[] data) {
        for (byte b : data) {
            if (b != 0) {
                return false;
            }
        }
        return true;
    }

    private long roundUp(long offset) {
        long remainder = offset % pageAlignment;
        return remainder == 0 ? offset : offset + pageAlignment - remainder;
    }

    private static void requireInside(long imageSize, Iterable<ByteRange> ranges, String what) {
        for (ByteRange range : ranges) {
            if (range.getEnd() >= imageSize) {
                throw new IllegalArgumentException(what + " " + range + " lies beyond the image size " + imageSize);
            }
        }
    }
}
