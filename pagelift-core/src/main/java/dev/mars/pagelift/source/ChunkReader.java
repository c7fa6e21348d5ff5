package dev.mars.pagelift.source;

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
import dev.mars.pagelift.core.ByteRange;
import dev.mars.pagelift.core.Chunk;
import dev.mars.pagelift.core.exceptions.SourceReadException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Reads the selected ranges of a source image, in order, on a single producer thread.
 *
 * <p>Each range becomes one {@link Chunk}. Reading stays sequential to keep seeks local and
 * memory bounded; the chunk channel capacity limits how far the reader runs ahead of its
 * consumer.</p>
 *
 * <p>The consumer sees one of two outcomes: {@link #next()} returns {@code null} after the last
 * chunk, or it throws the {@link SourceReadException} that stopped the reader. Chunks read
 * before a failure are still delivered first. A partially read chunk is never delivered.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class ChunkReader implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(ChunkReader.class);

    private final SourceStream source;
    private final List<ByteRange> ranges;
    private final Channel<Chunk> chunks;
    private final AtomicReference<SourceReadException> failure = new AtomicReference<>();
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    public ChunkReader(SourceStream source, List<ByteRange> ranges) {
        this(source, ranges, 0);
    }

    public ChunkReader(SourceStream source, List<ByteRange> ranges, int capacity) {
        this.source = Objects.requireNonNull(source, "source");
        this.ranges = List.copyOf(ranges);
        this.chunks = new Channel<>(capacity);
    }

    /**
     * Starts the producer thread. May be called once.
     */
    public void start() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Chunk reader already started");
        }
        Thread thread = new Thread(this::produce, "pagelift-chunk-reader");
        thread.setDaemon(true);
        thread.start();
    }

    /**
     * Returns the next chunk, blocking until it has been read.
     *
     * @return the next chunk, or {@code null} when every range has been delivered or the
     *         reader was closed
     * @throws SourceReadException if the source failed; no further chunks follow
     */
    public Chunk next() throws SourceReadException, InterruptedException {
        if (stopped.get()) {
            return null;
        }
        Chunk chunk = chunks.receive();
        if (chunk == null) {
            SourceReadException cause = failure.get();
            if (cause != null) {
                throw cause;
            }
        }
        return chunk;
    }

    /**
     * Stops the producer once its current read completes. Chunks not yet received are abandoned.
     */
    @Override
    public void close() {
        if (stopped.compareAndSet(false, true)) {
            // not interrupted: an interrupt closes a FileChannel mid-read
            chunks.close();
        }
    }

    /**
     * Reads exactly the bytes of {@code range} from {@code source}.
     */
    public static Chunk read(SourceStream source, ByteRange range) throws SourceReadException {
        if (range.getEnd() >= source.size()) {
            throw new SourceReadException(range.getStart(),
                    "Range " + range + " lies beyond the end of the image (" + source.size() + " bytes)", null);
        }
        if (range.getLength() > Integer.MAX_VALUE) {
            throw new SourceReadException(range.getStart(), "Range " + range + " is too large to read at once", null);
        }
        byte[] data = new byte[(int) range.getLength()];
        try {
            source.seek(range.getStart());
        } catch (IOException e) {
            throw new SourceReadException(range.getStart(), "Failed to seek to " + range.getStart() + ": " + e.getMessage(), e);
        }
        try {
            source.readFully(data);
        } catch (IOException e) {
            throw new SourceReadException(range.getStart(), "Failed to read range " + range + ": " + e.getMessage(), e);
        }
        return new Chunk(range, data);
    }

    private void produce() {
        int delivered = 0;
        long offset = 0;
        try {
            for (ByteRange range : ranges) {
                if (stopped.get()) {
                    return;
                }
                offset = range.getStart();
                chunks.send(read(source, range));
                delivered++;
            }
            logger.debug("Read all {} ranges from source", delivered);
        } catch (SourceReadException e) {
            failure.set(e);
            logger.error("Source read failed after {} of {} ranges: {}", delivered, ranges.size(), e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.debug("Chunk reader interrupted after {} ranges", delivered);
        } catch (RuntimeException | Error e) {
            if (chunks.isClosed()) {
                logger.debug("Chunk channel closed by consumer after {} ranges", delivered);
            } else {
                failure.set(new SourceReadException(offset, "Unexpected failure reading at " + offset + ": " + e, e));
                logger.error("Source read failed after {} of {} ranges", delivered, ranges.size(), e);
            }
        } finally {
            chunks.close();
        }
    }
}
