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


import dev.mars.pagelift.core.ByteRange;

import java.io.Closeable;
import java.io.EOFException;
import java.io.IOException;
import java.util.List;

/**
 * Seekable byte source exposing the logical content of an image.
 *
 * <p>Implementations hide whatever on-disk format the image uses; the upload engine only
 * sees a flat sequence of {@link #size()} bytes. Seek and read failures surface as
 * {@link IOException}s.</p>
 */
public interface SourceStream extends Closeable {

    /**
     * Logical size of the image in bytes.
     */
    long size();

    /**
     * Moves the read position to {@code position}.
     */
    void seek(long position) throws IOException;

    /**
     * Reads up to {@code length} bytes at the current position.
     *
     * @return the number of bytes read, or -1 at the end of the image
     */
    int read(byte[] buffer, int offset, int length) throws IOException;

    /**
     * Fills {@code buffer} completely from the current position.
     *
     * @throws EOFException if the image ends first
     */
    default void readFully(byte[] buffer) throws IOException {
        int filled = 0;
        while (filled < buffer.length) {
            int read = read(buffer, filled, buffer.length - filled);
            if (read < 0) {
                throw new EOFException("Unexpected end of image after " + filled + " of " + buffer.length + " bytes");
            }
            filled += read;
        }
    }

    /**
     * Regions of the image that hold data. Formats with block allocation tables can report
     * only their allocated blocks here; everything outside the extents reads as zero and is
     * never uploaded.
     */
    default List<ByteRange> extents() {
        long size = size();
        return size > 0 ? List.of(ByteRange.ofLength(0, size)) : List.of();
    }
}
