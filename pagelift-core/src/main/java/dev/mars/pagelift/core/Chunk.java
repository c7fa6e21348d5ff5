package dev.mars.pagelift.core;

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


import java.util.Objects;

/**
 * A byte range together with the bytes read for it from the source image.
 *
 * <p>A chunk is handed from the reader to exactly one upload request. The payload array
 * is not copied, so neither side may modify it after the handoff.</p>
 */
public final class Chunk {

    private final ByteRange range;
    private final byte[] data;

    public Chunk(ByteRange range, byte[] data) {
        this.range = Objects.requireNonNull(range, "range");
        this.data = Objects.requireNonNull(data, "data");
        if (data.length != range.getLength()) {
            throw new IllegalArgumentException("Chunk " + range + " expects " + range.getLength()
                    + " bytes but got " + data.length);
        }
    }

    public ByteRange getRange() {
        return range;
    }

    public byte[] getData() {
        return data;
    }

    public long getLength() {
        return range.getLength();
    }

    @Override
    public String toString() {
        return "Chunk{range=" + range + ", length=" + data.length + "}";
    }
}
