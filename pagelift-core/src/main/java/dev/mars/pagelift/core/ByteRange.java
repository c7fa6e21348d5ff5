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


/**
 * Immutable inclusive range of byte offsets {@code [start, end]} into a logical image.
 *
 * <p>The string form {@code "[start, end]"} doubles as the identifier of the upload
 * request built for the range.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class ByteRange implements Comparable<ByteRange> {

    private final long start;
    private final long end;

    private ByteRange(long start, long end) {
        if (start < 0) {
            throw new IllegalArgumentException("Range start must not be negative: " + start);
        }
        if (end < start) {
            throw new IllegalArgumentException("Range end " + end + " is before start " + start);
        }
        this.start = start;
        this.end = end;
    }

    /**
     * Creates the inclusive range {@code [start, end]}.
     */
    public static ByteRange of(long start, long end) {
        return new ByteRange(start, end);
    }

    /**
     * Creates the range of {@code length} bytes beginning at {@code start}.
     */
    public static ByteRange ofLength(long start, long length) {
        if (length <= 0) {
            throw new IllegalArgumentException("Range length must be positive: " + length);
        }
        return new ByteRange(start, start + length - 1);
    }

    public long getStart() {
        return start;
    }

    public long getEnd() {
        return end;
    }

    public long getLength() {
        return end - start + 1;
    }

    /**
     * Offset one past the last byte of the range.
     */
    public long getEndExclusive() {
        return end + 1;
    }

    public boolean contains(long offset) {
        return offset >= start && offset <= end;
    }

    public boolean contains(ByteRange other) {
        return other.start >= start && other.end <= end;
    }

    public boolean intersects(ByteRange other) {
        return other.start <= end && other.end >= start;
    }

    /**
     * True when the two ranges share no byte but leave no gap between them.
     */
    public boolean isAdjacentTo(ByteRange other) {
        return other.start == end + 1 || start == other.end + 1;
    }

    /**
     * True when page alignment holds at both ends, i.e. the range starts on a page
     * boundary and covers a whole number of pages.
     */
    public boolean isAligned(long pageSize) {
        return start % pageSize == 0 && getEndExclusive() % pageSize == 0;
    }

    @Override
    public int compareTo(ByteRange other) {
        int byStart = Long.compare(start, other.start);
        return byStart != 0 ? byStart : Long.compare(end, other.end);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ByteRange)) {
            return false;
        }
        ByteRange other = (ByteRange) o;
        return start == other.start && end == other.end;
    }

    @Override
    public int hashCode() {
        return 31 * Long.hashCode(start) + Long.hashCode(end);
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + "]";
    }
}
