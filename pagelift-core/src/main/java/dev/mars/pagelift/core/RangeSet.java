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


import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * Immutable ordered set of byte ranges.
 *
 * <p>Ranges are kept sorted by start offset and coalesced: no two members overlap or
 * touch. Any collection handed to {@link #of(Collection)} is normalised, so overlapping
 * or adjacent input ranges collapse into one member.</p>
 *
 * <p>Used both for the ranges already present at the destination and for intermediate
 * results of reconciliation.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class RangeSet implements Iterable<ByteRange> {

    private static final RangeSet EMPTY = new RangeSet(List.of());

    private final List<ByteRange> ranges;

    private RangeSet(List<ByteRange> normalised) {
        this.ranges = Collections.unmodifiableList(normalised);
    }

    public static RangeSet empty() {
        return EMPTY;
    }

    public static RangeSet of(ByteRange... ranges) {
        return of(Arrays.asList(ranges));
    }

    public static RangeSet of(Collection<ByteRange> ranges) {
        Objects.requireNonNull(ranges, "ranges");
        if (ranges.isEmpty()) {
            return EMPTY;
        }
        List<ByteRange> sorted = new ArrayList<>(ranges);
        sorted.forEach(r -> Objects.requireNonNull(r, "range"));
        Collections.sort(sorted);

        List<ByteRange> merged = new ArrayList<>(sorted.size());
        long start = sorted.get(0).getStart();
        long end = sorted.get(0).getEnd();
        for (int i = 1; i < sorted.size(); i++) {
            ByteRange next = sorted.get(i);
            if (next.getStart() <= end + 1) {
                end = Math.max(end, next.getEnd());
            } else {
                merged.add(ByteRange.of(start, end));
                start = next.getStart();
                end = next.getEnd();
            }
        }
        merged.add(ByteRange.of(start, end));
        return new RangeSet(merged);
    }

    public List<ByteRange> ranges() {
        return ranges;
    }

    public int size() {
        return ranges.size();
    }

    public boolean isEmpty() {
        return ranges.isEmpty();
    }

    public long totalLength() {
        long total = 0;
        for (ByteRange range : ranges) {
            total += range.getLength();
        }
        return total;
    }

    /**
     * True when every byte of {@code range} is a member of this set.
     */
    public boolean covers(ByteRange range) {
        for (ByteRange member : ranges) {
            if (member.contains(range)) {
                return true;
            }
            if (member.getStart() > range.getStart()) {
                return false;
            }
        }
        return false;
    }

    public RangeSet union(RangeSet other) {
        if (other.isEmpty()) {
            return this;
        }
        List<ByteRange> all = new ArrayList<>(ranges.size() + other.size());
        all.addAll(ranges);
        all.addAll(other.ranges);
        return of(all);
    }

    /**
     * Returns the bytes of this set that are not in {@code other}.
     *
     * <p>Both sets are sorted, so a single merge pass is enough.</p>
     */
    public RangeSet subtract(RangeSet other) {
        if (isEmpty() || other.isEmpty()) {
            return this;
        }
        List<ByteRange> result = new ArrayList<>();
        List<ByteRange> holes = other.ranges;
        int h = 0;
        for (ByteRange range : ranges) {
            long cursor = range.getStart();
            long end = range.getEnd();
            while (h < holes.size() && holes.get(h).getEnd() < cursor) {
                h++;
            }
            int k = h;
            while (cursor <= end && k < holes.size() && holes.get(k).getStart() <= end) {
                ByteRange hole = holes.get(k);
                if (hole.getStart() > cursor) {
                    result.add(ByteRange.of(cursor, hole.getStart() - 1));
                }
                cursor = Math.max(cursor, hole.getEnd() + 1);
                k++;
            }
            if (cursor <= end) {
                result.add(ByteRange.of(cursor, end));
            }
        }
        return new RangeSet(result);
    }

    @Override
    public Iterator<ByteRange> iterator() {
        return ranges.iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RangeSet)) {
            return false;
        }
        return ranges.equals(((RangeSet) o).ranges);
    }

    @Override
    public int hashCode() {
        return ranges.hashCode();
    }

    @Override
    public String toString() {
        return "RangeSet" + ranges;
    }
}
