package dev.mars.pagelift.storage;

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

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * One page of a paginated listing of the ranges present in a remote page object.
 */
public final class PageRangeListing {

    private final List<ByteRange> ranges;
    private final String nextMarker;

    public PageRangeListing(List<ByteRange> ranges, String nextMarker) {
        this.ranges = List.copyOf(Objects.requireNonNull(ranges, "ranges"));
        this.nextMarker = nextMarker;
    }

    public static PageRangeListing last(List<ByteRange> ranges) {
        return new PageRangeListing(ranges, null);
    }

    public List<ByteRange> getRanges() {
        return ranges;
    }

    /**
     * Marker to pass to the next listing call; empty on the final page.
     */
    public Optional<String> getNextMarker() {
        return nextMarker == null || nextMarker.isEmpty() ? Optional.empty() : Optional.of(nextMarker);
    }

    @Override
    public String toString() {
        return "PageRangeListing{ranges=" + ranges.size() + ", nextMarker=" + nextMarker + "}";
    }
}
