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
import dev.mars.pagelift.core.RangeSet;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PageBlobClientTest {

    @Test
    @DisplayName("Existing ranges are collected until the listing has no marker")
    void testListExistingRangesFollowsMarkers() throws Exception {
        PageBlobClient client = mock(PageBlobClient.class);
        when(client.listExistingRanges()).thenCallRealMethod();
        when(client.listPageRanges(isNull()))
                .thenReturn(new PageRangeListing(List.of(ByteRange.of(0, 511)), "m1"));
        when(client.listPageRanges("m1"))
                .thenReturn(new PageRangeListing(List.of(ByteRange.of(512, 1023), ByteRange.of(4096, 8191)), "m2"));
        when(client.listPageRanges("m2"))
                .thenReturn(PageRangeListing.last(List.of(ByteRange.of(16384, 16895))));

        RangeSet ranges = client.listExistingRanges();

        assertThat(ranges.ranges()).containsExactly(
                ByteRange.of(0, 1023), ByteRange.of(4096, 8191), ByteRange.of(16384, 16895));
        verify(client, times(3)).listPageRanges(any());
    }

    @Test
    @DisplayName("An empty marker ends the listing")
    void testEmptyMarkerIsLastPage() {
        assertThat(new PageRangeListing(List.of(), "").getNextMarker()).isEmpty();
        assertThat(PageRangeListing.last(List.of()).getNextMarker()).isEmpty();
    }

    @Test
    void testBlobPropertiesContentHash() {
        assertThat(new BlobProperties(512, Map.of(), new byte[0]).hasContentMd5()).isFalse();
        assertThat(new BlobProperties(512, Map.of(), null).getContentMd5()).isEmpty();
        assertThat(new BlobProperties(512, Map.of(), new byte[]{1}).getContentMd5()).isPresent();
    }
}
