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
import dev.mars.pagelift.core.exceptions.StorageException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Client for one remote page object, the destination of an upload.
 * Implementations wrap a concrete storage SDK; the upload engine depends only on this contract.
 *
 * <p>{@link #writePages} is called concurrently from the upload workers, so implementations
 * must be thread-safe.</p>
 */
public interface PageBlobClient {

    /**
     * Name of the remote object, used in log and error messages.
     */
    String getName();

    /**
     * Properties of the object, or empty if it does not exist yet.
     */
    Optional<BlobProperties> getProperties() throws StorageException;

    /**
     * Creates (or replaces) the object with the given size and user metadata.
     */
    void createObject(long size, Map<String, String> metadata) throws StorageException;

    /**
     * Writes {@code length} bytes at {@code offset}. Returns only once the destination has
     * acknowledged the write as durable. Offset and length are page-aligned.
     */
    void writePages(long offset, long length, byte[] data) throws StorageException;

    /**
     * Lists one page of the ranges holding data.
     *
     * @param marker continuation marker from the previous page, or {@code null} for the first page
     */
    PageRangeListing listPageRanges(String marker) throws StorageException;

    /**
     * Stamps the content hash of the completed upload.
     */
    void setFinalHash(byte[] contentMd5) throws StorageException;

    /**
     * Follows the listing markers until the last page and returns every range holding data.
     */
    default RangeSet listExistingRanges() throws StorageException {
        List<ByteRange> ranges = new ArrayList<>();
        String marker = null;
        do {
            PageRangeListing listing = listPageRanges(marker);
            ranges.addAll(listing.getRanges());
            marker = listing.getNextMarker().orElse(null);
        } while (marker != null);
        return RangeSet.of(ranges);
    }
}
