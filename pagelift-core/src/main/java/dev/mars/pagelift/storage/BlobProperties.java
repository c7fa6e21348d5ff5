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


import java.util.Arrays;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Properties of an existing remote page object: its size, its user metadata and, once an
 * upload has been finalised, its content hash.
 */
public final class BlobProperties {

    private final long size;
    private final Map<String, String> metadata;
    private final byte[] contentMd5;

    public BlobProperties(long size, Map<String, String> metadata, byte[] contentMd5) {
        this.size = size;
        this.metadata = Map.copyOf(Objects.requireNonNull(metadata, "metadata"));
        this.contentMd5 = contentMd5 == null ? null : contentMd5.clone();
    }

    public long getSize() {
        return size;
    }

    public Map<String, String> getMetadata() {
        return metadata;
    }

    public Optional<byte[]> getContentMd5() {
        return contentMd5 == null || contentMd5.length == 0 ? Optional.empty() : Optional.of(contentMd5.clone());
    }

    /**
     * True when a content hash was stamped, which only happens after a completed upload.
     */
    public boolean hasContentMd5() {
        return contentMd5 != null && contentMd5.length > 0;
    }

    @Override
    public String toString() {
        return "BlobProperties{size=" + size + ", metadataKeys=" + metadata.keySet()
                + ", contentMd5=" + (contentMd5 == null ? "none" : Arrays.toString(contentMd5)) + "}";
    }
}
