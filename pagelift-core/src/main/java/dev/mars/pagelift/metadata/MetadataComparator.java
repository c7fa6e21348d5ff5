package dev.mars.pagelift.metadata;

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


import dev.mars.pagelift.core.exceptions.ReconciliationPrecheckException;
import dev.mars.pagelift.storage.ChecksumCalculator;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Checks that the metadata stamped on a remote object describes the local image, which is
 * the precondition for resuming an interrupted upload into that object.
 */
public final class MetadataComparator {

    private MetadataComparator() {
    }

    /**
     * @return one human-readable line per mismatch; empty when the upload can be resumed
     */
    public static List<String> compare(ImageMetadata remote, ImageMetadata local) {
        List<String> mismatches = new ArrayList<>();
        if (!Arrays.equals(remote.getMd5Hash(), local.getMd5Hash())) {
            mismatches.add(String.format("MD5 hash of the local image (%s) differs from the hash recorded at upload start (%s)",
                    hex(local.getMd5Hash()), hex(remote.getMd5Hash())));
        }
        if (remote.getImageSize() != local.getImageSize()) {
            mismatches.add(String.format("Logical size of the local image (%d bytes) differs from the size recorded at upload start (%d bytes)",
                    local.getImageSize(), remote.getImageSize()));
        }
        return mismatches;
    }

    public static void ensureResumable(String objectName, ImageMetadata remote, ImageMetadata local)
            throws ReconciliationPrecheckException {
        List<String> mismatches = compare(remote, local);
        if (!mismatches.isEmpty()) {
            throw new ReconciliationPrecheckException(
                    "Upload into '" + objectName + "' cannot be resumed, use overwrite", mismatches);
        }
    }

    private static String hex(byte[] hash) {
        return hash == null ? "none" : ChecksumCalculator.toHex(hash);
    }
}
