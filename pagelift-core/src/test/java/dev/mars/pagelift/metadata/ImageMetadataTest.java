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


import dev.mars.pagelift.core.exceptions.PageliftException;
import dev.mars.pagelift.simulator.ByteArraySourceStream;
import dev.mars.pagelift.storage.ChecksumCalculator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.security.MessageDigest;
import java.time.Instant;
import java.util.Base64;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ImageMetadata Tests")
class ImageMetadataTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Describes a local image file")
    void testFromLocalImage() throws Exception {
        byte[] content = "not really a disk image, but 32b".getBytes(StandardCharsets.US_ASCII);
        Path image = Files.write(tempDir.resolve("disk.img"), content);
        Files.setLastModifiedTime(image, FileTime.from(Instant.parse("2025-02-03T04:05:06Z")));

        ImageMetadata metadata = ImageMetadata.fromLocalImage(image, new ByteArraySourceStream(content),
                new ChecksumCalculator());

        assertThat(metadata.getFileName()).isEqualTo("disk.img");
        assertThat(metadata.getFileSize()).isEqualTo(content.length);
        assertThat(metadata.getImageSize()).isEqualTo(content.length);
        assertThat(metadata.getLastModifiedTime()).isEqualTo("2025-02-03T04:05:06Z");
        assertThat(ChecksumCalculator.toHex(metadata.getMd5Hash()))
                .isEqualTo(ChecksumCalculator.toHex(MessageDigest.getInstance("MD5").digest(content)));
    }

    @Test
    @DisplayName("Survives the trip through blob metadata")
    void testBlobMetadataEncoding() throws Exception {
        ImageMetadata metadata = new ImageMetadata("disk.vhd", 1024, 512, "2025-01-01T00:00:00Z",
                new byte[]{1, 2, 3, 4});

        Map<String, String> blobMetadata = metadata.toBlobMetadata();

        assertThat(blobMetadata).containsOnlyKeys(ImageMetadata.METADATA_KEY);
        String json = new String(Base64.getDecoder().decode(blobMetadata.get(ImageMetadata.METADATA_KEY)),
                StandardCharsets.UTF_8);
        assertThat(json).contains("\"FileName\":\"disk.vhd\"").contains("\"MD5Hash\":\"AQIDBA==\"");
        assertThat(ImageMetadata.fromBlobMetadata(blobMetadata)).contains(metadata);
    }

    @Test
    @DisplayName("Metadata key lookup ignores case")
    void testKeyCaseInsensitive() throws Exception {
        ImageMetadata metadata = new ImageMetadata("disk.vhd", 1, 512, null, null);
        String encoded = metadata.toBlobMetadata().get(ImageMetadata.METADATA_KEY);

        Optional<ImageMetadata> decoded = ImageMetadata.fromBlobMetadata(Map.of("DiskMetadata", encoded));

        assertThat(decoded).contains(metadata);
        assertThat(decoded.get().hasMd5Hash()).isFalse();
    }

    @Test
    @DisplayName("Absent entry means no upload metadata")
    void testAbsent() throws Exception {
        assertThat(ImageMetadata.fromBlobMetadata(Map.of("owner", "ops"))).isEmpty();
    }

    @Test
    @DisplayName("Unknown JSON properties are ignored")
    void testUnknownProperties() throws Exception {
        String json = "{\"FileName\":\"a.vhd\",\"FileSize\":10,\"ImageSize\":512,\"VHDSize\":99}";
        String encoded = Base64.getEncoder().encodeToString(json.getBytes(StandardCharsets.UTF_8));

        ImageMetadata metadata = ImageMetadata.fromBlobMetadata(Map.of(ImageMetadata.METADATA_KEY, encoded)).orElseThrow();

        assertThat(metadata.getFileName()).isEqualTo("a.vhd");
        assertThat(metadata.getImageSize()).isEqualTo(512);
    }

    @Test
    @DisplayName("Corrupt entries are reported")
    void testCorrupt() {
        assertThatThrownBy(() -> ImageMetadata.fromBlobMetadata(Map.of(ImageMetadata.METADATA_KEY, "%%%")))
                .isInstanceOf(PageliftException.class);
        String notJson = Base64.getEncoder().encodeToString("not json".getBytes(StandardCharsets.UTF_8));
        assertThatThrownBy(() -> ImageMetadata.fromBlobMetadata(Map.of(ImageMetadata.METADATA_KEY, notJson)))
                .isInstanceOf(PageliftException.class)
                .hasMessageContaining(ImageMetadata.METADATA_KEY);
    }
}
