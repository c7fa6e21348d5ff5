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


import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.mars.pagelift.core.exceptions.PageliftException;
import dev.mars.pagelift.source.SourceStream;
import dev.mars.pagelift.storage.ChecksumCalculator;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Arrays;
import java.util.Base64;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Description of a local image, stamped on the remote object when an upload session creates
 * it and compared against the local image before a session resumes.
 *
 * <p>Stored as base64-encoded JSON under the {@value #METADATA_KEY} user metadata key.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class ImageMetadata {

    public static final String METADATA_KEY = "diskmetadata";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final String fileName;
    private final long fileSize;
    private final long imageSize;
    private final String lastModifiedTime;
    private final byte[] md5Hash;

    @JsonCreator
    public ImageMetadata(@JsonProperty("FileName") String fileName,
                         @JsonProperty("FileSize") long fileSize,
                         @JsonProperty("ImageSize") long imageSize,
                         @JsonProperty("LastModifiedTime") String lastModifiedTime,
                         @JsonProperty("MD5Hash") byte[] md5Hash) {
        this.fileName = fileName;
        this.fileSize = fileSize;
        this.imageSize = imageSize;
        this.lastModifiedTime = lastModifiedTime;
        this.md5Hash = md5Hash == null ? null : md5Hash.clone();
    }

    /**
     * Describes {@code imageFile}, whose logical content is exposed by {@code source}.
     * Hashes the whole logical content, so this reads the entire image once.
     */
    public static ImageMetadata fromLocalImage(Path imageFile, SourceStream source, ChecksumCalculator checksum)
            throws IOException {
        Objects.requireNonNull(imageFile, "imageFile");
        Instant modified = Files.getLastModifiedTime(imageFile).toInstant();
        byte[] md5 = checksum.digest(source);
        Path name = imageFile.getFileName();
        return new ImageMetadata(name == null ? imageFile.toString() : name.toString(),
                Files.size(imageFile), source.size(), modified.toString(), md5);
    }

    /**
     * Reads the metadata stamped on a remote object.
     *
     * @return empty when the object carries no upload metadata
     * @throws PageliftException if the entry exists but cannot be decoded
     */
    public static Optional<ImageMetadata> fromBlobMetadata(Map<String, String> blobMetadata) throws PageliftException {
        String encoded = null;
        for (Map.Entry<String, String> entry : blobMetadata.entrySet()) {
            // services are free to change the case of metadata keys
            if (METADATA_KEY.equalsIgnoreCase(entry.getKey())) {
                encoded = entry.getValue();
                break;
            }
        }
        if (encoded == null || encoded.isBlank()) {
            return Optional.empty();
        }
        try {
            byte[] json = Base64.getDecoder().decode(encoded.trim());
            return Optional.of(MAPPER.readValue(json, ImageMetadata.class));
        } catch (IllegalArgumentException | IOException e) {
            throw new PageliftException("Corrupt upload metadata under key '" + METADATA_KEY + "': " + e.getMessage(), e);
        }
    }

    /**
     * User metadata to set when creating the remote object.
     */
    public Map<String, String> toBlobMetadata() throws PageliftException {
        try {
            String json = MAPPER.writeValueAsString(this);
            return Map.of(METADATA_KEY, Base64.getEncoder().encodeToString(json.getBytes(StandardCharsets.UTF_8)));
        } catch (JsonProcessingException e) {
            throw new PageliftException("Failed to serialize upload metadata", e);
        }
    }

    @JsonProperty("FileName")
    public String getFileName() {
        return fileName;
    }

    /**
     * Size of the image file on disk.
     */
    @JsonProperty("FileSize")
    public long getFileSize() {
        return fileSize;
    }

    /**
     * Logical size of the image, the size of the remote object.
     */
    @JsonProperty("ImageSize")
    public long getImageSize() {
        return imageSize;
    }

    @JsonProperty("LastModifiedTime")
    public String getLastModifiedTime() {
        return lastModifiedTime;
    }

    @JsonProperty("MD5Hash")
    public byte[] getMd5Hash() {
        return md5Hash == null ? null : md5Hash.clone();
    }

    @JsonIgnore
    public boolean hasMd5Hash() {
        return md5Hash != null && md5Hash.length > 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ImageMetadata that = (ImageMetadata) o;
        return fileSize == that.fileSize &&
                imageSize == that.imageSize &&
                Objects.equals(fileName, that.fileName) &&
                Objects.equals(lastModifiedTime, that.lastModifiedTime) &&
                Arrays.equals(md5Hash, that.md5Hash);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(fileName, fileSize, imageSize, lastModifiedTime);
        return 31 * result + Arrays.hashCode(md5Hash);
    }

    @Override
    public String toString() {
        return "ImageMetadata{" +
                "fileName='" + fileName + '\'' +
                ", fileSize=" + fileSize +
                ", imageSize=" + imageSize +
                ", lastModifiedTime='" + lastModifiedTime + '\'' +
                ", md5=" + (md5Hash == null ? "none" : ChecksumCalculator.toHex(md5Hash)) +
                '}';
    }
}
