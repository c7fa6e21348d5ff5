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


import dev.mars.pagelift.source.SourceStream;

import java.io.IOException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;

/**
 * Computes content hashes of source images.
 * MD5 by default, since that is the hash the destination stores as its content header.
 */
public class ChecksumCalculator {
    private static final String DEFAULT_ALGORITHM = "MD5";
    private static final int BUFFER_SIZE = 1024 * 1024;

    private final MessageDigest digest;
    private final String algorithm;

    public ChecksumCalculator() {
        this(DEFAULT_ALGORITHM);
    }

    public ChecksumCalculator(String algorithm) {
        this.algorithm = algorithm;
        try {
            this.digest = MessageDigest.getInstance(algorithm);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalArgumentException("Unsupported checksum algorithm: " + algorithm, e);
        }
    }

    public void update(byte[] data) {
        digest.update(data);
    }

    public void update(byte[] data, int offset, int length) {
        digest.update(data, offset, length);
    }

    /**
     * Completes the hash and resets the calculator.
     */
    public byte[] digest() {
        return digest.digest();
    }

    /**
     * Hashes the whole logical content of {@code source}, leaving its position at the end.
     */
    public byte[] digest(SourceStream source) throws IOException {
        digest.reset();
        source.seek(0);
        byte[] buffer = new byte[BUFFER_SIZE];
        int read;
        while ((read = source.read(buffer, 0, buffer.length)) != -1) {
            digest.update(buffer, 0, read);
        }
        return digest.digest();
    }

    public void reset() {
        digest.reset();
    }

    public String getAlgorithm() {
        return algorithm;
    }

    public static String toBase64(byte[] hash) {
        return Base64.getEncoder().encodeToString(hash);
    }

    public static String toHex(byte[] hash) {
        StringBuilder result = new StringBuilder(hash.length * 2);
        for (byte b : hash) {
            result.append(String.format("%02x", b));
        }
        return result.toString();
    }

    public static boolean isAlgorithmSupported(String algorithm) {
        try {
            MessageDigest.getInstance(algorithm);
            return true;
        } catch (NoSuchAlgorithmException e) {
            return false;
        }
    }

    @Override
    public String toString() {
        return "ChecksumCalculator{algorithm='" + algorithm + "'}";
    }
}
