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


import dev.mars.pagelift.simulator.ByteArraySourceStream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class ChecksumCalculatorTest {

    private static final byte[] HELLO = "hello".getBytes(StandardCharsets.US_ASCII);

    @Test
    void testMd5ByDefault() {
        ChecksumCalculator calculator = new ChecksumCalculator();
        calculator.update(HELLO);

        assertEquals("MD5", calculator.getAlgorithm());
        assertEquals("5d41402abc4b2a76b9719d911017c592", ChecksumCalculator.toHex(calculator.digest()));
    }

    @Test
    void testBase64Rendering() {
        ChecksumCalculator calculator = new ChecksumCalculator();
        calculator.update(HELLO, 0, HELLO.length);

        assertEquals("XUFAKrxLKna5cZ2REBfFkg==", ChecksumCalculator.toBase64(calculator.digest()));
    }

    @Test
    void testDigestOfSourceStream() throws Exception {
        ByteArraySourceStream source = new ByteArraySourceStream(HELLO);
        source.seek(3);

        byte[] hash = new ChecksumCalculator().digest(source);

        assertEquals("5d41402abc4b2a76b9719d911017c592", ChecksumCalculator.toHex(hash));
    }

    @Test
    void testLargeSourceMatchesIncrementalDigest() throws Exception {
        ByteArraySourceStream source = ByteArraySourceStream.random(3 * 1024 * 1024 + 17, 9);
        ChecksumCalculator incremental = new ChecksumCalculator();
        incremental.update(source.getData());

        assertArrayEquals(incremental.digest(), new ChecksumCalculator().digest(source));
    }

    @ParameterizedTest
    @ValueSource(strings = {"MD5", "SHA-256"})
    void testSupportedAlgorithms(String algorithm) {
        assertTrue(ChecksumCalculator.isAlgorithmSupported(algorithm));
        assertEquals(algorithm, new ChecksumCalculator(algorithm).getAlgorithm());
    }

    @Test
    void testUnsupportedAlgorithm() {
        assertFalse(ChecksumCalculator.isAlgorithmSupported("NOPE-1"));
        assertThrows(IllegalArgumentException.class, () -> new ChecksumCalculator("NOPE-1"));
    }
}
