package dev.mars.pagelift.source;

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


import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * {@link SourceStream} over a raw image file whose bytes are the logical image content.
 */
public class FileSourceStream implements SourceStream {
    private static final Logger logger = LoggerFactory.getLogger(FileSourceStream.class);

    private final Path path;
    private final FileChannel channel;
    private final long size;

    private FileSourceStream(Path path, FileChannel channel) throws IOException {
        this.path = path;
        this.channel = channel;
        this.size = channel.size();
    }

    public static FileSourceStream open(Path path) throws IOException {
        FileChannel channel = FileChannel.open(path, StandardOpenOption.READ);
        try {
            FileSourceStream stream = new FileSourceStream(path, channel);
            logger.debug("Opened image {} ({} bytes)", path, stream.size);
            return stream;
        } catch (IOException e) {
            channel.close();
            throw e;
        }
    }

    public Path getPath() {
        return path;
    }

    @Override
    public long size() {
        return size;
    }

    @Override
    public void seek(long position) throws IOException {
        if (position < 0 || position > size) {
            throw new IOException("Cannot seek to " + position + " in image of " + size + " bytes");
        }
        channel.position(position);
    }

    @Override
    public int read(byte[] buffer, int offset, int length) throws IOException {
        return channel.read(ByteBuffer.wrap(buffer, offset, length));
    }

    @Override
    public void close() throws IOException {
        channel.close();
    }

    @Override
    public String toString() {
        return "FileSourceStream{path=" + path + ", size=" + size + "}";
    }
}
