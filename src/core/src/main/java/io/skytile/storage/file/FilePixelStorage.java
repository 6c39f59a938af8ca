/*
 * (c) Copyright 2025 Multiversio LLC. All rights reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *          http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.skytile.storage.file;

import io.skytile.storage.AbstractPixelStorage;
import io.skytile.storage.PixelStorage;
import java.io.IOException;
import java.net.URI;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.FileSystemNotFoundException;
import java.nio.file.OpenOption;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.util.Objects;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;

/**
 * A thread-safe {@link PixelStorage} over a local file.
 *
 * <p>Uses {@link FileChannel#read(ByteBuffer, long)} and {@link FileChannel#write(ByteBuffer, long)}, which
 * never touch the channel position, so worker threads can read and flush different tiles of the same
 * file concurrently without synchronizing on the channel.
 *
 * <pre>{@code
 * try (FilePixelStorage storage = FilePixelStorage.openWritable(Paths.get("stack/median.fits"))) {
 *     FitsFile file = FitsFile.builder().storage(storage).primaryDataOffset(2880).build();
 *     ...
 * }
 * }</pre>
 */
@Slf4j
public class FilePixelStorage extends AbstractPixelStorage implements PixelStorage {

    private final FileChannel channel;
    private final Path path;
    private final boolean writable;

    /**
     * Opens a file for positioned access.
     *
     * @param path the file path
     * @param writable {@code true} to open for reading and writing
     * @throws IOException if the file cannot be opened
     * @throws NullPointerException if path is null
     */
    public FilePixelStorage(Path path, boolean writable) throws IOException {
        this(path, writable, -1L);
    }

    private FilePixelStorage(Path path, boolean writable, long createSize) throws IOException {
        Objects.requireNonNull(path, "Path cannot be null");
        this.path = path;
        this.writable = writable || createSize >= 0;
        Set<OpenOption> options = this.writable
                ? Set.of(StandardOpenOption.READ, StandardOpenOption.WRITE)
                : Set.of(StandardOpenOption.READ);
        if (createSize >= 0) {
            options = Set.of(
                    StandardOpenOption.READ,
                    StandardOpenOption.WRITE,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.TRUNCATE_EXISTING);
        }
        this.channel = FileChannel.open(path, options);
        if (createSize > 0) {
            // extend the file to its final size, the gap reads back as zeros
            channel.write(ByteBuffer.allocate(1), createSize - 1);
        }
        log.debug("Opened {} ({}), size={}", path, this.writable ? "rw" : "r", channel.size());
    }

    @Override
    protected int readRangeNoFlip(long offset, int actualLength, ByteBuffer target) throws IOException {
        final int initialLimit = target.limit();
        target.limit(target.position() + actualLength);

        int totalRead = 0;
        long currentPosition = offset;
        try {
            while (totalRead < actualLength) {
                int read = channel.read(target, currentPosition);
                if (read == -1) {
                    break;
                }
                totalRead += read;
                currentPosition += read;
            }
        } finally {
            target.limit(initialLimit);
        }
        return totalRead;
    }

    @Override
    protected int writeRangeNoFlip(long offset, ByteBuffer source) throws IOException {
        int totalWritten = 0;
        long currentPosition = offset;
        while (source.hasRemaining()) {
            int written = channel.write(source, currentPosition);
            totalWritten += written;
            currentPosition += written;
        }
        return totalWritten;
    }

    @Override
    public long size() throws IOException {
        return channel.size();
    }

    @Override
    public boolean isWritable() {
        return writable;
    }

    @Override
    public String getSourceIdentifier() {
        return path.toAbsolutePath().toString();
    }

    /**
     * Forces written bytes to the device.
     *
     * @throws IOException if an I/O error occurs
     */
    public void flush() throws IOException {
        if (writable) {
            channel.force(false);
        }
    }

    @Override
    public void close() throws IOException {
        if (channel.isOpen()) {
            flush();
            channel.close();
        }
    }

    /**
     * @return a new builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Opens an existing file read-only.
     *
     * @param path the file path
     * @return a new storage
     * @throws IOException if the file cannot be opened
     */
    public static FilePixelStorage of(Path path) throws IOException {
        return builder().path(path).build();
    }

    /**
     * Opens an existing file for reading and writing.
     *
     * @param path the file path
     * @return a new storage
     * @throws IOException if the file cannot be opened
     */
    public static FilePixelStorage openWritable(Path path) throws IOException {
        return builder().path(path).writable(true).build();
    }

    /**
     * Creates (or truncates) a file of the given size, zero filled, open for reading and writing.
     *
     * @param path the file path
     * @param size the file size in bytes
     * @return a new storage
     * @throws IOException if the file cannot be created
     */
    public static FilePixelStorage create(Path path, long size) throws IOException {
        return builder().path(path).create(size).build();
    }

    /**
     * Builder for FilePixelStorage.
     */
    public static class Builder {
        private Path path;
        private boolean writable;
        private long createSize = -1L;

        private Builder() {}

        /**
         * @param path the file path
         * @return this builder
         */
        public Builder path(Path path) {
            this.path = Objects.requireNonNull(path, "Path cannot be null");
            return this;
        }

        /**
         * @param pathString the file path or file URI as a string
         * @return this builder
         */
        public Builder path(String pathString) {
            return uri(URI.create(pathString));
        }

        /**
         * @param uri the file URI; a URI without scheme is taken as a local path
         * @return this builder
         */
        public Builder uri(URI uri) {
            Objects.requireNonNull(uri, "URI cannot be null");
            if (null == uri.getScheme()) {
                uri = URI.create("file:" + uri.toString());
            }
            try {
                this.path = Paths.get(uri);
            } catch (IllegalArgumentException | FileSystemNotFoundException ex) {
                throw new IllegalArgumentException(
                        "Unable to open storage for URI %s: %s".formatted(uri, ex.getMessage()), ex);
            }
            return this;
        }

        /**
         * @param writable whether to open the file for writing as well
         * @return this builder
         */
        public Builder writable(boolean writable) {
            this.writable = writable;
            return this;
        }

        /**
         * Requests a new zero-filled file of the given size, replacing any existing file.
         *
         * @param size the file size in bytes
         * @return this builder
         */
        public Builder create(long size) {
            if (size < 0) {
                throw new IllegalArgumentException("size cannot be negative: " + size);
            }
            this.createSize = size;
            return this;
        }

        /**
         * @return the opened storage
         * @throws IOException if the file cannot be opened or created
         */
        public FilePixelStorage build() throws IOException {
            if (path == null) {
                throw new IllegalStateException("Path must be set");
            }
            return new FilePixelStorage(path, writable, createSize);
        }
    }
}
