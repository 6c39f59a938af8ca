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
package io.skytile.storage;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.Objects;

/**
 * A {@link PixelStorage} backed by a fixed-size heap array.
 * <p>
 * Used for intermediate planes that never reach the disk and in tests. Visibility of bytes
 * written by one thread to another is provided by the region lock handing the region over,
 * not by this class.
 */
public class MemoryPixelStorage extends AbstractPixelStorage {

    private final byte[] data;
    private final boolean writable;
    private final String identifier;

    private MemoryPixelStorage(byte[] data, boolean writable) {
        this.data = data;
        this.writable = writable;
        this.identifier = "memory:" + Integer.toHexString(System.identityHashCode(this));
    }

    /**
     * Creates a zero-filled writable storage.
     *
     * @param size the size in bytes
     * @return a new storage
     */
    public static MemoryPixelStorage allocate(int size) {
        if (size < 0) {
            throw new IllegalArgumentException("size cannot be negative: " + size);
        }
        return new MemoryPixelStorage(new byte[size], true);
    }

    /**
     * Wraps an existing array without copying it.
     *
     * @param data the backing bytes
     * @param writable whether writes are allowed
     * @return a new storage
     */
    public static MemoryPixelStorage wrap(byte[] data, boolean writable) {
        return new MemoryPixelStorage(Objects.requireNonNull(data, "data"), writable);
    }

    @Override
    protected int readRangeNoFlip(long offset, int actualLength, ByteBuffer target) {
        target.put(data, (int) offset, actualLength);
        return actualLength;
    }

    @Override
    protected int writeRangeNoFlip(long offset, ByteBuffer source) throws IOException {
        final int length = source.remaining();
        if (offset + length > data.length) {
            throw new IOException("Write of %d bytes at offset %d exceeds storage size %d"
                    .formatted(length, offset, data.length));
        }
        source.get(data, (int) offset, length);
        return length;
    }

    @Override
    public long size() {
        return data.length;
    }

    @Override
    public boolean isWritable() {
        return writable;
    }

    @Override
    public String getSourceIdentifier() {
        return identifier;
    }

    @Override
    public void close() {
        // nothing to release
    }
}
