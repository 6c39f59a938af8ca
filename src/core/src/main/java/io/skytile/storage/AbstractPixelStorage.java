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
import java.nio.ReadOnlyBufferException;
import java.nio.channels.NonWritableChannelException;

/**
 * Base class for {@link PixelStorage} implementations.
 * <p>
 * {@link #readRange(long, int, ByteBuffer)} and {@link #writeRange(long, ByteBuffer)} perform
 * argument validation and end-of-storage handling, then delegate to
 * {@link #readRangeNoFlip(long, int, ByteBuffer)} and {@link #writeRangeNoFlip(long, ByteBuffer)}.
 * <p>
 * Guarantees given to the delegate methods:
 * <ul>
 * <li>{@literal offset >= 0}</li>
 * <li>the length to transfer is {@literal > 0}</li>
 * <li>for reads, {@literal offset < size()} and the length has been truncated to the end of the storage</li>
 * <li>for writes, the storage is writable</li>
 * </ul>
 */
public abstract class AbstractPixelStorage implements PixelStorage {

    /**
     * Constructor for subclasses.
     */
    protected AbstractPixelStorage() {
        // Default constructor for subclasses
    }

    @Override
    public final int readRange(long offset, int length, ByteBuffer target) throws IOException {
        if (offset < 0) {
            throw new IllegalArgumentException("Offset cannot be negative");
        }
        if (length < 0) {
            throw new IllegalArgumentException("Length cannot be negative");
        }
        if (target == null) {
            throw new IllegalArgumentException("Target buffer cannot be null");
        }
        if (target.isReadOnly()) {
            throw new ReadOnlyBufferException();
        }
        if (length == 0) {
            return 0;
        }
        final int remaining = target.remaining();
        if (remaining < length) {
            throw new IllegalArgumentException(
                    "Target buffer has insufficient remaining capacity: " + remaining + " < " + length);
        }

        final long size = size();
        if (offset >= size) {
            return 0;
        }
        int actualLength = length;
        if (offset + length > size) {
            actualLength = (int) (size - offset);
        }
        return readRangeNoFlip(offset, actualLength, target);
    }

    @Override
    public final int writeRange(long offset, ByteBuffer source) throws IOException {
        if (offset < 0) {
            throw new IllegalArgumentException("Offset cannot be negative");
        }
        if (source == null) {
            throw new IllegalArgumentException("Source buffer cannot be null");
        }
        if (!isWritable()) {
            throw new NonWritableChannelException();
        }
        if (!source.hasRemaining()) {
            return 0;
        }
        return writeRangeNoFlip(offset, source);
    }

    /**
     * Reads exactly {@code actualLength} bytes (or up to end of storage) into {@code target},
     * advancing its position and leaving its limit unchanged.
     *
     * @param offset the offset to read from
     * @param actualLength the number of bytes to read
     * @param target the buffer to read into
     * @return the number of bytes read
     * @throws IOException if an I/O error occurs
     */
    protected abstract int readRangeNoFlip(long offset, int actualLength, ByteBuffer target) throws IOException;

    /**
     * Writes all remaining bytes of {@code source} at {@code offset}, advancing its position.
     *
     * @param offset the offset to write at
     * @param source the bytes to write
     * @return the number of bytes written
     * @throws IOException if an I/O error occurs
     */
    protected abstract int writeRangeNoFlip(long offset, ByteBuffer source) throws IOException;
}
