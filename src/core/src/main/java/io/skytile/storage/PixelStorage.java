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

import java.io.Closeable;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * Byte-addressable, random-access storage backing one or more FITS pixel planes.
 * <p>
 * Reads and writes are positioned: every call names its absolute offset, so concurrent callers
 * never share a cursor. All implementations MUST be thread-safe. Callers that touch the same
 * bytes from different threads are expected to coordinate through a
 * {@link io.skytile.lock.RegionLock}; the storage itself does not serialize overlapping writes.
 */
public interface PixelStorage extends Closeable {

    /**
     * Reads bytes at the given offset into a newly allocated big-endian buffer.
     *
     * @param offset the offset to read from
     * @param length the number of bytes to read
     * @return a buffer whose position is the number of bytes read, needs flip() to be consumed
     * @throws IOException if an I/O error occurs
     * @throws IllegalArgumentException if offset or length is negative
     */
    default ByteBuffer readRange(long offset, int length) throws IOException {
        ByteBuffer buffer = ByteBuffer.allocate(length).order(ByteOrder.BIG_ENDIAN);
        int bytesRead = readRange(offset, length, buffer);
        assert bytesRead == buffer.position();
        return buffer;
    }

    /**
     * Reads bytes at the given offset into {@code target}, starting at its current position.
     * <p>
     * Follows NIO conventions: the target position is advanced by the number of bytes read and
     * its limit is left untouched. Reads extending beyond the end of the storage are truncated.
     *
     * @param offset the offset to read from
     * @param length the number of bytes to read
     * @param target the buffer to read into
     * @return the number of bytes actually read
     * @throws IOException if an I/O error occurs
     * @throws IllegalArgumentException if offset or length is negative, target is null, or target
     *         has less than {@code length} bytes remaining
     * @throws java.nio.ReadOnlyBufferException if target is read-only
     */
    int readRange(long offset, int length, ByteBuffer target) throws IOException;

    /**
     * Writes the remaining bytes of {@code source} at the given offset.
     * <p>
     * The source position is advanced by the number of bytes written.
     *
     * @param offset the offset to write at
     * @param source the bytes to write, from its position to its limit
     * @return the number of bytes written
     * @throws IOException if an I/O error occurs or the write does not fit the storage
     * @throws IllegalArgumentException if offset is negative or source is null
     * @throws java.nio.channels.NonWritableChannelException if the storage was opened read-only
     */
    int writeRange(long offset, ByteBuffer source) throws IOException;

    /**
     * @return the size of the storage in bytes
     * @throws IOException if an I/O error occurs
     */
    long size() throws IOException;

    /**
     * @return {@code true} if {@link #writeRange(long, ByteBuffer)} is supported
     */
    boolean isWritable();

    /**
     * @return an identifier of the underlying source, for logging and diagnostics
     */
    String getSourceIdentifier();

    /**
     * Releases the underlying resources. Idempotent.
     */
    @Override
    void close() throws IOException;
}
