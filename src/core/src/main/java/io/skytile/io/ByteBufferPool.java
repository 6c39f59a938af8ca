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
package io.skytile.io;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A thread-safe pool of heap {@link ByteBuffer}s used as staging areas for pixel rows and tiles.
 * <p>
 * Tiled algorithms read and flush the same tile geometry over and over; pooling the raw byte
 * buffers that carry the encoded pixels between the storage and the codec avoids allocating a
 * fresh array for every tile.
 * <p>
 * Borrowed buffers are cleared, set to {@link ByteOrder#BIG_ENDIAN big-endian} (the FITS byte
 * order), and have their limit set to the requested size. The pool keeps at most
 * {@link #maxBuffers()} buffers; extra returned buffers are discarded.
 *
 * <pre>{@code
 * ByteBufferPool pool = ByteBufferPool.getDefault();
 * ByteBuffer rowBytes = pool.borrow(width * format.bytesPerPixel());
 * try {
 *     storage.readRange(offset, rowBytes.remaining(), rowBytes);
 *     // decode...
 * } finally {
 *     pool.returnBuffer(rowBytes);
 * }
 * }</pre>
 */
public class ByteBufferPool {

    private static final Logger logger = LoggerFactory.getLogger(ByteBufferPool.class);

    /** Default maximum number of pooled buffers. */
    public static final int DEFAULT_MAX_BUFFERS = 64;

    /** Default minimum buffer size worth pooling (4KB). */
    public static final int DEFAULT_MIN_BUFFER_SIZE = 4096;

    private static final ByteBufferPool DEFAULT_INSTANCE = new ByteBufferPool();

    private final ConcurrentLinkedQueue<ByteBuffer> buffers = new ConcurrentLinkedQueue<>();
    private final AtomicInteger bufferCount = new AtomicInteger();

    private final int maxBuffers;
    private final int minBufferSize;

    private final AtomicLong buffersCreated = new AtomicLong();
    private final AtomicLong buffersReused = new AtomicLong();
    private final AtomicLong buffersReturned = new AtomicLong();
    private final AtomicLong buffersDiscarded = new AtomicLong();

    /**
     * Creates a pool with {@link #DEFAULT_MAX_BUFFERS} and {@link #DEFAULT_MIN_BUFFER_SIZE}.
     */
    public ByteBufferPool() {
        this(DEFAULT_MAX_BUFFERS, DEFAULT_MIN_BUFFER_SIZE);
    }

    /**
     * Creates a pool with custom limits.
     *
     * @param maxBuffers maximum number of buffers kept for reuse
     * @param minBufferSize buffers with a smaller capacity are not kept
     * @throws IllegalArgumentException if either argument is not positive
     */
    public ByteBufferPool(int maxBuffers, int minBufferSize) {
        if (maxBuffers <= 0) {
            throw new IllegalArgumentException("maxBuffers must be positive: " + maxBuffers);
        }
        if (minBufferSize <= 0) {
            throw new IllegalArgumentException("minBufferSize must be positive: " + minBufferSize);
        }
        this.maxBuffers = maxBuffers;
        this.minBufferSize = minBufferSize;
        logger.debug("Created ByteBufferPool: maxBuffers={}, minSize={}", maxBuffers, minBufferSize);
    }

    /**
     * @return the shared pool instance
     */
    public static ByteBufferPool getDefault() {
        return DEFAULT_INSTANCE;
    }

    /**
     * @return the maximum number of buffers this pool retains
     */
    public int maxBuffers() {
        return maxBuffers;
    }

    /**
     * Borrows a heap buffer with at least {@code size} bytes of capacity.
     *
     * @param size the number of bytes needed
     * @return a cleared big-endian buffer whose limit is {@code size}
     * @throws IllegalArgumentException if size is negative
     */
    public ByteBuffer borrow(int size) {
        if (size < 0) {
            throw new IllegalArgumentException("size cannot be negative: " + size);
        }
        ByteBuffer buffer = poll(size);
        if (buffer != null) {
            buffersReused.incrementAndGet();
            logger.trace("Reused buffer: capacity={}, requested={}", buffer.capacity(), size);
        } else {
            buffer = ByteBuffer.allocate(roundUpTo8KB(size));
            buffersCreated.incrementAndGet();
            logger.trace("Created buffer: capacity={}, requested={}", buffer.capacity(), size);
        }
        buffer.clear().limit(size);
        return buffer.order(ByteOrder.BIG_ENDIAN);
    }

    /**
     * Hands a buffer back to the pool. The caller must not touch it afterwards.
     *
     * @param buffer the buffer to return, {@code null} is ignored
     */
    public void returnBuffer(ByteBuffer buffer) {
        if (buffer == null) {
            return;
        }
        buffer.clear();
        if (buffer.isDirect() || buffer.isReadOnly() || buffer.capacity() < minBufferSize) {
            buffersDiscarded.incrementAndGet();
            return;
        }
        if (bufferCount.incrementAndGet() <= maxBuffers) {
            buffers.offer(buffer);
            buffersReturned.incrementAndGet();
        } else {
            bufferCount.decrementAndGet();
            buffersDiscarded.incrementAndGet();
            logger.trace("Discarded buffer (pool full): capacity={}", buffer.capacity());
        }
    }

    /**
     * Drops every pooled buffer.
     */
    public void clear() {
        int cleared = 0;
        while (buffers.poll() != null) {
            bufferCount.decrementAndGet();
            cleared++;
        }
        logger.debug("Cleared pool: {} buffers", cleared);
    }

    /**
     * @return a snapshot of the pool counters
     */
    public PoolStatistics getStatistics() {
        return new PoolStatistics(
                bufferCount.get(),
                maxBuffers,
                buffersCreated.get(),
                buffersReused.get(),
                buffersReturned.get(),
                buffersDiscarded.get());
    }

    private ByteBuffer poll(int minCapacity) {
        ByteBuffer buffer;
        while ((buffer = buffers.poll()) != null) {
            bufferCount.decrementAndGet();
            if (buffer.capacity() >= minCapacity) {
                return buffer;
            }
            buffersDiscarded.incrementAndGet();
        }
        return null;
    }

    private static int roundUpTo8KB(int capacity) {
        final int alignment = 8192;
        return ((capacity + alignment - 1) / alignment) * alignment;
    }

    @Override
    public String toString() {
        PoolStatistics stats = getStatistics();
        return String.format(
                "ByteBufferPool[pooled=%d/%d, created=%d, reused=%d, returned=%d, discarded=%d]",
                stats.pooledBuffers(),
                stats.maxBuffers(),
                stats.buffersCreated(),
                stats.buffersReused(),
                stats.buffersReturned(),
                stats.buffersDiscarded());
    }

    /**
     * Immutable statistics snapshot of a {@link ByteBufferPool}.
     *
     * @param pooledBuffers buffers currently available for reuse
     * @param maxBuffers maximum number of pooled buffers
     * @param buffersCreated buffers allocated because none could be reused
     * @param buffersReused borrow requests served from the pool
     * @param buffersReturned buffers accepted back into the pool
     * @param buffersDiscarded buffers dropped because the pool was full or they were too small
     */
    public record PoolStatistics(
            int pooledBuffers,
            int maxBuffers,
            long buffersCreated,
            long buffersReused,
            long buffersReturned,
            long buffersDiscarded) {

        /**
         * @return percentage of borrow requests served from the pool (0.0 to 100.0)
         */
        public double hitRate() {
            long totalBorrows = buffersCreated + buffersReused;
            return totalBorrows > 0 ? (buffersReused * 100.0) / totalBorrows : 0.0;
        }
    }
}
