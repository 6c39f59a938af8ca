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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ByteBufferPoolTest {

    private ByteBufferPool pool;

    @BeforeEach
    void setUp() {
        pool = new ByteBufferPool(2, 1024); // Small limits for testing
    }

    @Test
    void constructor_withInvalidParameters_throwsException() {
        assertThatThrownBy(() -> new ByteBufferPool(0, 1024))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("maxBuffers must be positive");

        assertThatThrownBy(() -> new ByteBufferPool(4, 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("minBufferSize must be positive");
    }

    @Test
    void getDefault_returnsSameInstance() {
        assertThat(ByteBufferPool.getDefault()).isSameAs(ByteBufferPool.getDefault());
    }

    @Test
    void borrow_returnsClearedBigEndianHeapBuffer() {
        ByteBuffer buffer = pool.borrow(3000);

        assertThat(buffer.isDirect()).isFalse();
        assertThat(buffer.order()).isEqualTo(ByteOrder.BIG_ENDIAN);
        assertThat(buffer.position()).isZero();
        assertThat(buffer.limit()).isEqualTo(3000);
        assertThat(buffer.capacity()).isEqualTo(8192);
    }

    @Test
    void borrow_withNegativeSize_throwsException() {
        assertThatThrownBy(() -> pool.borrow(-1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("size cannot be negative");
    }

    @Test
    void returnBuffer_withNullBuffer_doesNothing() {
        pool.returnBuffer(null);

        assertThat(pool.getStatistics().buffersReturned()).isZero();
    }

    @Test
    void returnedBuffer_isReusedAndReset() {
        ByteBuffer buffer = pool.borrow(2048);
        buffer.putInt(12345);
        pool.returnBuffer(buffer);

        ByteBuffer again = pool.borrow(100);

        assertThat(again).isSameAs(buffer);
        assertThat(again.position()).isZero();
        assertThat(again.limit()).isEqualTo(100);
        ByteBufferPool.PoolStatistics stats = pool.getStatistics();
        assertThat(stats.buffersCreated()).isEqualTo(1);
        assertThat(stats.buffersReused()).isEqualTo(1);
        assertThat(stats.hitRate()).isEqualTo(50.0);
    }

    @Test
    void pooledBufferTooSmall_isDiscardedOnBorrow() {
        pool.returnBuffer(pool.borrow(2048));

        ByteBuffer big = pool.borrow(20_000);

        assertThat(big.capacity()).isGreaterThanOrEqualTo(20_000);
        ByteBufferPool.PoolStatistics stats = pool.getStatistics();
        assertThat(stats.buffersCreated()).isEqualTo(2);
        assertThat(stats.buffersDiscarded()).isEqualTo(1);
        assertThat(stats.pooledBuffers()).isZero();
    }

    @Test
    void returnBuffer_discardsUnpoolableBuffers() {
        pool.returnBuffer(ByteBuffer.allocateDirect(4096));
        pool.returnBuffer(ByteBuffer.allocate(4096).asReadOnlyBuffer());
        pool.returnBuffer(ByteBuffer.allocate(512));

        ByteBufferPool.PoolStatistics stats = pool.getStatistics();
        assertThat(stats.buffersDiscarded()).isEqualTo(3);
        assertThat(stats.pooledBuffers()).isZero();
    }

    @Test
    void returnBuffer_whenPoolFull_discardsBuffer() {
        ByteBuffer b1 = pool.borrow(2048);
        ByteBuffer b2 = pool.borrow(2048);
        ByteBuffer b3 = pool.borrow(2048);

        pool.returnBuffer(b1);
        pool.returnBuffer(b2);
        pool.returnBuffer(b3);

        ByteBufferPool.PoolStatistics stats = pool.getStatistics();
        assertThat(stats.pooledBuffers()).isEqualTo(2);
        assertThat(stats.buffersReturned()).isEqualTo(2);
        assertThat(stats.buffersDiscarded()).isEqualTo(1);
        assertThat(pool.toString()).contains("pooled=2/2");
    }

    @Test
    void clear_dropsPooledBuffers() {
        pool.returnBuffer(pool.borrow(2048));
        assertThat(pool.getStatistics().pooledBuffers()).isEqualTo(1);

        pool.clear();

        assertThat(pool.getStatistics().pooledBuffers()).isZero();
    }

    @Test
    void concurrentBorrowAndReturn_neverExceedsLimit() throws Exception {
        ByteBufferPool shared = new ByteBufferPool(4, 1024);
        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    for (int i = 0; i < 200; i++) {
                        ByteBuffer buffer = shared.borrow(4096);
                        buffer.putLong(i);
                        shared.returnBuffer(buffer);
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> f : futures) {
                f.get(10, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        ByteBufferPool.PoolStatistics stats = shared.getStatistics();
        assertThat(stats.pooledBuffers()).isLessThanOrEqualTo(4);
        assertThat(stats.buffersCreated() + stats.buffersReused()).isEqualTo(threads * 200L);
    }
}
