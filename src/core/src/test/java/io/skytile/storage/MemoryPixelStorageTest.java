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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ReadOnlyBufferException;
import java.nio.channels.NonWritableChannelException;
import org.junit.jupiter.api.Test;

class MemoryPixelStorageTest {

    private static byte[] sequence(int size) {
        byte[] data = new byte[size];
        for (int i = 0; i < size; i++) {
            data[i] = (byte) i;
        }
        return data;
    }

    @Test
    void testReadRange() throws IOException {
        MemoryPixelStorage storage = MemoryPixelStorage.wrap(sequence(100), false);

        ByteBuffer buffer = storage.readRange(10, 5);

        assertThat(buffer.position()).isEqualTo(5);
        buffer.flip();
        assertThat(buffer.get()).isEqualTo((byte) 10);
        assertThat(buffer.get(4)).isEqualTo((byte) 14);
    }

    @Test
    void testReadRangeIntoTargetAtPosition() throws IOException {
        MemoryPixelStorage storage = MemoryPixelStorage.wrap(sequence(100), false);
        ByteBuffer target = ByteBuffer.allocate(16);
        target.position(4);

        int read = storage.readRange(20, 8, target);

        assertThat(read).isEqualTo(8);
        assertThat(target.position()).isEqualTo(12);
        assertThat(target.get(4)).isEqualTo((byte) 20);
        assertThat(target.get(11)).isEqualTo((byte) 27);
    }

    @Test
    void testReadCrossingEndIsTruncated() throws IOException {
        MemoryPixelStorage storage = MemoryPixelStorage.wrap(sequence(10), false);

        assertThat(storage.readRange(8, 5, ByteBuffer.allocate(5))).isEqualTo(2);
        assertThat(storage.readRange(10, 5, ByteBuffer.allocate(5))).isZero();
        assertThat(storage.readRange(3, 0, ByteBuffer.allocate(5))).isZero();
    }

    @Test
    void testReadArgumentValidation() {
        MemoryPixelStorage storage = MemoryPixelStorage.allocate(10);

        assertThatThrownBy(() -> storage.readRange(-1, 2, ByteBuffer.allocate(2)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Offset cannot be negative");
        assertThatThrownBy(() -> storage.readRange(0, -2, ByteBuffer.allocate(2)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Length cannot be negative");
        assertThatThrownBy(() -> storage.readRange(0, 2, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Target buffer cannot be null");
        assertThatThrownBy(() -> storage.readRange(0, 4, ByteBuffer.allocate(2)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("insufficient remaining capacity");
        assertThatThrownBy(() -> storage.readRange(0, 2, ByteBuffer.allocate(2).asReadOnlyBuffer()))
                .isInstanceOf(ReadOnlyBufferException.class);
    }

    @Test
    void testWriteRange() throws IOException {
        MemoryPixelStorage storage = MemoryPixelStorage.allocate(16);
        ByteBuffer source = ByteBuffer.wrap(new byte[] {1, 2, 3, 4});

        assertThat(storage.writeRange(6, source)).isEqualTo(4);
        assertThat(source.hasRemaining()).isFalse();

        ByteBuffer back = storage.readRange(5, 6);
        assertThat(back.array()).containsExactly(0, 1, 2, 3, 4, 0);
    }

    @Test
    void testWriteBeyondSizeFails() {
        MemoryPixelStorage storage = MemoryPixelStorage.allocate(8);

        assertThatThrownBy(() -> storage.writeRange(6, ByteBuffer.allocate(4)))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("exceeds storage size 8");
    }

    @Test
    void testWriteToReadOnlyStorageFails() {
        MemoryPixelStorage storage = MemoryPixelStorage.wrap(new byte[8], false);

        assertThat(storage.isWritable()).isFalse();
        assertThatThrownBy(() -> storage.writeRange(0, ByteBuffer.allocate(2)))
                .isInstanceOf(NonWritableChannelException.class);
    }

    @Test
    void testWrapSharesArray() throws IOException {
        byte[] data = new byte[4];
        MemoryPixelStorage storage = MemoryPixelStorage.wrap(data, true);

        storage.writeRange(1, ByteBuffer.wrap(new byte[] {9}));

        assertThat(data[1]).isEqualTo((byte) 9);
        assertThat(storage.size()).isEqualTo(4);
        assertThat(storage.getSourceIdentifier()).startsWith("memory:");
    }
}
