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
package io.skytile.image;

import static java.util.Objects.requireNonNull;

import io.skytile.storage.PixelStorage;
import java.io.Closeable;
import java.io.IOException;
import java.util.Map;
import java.util.TreeMap;

/**
 * A FITS container: the storage holding it plus where each data array starts and the header describing
 * it. Image 0 is the primary array, images 1 to n are the extensions in file order.
 * <p>
 * Headers are parsed elsewhere; this class only records their outcome.
 */
public class FitsFile implements Closeable {

    private final PixelStorage storage;
    private final Map<Integer, Long> dataOffsets;
    private final Map<Integer, HeaderTable> headers;

    private FitsFile(Builder builder) {
        this.storage = requireNonNull(builder.storage, "storage");
        this.dataOffsets = Map.copyOf(builder.dataOffsets);
        this.headers = Map.copyOf(builder.headers);
    }

    public static Builder builder() {
        return new Builder();
    }

    public PixelStorage storage() {
        return storage;
    }

    /**
     * @return {@code true} if the underlying storage accepts writes
     */
    public boolean isWritable() {
        return storage.isWritable();
    }

    /**
     * @return the number of images, primary included
     */
    public int imageCount() {
        return dataOffsets.size();
    }

    /**
     * @param imageNumber 0 for the primary array, n for the n-th extension
     * @return the byte offset of the first pixel of that image
     * @throws IllegalArgumentException if there is no such image
     */
    public long dataOffset(int imageNumber) {
        Long offset = dataOffsets.get(imageNumber);
        if (offset == null) {
            throw new IllegalArgumentException(
                    "No image %d in %s".formatted(imageNumber, storage.getSourceIdentifier()));
        }
        return offset;
    }

    /**
     * @param imageNumber 0 for the primary array, n for the n-th extension
     * @return the header of that image, empty if none was recorded
     * @throws IllegalArgumentException if there is no such image
     */
    public HeaderTable header(int imageNumber) {
        dataOffset(imageNumber);
        return headers.getOrDefault(imageNumber, new HeaderTable());
    }

    @Override
    public void close() throws IOException {
        storage.close();
    }

    @Override
    public String toString() {
        return "FitsFile[" + storage.getSourceIdentifier() + ", images=" + dataOffsets.size() + "]";
    }

    /**
     * Builder for FitsFile.
     */
    public static class Builder {
        private PixelStorage storage;
        private final Map<Integer, Long> dataOffsets = new TreeMap<>();
        private final Map<Integer, HeaderTable> headers = new TreeMap<>();

        private Builder() {}

        public Builder storage(PixelStorage storage) {
            this.storage = requireNonNull(storage, "storage");
            return this;
        }

        /**
         * @param offset byte offset of the primary data array
         * @return this builder
         */
        public Builder primaryDataOffset(long offset) {
            return image(0, offset, null);
        }

        /**
         * @param offset byte offset of the primary data array
         * @param header the primary header
         * @return this builder
         */
        public Builder primary(long offset, HeaderTable header) {
            return image(0, offset, header);
        }

        /**
         * @param number extension number, starting at 1
         * @param offset byte offset of the extension data array
         * @param header the extension header
         * @return this builder
         */
        public Builder extension(int number, long offset, HeaderTable header) {
            if (number < 1) {
                throw new IllegalArgumentException("Extension numbers start at 1: " + number);
            }
            return image(number, offset, header);
        }

        private Builder image(int number, long offset, HeaderTable header) {
            if (offset < 0) {
                throw new IllegalArgumentException("Data offset cannot be negative: " + offset);
            }
            dataOffsets.put(number, offset);
            if (header != null) {
                headers.put(number, header);
            }
            return this;
        }

        public FitsFile build() {
            if (storage == null) {
                throw new IllegalStateException("Storage must be set");
            }
            if (!dataOffsets.containsKey(0)) {
                throw new IllegalStateException("Primary data offset must be set");
            }
            return new FitsFile(this);
        }
    }
}
