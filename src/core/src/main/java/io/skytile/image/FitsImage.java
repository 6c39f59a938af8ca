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

import io.skytile.codec.PixelCodec;
import io.skytile.codec.PixelFormat;
import io.skytile.io.ByteBufferPool;
import io.skytile.lock.LockHolder;
import io.skytile.lock.LockMode;
import io.skytile.lock.LockToken;
import io.skytile.lock.NotLockOwnerException;
import io.skytile.lock.Region;
import io.skytile.lock.RegionLock;
import io.skytile.lock.UnknownLockTokenException;
import io.skytile.storage.PixelStorage;
import java.io.EOFException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * An {@link Image} stored as a FITS data array.
 * <p>
 * Pixels are read and written in place in the {@link FitsFile}'s storage, row-major from the data offset
 * of the image, each pixel encoded as given by {@code BITPIX}. Region access is serialized by a
 * {@link RegionLock} owned by this image; the storage I/O itself runs outside of it, so disjoint tiles
 * are read and written in parallel.
 * <p>
 * Reads fetch a locked region with as few storage calls as possible: all rows of a region are covered
 * by one contiguous byte span of the data array, and the codec skips the columns outside the region.
 * Writes go row by row so pixels next to the region are never touched.
 *
 * <pre>{@code
 * FitsFile file = FitsFile.builder()
 *         .storage(FilePixelStorage.openWritable(path))
 *         .primary(2880, header)
 *         .build();
 * FitsImage image = FitsImage.builder().file(file).config(config).build();
 * }</pre>
 */
@Slf4j
public class FitsImage extends Image {

    /** Largest accepted image width or height. */
    public static final int MAX_SIZE = 1_000_000;

    /** Largest byte span fetched or flushed with a single storage call. */
    static final int MAX_IO_SPAN = 16 * 1024 * 1024;

    private final FitsFile file;
    private final PixelStorage storage;
    private final PixelFormat format;
    private final long dataOffset;
    private final RegionLock regionLock;
    private final ByteBufferPool bufferPool;
    private final ImageProperties.DataTransform dataTransform;

    private FitsImage(Builder builder, HeaderTable header, int width, int height, PixelFormat format) {
        super(builder.imageNumber, width, height, builder.transform, header, builder.config);
        if (width > MAX_SIZE || height > MAX_SIZE) {
            throw new IllegalArgumentException(
                    "Image size %dx%d exceeds the maximum of %d".formatted(width, height, MAX_SIZE));
        }
        this.file = builder.file;
        this.storage = file.storage();
        this.format = requireNonNull(format, "format");
        this.dataOffset = file.dataOffset(builder.imageNumber);
        this.bufferPool = builder.bufferPool;
        this.regionLock = new RegionLock(builder.config.get(ImageConfig.LOCK_POLICY));
        this.dataTransform =
                builder.config.get(ImageConfig.SWARP_SCALING) ? getProperty(SWarpScaling.class) : null;
        log.debug(
                "Opened image {} of {}: {}x{} {}, data at {}, {}",
                builder.imageNumber,
                storage.getSourceIdentifier(),
                width,
                height,
                format,
                dataOffset,
                regionLock.policy());
    }

    /**
     * Opens the primary image of a file, taking geometry and format from its header.
     *
     * @param file the container
     * @return the image
     */
    public static FitsImage of(FitsFile file) {
        return of(file, 0);
    }

    /**
     * Opens an image of a file, taking geometry and format from its header.
     *
     * @param file the container
     * @param imageNumber 0 for the primary array, n for the n-th extension
     * @return the image
     */
    public static FitsImage of(FitsFile file, int imageNumber) {
        return builder().file(file).imageNumber(imageNumber).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public FitsFile getFile() {
        return file;
    }

    public PixelFormat getFormat() {
        return format;
    }

    /**
     * @return the lock manager serializing access to this image
     */
    public RegionLock getRegionLock() {
        return regionLock;
    }

    @Override
    public ImageData lockData(LockHolder holder, Region area, boolean fillZero, boolean readOnly) {
        requireNonNull(holder, "holder");
        checkArea(area, fillZero, readOnly);

        LockToken token = regionLock.enter(holder, area, LockMode.of(readOnly));
        try {
            ImageData data = new ImageData(this, holder, area, readOnly, token);
            readData(data, false);
            return data;
        } catch (RuntimeException e) {
            regionLock.exit(holder, token);
            throw e;
        }
    }

    @Override
    public ImageData switchLockData(
            LockHolder releaser, ImageData data, int newX, int newY, boolean fillZero, boolean readOnly) {
        checkParent(data);
        Region area = data.getPosition().withOrigin(newX, newY);
        checkArea(area, fillZero, readOnly);

        release(releaser, data);
        LockToken token = regionLock.enter(data.getHolder(), area, LockMode.of(readOnly));
        data.relock(area, readOnly, token);
        try {
            readData(data, true);
        } catch (RuntimeException e) {
            regionLock.exit(data.getHolder(), token);
            data.markReleased();
            throw e;
        }
        return data;
    }

    @Override
    public void exitLock(LockHolder releaser, ImageData data) {
        checkParent(data);
        release(releaser, data);
    }

    @Override
    public void forceExitLock(ImageData data) {
        checkParent(data);
        regionLock.forceExit(LockHolder.currentThread(), data.getToken());
        data.markReleased();
    }

    private void release(LockHolder releaser, ImageData data) {
        requireNonNull(releaser, "releaser");
        if (data.isReleased()) {
            throw new UnknownLockTokenException("No lock held for " + data.getToken());
        }
        if (!data.getHolder().equals(releaser)) {
            throw new NotLockOwnerException(
                    "Tried to exit a lock held by " + data.getHolder() + " from " + releaser);
        }
        try {
            if (!data.isReadOnly()) {
                writeData(data);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to write %s of %s".formatted(data.getPosition(), this), e);
        } finally {
            regionLock.exit(releaser, data.getToken());
            data.markReleased();
        }
    }

    private void checkParent(ImageData data) {
        requireNonNull(data, "data");
        if (data.getParent() != this) {
            throw new IllegalArgumentException(
                    "%s was locked on %s, not on %s".formatted(data, data.getParent(), this));
        }
    }

    private void checkArea(Region area, boolean fillZero, boolean readOnly) {
        requireNonNull(area, "area");
        if (fillZero && !readOnly) {
            throw new IllegalArgumentException("Zero filling requires read-only access, requested for " + area);
        }
        if (!readOnly && !file.isWritable()) {
            throw new IllegalArgumentException("Cannot lock %s for writing, %s is read-only".formatted(area, file));
        }
        if (!fillZero && !getBounds().contains(area)) {
            throw new IllegalArgumentException(
                    "Attempted reading outside of image bounds: %s not in %s".formatted(area, getBounds()));
        }
    }

    /**
     * Fills the buffer of {@code target} from storage. Cells outside the image are zero; a reused buffer
     * is cleared first when some of its cells fall outside.
     */
    private void readData(ImageData target, boolean reused) {
        final Region area = target.getPosition();
        final double[][] buffer = target.getData();
        final Optional<Region> inside = area.intersection(getBounds());

        if (reused && !inside.map(area::equals).orElse(area.isEmpty())) {
            for (double[] row : buffer) {
                Arrays.fill(row, 0);
            }
        }
        if (inside.isEmpty()) {
            return;
        }
        Region clip = inside.get();
        Region valid = clip.withOrigin(clip.x() - area.x(), clip.y() - area.y());
        try {
            readPixels(clip, buffer, valid);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read %s of %s".formatted(clip, this), e);
        }
        if (dataTransform != null) {
            dataTransform.apply(buffer, valid);
        }
    }

    private void readPixels(Region clip, double[][] buffer, Region valid) throws IOException {
        final int bpp = format.bytesPerPixel();
        final int stride = getWidth() * bpp;
        final int rowBytes = clip.width() * bpp;
        final int rowsPerCall = Math.max(1, Math.min(clip.height(), (MAX_IO_SPAN - rowBytes) / stride + 1));

        for (int r0 = 0; r0 < clip.height(); r0 += rowsPerCall) {
            final int rows = Math.min(rowsPerCall, clip.height() - r0);
            final int span = (int) PixelCodec.encodedSpan(format, rows, clip.width(), stride);
            final long offset = pixelOffset(clip.x(), clip.y() + r0);
            ByteBuffer bytes = bufferPool.borrow(span);
            try {
                int read = storage.readRange(offset, span, bytes);
                if (read < span) {
                    throw new EOFException("Expected %d bytes at offset %d of %s, got %d"
                            .formatted(span, offset, storage.getSourceIdentifier(), read));
                }
                bytes.flip();
                PixelCodec.decode(
                        format, bytes, buffer, valid.y() + r0, valid.y() + r0 + rows, valid.x(), valid.right(), stride);
            } finally {
                bufferPool.returnBuffer(bytes);
            }
        }
        log.trace("Read {} of image {} in chunks of {} row(s)", clip, getImageNumber(), rowsPerCall);
    }

    private void writeData(ImageData source) throws IOException {
        final Region area = source.getPosition();
        if (area.isEmpty()) {
            return;
        }
        final double[][] data = source.getData();
        final int rowBytes = area.width() * format.bytesPerPixel();
        final int rowsPerBuffer = Math.max(1, Math.min(area.height(), MAX_IO_SPAN / rowBytes));

        for (int r0 = 0; r0 < area.height(); r0 += rowsPerBuffer) {
            final int rows = Math.min(rowsPerBuffer, area.height() - r0);
            ByteBuffer bytes = bufferPool.borrow(rows * rowBytes);
            try {
                PixelCodec.encode(format, Arrays.copyOfRange(data, r0, r0 + rows), bytes, rowBytes);
                for (int r = 0; r < rows; r++) {
                    bytes.limit((r + 1) * rowBytes);
                    bytes.position(r * rowBytes);
                    storage.writeRange(pixelOffset(area.x(), area.y() + r0 + r), bytes);
                }
            } finally {
                bufferPool.returnBuffer(bytes);
            }
        }
        log.trace("Wrote {} of image {}", area, getImageNumber());
    }

    private long pixelOffset(int x, int y) {
        return dataOffset + ((long) y * getWidth() + x) * format.bytesPerPixel();
    }

    /**
     * Builder for FitsImage. Width, height and format default to the {@code NAXIS1}, {@code NAXIS2} and
     * {@code BITPIX} keywords of the image header.
     */
    public static class Builder {
        private FitsFile file;
        private int imageNumber;
        private Integer width;
        private Integer height;
        private PixelFormat format;
        private HeaderTable header;
        private WcsProjection transform;
        private ImageConfig config = ImageConfig.defaults();
        private ByteBufferPool bufferPool = ByteBufferPool.getDefault();

        private Builder() {}

        public Builder file(FitsFile file) {
            this.file = requireNonNull(file, "file");
            return this;
        }

        /**
         * @param imageNumber 0 for the primary array, n for the n-th extension
         * @return this builder
         */
        public Builder imageNumber(int imageNumber) {
            this.imageNumber = imageNumber;
            return this;
        }

        /**
         * Overrides the header geometry.
         *
         * @param width number of columns
         * @param height number of rows
         * @return this builder
         */
        public Builder size(int width, int height) {
            this.width = width;
            this.height = height;
            return this;
        }

        /**
         * Overrides the header {@code BITPIX}.
         *
         * @param format the pixel encoding
         * @return this builder
         */
        public Builder format(PixelFormat format) {
            this.format = requireNonNull(format, "format");
            return this;
        }

        /**
         * Overrides the header recorded in the file.
         *
         * @param header the image header
         * @return this builder
         */
        public Builder header(HeaderTable header) {
            this.header = requireNonNull(header, "header");
            return this;
        }

        public Builder transform(WcsProjection transform) {
            this.transform = transform;
            return this;
        }

        public Builder config(ImageConfig config) {
            this.config = requireNonNull(config, "config");
            return this;
        }

        public Builder bufferPool(ByteBufferPool bufferPool) {
            this.bufferPool = requireNonNull(bufferPool, "bufferPool");
            return this;
        }

        /**
         * @return the image
         * @throws IllegalStateException if no file was set
         * @throws IllegalArgumentException if the geometry or format are missing or invalid
         */
        public FitsImage build() {
            if (file == null) {
                throw new IllegalStateException("FitsFile must be set");
            }
            HeaderTable h = header != null ? header : file.header(imageNumber);
            int w = width != null ? width : h.require("NAXIS1").intValue();
            int hgt = height != null ? height : h.require("NAXIS2").intValue();
            PixelFormat f = format != null ? format : PixelFormat.fromBitpix(h.require("BITPIX").intValue());
            return new FitsImage(this, h, w, hgt, f);
        }
    }
}
