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
package io.skytile.codec;

import static java.util.Objects.requireNonNull;

import java.nio.ByteBuffer;

/**
 * Translates between the big-endian FITS pixel layouts and row-major {@code double[row][col]} buffers.
 * <p>
 * Both directions work on absolute indices relative to the buffer's current position and leave
 * position and limit untouched. Rows in the byte buffer are {@code stride} bytes apart; bytes past
 * the pixels of a row are skipped, never read or written.
 * <p>
 * The codec trusts its caller: a byte buffer too small for the declared rectangle and stride, or a
 * rectangle outside the target matrix, fails with an {@link IndexOutOfBoundsException} from the
 * bounds-checked buffer or array access.
 */
public final class PixelCodec {

    private static final double HALF_WORD = 65536.0;
    private static final long WORD = 1L << 32;

    private PixelCodec() {
        // static utility
    }

    @FunctionalInterface
    private interface PixelReader {
        double read(ByteBuffer source, int index);
    }

    @FunctionalInterface
    private interface PixelWriter {
        void write(ByteBuffer target, int index, double value);
    }

    /**
     * Decodes pixels into the sub-rectangle {@code [hStart, hEnd) x [wStart, wEnd)} of {@code target}.
     * <p>
     * The first encoded pixel is at the current position of {@code source}; it becomes
     * {@code target[hStart][wStart]}. After each row the cursor advances by
     * {@code stride - (wEnd - wStart) * bytesPerPixel}.
     *
     * @param format the on-disk encoding
     * @param source the encoded bytes
     * @param target the destination matrix, indexed {@code [row][column]}
     * @param hStart first row of target to fill
     * @param hEnd row after the last row to fill
     * @param wStart first column of target to fill
     * @param wEnd column after the last column to fill
     * @param stride bytes from the start of one encoded row to the start of the next
     * @throws IndexOutOfBoundsException if source or target are too small for the rectangle
     */
    public static void decode(
            PixelFormat format,
            ByteBuffer source,
            double[][] target,
            int hStart,
            int hEnd,
            int wStart,
            int wEnd,
            int stride) {
        requireNonNull(source, "source");
        requireNonNull(target, "target");
        final PixelReader reader = readerFor(format);
        final int bpp = format.bytesPerPixel();
        final int rowSkip = stride - (wEnd - wStart) * bpp;

        int b = source.position();
        for (int i = hStart; i < hEnd; i++) {
            final double[] row = target[i];
            for (int j = wStart; j < wEnd; j++, b += bpp) {
                row[j] = reader.read(source, b);
            }
            b += rowSkip;
        }
    }

    /**
     * Encodes the whole of {@code source} starting at the current position of {@code target}.
     * Each row of the matrix is written {@code stride} bytes after the previous one.
     *
     * @param format the on-disk encoding
     * @param source the pixels, indexed {@code [row][column]}; all rows must have the same length
     * @param target the destination bytes
     * @param stride bytes from the start of one encoded row to the start of the next
     * @throws IllegalArgumentException if stride is smaller than an encoded row
     * @throws IndexOutOfBoundsException if target is too small
     */
    public static void encode(PixelFormat format, double[][] source, ByteBuffer target, int stride) {
        requireNonNull(source, "source");
        requireNonNull(target, "target");
        final PixelWriter writer = writerFor(format);
        final int bpp = format.bytesPerPixel();
        final int columns = source.length == 0 ? 0 : source[0].length;
        final int rowSkip = stride - columns * bpp;
        if (rowSkip < 0) {
            throw new IllegalArgumentException(
                    "Stride %d is smaller than an encoded row of %d bytes".formatted(stride, columns * bpp));
        }

        int b = target.position();
        for (double[] row : source) {
            for (int j = 0; j < columns; j++, b += bpp) {
                writer.write(target, b, row[j]);
            }
            b += rowSkip;
        }
    }

    /**
     * Number of bytes spanned by {@code rows} encoded rows of {@code columns} pixels, {@code stride}
     * bytes apart. The padding after the last row is not counted.
     *
     * @param format the on-disk encoding
     * @param rows number of rows
     * @param columns pixels per row
     * @param stride bytes between row starts
     * @return the byte span, 0 if there are no pixels
     */
    public static long encodedSpan(PixelFormat format, int rows, int columns, long stride) {
        if (rows <= 0 || columns <= 0) {
            return 0;
        }
        return (rows - 1) * stride + (long) columns * format.bytesPerPixel();
    }

    private static PixelReader readerFor(PixelFormat format) {
        switch (requireNonNull(format, "format")) {
            case UINT8:
                return (s, i) -> s.get(i) & 0xFF;
            case INT16:
                return PixelCodec::signedHalf;
            case INT32:
                return (s, i) -> signedHalf(s, i) * HALF_WORD + unsignedHalf(s, i + 2);
            case INT64:
                return PixelCodec::readInt64;
            case FLOAT32:
                return (s, i) -> Float.intBitsToFloat(bigEndianInt(s, i));
            case FLOAT64:
                return (s, i) -> Double.longBitsToDouble(((long) bigEndianInt(s, i) << 32)
                        | (bigEndianInt(s, i + 4) & 0xFFFFFFFFL));
            default:
                throw new IllegalArgumentException("Unsupported pixel format " + format);
        }
    }

    private static PixelWriter writerFor(PixelFormat format) {
        switch (requireNonNull(format, "format")) {
            case UINT8:
                return (t, i, v) -> t.put(i, (byte) (int) v);
            case INT16:
                return (t, i, v) -> {
                    int d = (int) v;
                    t.put(i, (byte) (d >> 8));
                    t.put(i + 1, (byte) d);
                };
            case INT32:
                return (t, i, v) -> putBigEndianInt(t, i, (int) v);
            case INT64:
                return PixelCodec::writeInt64;
            case FLOAT32:
                return (t, i, v) -> putBigEndianInt(t, i, Float.floatToRawIntBits((float) v));
            case FLOAT64:
                return (t, i, v) -> {
                    long bits = Double.doubleToRawLongBits(v);
                    putBigEndianInt(t, i, (int) (bits >>> 32));
                    putBigEndianInt(t, i + 4, (int) bits);
                };
            default:
                throw new IllegalArgumentException("Unsupported pixel format " + format);
        }
    }

    /** Sign-extended high byte times 256 plus the unsigned low byte. */
    private static int signedHalf(ByteBuffer source, int index) {
        return source.get(index) * 256 + (source.get(index + 1) & 0xFF);
    }

    private static int unsignedHalf(ByteBuffer source, int index) {
        return (source.get(index) & 0xFF) * 256 + (source.get(index + 1) & 0xFF);
    }

    private static double readInt64(ByteBuffer source, int index) {
        double value = signedHalf(source, index);
        value = value * HALF_WORD + unsignedHalf(source, index + 2);
        value = value * HALF_WORD + unsignedHalf(source, index + 4);
        value = value * HALF_WORD + unsignedHalf(source, index + 6);
        return value;
    }

    private static void writeInt64(ByteBuffer target, int index, double value) {
        final long d = (long) value;
        // high word by floor division so negative values keep their sign bits
        final long high = Math.floorDiv(d, WORD);
        final long low = d - high * WORD;
        putBigEndianInt(target, index, (int) high);
        putBigEndianInt(target, index + 4, (int) low);
    }

    private static int bigEndianInt(ByteBuffer source, int index) {
        return (source.get(index) & 0xFF) << 24
                | (source.get(index + 1) & 0xFF) << 16
                | (source.get(index + 2) & 0xFF) << 8
                | (source.get(index + 3) & 0xFF);
    }

    private static void putBigEndianInt(ByteBuffer target, int index, int value) {
        target.put(index, (byte) (value >>> 24));
        target.put(index + 1, (byte) (value >>> 16));
        target.put(index + 2, (byte) (value >>> 8));
        target.put(index + 3, (byte) value);
    }
}
