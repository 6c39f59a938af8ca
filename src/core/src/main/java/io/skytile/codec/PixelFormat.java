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

/**
 * On-disk pixel encodings of a FITS data array, as named by the {@code BITPIX} keyword.
 * All multi-byte kinds are big-endian.
 */
public enum PixelFormat {
    /** Unsigned 8-bit integer, {@code BITPIX = 8}. */
    UINT8(8),
    /** Two's-complement 16-bit integer, {@code BITPIX = 16}. */
    INT16(16),
    /** Two's-complement 32-bit integer, {@code BITPIX = 32}. */
    INT32(32),
    /** Two's-complement 64-bit integer, {@code BITPIX = 64}. */
    INT64(64),
    /** IEEE-754 single precision, {@code BITPIX = -32}. */
    FLOAT32(-32),
    /** IEEE-754 double precision, {@code BITPIX = -64}. */
    FLOAT64(-64);

    private final int bitpix;

    PixelFormat(int bitpix) {
        this.bitpix = bitpix;
    }

    /**
     * @return the FITS {@code BITPIX} value of this format
     */
    public int bitpix() {
        return bitpix;
    }

    /**
     * @return the number of bytes each pixel takes on disk, {@code |BITPIX| / 8}
     */
    public int bytesPerPixel() {
        return Math.abs(bitpix) / 8;
    }

    /**
     * @return {@code true} for the IEEE-754 kinds
     */
    public boolean isFloatingPoint() {
        return bitpix < 0;
    }

    /**
     * Looks up the format for a {@code BITPIX} header value.
     *
     * @param bitpix the header value
     * @return the matching format
     * @throws IllegalArgumentException if the value is not one of 8, 16, 32, 64, -32, -64
     */
    public static PixelFormat fromBitpix(int bitpix) {
        for (PixelFormat format : values()) {
            if (format.bitpix == bitpix) {
                return format;
            }
        }
        throw new IllegalArgumentException("BITPIX field not conforming to FITS standard: " + bitpix);
    }
}
