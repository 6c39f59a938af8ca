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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

class PixelFormatTest {

    @ParameterizedTest
    @CsvSource({"8, UINT8, 1", "16, INT16, 2", "32, INT32, 4", "64, INT64, 8", "-32, FLOAT32, 4", "-64, FLOAT64, 8"})
    void fromBitpix_mapsStandardValues(int bitpix, PixelFormat expected, int bytesPerPixel) {
        PixelFormat format = PixelFormat.fromBitpix(bitpix);

        assertThat(format).isEqualTo(expected);
        assertThat(format.bitpix()).isEqualTo(bitpix);
        assertThat(format.bytesPerPixel()).isEqualTo(bytesPerPixel);
        assertThat(format.isFloatingPoint()).isEqualTo(bitpix < 0);
    }

    @ParameterizedTest
    @ValueSource(ints = {0, 12, -8, -16, 128})
    void fromBitpix_rejectsNonStandardValues(int bitpix) {
        assertThatThrownBy(() -> PixelFormat.fromBitpix(bitpix))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("BITPIX field not conforming to FITS standard");
    }
}
