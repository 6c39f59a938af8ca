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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class MetadataRecordTest {

    @Test
    void numericValues() {
        assertThat(MetadataRecord.of("NAXIS1", "  2048").intValue()).isEqualTo(2048);
        assertThat(MetadataRecord.of("BITPIX", "-32").longValue()).isEqualTo(-32L);
        assertThat(MetadataRecord.of("FLXSCALE", "1.5D2").doubleValue()).isEqualTo(150.0);
        assertThat(MetadataRecord.of("BACKMEAN", "-3.25E-1").doubleValue()).isEqualTo(-0.325);
    }

    @Test
    void invalidNumbersAreRejected() {
        assertThatThrownBy(() -> MetadataRecord.of("NAXIS1", "'abc'").intValue())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("NAXIS1 is not an integer");
        assertThatThrownBy(() -> MetadataRecord.of("BIG", "4294967296").intValue())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("does not fit an int");
        assertThatThrownBy(() -> MetadataRecord.of("FLXSCALE", "T").doubleValue())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("FLXSCALE is not a number");
    }

    @Test
    void stringValueStripsQuotesAndTrailingBlanks() {
        assertThat(MetadataRecord.of("CUNIT1", "'deg     '").stringValue()).isEqualTo("deg");
        assertThat(MetadataRecord.of("OBSERVER", "'O''Brien'").stringValue()).isEqualTo("O'Brien");
        assertThat(MetadataRecord.of("PLAIN", "raw ").stringValue()).isEqualTo("raw");
    }

    @Test
    void logicalValues() {
        assertThat(MetadataRecord.of("SIMPLE", "T").booleanValue()).isTrue();
        assertThat(MetadataRecord.of("EXTEND", " F ").booleanValue()).isFalse();
        assertThatThrownBy(() -> MetadataRecord.of("SIMPLE", "yes").booleanValue())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void headerTableKeepsOrderAndReportsMissingKeywords() {
        HeaderTable header = new HeaderTable()
                .put("SIMPLE", "T")
                .put("BITPIX", "16")
                .put("NAXIS", "2")
                .put("BITPIX", "-32");

        assertThat(header.size()).isEqualTo(3);
        assertThat(header.records()).extracting(MetadataRecord::name).containsExactly("SIMPLE", "BITPIX", "NAXIS");
        assertThat(header.get("BITPIX")).hasValueSatisfying(r -> assertThat(r.intValue()).isEqualTo(-32));
        assertThat(header.get("NAXIS1")).isEmpty();
        assertThat(header.containsAll("SIMPLE", "NAXIS")).isTrue();
        assertThat(header.containsAll("SIMPLE", "NAXIS1")).isFalse();
        assertThatThrownBy(() -> header.require("NAXIS1"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Missing header keyword NAXIS1");
    }
}
