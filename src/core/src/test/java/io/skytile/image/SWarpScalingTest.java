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

import io.skytile.codec.PixelFormat;
import io.skytile.lock.Region;
import io.skytile.storage.MemoryPixelStorage;
import java.util.List;
import org.junit.jupiter.api.Test;

class SWarpScalingTest {

    private static FitsImage image(HeaderTable header, ImageConfig config) {
        FitsFile file = FitsFile.builder()
                .storage(MemoryPixelStorage.allocate(64))
                .primary(0, header)
                .build();
        return FitsImage.builder()
                .file(file)
                .size(4, 2)
                .format(PixelFormat.FLOAT64)
                .config(config)
                .build();
    }

    private static HeaderTable swarpHeader() {
        return new HeaderTable()
                .put(SWarpScaling.FLXSCALE, "2.0")
                .put(SWarpScaling.BACKMEAN, "1.0D0")
                .put(SWarpScaling.BACKSIG, "0.5");
    }

    @Test
    void readsKeywords() {
        SWarpScaling scaling = image(swarpHeader(), ImageConfig.defaults()).getProperty(SWarpScaling.class);

        assertThat(scaling.isPresent()).isTrue();
        assertThat(scaling.getFlxScale()).isEqualTo(2.0);
        assertThat(scaling.getBackMean()).isEqualTo(1.0);
        assertThat(scaling.getBackSig()).isEqualTo(0.5);
        List<MetadataRecord> records = scaling.getRecords();
        assertThat(records).extracting(MetadataRecord::name).containsExactly("FLXSCALE", "BACKMEAN", "BACKSIG");
        assertThat(records.get(0).doubleValue()).isEqualTo(2.0);
    }

    @Test
    void missingKeywordsMeanIdentity() {
        SWarpScaling scaling = image(new HeaderTable(), ImageConfig.defaults()).getProperty(SWarpScaling.class);
        double[][] data = {{3, 4}};

        scaling.apply(data, Region.of(0, 0, 2, 1));

        assertThat(scaling.isPresent()).isFalse();
        assertThat(data[0]).containsExactly(3, 4);
    }

    @Test
    void missingKeywordsFailWhenRequired() {
        FitsImage image = image(
                new HeaderTable().put(SWarpScaling.FLXSCALE, "2.0"),
                new ImageConfig().setParameter(ImageConfig.SWARP_HEADERS_REQUIRED, true));

        assertThatThrownBy(() -> image.getProperty(SWarpScaling.class))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Missing SWarp keywords");
    }

    @Test
    void applyOnlyTouchesValidCells() {
        SWarpScaling scaling = image(swarpHeader(), ImageConfig.defaults()).getProperty(SWarpScaling.class);
        double[][] data = {{0, 0, 0}, {0, 5, 7}};

        scaling.apply(data, Region.of(1, 1, 2, 1));

        assertThat(data[0]).containsExactly(0, 0, 0);
        assertThat(data[1]).containsExactly(0, 8, 12);
    }

    @Test
    void propertiesAreCachedPerImage() {
        FitsImage image = image(swarpHeader(), ImageConfig.defaults());

        assertThat(image.getProperty(SWarpScaling.class)).isSameAs(image.getProperty(SWarpScaling.class));
        assertThat(image(swarpHeader(), ImageConfig.defaults()).getProperty(SWarpScaling.class))
                .isNotSameAs(image.getProperty(SWarpScaling.class));
    }

    @Test
    void propertiesWithoutImageConstructorAreRejected() {
        FitsImage image = image(swarpHeader(), ImageConfig.defaults());

        assertThatThrownBy(() -> image.getProperty(Unconstructible.class))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("no public constructor");
    }

    public static class Unconstructible extends ImageProperties {
        public Unconstructible(Image image, int extra) {
            super(image);
        }

        @Override
        public List<MetadataRecord> getRecords() {
            return List.of();
        }
    }
}
