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

import io.skytile.lock.Region;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * Flux scaling written by SWarp when resampling an image.
 * <p>
 * Reads {@code FLXSCALE}, {@code BACKMEAN} and {@code BACKSIG}. As a {@link ImageProperties.DataTransform}
 * it rewrites each read pixel as {@code (value - BACKMEAN) * FLXSCALE}. When the keywords are missing the
 * scaling is the identity, unless {@link ImageConfig#SWARP_HEADERS_REQUIRED} is set.
 */
@Slf4j
public class SWarpScaling extends ImageProperties implements ImageProperties.DataTransform {

    public static final String FLXSCALE = "FLXSCALE";
    public static final String BACKMEAN = "BACKMEAN";
    public static final String BACKSIG = "BACKSIG";

    private final double flxScale;
    private final double backMean;
    private final double backSig;
    private final boolean present;

    /**
     * @param image the image to read the keywords from
     * @throws IllegalArgumentException if a keyword is missing and required, or is not a number
     */
    public SWarpScaling(Image image) {
        super(image);
        HeaderTable header = image.getHeader();
        this.present = header.containsAll(FLXSCALE, BACKMEAN, BACKSIG);
        if (present) {
            flxScale = header.require(FLXSCALE).doubleValue();
            backMean = header.require(BACKMEAN).doubleValue();
            backSig = header.require(BACKSIG).doubleValue();
        } else {
            if (image.getConfig().get(ImageConfig.SWARP_HEADERS_REQUIRED)) {
                throw new IllegalArgumentException(
                        "Missing SWarp keywords %s, %s or %s in %s".formatted(FLXSCALE, BACKMEAN, BACKSIG, image));
            }
            log.debug("No SWarp keywords in {}, scaling is the identity", image);
            flxScale = 1;
            backMean = 0;
            backSig = 0;
        }
    }

    public double getFlxScale() {
        return flxScale;
    }

    public double getBackMean() {
        return backMean;
    }

    public double getBackSig() {
        return backSig;
    }

    /**
     * @return {@code false} if the header had no SWarp keywords
     */
    public boolean isPresent() {
        return present;
    }

    @Override
    public List<MetadataRecord> getRecords() {
        return List.of(
                MetadataRecord.of(FLXSCALE, Double.toString(flxScale)),
                MetadataRecord.of(BACKMEAN, Double.toString(backMean)),
                MetadataRecord.of(BACKSIG, Double.toString(backSig)));
    }

    @Override
    public void apply(double[][] data, Region valid) {
        for (int i = valid.y(); i < valid.bottom(); i++) {
            double[] row = data[i];
            for (int j = valid.x(); j < valid.right(); j++) {
                row[j] = (row[j] - backMean) * flxScale;
            }
        }
    }

    @Override
    public String toString() {
        return "SWarpScaling[flxScale=%s, backMean=%s, backSig=%s]".formatted(flxScale, backMean, backSig);
    }
}
