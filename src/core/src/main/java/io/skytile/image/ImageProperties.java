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

import io.skytile.lock.Region;
import java.util.List;

/**
 * A set of image properties derived from the image metadata.
 * <p>
 * Instances are created on demand by {@link Image#getProperty(Class)}, which calls a public constructor
 * taking the image, and are cached for the lifetime of the image.
 */
public abstract class ImageProperties {

    /**
     * @param image the image the properties are extracted from
     */
    protected ImageProperties(Image image) {
        requireNonNull(image, "image");
    }

    /**
     * @return the metadata records backing these properties
     */
    public abstract List<MetadataRecord> getRecords();

    /**
     * Properties that rewrite pixel values each time a region is read.
     */
    @FunctionalInterface
    public interface DataTransform {

        /**
         * Transforms the decoded pixels in place.
         *
         * @param data the buffer of an {@link ImageData}, {@code [row][column]}
         * @param valid the part of the buffer holding pixels read from the image, in buffer coordinates;
         *        cells outside it are zero padding and must be left alone
         */
        void apply(double[][] data, Region valid);
    }
}
