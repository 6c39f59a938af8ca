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
package io.skytile.lock;

import java.util.Optional;

/**
 * An axis-aligned rectangle of pixels.
 * <p>
 * {@code x} is the left column and {@code y} the top row; the region covers columns
 * {@code [x, x + width)} and rows {@code [y, y + height)}. Coordinates may be negative or extend past
 * the image when a caller asks for an overscan margin.
 *
 * @param x left column
 * @param y top row
 * @param width number of columns
 * @param height number of rows
 */
public record Region(int x, int y, int width, int height) {

    /**
     * @param x left column
     * @param y top row
     * @param width number of columns, non-negative
     * @param height number of rows, non-negative
     */
    public Region {
        if (width < 0) {
            throw new IllegalArgumentException("width can't be < 0: " + width);
        }
        if (height < 0) {
            throw new IllegalArgumentException("height can't be < 0: " + height);
        }
    }

    /**
     * Factory method.
     *
     * @param x left column
     * @param y top row
     * @param width number of columns
     * @param height number of rows
     * @return a new region
     */
    public static Region of(int x, int y, int width, int height) {
        return new Region(x, y, width, height);
    }

    /**
     * @return the column after the last covered column
     */
    public int right() {
        return x + width;
    }

    /**
     * @return the row after the last covered row
     */
    public int bottom() {
        return y + height;
    }

    /**
     * @return {@code true} if the region covers no pixel
     */
    public boolean isEmpty() {
        return width == 0 || height == 0;
    }

    /**
     * Two regions intersect when they share at least one pixel. Empty regions intersect nothing.
     *
     * @param other the other region
     * @return whether the regions share a pixel
     */
    public boolean intersects(Region other) {
        return !isEmpty()
                && !other.isEmpty()
                && other.x < right()
                && x < other.right()
                && other.y < bottom()
                && y < other.bottom();
    }

    /**
     * @param other the other region
     * @return the shared pixels, or empty if the regions do not intersect
     */
    public Optional<Region> intersection(Region other) {
        if (!intersects(other)) {
            return Optional.empty();
        }
        int left = Math.max(x, other.x);
        int top = Math.max(y, other.y);
        int r = Math.min(right(), other.right());
        int b = Math.min(bottom(), other.bottom());
        return Optional.of(new Region(left, top, r - left, b - top));
    }

    /**
     * @param other the other region
     * @return {@code true} if every pixel of {@code other} is in this region
     */
    public boolean contains(Region other) {
        return other.x >= x && other.y >= y && other.right() <= right() && other.bottom() <= bottom();
    }

    /**
     * @param newX the new left column
     * @param newY the new top row
     * @return a region of the same size at the given origin
     */
    public Region withOrigin(int newX, int newY) {
        return new Region(newX, newY, width, height);
    }
}
