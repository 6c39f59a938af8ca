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

/**
 * World coordinate transform of an image. Implemented outside this library.
 */
public interface WcsProjection {

    /**
     * @param x pixel column
     * @param y pixel row
     * @return right ascension and declination, in radians
     */
    double[] pixelToWorld(double x, double y);

    /**
     * @param ra right ascension, in radians
     * @param dec declination, in radians
     * @return pixel column and row
     */
    double[] worldToPixel(double ra, double dec);
}
