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
 * One keyword of an image header.
 * <p>
 * Header parsing happens outside this library; parsers hand their records over through this interface.
 * The typed accessors interpret {@link #value()} and throw {@link IllegalArgumentException} when it
 * cannot be read as the requested type.
 */
public interface MetadataRecord {

    /**
     * @return the keyword name, e.g. {@code NAXIS1}
     */
    String name();

    /**
     * @return the raw value text as found in the header
     */
    String value();

    /**
     * @return the value as a 64-bit integer
     */
    long longValue();

    /**
     * @return the value as a 32-bit integer
     */
    default int intValue() {
        long v = longValue();
        if (v < Integer.MIN_VALUE || v > Integer.MAX_VALUE) {
            throw new IllegalArgumentException(name() + " does not fit an int: " + v);
        }
        return (int) v;
    }

    /**
     * @return the value as a floating point number
     */
    double doubleValue();

    /**
     * @return the value as a string, without FITS quotes or trailing blanks
     */
    String stringValue();

    /**
     * @return the value as a FITS logical ({@code T} or {@code F})
     */
    boolean booleanValue();

    /**
     * Creates a record from a keyword and its raw value text.
     *
     * @param name the keyword
     * @param value the raw value text
     * @return a new record
     */
    static MetadataRecord of(String name, String value) {
        return new TextRecord(name, value);
    }
}
