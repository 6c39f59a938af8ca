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

/**
 * {@link MetadataRecord} holding the value text of a FITS card.
 */
record TextRecord(String name, String value) implements MetadataRecord {

    TextRecord {
        requireNonNull(name, "name");
        requireNonNull(value, "value");
    }

    @Override
    public long longValue() {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("%s is not an integer: '%s'".formatted(name, value), e);
        }
    }

    @Override
    public double doubleValue() {
        try {
            // FITS allows Fortran style exponents
            return Double.parseDouble(value.trim().replace('D', 'E').replace('d', 'e'));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("%s is not a number: '%s'".formatted(name, value), e);
        }
    }

    @Override
    public String stringValue() {
        String s = value.trim();
        if (s.length() >= 2 && s.startsWith("'") && s.endsWith("'")) {
            s = s.substring(1, s.length() - 1).replace("''", "'");
        }
        return s.stripTrailing();
    }

    @Override
    public boolean booleanValue() {
        String s = value.trim();
        if ("T".equals(s)) {
            return true;
        }
        if ("F".equals(s)) {
            return false;
        }
        throw new IllegalArgumentException("%s is not a logical: '%s'".formatted(name, value));
    }

    @Override
    public String toString() {
        return name + ":" + value;
    }
}
