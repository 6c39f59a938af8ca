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

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Keyword to record map of an image header, in header order.
 * <p>
 * Filled once by whoever parses the header and read concurrently afterwards; mutation is not
 * synchronized.
 */
public class HeaderTable {

    private final Map<String, MetadataRecord> records = new LinkedHashMap<>();

    /**
     * Creates an empty table.
     */
    public HeaderTable() {
        // empty
    }

    /**
     * Adds or replaces a record.
     *
     * @param record the record
     * @return this table
     */
    public HeaderTable put(MetadataRecord record) {
        requireNonNull(record, "record");
        records.put(record.name(), record);
        return this;
    }

    /**
     * Adds or replaces a record from its raw value text.
     *
     * @param name the keyword
     * @param value the raw value text
     * @return this table
     */
    public HeaderTable put(String name, String value) {
        return put(MetadataRecord.of(name, value));
    }

    /**
     * @param name the keyword
     * @return the record, or empty if absent
     */
    public Optional<MetadataRecord> get(String name) {
        return Optional.ofNullable(records.get(name));
    }

    /**
     * @param name the keyword
     * @return the record
     * @throws IllegalArgumentException if the keyword is absent
     */
    public MetadataRecord require(String name) {
        MetadataRecord record = records.get(name);
        if (record == null) {
            throw new IllegalArgumentException("Missing header keyword " + name);
        }
        return record;
    }

    /**
     * @param names keywords
     * @return {@code true} if every keyword is present
     */
    public boolean containsAll(String... names) {
        for (String name : names) {
            if (!records.containsKey(name)) {
                return false;
            }
        }
        return true;
    }

    /**
     * @return the number of records
     */
    public int size() {
        return records.size();
    }

    /**
     * @return an unmodifiable view of the records in header order
     */
    public Collection<MetadataRecord> records() {
        return Collections.unmodifiableCollection(records.values());
    }

    @Override
    public String toString() {
        return "HeaderTable" + records.values();
    }
}
