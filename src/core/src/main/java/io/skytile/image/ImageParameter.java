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

import java.util.List;
import java.util.Optional;

/**
 * A configurable parameter of image access, as held by {@link ImageConfig}.
 *
 * @param <T> the type of the parameter's value
 * @param key the unique key identifying the parameter
 * @param type the type values are converted to when read
 * @param defaultValue the value used when the parameter is not set
 * @param allowedValues the values the parameter accepts, empty to accept any value of {@code type}
 */
public record ImageParameter<T>(String key, Class<T> type, Optional<T> defaultValue, List<T> allowedValues) {

    public ImageParameter {
        requireNonNull(key, "Parameter key cannot be null");
        requireNonNull(type, "Parameter type cannot be null");
        requireNonNull(defaultValue, "Parameter default value optional cannot be null");
        allowedValues = List.copyOf(requireNonNull(allowedValues, "Parameter allowed values cannot be null"));
    }

    /**
     * Converts a raw value to the parameter type and checks it against {@link #allowedValues()}.
     *
     * @param value a value of the parameter type, or its string form
     * @return the converted value
     * @throws IllegalArgumentException if the value cannot be converted or is not allowed
     */
    public T validate(Object value) {
        final T converted;
        try {
            converted = ImageConfig.convert(requireNonNull(value, "value"), type);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid value '%s' for %s".formatted(value, key), e);
        }
        if (!allowedValues.isEmpty() && !allowedValues.contains(converted)) {
            throw new IllegalArgumentException(
                    "Invalid value '%s' for %s, expected one of %s".formatted(value, key, allowedValues));
        }
        return converted;
    }

    /**
     * @return A new {@link Builder} instance.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * A builder class for {@link ImageParameter}.
     */
    public static class Builder {
        String key;

        @SuppressWarnings("rawtypes")
        Class type;

        Optional<Object> defaultValue = Optional.empty();
        List<Object> allowedValues = List.of();

        Builder() {}

        public Builder key(String key) {
            this.key = key;
            return this;
        }

        public Builder type(Class<?> type) {
            this.type = type;
            return this;
        }

        public Builder defaultValue(Object defaultValue) {
            this.defaultValue = Optional.ofNullable(defaultValue);
            return this;
        }

        /**
         * @param values the accepted values; none to accept any value of the parameter type
         * @return This builder instance.
         */
        public Builder options(Object... values) {
            this.allowedValues = values == null || values.length == 0 ? List.of() : List.of(values);
            return this;
        }

        /**
         * @param <T> The type of the parameter value.
         * @return A new {@link ImageParameter}.
         * @throws NullPointerException if key or type is {@code null}.
         */
        @SuppressWarnings("unchecked")
        public <T> ImageParameter<T> build() {
            return new ImageParameter<>(key, type, defaultValue, allowedValues);
        }
    }
}
