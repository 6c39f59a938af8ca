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

import io.skytile.lock.RegionLock;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Settings shared by the images of a pipeline run.
 * <p>
 * Values of known parameters are converted and validated when set, so a {@link Properties} file with a
 * bad value fails when loaded. Values of other keys are kept as given.
 *
 * <pre>{@code
 * Properties props = new Properties();
 * props.load(reader);
 * ImageConfig config = ImageConfig.fromProperties(props);
 * boolean scaled = config.get(ImageConfig.SWARP_SCALING);
 * }</pre>
 */
public class ImageConfig {

    /** Prefix shared by all keys of this config. */
    public static final String PREFIX = "io.skytile.image.";

    /**
     * How the region lock of each image records granted modes. {@code SYMMETRIC} applies the
     * readers-writer rule both ways, {@code LEGACY_READ_RECORDING} records every granted lock as a read.
     */
    public static final ImageParameter<RegionLock.Policy> LOCK_POLICY = ImageParameter.builder()
            .key(PREFIX + "lock-policy")
            .type(RegionLock.Policy.class)
            .defaultValue(RegionLock.Policy.SYMMETRIC)
            .options((Object[]) RegionLock.Policy.values())
            .build();

    /** Whether pixels read from images are rewritten as {@code (value - BACKMEAN) * FLXSCALE}. */
    public static final ImageParameter<Boolean> SWARP_SCALING = ImageParameter.builder()
            .key(PREFIX + "swarp-scaling")
            .type(Boolean.class)
            .defaultValue(false)
            .options(true, false)
            .build();

    /**
     * Whether a missing {@code FLXSCALE}, {@code BACKMEAN} or {@code BACKSIG} is an error instead of an
     * identity scaling.
     */
    public static final ImageParameter<Boolean> SWARP_HEADERS_REQUIRED = ImageParameter.builder()
            .key(PREFIX + "swarp-headers-required")
            .type(Boolean.class)
            .defaultValue(false)
            .options(true, false)
            .build();

    /** All parameters understood by this config. */
    public static final List<ImageParameter<?>> PARAMETERS =
            List.of(LOCK_POLICY, SWARP_SCALING, SWARP_HEADERS_REQUIRED);

    private static final Map<String, ImageParameter<?>> BY_KEY = PARAMETERS.stream()
            .collect(Collectors.toUnmodifiableMap(ImageParameter::key, Function.identity()));

    private final Map<String, Object> parameterValues = new HashMap<>();

    /**
     * Creates a config where every parameter takes its default value.
     */
    public ImageConfig() {
        // Default constructor
    }

    /**
     * @return a new config with default values
     */
    public static ImageConfig defaults() {
        return new ImageConfig();
    }

    /**
     * Sets a parameter value by its key.
     * <p>
     * Values of the known {@link #PARAMETERS} are validated and stored converted; values of other keys
     * are stored as given.
     *
     * @param key The key of the parameter.
     * @param value The value of the parameter, {@code null} to restore the default.
     * @return This config for method chaining.
     * @throws IllegalArgumentException if the value is not valid for a known parameter
     */
    public ImageConfig setParameter(String key, Object value) {
        requireNonNull(key, "key");
        if (value == null) {
            parameterValues.remove(key);
            return this;
        }
        ImageParameter<?> param = BY_KEY.get(key);
        parameterValues.put(key, param == null ? value : param.validate(value));
        return this;
    }

    /**
     * @param <T> the type of the parameter value
     * @param param The parameter descriptor.
     * @param value The value of the parameter.
     * @return This config for method chaining.
     */
    public <T> ImageConfig setParameter(ImageParameter<T> param, T value) {
        return setParameter(param.key(), value);
    }

    /**
     * Retrieves the value explicitly set for a parameter.
     *
     * @param <T> The type of the parameter value.
     * @param param The parameter definition.
     * @return the converted value, or empty if not set.
     * @throws IllegalArgumentException if the value cannot be converted to the parameter type.
     */
    public <T> Optional<T> getParameter(ImageParameter<T> param) {
        Object value = parameterValues.get(param.key());
        if (value == null) {
            return Optional.empty();
        }
        return Optional.of(convert(value, param.type()));
    }

    /**
     * @param key The key of the parameter.
     * @return the raw value, or empty if not set.
     */
    public Optional<Object> getParameter(String key) {
        return Optional.ofNullable(parameterValues.get(requireNonNull(key, "key")));
    }

    /**
     * Retrieves the value of a parameter, falling back to its default.
     *
     * @param <T> The type of the parameter value.
     * @param param The parameter definition.
     * @return the value
     * @throws IllegalStateException if the parameter is neither set nor has a default
     */
    public <T> T get(ImageParameter<T> param) {
        return getParameter(param)
                .or(param::defaultValue)
                .orElseThrow(() -> new IllegalStateException("No value for " + param.key()));
    }

    /**
     * Converts an object to a specified target type.
     * Supports conversion to {@code String}, {@code Boolean}, {@code Integer} and enum types.
     *
     * @param <T> The target type.
     * @param value The object to convert.
     * @param type The {@link Class} representing the target type.
     * @return The converted object.
     * @throws IllegalArgumentException if the conversion to the specified type is not supported.
     */
    @SuppressWarnings({"unchecked", "rawtypes"})
    static <T> T convert(Object value, Class<T> type) {
        if (type.isInstance(value)) return type.cast(value);

        Object converted;
        String text = String.valueOf(value).trim();
        if (type.equals(String.class)) {
            converted = text;
        } else if (type.equals(Boolean.class)) {
            converted = Boolean.valueOf(text);
        } else if (type.equals(Integer.class)) {
            converted = Integer.parseInt(text);
        } else if (type.isEnum()) {
            converted = Enum.valueOf((Class) type, text.toUpperCase(Locale.ROOT).replace('-', '_'));
        } else {
            throw new IllegalArgumentException("Unsupported conversion %s to %s"
                    .formatted(value.getClass().getCanonicalName(), type.getCanonicalName()));
        }
        return type.cast(converted);
    }

    /**
     * @return the explicitly set values as {@link Properties}
     */
    public Properties toProperties() {
        Properties properties = new Properties();
        parameterValues.forEach((name, v) -> properties.setProperty(name, String.valueOf(v)));
        return properties;
    }

    /**
     * Creates a config from {@link Properties}. Keys outside {@link #PREFIX} are ignored.
     *
     * @param properties The properties to read.
     * @return A new config.
     * @throws IllegalArgumentException if a known parameter has an invalid value
     */
    public static ImageConfig fromProperties(Properties properties) {
        requireNonNull(properties);
        ImageConfig config = new ImageConfig();
        properties.forEach((k, v) -> {
            String key = String.valueOf(k);
            if (key.startsWith(PREFIX)) {
                config.setParameter(key, v);
            }
        });
        return config;
    }

    @Override
    public String toString() {
        return "ImageConfig" + parameterValues;
    }
}
