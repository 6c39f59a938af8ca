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

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.skytile.lock.LockHolder;
import io.skytile.lock.Region;
import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;

/**
 * A two-dimensional image whose pixels are accessed through region locks.
 * <p>
 * Workers call {@link #lockData(Region, boolean, boolean) lockData} to obtain an {@link ImageData} for a
 * rectangle, process it, and hand it back with {@link #exitLock(ImageData) exitLock}, which writes the
 * pixels back when the lock was writable. {@link #switchLockData(ImageData, int, int, boolean, boolean)
 * switchLockData} moves a buffer to another rectangle of the same size without reallocating it.
 * <p>
 * The variants without a {@link LockHolder} act on behalf of the calling thread.
 *
 * <pre>{@code
 * ImageData tile = image.lockData(Region.of(0, 0, 256, 256), false, false);
 * try {
 *     process(tile.getData());
 * } finally {
 *     image.exitLock(tile);
 * }
 * }</pre>
 */
public abstract class Image {

    private final int imageNumber;
    private final int width;
    private final int height;
    private final WcsProjection transform;
    private final HeaderTable header;
    private final ImageConfig config;

    private final Cache<Class<? extends ImageProperties>, ImageProperties> properties =
            Caffeine.newBuilder().build();

    /**
     * @param imageNumber index of the image in its container, 0 for the primary image
     * @param width number of columns
     * @param height number of rows
     * @param transform the world coordinate transform, may be {@code null}
     * @param header the image header
     * @param config access settings
     */
    protected Image(
            int imageNumber, int width, int height, WcsProjection transform, HeaderTable header, ImageConfig config) {
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("Image size can't be negative: %dx%d".formatted(width, height));
        }
        this.imageNumber = imageNumber;
        this.width = width;
        this.height = height;
        this.transform = transform;
        this.header = requireNonNull(header, "header");
        this.config = requireNonNull(config, "config");
    }

    public int getImageNumber() {
        return imageNumber;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    /**
     * @return the image extent, anchored at the origin
     */
    public Region getBounds() {
        return Region.of(0, 0, width, height);
    }

    public WcsProjection getTransform() {
        return transform;
    }

    public HeaderTable getHeader() {
        return header;
    }

    public ImageConfig getConfig() {
        return config;
    }

    /**
     * Returns the properties of the given type, creating them on first use.
     * <p>
     * {@code type} must have a public constructor taking a single argument this image is an instance of.
     * Each type is created at most once per image.
     *
     * @param <T> the properties type
     * @param type the properties class
     * @return the cached instance
     * @throws IllegalArgumentException if {@code type} has no suitable constructor, or its constructor
     *         rejects the image metadata
     */
    public <T extends ImageProperties> T getProperty(Class<T> type) {
        requireNonNull(type, "type");
        return type.cast(properties.get(type, this::createProperty));
    }

    private ImageProperties createProperty(Class<? extends ImageProperties> type) {
        for (Constructor<?> constructor : type.getConstructors()) {
            Class<?>[] params = constructor.getParameterTypes();
            if (params.length == 1 && params[0].isInstance(this)) {
                try {
                    return (ImageProperties) constructor.newInstance(this);
                } catch (InvocationTargetException e) {
                    if (e.getCause() instanceof RuntimeException re) {
                        throw re;
                    }
                    throw new IllegalStateException("Unable to create " + type.getName(), e.getCause());
                } catch (ReflectiveOperationException e) {
                    throw new IllegalStateException("Unable to create " + type.getName(), e);
                }
            }
        }
        throw new IllegalArgumentException(type.getName() + " has no public constructor accepting " + getClass());
    }

    /**
     * Same as {@link #lockData(Region, boolean, boolean)} with read-only access.
     *
     * @param area the region to lock
     * @param fillZero whether parts of {@code area} outside the image read as 0
     * @return the locked pixels
     */
    public ImageData lockData(Region area, boolean fillZero) {
        return lockData(area, fillZero, true);
    }

    /**
     * Locks a region on behalf of the calling thread.
     *
     * @param area the region to lock
     * @param fillZero whether parts of {@code area} outside the image read as 0
     * @param readOnly whether the pixels are only read
     * @return the locked pixels
     * @see #lockData(LockHolder, Region, boolean, boolean)
     */
    public ImageData lockData(Region area, boolean fillZero, boolean readOnly) {
        return lockData(LockHolder.currentThread(), area, fillZero, readOnly);
    }

    /**
     * Locks a region and reads its pixels. Blocks while a conflicting lock is held.
     *
     * @param holder who will own the lock
     * @param area the region to lock
     * @param fillZero whether parts of {@code area} outside the image read as 0; requires read-only access
     * @param readOnly whether the pixels are only read
     * @return the locked pixels
     * @throws IllegalArgumentException if {@code fillZero} is requested for writing, or {@code area} leaves
     *         the image and {@code fillZero} is not set; no lock is taken
     * @throws io.skytile.lock.RecursiveLockException if {@code holder} already holds a lock on this image
     * @throws java.io.UncheckedIOException if the pixels cannot be read; the lock is released
     */
    public abstract ImageData lockData(LockHolder holder, Region area, boolean fillZero, boolean readOnly);

    /**
     * Same as {@link #switchLockData(ImageData, int, int, boolean, boolean)} with read-only access.
     *
     * @param data the data to move
     * @param newX new left column
     * @param newY new top row
     * @param fillZero whether parts of the new region outside the image read as 0
     * @return {@code data}, now covering the new region
     */
    public ImageData switchLockData(ImageData data, int newX, int newY, boolean fillZero) {
        return switchLockData(data, newX, newY, fillZero, true);
    }

    /**
     * Moves a lock on behalf of the calling thread.
     *
     * @param data the data to move
     * @param newX new left column
     * @param newY new top row
     * @param fillZero whether parts of the new region outside the image read as 0
     * @param readOnly whether the new region is only read
     * @return {@code data}, now covering the new region
     * @see #switchLockData(LockHolder, ImageData, int, int, boolean, boolean)
     */
    public ImageData switchLockData(ImageData data, int newX, int newY, boolean fillZero, boolean readOnly) {
        return switchLockData(LockHolder.currentThread(), data, newX, newY, fillZero, readOnly);
    }

    /**
     * Releases the lock behind {@code data}, writing its pixels back first if it was writable, then locks
     * the same-sized region at {@code (newX, newY)} and reads it into the same buffer.
     * <p>
     * The move is not atomic: another holder may lock either region between the release and the new
     * grant.
     *
     * @param releaser who is moving the lock; must own it
     * @param data the data to move
     * @param newX new left column
     * @param newY new top row
     * @param fillZero whether parts of the new region outside the image read as 0
     * @param readOnly whether the new region is only read
     * @return {@code data}, now covering the new region
     * @throws io.skytile.lock.UnknownLockTokenException if {@code data} was already released
     * @throws io.skytile.lock.NotLockOwnerException if {@code releaser} does not own the lock
     */
    public abstract ImageData switchLockData(
            LockHolder releaser, ImageData data, int newX, int newY, boolean fillZero, boolean readOnly);

    /**
     * Releases a lock on behalf of the calling thread.
     *
     * @param data the data to release
     * @see #exitLock(LockHolder, ImageData)
     */
    public void exitLock(ImageData data) {
        exitLock(LockHolder.currentThread(), data);
    }

    /**
     * Writes the pixels back if the lock was writable, then releases the lock. The lock is released even
     * when the write fails.
     *
     * @param releaser who is releasing; must own the lock
     * @param data the data to release
     * @throws io.skytile.lock.UnknownLockTokenException if {@code data} was already released
     * @throws io.skytile.lock.NotLockOwnerException if {@code releaser} does not own the lock; nothing is
     *         written
     * @throws java.io.UncheckedIOException if the pixels cannot be written
     */
    public abstract void exitLock(LockHolder releaser, ImageData data);

    /**
     * Releases the lock behind {@code data} whoever owns it, without writing the pixels back.
     *
     * @param data the data whose lock to drop
     * @throws io.skytile.lock.UnknownLockTokenException if {@code data} was already released
     */
    public abstract void forceExitLock(ImageData data);

    @Override
    public String toString() {
        return "%s[#%d %dx%d]".formatted(getClass().getSimpleName(), imageNumber, width, height);
    }
}
