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

import io.skytile.lock.LockHolder;
import io.skytile.lock.LockToken;
import io.skytile.lock.Region;

/**
 * The pixels of a locked region of an {@link Image}.
 * <p>
 * {@link #getData()} is indexed {@code [row][column]} relative to {@link #getPosition()}: cell
 * {@code [i][j]} is image pixel {@code (x + j, y + i)}. The buffer keeps its identity for the life of
 * the object, also across {@link Image#switchLockData(ImageData, int, int, boolean) switches}, so callers
 * may hold on to the array.
 * <p>
 * Not thread-safe: an instance belongs to the holder of its lock.
 */
public final class ImageData {

    private final Image parent;
    private final LockHolder holder;
    private final double[][] data;
    private Region position;
    private boolean readOnly;
    private LockToken token;
    private boolean released;

    ImageData(Image parent, LockHolder holder, Region position, boolean readOnly, LockToken token) {
        this.parent = requireNonNull(parent, "parent");
        this.holder = requireNonNull(holder, "holder");
        this.position = requireNonNull(position, "position");
        this.readOnly = readOnly;
        this.token = requireNonNull(token, "token");
        this.data = new double[position.height()][position.width()];
    }

    /**
     * @return the locked region, in image coordinates
     */
    public Region getPosition() {
        return position;
    }

    /**
     * @return the pixel buffer, {@code [row][column]}
     */
    public double[][] getData() {
        return data;
    }

    /**
     * @return the image this data was locked on
     */
    public Image getParent() {
        return parent;
    }

    /**
     * @return {@code true} if the pixels are not written back on release
     */
    public boolean isReadOnly() {
        return readOnly;
    }

    /**
     * @return who owns the lock behind this data
     */
    public LockHolder getHolder() {
        return holder;
    }

    /**
     * @return the token of the lock currently behind this data
     */
    public LockToken getToken() {
        return token;
    }

    /**
     * @return {@code true} once the lock has been released
     */
    public boolean isReleased() {
        return released;
    }

    /**
     * @param x image column
     * @param y image row
     * @return the buffered value of pixel {@code (x, y)}
     * @throws IndexOutOfBoundsException if the pixel is outside {@link #getPosition()}
     */
    public double get(int x, int y) {
        return data[y - position.y()][x - position.x()];
    }

    /**
     * @param x image column
     * @param y image row
     * @param value the new buffered value of pixel {@code (x, y)}
     * @throws IndexOutOfBoundsException if the pixel is outside {@link #getPosition()}
     */
    public void set(int x, int y, double value) {
        data[y - position.y()][x - position.x()] = value;
    }

    void relock(Region newPosition, boolean newReadOnly, LockToken newToken) {
        this.position = newPosition;
        this.readOnly = newReadOnly;
        this.token = newToken;
        this.released = false;
    }

    void markReleased() {
        this.released = true;
    }

    @Override
    public String toString() {
        return "ImageData[%s, %s, %s%s]"
                .formatted(position, readOnly ? "read" : "write", holder, released ? ", released" : "");
    }
}
