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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class RegionTest {

    @Test
    void negativeSizeIsRejected() {
        assertThatThrownBy(() -> Region.of(0, 0, -1, 4))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("width can't be < 0");
        assertThatThrownBy(() -> Region.of(0, 0, 4, -1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("height can't be < 0");
    }

    @Test
    void intersects_requiresSharedPixel() {
        Region a = Region.of(0, 0, 10, 10);

        assertThat(a.intersects(Region.of(9, 9, 5, 5))).isTrue();
        assertThat(a.intersects(Region.of(10, 0, 5, 5))).isFalse();
        assertThat(a.intersects(Region.of(0, 10, 5, 5))).isFalse();
        assertThat(a.intersects(Region.of(-5, -5, 6, 6))).isTrue();
        assertThat(a.intersects(Region.of(2, 2, 0, 5))).isFalse();
    }

    @Test
    void intersection() {
        Region image = Region.of(0, 0, 100, 50);

        assertThat(image.intersection(Region.of(-4, 40, 20, 20))).contains(Region.of(0, 40, 16, 10));
        assertThat(image.intersection(Region.of(100, 0, 5, 5))).isEmpty();
    }

    @Test
    void contains() {
        Region image = Region.of(0, 0, 100, 50);

        assertThat(image.contains(Region.of(0, 0, 100, 50))).isTrue();
        assertThat(image.contains(Region.of(90, 40, 10, 10))).isTrue();
        assertThat(image.contains(Region.of(90, 40, 11, 10))).isFalse();
        assertThat(image.contains(Region.of(-1, 0, 5, 5))).isFalse();
    }

    @Test
    void withOriginKeepsSize() {
        Region moved = Region.of(1, 2, 30, 40).withOrigin(-7, 8);

        assertThat(moved).isEqualTo(Region.of(-7, 8, 30, 40));
        assertThat(moved.right()).isEqualTo(23);
        assertThat(moved.bottom()).isEqualTo(48);
    }
}
