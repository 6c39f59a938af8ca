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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;

import io.skytile.storage.MemoryPixelStorage;
import io.skytile.storage.PixelStorage;
import java.io.IOException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class FitsFileTest {

    @Mock
    private PixelStorage storage;

    @Test
    void dataOffsetsAndHeaders() {
        HeaderTable primary = new HeaderTable().put("NAXIS", "0");
        HeaderTable ext = new HeaderTable().put("XTENSION", "'IMAGE   '");

        FitsFile file = FitsFile.builder()
                .storage(MemoryPixelStorage.allocate(16))
                .primary(2880, primary)
                .extension(1, 5760, ext)
                .build();

        assertThat(file.imageCount()).isEqualTo(2);
        assertThat(file.dataOffset(0)).isEqualTo(2880);
        assertThat(file.dataOffset(1)).isEqualTo(5760);
        assertThat(file.header(0)).isSameAs(primary);
        assertThat(file.header(1)).isSameAs(ext);
        assertThat(file.isWritable()).isTrue();
    }

    @Test
    void unknownImageIsRejected() {
        FitsFile file = FitsFile.builder()
                .storage(MemoryPixelStorage.allocate(16))
                .primaryDataOffset(0)
                .build();

        assertThat(file.header(0).size()).isZero();
        assertThatThrownBy(() -> file.dataOffset(2))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("No image 2");
        assertThatThrownBy(() -> file.header(-1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void builderValidation() {
        assertThatThrownBy(() -> FitsFile.builder().primaryDataOffset(0).build())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Storage must be set");
        assertThatThrownBy(() -> FitsFile.builder().storage(storage).build())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Primary data offset must be set");
        assertThatThrownBy(() -> FitsFile.builder().extension(0, 10, new HeaderTable()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> FitsFile.builder().primaryDataOffset(-1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void closeClosesStorage() throws IOException {
        FitsFile file = FitsFile.builder().storage(storage).primaryDataOffset(0).build();

        file.close();

        verify(storage).close();
    }
}
