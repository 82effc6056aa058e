/*
 * Copyright © 2021-present Arcade Data Ltd (info@arcadedata.com)
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * SPDX-FileCopyrightText: 2021-present Arcade Data Ltd (info@arcadedata.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.stratadb.engine.dictionary;

import com.stratadb.exception.DictionaryBuildException;
import com.stratadb.exception.ErrorCode;
import com.stratadb.schema.Type;
import com.stratadb.utility.FileUtils;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.File;
import java.nio.ByteBuffer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SortIndexFileTest {
  private static final String TEST_PATH = "target/databases/SortIndexFileTest";
  private              Path   file;

  @BeforeEach
  void setUp() {
    FileUtils.deleteRecursively(new File(TEST_PATH));
    file = Path.of(TEST_PATH, "col.sortindex");
  }

  @AfterEach
  void tearDown() {
    FileUtils.deleteRecursively(new File(TEST_PATH));
  }

  @Test
  void layout() throws Exception {
    final SortIndex index = SortIndex.compute(List.of("b", "c", "a"), Type.STRING);
    SortIndexFile.write(file, index);

    final byte[] data = Files.readAllBytes(file);
    assertThat(data).hasSize(SortIndexFile.HEADER_SIZE + 3 * 8 + 8);

    final ByteBuffer buffer = ByteBuffer.wrap(data);
    assertThat(buffer.getInt()).isEqualTo(SortIndexFile.MAGIC_VALUE);
    assertThat(buffer.getInt()).isEqualTo(SortIndexFile.CURRENT_VERSION);
    assertThat(buffer.getInt()).isEqualTo(3);
    assertThat(new int[] { buffer.getInt(), buffer.getInt(), buffer.getInt() }).containsExactly(2, 0, 1);

    assertThat(SortIndexFile.read(file)).isEqualTo(index);
  }

  @Test
  void flippedByteFailsTheChecksum() throws Exception {
    SortIndexFile.write(file, SortIndex.compute(List.of("b", "c", "a", "d"), Type.STRING));

    final byte[] data = Files.readAllBytes(file);
    data[SortIndexFile.HEADER_SIZE + 5] ^= 0x01;
    Files.write(file, data);

    assertThatThrownBy(() -> SortIndexFile.read(file)).isInstanceOf(DictionaryBuildException.class)
        .hasMessageContaining("checksum")
        .extracting(e -> ((DictionaryBuildException) e).getErrorCode()).isEqualTo(ErrorCode.CORRUPTION_DETECTED);
  }

  @Test
  void truncatedFile() throws Exception {
    SortIndexFile.write(file, SortIndex.compute(List.of("b", "a"), Type.STRING));
    final byte[] data = Files.readAllBytes(file);

    Files.write(file, Arrays.copyOf(data, data.length - 3));
    assertThatThrownBy(() -> SortIndexFile.read(file)).isInstanceOf(DictionaryBuildException.class);

    Files.write(file, Arrays.copyOf(data, 6));
    assertThatThrownBy(() -> SortIndexFile.read(file)).isInstanceOf(DictionaryBuildException.class)
        .hasMessageContaining("truncated");
  }

  @Test
  void wrongMagic() throws Exception {
    SortIndexFile.write(file, SortIndex.EMPTY);
    final byte[] data = Files.readAllBytes(file);
    data[0] = 0;
    Files.write(file, data);

    assertThatThrownBy(() -> SortIndexFile.read(file)).isInstanceOf(DictionaryBuildException.class).hasMessageContaining("magic");
  }

  @Test
  void empty() throws Exception {
    SortIndexFile.write(file, SortIndex.EMPTY);
    assertThat(SortIndexFile.read(file).size()).isZero();
  }
}
