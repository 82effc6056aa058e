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
package com.stratadb.importer;

import com.stratadb.utility.FileUtils;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.File;
import java.io.FilterReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CSVRowSourceTest {
  private static final String TEST_PATH = "target/databases/CSVRowSourceTest";

  @BeforeEach
  void setUp() {
    FileUtils.deleteRecursively(new File(TEST_PATH));
  }

  @AfterEach
  void tearDown() {
    FileUtils.deleteRecursively(new File(TEST_PATH));
  }

  @Test
  void csvWithHeader() throws Exception {
    final Path file = Path.of(TEST_PATH, "orders.csv");
    Files.createDirectories(file.getParent());
    Files.writeString(file, "id,country,city\n1,US,\"New York, NY\"\n2,,LA\n3,FR\n");

    try (final CSVRowSource source = CSVRowSource.open(file, StandardCharsets.UTF_8, null, null, null)) {
      final List<String[]> rows = drain(source);
      assertThat(rows).hasSize(3);
      assertThat(rows.get(0)).containsExactly("1", "US", "New York, NY");
      assertThat(rows.get(1)).containsExactly("2", null, "LA");
      assertThat(rows.get(2)).containsExactly("3", "FR");
      assertThat(source.getRowCount()).isEqualTo(3);
      assertThatThrownBy(source::next).isInstanceOf(NoSuchElementException.class);
    }
  }

  @Test
  void tabDelimited() throws Exception {
    try (final CSVRowSource source = new CSVRowSource(new StringReader("a\tb\r\nc\td\r\n"), "\\t", 0)) {
      final List<String[]> rows = drain(source);
      assertThat(rows).hasSize(2);
      assertThat(rows.get(1)).containsExactly("c", "d");
    }
  }

  @Test
  void customDelimiterAndSkip() throws Exception {
    try (final CSVRowSource source = new CSVRowSource(new StringReader("title\nheader\n1;US\n"), ";", 2)) {
      final List<String[]> rows = drain(source);
      assertThat(rows).hasSize(1);
      assertThat(rows.get(0)).containsExactly("1", "US");
    }
  }

  @Test
  void skipEntriesOverridesHeader() throws Exception {
    final Path file = Path.of(TEST_PATH, "noheader.csv");
    Files.createDirectories(file.getParent());
    Files.writeString(file, "1,US\n2,FR\n");

    try (final CSVRowSource source = CSVRowSource.open(file, StandardCharsets.UTF_8, ",", true, 0L)) {
      assertThat(drain(source)).hasSize(2);
    }
    try (final CSVRowSource source = CSVRowSource.open(file, StandardCharsets.UTF_8, ",", false, null)) {
      assertThat(drain(source)).hasSize(2);
    }
  }

  @Test
  void emptySource() throws Exception {
    try (final CSVRowSource source = new CSVRowSource(new StringReader(""), ",", 1)) {
      assertThat(source.hasNext()).isFalse();
    }
  }

  @Test
  void malformedSourceClosesTheReader() {
    final TrackingReader reader = new TrackingReader(new StringReader("id,name\n1,\"" + "x".repeat(10_000) + "\n"));

    assertThatThrownBy(() -> new CSVRowSource(reader, ",", 1)).isInstanceOf(RuntimeException.class);
    assertThat(reader.closed).isTrue();
  }

  @Test
  void unreadableSourceClosesTheReader() {
    final TrackingReader reader = new TrackingReader(new StringReader("")) {
      @Override
      public int read(final char[] buffer, final int offset, final int length) throws IOException {
        throw new IOException("Device not ready");
      }
    };

    assertThatThrownBy(() -> new CSVRowSource(reader, ",", 0)).isInstanceOf(RuntimeException.class);
    assertThat(reader.closed).isTrue();
  }

  private static class TrackingReader extends FilterReader {
    private boolean closed;

    TrackingReader(final Reader in) {
      super(in);
    }

    @Override
    public void close() throws IOException {
      closed = true;
      super.close();
    }
  }

  private static List<String[]> drain(final CSVRowSource source) {
    final List<String[]> rows = new ArrayList<>();
    while (source.hasNext())
      rows.add(source.next());
    return rows;
  }
}
