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

import com.stratadb.StoreConfiguration;
import com.stratadb.engine.TablePath;
import com.stratadb.exception.DictionaryBuildException;
import com.stratadb.exception.ErrorCode;
import com.stratadb.schema.ColumnDefinition;
import com.stratadb.schema.Encoding;
import com.stratadb.schema.TableSchema;
import com.stratadb.schema.Type;
import com.stratadb.utility.FileUtils;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

class DictionaryStoreTest {
  private static final String          TEST_PATH = "target/databases/DictionaryStoreTest";
  private              TablePath       tablePath;
  private              DictionaryStore store;

  @BeforeEach
  void setUp() {
    FileUtils.deleteRecursively(new File(TEST_PATH));
    tablePath = new TablePath(Path.of(TEST_PATH));
    store = new DictionaryStore(tablePath, StoreConfiguration.fromGlobal());
  }

  @AfterEach
  void tearDown() {
    FileUtils.deleteRecursively(new File(TEST_PATH));
  }

  @Test
  void firstLoadAssignsKeysInFirstSeenOrder() {
    final DictionaryAppendResult result = store.appendDistinctValues("country", List.of("@NU#LL$!", "US", "US", "FR"));

    assertThat(result.getAssignment()).containsExactly(//
        entry("@NU#LL$!", 1),//
        entry("US", 2),//
        entry("FR", 3));
    assertThat(result.getAddedValues()).containsExactly("@NU#LL$!", "US", "FR");
    assertThat(result.getCardinality()).isEqualTo(3);
    assertThat(result.getSortIndex().getSortOrder()).containsExactly(0, 2, 1);
    assertThat(result.getSortIndex().getInverseSortOrder()).containsExactly(0, 2, 1);

    final ColumnDictionary dictionary = store.getDictionary("country");
    assertThat(dictionary.getValues()).containsExactly("@NU#LL$!", "US", "FR");
    assertThat(dictionary.getSurrogateKey("FR")).isEqualTo(3);
    assertThat(dictionary.getSurrogateKey("DE")).isEqualTo(ColumnDictionary.NOT_ENCODED);
  }

  @Test
  void keysAreStableAcrossLoads() {
    store.appendDistinctValues("country", List.of("@NU#LL$!", "US", "FR"));

    final DictionaryStore reopened = new DictionaryStore(tablePath, StoreConfiguration.fromGlobal());
    final DictionaryAppendResult second = reopened.appendDistinctValues("country", List.of("@NU#LL$!", "DE", "US", "AT"));

    assertThat(second.getSurrogateKey("@NU#LL$!")).isEqualTo(1);
    assertThat(second.getSurrogateKey("US")).isEqualTo(2);
    assertThat(second.getSurrogateKey("DE")).isEqualTo(4);
    assertThat(second.getSurrogateKey("AT")).isEqualTo(5);
    assertThat(second.getAddedValues()).containsExactly("DE", "AT");

    final List<String> values = reopened.getDictionary("country").getValues();
    assertThat(values).containsExactly("@NU#LL$!", "US", "FR", "DE", "AT");
    assertThat(values.stream().filter("@NU#LL$!"::equals).count()).isEqualTo(1);

    // @NU#LL$!, AT, DE, FR, US
    assertThat(second.getSortIndex().getSortOrder()).containsExactly(0, 4, 3, 2, 1);
    assertThat(reopened.readSortIndex("country")).isEqualTo(second.getSortIndex());
  }

  @Test
  void nothingNewKeepsTheDictionaryUnchanged() throws Exception {
    store.appendDistinctValues("country", List.of("US", "FR"));
    final long size = Files.size(tablePath.getDictionaryFile("country"));

    final DictionaryAppendResult result = store.appendDistinctValues("country", List.of("FR", "US", "FR"));

    assertThat(result.getAddedValues()).isEmpty();
    assertThat(result.getAssignment()).containsKeys("FR", "US");
    assertThat(Files.size(tablePath.getDictionaryFile("country"))).isEqualTo(size);
  }

  @Test
  void numericColumnsSortByValue() {
    final TableSchema schema = TableSchema.builder("t").addDimension("id", Type.INTEGER, Encoding.DICTIONARY).build();
    final ColumnDefinition id = schema.getColumn("id");

    final DictionaryAppendResult result = store.appendDistinctValues(id, List.of("@NU#LL$!", "10", "9", "-1", "100"));

    // -1, 9, 10, 100, then the non numeric default member
    assertThat(result.getSortIndex().getSortOrder()).containsExactly(3, 2, 1, 4, 0);
  }

  @Test
  void emptyColumn() {
    assertThat(store.getDictionary("missing").size()).isZero();
    assertThat(store.readSortIndex("missing")).isSameAs(SortIndex.EMPTY);
  }

  @Test
  void staleSortIndexIsDetectedAndRebuilt() throws Exception {
    final TableSchema schema = TableSchema.builder("t").addDimension("country", Type.STRING, Encoding.DICTIONARY).build();
    final ColumnDefinition country = schema.getColumn("country");

    store.appendDistinctValues(country, List.of("B", "A"));
    final byte[] oldIndex = Files.readAllBytes(tablePath.getSortIndexFile(country.getId()));
    store.appendDistinctValues(country, List.of("C"));

    // SIMULATE A CRASH BETWEEN THE DICTIONARY COMMIT AND THE SORT INDEX REPLACE
    Files.write(tablePath.getSortIndexFile(country.getId()), oldIndex);

    assertThatThrownBy(() -> store.readSortIndex(country.getId())).isInstanceOf(DictionaryBuildException.class)
        .extracting(e -> ((DictionaryBuildException) e).getErrorCode()).isEqualTo(ErrorCode.CORRUPTION_DETECTED);

    final SortIndex rebuilt = store.rebuildSortIndex(country);
    assertThat(rebuilt.getSortOrder()).containsExactly(1, 0, 2);
    assertThat(store.readSortIndex(country.getId())).isEqualTo(rebuilt);
  }

  @Test
  void missingSortIndexOfNonEmptyDictionary() throws Exception {
    store.appendDistinctValues("country", List.of("US"));
    Files.delete(tablePath.getSortIndexFile("country"));

    assertThatThrownBy(() -> store.readSortIndex("country")).isInstanceOf(DictionaryBuildException.class)
        .hasMessageContaining("missing");
  }

  @Test
  void nullCandidateIsRejected() {
    assertThatThrownBy(() -> store.appendDistinctValues("country", Arrays.asList("US", null))).isInstanceOf(
        IllegalArgumentException.class);
    assertThat(store.getDictionary("country").size()).isZero();
  }
}
