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
import com.stratadb.schema.ColumnDefinition;
import com.stratadb.schema.Encoding;
import com.stratadb.schema.TableSchema;
import com.stratadb.schema.Type;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class DictionaryBuilderTest {
  private final StoreConfiguration configuration = StoreConfiguration.fromGlobal();

  private final TableSchema schema = TableSchema.builder("orders")
      .addDimension("id", Type.INTEGER, Encoding.DICTIONARY)
      .addDimension("country", Type.STRING, Encoding.DICTIONARY)
      .addDimension("city", Type.STRING)
      .addMeasure("amount", Type.DOUBLE)
      .build();

  @Test
  void defaultMemberPrecedesTheFirstValue() {
    final DictionaryBuilder builder = new DictionaryBuilder(schema, configuration);
    final Map<ColumnDefinition, List<String>> candidates = builder.build(Arrays.asList(//
        new String[] { "1", "US", "NYC", "10.5" },//
        new String[] { "2", "US", "LA", "3" },//
        new String[] { "3", "FR", "Paris", "7" }).iterator());

    assertThat(builder.getRowCount()).isEqualTo(3);
    assertThat(candidates.keySet()).containsExactly(schema.getColumn("id"), schema.getColumn("country"));
    assertThat(candidates.get(schema.getColumn("id"))).containsExactly("@NU#LL$!", "1", "2", "3");
    assertThat(candidates.get(schema.getColumn("country"))).containsExactly("@NU#LL$!", "US", "US", "FR");
  }

  @Test
  void noRowsNoCandidates() {
    final DictionaryBuilder builder = new DictionaryBuilder(schema, configuration);
    final Map<ColumnDefinition, List<String>> candidates = builder.build(List.<String[]>of().iterator());

    assertThat(builder.getRowCount()).isZero();
    assertThat(candidates.get(schema.getColumn("id"))).isEmpty();
    assertThat(candidates.get(schema.getColumn("country"))).isEmpty();
  }

  @Test
  void shortAndNullFieldsUseTheNullFormat() {
    final DictionaryBuilder builder = new DictionaryBuilder(schema, configuration);
    builder.accept(new String[] { "1" });
    builder.accept(new String[] { "2", null, "Rome" });
    builder.accept(new String[] { "3" , "IT"});
    builder.accept(null);

    assertThat(builder.getCandidates().get(schema.getColumn("id"))).containsExactly("@NU#LL$!", "\\N", "2", "3", "\\N");
    assertThat(builder.getCandidates().get(schema.getColumn("country"))).containsExactly("@NU#LL$!", "\\N", "\\N", "IT", "\\N");
  }

  @Test
  void singleColumnTableKeepsItsOnlyField() {
    final TableSchema single = TableSchema.builder("tags").addDimension("tag", Type.STRING, Encoding.DICTIONARY).build();
    final DictionaryBuilder builder = new DictionaryBuilder(single, configuration);
    builder.accept(new String[] { "red" });

    assertThat(builder.getCandidates().get(single.getColumn("tag"))).containsExactly("@NU#LL$!", "red");
  }

  @Test
  void directDictionaryHasNoDefaultMember() {
    final TableSchema withDate = TableSchema.builder("events")
        .addDimension("day", Type.DATE, Encoding.DICTIONARY, Encoding.DIRECT_DICTIONARY)
        .addDimension("kind", Type.STRING, Encoding.DICTIONARY)
        .build();

    final DictionaryBuilder builder = new DictionaryBuilder(withDate, configuration);
    builder.accept(new String[] { "2024-01-01", "click" });

    assertThat(builder.getCandidates().get(withDate.getColumn("day"))).containsExactly("2024-01-01");
    assertThat(builder.getCandidates().get(withDate.getColumn("kind"))).containsExactly("@NU#LL$!", "click");
  }

  @Test
  void customTokens() {
    final StoreConfiguration custom = new StoreConfiguration(null, "<default>", "NULL", configuration.getCharset());
    final DictionaryBuilder builder = new DictionaryBuilder(schema, custom);
    builder.accept(new String[] { "5" });

    assertThat(builder.getCandidates().get(schema.getColumn("id"))).containsExactly("<default>", "NULL");
  }
}
