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
package com.stratadb.schema;

import com.stratadb.exception.ErrorCode;
import com.stratadb.exception.SchemaException;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TableSchemaTest {

  @Test
  void dimensionsInOrdinalOrder() {
    final ColumnDefinition amount = new ColumnDefinition("c3", "amount", 2, ColumnRole.MEASURE, Type.DOUBLE, null);
    final ColumnDefinition country = new ColumnDefinition("c2", "country", 1, ColumnRole.DIMENSION, Type.STRING,
        EnumSet.of(Encoding.DICTIONARY));
    final ColumnDefinition id = new ColumnDefinition("c1", "id", 0, ColumnRole.DIMENSION, Type.INTEGER, EnumSet.of(Encoding.DICTIONARY));
    final ColumnDefinition city = new ColumnDefinition("c4", "city", 3, ColumnRole.DIMENSION, Type.STRING, null);

    final TableSchema schema = new TableSchema("t1", "sales", "orders", List.of(amount, country, city, id));

    assertThat(schema.getDimensions()).containsExactly(id, country, city);
    assertThat(schema.getMeasures()).containsExactly(amount);
    assertThat(schema.getDictionaryDimensions()).containsExactly(id, country);
    assertThat(schema.getColumn("COUNTRY")).isSameAs(country);
  }

  @Test
  void unknownColumn() {
    final TableSchema schema = TableSchema.builder("orders").addDimension("id", Type.INTEGER, Encoding.DICTIONARY).build();

    assertThatThrownBy(() -> schema.getColumn("missing")).isInstanceOf(SchemaException.class)
        .extracting(e -> ((SchemaException) e).getErrorCode()).isEqualTo(ErrorCode.COLUMN_NOT_FOUND);
  }

  @Test
  void duplicateColumns() {
    assertThatThrownBy(() -> TableSchema.builder("orders")
        .addDimension("id", Type.INTEGER)
        .addDimension("ID", Type.STRING)
        .build()).isInstanceOf(SchemaException.class).hasMessageContaining("duplicate column name");

    final ColumnDefinition a = new ColumnDefinition("a", "a", 0, ColumnRole.DIMENSION, Type.STRING, null);
    final ColumnDefinition b = new ColumnDefinition("b", "b", 0, ColumnRole.DIMENSION, Type.STRING, null);
    assertThatThrownBy(() -> new TableSchema(null, null, "t", List.of(a, b))).isInstanceOf(SchemaException.class)
        .hasMessageContaining("ordinal");
  }

  @Test
  void directDictionaryRules() {
    assertThatThrownBy(() -> new ColumnDefinition("d", "day", 0, ColumnRole.DIMENSION, Type.DATE, EnumSet.of(Encoding.DIRECT_DICTIONARY)))
        .isInstanceOf(SchemaException.class).hasMessageContaining("without DICTIONARY");

    assertThatThrownBy(() -> new ColumnDefinition("d", "name", 0, ColumnRole.DIMENSION, Type.STRING,
        EnumSet.of(Encoding.DICTIONARY, Encoding.DIRECT_DICTIONARY))).isInstanceOf(SchemaException.class)
        .hasMessageContaining("not a date or timestamp");

    final ColumnDefinition day = new ColumnDefinition("d", "day", 0, ColumnRole.DIMENSION, Type.DATE,
        EnumSet.of(Encoding.DICTIONARY, Encoding.DIRECT_DICTIONARY));
    assertThat(day.isDictionaryEncoded()).isTrue();
    assertThat(day.isDirectDictionary()).isTrue();
    assertThat(day.isPlainDictionary()).isFalse();
  }

  @Test
  void invalidColumns() {
    assertThatThrownBy(() -> new ColumnDefinition("x", "x", -1, ColumnRole.DIMENSION, Type.STRING, null)).isInstanceOf(
        SchemaException.class);
    assertThatThrownBy(() -> new ColumnDefinition("x", "price", 0, ColumnRole.MEASURE, Type.DECIMAL, null, 4, 6)).isInstanceOf(
        SchemaException.class);
    assertThatThrownBy(() -> new ColumnDefinition(" ", "x", 0, ColumnRole.DIMENSION, Type.STRING, null)).isInstanceOf(
        SchemaException.class);
  }

  @Test
  void jsonRoundTrip() {
    final TableSchema schema = TableSchema.builder("orders")
        .withDatabase("sales")
        .addDimension("id", Type.INTEGER, Encoding.DICTIONARY)
        .addDimension("country", Type.STRING, Encoding.DICTIONARY, Encoding.INVERTED_INDEX)
        .addDimension("day", Type.DATE, Encoding.DICTIONARY, Encoding.DIRECT_DICTIONARY)
        .addDecimalMeasure("price", 10, 2)
        .build();

    final TableSchema copy = TableSchema.fromJSON(schema.toJSON().toString());

    assertThat(copy.getTableId()).isEqualTo(schema.getTableId());
    assertThat(copy.getDatabaseName()).isEqualTo("sales");
    assertThat(copy.getColumns()).isEqualTo(schema.getColumns());
    assertThat(copy.getColumn("price").getPrecision()).isEqualTo(10);
    assertThat(copy.getColumn("country").getEncodings()).containsExactly(Encoding.DICTIONARY, Encoding.INVERTED_INDEX);
  }

  @Test
  void malformedJSON() {
    assertThatThrownBy(() -> TableSchema.fromJSON("{\"tableName\":\"t\"}")).isInstanceOf(SchemaException.class);
    assertThatThrownBy(() -> TableSchema.fromJSON(
        "{\"tableName\":\"t\",\"columns\":[{\"id\":\"a\",\"name\":\"a\",\"ordinal\":0,\"role\":\"DIMENSION\",\"type\":\"BLOB\"}]}"))
        .isInstanceOf(SchemaException.class).hasMessageContaining("BLOB");
  }
}
