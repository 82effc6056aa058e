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
import com.stratadb.schema.TableSchema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collects, for every dictionary encoded dimension of a table, the candidate values to merge into the column dictionary. Values
 * are kept in row order and may repeat: deduplication happens when the candidates are appended to the {@link DictionaryStore}.
 * <p>
 * A plain dictionary column (dictionary encoded, not direct) receives the default member right before its first candidate, so its
 * dictionary always reserves it. A row that is too short to carry a column's field contributes the null format token instead.
 * <p>
 * Not thread safe: one builder per load.
 */
public class DictionaryBuilder {
  private final List<ColumnDefinition>               columns;
  private final Map<ColumnDefinition, List<String>> candidates = new LinkedHashMap<>();
  private final String                               memberDefaultValue;
  private final String                               nullFormat;
  private final int                                  expectedFields;
  private       long                                 rowCount;

  public DictionaryBuilder(final TableSchema schema, final StoreConfiguration configuration) {
    this.columns = schema.getDictionaryDimensions();
    this.memberDefaultValue = configuration.getMemberDefaultValue();
    this.nullFormat = configuration.getNullFormat();

    int maxOrdinal = 0;
    for (ColumnDefinition c : schema.getColumns())
      maxOrdinal = Math.max(maxOrdinal, c.getOrdinal());
    this.expectedFields = maxOrdinal + 1;

    for (ColumnDefinition c : columns)
      candidates.put(c, new ArrayList<>());
  }

  /**
   * Consumes all the rows of the source.
   *
   * @return the candidates per column, see {@link #getCandidates()}
   */
  public Map<ColumnDefinition, List<String>> build(final Iterator<String[]> rows) {
    while (rows.hasNext())
      accept(rows.next());
    return getCandidates();
  }

  /**
   * Consumes one row.
   */
  public void accept(final String[] row) {
    ++rowCount;
    for (ColumnDefinition column : columns) {
      final List<String> columnCandidates = candidates.get(column);
      if (columnCandidates.isEmpty() && column.isPlainDictionary())
        columnCandidates.add(memberDefaultValue);

      columnCandidates.add(fieldOf(row, column));
    }
  }

  /**
   * Returns the candidates of every dictionary encoded dimension, in schema ordinal order. Each list keeps the row order, duplicates
   * included.
   */
  public Map<ColumnDefinition, List<String>> getCandidates() {
    final Map<ColumnDefinition, List<String>> result = new LinkedHashMap<>(candidates.size());
    for (Map.Entry<ColumnDefinition, List<String>> entry : candidates.entrySet())
      result.put(entry.getKey(), Collections.unmodifiableList(entry.getValue()));
    return Collections.unmodifiableMap(result);
  }

  public List<ColumnDefinition> getColumns() {
    return columns;
  }

  public long getRowCount() {
    return rowCount;
  }

  private String fieldOf(final String[] row, final ColumnDefinition column) {
    if (row == null || (row.length == 1 && expectedFields > 1))
      // TRUNCATED ROW
      return nullFormat;

    final int ordinal = column.getOrdinal();
    if (ordinal >= row.length || row[ordinal] == null)
      return nullFormat;

    return row[ordinal];
  }
}
