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
import com.stratadb.log.LogManager;
import com.stratadb.schema.ColumnDefinition;
import com.stratadb.schema.Type;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;

/**
 * Persistent dictionaries of the columns of one table. Each column has an append-only dictionary file and a sort index file under
 * the table metadata directory.
 * <p>
 * There is no locking: a caller must guarantee a single writer per column at a time.
 */
public class DictionaryStore {
  private final TablePath tablePath;
  private final Charset   charset;

  public DictionaryStore(final TablePath tablePath, final StoreConfiguration configuration) {
    this.tablePath = tablePath;
    this.charset = configuration.getCharset();
  }

  public DictionaryAppendResult appendDistinctValues(final ColumnDefinition column, final List<String> candidates) {
    return appendDistinctValues(column.getId(), column.getDataType(), candidates);
  }

  /**
   * Appends the candidates of a string column. See {@link #appendDistinctValues(String, Type, List)}.
   */
  public DictionaryAppendResult appendDistinctValues(final String columnId, final List<String> candidates) {
    return appendDistinctValues(columnId, Type.STRING, candidates);
  }

  /**
   * Merges the candidates into the column dictionary. Values not already present receive the next surrogate keys in first-seen
   * order, keys of existing values never change. The new values are appended and committed, then the sort index is rebuilt over
   * the whole dictionary and replaced.
   *
   * @throws DictionaryBuildException if the append or the sort index write fails. The column dictionary must then be considered
   *                                  corrupt for the current load.
   */
  public DictionaryAppendResult appendDistinctValues(final String columnId, final Type type, final List<String> candidates) {
    try {
      final List<String> values = readValues(columnId);

      final Map<String, Integer> keys = new HashMap<>(values.size() * 4 / 3 + 16);
      for (int i = 0; i < values.size(); i++)
        keys.put(values.get(i), i + 1);

      final Map<String, Integer> assignment = new LinkedHashMap<>();
      final List<String> added = new ArrayList<>();
      for (String candidate : candidates) {
        if (candidate == null)
          throw new IllegalArgumentException("Dictionary value of column '" + columnId + "' is null");

        Integer key = keys.get(candidate);
        if (key == null) {
          key = keys.size() + 1;
          keys.put(candidate, key);
          added.add(candidate);
        }
        assignment.putIfAbsent(candidate, key);
      }

      if (!added.isEmpty()) {
        try (final DictionaryWriter writer = new DictionaryWriter(tablePath.getDictionaryFile(columnId),
            tablePath.getDictionaryMetaFile(columnId), charset)) {
          for (String value : added)
            writer.write(value);
          writer.close();
          writer.commit();
        }
        values.addAll(added);
      }

      final SortIndex sortIndex = SortIndex.compute(values, type);
      SortIndexFile.write(tablePath.getSortIndexFile(columnId), sortIndex);

      LogManager.instance()
          .log(this, Level.FINE, "Dictionary of column '%s': %d candidates, %d new values, cardinality %d", null, columnId,
              candidates.size(), added.size(), values.size());

      return new DictionaryAppendResult(columnId, assignment, added, values.size(), sortIndex);

    } catch (IOException e) {
      final DictionaryBuildException exception = new DictionaryBuildException("Error on appending values to the dictionary of column '" + columnId + "'", e);
      exception.addContext("columnId", columnId);
      throw exception;
    }
  }

  /**
   * Returns the committed dictionary of the column, empty if the column has none yet.
   */
  public ColumnDictionary getDictionary(final String columnId) {
    try {
      return new ColumnDictionary(columnId, readValues(columnId));
    } catch (IOException e) {
      throw new DictionaryBuildException(ErrorCode.IO_ERROR, "Error on reading the dictionary of column '" + columnId + "'", e);
    }
  }

  /**
   * Reads the persisted sort index of the column.
   *
   * @throws DictionaryBuildException with {@link ErrorCode#CORRUPTION_DETECTED} if the sort index is missing, corrupted or stale,
   *                                  that is computed over a different number of entries than the committed dictionary has
   */
  public SortIndex readSortIndex(final String columnId) {
    try {
      final int cardinality = DictionaryMetadata.read(tablePath.getDictionaryMetaFile(columnId), charset).getEntryCount();

      final Path file = tablePath.getSortIndexFile(columnId);
      if (!Files.exists(file)) {
        if (cardinality == 0)
          return SortIndex.EMPTY;
        throw new DictionaryBuildException(ErrorCode.CORRUPTION_DETECTED, "Sort index of column '" + columnId + "' is missing");
      }

      final SortIndex index = SortIndexFile.read(file);
      if (index.size() != cardinality) {
        LogManager.instance()
            .log(this, Level.WARNING, "Sort index of column '%s' is stale (%d entries, dictionary has %d)", null, columnId, index.size(),
                cardinality);
        throw new DictionaryBuildException(ErrorCode.CORRUPTION_DETECTED,
            "Sort index of column '" + columnId + "' covers " + index.size() + " entries but the dictionary has " + cardinality);
      }
      return index;
    } catch (IOException e) {
      throw new DictionaryBuildException(ErrorCode.IO_ERROR, "Error on reading the sort index of column '" + columnId + "'", e);
    }
  }

  /**
   * Recomputes the sort index of the column from its committed dictionary and replaces the persisted one.
   */
  public SortIndex rebuildSortIndex(final ColumnDefinition column) {
    final String columnId = column.getId();
    try {
      final SortIndex index = SortIndex.compute(readValues(columnId), column.getDataType());
      SortIndexFile.write(tablePath.getSortIndexFile(columnId), index);
      return index;
    } catch (IOException e) {
      throw new DictionaryBuildException("Error on rebuilding the sort index of column '" + columnId + "'", e);
    }
  }

  public TablePath getTablePath() {
    return tablePath;
  }

  private List<String> readValues(final String columnId) throws IOException {
    return new DictionaryReader(tablePath.getDictionaryFile(columnId), tablePath.getDictionaryMetaFile(columnId), charset).read();
  }
}
