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

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Committed content of a column dictionary. Surrogate keys start from 1 and follow the order values were appended in; 0 is never
 * assigned to a value.
 */
public final class ColumnDictionary {
  public static final int NOT_ENCODED = 0;

  private final String               columnId;
  private final List<String>         values;
  private final Map<String, Integer> keys;

  ColumnDictionary(final String columnId, final List<String> values) {
    this.columnId = columnId;
    this.values = Collections.unmodifiableList(values);
    this.keys = new HashMap<>(values.size() * 4 / 3 + 1);
    for (int i = 0; i < values.size(); i++)
      if (keys.putIfAbsent(values.get(i), i + 1) != null)
        throw new DictionaryBuildException(ErrorCode.CORRUPTION_DETECTED,
            "Dictionary of column '" + columnId + "' contains the value '" + values.get(i) + "' twice");
  }

  public String getColumnId() {
    return columnId;
  }

  /**
   * Returns the surrogate key of the value, or {@link #NOT_ENCODED} if the value is not in the dictionary.
   */
  public int getSurrogateKey(final String value) {
    final Integer key = keys.get(value);
    return key != null ? key : NOT_ENCODED;
  }

  public String getValue(final int surrogateKey) {
    if (surrogateKey < 1 || surrogateKey > values.size())
      throw new IllegalArgumentException(
          "Surrogate key " + surrogateKey + " is not valid for column '" + columnId + "' (total=" + values.size() + ")");
    return values.get(surrogateKey - 1);
  }

  public boolean contains(final String value) {
    return keys.containsKey(value);
  }

  /**
   * Values in surrogate key order: the value at index i has key i + 1.
   */
  public List<String> getValues() {
    return values;
  }

  public int size() {
    return values.size();
  }

  public int getMaxSurrogateKey() {
    return values.size();
  }

  @Override
  public String toString() {
    return "ColumnDictionary{" + columnId + ", size=" + values.size() + "}";
  }
}
