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

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Outcome of {@link DictionaryStore#appendDistinctValues}: the surrogate key of every distinct candidate, the values that were new
 * to the dictionary and the sort index rebuilt over the whole dictionary.
 */
public final class DictionaryAppendResult {
  private final String               columnId;
  private final Map<String, Integer> assignment;
  private final List<String>         addedValues;
  private final int                  cardinality;
  private final SortIndex            sortIndex;

  DictionaryAppendResult(final String columnId, final Map<String, Integer> assignment, final List<String> addedValues,
      final int cardinality, final SortIndex sortIndex) {
    this.columnId = columnId;
    this.assignment = Collections.unmodifiableMap(assignment);
    this.addedValues = Collections.unmodifiableList(addedValues);
    this.cardinality = cardinality;
    this.sortIndex = sortIndex;
  }

  public String getColumnId() {
    return columnId;
  }

  /**
   * Distinct candidates in first-seen order, mapped to their surrogate key.
   */
  public Map<String, Integer> getAssignment() {
    return assignment;
  }

  public int getSurrogateKey(final String value) {
    final Integer key = assignment.get(value);
    if (key == null)
      throw new IllegalArgumentException("Value '" + value + "' was not a candidate of column '" + columnId + "'");
    return key;
  }

  public List<String> getAddedValues() {
    return addedValues;
  }

  /**
   * Size of the dictionary after the append.
   */
  public int getCardinality() {
    return cardinality;
  }

  public SortIndex getSortIndex() {
    return sortIndex;
  }

  @Override
  public String toString() {
    return "DictionaryAppendResult{" + columnId + ", added=" + addedValues.size() + ", cardinality=" + cardinality + "}";
  }
}
