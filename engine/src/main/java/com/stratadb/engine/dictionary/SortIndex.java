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

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Ordering of the entries of a column dictionary, used to prune ranges of surrogate keys.
 * <p>
 * {@code sortOrder[rank]} is the index (surrogate key - 1) of the entry with that rank, {@code inverseSortOrder[index]} is the
 * rank of the entry at that index. Entries with equal values keep the surrogate key order.
 */
public final class SortIndex {
  public static final SortIndex EMPTY = new SortIndex(new int[0], new int[0]);

  private final int[] sortOrder;
  private final int[] inverseSortOrder;

  public SortIndex(final int[] sortOrder, final int[] inverseSortOrder) {
    if (sortOrder.length != inverseSortOrder.length)
      throw new IllegalArgumentException(
          "Sort order and inverse sort order have different sizes (" + sortOrder.length + " != " + inverseSortOrder.length + ")");
    this.sortOrder = sortOrder;
    this.inverseSortOrder = inverseSortOrder;
  }

  /**
   * Sorts the whole dictionary. The values are in surrogate key order.
   */
  public static SortIndex compute(final List<String> values, final Type type) {
    final int size = values.size();
    final Integer[] indexes = new Integer[size];
    for (int i = 0; i < size; i++)
      indexes[i] = i;

    final DictionaryValueComparator valueComparator = new DictionaryValueComparator(type);
    final Comparator<Integer> comparator = (a, b) -> {
      final int cmp = valueComparator.compare(values.get(a), values.get(b));
      return cmp != 0 ? cmp : Integer.compare(a, b);
    };
    Arrays.sort(indexes, comparator);

    final int[] sortOrder = new int[size];
    final int[] inverse = new int[size];
    for (int rank = 0; rank < size; rank++) {
      sortOrder[rank] = indexes[rank];
      inverse[indexes[rank]] = rank;
    }
    return new SortIndex(sortOrder, inverse);
  }

  public int size() {
    return sortOrder.length;
  }

  public int[] getSortOrder() {
    return sortOrder.clone();
  }

  public int[] getInverseSortOrder() {
    return inverseSortOrder.clone();
  }

  /**
   * Returns the surrogate key of the entry with the given rank.
   */
  public int getSurrogateKeyAt(final int rank) {
    return sortOrder[rank] + 1;
  }

  /**
   * Returns the rank of the entry with the given surrogate key.
   */
  public int getRank(final int surrogateKey) {
    if (surrogateKey < 1 || surrogateKey > inverseSortOrder.length)
      throw new IllegalArgumentException("Surrogate key " + surrogateKey + " is not valid (total=" + inverseSortOrder.length + ")");
    return inverseSortOrder[surrogateKey - 1];
  }

  /**
   * Checks that the sort order is a permutation of [0, size) and that the inverse matches it.
   *
   * @throws DictionaryBuildException with {@link ErrorCode#CORRUPTION_DETECTED} otherwise
   */
  public void validate() {
    final int size = sortOrder.length;
    final boolean[] seen = new boolean[size];
    for (int rank = 0; rank < size; rank++) {
      final int index = sortOrder[rank];
      if (index < 0 || index >= size || seen[index])
        throw new DictionaryBuildException(ErrorCode.CORRUPTION_DETECTED, "Sort order is not a permutation at rank " + rank);
      seen[index] = true;
      if (inverseSortOrder[index] != rank)
        throw new DictionaryBuildException(ErrorCode.CORRUPTION_DETECTED, "Inverse sort order does not match at index " + index);
    }
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o)
      return true;
    if (!(o instanceof SortIndex))
      return false;
    final SortIndex that = (SortIndex) o;
    return Arrays.equals(sortOrder, that.sortOrder) && Arrays.equals(inverseSortOrder, that.inverseSortOrder);
  }

  @Override
  public int hashCode() {
    return 31 * Arrays.hashCode(sortOrder) + Arrays.hashCode(inverseSortOrder);
  }

  @Override
  public String toString() {
    return "SortIndex{sortOrder=" + Arrays.toString(sortOrder) + ", inverseSortOrder=" + Arrays.toString(inverseSortOrder) + "}";
  }
}
