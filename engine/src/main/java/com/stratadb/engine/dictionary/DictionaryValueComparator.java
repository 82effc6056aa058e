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

import com.stratadb.schema.Type;

import java.math.BigDecimal;
import java.util.Comparator;

/**
 * Orders raw dictionary values according to the column type. Numeric columns compare by numeric value; values that do not parse
 * as a number, such as the default member or the null format token, sort after every number and lexicographically among
 * themselves. Any other type compares lexicographically.
 */
public class DictionaryValueComparator implements Comparator<String> {
  private final boolean numeric;

  public DictionaryValueComparator(final Type type) {
    this.numeric = type != null && type.isNumeric();
  }

  @Override
  public int compare(final String a, final String b) {
    if (!numeric)
      return a.compareTo(b);

    final BigDecimal na = parseNumber(a);
    final BigDecimal nb = parseNumber(b);
    if (na != null && nb != null)
      return na.compareTo(nb);
    if (na != null)
      return -1;
    if (nb != null)
      return 1;
    return a.compareTo(b);
  }

  static BigDecimal parseNumber(final String value) {
    if (value == null || value.isEmpty())
      return null;

    final char first = value.charAt(0);
    if (first != '-' && first != '+' && first != '.' && (first < '0' || first > '9'))
      return null;

    try {
      return new BigDecimal(value.trim());
    } catch (NumberFormatException e) {
      return null;
    }
  }
}
