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

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Declared value type of a column.
 */
public enum Type {
  BOOLEAN("Boolean", 0),

  SHORT("Short", 1),

  INTEGER("Integer", 2),

  LONG("Long", 3),

  FLOAT("Float", 4),

  DOUBLE("Double", 5),

  DECIMAL("Decimal", 6),

  STRING("String", 7),

  DATE("Date", 8),

  TIMESTAMP("Timestamp", 9),
  ;

  private static final Map<String, Type> TYPES_BY_NAME = new HashMap<>();

  static {
    for (final Type type : values())
      TYPES_BY_NAME.put(type.name.toLowerCase(Locale.ENGLISH), type);
  }

  private final String name;
  private final int    id;

  Type(final String name, final int id) {
    this.name = name;
    this.id = id;
  }

  /**
   * Returns the type by its name, case insensitive. Both the display name ("Integer") and the enum name ("INTEGER") match.
   */
  public static Type getTypeByName(final String name) {
    return name != null ? TYPES_BY_NAME.get(name.toLowerCase(Locale.ENGLISH)) : null;
  }

  public boolean isNumeric() {
    return switch (this) {
      case SHORT, INTEGER, LONG, FLOAT, DOUBLE, DECIMAL -> true;
      default -> false;
    };
  }

  /**
   * Types whose values can be turned into surrogate keys by calendar arithmetic instead of a stored dictionary.
   */
  public boolean isCalendar() {
    return this == DATE || this == TIMESTAMP;
  }

  public String getName() {
    return name;
  }

  public int getId() {
    return id;
  }
}
