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

import com.stratadb.exception.SchemaException;
import com.stratadb.serializer.json.JSONArray;
import com.stratadb.serializer.json.JSONObject;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Defines a column of a table: its identity, its position in the input rows, its role, its type and its encodings. Instances are
 * immutable.
 */
public final class ColumnDefinition {
  private final String            id;
  private final String            name;
  private final int               ordinal;
  private final ColumnRole        role;
  private final Type              dataType;
  private final EnumSet<Encoding> encodings;
  private final int               precision;
  private final int               scale;

  public ColumnDefinition(final String id, final String name, final int ordinal, final ColumnRole role, final Type dataType,
      final Collection<Encoding> encodings) {
    this(id, name, ordinal, role, dataType, encodings, 0, 0);
  }

  public ColumnDefinition(final String id, final String name, final int ordinal, final ColumnRole role, final Type dataType,
      final Collection<Encoding> encodings, final int precision, final int scale) {
    if (id == null || id.isBlank())
      throw new SchemaException("Column id is empty");
    if (name == null || name.isBlank())
      throw new SchemaException("Column name is empty (id=" + id + ")");
    if (ordinal < 0)
      throw new SchemaException("Column '" + name + "' has a negative ordinal " + ordinal);
    if (role == null || dataType == null)
      throw new SchemaException("Column '" + name + "' has no role or type");

    this.id = id;
    this.name = name;
    this.ordinal = ordinal;
    this.role = role;
    this.dataType = dataType;
    this.encodings = encodings == null || encodings.isEmpty() ? EnumSet.noneOf(Encoding.class) : EnumSet.copyOf(encodings);
    this.precision = precision;
    this.scale = scale;

    if (this.encodings.contains(Encoding.DIRECT_DICTIONARY)) {
      if (!this.encodings.contains(Encoding.DICTIONARY))
        throw new SchemaException("Column '" + name + "' has DIRECT_DICTIONARY encoding without DICTIONARY");
      if (!dataType.isCalendar())
        throw new SchemaException("Column '" + name + "' has DIRECT_DICTIONARY encoding but type " + dataType + " is not a date or timestamp");
    }

    if (dataType == Type.DECIMAL && (precision < 0 || scale < 0 || scale > precision))
      throw new SchemaException("Column '" + name + "' has invalid decimal precision " + precision + " and scale " + scale);
  }

  public String getId() {
    return id;
  }

  public String getName() {
    return name;
  }

  /**
   * Position of the column's field within an input row.
   */
  public int getOrdinal() {
    return ordinal;
  }

  public ColumnRole getRole() {
    return role;
  }

  public Type getDataType() {
    return dataType;
  }

  public Set<Encoding> getEncodings() {
    return Collections.unmodifiableSet(encodings);
  }

  public int getPrecision() {
    return precision;
  }

  public int getScale() {
    return scale;
  }

  public boolean isDimension() {
    return role == ColumnRole.DIMENSION;
  }

  public boolean isDictionaryEncoded() {
    return encodings.contains(Encoding.DICTIONARY);
  }

  public boolean isDirectDictionary() {
    return encodings.contains(Encoding.DIRECT_DICTIONARY);
  }

  /**
   * A plain dictionary stores the raw values and reserves a default member before the first real one.
   */
  public boolean isPlainDictionary() {
    return isDictionaryEncoded() && !isDirectDictionary();
  }

  public JSONObject toJSON() {
    final JSONObject json = new JSONObject();
    json.put("id", id);
    json.put("name", name);
    json.put("ordinal", ordinal);
    json.put("role", role.name());
    json.put("type", dataType.name());

    final JSONArray encodingArray = new JSONArray();
    for (Encoding encoding : encodings)
      encodingArray.put(encoding.name());
    json.put("encodings", encodingArray);

    if (dataType == Type.DECIMAL) {
      json.put("precision", precision);
      json.put("scale", scale);
    }
    return json;
  }

  public static ColumnDefinition fromJSON(final JSONObject json) {
    final Type type = Type.getTypeByName(json.getString("type"));
    if (type == null)
      throw new SchemaException("Unknown type '" + json.getString("type") + "' for column '" + json.optString("name") + "'");

    final ColumnRole role;
    try {
      role = ColumnRole.valueOf(json.getString("role"));
    } catch (IllegalArgumentException e) {
      throw new SchemaException("Unknown role '" + json.getString("role") + "' for column '" + json.optString("name") + "'", e);
    }

    final EnumSet<Encoding> encodings = EnumSet.noneOf(Encoding.class);
    if (json.has("encodings"))
      for (Object e : json.getJSONArray("encodings")) {
        try {
          encodings.add(Encoding.valueOf(e.toString()));
        } catch (IllegalArgumentException ex) {
          throw new SchemaException("Unknown encoding '" + e + "' for column '" + json.optString("name") + "'", ex);
        }
      }

    final int precision = json.has("precision") ? json.getInt("precision") : 0;
    final int scale = json.has("scale") ? json.getInt("scale") : 0;

    return new ColumnDefinition(json.getString("id"), json.getString("name"), json.getInt("ordinal"), role, type, encodings, precision,
        scale);
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o)
      return true;
    if (!(o instanceof ColumnDefinition))
      return false;
    final ColumnDefinition that = (ColumnDefinition) o;
    return ordinal == that.ordinal && precision == that.precision && scale == that.scale && id.equals(that.id) && name.equals(
        that.name) && role == that.role && dataType == that.dataType && encodings.equals(that.encodings);
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, name, ordinal, role, dataType, encodings);
  }

  @Override
  public String toString() {
    return name + " " + dataType + " (" + role + ", ordinal=" + ordinal + ", encodings=" + encodings + ")";
  }
}
