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
import com.stratadb.serializer.json.JSONArray;
import com.stratadb.serializer.json.JSONException;
import com.stratadb.serializer.json.JSONObject;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;

/**
 * Column layout of a table. Dimensions are exposed in schema ordinal order, which is the order the dictionary builder visits
 * them.
 */
public final class TableSchema {
  private final String                 tableId;
  private final String                 databaseName;
  private final String                 tableName;
  private final List<ColumnDefinition> columns;
  private final List<ColumnDefinition> dimensions;
  private final List<ColumnDefinition> measures;

  public TableSchema(final String tableId, final String databaseName, final String tableName, final List<ColumnDefinition> columns) {
    if (tableName == null || tableName.isBlank())
      throw new SchemaException("Table name is empty");
    if (columns == null || columns.isEmpty())
      throw new SchemaException("Table '" + tableName + "' has no columns");

    final Set<String> ids = new HashSet<>();
    final Set<String> names = new HashSet<>();
    final Set<Integer> ordinals = new HashSet<>();
    for (ColumnDefinition c : columns) {
      if (!ids.add(c.getId()))
        throw new SchemaException("Table '" + tableName + "' has duplicate column id '" + c.getId() + "'");
      if (!names.add(c.getName().toLowerCase(Locale.ENGLISH)))
        throw new SchemaException("Table '" + tableName + "' has duplicate column name '" + c.getName() + "'");
      if (!ordinals.add(c.getOrdinal()))
        throw new SchemaException("Table '" + tableName + "' has duplicate column ordinal " + c.getOrdinal());
    }

    this.tableId = tableId != null ? tableId : UUID.randomUUID().toString();
    this.databaseName = databaseName != null ? databaseName : "default";
    this.tableName = tableName;

    final List<ColumnDefinition> sorted = new ArrayList<>(columns);
    sorted.sort(Comparator.comparingInt(ColumnDefinition::getOrdinal));
    this.columns = Collections.unmodifiableList(sorted);

    final List<ColumnDefinition> dims = new ArrayList<>();
    final List<ColumnDefinition> meas = new ArrayList<>();
    for (ColumnDefinition c : sorted)
      if (c.isDimension())
        dims.add(c);
      else
        meas.add(c);
    this.dimensions = Collections.unmodifiableList(dims);
    this.measures = Collections.unmodifiableList(meas);
  }

  public String getTableId() {
    return tableId;
  }

  public String getDatabaseName() {
    return databaseName;
  }

  public String getTableName() {
    return tableName;
  }

  public List<ColumnDefinition> getColumns() {
    return columns;
  }

  public List<ColumnDefinition> getDimensions() {
    return dimensions;
  }

  public List<ColumnDefinition> getMeasures() {
    return measures;
  }

  /**
   * Dimensions carrying the dictionary encoding, in schema ordinal order.
   */
  public List<ColumnDefinition> getDictionaryDimensions() {
    final List<ColumnDefinition> result = new ArrayList<>();
    for (ColumnDefinition c : dimensions)
      if (c.isDictionaryEncoded())
        result.add(c);
    return result;
  }

  /**
   * Returns the column by name, case insensitive.
   *
   * @throws SchemaException with {@link ErrorCode#COLUMN_NOT_FOUND} if the table has no such column
   */
  public ColumnDefinition getColumn(final String name) {
    for (ColumnDefinition c : columns)
      if (c.getName().equalsIgnoreCase(name))
        return c;
    final SchemaException exception = new SchemaException(ErrorCode.COLUMN_NOT_FOUND, "Column '" + name + "' not found");
    exception.addContext("table", tableName);
    throw exception;
  }

  public JSONObject toJSON() {
    final JSONObject json = new JSONObject();
    json.put("tableId", tableId);
    json.put("databaseName", databaseName);
    json.put("tableName", tableName);

    final JSONArray array = new JSONArray();
    for (ColumnDefinition c : columns)
      array.put(c.toJSON());
    json.put("columns", array);
    return json;
  }

  public static TableSchema fromJSON(final String content) {
    try {
      return fromJSON(new JSONObject(content));
    } catch (JSONException e) {
      throw new SchemaException("Invalid table schema content", e);
    }
  }

  public static TableSchema fromJSON(final JSONObject json) {
    try {
      final JSONArray array = json.getJSONArray("columns");
      final List<ColumnDefinition> columns = new ArrayList<>(array.length());
      for (int i = 0; i < array.length(); i++)
        columns.add(ColumnDefinition.fromJSON(array.getJSONObject(i)));

      return new TableSchema(json.has("tableId") ? json.getString("tableId") : null,
          json.has("databaseName") ? json.getString("databaseName") : null, json.getString("tableName"), columns);
    } catch (JSONException | IllegalStateException | UnsupportedOperationException e) {
      throw new SchemaException("Invalid table schema content", e);
    }
  }

  @Override
  public String toString() {
    return databaseName + "." + tableName + " " + columns;
  }

  public static Builder builder(final String tableName) {
    return new Builder(tableName);
  }

  /**
   * Fluent construction of a schema. Ordinals follow the order columns are added in, ids are random UUIDs unless given.
   */
  public static class Builder {
    private final String                 tableName;
    private       String                 databaseName = "default";
    private       String                 tableId;
    private final List<ColumnDefinition> columns      = new ArrayList<>();

    private Builder(final String tableName) {
      this.tableName = tableName;
    }

    public Builder withDatabase(final String databaseName) {
      this.databaseName = databaseName;
      return this;
    }

    public Builder withTableId(final String tableId) {
      this.tableId = tableId;
      return this;
    }

    public Builder addDimension(final String name, final Type type, final Encoding... encodings) {
      return add(name, ColumnRole.DIMENSION, type, encodings);
    }

    public Builder addMeasure(final String name, final Type type) {
      return add(name, ColumnRole.MEASURE, type);
    }

    public Builder addDecimalMeasure(final String name, final int precision, final int scale) {
      columns.add(new ColumnDefinition(UUID.randomUUID().toString(), name, columns.size(), ColumnRole.MEASURE, Type.DECIMAL,
          EnumSet.noneOf(Encoding.class), precision, scale));
      return this;
    }

    public Builder add(final ColumnDefinition column) {
      columns.add(column);
      return this;
    }

    private Builder add(final String name, final ColumnRole role, final Type type, final Encoding... encodings) {
      final EnumSet<Encoding> set = EnumSet.noneOf(Encoding.class);
      Collections.addAll(set, encodings);
      columns.add(new ColumnDefinition(UUID.randomUUID().toString(), name, columns.size(), role, type, set));
      return this;
    }

    public TableSchema build() {
      return new TableSchema(tableId, databaseName, tableName, columns);
    }
  }
}
