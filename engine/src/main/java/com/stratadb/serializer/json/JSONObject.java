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
package com.stratadb.serializer.json;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import com.google.gson.Strictness;
import com.google.gson.internal.LazilyParsedNumber;
import com.google.gson.stream.JsonReader;

import java.io.StringReader;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * JSON object.<br>
 * This API is compatible with org.json Java API, but uses Google GSON library under the hood. Attributes keep their insertion
 * order, so files written from the same content are byte-identical.
 */
public class JSONObject {
  public static final JsonNull   NULL = JsonNull.INSTANCE;
  private final       JsonObject object;

  public JSONObject() {
    this.object = new JsonObject();
  }

  public JSONObject(final JsonObject input) {
    this.object = input;
  }

  public JSONObject(final String input) {
    if (input != null) {
      try {
        final JsonReader reader = new JsonReader(new StringReader(input));
        reader.setStrictness(Strictness.LENIENT);
        object = JsonParser.parseReader(reader).getAsJsonObject();
      } catch (Exception e) {
        throw new JSONException("Invalid JSON object format: " + input, e);
      }
    } else
      object = new JsonObject();
  }

  public JSONObject(final Map<String, ?> map) {
    object = new JsonObject();
    if (map != null)
      for (Map.Entry<String, ?> entry : map.entrySet())
        put(entry.getKey(), entry.getValue());
  }

  public JSONObject put(final String name, final String value) {
    object.addProperty(name, value);
    return this;
  }

  public JSONObject put(final String name, final Number value) {
    object.addProperty(name, value);
    return this;
  }

  public JSONObject put(final String name, final Boolean value) {
    object.addProperty(name, value);
    return this;
  }

  public JSONObject put(final String name, final Object value) {
    if (name == null)
      throw new IllegalArgumentException("Property name is null");

    object.add(name, objectToElement(value));
    return this;
  }

  public String getString(final String name) {
    return getElement(name).getAsString();
  }

  public int getInt(final String name) {
    return getElement(name).getAsNumber().intValue();
  }

  public long getLong(final String name) {
    return getElement(name).getAsNumber().longValue();
  }

  public boolean getBoolean(final String name) {
    return getElement(name).getAsBoolean();
  }

  public JSONObject getJSONObject(final String name) {
    return new JSONObject(getElement(name).getAsJsonObject());
  }

  public JSONArray getJSONArray(final String name) {
    return new JSONArray(getElement(name).getAsJsonArray());
  }

  public Object get(final String name) {
    return elementToObject(getElement(name));
  }

  public String optString(final String name) {
    return optString(name, "");
  }

  public String optString(final String name, final String defaultValue) {
    final Object value = name == null ? null : elementToObject(object.get(name));
    return value == null ? defaultValue : value.toString();
  }

  public boolean has(final String name) {
    return object.has(name);
  }

  public boolean isNull(final String name) {
    return !object.has(name) || object.get(name).isJsonNull();
  }

  public Object remove(final String name) {
    final JsonElement oldElement = object.remove(name);
    if (oldElement != null)
      return elementToObject(oldElement);
    return null;
  }

  public Map<String, Object> toMap() {
    final Map<String, JsonElement> map = object.asMap();
    final Map<String, Object> result = new LinkedHashMap<>(map.size());
    for (Map.Entry<String, JsonElement> entry : map.entrySet()) {
      Object value = elementToObject(entry.getValue());
      if (value instanceof JSONObject nObject)
        value = nObject.toMap();
      else if (value instanceof JSONArray array)
        value = array.toList();

      result.put(entry.getKey(), value);
    }

    return result;
  }

  public Set<String> keySet() {
    return object.keySet();
  }

  public int length() {
    return object.size();
  }

  public boolean isEmpty() {
    return object.size() == 0;
  }

  public JsonObject getInternal() {
    return object;
  }

  public String toString(final int indent) {
    return indent > 0 ? JSONFactory.INSTANCE.getGsonPrettyPrint().toJson(object) : toString();
  }

  @Override
  public String toString() {
    return JSONFactory.INSTANCE.getGson().toJson(object);
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o)
      return true;
    if (!(o instanceof JSONObject))
      return false;
    final JSONObject that = (JSONObject) o;
    return object.equals(that.object);
  }

  @Override
  public int hashCode() {
    return Objects.hash(object);
  }

  private JsonElement getElement(final String name) {
    if (name == null)
      throw new IllegalArgumentException("Property name is null");

    final JsonElement element = object.get(name);
    if (element == null)
      throw new JSONException("JSONObject[" + name + "] not found");
    return element;
  }

  protected static Object elementToObject(final JsonElement element) {
    if (element == null || element.isJsonNull())
      return null;
    else if (element.isJsonPrimitive()) {
      final JsonPrimitive primitive = element.getAsJsonPrimitive();
      if (primitive.isNumber()) {
        final Number value = primitive.getAsNumber();
        if (!(value instanceof LazilyParsedNumber))
          return value;

        // PARSED FROM TEXT: USE THE SMALLEST EXACT JAVA TYPE
        final String strValue = primitive.getAsString();
        if (strValue.contains(".") || strValue.contains("e") || strValue.contains("E"))
          return value.doubleValue();
        final long longValue = value.longValue();
        if (longValue >= Integer.MIN_VALUE && longValue <= Integer.MAX_VALUE)
          return (int) longValue;
        return longValue;
      } else if (primitive.isBoolean())
        return primitive.getAsBoolean();
      return primitive.getAsString();
    } else if (element.isJsonObject())
      return new JSONObject(element.getAsJsonObject());
    else if (element.isJsonArray())
      return new JSONArray(element.getAsJsonArray());

    throw new JSONException("Unsupported JSON element " + element);
  }

  @SuppressWarnings("unchecked")
  protected static JsonElement objectToElement(final Object value) {
    if (value == null || value instanceof JsonNull)
      return NULL;
    else if (value instanceof JsonElement jsonElement)
      return jsonElement;
    else if (value instanceof String string)
      return new JsonPrimitive(string);
    else if (value instanceof Number number)
      return new JsonPrimitive(number);
    else if (value instanceof Boolean bool)
      return new JsonPrimitive(bool);
    else if (value instanceof Character character)
      return new JsonPrimitive(character);
    else if (value instanceof JSONObject nObject)
      return nObject.getInternal();
    else if (value instanceof JSONArray jsonArray)
      return jsonArray.getInternal();
    else if (value instanceof Enum<?> enumValue)
      return new JsonPrimitive(enumValue.name());
    else if (value instanceof Map<?, ?> map)
      return new JSONObject((Map<String, Object>) map).getInternal();
    else if (value instanceof Collection<?> collection) {
      final JsonArray array = new JsonArray();
      for (Object o : collection)
        array.add(objectToElement(o));
      return array;
    } else if (value instanceof Object[] items) {
      final JsonArray array = new JsonArray();
      for (Object o : items)
        array.add(objectToElement(o));
      return array;
    }

    return new JsonPrimitive(value.toString());
  }
}
