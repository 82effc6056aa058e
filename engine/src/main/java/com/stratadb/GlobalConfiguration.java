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
package com.stratadb;

import com.stratadb.exception.ConfigurationException;
import com.stratadb.log.LogManager;
import com.stratadb.serializer.json.JSONObject;
import com.stratadb.utility.Callable;

import java.io.PrintStream;
import java.util.logging.Level;

/**
 * Keeps all configuration settings. At startup assigns the configuration values by reading system properties and, when a
 * property is not set, the environment variable with the same name.
 */
public enum GlobalConfiguration {
  // ENVIRONMENT
  DUMP_CONFIG_AT_STARTUP("stratadb.dumpConfigAtStartup", "Dumps the configuration at startup", Boolean.class, false,
      new Callable<Object, Object>() {
        @Override
        public Object call(final Object value) {
          if (Boolean.TRUE.equals(value))
            dumpConfiguration(System.out);
          return value;
        }
      }),

  // COMMIT
  COMMIT_PERMITS("stratadb.commitPermits",
      "Maximum number of segment commits executing at the same time in the process. Not set means unbounded. Values lower than 1 are rejected when the commit gate is created",
      String.class, null),

  // DICTIONARY
  MEMBER_DEFAULT_VALUE("stratadb.memberDefaultValue",
      "Default member reserved in every plain dictionary column before its first real value", String.class, "@NU#LL$!"),

  SERIALIZATION_NULL_FORMAT("stratadb.serializationNullFormat", "Token that replaces the value of a truncated or missing field",
      String.class, "\\N"),

  DICTIONARY_CHARSET("stratadb.dictionaryCharset", "Charset used to encode dictionary values, schema and table status files",
      String.class, "UTF-8"),

  // IMPORTER
  CSV_DELIMITER("stratadb.csvDelimiter", "Default field delimiter of delimited text sources", String.class, ","),

  CSV_HEADER("stratadb.csvHeader", "Default for delimited text sources: the first line is a header and is skipped", Boolean.class,
      true),
  ;

  /**
   * Place holder for the "undefined" value of setting.
   */
  private final Object nullValue = new Object();

  private static final String                   PREFIX = "stratadb.";
  private final        String                   key;
  private final        Object                   defValue;
  private final        Class<?>                 type;
  private final        String                   description;
  private final        Callable<Object, Object> callback;
  private volatile     Object                   value  = nullValue;

  static {
    readConfiguration();
  }

  GlobalConfiguration(final String iKey, final String iDescription, final Class<?> iType, final Object iDefValue) {
    this(iKey, iDescription, iType, iDefValue, null);
  }

  GlobalConfiguration(final String iKey, final String iDescription, final Class<?> iType, final Object iDefValue,
      final Callable<Object, Object> callback) {
    this.key = iKey;
    this.description = iDescription;
    this.defValue = iDefValue;
    this.type = iType;
    this.callback = callback;
  }

  /**
   * Reset all the configurations to the default values.
   */
  public static void resetAll() {
    for (GlobalConfiguration v : values())
      v.reset();
  }

  /**
   * Reset the configuration to the default value.
   */
  public void reset() {
    value = nullValue;
  }

  public static void dumpConfiguration(final PrintStream out) {
    out.println("STRATADB configuration:");

    for (GlobalConfiguration v : values()) {
      out.print("  + ");
      out.print(v.key);
      out.print(" = ");
      out.println(String.valueOf((Object) v.getValue()));
    }
  }

  public static void fromJSON(final String input) {
    if (input == null)
      return;

    final JSONObject json = new JSONObject(input);
    final JSONObject cfg = json.getJSONObject("configuration");
    for (String k : cfg.keySet()) {
      final GlobalConfiguration cfgEntry = findByKey(PREFIX + k);
      if (cfgEntry != null)
        cfgEntry.setValue(cfg.get(k));
    }
  }

  public static String toJSON() {
    final JSONObject json = new JSONObject();

    final JSONObject cfg = new JSONObject();
    json.put("configuration", cfg);

    for (GlobalConfiguration k : values())
      cfg.put(k.key.substring(PREFIX.length()), (Object) k.getValue());

    return json.toString();
  }

  /**
   * Finds the setting by its key. The key is case insensitive.
   *
   * @return the setting if found, otherwise null
   */
  public static GlobalConfiguration findByKey(final String iKey) {
    for (GlobalConfiguration v : values()) {
      if (v.getKey().equalsIgnoreCase(iKey))
        return v;
    }
    return null;
  }

  /**
   * Assign configuration values by reading system properties.
   */
  private static void readConfiguration() {
    String prop;

    for (GlobalConfiguration config : values()) {
      prop = System.getProperty(config.key);
      if (prop == null)
        prop = System.getenv(config.key);

      if (prop != null) {
        try {
          config.setValue(prop);
        } catch (ConfigurationException e) {
          // KEEP THE DEFAULT
          LogManager.instance().log(config, Level.SEVERE, "Ignored invalid setting %s=%s", e, config.key, prop);
        }
      }
    }
  }

  public <T> T getValue() {
    //noinspection unchecked
    return (T) (value != nullValue && value != null ? value : defValue);
  }

  /**
   * @return {@literal true} if configuration was changed from default value and {@literal false} otherwise.
   */
  public boolean isChanged() {
    return value != nullValue;
  }

  public void setValue(final Object iValue) {
    if (iValue != null)
      try {
        if (type == Boolean.class)
          value = iValue instanceof Boolean ? iValue : Boolean.parseBoolean(iValue.toString());
        else if (type == Integer.class)
          value = iValue instanceof Integer ? iValue : Integer.parseInt(iValue.toString().trim());
        else if (type == Long.class)
          value = iValue instanceof Long ? iValue : Long.parseLong(iValue.toString().trim());
        else if (type == String.class)
          value = iValue.toString();
        else
          value = iValue;
      } catch (NumberFormatException e) {
        throw new ConfigurationException("Invalid value '" + iValue + "' for setting '" + key + "'", e);
      }
    else
      value = nullValue;

    if (callback != null)
      try {
        final Object newValue = callback.call(value);
        if (newValue != value)
          // OVERWRITE IT
          value = newValue;
      } catch (Exception e) {
        LogManager.instance().log(this, Level.SEVERE, "Error during setting property %s=%s", e, key, value);
      }
  }

  public boolean getValueAsBoolean() {
    final Object v = getValue();
    return v instanceof Boolean ? (Boolean) v : Boolean.parseBoolean(String.valueOf(v));
  }

  public String getValueAsString() {
    final Object v = getValue();
    return v != null ? v.toString() : null;
  }

  public String getKey() {
    return key;
  }

  public Class<?> getType() {
    return type;
  }

  public String getDescription() {
    return description;
  }
}
