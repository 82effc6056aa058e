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
package com.stratadb.importer;

import java.util.HashMap;
import java.util.Map;

public class ImporterSettings {
  String  table;
  String  schema;
  String  file;
  String  delimiter;
  Boolean header;
  Long    skipEntries;
  String  commitPermits;

  final Map<String, String> options = new HashMap<>();

  protected void parseParameters(final String[] args) {
    if (args != null)
      for (int i = 0; i < args.length - 1; i += 2)
        parseParameter(args[i].startsWith("-") ? args[i].substring(1) : args[i], args[i + 1]);
  }

  public void parseParameter(final String name, final String value) {
    if ("table".equals(name))
      table = value;
    else if ("schema".equals(name))
      schema = value;
    else if ("file".equals(name))
      file = value;
    else if ("delimiter".equals(name))
      delimiter = value;
    else if ("header".equals(name))
      header = Boolean.parseBoolean(value);
    else if ("skipEntries".equals(name))
      skipEntries = Long.parseLong(value);
    else if ("commitPermits".equals(name))
      commitPermits = value;
    else
      // ADDITIONAL OPTIONS
      options.put(name, value);
  }

  public String getTable() {
    return table;
  }

  public String getSchema() {
    return schema;
  }

  public String getFile() {
    return file;
  }

  public Map<String, String> getOptions() {
    return options;
  }
}
