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
package com.stratadb.engine;

import com.stratadb.utility.FileUtils;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Layout of a table directory:
 * <pre>
 * &lt;table&gt;/Metadata/schema
 * &lt;table&gt;/Metadata/tablestatus
 * &lt;table&gt;/Metadata/&lt;columnId&gt;.dict
 * &lt;table&gt;/Metadata/&lt;columnId&gt;.dictmeta
 * &lt;table&gt;/Metadata/&lt;columnId&gt;.sortindex
 * &lt;table&gt;/Fact/Part0/Segment_&lt;loadId&gt;
 * </pre>
 */
public class TablePath {
  public static final String METADATA_DIRECTORY  = "Metadata";
  public static final String FACT_DIRECTORY      = "Fact";
  public static final String PARTITION_DIRECTORY = "Part0";
  public static final String SEGMENT_PREFIX      = "Segment_";
  public static final String SCHEMA_FILE         = "schema";
  public static final String TABLE_STATUS_FILE   = "tablestatus";
  public static final String DICTIONARY_EXT      = ".dict";
  public static final String DICTIONARY_META_EXT = ".dictmeta";
  public static final String SORT_INDEX_EXT      = ".sortindex";

  private final Path root;

  public TablePath(final Path root) {
    this.root = root.toAbsolutePath();
  }

  public Path getRoot() {
    return root;
  }

  public Path getMetadataDirectory() {
    return root.resolve(METADATA_DIRECTORY);
  }

  public Path getSchemaFile() {
    return getMetadataDirectory().resolve(SCHEMA_FILE);
  }

  public Path getTableStatusFile() {
    return getMetadataDirectory().resolve(TABLE_STATUS_FILE);
  }

  public Path getDictionaryFile(final String columnId) {
    return columnFile(columnId, DICTIONARY_EXT);
  }

  public Path getDictionaryMetaFile(final String columnId) {
    return columnFile(columnId, DICTIONARY_META_EXT);
  }

  public Path getSortIndexFile(final String columnId) {
    return columnFile(columnId, SORT_INDEX_EXT);
  }

  public Path getPartitionDirectory() {
    return root.resolve(FACT_DIRECTORY).resolve(PARTITION_DIRECTORY);
  }

  public Path getSegmentDirectory(final String loadId) {
    return getPartitionDirectory().resolve(SEGMENT_PREFIX + loadId);
  }

  private Path columnFile(final String columnId, final String extension) {
    try {
      FileUtils.checkValidName(columnId);
    } catch (IOException e) {
      throw new IllegalArgumentException("Invalid column id '" + columnId + "'", e);
    }
    return getMetadataDirectory().resolve(columnId + extension);
  }

  @Override
  public String toString() {
    return root.toString();
  }
}
