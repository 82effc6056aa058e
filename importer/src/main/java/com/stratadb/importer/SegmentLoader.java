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

import com.stratadb.StoreConfiguration;
import com.stratadb.engine.AtomicFileOperation;
import com.stratadb.engine.StoreContext;
import com.stratadb.engine.TablePath;
import com.stratadb.engine.dictionary.DictionaryAppendResult;
import com.stratadb.engine.dictionary.DictionaryBuilder;
import com.stratadb.engine.dictionary.DictionaryStore;
import com.stratadb.engine.status.SegmentCommitCoordinator;
import com.stratadb.engine.status.SegmentRecord;
import com.stratadb.engine.status.SegmentStatus;
import com.stratadb.exception.ErrorCode;
import com.stratadb.exception.SchemaException;
import com.stratadb.exception.StrataException;
import com.stratadb.log.LogManager;
import com.stratadb.schema.ColumnDefinition;
import com.stratadb.schema.TableSchema;
import com.stratadb.utility.FileUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;

/**
 * Loads one segment of a table: registers the segment as in progress, extends the column dictionaries with the values of the rows,
 * creates the segment directory and publishes the segment as successful. Any failure is returned as a failed {@link LoadResult}
 * and the segment is marked as failed, so it never becomes visible.
 */
public class SegmentLoader {
  private final TablePath                tablePath;
  private final StoreConfiguration       configuration;
  private final DictionaryStore          dictionaryStore;
  private final SegmentCommitCoordinator coordinator;

  public SegmentLoader(final TablePath tablePath, final StoreContext context) {
    this(tablePath, context, new SegmentCommitCoordinator(context));
  }

  public SegmentLoader(final TablePath tablePath, final StoreContext context, final SegmentCommitCoordinator coordinator) {
    this.tablePath = tablePath;
    this.configuration = context.getConfiguration();
    this.dictionaryStore = new DictionaryStore(tablePath, configuration);
    this.coordinator = coordinator;
  }

  public LoadResult load(final TableSchema schema, final Iterator<String[]> rows) {
    LogManager.instance().setContext(schema.getTableName());
    SegmentRecord segment = null;
    try {
      writeSchemaIfAbsent(schema);

      final Path manifest = tablePath.getTableStatusFile();
      segment = coordinator.beginSegment(manifest);

      LogManager.instance().log(this, Level.INFO, "Loading segment %s into table '%s'", null, segment.getLoadId(), tablePath);
      final long beginTime = System.currentTimeMillis();

      final DictionaryBuilder builder = new DictionaryBuilder(schema, configuration);
      final Map<ColumnDefinition, List<String>> candidates = builder.build(rows);

      final Map<String, DictionaryAppendResult> dictionaries = new LinkedHashMap<>();
      for (Map.Entry<ColumnDefinition, List<String>> entry : candidates.entrySet())
        dictionaries.put(entry.getKey().getName(), dictionaryStore.appendDistinctValues(entry.getKey(), entry.getValue()));

      FileUtils.ensureDirectory(tablePath.getSegmentDirectory(segment.getLoadId()));

      final SegmentRecord committed = coordinator.completeSegment(manifest, segment.getLoadId(), SegmentStatus.SUCCESS);

      LogManager.instance()
          .log(this, Level.INFO, "Segment %s loaded: %d rows, %d dictionary columns (elapsed=%dms)", null, committed.getLoadId(),
              builder.getRowCount(), dictionaries.size(), System.currentTimeMillis() - beginTime);

      return LoadResult.success(committed, builder.getRowCount(), dictionaries);

    } catch (StrataException e) {
      return fail(segment, e.getErrorCode(), e);
    } catch (IOException e) {
      return fail(segment, ErrorCode.IO_ERROR, e);
    } catch (RuntimeException e) {
      // ROW SOURCE FAILURES (PARSING, I/O)
      return fail(segment, ErrorCode.IMPORT_ERROR, e);
    } finally {
      LogManager.instance().setContext(null);
    }
  }

  public DictionaryStore getDictionaryStore() {
    return dictionaryStore;
  }

  public SegmentCommitCoordinator getCoordinator() {
    return coordinator;
  }

  private LoadResult fail(final SegmentRecord segment, final ErrorCode errorCode, final Exception cause) {
    LogManager.instance()
        .log(this, Level.SEVERE, "Error on loading segment %s into table '%s'", cause, segment != null ? segment.getLoadId() : "-",
            tablePath);

    SegmentRecord failed = segment;
    if (segment != null) {
      try {
        failed = coordinator.completeSegment(tablePath.getTableStatusFile(), segment.getLoadId(), SegmentStatus.FAILURE);
      } catch (StrataException e) {
        LogManager.instance().log(this, Level.WARNING, "Cannot mark segment %s as failed", e, segment.getLoadId());
        cause.addSuppressed(e);
      }
    }
    return LoadResult.failure(failed, errorCode, cause);
  }

  /**
   * Stores the schema on the first load. Later loads must use the same schema.
   */
  private void writeSchemaIfAbsent(final TableSchema schema) throws IOException {
    final Path file = tablePath.getSchemaFile();
    if (Files.exists(file)) {
      final TableSchema stored = TableSchema.fromJSON(FileUtils.readFileAsString(file.toFile(), configuration.getCharset()));
      if (!stored.getColumns().equals(schema.getColumns()))
        throw new SchemaException("Table '" + schema.getTableName() + "' was created with a different schema: " + stored);
      return;
    }

    AtomicFileOperation.write(file, schema.toJSON().toString(2).getBytes(configuration.getCharset()));
  }
}
