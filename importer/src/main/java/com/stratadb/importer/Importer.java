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

import com.stratadb.ContextConfiguration;
import com.stratadb.GlobalConfiguration;
import com.stratadb.StoreConfiguration;
import com.stratadb.engine.StoreContext;
import com.stratadb.engine.TablePath;
import com.stratadb.exception.ConfigurationException;
import com.stratadb.exception.ErrorCode;
import com.stratadb.exception.StrataException;
import com.stratadb.log.LogManager;
import com.stratadb.schema.TableSchema;
import com.stratadb.utility.FileUtils;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.util.logging.Level;

/**
 * Command line entry point. Loads one delimited text file into a table as a new segment.
 * <pre>
 * Importer -table ./tables/sales -schema ./sales.json -file ./sales.csv [-delimiter ,] [-header true] [-skipEntries 0] [-commitPermits 2]
 * </pre>
 * Exits with 0 if the segment was committed, 1 otherwise.
 */
public class Importer {
  protected ImporterSettings settings = new ImporterSettings();

  public Importer(final String[] args) {
    settings.parseParameters(args);
  }

  public Importer(final ImporterSettings settings) {
    this.settings = settings;
  }

  public static void main(final String[] args) {
    final LoadResult result = new Importer(args).load();
    System.exit(result.isSuccess() ? 0 : 1);
  }

  public LoadResult load() {
    final StoreConfiguration configuration;
    final TableSchema schema;
    try {
      configuration = createConfiguration();
      schema = loadSchema(configuration);
    } catch (StrataException e) {
      LogManager.instance().log(this, Level.SEVERE, "Invalid importer settings", e);
      return LoadResult.failure(null, e.getErrorCode(), e);
    } catch (IOException e) {
      LogManager.instance().log(this, Level.SEVERE, "Error on reading schema file '%s'", e, settings.schema);
      return LoadResult.failure(null, ErrorCode.IO_ERROR, e);
    }

    final SegmentLoader loader = new SegmentLoader(new TablePath(Path.of(settings.table)), new StoreContext(configuration));

    try (final CSVRowSource rows = CSVRowSource.open(Path.of(settings.file), configuration.getCharset(), settings.delimiter,
        settings.header, settings.skipEntries)) {
      final LoadResult result = loader.load(schema, rows);
      if (result.isSuccess())
        LogManager.instance().log(this, Level.INFO, "Imported %d rows from '%s' into segment %s", null, result.getRowCount(), settings.file,
            result.getSegment().getLoadId());
      return result;
    } catch (IOException e) {
      LogManager.instance().log(this, Level.SEVERE, "Error on reading source file '%s'", e, settings.file);
      return LoadResult.failure(null, ErrorCode.IMPORT_ERROR, e);
    } catch (RuntimeException e) {
      LogManager.instance().log(this, Level.SEVERE, "Error on parsing source file '%s'", e, settings.file);
      return LoadResult.failure(null, ErrorCode.IMPORT_ERROR, e);
    }
  }

  protected StoreConfiguration createConfiguration() {
    if (settings.table == null)
      throw new ConfigurationException("Missing -table parameter");
    if (settings.schema == null)
      throw new ConfigurationException("Missing -schema parameter");
    if (settings.file == null)
      throw new ConfigurationException("Missing -file parameter");

    final ContextConfiguration context = new ContextConfiguration();
    if (settings.commitPermits != null)
      context.setValue(GlobalConfiguration.COMMIT_PERMITS, settings.commitPermits);
    return StoreConfiguration.from(context);
  }

  protected TableSchema loadSchema(final StoreConfiguration configuration) throws IOException {
    return TableSchema.fromJSON(FileUtils.readFileAsString(new File(settings.schema), configuration.getCharset()));
  }
}
