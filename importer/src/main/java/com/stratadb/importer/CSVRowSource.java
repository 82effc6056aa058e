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

import com.stratadb.GlobalConfiguration;
import com.stratadb.log.LogManager;
import com.univocity.parsers.common.AbstractParser;
import com.univocity.parsers.csv.CsvParser;
import com.univocity.parsers.csv.CsvParserSettings;
import com.univocity.parsers.tsv.TsvParser;
import com.univocity.parsers.tsv.TsvParserSettings;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.logging.Level;

/**
 * Delimited text rows as positional fields. Tab delimited sources are parsed as TSV, anything else as CSV. Empty fields are
 * returned as null.
 */
public class CSVRowSource implements Iterator<String[]>, AutoCloseable {
  private final AbstractParser<?> parser;
  private final Reader            reader;
  private       String[]          next;
  private       long              rows;
  private       boolean           closed;

  public CSVRowSource(final Reader reader, final String delimiter, final long skipEntries) {
    this.reader = reader;
    this.parser = createCSVParser(delimiter);
    try {
      this.parser.beginParsing(reader);

      for (long i = 0; i < skipEntries; i++)
        if (parser.parseNext() == null)
          break;

      this.next = parser.parseNext();
    } catch (RuntimeException e) {
      try {
        reader.close();
      } catch (IOException closeException) {
        e.addSuppressed(closeException);
      }
      throw e;
    }
  }

  /**
   * Opens a file.
   *
   * @param delimiter   field delimiter, null for {@link GlobalConfiguration#CSV_DELIMITER}
   * @param header      true if the first line is a header to skip, null for {@link GlobalConfiguration#CSV_HEADER}
   * @param skipEntries lines to skip at the beginning, overrides the header setting when not null
   */
  public static CSVRowSource open(final Path file, final Charset charset, final String delimiter, final Boolean header,
      final Long skipEntries) throws IOException {
    final String sep = delimiter != null ? delimiter : GlobalConfiguration.CSV_DELIMITER.getValueAsString();

    long skip;
    if (skipEntries != null)
      skip = skipEntries;
    else
      skip = (header != null ? header : GlobalConfiguration.CSV_HEADER.getValueAsBoolean()) ? 1L : 0L;

    LogManager.instance().log(CSVRowSource.class, Level.FINE, "Reading rows from '%s' (delimiter='%s', skip=%d)", null, file, sep, skip);
    return new CSVRowSource(Files.newBufferedReader(file, charset), sep, skip);
  }

  @Override
  public boolean hasNext() {
    return next != null;
  }

  @Override
  public String[] next() {
    if (next == null)
      throw new NoSuchElementException();

    final String[] current = next;
    ++rows;
    next = parser.parseNext();
    return current;
  }

  /**
   * Rows returned so far.
   */
  public long getRowCount() {
    return rows;
  }

  @Override
  public void close() throws IOException {
    if (closed)
      return;
    closed = true;
    try {
      parser.stopParsing();
    } finally {
      reader.close();
    }
  }

  static AbstractParser<?> createCSVParser(final String delimiter) {
    if ("\t".equals(delimiter) || "\\t".equals(delimiter)) {
      final TsvParserSettings tsvParserSettings = new TsvParserSettings();
      tsvParserSettings.setLineSeparatorDetectionEnabled(true);
      return new TsvParser(tsvParserSettings);
    }

    final CsvParserSettings csvParserSettings = new CsvParserSettings();
    csvParserSettings.setLineSeparatorDetectionEnabled(true);
    if (delimiter != null && !delimiter.isEmpty())
      csvParserSettings.getFormat().setDelimiter(delimiter.charAt(0));
    return new CsvParser(csvParserSettings);
  }
}
