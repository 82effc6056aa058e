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
package com.stratadb.engine.dictionary;

import com.stratadb.engine.AtomicFileOperation;
import com.stratadb.exception.DictionaryBuildException;
import com.stratadb.exception.ErrorCode;
import com.stratadb.serializer.json.JSONException;
import com.stratadb.serializer.json.JSONObject;
import com.stratadb.utility.FileUtils;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Commit point of a dictionary file: the number of committed entries and the byte offset where they end. Bytes past the offset
 * belong to an append that never committed.
 * <p>
 * Stored as JSON in {@code <columnId>.dictmeta}: {@code {"version":1,"entryCount":3,"endOffset":42}}.
 */
final class DictionaryMetadata {
  static final DictionaryMetadata EMPTY   = new DictionaryMetadata(0, 0L);
  static final int                VERSION = 1;

  private final int  entryCount;
  private final long endOffset;

  DictionaryMetadata(final int entryCount, final long endOffset) {
    this.entryCount = entryCount;
    this.endOffset = endOffset;
  }

  static DictionaryMetadata read(final Path file, final Charset charset) throws IOException {
    if (!Files.exists(file))
      return EMPTY;

    final String content = FileUtils.readFileAsString(file.toFile(), charset);
    try {
      final JSONObject json = new JSONObject(content);
      final int version = json.getInt("version");
      if (version != VERSION)
        throw new DictionaryBuildException(ErrorCode.CORRUPTION_DETECTED, "Unsupported dictionary metadata version " + version + " in " + file);

      final int count = json.getInt("entryCount");
      final long offset = json.getLong("endOffset");
      if (count < 0 || offset < 0)
        throw new DictionaryBuildException(ErrorCode.CORRUPTION_DETECTED, "Invalid dictionary metadata in " + file + ": " + content);
      return new DictionaryMetadata(count, offset);
    } catch (JSONException | IllegalStateException | UnsupportedOperationException | NumberFormatException e) {
      throw new DictionaryBuildException(ErrorCode.CORRUPTION_DETECTED, "Malformed dictionary metadata in " + file, e);
    }
  }

  void write(final Path file, final Charset charset) throws IOException {
    final JSONObject json = new JSONObject();
    json.put("version", VERSION);
    json.put("entryCount", entryCount);
    json.put("endOffset", endOffset);
    AtomicFileOperation.write(file, json.toString().getBytes(charset));
  }

  int getEntryCount() {
    return entryCount;
  }

  long getEndOffset() {
    return endOffset;
  }

  @Override
  public String toString() {
    return "entryCount=" + entryCount + ", endOffset=" + endOffset;
  }
}
