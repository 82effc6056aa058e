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

import com.stratadb.exception.DictionaryBuildException;
import com.stratadb.exception.ErrorCode;

import java.io.BufferedInputStream;
import java.io.DataInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the committed entries of a dictionary file, ignoring any uncommitted tail.
 */
public class DictionaryReader {
  private final Path    dictionaryFile;
  private final Path    metadataFile;
  private final Charset charset;

  public DictionaryReader(final Path dictionaryFile, final Path metadataFile, final Charset charset) {
    this.dictionaryFile = dictionaryFile;
    this.metadataFile = metadataFile;
    this.charset = charset;
  }

  /**
   * Returns the committed values in surrogate key order.
   *
   * @throws DictionaryBuildException with {@link ErrorCode#CORRUPTION_DETECTED} if the committed region is truncated or malformed
   */
  public List<String> read() throws IOException {
    final DictionaryMetadata metadata = DictionaryMetadata.read(metadataFile, charset);
    final int count = metadata.getEntryCount();
    final long endOffset = metadata.getEndOffset();
    if (count == 0)
      return new ArrayList<>();

    if (!Files.exists(dictionaryFile) || Files.size(dictionaryFile) < endOffset)
      throw corrupted("committed region of " + endOffset + " bytes is missing", null);

    final List<String> values = new ArrayList<>(count);
    long position = 0;
    try (final InputStream fis = Files.newInputStream(dictionaryFile); final DataInputStream in = new DataInputStream(
        new BufferedInputStream(fis, 64 * 1024))) {
      for (int i = 0; i < count; i++) {
        final int length = in.readInt();
        if (length < 0 || position + 4 + length > endOffset)
          throw corrupted("invalid record length " + length + " at offset " + position, null);

        final byte[] bytes = new byte[length];
        in.readFully(bytes);
        values.add(new String(bytes, charset));
        position += 4 + length;
      }
    } catch (EOFException e) {
      throw corrupted("unexpected end of file after " + values.size() + " entries", e);
    }

    if (position != endOffset)
      throw corrupted(count + " entries end at offset " + position + " instead of " + endOffset, null);

    return values;
  }

  private DictionaryBuildException corrupted(final String reason, final Throwable cause) {
    final DictionaryBuildException exception = new DictionaryBuildException(ErrorCode.CORRUPTION_DETECTED,
        "Dictionary file " + dictionaryFile + " is corrupted: " + reason, cause);
    exception.addContext("file", dictionaryFile);
    return exception;
  }
}
