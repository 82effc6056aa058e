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

import java.io.IOException;
import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.zip.CRC32;

/**
 * Persists a {@link SortIndex} as a single file, so the sort order and its inverse are replaced together.
 * <p>
 * Format:
 * - 4 bytes: magic
 * - 4 bytes: version
 * - 4 bytes: cardinality n
 * - n * 4 bytes: sort order
 * - n * 4 bytes: inverse sort order
 * - 8 bytes: CRC32 of all the previous bytes
 */
public final class SortIndexFile {
  static final int MAGIC_VALUE     = 0x53534958; // "SSIX"
  static final int CURRENT_VERSION = 1;
  static final int HEADER_SIZE     = 12;

  private SortIndexFile() {
  }

  public static void write(final Path file, final SortIndex index) throws IOException {
    AtomicFileOperation.write(file, serialize(index));
  }

  public static SortIndex read(final Path file) throws IOException {
    return deserialize(file, Files.readAllBytes(file));
  }

  static byte[] serialize(final SortIndex index) {
    final int n = index.size();
    final ByteBuffer buffer = ByteBuffer.allocate(HEADER_SIZE + n * 8 + 8);
    buffer.putInt(MAGIC_VALUE);
    buffer.putInt(CURRENT_VERSION);
    buffer.putInt(n);
    for (int v : index.getSortOrder())
      buffer.putInt(v);
    for (int v : index.getInverseSortOrder())
      buffer.putInt(v);

    final CRC32 crc = new CRC32();
    crc.update(buffer.array(), 0, buffer.position());
    buffer.putLong(crc.getValue());
    return buffer.array();
  }

  static SortIndex deserialize(final Path file, final byte[] data) {
    try {
      final ByteBuffer buffer = ByteBuffer.wrap(data);
      final int magic = buffer.getInt();
      if (magic != MAGIC_VALUE)
        throw corrupted(file, "invalid magic number " + Integer.toHexString(magic));

      final int version = buffer.getInt();
      if (version != CURRENT_VERSION)
        throw corrupted(file, "unsupported version " + version);

      final int n = buffer.getInt();
      if (n < 0 || (long) HEADER_SIZE + (long) n * 8 + 8 != data.length)
        throw corrupted(file, "cardinality " + n + " does not match the file size " + data.length);

      final CRC32 crc = new CRC32();
      crc.update(data, 0, data.length - 8);
      final long expected = ByteBuffer.wrap(data, data.length - 8, 8).getLong();
      if (crc.getValue() != expected)
        throw corrupted(file, "checksum mismatch");

      final int[] sortOrder = new int[n];
      final int[] inverse = new int[n];
      for (int i = 0; i < n; i++)
        sortOrder[i] = buffer.getInt();
      for (int i = 0; i < n; i++)
        inverse[i] = buffer.getInt();

      final SortIndex index = new SortIndex(sortOrder, inverse);
      index.validate();
      return index;
    } catch (BufferUnderflowException e) {
      final DictionaryBuildException exception = corrupted(file, "truncated content of " + data.length + " bytes");
      exception.initCause(e);
      throw exception;
    }
  }

  private static DictionaryBuildException corrupted(final Path file, final String reason) {
    return new DictionaryBuildException(ErrorCode.CORRUPTION_DETECTED, "Sort index file " + file + " is corrupted: " + reason);
  }
}
