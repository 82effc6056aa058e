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
import com.stratadb.log.LogManager;
import com.stratadb.utility.FileUtils;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.Charset;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.logging.Level;

/**
 * Appends values to a dictionary file. Each value is stored as a record of 4 bytes of length followed by the encoded bytes.
 * <p>
 * Appended values become visible to readers only after {@link #close()} and {@link #commit()}: the commit atomically moves the
 * committed offset stored in the metadata file. A tail left by a writer that never committed is truncated when the next writer
 * opens the file, so existing committed records are never rewritten.
 */
public class DictionaryWriter implements AutoCloseable {
  private final Path        dictionaryFile;
  private final Path        metadataFile;
  private final Charset     charset;
  private final int         committedCount;
  private       FileChannel channel;
  private       int         entryCount;
  private       long        offset;
  private       boolean     committed;

  public DictionaryWriter(final Path dictionaryFile, final Path metadataFile, final Charset charset) throws IOException {
    this.dictionaryFile = dictionaryFile;
    this.metadataFile = metadataFile;
    this.charset = charset;

    final DictionaryMetadata metadata = DictionaryMetadata.read(metadataFile, charset);
    this.committedCount = metadata.getEntryCount();
    this.entryCount = metadata.getEntryCount();
    this.offset = metadata.getEndOffset();

    FileUtils.ensureDirectory(dictionaryFile.getParent());
    this.channel = FileChannel.open(dictionaryFile, StandardOpenOption.CREATE, StandardOpenOption.WRITE);

    try {
      final long size = channel.size();
      if (size < offset)
        throw new DictionaryBuildException(ErrorCode.CORRUPTION_DETECTED,
            "Dictionary file " + dictionaryFile + " is shorter (" + size + ") than its committed offset " + offset);

      if (size > offset) {
        LogManager.instance()
            .log(this, Level.WARNING, "Truncating %d uncommitted bytes from dictionary file '%s'", null, size - offset, dictionaryFile);
        channel.truncate(offset);
      }
      channel.position(offset);
    } catch (IOException | RuntimeException e) {
      channel.close();
      throw e;
    }
  }

  public void write(final String value) throws IOException {
    if (channel == null)
      throw new IllegalStateException("Dictionary writer of " + dictionaryFile + " is closed");
    if (value == null)
      throw new IllegalArgumentException("Dictionary value is null");

    final byte[] bytes = value.getBytes(charset);
    final ByteBuffer buffer = ByteBuffer.allocate(4 + bytes.length);
    buffer.putInt(bytes.length);
    buffer.put(bytes);
    buffer.flip();
    while (buffer.hasRemaining())
      channel.write(buffer);

    offset += 4 + bytes.length;
    ++entryCount;
  }

  /**
   * Forces the appended records to disk and closes the file. Can be called more than once.
   */
  @Override
  public void close() throws IOException {
    if (channel == null)
      return;

    try {
      channel.force(true);
    } finally {
      channel.close();
      channel = null;
    }
  }

  /**
   * Publishes the appended records by atomically replacing the metadata file. Closes the writer first if still open.
   */
  public void commit() throws IOException {
    if (committed)
      return;

    close();
    if (entryCount > committedCount)
      new DictionaryMetadata(entryCount, offset).write(metadataFile, charset);
    committed = true;
  }

  /**
   * Number of entries including the ones appended by this writer.
   */
  public int getEntryCount() {
    return entryCount;
  }

  public int getAppendedCount() {
    return entryCount - committedCount;
  }
}
