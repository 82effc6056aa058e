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

import com.stratadb.log.LogManager;
import com.stratadb.utility.FileUtils;

import java.io.BufferedOutputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.logging.Level;

/**
 * Replaces a file as a whole: the new content goes to a temporary sibling ({@code <name>.<random>.tmp}) that is renamed over the
 * target on {@link #commit()}. Closing the operation without committing discards the temporary file, so readers of the target see
 * either the previous content or the complete new one.
 * <p>
 * Every operation writes its own temporary file, so concurrent operations on the same target never write into each other's file:
 * the last rename wins. Temporary files older than {@link #STALE_TEMP_AGE_MS} are left by writers that died before committing and
 * are removed when the next operation opens.
 * <p>
 * Usage:
 * <pre>
 * try (AtomicFileOperation op = new AtomicFileOperation(target)) {
 *   op.openForWrite().write(content);
 *   op.commit();
 * }
 * </pre>
 */
public class AtomicFileOperation implements AutoCloseable {
  public static final String TEMP_SUFFIX       = ".tmp";
  public static final long   STALE_TEMP_AGE_MS = 10 * 60 * 1000L;

  private final Path                 target;
  private       Path                 temp;
  private       FileOutputStream     fileStream;
  private       BufferedOutputStream stream;
  private       boolean              committed;

  public AtomicFileOperation(final Path target) {
    this.target = target.toAbsolutePath();
  }

  /**
   * Writes the whole content of the target in one operation.
   */
  public static void write(final Path target, final byte[] content) throws IOException {
    try (final AtomicFileOperation operation = new AtomicFileOperation(target)) {
      operation.openForWrite().write(content);
      operation.commit();
    }
  }

  /**
   * Creates a new temporary file and opens it for writing. Stale temporary files of the same target are removed first.
   */
  public OutputStream openForWrite() throws IOException {
    if (stream != null)
      throw new IllegalStateException("File '" + target + "' is already open for write");
    if (committed)
      throw new IllegalStateException("File '" + target + "' has already been committed");

    FileUtils.ensureDirectory(target.getParent());
    removeStaleTemporaryFiles(target, System.currentTimeMillis() - STALE_TEMP_AGE_MS);

    temp = Files.createTempFile(target.getParent(), target.getFileName() + ".", TEMP_SUFFIX);
    fileStream = new FileOutputStream(temp.toFile());
    stream = new BufferedOutputStream(fileStream, 64 * 1024);
    return stream;
  }

  /**
   * Deletes the temporary files of the target last modified before the given time.
   *
   * @return the number of files removed
   */
  public static int removeStaleTemporaryFiles(final Path target, final long olderThan) throws IOException {
    final Path directory = target.toAbsolutePath().getParent();
    if (!Files.isDirectory(directory))
      return 0;

    final String prefix = target.getFileName() + ".";
    int removed = 0;
    try (final DirectoryStream<Path> files = Files.newDirectoryStream(directory)) {
      for (Path file : files) {
        final String name = file.getFileName().toString();
        if (!name.startsWith(prefix) || !name.endsWith(TEMP_SUFFIX))
          continue;

        final long lastModified;
        try {
          lastModified = Files.getLastModifiedTime(file).toMillis();
        } catch (NoSuchFileException e) {
          // COMMITTED OR DISCARDED BY ITS WRITER MEANWHILE
          continue;
        }

        if (lastModified < olderThan && Files.deleteIfExists(file)) {
          LogManager.instance().log(AtomicFileOperation.class, Level.WARNING, "Removed stale temporary file '%s'", null, file);
          ++removed;
        }
      }
    }
    return removed;
  }

  /**
   * Flushes and syncs the temporary file, then renames it over the target.
   */
  public void commit() throws IOException {
    if (stream == null)
      throw new IllegalStateException("File '" + target + "' is not open for write");

    try {
      stream.flush();
      fileStream.getFD().sync();
    } finally {
      stream.close();
      stream = null;
      fileStream = null;
    }

    try {
      Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException e) {
      LogManager.instance().log(this, Level.WARNING, "Atomic move not supported for '%s', falling back to replace", null, target);
      Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
    }
    committed = true;
  }

  public boolean isCommitted() {
    return committed;
  }

  public Path getTarget() {
    return target;
  }

  /**
   * Returns the temporary file of this operation, null before {@link #openForWrite()}.
   */
  public Path getTemporaryFile() {
    return temp;
  }

  /**
   * Releases the temporary file. Without a previous {@link #commit()} the written content is discarded and the target is left
   * untouched.
   */
  @Override
  public void close() {
    if (committed)
      return;

    if (stream != null) {
      try {
        stream.close();
      } catch (IOException e) {
        LogManager.instance().log(this, Level.WARNING, "Error closing temporary file '%s'", e, temp);
      }
      stream = null;
      fileStream = null;
    }

    if (temp != null)
      FileUtils.deleteFile(temp.toFile());
  }
}
