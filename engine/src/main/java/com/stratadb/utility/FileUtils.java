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
package com.stratadb.utility;

import com.stratadb.log.LogManager;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Level;

public class FileUtils {
  public static final String UTF8_BOM = "\uFEFF";

  /**
   * Rejects names that would escape the directory they are resolved against.
   */
  public static void checkValidName(final String iFileName) throws IOException {
    if (iFileName == null || iFileName.isEmpty() || iFileName.contains("..") || iFileName.contains("/") || iFileName.contains(
        File.separator))
      throw new IOException("Invalid file name '" + iFileName + "'");
  }

  public static void deleteRecursively(final File rootFile) {
    for (int attempt = 0; attempt < 3; attempt++) {
      try {
        if (rootFile.exists()) {
          if (rootFile.isDirectory()) {
            final File[] files = rootFile.listFiles();
            if (files != null) {
              for (final File f : files) {
                if (f.isFile())
                  Files.delete(f.toPath());
                else
                  deleteRecursively(f);
              }
            }
          }

          Files.delete(rootFile.toPath());
        }

        break;

      } catch (final IOException e) {
        LogManager.instance().log(rootFile, Level.WARNING, "Cannot delete directory '%s' (attempt=%d)", e, rootFile, attempt);
      }
    }
  }

  public static boolean deleteFile(final File file) {
    for (int attempt = 0; attempt < 3; attempt++) {
      try {
        Files.deleteIfExists(file.toPath());
        return true;
      } catch (final IOException e) {
        LogManager.instance().log(file, Level.WARNING, "Cannot delete file '%s' (attempt=%d)", e, file, attempt);
      }
    }
    return false;
  }

  public static String readFileAsString(final File file, final Charset charset) throws IOException {
    try (final FileInputStream is = new FileInputStream(file)) {
      return readStreamAsString(is, charset);
    }
  }

  public static String readStreamAsString(final InputStream iStream, final Charset charset) throws IOException {
    final StringBuilder fileData = new StringBuilder(1000);
    try (final BufferedReader reader = new BufferedReader(new InputStreamReader(iStream, charset))) {
      final char[] buf = new char[1024];
      int numRead;

      while ((numRead = reader.read(buf)) != -1) {
        String readData = String.valueOf(buf, 0, numRead);

        if (fileData.length() == 0 && readData.startsWith(UTF8_BOM))
          // SKIP UTF-8 BOM IF ANY
          readData = readData.substring(1);

        fileData.append(readData);
      }
    }
    return fileData.toString();
  }

  public static Path ensureDirectory(final Path directory) throws IOException {
    if (!Files.isDirectory(directory))
      Files.createDirectories(directory);
    return directory;
  }
}
