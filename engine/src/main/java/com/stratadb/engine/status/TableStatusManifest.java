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
package com.stratadb.engine.status;

import com.stratadb.exception.DataLoadingException;
import com.stratadb.exception.ErrorCode;
import com.stratadb.serializer.json.JSONArray;
import com.stratadb.serializer.json.JSONException;
import com.stratadb.utility.FileUtils;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The table status: the ordered history of all the segment records of a table, stored as a JSON array of
 * {@code {loadId, startTime, endTime, status}} objects. The file is always written whole.
 */
public final class TableStatusManifest {
  private final List<SegmentRecord> records;

  public TableStatusManifest(final List<SegmentRecord> records) {
    final List<SegmentRecord> copy = new ArrayList<>(records.size());
    for (SegmentRecord r : records)
      copy.add(r.copy());
    this.records = Collections.unmodifiableList(copy);
  }

  /**
   * Reads the table status. A missing file is an empty history.
   *
   * @throws DataLoadingException with {@link ErrorCode#SERIALIZATION_ERROR} if the content is malformed
   */
  public static TableStatusManifest read(final Path file, final Charset charset) throws IOException {
    if (!Files.exists(file))
      return new TableStatusManifest(Collections.emptyList());
    return parse(FileUtils.readFileAsString(file.toFile(), charset));
  }

  public static TableStatusManifest parse(final String content) {
    if (content == null || content.isBlank())
      return new TableStatusManifest(Collections.emptyList());

    try {
      final JSONArray array = new JSONArray(content);
      final List<SegmentRecord> records = new ArrayList<>(array.length());
      for (int i = 0; i < array.length(); i++)
        records.add(SegmentRecord.fromJSON(array.getJSONObject(i)));
      return new TableStatusManifest(records);
    } catch (JSONException | IllegalArgumentException | IllegalStateException | UnsupportedOperationException e) {
      throw new DataLoadingException(ErrorCode.SERIALIZATION_ERROR, "Malformed table status content", e);
    }
  }

  public byte[] serialize(final Charset charset) {
    final JSONArray array = new JSONArray();
    for (SegmentRecord r : records)
      array.put(r.toJSON());
    return array.toString().getBytes(charset);
  }

  /**
   * Records in the order they were added. The instances are copies: changing them does not change this manifest.
   */
  public List<SegmentRecord> getRecords() {
    final List<SegmentRecord> copy = new ArrayList<>(records.size());
    for (SegmentRecord r : records)
      copy.add(r.copy());
    return copy;
  }

  public SegmentRecord getRecord(final String loadId) {
    for (SegmentRecord r : records)
      if (r.getLoadId().equals(loadId))
        return r.copy();
    return null;
  }

  public int size() {
    return records.size();
  }

  /**
   * Next load id: one more than the highest numeric load id, 0 for an empty history. Non numeric ids are skipped.
   */
  public String getNextLoadId() {
    long max = -1;
    for (SegmentRecord r : records)
      if (isNumeric(r.getLoadId()))
        max = Math.max(max, Long.parseLong(r.getLoadId()));
    return String.valueOf(max + 1);
  }

  private static boolean isNumeric(final String loadId) {
    if (loadId.length() > 18)
      return false;
    for (int i = 0; i < loadId.length(); i++)
      if (!Character.isDigit(loadId.charAt(i)))
        return false;
    return true;
  }
}
