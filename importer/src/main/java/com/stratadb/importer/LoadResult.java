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

import com.stratadb.engine.dictionary.DictionaryAppendResult;
import com.stratadb.engine.status.SegmentRecord;
import com.stratadb.exception.ErrorCode;

import java.util.Collections;
import java.util.Map;

/**
 * Outcome of a load: either the committed segment with the dictionaries it extended, or the error that stopped it. A failed load
 * never publishes a visible segment.
 */
public final class LoadResult {
  private final boolean                             success;
  private final SegmentRecord                       segment;
  private final long                                rows;
  private final Map<String, DictionaryAppendResult> dictionaries;
  private final ErrorCode                           errorCode;
  private final Throwable                           cause;

  private LoadResult(final boolean success, final SegmentRecord segment, final long rows,
      final Map<String, DictionaryAppendResult> dictionaries, final ErrorCode errorCode, final Throwable cause) {
    this.success = success;
    this.segment = segment;
    this.rows = rows;
    this.dictionaries = dictionaries != null ? Collections.unmodifiableMap(dictionaries) : Collections.emptyMap();
    this.errorCode = errorCode;
    this.cause = cause;
  }

  public static LoadResult success(final SegmentRecord segment, final long rows, final Map<String, DictionaryAppendResult> dictionaries) {
    return new LoadResult(true, segment, rows, dictionaries, null, null);
  }

  /**
   * @param segment the segment record if the load got as far as creating it, otherwise null
   */
  public static LoadResult failure(final SegmentRecord segment, final ErrorCode errorCode, final Throwable cause) {
    return new LoadResult(false, segment, 0, null, errorCode, cause);
  }

  public boolean isSuccess() {
    return success;
  }

  public SegmentRecord getSegment() {
    return segment;
  }

  public long getRowCount() {
    return rows;
  }

  /**
   * Dictionary append results by column name, in schema order. Empty for a failed load.
   */
  public Map<String, DictionaryAppendResult> getDictionaries() {
    return dictionaries;
  }

  public ErrorCode getErrorCode() {
    return errorCode;
  }

  public Throwable getCause() {
    return cause;
  }

  public String getErrorMessage() {
    return cause != null ? cause.getMessage() : null;
  }

  @Override
  public String toString() {
    if (success)
      return "LoadResult{success, segment=" + segment + ", rows=" + rows + "}";
    return "LoadResult{failure, errorCode=" + errorCode + ", segment=" + segment + ", cause=" + cause + "}";
  }
}
