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
package com.stratadb.exception;

import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Standardized error codes for StrataDB exceptions.
 * Error codes are organized in categories based on the first digit(s):
 * <ul>
 *   <li>1xxx - Configuration errors</li>
 *   <li>2xxx - Commit errors (admission, interruption)</li>
 *   <li>5xxx - Storage errors (I/O, serialization, corruption)</li>
 *   <li>7xxx - Schema errors</li>
 *   <li>10xxx - Load errors (dictionaries, segments)</li>
 *   <li>99xxx - Internal errors</li>
 * </ul>
 *
 * @see StrataException
 */
public enum ErrorCode {

  // ========== Configuration Errors (1xxx) ==========
  /** Invalid or unparsable configuration value */
  CONFIGURATION_ERROR(1001, "Configuration error"),

  // ========== Commit Errors (2xxx) ==========
  /** Interrupted while waiting for a commit permit */
  COMMIT_INTERRUPTED(2001, "Commit interrupted"),

  /** The new table status would hide a previously committed segment */
  COMMIT_REJECTED(2002, "Commit rejected"),

  // ========== Storage Errors (5xxx) ==========
  /** File system I/O operation failed */
  IO_ERROR(5001, "I/O error"),

  /** Data corruption detected in storage files */
  CORRUPTION_DETECTED(5002, "Data corruption detected"),

  /** Serialization/deserialization failed */
  SERIALIZATION_ERROR(5004, "Serialization error"),

  // ========== Schema Errors (7xxx) ==========
  /** Invalid table or column definition */
  SCHEMA_ERROR(7001, "Schema error"),

  /** Referenced column does not exist */
  COLUMN_NOT_FOUND(7002, "Column not found"),

  // ========== Load Errors (10xxx) ==========
  /** Data loading failed, the segment is not published */
  DATA_LOADING_ERROR(10001, "Data loading failed"),

  /** Appending dictionary entries or persisting the sort index failed */
  DICTIONARY_BUILD_ERROR(10002, "Dictionary build failed"),

  /** Reading the input source failed */
  IMPORT_ERROR(10003, "Import error"),

  // ========== General Errors (99xxx) ==========
  /** Unexpected internal error (should not normally occur) */
  INTERNAL_ERROR(99999, "Internal error");

  private static final Map<Integer, ErrorCode> CODE_MAP = Stream.of(values())
      .collect(Collectors.toUnmodifiableMap(ErrorCode::getCode, e -> e));

  private final int    code;
  private final String defaultMessage;

  ErrorCode(final int code, final String defaultMessage) {
    this.code = code;
    this.defaultMessage = defaultMessage;
  }

  public int getCode() {
    return code;
  }

  public String getDefaultMessage() {
    return defaultMessage;
  }

  /**
   * Returns the error category based on the error code range.
   */
  public ErrorCategory getCategory() {
    final int category = code / 1000;
    return switch (category) {
      case 1 -> ErrorCategory.CONFIGURATION;
      case 2 -> ErrorCategory.COMMIT;
      case 5 -> ErrorCategory.STORAGE;
      case 7 -> ErrorCategory.SCHEMA;
      case 10 -> ErrorCategory.LOAD;
      case 99 -> ErrorCategory.INTERNAL;
      default -> ErrorCategory.UNKNOWN;
    };
  }

  /**
   * Finds an ErrorCode by its numeric code.
   *
   * @return the matching ErrorCode, or INTERNAL_ERROR if not found
   */
  public static ErrorCode fromCode(final int code) {
    return CODE_MAP.getOrDefault(code, INTERNAL_ERROR);
  }

  @Override
  public String toString() {
    return String.format("%s(%d): %s", name(), code, defaultMessage);
  }
}
