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

/**
 * Categories for organizing error codes in the StrataDB exception hierarchy.
 * <p>
 * Each {@link ErrorCode} belongs to exactly one category, derived from the range of its numeric code:
 * <ul>
 *   <li>{@link #CONFIGURATION} - Invalid or unparsable settings (1xxx)</li>
 *   <li>{@link #COMMIT} - Commit admission and table status publication (2xxx)</li>
 *   <li>{@link #STORAGE} - I/O operations, persistence, serialization and corruption (5xxx)</li>
 *   <li>{@link #SCHEMA} - Table and column definitions (7xxx)</li>
 *   <li>{@link #LOAD} - Dictionary construction and data loading (10xxx)</li>
 *   <li>{@link #INTERNAL} - Internal system errors and unexpected conditions (99xxx)</li>
 * </ul>
 *
 * @see ErrorCode
 * @see StrataException
 */
public enum ErrorCategory {
  CONFIGURATION("Configuration"),
  COMMIT("Commit"),
  STORAGE("Storage"),
  SCHEMA("Schema"),
  LOAD("Load"),
  INTERNAL("Internal"),
  UNKNOWN("Unknown");

  private final String displayName;

  ErrorCategory(final String displayName) {
    this.displayName = displayName;
  }

  /**
   * Returns the human-readable display name for this category, used in error messages, logs and JSON representations.
   */
  public String getDisplayName() {
    return displayName;
  }

  @Override
  public String toString() {
    return displayName;
  }
}
